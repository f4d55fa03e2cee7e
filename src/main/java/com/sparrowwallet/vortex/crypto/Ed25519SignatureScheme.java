package com.sparrowwallet.vortex.crypto;

import java.security.*;
import java.security.interfaces.EdECPrivateKey;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.NamedParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;

class Ed25519SignatureScheme implements SignatureScheme {

  private static final String ALGORITHM = "Ed25519";
  private static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");
  private static final int KEY_LENGTH = 32;

  private final KeyFactory keyFactory;

  public Ed25519SignatureScheme() throws NoSuchAlgorithmException {
    this.keyFactory = KeyFactory.getInstance(ALGORITHM);

    Signature.getInstance(ALGORITHM);
    KeyPairGenerator.getInstance(ALGORITHM);
  }

  @Override
  public String getName() {
    return ALGORITHM;
  }

  @Override
  public KeyPair generateKeyPair() {
    try {
      return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public byte[] sign(final PrivateKey privateKey, final byte[] message) {
    try {
      final Signature signature = Signature.getInstance(ALGORITHM);
      signature.initSign(privateKey);
      signature.update(message);
      return signature.sign();
    } catch (final InvalidKeyException e) {
      throw new IllegalArgumentException("Invalid signing key", e);
    } catch (final NoSuchAlgorithmException | SignatureException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public boolean verify(final byte[] publicKeyBytes, final byte[] message, final byte[] signature) {
    if (publicKeyBytes == null || message == null || signature == null) {
      return false;
    }

    try {
      final Signature verifier = Signature.getInstance(ALGORITHM);
      verifier.initVerify(deserializePublicKey(publicKeyBytes));
      verifier.update(message);
      return verifier.verify(signature);
    } catch (final GeneralSecurityException | RuntimeException e) {
      return false;
    }
  }

  @Override
  public byte[] serializePublicKey(final PublicKey publicKey) {
    final byte[] serializedPublicKey = new byte[KEY_LENGTH];
    System.arraycopy(publicKey.getEncoded(), X509_PREFIX.length, serializedPublicKey, 0, KEY_LENGTH);

    return serializedPublicKey;
  }

  @Override
  public PublicKey deserializePublicKey(final byte[] publicKeyBytes) {
    if (publicKeyBytes == null || publicKeyBytes.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Unexpected serialized public key length");
    }

    final byte[] x509Bytes = new byte[X509_PREFIX.length + KEY_LENGTH];
    System.arraycopy(X509_PREFIX, 0, x509Bytes, 0, X509_PREFIX.length);
    System.arraycopy(publicKeyBytes, 0, x509Bytes, X509_PREFIX.length, KEY_LENGTH);

    try {
      return keyFactory.generatePublic(new X509EncodedKeySpec(x509Bytes, ALGORITHM));
    } catch (final InvalidKeySpecException e) {
      throw new IllegalArgumentException("Invalid key", e);
    }
  }

  @Override
  public byte[] serializePrivateKey(final PrivateKey privateKey) {
    if (privateKey instanceof EdECPrivateKey edECPrivateKey) {
      return edECPrivateKey.getBytes()
          .orElseThrow(() -> new IllegalArgumentException("Private key material is not extractable"));
    }

    throw new IllegalArgumentException("Unexpected key type: " + privateKey.getClass());
  }

  @Override
  public PrivateKey deserializePrivateKey(final byte[] privateKeyBytes) {
    if (privateKeyBytes == null || privateKeyBytes.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Unexpected serialized private key length");
    }

    try {
      return keyFactory.generatePrivate(new EdECPrivateKeySpec(NamedParameterSpec.ED25519, privateKeyBytes));
    } catch (final InvalidKeySpecException e) {
      throw new IllegalArgumentException("Invalid key", e);
    }
  }
}
