package com.sparrowwallet.vortex.crypto;

import javax.crypto.KeyAgreement;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.XECPrivateKey;
import java.security.interfaces.XECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.NamedParameterSpec;
import java.security.spec.XECPrivateKeySpec;
import java.security.spec.XECPublicKeySpec;

/**
 * X25519 over raw 32-byte keys. Public keys are the little-endian u-coordinate of RFC 7748; the unused top bit is
 * masked on decode.
 */
class X25519KeyAgreement implements RatchetKeyAgreement {

  private static final String ALGORITHM = "X25519";
  private static final int KEY_LENGTH = 32;

  private final KeyFactory keyFactory;

  X25519KeyAgreement() throws NoSuchAlgorithmException {
    this.keyFactory = KeyFactory.getInstance(ALGORITHM);

    // Fail when the suite is created, not in the middle of a session
    KeyAgreement.getInstance(ALGORITHM);
    KeyPairGenerator.getInstance(ALGORITHM);
  }

  @Override
  public String getName() {
    return "25519";
  }

  @Override
  public int getPublicKeyLength() {
    return KEY_LENGTH;
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
  public byte[] generateSecret(final PrivateKey privateKey, final PublicKey publicKey) {
    final byte[] secret;
    try {
      final KeyAgreement keyAgreement = KeyAgreement.getInstance(ALGORITHM);
      keyAgreement.init(privateKey);
      keyAgreement.doPhase(publicKey, true);
      secret = keyAgreement.generateSecret();
    } catch (final InvalidKeyException e) {
      throw new IllegalArgumentException("Key agreement failed", e);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError(e);
    }

    int accumulator = 0;
    for (final byte b : secret) {
      accumulator |= b;
    }
    if (accumulator == 0) {
      throw new IllegalArgumentException("Public key is a low-order point");
    }

    return secret;
  }

  @Override
  public byte[] serializePublicKey(final PublicKey publicKey) {
    if (!(publicKey instanceof XECPublicKey xecPublicKey)) {
      throw new IllegalArgumentException("Unexpected key type: " + publicKey.getClass());
    }

    final byte[] bigEndian = xecPublicKey.getU().toByteArray();
    final byte[] littleEndian = new byte[KEY_LENGTH];
    for (int i = 0; i < KEY_LENGTH && i < bigEndian.length; i++) {
      littleEndian[i] = bigEndian[bigEndian.length - 1 - i];
    }

    return littleEndian;
  }

  @Override
  public PublicKey deserializePublicKey(final byte[] publicKeyBytes) {
    if (publicKeyBytes == null || publicKeyBytes.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Unexpected serialized public key length");
    }

    final byte[] bigEndian = new byte[KEY_LENGTH];
    for (int i = 0; i < KEY_LENGTH; i++) {
      bigEndian[i] = publicKeyBytes[KEY_LENGTH - 1 - i];
    }
    bigEndian[0] &= 0x7f;

    try {
      return keyFactory.generatePublic(new XECPublicKeySpec(NamedParameterSpec.X25519, new BigInteger(1, bigEndian)));
    } catch (final InvalidKeySpecException e) {
      throw new IllegalArgumentException("Invalid public key", e);
    }
  }

  @Override
  public byte[] serializePrivateKey(final PrivateKey privateKey) {
    if (privateKey instanceof XECPrivateKey xecPrivateKey) {
      return xecPrivateKey.getScalar()
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
      return keyFactory.generatePrivate(new XECPrivateKeySpec(NamedParameterSpec.X25519, privateKeyBytes));
    } catch (final GeneralSecurityException e) {
      throw new IllegalArgumentException("Invalid private key", e);
    }
  }
}
