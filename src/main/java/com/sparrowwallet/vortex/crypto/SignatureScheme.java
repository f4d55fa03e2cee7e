package com.sparrowwallet.vortex.crypto;

import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * A signature scheme signs and verifies pre-key material. Signing key pairs are never used for key agreement.
 */
public interface SignatureScheme {

  /**
   * Returns a {@code SignatureScheme} instance that implements the named signature algorithm. This method recognizes
   * the name "Ed25519".
   *
   * @param name the name of the signature algorithm
   *
   * @return a concrete signature scheme for the given name
   *
   * @throws NoSuchAlgorithmException if no security provider in the current JVM supports the algorithm
   * @throws IllegalArgumentException if the given name is not a known signature scheme name
   */
  static SignatureScheme getInstance(final String name) throws NoSuchAlgorithmException {
    return switch (name) {
      case "Ed25519" -> new Ed25519SignatureScheme();
      default -> throw new IllegalArgumentException("Unrecognized signature scheme name: " + name);
    };
  }

  String getName();

  KeyPair generateKeyPair();

  byte[] sign(PrivateKey privateKey, byte[] message);

  /**
   * Verifies a detached signature. Malformed keys or signatures yield {@code false} rather than an exception.
   *
   * @param publicKeyBytes the raw public key of the signer
   * @param message the signed message
   * @param signature the detached signature
   *
   * @return {@code true} if the signature is valid for the message under the given key
   */
  boolean verify(byte[] publicKeyBytes, byte[] message, byte[] signature);

  byte[] serializePublicKey(PublicKey publicKey);

  PublicKey deserializePublicKey(byte[] publicKeyBytes);

  byte[] serializePrivateKey(PrivateKey privateKey);

  PrivateKey deserializePrivateKey(byte[] privateKeyBytes);

  default KeyPair deserializeKeyPair(final byte[] publicKeyBytes, final byte[] privateKeyBytes) {
    return new KeyPair(deserializePublicKey(publicKeyBytes), deserializePrivateKey(privateKeyBytes));
  }
}
