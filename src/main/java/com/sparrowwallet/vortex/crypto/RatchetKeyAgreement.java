package com.sparrowwallet.vortex.crypto;

import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * A ratchet key agreement is a stateless Diffie-Hellman function over raw, fixed-length public and private keys. It
 * is used for every X3DH and DH-ratchet computation in a session.
 */
public interface RatchetKeyAgreement {

  /**
   * Returns a {@code RatchetKeyAgreement} instance that implements the named key agreement algorithm. This method
   * recognizes the name "25519".
   *
   * @param name the name of the key agreement algorithm
   *
   * @return a concrete key agreement for the given name
   *
   * @throws NoSuchAlgorithmException if no security provider in the current JVM supports the algorithm
   * @throws IllegalArgumentException if the given name is not a known key agreement name
   */
  static RatchetKeyAgreement getInstance(final String name) throws NoSuchAlgorithmException {
    return switch (name) {
      case "25519" -> new X25519KeyAgreement();
      default -> throw new IllegalArgumentException("Unrecognized key agreement name: " + name);
    };
  }

  /**
   * Returns the short name of this key agreement algorithm.
   *
   * @return the short name of this key agreement algorithm
   */
  String getName();

  /**
   * Generates a new key pair compatible with this key agreement algorithm.
   *
   * @return a new key pair
   */
  KeyPair generateKeyPair();

  /**
   * Calculates a shared secret from a local private key and a remote public key.
   *
   * @param privateKey the local private key
   * @param publicKey the remote public key
   *
   * @return the shared secret
   *
   * @throws IllegalArgumentException if either key is not valid for this algorithm, or the public key is a low-order
   * point that would produce an all-zero secret
   */
  byte[] generateSecret(PrivateKey privateKey, PublicKey publicKey);

  /**
   * Returns the length, in bytes, of a raw public key for this algorithm.
   *
   * @return the length of a raw public key
   */
  int getPublicKeyLength();

  byte[] serializePublicKey(PublicKey publicKey);

  PublicKey deserializePublicKey(byte[] publicKeyBytes);

  byte[] serializePrivateKey(PrivateKey privateKey);

  PrivateKey deserializePrivateKey(byte[] privateKeyBytes);

  /**
   * Rebuilds a key pair from its raw public and private halves.
   *
   * @param publicKeyBytes the raw public key
   * @param privateKeyBytes the raw private key
   *
   * @return the reconstructed key pair
   */
  default KeyPair deserializeKeyPair(final byte[] publicKeyBytes, final byte[] privateKeyBytes) {
    return new KeyPair(deserializePublicKey(publicKeyBytes), deserializePrivateKey(privateKeyBytes));
  }
}
