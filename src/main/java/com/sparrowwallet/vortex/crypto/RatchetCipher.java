package com.sparrowwallet.vortex.crypto;

import javax.crypto.AEADBadTagException;
import java.security.Key;
import java.security.NoSuchAlgorithmException;

/**
 * A ratchet cipher is a stateless object that encrypts and decrypts data in AEAD mode. Implementations take an
 * explicit nonce on every call and produce (and verify) a 16-byte AEAD tag. Each key handed to a ratchet cipher is used
 * for a single message, so nonces are chosen at random by the caller rather than counted.
 */
public interface RatchetCipher {

  /**
   * <p>Returns a {@code RatchetCipher} instance that implements the named cipher algorithm. This method recognizes the
   * following cipher names:</p>
   *
   * <dl>
   *   <dt>ChaChaPoly</dt>
   *   <dd>Returns a cipher backed by the {@link javax.crypto.Cipher} returned by the most preferred security provider
   *   that supports the "ChaCha20-Poly1305" cipher transformation</dd>
   *
   *   <dt>AESGCM</dt>
   *   <dd>Returns a cipher backed by the {@link javax.crypto.Cipher} returned by the most preferred security provider
   *   that supports the "AES/GCM/NoPadding" cipher transformation</dd>
   * </dl>
   *
   * @param cipherName the name of the cipher algorithm
   *
   * @return a concrete {@code RatchetCipher} implementation for the given algorithm name
   *
   * @throws NoSuchAlgorithmException if the named transformation is not supported by any security provider
   * @throws IllegalArgumentException if the given name is not a known cipher name
   */
  static RatchetCipher getInstance(final String cipherName) throws NoSuchAlgorithmException {
    return switch (cipherName) {
      case "ChaChaPoly" -> new ChaCha20Poly1305Cipher();
      case "AESGCM" -> new AesGcmCipher();
      default -> throw new IllegalArgumentException("Unrecognized cipher name: " + cipherName);
    };
  }

  /**
   * Returns the name of this cipher as it appears in configuration.
   *
   * @return the name of this cipher
   */
  String getName();

  /**
   * Returns the length, in bytes, of the nonce this cipher expects.
   *
   * @return the nonce length
   */
  int getNonceLength();

  /**
   * Encrypts the given plaintext using the given key, nonce, and associated data. The returned array holds the
   * ciphertext followed by the AEAD tag.
   *
   * @param key the key with which to encrypt the given plaintext
   * @param nonce a nonce of exactly {@link #getNonceLength()} bytes; must never repeat for the same key
   * @param associatedData the associated data to authenticate; may be {@code null}
   * @param plaintext the plaintext to encrypt
   *
   * @return a new byte array containing the resulting ciphertext and AEAD tag
   */
  byte[] encrypt(Key key, byte[] nonce, byte[] associatedData, byte[] plaintext);

  /**
   * Decrypts the given ciphertext and verifies its AEAD tag.
   *
   * @param key the key with which to decrypt the given ciphertext
   * @param nonce the nonce used at encryption time
   * @param associatedData the associated data used at encryption time; may be {@code null}
   * @param ciphertext the ciphertext and AEAD tag
   *
   * @return a new byte array containing the plaintext
   *
   * @throws AEADBadTagException if the tag does not match the ciphertext, nonce, key, and associated data, or if the
   * ciphertext is too short to hold a tag
   */
  byte[] decrypt(Key key, byte[] nonce, byte[] associatedData, byte[] ciphertext) throws AEADBadTagException;

  /**
   * Returns the length, in bytes, of the authentication tag appended to every ciphertext.
   *
   * @return the tag length
   */
  default int getTagLength() {
    return 16;
  }

  /**
   * Converts an array of bytes into a {@link Key} instance suitable for use with this cipher.
   *
   * @param keyBytes the raw key material
   *
   * @return a {@code Key} instance suitable for use with this cipher
   */
  Key buildKey(byte[] keyBytes);
}
