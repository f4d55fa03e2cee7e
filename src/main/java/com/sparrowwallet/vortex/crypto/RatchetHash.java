package com.sparrowwallet.vortex.crypto;

import java.security.NoSuchAlgorithmException;

/**
 * A ratchet hash encapsulates the hashing functionality of the ratchet engine: plain digests for fingerprints and
 * safety numbers, HMAC for the symmetric chain ratchet, and HKDF built on that HMAC for the root ratchet and X3DH.
 */
public interface RatchetHash {

  /**
   * Returns a {@code RatchetHash} instance that implements the named hash algorithm. This method recognizes the name
   * "SHA256".
   *
   * @param hashName the name of the hash algorithm
   *
   * @return a concrete {@code RatchetHash} implementation for the given algorithm name
   *
   * @throws NoSuchAlgorithmException never for "SHA256"; declared for symmetry with the other components
   * @throws IllegalArgumentException if the given name is not a known hash name
   */
  static RatchetHash getInstance(final String hashName) throws NoSuchAlgorithmException {
    return switch (hashName) {
      case "SHA256" -> new Sha256RatchetHash();
      default -> throw new IllegalArgumentException("Unrecognized hash name: " + hashName);
    };
  }

  String getName();

  /**
   * Returns the length of a digest or HMAC produced by this hash.
   *
   * @return the length of a digest produced by this hash
   */
  int getHashLength();

  /**
   * Hashes the concatenation of the given byte arrays.
   *
   * @param inputs the data to hash
   *
   * @return the digest
   */
  byte[] hash(byte[]... inputs);

  /**
   * Calculates an HMAC of the given data under the given key.
   *
   * @param key the HMAC key
   * @param data the data to authenticate
   *
   * @return the HMAC digest
   */
  byte[] hmac(byte[] key, byte[] data);

  /**
   * Derives {@code length} bytes of key material from the given input key material, salt and context information
   * using the HKDF extract-and-expand construction with this hash's HMAC algorithm.
   *
   * @param inputKeyMaterial the input key material
   * @param salt the HKDF salt; an empty or {@code null} salt is replaced with {@link #getHashLength()} zero bytes
   * @param info context and application specific information; may be {@code null}
   * @param length the number of bytes to derive; at most 255 times the hash length
   *
   * @return the derived key material
   *
   * @see <a href="https://www.ietf.org/rfc/rfc5869.txt">IETF RFC 5869: HMAC-based Extract-and-Expand Key Derivation
   * Function (HKDF)</a>
   */
  byte[] deriveKeys(byte[] inputKeyMaterial, byte[] salt, byte[] info, int length);
}
