package com.sparrowwallet.vortex.crypto;

/**
 * A memory-hard password hash used to turn a backup password into a symmetric key.
 */
public interface PasswordHash {

  static PasswordHash getInstance(final String name) {
    return switch (name) {
      case "argon2id" -> new Argon2idPasswordHash();
      default -> throw new IllegalArgumentException("Unrecognized password hash name: " + name);
    };
  }

  String getName();

  int getSaltLength();

  /**
   * Stretches a password into key material.
   *
   * @param password the password; not retained
   * @param salt a random salt of {@link #getSaltLength()} bytes
   * @param memoryKiB memory cost in kibibytes
   * @param iterations time cost
   * @param parallelism number of lanes
   * @param length the number of bytes to derive
   *
   * @return the derived key material
   */
  byte[] deriveKey(char[] password, byte[] salt, int memoryKiB, int iterations, int parallelism, int length);
}
