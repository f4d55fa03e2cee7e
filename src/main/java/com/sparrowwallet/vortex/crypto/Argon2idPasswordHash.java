package com.sparrowwallet.vortex.crypto;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

class Argon2idPasswordHash implements PasswordHash {

  private static final int SALT_LENGTH = 16;

  @Override
  public String getName() {
    return "argon2id";
  }

  @Override
  public int getSaltLength() {
    return SALT_LENGTH;
  }

  @Override
  public byte[] deriveKey(final char[] password,
                          final byte[] salt,
                          final int memoryKiB,
                          final int iterations,
                          final int parallelism,
                          final int length) {

    if (salt == null || salt.length != SALT_LENGTH) {
      throw new IllegalArgumentException("Salt must be exactly " + SALT_LENGTH + " bytes");
    }

    final Argon2Parameters parameters = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(memoryKiB)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();

    final Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(parameters);

    final byte[] output = new byte[length];
    generator.generateBytes(password, output);

    return output;
  }
}
