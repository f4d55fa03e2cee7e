package com.sparrowwallet.vortex.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;

class Sha256RatchetHash implements RatchetHash {

  private static final int HASH_LENGTH = 32;
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  @Override
  public String getName() {
    return "SHA256";
  }

  @Override
  public int getHashLength() {
    return HASH_LENGTH;
  }

  @Override
  public byte[] hash(final byte[]... inputs) {
    final MessageDigest sha256;
    try {
      sha256 = MessageDigest.getInstance("SHA-256");
    } catch (final GeneralSecurityException e) {
      throw new AssertionError("SHA-256 is a required JCA algorithm", e);
    }

    Arrays.stream(inputs).forEach(sha256::update);
    return sha256.digest();
  }

  @Override
  public byte[] hmac(final byte[] key, final byte[] data) {
    return newHmac(key).doFinal(data);
  }

  @Override
  public byte[] deriveKeys(final byte[] inputKeyMaterial, final byte[] salt, final byte[] info, final int length) {
    if (length < 1 || length > 255 * HASH_LENGTH) {
      throw new IllegalArgumentException("Illegal output length: " + length);
    }

    // Extract
    final byte[] pseudoRandomKey = hmac(salt == null || salt.length == 0 ? new byte[HASH_LENGTH] : salt, inputKeyMaterial);

    // Expand: T(i) = HMAC(PRK, T(i - 1) | info | i)
    final Mac expander = newHmac(pseudoRandomKey);
    Arrays.fill(pseudoRandomKey, (byte) 0);

    final ByteArrayOutputStream okm = new ByteArrayOutputStream(length + HASH_LENGTH);
    byte[] block = new byte[0];
    for (int counter = 1; okm.size() < length; counter++) {
      expander.update(block);
      if (info != null) {
        expander.update(info);
      }
      expander.update((byte) counter);
      block = expander.doFinal();
      okm.writeBytes(block);
    }

    final byte[] expanded = okm.toByteArray();
    final byte[] output = Arrays.copyOf(expanded, length);
    Arrays.fill(expanded, (byte) 0);
    Arrays.fill(block, (byte) 0);
    return output;
  }

  private static Mac newHmac(final byte[] key) {
    try {
      final Mac hmac = Mac.getInstance(HMAC_ALGORITHM);
      hmac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
      return hmac;
    } catch (final GeneralSecurityException e) {
      throw new AssertionError("HMAC-SHA256 is a required JCA algorithm", e);
    }
  }
}
