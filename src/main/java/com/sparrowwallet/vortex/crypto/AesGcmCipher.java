package com.sparrowwallet.vortex.crypto;

import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.Key;
import java.security.NoSuchAlgorithmException;
import java.security.spec.AlgorithmParameterSpec;

class AesGcmCipher extends AbstractRatchetCipher {

  private static final String ALGORITHM = "AES/GCM/NoPadding";

  AesGcmCipher() throws NoSuchAlgorithmException {
    super(ALGORITHM);
  }

  @Override
  protected AlgorithmParameterSpec getAlgorithmParameters(final byte[] nonce) {
    return new GCMParameterSpec(getTagLength() * 8, nonce);
  }

  @Override
  public String getName() {
    return "AESGCM";
  }

  @Override
  public int getNonceLength() {
    return 12;
  }

  @Override
  public Key buildKey(final byte[] keyBytes) {
    return new SecretKeySpec(keyBytes, "AES");
  }
}
