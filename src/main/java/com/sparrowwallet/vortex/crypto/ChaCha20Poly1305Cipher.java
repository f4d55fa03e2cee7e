package com.sparrowwallet.vortex.crypto;

import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.Key;
import java.security.NoSuchAlgorithmException;
import java.security.spec.AlgorithmParameterSpec;

class ChaCha20Poly1305Cipher extends AbstractRatchetCipher {

  private static final String ALGORITHM = "ChaCha20-Poly1305";

  ChaCha20Poly1305Cipher() throws NoSuchAlgorithmException {
    super(ALGORITHM);
  }

  @Override
  protected AlgorithmParameterSpec getAlgorithmParameters(final byte[] nonce) {
    return new IvParameterSpec(nonce);
  }

  @Override
  public String getName() {
    return "ChaChaPoly";
  }

  @Override
  public int getNonceLength() {
    return 12;
  }

  @Override
  public Key buildKey(final byte[] keyBytes) {
    return new SecretKeySpec(keyBytes, "ChaCha20");
  }
}
