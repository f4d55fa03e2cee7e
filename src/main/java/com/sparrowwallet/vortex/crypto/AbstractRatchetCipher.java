package com.sparrowwallet.vortex.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.NoSuchAlgorithmException;
import java.security.spec.AlgorithmParameterSpec;

/**
 * Common JCA plumbing for the AEAD ciphers. A fresh {@link Cipher} is created for every call because JCA refuses to
 * reuse a key and nonce pair on one instance, and because a suite is shared between sessions.
 */
abstract class AbstractRatchetCipher implements RatchetCipher {

  private final String transformation;

  AbstractRatchetCipher(final String transformation) throws NoSuchAlgorithmException {
    this.transformation = transformation;

    // Fail when the suite is created if the transformation isn't available
    newCipher();
  }

  protected abstract AlgorithmParameterSpec getAlgorithmParameters(final byte[] nonce);

  @Override
  public byte[] encrypt(final Key key, final byte[] nonce, final byte[] associatedData, final byte[] plaintext) {
    try {
      return process(Cipher.ENCRYPT_MODE, key, nonce, associatedData, plaintext);
    } catch (final AEADBadTagException e) {
      throw new AssertionError("Tag verification during encryption", e);
    }
  }

  @Override
  public byte[] decrypt(final Key key, final byte[] nonce, final byte[] associatedData, final byte[] ciphertext)
      throws AEADBadTagException {

    if (ciphertext == null || ciphertext.length < getTagLength()) {
      throw new AEADBadTagException("Ciphertext is shorter than an AEAD tag");
    }

    return process(Cipher.DECRYPT_MODE, key, nonce, associatedData, ciphertext);
  }

  private byte[] process(final int mode, final Key key, final byte[] nonce, final byte[] associatedData, final byte[] input)
      throws AEADBadTagException {

    if (nonce == null || nonce.length != getNonceLength()) {
      throw new IllegalArgumentException("Nonce must be exactly " + getNonceLength() + " bytes");
    }

    final Cipher cipher;
    try {
      cipher = newCipher();
      cipher.init(mode, key, getAlgorithmParameters(nonce));
    } catch (final InvalidKeyException e) {
      throw new IllegalArgumentException("Invalid key", e);
    } catch (final NoSuchAlgorithmException | InvalidAlgorithmParameterException e) {
      throw new AssertionError(e);
    }

    if (associatedData != null) {
      cipher.updateAAD(associatedData);
    }

    try {
      return cipher.doFinal(input);
    } catch (final AEADBadTagException e) {
      throw e;
    } catch (final IllegalBlockSizeException | BadPaddingException e) {
      // Stream-style AEAD without padding
      throw new AssertionError(e);
    }
  }

  private Cipher newCipher() throws NoSuchAlgorithmException {
    try {
      return Cipher.getInstance(transformation);
    } catch (final NoSuchAlgorithmException e) {
      throw e;
    } catch (final GeneralSecurityException e) {
      throw new AssertionError("No padding is requested", e);
    }
  }
}
