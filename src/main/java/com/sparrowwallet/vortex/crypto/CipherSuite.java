package com.sparrowwallet.vortex.crypto;

import com.sparrowwallet.vortex.ProtocolConfig;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * The set of primitives a session engine runs on. Every component is stateless, so a single suite may be shared by any
 * number of managers and sessions, including across threads.
 */
public class CipherSuite {

  private final RatchetKeyAgreement keyAgreement;
  private final RatchetCipher cipher;
  private final RatchetHash hash;
  private final SignatureScheme signatureScheme;
  private final PasswordHash passwordHash;
  private final SecureRandom random;

  public CipherSuite(final RatchetKeyAgreement keyAgreement,
                     final RatchetCipher cipher,
                     final RatchetHash hash,
                     final SignatureScheme signatureScheme,
                     final PasswordHash passwordHash,
                     final SecureRandom random) {

    this.keyAgreement = keyAgreement;
    this.cipher = cipher;
    this.hash = hash;
    this.signatureScheme = signatureScheme;
    this.passwordHash = passwordHash;
    this.random = random;
  }

  /**
   * Builds the suite named by the given configuration: X25519, Ed25519, SHA-256 and Argon2id, with the configured AEAD
   * cipher.
   *
   * @param config the protocol configuration that names the AEAD cipher
   *
   * @return a new cipher suite
   *
   * @throws NoSuchAlgorithmException if the running JVM does not provide one of the required primitives
   */
  public static CipherSuite create(final ProtocolConfig config) throws NoSuchAlgorithmException {
    return new CipherSuite(RatchetKeyAgreement.getInstance("25519"),
        RatchetCipher.getInstance(config.getCipher()),
        RatchetHash.getInstance("SHA256"),
        SignatureScheme.getInstance("Ed25519"),
        PasswordHash.getInstance("argon2id"),
        new SecureRandom());
  }

  public RatchetKeyAgreement getKeyAgreement() {
    return keyAgreement;
  }

  public RatchetCipher getCipher() {
    return cipher;
  }

  public RatchetHash getHash() {
    return hash;
  }

  public SignatureScheme getSignatureScheme() {
    return signatureScheme;
  }

  public PasswordHash getPasswordHash() {
    return passwordHash;
  }

  public SecureRandom getRandom() {
    return random;
  }

  public byte[] randomBytes(final int length) {
    final byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }
}
