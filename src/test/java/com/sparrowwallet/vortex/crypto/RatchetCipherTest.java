package com.sparrowwallet.vortex.crypto;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.crypto.AEADBadTagException;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

public class RatchetCipherTest {
    private static final SecureRandom RANDOM = new SecureRandom();

    private static byte[] random(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    @ParameterizedTest
    @ValueSource(strings = { "ChaChaPoly", "AESGCM" })
    public void testEncryptDecrypt(String name) throws NoSuchAlgorithmException, AEADBadTagException {
        RatchetCipher cipher = RatchetCipher.getInstance(name);
        Key key = cipher.buildKey(random(32));
        byte[] nonce = random(cipher.getNonceLength());
        byte[] associatedData = "ad".getBytes(StandardCharsets.UTF_8);
        byte[] plaintext = "attack at dawn".getBytes(StandardCharsets.UTF_8);

        byte[] ciphertext = cipher.encrypt(key, nonce, associatedData, plaintext);
        assertEquals(plaintext.length + cipher.getTagLength(), ciphertext.length);
        assertArrayEquals(plaintext, cipher.decrypt(key, nonce, associatedData, ciphertext));
    }

    @ParameterizedTest
    @ValueSource(strings = { "ChaChaPoly", "AESGCM" })
    public void testTamperingDetected(String name) throws NoSuchAlgorithmException {
        RatchetCipher cipher = RatchetCipher.getInstance(name);
        Key key = cipher.buildKey(random(32));
        byte[] nonce = random(cipher.getNonceLength());
        byte[] associatedData = "ad".getBytes(StandardCharsets.UTF_8);
        byte[] ciphertext = cipher.encrypt(key, nonce, associatedData, "attack at dawn".getBytes(StandardCharsets.UTF_8));

        byte[] flipped = ciphertext.clone();
        flipped[0] ^= 0x01;
        assertThrows(AEADBadTagException.class, () -> cipher.decrypt(key, nonce, associatedData, flipped));
        assertThrows(AEADBadTagException.class, () -> cipher.decrypt(key, nonce, "other".getBytes(StandardCharsets.UTF_8), ciphertext));
        assertThrows(AEADBadTagException.class, () -> cipher.decrypt(cipher.buildKey(random(32)), nonce, associatedData, ciphertext));
        assertThrows(AEADBadTagException.class, () -> cipher.decrypt(key, nonce, associatedData, new byte[8]));
    }

    @ParameterizedTest
    @ValueSource(strings = { "ChaChaPoly", "AESGCM" })
    public void testNonceLengthEnforced(String name) throws NoSuchAlgorithmException {
        RatchetCipher cipher = RatchetCipher.getInstance(name);
        Key key = cipher.buildKey(random(32));
        assertThrows(IllegalArgumentException.class, () -> cipher.encrypt(key, new byte[8], null, new byte[1]));
    }
}
