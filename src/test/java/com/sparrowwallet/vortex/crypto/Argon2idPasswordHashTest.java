package com.sparrowwallet.vortex.crypto;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class Argon2idPasswordHashTest {
    @Test
    public void testDeterministicForSameInputs() {
        PasswordHash passwordHash = PasswordHash.getInstance("argon2id");
        byte[] salt = new byte[passwordHash.getSaltLength()];
        Arrays.fill(salt, (byte)7);

        byte[] first = passwordHash.deriveKey("correct horse".toCharArray(), salt, 1024, 1, 1, 32);
        byte[] second = passwordHash.deriveKey("correct horse".toCharArray(), salt, 1024, 1, 1, 32);
        assertEquals(32, first.length);
        assertArrayEquals(first, second);
    }

    @Test
    public void testInputsChangeOutput() {
        PasswordHash passwordHash = PasswordHash.getInstance("argon2id");
        byte[] salt = new byte[passwordHash.getSaltLength()];
        byte[] otherSalt = new byte[passwordHash.getSaltLength()];
        otherSalt[0] = 1;

        byte[] reference = passwordHash.deriveKey("password".toCharArray(), salt, 1024, 1, 1, 32);
        assertFalse(Arrays.equals(reference, passwordHash.deriveKey("Password".toCharArray(), salt, 1024, 1, 1, 32)));
        assertFalse(Arrays.equals(reference, passwordHash.deriveKey("password".toCharArray(), otherSalt, 1024, 1, 1, 32)));
        assertFalse(Arrays.equals(reference, passwordHash.deriveKey("password".toCharArray(), salt, 1024, 2, 1, 32)));
    }

    @Test
    public void testSaltLengthEnforced() {
        PasswordHash passwordHash = PasswordHash.getInstance("argon2id");
        assertThrows(IllegalArgumentException.class, () -> passwordHash.deriveKey("password".toCharArray(), new byte[8], 1024, 1, 1, 32));
    }
}
