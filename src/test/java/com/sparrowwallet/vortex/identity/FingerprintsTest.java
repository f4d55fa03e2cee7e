package com.sparrowwallet.vortex.identity;

import com.sparrowwallet.vortex.crypto.RatchetHash;
import org.junit.jupiter.api.Test;

import java.security.NoSuchAlgorithmException;

import static org.junit.jupiter.api.Assertions.*;

public class FingerprintsTest {
    @Test
    public void testFingerprintOfZeroKey() throws NoSuchAlgorithmException {
        Fingerprints fingerprints = new Fingerprints(RatchetHash.getInstance("SHA256"));
        // SHA-256 of 32 zero bytes is 66687aadf862bd776c8fc18b8e9f8e20089714856ee233b3902a591d0d5f2925
        assertEquals("6668 7aad f862 bd77 6c8f c18b 8e9f 8e20", fingerprints.fingerprint(new byte[32]));
    }

    @Test
    public void testSafetyNumberOrderIndependent() throws NoSuchAlgorithmException {
        Fingerprints fingerprints = new Fingerprints(RatchetHash.getInstance("SHA256"));
        byte[] low = new byte[32];
        byte[] high = new byte[32];
        high[0] = (byte)0x80;

        assertEquals(fingerprints.safetyNumber(low, high), fingerprints.safetyNumber(high, low));
        assertNotEquals(fingerprints.safetyNumber(low, high), fingerprints.safetyNumber(low, low));
    }

    @Test
    public void testSafetyNumberGroups() throws NoSuchAlgorithmException {
        Fingerprints fingerprints = new Fingerprints(RatchetHash.getInstance("SHA256"));
        String safetyNumber = fingerprints.safetyNumber(new byte[32], new byte[32]);
        String[] groups = safetyNumber.split(" ");
        assertEquals(6, groups.length);
        for(String group : groups) {
            assertEquals(5, group.length());
            assertTrue(group.chars().allMatch(Character::isDigit));
        }
    }
}
