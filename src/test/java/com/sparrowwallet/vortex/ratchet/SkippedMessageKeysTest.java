package com.sparrowwallet.vortex.ratchet;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class SkippedMessageKeysTest {
    private static byte[] key(int value) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte)value);
        return bytes;
    }

    @Test
    public void testTakeRemovesKey() {
        SkippedMessageKeys skippedKeys = new SkippedMessageKeys(10);
        byte[] ratchetKey = key(1);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 3), key(7), 100);

        assertArrayEquals(key(7), skippedKeys.take(ratchetKey, 3).orElseThrow());
        assertTrue(skippedKeys.take(ratchetKey, 3).isEmpty());
        assertTrue(skippedKeys.take(key(2), 3).isEmpty());
    }

    @Test
    public void testOldestEvictedBeyondCapacity() {
        SkippedMessageKeys skippedKeys = new SkippedMessageKeys(3);
        byte[] ratchetKey = key(1);
        byte[] firstMessageKey = key(10);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 0), firstMessageKey, 0);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 1), key(11), 0);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 2), key(12), 0);

        assertEquals(1, skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 3), key(13), 0));
        assertEquals(3, skippedKeys.size());
        assertTrue(skippedKeys.take(ratchetKey, 0).isEmpty());
        assertArrayEquals(new byte[32], firstMessageKey);
        assertTrue(skippedKeys.take(ratchetKey, 3).isPresent());
    }

    @Test
    public void testRemoveOlderThan() {
        SkippedMessageKeys skippedKeys = new SkippedMessageKeys(10);
        byte[] ratchetKey = key(1);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 0), key(10), 100);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 1), key(11), 200);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 2), key(12), 300);

        assertEquals(2, skippedKeys.removeOlderThan(250));
        assertEquals(1, skippedKeys.size());
        assertTrue(skippedKeys.take(ratchetKey, 2).isPresent());
    }

    @Test
    public void testCopyIsIndependent() {
        SkippedMessageKeys skippedKeys = new SkippedMessageKeys(10);
        byte[] ratchetKey = key(1);
        skippedKeys.put(SkippedMessageKeys.keyFor(ratchetKey, 0), key(10), 100);

        SkippedMessageKeys copy = skippedKeys.copy();
        copy.take(ratchetKey, 0);
        assertEquals(1, skippedKeys.size());

        SkippedMessageKeys second = skippedKeys.copy();
        skippedKeys.wipe();
        assertTrue(skippedKeys.isEmpty());
        assertArrayEquals(key(10), second.take(ratchetKey, 0).orElseThrow());
    }
}
