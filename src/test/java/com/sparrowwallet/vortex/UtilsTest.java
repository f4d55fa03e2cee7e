package com.sparrowwallet.vortex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {
    @Test
    public void testBase64IsUrlSafeWithoutPadding() {
        byte[] bytes = new byte[] { (byte)0xfb, (byte)0xff, (byte)0xbf, 0x01 };
        String encoded = Utils.toBase64(bytes);
        assertEquals("-_-_AQ", encoded);
        assertArrayEquals(bytes, Utils.fromBase64(encoded));
        assertArrayEquals(bytes, Utils.fromBase64("-_-_AQ=="));
    }

    @Test
    public void testInvalidBase64() {
        assertThrows(IllegalArgumentException.class, () -> Utils.fromBase64("not base64!"));
    }

    @Test
    public void testConcat() {
        assertArrayEquals(new byte[] { 1, 2, 3, 4, 5 }, Utils.concat(new byte[] { 1, 2 }, new byte[0], new byte[] { 3, 4, 5 }));
    }

    @Test
    public void testConstantTimeEquals() {
        assertTrue(Utils.constantTimeEquals(new byte[] { 1, 2 }, new byte[] { 1, 2 }));
        assertFalse(Utils.constantTimeEquals(new byte[] { 1, 2 }, new byte[] { 1, 3 }));
        assertFalse(Utils.constantTimeEquals(new byte[] { 1, 2 }, new byte[] { 1, 2, 3 }));
        assertFalse(Utils.constantTimeEquals(null, new byte[] { 1 }));
    }

    @Test
    public void testWipe() {
        byte[] bytes = new byte[] { 1, 2, 3 };
        Utils.wipe(bytes);
        assertArrayEquals(new byte[3], bytes);
        Utils.wipe(null);
    }
}
