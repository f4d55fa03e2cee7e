package com.sparrowwallet.vortex;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

public class Utils {
    private static final Base64.Encoder BASE64_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder BASE64_DECODER = Base64.getUrlDecoder();

    private Utils() {}

    /**
     * Encodes bytes as URL-safe base64 without padding, the encoding used for every byte field on the wire and in
     * exported state.
     */
    public static String toBase64(byte[] bytes) {
        return BASE64_ENCODER.encodeToString(bytes);
    }

    /**
     * Decodes URL-safe base64, with or without padding.
     *
     * @throws IllegalArgumentException if the input is not valid base64
     */
    public static byte[] fromBase64(String base64) {
        return BASE64_DECODER.decode(base64);
    }

    public static byte[] concat(byte[]... arrays) {
        int length = 0;
        for(byte[] array : arrays) {
            length += array.length;
        }

        byte[] result = new byte[length];
        int offset = 0;
        for(byte[] array : arrays) {
            System.arraycopy(array, 0, result, offset, array.length);
            offset += array.length;
        }

        return result;
    }

    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        if(a == null || b == null) {
            return false;
        }

        return MessageDigest.isEqual(a, b);
    }

    public static void wipe(byte[] bytes) {
        if(bytes != null) {
            Arrays.fill(bytes, (byte)0);
        }
    }
}
