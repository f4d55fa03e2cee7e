package com.sparrowwallet.vortex.protocol;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

public class MessageHeaderTest {
    @Test
    public void testEncodingLayout() throws InvalidWireFormatException {
        byte[] dh = new byte[32];
        Arrays.fill(dh, (byte)0xaa);
        MessageHeader header = new MessageHeader(dh, 258, 7);

        byte[] encoded = header.encode();
        assertEquals(MessageHeader.ENCODED_LENGTH, encoded.length);
        assertEquals("0000010200000007", HexFormat.of().formatHex(encoded, 32, 40));
        assertEquals(header, MessageHeader.decode(encoded));
    }

    @Test
    public void testDecodeRejectsBadInput() {
        assertThrows(InvalidWireFormatException.class, () -> MessageHeader.decode(new byte[39]));
        assertThrows(InvalidWireFormatException.class, () -> MessageHeader.decode(null));

        byte[] encoded = new byte[40];
        encoded[36] = (byte)0x80;
        assertThrows(InvalidWireFormatException.class, () -> MessageHeader.decode(encoded));
    }

    @Test
    public void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new MessageHeader(new byte[31], 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new MessageHeader(new byte[32], -1, 0));
    }
}
