package com.sparrowwallet.vortex.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class WireCodecTest {
    private final WireCodec codec = new WireCodec();

    private static byte[] filled(int length, int value) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte)value);
        return bytes;
    }

    private static EncryptedMessage message() {
        return new EncryptedMessage(new MessageHeader(filled(32, 1), 3, 4), filled(56, 2), filled(12, 3), filled(20, 4), filled(12, 5));
    }

    @Test
    public void testMessageEnvelope() throws Exception {
        String json = codec.encode(message());
        JsonNode node = new ObjectMapper().readTree(json);
        assertEquals("message", node.get("t").asText());
        assertEquals(3, node.get("header").get("pn").asInt());
        assertEquals(4, node.get("header").get("n").asInt());
        assertFalse(node.get("headerCipher").asText().contains("="));

        EncryptedMessage decoded = codec.decodeMessage(json);
        assertEquals(message().getHeader(), decoded.getHeader());
        assertArrayEquals(filled(56, 2), decoded.getHeaderCipher());
        assertArrayEquals(filled(12, 3), decoded.getHeaderNonce());
        assertArrayEquals(filled(20, 4), decoded.getCiphertext());
        assertArrayEquals(filled(12, 5), decoded.getNonce());
    }

    @Test
    public void testPreKeyMessageEnvelope() throws Exception {
        PreKeyMessage preKeyMessage = new PreKeyMessage(42, filled(32, 6), filled(32, 7), filled(32, 8), null, message());
        String json = codec.encode(preKeyMessage);
        assertFalse(json.contains("oneTimePreKey"));

        WireMessage decoded = codec.decode(json);
        assertEquals(MessageKind.PREKEY, decoded.getKind());
        PreKeyMessage decodedPreKeyMessage = (PreKeyMessage)decoded;
        assertEquals(42, decodedPreKeyMessage.getRegistrationId());
        assertArrayEquals(filled(32, 6), decodedPreKeyMessage.getIdentityKey());
        assertArrayEquals(filled(32, 7), decodedPreKeyMessage.getEphemeralKey());
        assertArrayEquals(filled(32, 8), decodedPreKeyMessage.getSignedPreKey());
        assertTrue(decodedPreKeyMessage.getOneTimePreKey().isEmpty());
        assertEquals(message().getHeader(), decodedPreKeyMessage.getMessage().getHeader());

        assertThrows(InvalidWireFormatException.class, () -> codec.decodeMessage(json));
    }

    @Test
    public void testBundle() throws Exception {
        PreKeyBundle bundle = new PreKeyBundle(filled(32, 1), filled(32, 2), filled(64, 3), filled(32, 4), 1234, filled(32, 5));
        String json = codec.encodeBundle(bundle);
        JsonNode node = new ObjectMapper().readTree(json);
        assertTrue(node.has("identityKey"));
        assertTrue(node.has("signedPreKey"));
        assertTrue(node.has("signedPreKeySig"));
        assertTrue(node.has("oneTimePreKey"));
        assertEquals(1234, node.get("registrationId").asInt());

        PreKeyBundle decoded = codec.decodeBundle(json);
        assertArrayEquals(filled(32, 1), decoded.getIdentityKey());
        assertArrayEquals(filled(64, 3), decoded.getSignedPreKeySig());
        assertArrayEquals(filled(32, 4), decoded.getOneTimePreKey().orElseThrow());
        assertArrayEquals(filled(32, 5), decoded.getSigningKey().orElseThrow());
        assertEquals(1234, decoded.getRegistrationId());

        PreKeyBundle withoutOneTimePreKey = codec.decodeBundle(codec.encodeBundle(bundle.withoutOneTimePreKey()));
        assertTrue(withoutOneTimePreKey.getOneTimePreKey().isEmpty());
    }

    @Test
    public void testMalformedInput() {
        assertThrows(InvalidWireFormatException.class, () -> codec.decode("not json"));
        assertThrows(InvalidWireFormatException.class, () -> codec.decode("[]"));
        assertThrows(InvalidWireFormatException.class, () -> codec.decode("{\"ciphertext\":\"AA\"}"));
        assertThrows(InvalidWireFormatException.class, () -> codec.decode("{\"t\":\"group\"}"));
        assertThrows(InvalidWireFormatException.class, () -> codec.decode("{\"t\":\"message\",\"header\":{\"dh\":\"AA\",\"pn\":0,\"n\":0}}"));
        assertThrows(InvalidWireFormatException.class, () -> codec.decode("{\"t\":\"message\"}"));
        assertThrows(InvalidWireFormatException.class, () -> codec.decodeBundle("{\"identityKey\":\"***\"}"));
    }

    @Test
    public void testCounterOutOfRange() {
        String json = codec.encode(message()).replace("\"n\":4", "\"n\":4294967295");
        assertThrows(InvalidWireFormatException.class, () -> codec.decodeMessage(json));
    }
}
