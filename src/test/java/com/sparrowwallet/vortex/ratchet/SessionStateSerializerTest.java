package com.sparrowwallet.vortex.ratchet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.TestConfig;
import com.sparrowwallet.vortex.crypto.CipherSuite;
import com.sparrowwallet.vortex.protocol.EncryptedMessage;
import com.sparrowwallet.vortex.protocol.InvalidWireFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class SessionStateSerializerTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private ProtocolConfig config;
    private CipherSuite suite;
    private SessionStateSerializer serializer;
    private SessionPair pair;
    private EncryptedMessage skipped;

    @BeforeEach
    public void setUp() throws Exception {
        config = TestConfig.load();
        suite = TestConfig.suite(config);
        serializer = new SessionStateSerializer(suite, config);
        pair = new SessionPair(suite, config, new MutableClock(Instant.parse("2024-06-01T12:00:00Z")), true);

        skipped = pair.alice.encrypt("skipped".getBytes(StandardCharsets.UTF_8));
        pair.bob.decrypt(pair.alice.encrypt("delivered".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testDocumentShape() throws Exception {
        JsonNode node = mapper.readTree(pair.bob.exportState());
        assertEquals(1, node.get("v").asInt());
        assertEquals("bob", node.get("sessionId").asText());
        assertEquals("RESPONDER", node.get("role").asText());
        assertTrue(node.get("DHs").has("publicKey"));
        assertTrue(node.get("DHs").has("privateKey"));
        assertEquals(2, node.get("Nr").asInt());
        assertEquals(0, node.get("Ns").asInt());
        assertTrue(node.get("CKs").isTextual());
        assertTrue(node.get("HKr").isTextual());
        assertEquals(pair.bob.getCreatedAt(), node.get("createdAt").asLong());

        JsonNode skippedKeys = node.get("MKSKIPPED");
        assertTrue(skippedKeys.isArray());
        assertEquals(1, skippedKeys.size());
        JsonNode entry = skippedKeys.get(0);
        assertTrue(entry.isArray());
        assertEquals(2, entry.size());
        assertTrue(entry.get(0).asText().endsWith(":0"));
        assertTrue(entry.get(1).has("messageKey"));
        assertTrue(entry.get(1).has("timestamp"));
    }

    @Test
    public void testInitiatorBeforeReplyHasNoReceivingChain() throws Exception {
        JsonNode node = mapper.readTree(pair.alice.exportState());
        assertEquals("INITIATOR", node.get("role").asText());
        assertTrue(node.get("CKr").isNull());
        assertTrue(node.get("HKr").isNull());
        assertTrue(node.get("DHr").isTextual());

        SessionState state = serializer.deserialize(pair.alice.exportState());
        assertNull(state.getReceivingChainKey());
        assertEquals(2, state.getSendingCount());
    }

    @Test
    public void testShortSkippedKeyAlias() throws Exception {
        ObjectNode node = (ObjectNode)mapper.readTree(pair.bob.exportState());
        ObjectNode value = (ObjectNode)node.get("MKSKIPPED").get(0).get(1);
        value.set("mk", value.remove("messageKey"));

        DoubleRatchetSession restored = new DoubleRatchetSession(suite, config);
        restored.importState(mapper.writeValueAsString(node));
        assertEquals("skipped", new String(restored.decrypt(skipped).plaintext(), StandardCharsets.UTF_8));
    }

    @Test
    public void testUnknownFieldsIgnored() throws Exception {
        ObjectNode node = (ObjectNode)mapper.readTree(pair.bob.exportState());
        node.put("extra", "ignored");
        assertEquals(1, serializer.deserialize(mapper.writeValueAsString(node)).getSkippedKeyCount());
    }

    @Test
    public void testUnsupportedVersion() throws Exception {
        ObjectNode node = (ObjectNode)mapper.readTree(pair.bob.exportState());
        node.put("v", 2);
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize(mapper.writeValueAsString(node)));

        node.remove("v");
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize(mapper.writeValueAsString(node)));
    }

    @Test
    public void testMalformedDocuments() throws Exception {
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize("not json"));
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize("null"));

        ObjectNode shortKey = (ObjectNode)mapper.readTree(pair.bob.exportState());
        shortKey.put("RK", "AAAA");
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize(mapper.writeValueAsString(shortKey)));

        ObjectNode missingRoot = (ObjectNode)mapper.readTree(pair.bob.exportState());
        missingRoot.remove("RK");
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize(mapper.writeValueAsString(missingRoot)));

        ObjectNode negative = (ObjectNode)mapper.readTree(pair.bob.exportState());
        negative.put("Nr", -1);
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize(mapper.writeValueAsString(negative)));

        ObjectNode badEntry = (ObjectNode)mapper.readTree(pair.bob.exportState());
        ((ArrayNode)badEntry.get("MKSKIPPED").get(0)).set(0, mapper.getNodeFactory().textNode("nocolon"));
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize(mapper.writeValueAsString(badEntry)));

        ObjectNode missingKeyPair = (ObjectNode)mapper.readTree(pair.bob.exportState());
        missingKeyPair.remove("DHs");
        assertThrows(InvalidWireFormatException.class, () -> serializer.deserialize(mapper.writeValueAsString(missingKeyPair)));
    }

    @Test
    public void testFailedImportKeepsSession() throws Exception {
        String before = pair.bob.exportState();
        assertThrows(InvalidWireFormatException.class, () -> pair.bob.importState("{\"v\":1}"));
        assertEquals(before, pair.bob.exportState());
        assertTrue(pair.bob.isReady());
    }
}
