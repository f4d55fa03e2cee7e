package com.sparrowwallet.vortex.ratchet;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.Utils;
import com.sparrowwallet.vortex.crypto.CipherSuite;
import com.sparrowwallet.vortex.crypto.RatchetKeyAgreement;
import com.sparrowwallet.vortex.protocol.InvalidWireFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link SessionState} to and from its versioned JSON export. Byte fields are URL-safe base64 without
 * padding and the skipped message keys are flattened to an array of {@code [key, {messageKey, timestamp}]} pairs.
 */
public class SessionStateSerializer {
    public static final int VERSION = 1;
    private static final int KEY_LENGTH = 32;

    private final CipherSuite suite;
    private final ProtocolConfig config;
    private final ObjectMapper mapper = new ObjectMapper();

    public SessionStateSerializer(CipherSuite suite, ProtocolConfig config) {
        this.suite = suite;
        this.config = config;
    }

    public String serialize(SessionState state) {
        RatchetKeyAgreement keyAgreement = suite.getKeyAgreement();

        SessionFile file = new SessionFile();
        file.version = VERSION;
        file.sessionId = state.sessionId;
        file.role = state.role;
        file.dhs = new KeyPairFile();
        file.dhs.publicKey = Utils.toBase64(state.dhsPublicKey);
        file.dhs.privateKey = Utils.toBase64(keyAgreement.serializePrivateKey(state.dhs.getPrivate()));
        file.dhr = encode(state.dhr);
        file.rootKey = encode(state.rootKey);
        file.sendingChainKey = encode(state.sendingChainKey);
        file.receivingChainKey = encode(state.receivingChainKey);
        file.sendingCount = state.sendingCount;
        file.receivingCount = state.receivingCount;
        file.previousSendingCount = state.previousSendingCount;
        file.sendingHeaderKey = encode(state.sendingHeaderKey);
        file.receivingHeaderKey = encode(state.receivingHeaderKey);
        file.localIdentityKey = encode(state.localIdentityKey);
        file.remoteIdentityKey = encode(state.remoteIdentityKey);
        file.createdAt = state.createdAt;
        file.lastActivity = state.lastActivity;

        for(Map.Entry<String, SkippedMessageKeys.SkippedKey> entry : state.skippedKeys.entries().entrySet()) {
            SkippedKeyFile skippedKeyFile = new SkippedKeyFile();
            skippedKeyFile.messageKey = Utils.toBase64(entry.getValue().messageKey());
            skippedKeyFile.timestamp = entry.getValue().timestamp();

            SkippedEntryFile entryFile = new SkippedEntryFile();
            entryFile.key = entry.getKey();
            entryFile.value = skippedKeyFile;
            file.skippedKeys.add(entryFile);
        }

        try {
            return mapper.writeValueAsString(file);
        } catch(JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize session state", e);
        }
    }

    public SessionState deserialize(String json) throws InvalidWireFormatException {
        SessionFile file;
        try {
            file = mapper.readValue(json, SessionFile.class);
        } catch(JsonProcessingException e) {
            throw new InvalidWireFormatException("Session export is not valid JSON", e);
        }

        if(file == null || file.version == null || file.version != VERSION) {
            throw new InvalidWireFormatException("Unsupported session export version " + (file == null ? null : file.version));
        }
        if(file.dhs == null || file.sessionId == null) {
            throw new InvalidWireFormatException("Session export is missing its ratchet key pair or session id");
        }
        if(file.sendingCount < 0 || file.receivingCount < 0 || file.previousSendingCount < 0) {
            throw new InvalidWireFormatException("Negative message counter in session export");
        }

        RatchetKeyAgreement keyAgreement = suite.getKeyAgreement();
        SessionState state = new SessionState(file.sessionId, config.getMaxSkippedKeys(), file.createdAt);
        state.role = file.role;
        state.dhsPublicKey = required(file.dhs.publicKey, "DHs.publicKey");
        try {
            state.dhs = keyAgreement.deserializeKeyPair(state.dhsPublicKey, required(file.dhs.privateKey, "DHs.privateKey"));
        } catch(IllegalArgumentException e) {
            throw new InvalidWireFormatException("Invalid ratchet key pair in session export", e);
        }

        state.dhr = optional(file.dhr, "DHr");
        state.rootKey = required(file.rootKey, "RK");
        state.sendingChainKey = optional(file.sendingChainKey, "CKs");
        state.receivingChainKey = optional(file.receivingChainKey, "CKr");
        state.sendingCount = file.sendingCount;
        state.receivingCount = file.receivingCount;
        state.previousSendingCount = file.previousSendingCount;
        state.sendingHeaderKey = optional(file.sendingHeaderKey, "HKs");
        state.receivingHeaderKey = optional(file.receivingHeaderKey, "HKr");
        state.localIdentityKey = required(file.localIdentityKey, "localIdentityKey");
        state.remoteIdentityKey = required(file.remoteIdentityKey, "remoteIdentityKey");
        state.lastActivity = file.lastActivity;

        if(file.skippedKeys != null) {
            for(SkippedEntryFile entryFile : file.skippedKeys) {
                if(entryFile == null || entryFile.key == null || entryFile.value == null || entryFile.key.indexOf(':') < 0) {
                    throw new InvalidWireFormatException("Malformed skipped message key entry");
                }
                state.skippedKeys.put(entryFile.key, required(entryFile.value.messageKey, "MKSKIPPED.messageKey"), entryFile.value.timestamp);
            }
        }

        return state;
    }

    private static String encode(byte[] bytes) {
        return bytes == null ? null : Utils.toBase64(bytes);
    }

    private static byte[] required(String base64, String field) throws InvalidWireFormatException {
        if(base64 == null) {
            throw new InvalidWireFormatException("Missing field " + field);
        }

        return optional(base64, field);
    }

    private static byte[] optional(String base64, String field) throws InvalidWireFormatException {
        if(base64 == null) {
            return null;
        }

        try {
            byte[] bytes = Utils.fromBase64(base64);
            if(bytes.length != KEY_LENGTH) {
                throw new InvalidWireFormatException("Field " + field + " must be " + KEY_LENGTH + " bytes");
            }
            return bytes;
        } catch(IllegalArgumentException e) {
            throw new InvalidWireFormatException("Invalid base64 in field " + field, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SessionFile {
        @JsonProperty("v")
        public Integer version;

        @JsonProperty("sessionId")
        public String sessionId;

        @JsonProperty("role")
        public Role role;

        @JsonProperty("DHs")
        public KeyPairFile dhs;

        @JsonProperty("DHr")
        public String dhr;

        @JsonProperty("RK")
        public String rootKey;

        @JsonProperty("CKs")
        public String sendingChainKey;

        @JsonProperty("CKr")
        public String receivingChainKey;

        @JsonProperty("Ns")
        public int sendingCount;

        @JsonProperty("Nr")
        public int receivingCount;

        @JsonProperty("PN")
        public int previousSendingCount;

        @JsonProperty("HKs")
        public String sendingHeaderKey;

        @JsonProperty("HKr")
        public String receivingHeaderKey;

        @JsonProperty("MKSKIPPED")
        public List<SkippedEntryFile> skippedKeys = new ArrayList<>();

        @JsonProperty("localIdentityKey")
        public String localIdentityKey;

        @JsonProperty("remoteIdentityKey")
        public String remoteIdentityKey;

        @JsonProperty("createdAt")
        public long createdAt;

        @JsonProperty("lastActivity")
        public long lastActivity;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeyPairFile {
        @JsonProperty("publicKey")
        public String publicKey;

        @JsonProperty("privateKey")
        public String privateKey;
    }

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"key", "value"})
    public static class SkippedEntryFile {
        public String key;

        public SkippedKeyFile value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SkippedKeyFile {
        @JsonProperty("messageKey")
        @JsonAlias("mk")
        public String messageKey;

        @JsonProperty("timestamp")
        public long timestamp;
    }
}
