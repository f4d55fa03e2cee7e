package com.sparrowwallet.vortex.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowwallet.vortex.Utils;

/**
 * JSON encoding of the units exchanged between peers. Byte fields are URL-safe base64 without padding. Messages travel
 * in an envelope whose {@code t} field names the {@link MessageKind}.
 */
public class WireCodec {
    private static final int KEY_LENGTH = 32;

    private final ObjectMapper mapper = new ObjectMapper();

    public String encode(WireMessage message) {
        Object envelope = switch(message.getKind()) {
            case PREKEY -> toEnvelope((PreKeyMessage)message);
            case MESSAGE -> toEnvelope((EncryptedMessage)message);
        };

        return write(envelope);
    }

    public WireMessage decode(String json) throws InvalidWireFormatException {
        JsonNode node = readTree(json);
        JsonNode kindNode = node.get("t");
        if(kindNode == null || !kindNode.isTextual()) {
            throw new InvalidWireFormatException("Missing message kind");
        }

        MessageKind kind = MessageKind.fromTag(kindNode.asText());
        return switch(kind) {
            case PREKEY -> fromEnvelope(treeToValue(node, PreKeyMessageEnvelope.class));
            case MESSAGE -> fromEnvelope(treeToValue(node, MessageEnvelope.class));
        };
    }

    public EncryptedMessage decodeMessage(String json) throws InvalidWireFormatException {
        WireMessage message = decode(json);
        if(message instanceof EncryptedMessage encryptedMessage) {
            return encryptedMessage;
        }

        throw new InvalidWireFormatException("Expected " + MessageKind.MESSAGE.getTag() + " but received " + message.getKind().getTag());
    }

    public PreKeyMessage decodePreKeyMessage(String json) throws InvalidWireFormatException {
        WireMessage message = decode(json);
        if(message instanceof PreKeyMessage preKeyMessage) {
            return preKeyMessage;
        }

        throw new InvalidWireFormatException("Expected " + MessageKind.PREKEY.getTag() + " but received " + message.getKind().getTag());
    }

    public String encodeBundle(PreKeyBundle bundle) {
        BundleFile file = new BundleFile();
        file.identityKey = Utils.toBase64(bundle.getIdentityKey());
        file.signedPreKey = Utils.toBase64(bundle.getSignedPreKey());
        file.signedPreKeySig = Utils.toBase64(bundle.getSignedPreKeySig());
        file.oneTimePreKey = bundle.getOneTimePreKey().map(Utils::toBase64).orElse(null);
        file.registrationId = bundle.getRegistrationId();
        file.signingKey = bundle.getSigningKey().map(Utils::toBase64).orElse(null);
        return write(file);
    }

    public PreKeyBundle decodeBundle(String json) throws InvalidWireFormatException {
        BundleFile file = treeToValue(readTree(json), BundleFile.class);
        if(file.registrationId == null) {
            throw new InvalidWireFormatException("Missing registrationId");
        }

        return new PreKeyBundle(key(file.identityKey, "identityKey"),
                key(file.signedPreKey, "signedPreKey"),
                bytes(file.signedPreKeySig, "signedPreKeySig"),
                file.oneTimePreKey == null ? null : key(file.oneTimePreKey, "oneTimePreKey"),
                file.registrationId,
                file.signingKey == null ? null : key(file.signingKey, "signingKey"));
    }

    private MessageEnvelope toEnvelope(EncryptedMessage message) {
        MessageEnvelope envelope = new MessageEnvelope();
        envelope.t = MessageKind.MESSAGE.getTag();
        envelope.header = new HeaderFile();
        envelope.header.dh = Utils.toBase64(message.getHeader().getDh());
        envelope.header.pn = Integer.toUnsignedLong(message.getHeader().getPn());
        envelope.header.n = Integer.toUnsignedLong(message.getHeader().getN());
        envelope.headerCipher = Utils.toBase64(message.getHeaderCipher());
        envelope.headerNonce = Utils.toBase64(message.getHeaderNonce());
        envelope.ciphertext = Utils.toBase64(message.getCiphertext());
        envelope.nonce = Utils.toBase64(message.getNonce());
        return envelope;
    }

    private PreKeyMessageEnvelope toEnvelope(PreKeyMessage message) {
        PreKeyMessageEnvelope envelope = new PreKeyMessageEnvelope();
        envelope.t = MessageKind.PREKEY.getTag();
        envelope.registrationId = message.getRegistrationId();
        envelope.identityKey = Utils.toBase64(message.getIdentityKey());
        envelope.ephemeralKey = Utils.toBase64(message.getEphemeralKey());
        envelope.signedPreKey = Utils.toBase64(message.getSignedPreKey());
        envelope.oneTimePreKey = message.getOneTimePreKey().map(Utils::toBase64).orElse(null);
        envelope.message = toEnvelope(message.getMessage());
        return envelope;
    }

    private EncryptedMessage fromEnvelope(MessageEnvelope envelope) throws InvalidWireFormatException {
        if(envelope.header == null || envelope.header.pn == null || envelope.header.n == null) {
            throw new InvalidWireFormatException("Missing message header");
        }
        if(envelope.header.pn < 0 || envelope.header.pn > Integer.MAX_VALUE || envelope.header.n < 0 || envelope.header.n > Integer.MAX_VALUE) {
            throw new InvalidWireFormatException("Message counter out of range");
        }

        MessageHeader header = new MessageHeader(key(envelope.header.dh, "header.dh"), envelope.header.pn.intValue(), envelope.header.n.intValue());
        return new EncryptedMessage(header,
                bytes(envelope.headerCipher, "headerCipher"),
                bytes(envelope.headerNonce, "headerNonce"),
                bytes(envelope.ciphertext, "ciphertext"),
                bytes(envelope.nonce, "nonce"));
    }

    private PreKeyMessage fromEnvelope(PreKeyMessageEnvelope envelope) throws InvalidWireFormatException {
        if(envelope.registrationId == null) {
            throw new InvalidWireFormatException("Missing registrationId");
        }
        if(envelope.message == null) {
            throw new InvalidWireFormatException("Missing initial message");
        }

        return new PreKeyMessage(envelope.registrationId,
                key(envelope.identityKey, "identityKey"),
                key(envelope.ephemeralKey, "ephemeralKey"),
                key(envelope.signedPreKey, "signedPreKey"),
                envelope.oneTimePreKey == null ? null : key(envelope.oneTimePreKey, "oneTimePreKey"),
                fromEnvelope(envelope.message));
    }

    private static byte[] key(String base64, String field) throws InvalidWireFormatException {
        byte[] key = bytes(base64, field);
        if(key.length != KEY_LENGTH) {
            throw new InvalidWireFormatException("Field " + field + " must be " + KEY_LENGTH + " bytes");
        }

        return key;
    }

    private static byte[] bytes(String base64, String field) throws InvalidWireFormatException {
        if(base64 == null) {
            throw new InvalidWireFormatException("Missing field " + field);
        }

        try {
            return Utils.fromBase64(base64);
        } catch(IllegalArgumentException e) {
            throw new InvalidWireFormatException("Invalid base64 in field " + field, e);
        }
    }

    private JsonNode readTree(String json) throws InvalidWireFormatException {
        try {
            JsonNode node = mapper.readTree(json);
            if(node == null || !node.isObject()) {
                throw new InvalidWireFormatException("Expected a JSON object");
            }
            return node;
        } catch(JsonProcessingException e) {
            throw new InvalidWireFormatException("Invalid JSON", e);
        }
    }

    private <T> T treeToValue(JsonNode node, Class<T> type) throws InvalidWireFormatException {
        try {
            return mapper.treeToValue(node, type);
        } catch(JsonProcessingException e) {
            throw new InvalidWireFormatException("Invalid " + type.getSimpleName(), e);
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch(JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BundleFile {
        @JsonProperty("identityKey")
        public String identityKey;

        @JsonProperty("signedPreKey")
        public String signedPreKey;

        @JsonProperty("signedPreKeySig")
        public String signedPreKeySig;

        @JsonProperty("oneTimePreKey")
        public String oneTimePreKey;

        @JsonProperty("registrationId")
        public Integer registrationId;

        @JsonProperty("signingKey")
        public String signingKey;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HeaderFile {
        @JsonProperty("dh")
        public String dh;

        @JsonProperty("pn")
        public Long pn;

        @JsonProperty("n")
        public Long n;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageEnvelope {
        @JsonProperty("t")
        public String t;

        @JsonProperty("header")
        public HeaderFile header;

        @JsonProperty("headerCipher")
        public String headerCipher;

        @JsonProperty("headerNonce")
        public String headerNonce;

        @JsonProperty("ciphertext")
        public String ciphertext;

        @JsonProperty("nonce")
        public String nonce;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PreKeyMessageEnvelope {
        @JsonProperty("t")
        public String t;

        @JsonProperty("registrationId")
        public Integer registrationId;

        @JsonProperty("identityKey")
        public String identityKey;

        @JsonProperty("ephemeralKey")
        public String ephemeralKey;

        @JsonProperty("signedPreKey")
        public String signedPreKey;

        @JsonProperty("oneTimePreKey")
        public String oneTimePreKey;

        @JsonProperty("message")
        public MessageEnvelope message;
    }
}
