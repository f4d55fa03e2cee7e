package com.sparrowwallet.vortex.protocol;

/**
 * Kinds of units carried on the wire, identified by the {@code t} field of the JSON envelope.
 */
public enum MessageKind {
    PREKEY("prekey"),
    MESSAGE("message");

    private final String tag;

    MessageKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static MessageKind fromTag(String tag) throws InvalidWireFormatException {
        for(MessageKind kind : values()) {
            if(kind.tag.equals(tag)) {
                return kind;
            }
        }

        throw new InvalidWireFormatException("Unknown message kind " + tag);
    }
}
