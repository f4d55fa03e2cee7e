package com.sparrowwallet.vortex.protocol;

import java.util.Arrays;

/**
 * A single ratchet message as produced by encrypt and consumed by decrypt. The header travels in the clear so that
 * the receiver can select the message key, and encrypted under the sending header key. The header ciphertext is bound
 * into the associated data of the body.
 */
public final class EncryptedMessage implements WireMessage {
    private final MessageHeader header;
    private final byte[] headerCipher;
    private final byte[] headerNonce;
    private final byte[] ciphertext;
    private final byte[] nonce;

    public EncryptedMessage(MessageHeader header, byte[] headerCipher, byte[] headerNonce, byte[] ciphertext, byte[] nonce) {
        if(header == null || headerCipher == null || headerNonce == null || ciphertext == null || nonce == null) {
            throw new IllegalArgumentException("All message fields are required");
        }

        this.header = header;
        this.headerCipher = Arrays.copyOf(headerCipher, headerCipher.length);
        this.headerNonce = Arrays.copyOf(headerNonce, headerNonce.length);
        this.ciphertext = Arrays.copyOf(ciphertext, ciphertext.length);
        this.nonce = Arrays.copyOf(nonce, nonce.length);
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.MESSAGE;
    }

    public MessageHeader getHeader() {
        return header;
    }

    public byte[] getHeaderCipher() {
        return Arrays.copyOf(headerCipher, headerCipher.length);
    }

    public byte[] getHeaderNonce() {
        return Arrays.copyOf(headerNonce, headerNonce.length);
    }

    public byte[] getCiphertext() {
        return Arrays.copyOf(ciphertext, ciphertext.length);
    }

    public byte[] getNonce() {
        return Arrays.copyOf(nonce, nonce.length);
    }
}
