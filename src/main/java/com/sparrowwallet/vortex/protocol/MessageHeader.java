package com.sparrowwallet.vortex.protocol;

import com.sparrowwallet.vortex.Utils;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * The ratchet header of a message: the sender's current ratchet public key, the length of its previous sending chain
 * and the number of this message in the current chain.
 */
public final class MessageHeader {
    public static final int DH_LENGTH = 32;
    public static final int ENCODED_LENGTH = DH_LENGTH + 4 + 4;

    private final byte[] dh;
    private final int pn;
    private final int n;

    public MessageHeader(byte[] dh, int pn, int n) {
        if(dh == null || dh.length != DH_LENGTH) {
            throw new IllegalArgumentException("Ratchet public key must be " + DH_LENGTH + " bytes");
        }
        if(pn < 0 || n < 0) {
            throw new IllegalArgumentException("Message counters must not be negative");
        }

        this.dh = Arrays.copyOf(dh, dh.length);
        this.pn = pn;
        this.n = n;
    }

    public byte[] getDh() {
        return Arrays.copyOf(dh, dh.length);
    }

    public int getPn() {
        return pn;
    }

    public int getN() {
        return n;
    }

    /**
     * Encodes the header as {@code dh || pn || n}, counters as unsigned 32 bit big endian integers.
     */
    public byte[] encode() {
        return ByteBuffer.allocate(ENCODED_LENGTH).put(dh).putInt(pn).putInt(n).array();
    }

    public static MessageHeader decode(byte[] encoded) throws InvalidWireFormatException {
        if(encoded == null || encoded.length != ENCODED_LENGTH) {
            throw new InvalidWireFormatException("Encoded header must be " + ENCODED_LENGTH + " bytes");
        }

        ByteBuffer buffer = ByteBuffer.wrap(encoded);
        byte[] dh = new byte[DH_LENGTH];
        buffer.get(dh);
        int pn = buffer.getInt();
        int n = buffer.getInt();
        if(pn < 0 || n < 0) {
            throw new InvalidWireFormatException("Message counter out of range");
        }

        return new MessageHeader(dh, pn, n);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(o == null || getClass() != o.getClass()) {
            return false;
        }
        MessageHeader that = (MessageHeader)o;
        return pn == that.pn && n == that.n && Arrays.equals(dh, that.dh);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(pn, n) + Arrays.hashCode(dh);
    }

    @Override
    public String toString() {
        return "MessageHeader{dh=" + Utils.toBase64(dh) + ", pn=" + pn + ", n=" + n + "}";
    }
}
