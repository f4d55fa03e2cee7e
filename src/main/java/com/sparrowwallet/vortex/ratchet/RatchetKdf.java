package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.Utils;
import com.sparrowwallet.vortex.crypto.RatchetHash;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The key derivation functions of the ratchet: the X3DH shared secret derivation, the root key step (KDF-RK) and the
 * chain key step (KDF-CK). All are pure functions of their inputs.
 */
public class RatchetKdf {
    public static final int KEY_LENGTH = 32;

    private static final byte[] INFO_RATCHET = "VORTEX_RATCHET".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] MESSAGE_KEY_SEED = new byte[] { 0x01 };
    private static final byte[] CHAIN_KEY_SEED = new byte[] { 0x02 };

    private final RatchetHash hash;

    public RatchetKdf(RatchetHash hash) {
        this.hash = hash;
    }

    /**
     * Derives the X3DH shared secret from the concatenated DH outputs, with an all zero salt.
     */
    public byte[] sharedSecret(byte[] dhOutputs) {
        return hash.deriveKeys(dhOutputs, new byte[KEY_LENGTH], INFO_RATCHET, KEY_LENGTH);
    }

    /**
     * KDF-RK: HKDF over the DH output salted with the current root key, split into the next root key, a chain key and
     * a header key.
     */
    public RootStep rootStep(byte[] rootKey, byte[] dhOutput) {
        byte[] derived = hash.deriveKeys(dhOutput, rootKey, INFO_RATCHET, KEY_LENGTH * 3);
        try {
            return new RootStep(Arrays.copyOfRange(derived, 0, KEY_LENGTH),
                    Arrays.copyOfRange(derived, KEY_LENGTH, KEY_LENGTH * 2),
                    Arrays.copyOfRange(derived, KEY_LENGTH * 2, KEY_LENGTH * 3));
        } finally {
            Utils.wipe(derived);
        }
    }

    /**
     * KDF-CK: the message key is the MAC of 0x01 under the chain key, the next chain key the MAC of 0x02.
     */
    public ChainStep chainStep(byte[] chainKey) {
        return new ChainStep(hash.hmac(chainKey, CHAIN_KEY_SEED), hash.hmac(chainKey, MESSAGE_KEY_SEED));
    }

    public record RootStep(byte[] rootKey, byte[] chainKey, byte[] headerKey) {}

    public record ChainStep(byte[] chainKey, byte[] messageKey) {}
}
