package com.sparrowwallet.vortex.ratchet;

import java.util.Arrays;

/**
 * The outcome of initializing the sending side of a session: the ephemeral public key the peer needs to complete the
 * handshake, and whether the peer's one-time pre-key was consumed.
 */
public record SenderInitialization(byte[] ephemeralPublicKey, boolean usedOneTimePreKey) {
    @Override
    public byte[] ephemeralPublicKey() {
        return Arrays.copyOf(ephemeralPublicKey, ephemeralPublicKey.length);
    }
}
