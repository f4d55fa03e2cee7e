package com.sparrowwallet.vortex.identity;

import com.sparrowwallet.vortex.Utils;

import java.security.KeyPair;
import java.util.Arrays;

/**
 * A single use X25519 pre-key. Once a handshake has consumed it, it is marked used and never issued again.
 */
public class OneTimePreKey {
    private final int keyId;
    private final KeyPair keyPair;
    private final byte[] publicKey;
    private volatile boolean used;

    public OneTimePreKey(int keyId, KeyPair keyPair, byte[] publicKey, boolean used) {
        this.keyId = keyId;
        this.keyPair = keyPair;
        this.publicKey = Arrays.copyOf(publicKey, publicKey.length);
        this.used = used;
    }

    public int getKeyId() {
        return keyId;
    }

    public KeyPair getKeyPair() {
        return keyPair;
    }

    public byte[] getPublicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    boolean matches(byte[] otherPublicKey) {
        return Utils.constantTimeEquals(publicKey, otherPublicKey);
    }

    public boolean isUsed() {
        return used;
    }

    void markUsed() {
        this.used = true;
    }
}
