package com.sparrowwallet.vortex.identity;

import java.security.KeyPair;
import java.util.Arrays;

/**
 * The medium-term X25519 pre-key published in bundles, signed over its raw public key with the identity's Ed25519
 * signing key.
 */
public record SignedPreKey(int keyId, KeyPair keyPair, byte[] publicKey, byte[] signature, long timestamp) {
    public SignedPreKey {
        publicKey = Arrays.copyOf(publicKey, publicKey.length);
        signature = Arrays.copyOf(signature, signature.length);
    }

    @Override
    public byte[] publicKey() {
        return Arrays.copyOf(publicKey, publicKey.length);
    }

    @Override
    public byte[] signature() {
        return Arrays.copyOf(signature, signature.length);
    }
}
