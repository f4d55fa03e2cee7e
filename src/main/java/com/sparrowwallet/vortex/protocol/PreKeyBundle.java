package com.sparrowwallet.vortex.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * A snapshot of a peer's public handshake material, sufficient to start a session with them without interaction.
 * The one-time pre-key is optional and single use.
 */
public final class PreKeyBundle {
    private final byte[] identityKey;
    private final byte[] signedPreKey;
    private final byte[] signedPreKeySig;
    private final byte[] oneTimePreKey;
    private final int registrationId;
    private final byte[] signingKey;

    public PreKeyBundle(byte[] identityKey, byte[] signedPreKey, byte[] signedPreKeySig, byte[] oneTimePreKey, int registrationId, byte[] signingKey) {
        if(identityKey == null || signedPreKey == null || signedPreKeySig == null) {
            throw new IllegalArgumentException("Identity key, signed pre-key and signature are required");
        }

        this.identityKey = Arrays.copyOf(identityKey, identityKey.length);
        this.signedPreKey = Arrays.copyOf(signedPreKey, signedPreKey.length);
        this.signedPreKeySig = Arrays.copyOf(signedPreKeySig, signedPreKeySig.length);
        this.oneTimePreKey = oneTimePreKey == null ? null : Arrays.copyOf(oneTimePreKey, oneTimePreKey.length);
        this.registrationId = registrationId;
        this.signingKey = signingKey == null ? null : Arrays.copyOf(signingKey, signingKey.length);
    }

    public byte[] getIdentityKey() {
        return Arrays.copyOf(identityKey, identityKey.length);
    }

    public byte[] getSignedPreKey() {
        return Arrays.copyOf(signedPreKey, signedPreKey.length);
    }

    public byte[] getSignedPreKeySig() {
        return Arrays.copyOf(signedPreKeySig, signedPreKeySig.length);
    }

    public Optional<byte[]> getOneTimePreKey() {
        return Optional.ofNullable(oneTimePreKey).map(key -> Arrays.copyOf(key, key.length));
    }

    public int getRegistrationId() {
        return registrationId;
    }

    /**
     * The Ed25519 key that signed the signed pre-key, when the issuer published it alongside the bundle. A key taken
     * from the bundle itself only proves consistency; callers that need trust must obtain it from a verified source.
     */
    public Optional<byte[]> getSigningKey() {
        return Optional.ofNullable(signingKey).map(key -> Arrays.copyOf(key, key.length));
    }

    /**
     * Returns a copy of this bundle with a different signed pre-key signature.
     */
    public PreKeyBundle withSignedPreKeySig(byte[] signature) {
        return new PreKeyBundle(identityKey, signedPreKey, signature, oneTimePreKey, registrationId, signingKey);
    }

    /**
     * Returns a copy of this bundle that carries no one-time pre-key.
     */
    public PreKeyBundle withoutOneTimePreKey() {
        return new PreKeyBundle(identityKey, signedPreKey, signedPreKeySig, null, registrationId, signingKey);
    }
}
