package com.sparrowwallet.vortex.identity;

import java.security.KeyPair;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The complete long-term state of a local party: its X25519 identity key pair, the Ed25519 key pair that signs its
 * pre-keys, its registration id, the single active signed pre-key and the pool of one-time pre-keys.
 */
public class IdentityStore {
    private final KeyPair identityKeyPair;
    private final byte[] identityPublicKey;
    private final KeyPair signingKeyPair;
    private final byte[] signingPublicKey;
    private final int registrationId;
    private final long createdAt;
    private final String fingerprint;
    private final List<OneTimePreKey> oneTimePreKeys;
    private volatile SignedPreKey signedPreKey;

    public IdentityStore(KeyPair identityKeyPair, byte[] identityPublicKey, KeyPair signingKeyPair, byte[] signingPublicKey, int registrationId,
                         SignedPreKey signedPreKey, List<OneTimePreKey> oneTimePreKeys, long createdAt, String fingerprint) {
        this.identityKeyPair = identityKeyPair;
        this.identityPublicKey = Arrays.copyOf(identityPublicKey, identityPublicKey.length);
        this.signingKeyPair = signingKeyPair;
        this.signingPublicKey = Arrays.copyOf(signingPublicKey, signingPublicKey.length);
        this.registrationId = registrationId;
        this.signedPreKey = signedPreKey;
        this.oneTimePreKeys = new ArrayList<>(oneTimePreKeys);
        this.createdAt = createdAt;
        this.fingerprint = fingerprint;
    }

    public KeyPair getIdentityKeyPair() {
        return identityKeyPair;
    }

    public byte[] getIdentityPublicKey() {
        return Arrays.copyOf(identityPublicKey, identityPublicKey.length);
    }

    public KeyPair getSigningKeyPair() {
        return signingKeyPair;
    }

    public byte[] getSigningPublicKey() {
        return Arrays.copyOf(signingPublicKey, signingPublicKey.length);
    }

    public int getRegistrationId() {
        return registrationId;
    }

    public SignedPreKey getSignedPreKey() {
        return signedPreKey;
    }

    void setSignedPreKey(SignedPreKey signedPreKey) {
        this.signedPreKey = signedPreKey;
    }

    /**
     * Returns a read-only view of the one-time pre-key pool, ordered by ascending key id.
     */
    public List<OneTimePreKey> getOneTimePreKeys() {
        return Collections.unmodifiableList(oneTimePreKeys);
    }

    List<OneTimePreKey> getMutableOneTimePreKeys() {
        return oneTimePreKeys;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public String getFingerprint() {
        return fingerprint;
    }
}
