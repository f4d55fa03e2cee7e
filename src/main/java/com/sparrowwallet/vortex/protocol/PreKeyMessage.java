package com.sparrowwallet.vortex.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * The first message of a session: the initiator's X3DH public material together with its first ratchet message.
 */
public final class PreKeyMessage implements WireMessage {
    private final int registrationId;
    private final byte[] identityKey;
    private final byte[] ephemeralKey;
    private final byte[] signedPreKey;
    private final byte[] oneTimePreKey;
    private final EncryptedMessage message;

    public PreKeyMessage(int registrationId, byte[] identityKey, byte[] ephemeralKey, byte[] signedPreKey, byte[] oneTimePreKey, EncryptedMessage message) {
        if(identityKey == null || ephemeralKey == null || signedPreKey == null || message == null) {
            throw new IllegalArgumentException("Identity key, ephemeral key, signed pre-key and message are required");
        }

        this.registrationId = registrationId;
        this.identityKey = Arrays.copyOf(identityKey, identityKey.length);
        this.ephemeralKey = Arrays.copyOf(ephemeralKey, ephemeralKey.length);
        this.signedPreKey = Arrays.copyOf(signedPreKey, signedPreKey.length);
        this.oneTimePreKey = oneTimePreKey == null ? null : Arrays.copyOf(oneTimePreKey, oneTimePreKey.length);
        this.message = message;
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.PREKEY;
    }

    public int getRegistrationId() {
        return registrationId;
    }

    public byte[] getIdentityKey() {
        return Arrays.copyOf(identityKey, identityKey.length);
    }

    public byte[] getEphemeralKey() {
        return Arrays.copyOf(ephemeralKey, ephemeralKey.length);
    }

    /**
     * The recipient's signed pre-key the initiator ran X3DH against.
     */
    public byte[] getSignedPreKey() {
        return Arrays.copyOf(signedPreKey, signedPreKey.length);
    }

    public Optional<byte[]> getOneTimePreKey() {
        return Optional.ofNullable(oneTimePreKey).map(key -> Arrays.copyOf(key, key.length));
    }

    public EncryptedMessage getMessage() {
        return message;
    }
}
