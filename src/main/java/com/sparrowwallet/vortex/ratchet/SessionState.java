package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.Utils;

import java.security.KeyPair;

/**
 * The complete mutable state of one Double Ratchet relationship. Fields are manipulated by
 * {@link DoubleRatchetSession} only; the public accessors exist for inspection and return copies.
 */
public class SessionState {
    KeyPair dhs;
    byte[] dhsPublicKey;
    byte[] dhr;
    byte[] rootKey;
    byte[] sendingChainKey;
    byte[] receivingChainKey;
    int sendingCount;
    int receivingCount;
    int previousSendingCount;
    byte[] sendingHeaderKey;
    byte[] receivingHeaderKey;
    SkippedMessageKeys skippedKeys;
    byte[] localIdentityKey;
    byte[] remoteIdentityKey;
    String sessionId;
    Role role;
    long createdAt;
    long lastActivity;

    SessionState(String sessionId, int maxSkippedKeys, long now) {
        this.sessionId = sessionId;
        this.skippedKeys = new SkippedMessageKeys(maxSkippedKeys);
        this.createdAt = now;
        this.lastActivity = now;
    }

    /**
     * Returns a deep copy whose byte arrays share nothing with this state. Key pairs are immutable and shared.
     */
    SessionState copy() {
        SessionState copy = new SessionState(sessionId, 0, createdAt);
        copy.dhs = dhs;
        copy.dhsPublicKey = clone(dhsPublicKey);
        copy.dhr = clone(dhr);
        copy.rootKey = clone(rootKey);
        copy.sendingChainKey = clone(sendingChainKey);
        copy.receivingChainKey = clone(receivingChainKey);
        copy.sendingCount = sendingCount;
        copy.receivingCount = receivingCount;
        copy.previousSendingCount = previousSendingCount;
        copy.sendingHeaderKey = clone(sendingHeaderKey);
        copy.receivingHeaderKey = clone(receivingHeaderKey);
        copy.skippedKeys = skippedKeys.copy();
        copy.localIdentityKey = clone(localIdentityKey);
        copy.remoteIdentityKey = clone(remoteIdentityKey);
        copy.role = role;
        copy.lastActivity = lastActivity;
        return copy;
    }

    /**
     * Zeroizes all symmetric key material and drops the ratchet key pair.
     */
    void wipe() {
        dhs = null;
        Utils.wipe(rootKey);
        Utils.wipe(sendingChainKey);
        Utils.wipe(receivingChainKey);
        Utils.wipe(sendingHeaderKey);
        Utils.wipe(receivingHeaderKey);
        skippedKeys.wipe();
    }

    private static byte[] clone(byte[] bytes) {
        return bytes == null ? null : bytes.clone();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Role getRole() {
        return role;
    }

    public byte[] getSendingRatchetKey() {
        return clone(dhsPublicKey);
    }

    public byte[] getReceivingRatchetKey() {
        return clone(dhr);
    }

    public byte[] getRootKey() {
        return clone(rootKey);
    }

    public byte[] getSendingChainKey() {
        return clone(sendingChainKey);
    }

    public byte[] getReceivingChainKey() {
        return clone(receivingChainKey);
    }

    public int getSendingCount() {
        return sendingCount;
    }

    public int getReceivingCount() {
        return receivingCount;
    }

    public int getPreviousSendingCount() {
        return previousSendingCount;
    }

    public int getSkippedKeyCount() {
        return skippedKeys.size();
    }

    public byte[] getLocalIdentityKey() {
        return clone(localIdentityKey);
    }

    public byte[] getRemoteIdentityKey() {
        return clone(remoteIdentityKey);
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastActivity() {
        return lastActivity;
    }
}
