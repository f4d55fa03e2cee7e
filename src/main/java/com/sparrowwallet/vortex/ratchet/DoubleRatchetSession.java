package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.Utils;
import com.sparrowwallet.vortex.crypto.CipherSuite;
import com.sparrowwallet.vortex.crypto.RatchetCipher;
import com.sparrowwallet.vortex.crypto.RatchetKeyAgreement;
import com.sparrowwallet.vortex.protocol.EncryptedMessage;
import com.sparrowwallet.vortex.protocol.InvalidWireFormatException;
import com.sparrowwallet.vortex.protocol.MessageHeader;
import com.sparrowwallet.vortex.protocol.PreKeyBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import java.io.ByteArrayOutputStream;
import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * A Double Ratchet session with a single peer. The session runs X3DH once, as either the initiator
 * ({@link #initializeSender}) or the responder ({@link #initializeReceiver}), and then derives a fresh key for every
 * message it encrypts or decrypts.
 *
 * <p>Decryption is transactional: all state changes are made to a staged copy of the state, which replaces the
 * current state only once the message has authenticated. A call that fails leaves the session unchanged.</p>
 *
 * <p>A session is not thread safe. Callers must not run {@code encrypt} or {@code decrypt} on the same session
 * concurrently; independent sessions may be used from different threads.</p>
 */
public class DoubleRatchetSession {
    private static final Logger log = LoggerFactory.getLogger(DoubleRatchetSession.class);

    private final CipherSuite suite;
    private final ProtocolConfig config;
    private final RatchetKdf kdf;
    private final Clock clock;

    private SessionState state;
    private boolean ready;

    public DoubleRatchetSession(CipherSuite suite, ProtocolConfig config) {
        this(suite, config, UUID.randomUUID().toString());
    }

    public DoubleRatchetSession(CipherSuite suite, ProtocolConfig config, String sessionId) {
        this(suite, config, sessionId, Clock.systemUTC());
    }

    DoubleRatchetSession(CipherSuite suite, ProtocolConfig config, String sessionId, Clock clock) {
        this.suite = suite;
        this.config = config;
        this.kdf = new RatchetKdf(suite.getHash());
        this.clock = clock;
        this.state = new SessionState(sessionId, config.getMaxSkippedKeys(), clock.millis());
    }

    /**
     * Runs the initiator's side of X3DH against the peer's bundle and starts the sending chain. The peer's signed
     * pre-key becomes its first ratchet key.
     *
     * @param localIdentityKeyPair the local X25519 identity key pair
     * @param remoteBundle the peer's bundle, whose signature the caller has verified
     * @return the ephemeral public key to send to the peer and whether the bundle's one-time pre-key was used
     * @throws IllegalArgumentException if a key in the bundle is not a valid X25519 public key
     */
    public SenderInitialization initializeSender(KeyPair localIdentityKeyPair, PreKeyBundle remoteBundle) {
        RatchetKeyAgreement keyAgreement = suite.getKeyAgreement();
        PublicKey remoteIdentityKey = keyAgreement.deserializePublicKey(remoteBundle.getIdentityKey());
        PublicKey remoteSignedPreKey = keyAgreement.deserializePublicKey(remoteBundle.getSignedPreKey());
        Optional<byte[]> oneTimePreKey = remoteBundle.getOneTimePreKey();

        KeyPair ephemeral = keyAgreement.generateKeyPair();
        ByteArrayOutputStream dhOutputs = new ByteArrayOutputStream();
        dhOutputs.writeBytes(keyAgreement.generateSecret(localIdentityKeyPair.getPrivate(), remoteSignedPreKey));
        dhOutputs.writeBytes(keyAgreement.generateSecret(ephemeral.getPrivate(), remoteIdentityKey));
        dhOutputs.writeBytes(keyAgreement.generateSecret(ephemeral.getPrivate(), remoteSignedPreKey));
        if(oneTimePreKey.isPresent()) {
            dhOutputs.writeBytes(keyAgreement.generateSecret(ephemeral.getPrivate(), keyAgreement.deserializePublicKey(oneTimePreKey.get())));
        }

        byte[] ikm = dhOutputs.toByteArray();
        byte[] sharedSecret = kdf.sharedSecret(ikm);
        Utils.wipe(ikm);

        SessionState initialized = newState(Role.INITIATOR);
        initialized.dhs = keyAgreement.generateKeyPair();
        initialized.dhsPublicKey = keyAgreement.serializePublicKey(initialized.dhs.getPublic());
        initialized.dhr = remoteBundle.getSignedPreKey();

        byte[] dhOut = keyAgreement.generateSecret(initialized.dhs.getPrivate(), remoteSignedPreKey);
        RatchetKdf.RootStep step = kdf.rootStep(sharedSecret, dhOut);
        Utils.wipe(dhOut);
        Utils.wipe(sharedSecret);

        initialized.rootKey = step.rootKey();
        initialized.sendingChainKey = step.chainKey();
        initialized.sendingHeaderKey = step.headerKey();
        initialized.localIdentityKey = keyAgreement.serializePublicKey(localIdentityKeyPair.getPublic());
        initialized.remoteIdentityKey = remoteBundle.getIdentityKey();
        commit(initialized);

        if(log.isDebugEnabled()) {
            log.debug("Session " + state.sessionId + " initialized as initiator" + (oneTimePreKey.isPresent() ? " with one-time pre-key" : ""));
        }

        return new SenderInitialization(keyAgreement.serializePublicKey(ephemeral.getPublic()), oneTimePreKey.isPresent());
    }

    /**
     * Runs the responder's side of X3DH. The local signed pre-key pair becomes the first ratchet key pair; the
     * receiving chain starts with the first message from the initiator.
     *
     * @throws IllegalArgumentException if a remote key is not a valid X25519 public key
     */
    public void initializeReceiver(KeyPair localIdentityKeyPair, KeyPair localSignedPreKeyPair, KeyPair localOneTimePreKeyPair,
                                   byte[] remoteIdentityKey, byte[] remoteEphemeralKey) {
        RatchetKeyAgreement keyAgreement = suite.getKeyAgreement();
        PublicKey remoteIdentity = keyAgreement.deserializePublicKey(remoteIdentityKey);
        PublicKey remoteEphemeral = keyAgreement.deserializePublicKey(remoteEphemeralKey);

        ByteArrayOutputStream dhOutputs = new ByteArrayOutputStream();
        dhOutputs.writeBytes(keyAgreement.generateSecret(localSignedPreKeyPair.getPrivate(), remoteIdentity));
        dhOutputs.writeBytes(keyAgreement.generateSecret(localIdentityKeyPair.getPrivate(), remoteEphemeral));
        dhOutputs.writeBytes(keyAgreement.generateSecret(localSignedPreKeyPair.getPrivate(), remoteEphemeral));
        if(localOneTimePreKeyPair != null) {
            dhOutputs.writeBytes(keyAgreement.generateSecret(localOneTimePreKeyPair.getPrivate(), remoteEphemeral));
        }

        byte[] ikm = dhOutputs.toByteArray();
        SessionState initialized = newState(Role.RESPONDER);
        initialized.rootKey = kdf.sharedSecret(ikm);
        Utils.wipe(ikm);

        initialized.dhs = localSignedPreKeyPair;
        initialized.dhsPublicKey = keyAgreement.serializePublicKey(localSignedPreKeyPair.getPublic());
        initialized.localIdentityKey = keyAgreement.serializePublicKey(localIdentityKeyPair.getPublic());
        initialized.remoteIdentityKey = remoteIdentityKey.clone();
        commit(initialized);

        if(log.isDebugEnabled()) {
            log.debug("Session " + state.sessionId + " initialized as responder" + (localOneTimePreKeyPair != null ? " with one-time pre-key" : ""));
        }
    }

    /**
     * Encrypts a message with the next key of the sending chain.
     *
     * @throws NotInitializedException if the session has not been initialized, or is a responder that has not yet
     * received a message
     */
    public EncryptedMessage encrypt(byte[] plaintext) throws NotInitializedException {
        if(!ready) {
            throw new NotInitializedException("Session not initialized");
        }
        if(state.sendingChainKey == null) {
            throw new NotInitializedException("Sending chain is not established until the first message is received");
        }
        if(state.sendingCount == Integer.MAX_VALUE) {
            throw new IllegalStateException("Sending chain exhausted");
        }

        RatchetKdf.ChainStep step = kdf.chainStep(state.sendingChainKey);
        Utils.wipe(state.sendingChainKey);
        state.sendingChainKey = step.chainKey();
        byte[] messageKey = step.messageKey();

        try {
            RatchetCipher cipher = suite.getCipher();
            MessageHeader header = new MessageHeader(state.dhsPublicKey, state.previousSendingCount, state.sendingCount);

            byte[] headerKey = state.sendingHeaderKey != null ? state.sendingHeaderKey : messageKey;
            byte[] headerNonce = suite.randomBytes(cipher.getNonceLength());
            byte[] headerCipher = cipher.encrypt(cipher.buildKey(headerKey), headerNonce, state.localIdentityKey, header.encode());

            byte[] associatedData = Utils.concat(state.localIdentityKey, state.remoteIdentityKey, headerCipher);
            byte[] nonce = suite.randomBytes(cipher.getNonceLength());
            byte[] ciphertext = cipher.encrypt(cipher.buildKey(messageKey), nonce, associatedData, plaintext);

            state.sendingCount++;
            state.lastActivity = clock.millis();
            return new EncryptedMessage(header, headerCipher, headerNonce, ciphertext, nonce);
        } finally {
            Utils.wipe(messageKey);
        }
    }

    /**
     * Decrypts a message, handling out of order delivery and DH ratchet steps.
     *
     * @throws NotInitializedException if the session has not been initialized
     * @throws AuthenticationFailureException if the message does not authenticate, carries an invalid ratchet key or
     * its key has already been used
     * @throws TooManySkippedMessagesException if accepting the message would skip more than the configured maximum
     * number of message keys
     */
    public DecryptResult decrypt(EncryptedMessage message) throws NotInitializedException, AuthenticationFailureException, TooManySkippedMessagesException {
        if(!ready) {
            throw new NotInitializedException("Session not initialized");
        }
        if(message.getNonce().length != suite.getCipher().getNonceLength()) {
            log.warn("Rejected message with malformed nonce in session " + state.sessionId);
            throw new AuthenticationFailureException("Malformed message nonce");
        }

        SessionState staged = state.copy();
        try {
            return decrypt(staged, message, clock.millis());
        } catch(AuthenticationFailureException | TooManySkippedMessagesException e) {
            staged.wipe();
            throw e;
        }
    }

    private DecryptResult decrypt(SessionState staged, EncryptedMessage message, long now) throws AuthenticationFailureException, TooManySkippedMessagesException {
        MessageHeader header = message.getHeader();
        byte[] ratchetKey = header.getDh();

        Optional<byte[]> skippedKey = staged.skippedKeys.take(ratchetKey, header.getN());
        if(skippedKey.isPresent()) {
            byte[] plaintext = decryptWithKey(staged, message, skippedKey.get());
            staged.lastActivity = now;
            commit(staged);
            if(log.isDebugEnabled()) {
                log.debug("Session " + state.sessionId + " decrypted skipped message " + header.getN() + ", " + state.skippedKeys.size() + " skipped keys remain");
            }
            return new DecryptResult(plaintext, DecryptResult.Kind.OUT_OF_ORDER, header);
        }

        DecryptResult.Kind kind = DecryptResult.Kind.IN_ORDER;
        if(staged.dhr == null || !Utils.constantTimeEquals(ratchetKey, staged.dhr)) {
            skipMessageKeys(staged, header.getPn(), now);
            dhRatchet(staged, ratchetKey);
            kind = DecryptResult.Kind.RATCHET_STEP;
        } else if(header.getN() < staged.receivingCount) {
            log.warn("Rejected replayed or expired message " + header.getN() + " in session " + state.sessionId);
            throw new AuthenticationFailureException("Message key has already been used");
        }

        skipMessageKeys(staged, header.getN(), now);

        RatchetKdf.ChainStep step = kdf.chainStep(staged.receivingChainKey);
        Utils.wipe(staged.receivingChainKey);
        staged.receivingChainKey = step.chainKey();
        staged.receivingCount++;

        byte[] plaintext = decryptWithKey(staged, message, step.messageKey());
        staged.lastActivity = now;
        commit(staged);

        if(kind == DecryptResult.Kind.RATCHET_STEP && log.isDebugEnabled()) {
            log.debug("Session " + state.sessionId + " performed DH ratchet step, previous chain length " + header.getPn());
        }

        return new DecryptResult(plaintext, kind, header);
    }

    private byte[] decryptWithKey(SessionState staged, EncryptedMessage message, byte[] messageKey) throws AuthenticationFailureException {
        RatchetCipher cipher = suite.getCipher();
        byte[] associatedData = Utils.concat(staged.remoteIdentityKey, staged.localIdentityKey, message.getHeaderCipher());

        try {
            return cipher.decrypt(cipher.buildKey(messageKey), message.getNonce(), associatedData, message.getCiphertext());
        } catch(AEADBadTagException e) {
            log.warn("Message failed authentication in session " + state.sessionId);
            throw new AuthenticationFailureException("Message failed authentication", e);
        } finally {
            Utils.wipe(messageKey);
        }
    }

    private void skipMessageKeys(SessionState staged, int until, long now) throws TooManySkippedMessagesException {
        if((long)staged.receivingCount + config.getMaxSkip() < until) {
            log.warn("Rejected message " + until + " in session " + state.sessionId + ", more than " + config.getMaxSkip() + " skipped messages");
            throw new TooManySkippedMessagesException("Too many skipped messages");
        }

        if(staged.receivingChainKey == null) {
            return;
        }

        int evicted = 0;
        while(staged.receivingCount < until) {
            RatchetKdf.ChainStep step = kdf.chainStep(staged.receivingChainKey);
            Utils.wipe(staged.receivingChainKey);
            staged.receivingChainKey = step.chainKey();
            evicted += staged.skippedKeys.put(SkippedMessageKeys.keyFor(staged.dhr, staged.receivingCount), step.messageKey(), now);
            staged.receivingCount++;
        }

        if(evicted > 0 && log.isDebugEnabled()) {
            log.debug("Session " + state.sessionId + " evicted " + evicted + " oldest skipped message keys");
        }
    }

    private void dhRatchet(SessionState staged, byte[] ratchetKey) throws AuthenticationFailureException {
        RatchetKeyAgreement keyAgreement = suite.getKeyAgreement();

        byte[] receivingDhOut;
        PublicKey remoteRatchetKey;
        try {
            remoteRatchetKey = keyAgreement.deserializePublicKey(ratchetKey);
            receivingDhOut = keyAgreement.generateSecret(staged.dhs.getPrivate(), remoteRatchetKey);
        } catch(IllegalArgumentException e) {
            log.warn("Rejected invalid ratchet key in session " + state.sessionId);
            throw new AuthenticationFailureException("Invalid ratchet key", e);
        }

        staged.previousSendingCount = staged.sendingCount;
        staged.sendingCount = 0;
        staged.receivingCount = 0;
        staged.dhr = ratchetKey.clone();

        RatchetKdf.RootStep receiving = kdf.rootStep(staged.rootKey, receivingDhOut);
        Utils.wipe(receivingDhOut);
        replaceRootKey(staged, receiving.rootKey());
        Utils.wipe(staged.receivingChainKey);
        staged.receivingChainKey = receiving.chainKey();
        Utils.wipe(staged.receivingHeaderKey);
        staged.receivingHeaderKey = receiving.headerKey();

        staged.dhs = keyAgreement.generateKeyPair();
        staged.dhsPublicKey = keyAgreement.serializePublicKey(staged.dhs.getPublic());

        byte[] sendingDhOut = keyAgreement.generateSecret(staged.dhs.getPrivate(), remoteRatchetKey);
        RatchetKdf.RootStep sending = kdf.rootStep(staged.rootKey, sendingDhOut);
        Utils.wipe(sendingDhOut);
        replaceRootKey(staged, sending.rootKey());
        Utils.wipe(staged.sendingChainKey);
        staged.sendingChainKey = sending.chainKey();
        Utils.wipe(staged.sendingHeaderKey);
        staged.sendingHeaderKey = sending.headerKey();
    }

    private static void replaceRootKey(SessionState staged, byte[] rootKey) {
        Utils.wipe(staged.rootKey);
        staged.rootKey = rootKey;
    }

    /**
     * Deletes skipped message keys older than the configured maximum age.
     *
     * @return the number of keys deleted
     */
    public int cleanupSkippedKeys() {
        return cleanupSkippedKeys(config.getSkippedKeyMaxAgeMs());
    }

    /**
     * Deletes skipped message keys cached more than {@code maxAgeMs} milliseconds ago.
     *
     * @return the number of keys deleted
     */
    public int cleanupSkippedKeys(long maxAgeMs) {
        int removed = state.skippedKeys.removeOlderThan(clock.millis() - maxAgeMs);
        if(removed > 0 && log.isDebugEnabled()) {
            log.debug("Session " + state.sessionId + " deleted " + removed + " expired skipped message keys");
        }

        return removed;
    }

    /**
     * Serializes the full session state, including private key material, to a versioned JSON document.
     *
     * @throws NotInitializedException if the session has not been initialized
     */
    public String exportState() throws NotInitializedException {
        if(!ready) {
            throw new NotInitializedException("Session not initialized");
        }

        return new SessionStateSerializer(suite, config).serialize(state);
    }

    /**
     * Replaces this session's state with one previously produced by {@link #exportState()}. The session is ready
     * afterwards. On failure the current state is left unchanged.
     */
    public void importState(String json) throws InvalidWireFormatException {
        SessionState imported = new SessionStateSerializer(suite, config).deserialize(json);
        commit(imported);
    }

    /**
     * Zeroizes all key material held by this session and returns it to the uninitialized state.
     */
    public void destroy() {
        String sessionId = state.sessionId;
        state.wipe();
        state = new SessionState(sessionId, config.getMaxSkippedKeys(), clock.millis());
        ready = false;
        if(log.isDebugEnabled()) {
            log.debug("Session " + sessionId + " destroyed");
        }
    }

    private SessionState newState(Role role) {
        SessionState newState = new SessionState(state.sessionId, config.getMaxSkippedKeys(), clock.millis());
        newState.role = role;
        return newState;
    }

    private void commit(SessionState next) {
        SessionState previous = state;
        state = next;
        ready = true;
        if(previous != next) {
            previous.wipe();
        }
    }

    public String getSessionId() {
        return state.sessionId;
    }

    public boolean isReady() {
        return ready;
    }

    public Optional<Role> getRole() {
        return Optional.ofNullable(state.role);
    }

    public long getCreatedAt() {
        return state.createdAt;
    }

    public long getLastActivity() {
        return state.lastActivity;
    }

    /**
     * Returns the live state for inspection. Callers must not retain it across calls that mutate the session.
     */
    public SessionState getState() {
        return state;
    }
}
