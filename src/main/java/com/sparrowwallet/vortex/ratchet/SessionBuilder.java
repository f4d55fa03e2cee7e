package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.Utils;
import com.sparrowwallet.vortex.identity.IdentityManager;
import com.sparrowwallet.vortex.identity.IdentityStore;
import com.sparrowwallet.vortex.identity.OneTimePreKey;
import com.sparrowwallet.vortex.identity.SignedPreKey;
import com.sparrowwallet.vortex.protocol.EncryptedMessage;
import com.sparrowwallet.vortex.protocol.PreKeyBundle;
import com.sparrowwallet.vortex.protocol.PreKeyMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyPair;
import java.util.Optional;

/**
 * Establishes sessions between a local identity and its peers. The initiator verifies a bundle, runs X3DH and
 * produces a {@link PreKeyMessage} carrying its first message. The responder resolves the pre-keys that message
 * names, runs its side of X3DH and decrypts the first message. A one-time pre-key is marked used only once that first
 * message has authenticated, and atomically, so of several concurrent accepts naming the same key only one succeeds.
 */
public class SessionBuilder {
    private static final Logger log = LoggerFactory.getLogger(SessionBuilder.class);

    private final IdentityManager identityManager;
    private final ProtocolConfig config;

    public SessionBuilder(IdentityManager identityManager, ProtocolConfig config) {
        this.identityManager = identityManager;
        this.config = config;
    }

    /**
     * Starts a session against a bundle whose signed pre-key must verify under the given signing key. The signing key
     * must come from a trusted source, not from the bundle itself.
     *
     * @throws InvalidBundleSignatureException if the bundle's signature does not verify, or one of its keys is invalid
     * @throws IllegalStateException if the local identity has not been generated
     */
    public Outgoing initiate(PreKeyBundle bundle, byte[] signingPublicKey, byte[] firstPlaintext) throws InvalidBundleSignatureException {
        if(!identityManager.verifyPreKeyBundle(bundle, signingPublicKey)) {
            throw new InvalidBundleSignatureException("Pre-key bundle signature is invalid");
        }

        IdentityStore store = identityManager.getStore().orElseThrow(() -> new IllegalStateException("Identity not initialized"));
        DoubleRatchetSession session = new DoubleRatchetSession(identityManager.getCipherSuite(), config);

        SenderInitialization initialization;
        try {
            initialization = session.initializeSender(store.getIdentityKeyPair(), bundle);
        } catch(IllegalArgumentException e) {
            throw new InvalidBundleSignatureException("Pre-key bundle contains an invalid key", e);
        }

        EncryptedMessage message;
        try {
            message = session.encrypt(firstPlaintext);
        } catch(NotInitializedException e) {
            throw new IllegalStateException("Initiator session has no sending chain", e);
        }

        PreKeyMessage preKeyMessage = new PreKeyMessage(store.getRegistrationId(), store.getIdentityPublicKey(), initialization.ephemeralPublicKey(),
                bundle.getSignedPreKey(), bundle.getOneTimePreKey().orElse(null), message);

        log.info("Initiated session " + session.getSessionId() + " with registration id " + bundle.getRegistrationId());
        return new Outgoing(session, preKeyMessage);
    }

    /**
     * Accepts a session started by a peer and decrypts its first message.
     *
     * @throws UnknownPreKeyException if there is no local identity, the signed pre-key is no longer the active one, or
     * the one-time pre-key is unknown or already used
     * @throws AuthenticationFailureException if the handshake keys are invalid or the first message does not
     * authenticate
     * @throws TooManySkippedMessagesException if the first message claims too many earlier messages
     */
    public Incoming accept(PreKeyMessage preKeyMessage) throws UnknownPreKeyException, AuthenticationFailureException, TooManySkippedMessagesException {
        IdentityStore store = identityManager.getStore().orElseThrow(() -> new UnknownPreKeyException("No local identity"));

        SignedPreKey signedPreKey = store.getSignedPreKey();
        if(!Utils.constantTimeEquals(signedPreKey.publicKey(), preKeyMessage.getSignedPreKey())) {
            log.warn("Rejected session from registration id " + preKeyMessage.getRegistrationId() + " against an inactive signed pre-key");
            throw new UnknownPreKeyException("Signed pre-key is not the active signed pre-key");
        }

        KeyPair oneTimePreKeyPair = null;
        Optional<byte[]> oneTimePreKeyPublic = preKeyMessage.getOneTimePreKey();
        if(oneTimePreKeyPublic.isPresent()) {
            OneTimePreKey oneTimePreKey = identityManager.getOneTimePreKey(oneTimePreKeyPublic.get())
                    .orElseThrow(() -> new UnknownPreKeyException("Unknown one-time pre-key"));
            if(oneTimePreKey.isUsed()) {
                log.warn("Rejected session reusing one-time pre-key " + oneTimePreKey.getKeyId());
                throw new UnknownPreKeyException("One-time pre-key has already been used");
            }
            oneTimePreKeyPair = oneTimePreKey.getKeyPair();
        }

        DoubleRatchetSession session = new DoubleRatchetSession(identityManager.getCipherSuite(), config);
        try {
            session.initializeReceiver(store.getIdentityKeyPair(), signedPreKey.keyPair(), oneTimePreKeyPair,
                    preKeyMessage.getIdentityKey(), preKeyMessage.getEphemeralKey());
        } catch(IllegalArgumentException e) {
            throw new AuthenticationFailureException("Invalid handshake key", e);
        }

        DecryptResult result;
        try {
            result = session.decrypt(preKeyMessage.getMessage());
        } catch(NotInitializedException e) {
            throw new IllegalStateException("Responder session was not initialized", e);
        }

        if(oneTimePreKeyPublic.isPresent() && !identityManager.markOneTimePreKeyUsed(oneTimePreKeyPublic.get())) {
            session.destroy();
            log.warn("Rejected session from registration id " + preKeyMessage.getRegistrationId() + ", one-time pre-key was consumed concurrently");
            throw new UnknownPreKeyException("One-time pre-key has already been used");
        }

        log.info("Accepted session " + session.getSessionId() + " from registration id " + preKeyMessage.getRegistrationId());
        return new Incoming(session, result);
    }

    public record Outgoing(DoubleRatchetSession session, PreKeyMessage preKeyMessage) {}

    public record Incoming(DoubleRatchetSession session, DecryptResult firstMessage) {}
}
