package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.crypto.CipherSuite;
import com.sparrowwallet.vortex.identity.IdentityManager;
import com.sparrowwallet.vortex.identity.IdentityStore;
import com.sparrowwallet.vortex.identity.OneTimePreKey;
import com.sparrowwallet.vortex.protocol.PreKeyBundle;

import java.time.Clock;

/**
 * An initiator and a responder session established directly through X3DH, without a transport.
 */
public class SessionPair {
    public final IdentityManager aliceIdentity;
    public final IdentityManager bobIdentity;
    public final DoubleRatchetSession alice;
    public final DoubleRatchetSession bob;
    public final SenderInitialization initialization;

    public SessionPair(CipherSuite suite, ProtocolConfig config, Clock clock, boolean useOneTimePreKey) {
        aliceIdentity = new IdentityManager(suite, config);
        bobIdentity = new IdentityManager(suite, config);
        IdentityStore aliceStore = aliceIdentity.generateIdentity();
        IdentityStore bobStore = bobIdentity.generateIdentity();

        PreKeyBundle bundle = bobIdentity.getPreKeyBundle().orElseThrow();
        if(!useOneTimePreKey) {
            bundle = bundle.withoutOneTimePreKey();
        }

        alice = new DoubleRatchetSession(suite, config, "alice", clock);
        bob = new DoubleRatchetSession(suite, config, "bob", clock);

        initialization = alice.initializeSender(aliceStore.getIdentityKeyPair(), bundle);
        OneTimePreKey oneTimePreKey = bundle.getOneTimePreKey().flatMap(bobIdentity::getOneTimePreKey).orElse(null);
        bob.initializeReceiver(bobStore.getIdentityKeyPair(), bobStore.getSignedPreKey().keyPair(),
                oneTimePreKey == null ? null : oneTimePreKey.getKeyPair(), aliceStore.getIdentityPublicKey(), initialization.ephemeralPublicKey());
    }
}
