package com.sparrowwallet.vortex.identity;

import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.crypto.CipherSuite;
import com.sparrowwallet.vortex.protocol.PreKeyBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyPair;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Holds the local party's long-term identity and handshake material. Issues pre-key bundles, tracks one-time pre-key
 * consumption, rotates the signed pre-key, verifies peers' bundles and renders fingerprints and safety numbers.
 *
 * <p>Operations on the pre-key pool are serialized on an internal lock, so a one-time pre-key is never issued to two
 * peers concurrently.</p>
 */
public class IdentityManager {
    private static final Logger log = LoggerFactory.getLogger(IdentityManager.class);

    public static final int MAX_REGISTRATION_ID = 16380;

    private final CipherSuite suite;
    private final ProtocolConfig config;
    private final Fingerprints fingerprints;
    private final IdentityBackup backup;
    private final Object lock = new Object();

    private IdentityStore store;

    public IdentityManager(CipherSuite suite, ProtocolConfig config) {
        this.suite = suite;
        this.config = config;
        this.fingerprints = new Fingerprints(suite.getHash());
        this.backup = new IdentityBackup(suite, config);
    }

    /**
     * Generates a complete new identity, replacing any identity this manager held: an X25519 identity key pair, an
     * Ed25519 signing key pair, a registration id, signed pre-key 1 and the initial batch of one-time pre-keys.
     */
    public IdentityStore generateIdentity() {
        KeyPair identityKeyPair = suite.getKeyAgreement().generateKeyPair();
        byte[] identityPublicKey = suite.getKeyAgreement().serializePublicKey(identityKeyPair.getPublic());
        KeyPair signingKeyPair = suite.getSignatureScheme().generateKeyPair();
        byte[] signingPublicKey = suite.getSignatureScheme().serializePublicKey(signingKeyPair.getPublic());

        int registrationId = generateRegistrationId();
        SignedPreKey signedPreKey = generateSignedPreKey(1, signingKeyPair);
        List<OneTimePreKey> oneTimePreKeys = generateOneTimePreKeys(config.getInitialOneTimePreKeys(), 1);
        String fingerprint = fingerprints.fingerprint(identityPublicKey);

        IdentityStore newStore = new IdentityStore(identityKeyPair, identityPublicKey, signingKeyPair, signingPublicKey, registrationId,
                signedPreKey, oneTimePreKeys, System.currentTimeMillis(), fingerprint);

        synchronized(lock) {
            store = newStore;
        }

        log.info("Generated identity with registration id " + registrationId + " and " + oneTimePreKeys.size() + " one-time pre-keys");
        return newStore;
    }

    /**
     * Generates a new signed pre-key with the given id, signed by the current identity's signing key. The new key is
     * not installed; use {@link #rotateSignedPreKey()} to replace the active signed pre-key.
     *
     * @throws IllegalStateException if no identity exists
     */
    public SignedPreKey generateSignedPreKey(int keyId) {
        return generateSignedPreKey(keyId, requireStore().getSigningKeyPair());
    }

    private SignedPreKey generateSignedPreKey(int keyId, KeyPair signingKeyPair) {
        KeyPair keyPair = suite.getKeyAgreement().generateKeyPair();
        byte[] publicKey = suite.getKeyAgreement().serializePublicKey(keyPair.getPublic());
        byte[] signature = suite.getSignatureScheme().sign(signingKeyPair.getPrivate(), publicKey);
        return new SignedPreKey(keyId, keyPair, publicKey, signature, System.currentTimeMillis());
    }

    /**
     * Generates {@code count} fresh, unused one-time pre-keys with ids {@code startId, startId + 1, ...}.
     */
    public List<OneTimePreKey> generateOneTimePreKeys(int count, int startId) {
        if(count < 0) {
            throw new IllegalArgumentException("Count must not be negative");
        }

        List<OneTimePreKey> keys = new ArrayList<>(count);
        for(int i = 0; i < count; i++) {
            KeyPair keyPair = suite.getKeyAgreement().generateKeyPair();
            keys.add(new OneTimePreKey(startId + i, keyPair, suite.getKeyAgreement().serializePublicKey(keyPair.getPublic()), false));
        }

        return keys;
    }

    /**
     * Returns a bundle carrying the identity key, the active signed pre-key and its signature, the first unused
     * one-time pre-key if any remain, the registration id and the signing public key. Returns empty if no identity
     * exists.
     */
    public Optional<PreKeyBundle> getPreKeyBundle() {
        synchronized(lock) {
            if(store == null) {
                return Optional.empty();
            }

            byte[] oneTimePreKey = store.getMutableOneTimePreKeys().stream().filter(key -> !key.isUsed()).findFirst()
                    .map(OneTimePreKey::getPublicKey).orElse(null);
            SignedPreKey signedPreKey = store.getSignedPreKey();
            return Optional.of(new PreKeyBundle(store.getIdentityPublicKey(), signedPreKey.publicKey(), signedPreKey.signature(),
                    oneTimePreKey, store.getRegistrationId(), store.getSigningPublicKey()));
        }
    }

    /**
     * Marks the one-time pre-key with the given public key as used, so it is never issued again. When fewer unused
     * keys than the low water mark remain, a new batch is added with ids continuing from the current maximum.
     *
     * @return true if this call consumed the key, false if it is unknown or was already used
     */
    public boolean markOneTimePreKeyUsed(byte[] publicKey) {
        synchronized(lock) {
            if(store == null) {
                return false;
            }

            List<OneTimePreKey> pool = store.getMutableOneTimePreKeys();
            OneTimePreKey match = null;
            for(OneTimePreKey key : pool) {
                if(key.matches(publicKey)) {
                    match = key;
                }
            }

            boolean consumed = match != null && !match.isUsed();
            if(consumed) {
                match.markUsed();
                if(log.isDebugEnabled()) {
                    log.debug("Marked one-time pre-key " + match.getKeyId() + " as used");
                }
            }

            long unused = pool.stream().filter(key -> !key.isUsed()).count();
            if(unused < config.getOneTimePreKeyLowWaterMark()) {
                int maxId = pool.stream().mapToInt(OneTimePreKey::getKeyId).max().orElse(0);
                pool.addAll(generateOneTimePreKeys(config.getOneTimePreKeyBatchSize(), maxId + 1));
                log.info("Replenished one-time pre-key pool with " + config.getOneTimePreKeyBatchSize() + " keys starting at id " + (maxId + 1));
            }

            return consumed;
        }
    }

    /**
     * Looks up a one-time pre-key, used or not, by its public key.
     */
    public Optional<OneTimePreKey> getOneTimePreKey(byte[] publicKey) {
        synchronized(lock) {
            if(store == null) {
                return Optional.empty();
            }

            OneTimePreKey match = null;
            for(OneTimePreKey key : store.getMutableOneTimePreKeys()) {
                if(key.matches(publicKey)) {
                    match = key;
                }
            }

            return Optional.ofNullable(match);
        }
    }

    /**
     * Replaces the active signed pre-key with a new one whose id is one greater. The previous signed pre-key is
     * discarded, so handshakes started against an older bundle can no longer be accepted.
     *
     * @throws IllegalStateException if no identity exists
     */
    public SignedPreKey rotateSignedPreKey() {
        synchronized(lock) {
            IdentityStore current = requireStore();
            SignedPreKey signedPreKey = generateSignedPreKey(current.getSignedPreKey().keyId() + 1, current.getSigningKeyPair());
            current.setSignedPreKey(signedPreKey);
            log.info("Rotated signed pre-key to id " + signedPreKey.keyId());
            return signedPreKey;
        }
    }

    /**
     * Verifies the signed pre-key signature of a bundle. Never throws: malformed input yields {@code false}.
     */
    public boolean verifyPreKeyBundle(PreKeyBundle bundle, byte[] signingPublicKey) {
        if(bundle == null) {
            return false;
        }

        boolean valid = suite.getSignatureScheme().verify(signingPublicKey, bundle.getSignedPreKey(), bundle.getSignedPreKeySig());
        if(!valid) {
            log.warn("Pre-key bundle for registration id " + bundle.getRegistrationId() + " failed signature verification");
        }

        return valid;
    }

    /**
     * @throws IllegalStateException if no identity exists
     */
    public String getFingerprint() {
        return requireStore().getFingerprint();
    }

    /**
     * Computes the safety number shared with the holder of the given identity key. Both parties compute the same
     * value.
     *
     * @throws IllegalStateException if no identity exists
     */
    public String computeSafetyNumber(byte[] theirIdentityKey) {
        return fingerprints.safetyNumber(requireStore().getIdentityPublicKey(), theirIdentityKey);
    }

    /**
     * Exports the full identity, including private keys and the signing key pair, encrypted under the given password.
     *
     * @throws IllegalStateException if no identity exists
     */
    public String exportIdentity(char[] password) {
        synchronized(lock) {
            return backup.export(requireStore(), password);
        }
    }

    /**
     * Restores an identity from a backup produced by {@link #exportIdentity(char[])}, replacing any identity this
     * manager held. On failure the current identity is left unchanged.
     */
    public IdentityStore importIdentity(String blob, char[] password) throws BackupException {
        IdentityStore restored;
        try {
            restored = backup.restore(blob, password);
        } catch(BackupException e) {
            log.warn("Could not import identity backup: " + e.getReason());
            throw e;
        }

        synchronized(lock) {
            store = restored;
        }

        log.info("Imported identity with registration id " + restored.getRegistrationId());
        return restored;
    }

    public Optional<KeyPair> getIdentityKeyPair() {
        return getStore().map(IdentityStore::getIdentityKeyPair);
    }

    public Optional<KeyPair> getSignedPreKeyPair() {
        return getStore().map(identityStore -> identityStore.getSignedPreKey().keyPair());
    }

    public Optional<byte[]> getSigningPublicKey() {
        return getStore().map(IdentityStore::getSigningPublicKey);
    }

    public boolean isInitialized() {
        return getStore().isPresent();
    }

    /**
     * Returns the registration id, or 0 if no identity exists.
     */
    public int getRegistrationId() {
        return getStore().map(IdentityStore::getRegistrationId).orElse(0);
    }

    public Optional<IdentityStore> getStore() {
        synchronized(lock) {
            return Optional.ofNullable(store);
        }
    }

    public CipherSuite getCipherSuite() {
        return suite;
    }

    private IdentityStore requireStore() {
        synchronized(lock) {
            if(store == null) {
                throw new IllegalStateException("Identity not initialized");
            }
            return store;
        }
    }

    private int generateRegistrationId() {
        return suite.getRandom().nextInt(MAX_REGISTRATION_ID) + 1;
    }
}
