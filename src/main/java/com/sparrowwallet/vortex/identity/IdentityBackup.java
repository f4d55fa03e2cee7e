package com.sparrowwallet.vortex.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.Utils;
import com.sparrowwallet.vortex.crypto.CipherSuite;
import com.sparrowwallet.vortex.crypto.RatchetCipher;
import com.sparrowwallet.vortex.crypto.RatchetKeyAgreement;
import com.sparrowwallet.vortex.crypto.SignatureScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Password protected export and import of an {@link IdentityStore}. The store is serialized to JSON, encrypted with an
 * AEAD cipher under a key stretched from the password with Argon2id, and wrapped in a versioned JSON document that
 * records the salt, nonce and key stretching parameters.
 */
public class IdentityBackup {
    private static final Logger log = LoggerFactory.getLogger(IdentityBackup.class);

    public static final int VERSION = 1;
    private static final int KEY_LENGTH = 32;
    private static final int MEMORY_CEILING_KIB = 256 * 1024;
    private static final int ITERATIONS_CEILING = 16;
    private static final int MAX_PARALLELISM = 16;

    private final CipherSuite suite;
    private final ProtocolConfig config;
    private final ObjectMapper mapper = new ObjectMapper();

    public IdentityBackup(CipherSuite suite, ProtocolConfig config) {
        this.suite = suite;
        this.config = config;
    }

    public String export(IdentityStore store, char[] password) {
        BackupFile backup = new BackupFile();
        backup.version = VERSION;
        backup.kdf = suite.getPasswordHash().getName();
        backup.aead = suite.getCipher().getName();
        backup.memoryKiB = config.getArgon2MemoryKiB();
        backup.iterations = config.getArgon2Iterations();
        backup.parallelism = config.getArgon2Parallelism();

        byte[] salt = suite.randomBytes(suite.getPasswordHash().getSaltLength());
        byte[] nonce = suite.randomBytes(suite.getCipher().getNonceLength());
        byte[] key = suite.getPasswordHash().deriveKey(password, salt, backup.memoryKiB, backup.iterations, backup.parallelism, KEY_LENGTH);
        byte[] plaintext = serialize(store);
        try {
            RatchetCipher cipher = suite.getCipher();
            byte[] ciphertext = cipher.encrypt(cipher.buildKey(key), nonce, associatedData(backup), plaintext);

            backup.salt = Utils.toBase64(salt);
            backup.nonce = Utils.toBase64(nonce);
            backup.data = Utils.toBase64(ciphertext);
            return mapper.writeValueAsString(backup);
        } catch(JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize identity backup", e);
        } finally {
            Utils.wipe(key);
            Utils.wipe(plaintext);
        }
    }

    public IdentityStore restore(String blob, char[] password) throws BackupException {
        BackupFile backup;
        try {
            backup = mapper.readValue(blob, BackupFile.class);
        } catch(IOException e) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Identity backup is not valid JSON", e);
        }

        if(backup == null || backup.version == null || backup.version != VERSION) {
            throw new BackupException(BackupException.Reason.UNSUPPORTED_VERSION, "Unsupported backup version " + (backup == null ? null : backup.version));
        }
        if(!suite.getPasswordHash().getName().equals(backup.kdf)) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Unsupported key derivation function " + backup.kdf);
        }
        // The parameters are unauthenticated until the key is derived, so never stretch harder than this engine would
        int maxMemoryKiB = Math.max(config.getArgon2MemoryKiB(), MEMORY_CEILING_KIB);
        int maxIterations = Math.max(config.getArgon2Iterations(), ITERATIONS_CEILING);
        if(backup.memoryKiB == null || backup.iterations == null || backup.parallelism == null
                || backup.parallelism < 1 || backup.parallelism > MAX_PARALLELISM
                || backup.memoryKiB < 8 * backup.parallelism || backup.memoryKiB > maxMemoryKiB
                || backup.iterations < 1 || backup.iterations > maxIterations) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Invalid key derivation parameters");
        }

        RatchetCipher cipher = getCipher(backup.aead);
        byte[] salt = decode(backup.salt, "salt");
        byte[] nonce = decode(backup.nonce, "nonce");
        byte[] data = decode(backup.data, "data");
        if(salt.length != suite.getPasswordHash().getSaltLength() || nonce.length != cipher.getNonceLength()) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Invalid salt or nonce length");
        }

        byte[] key = suite.getPasswordHash().deriveKey(password, salt, backup.memoryKiB, backup.iterations, backup.parallelism, KEY_LENGTH);
        byte[] plaintext;
        try {
            plaintext = cipher.decrypt(cipher.buildKey(key), nonce, associatedData(backup), data);
        } catch(AEADBadTagException e) {
            log.warn("Identity backup failed authentication");
            throw new BackupException(BackupException.Reason.AUTHENTICATION_FAILURE, "Wrong password or corrupted backup");
        } finally {
            Utils.wipe(key);
        }

        try {
            return deserialize(plaintext);
        } finally {
            Utils.wipe(plaintext);
        }
    }

    private RatchetCipher getCipher(String name) throws BackupException {
        if(name == null || name.equals(suite.getCipher().getName())) {
            return suite.getCipher();
        }

        try {
            return RatchetCipher.getInstance(name);
        } catch(NoSuchAlgorithmException | IllegalArgumentException e) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Unsupported backup cipher " + name, e);
        }
    }

    private static byte[] associatedData(BackupFile backup) {
        String tag = "vortex-identity-backup:v" + backup.version + ":" + backup.kdf + ":" + backup.memoryKiB + ":" + backup.iterations + ":" + backup.parallelism;
        return tag.getBytes(StandardCharsets.UTF_8);
    }

    private byte[] serialize(IdentityStore store) {
        RatchetKeyAgreement keyAgreement = suite.getKeyAgreement();
        SignatureScheme signatureScheme = suite.getSignatureScheme();

        StoreFile file = new StoreFile();
        file.identityKeyPair = toFile(store.getIdentityPublicKey(), keyAgreement.serializePrivateKey(store.getIdentityKeyPair().getPrivate()));
        file.signingKeyPair = toFile(store.getSigningPublicKey(), signatureScheme.serializePrivateKey(store.getSigningKeyPair().getPrivate()));
        file.registrationId = store.getRegistrationId();

        SignedPreKey signedPreKey = store.getSignedPreKey();
        file.signedPreKey = new SignedPreKeyFile();
        file.signedPreKey.keyId = signedPreKey.keyId();
        file.signedPreKey.keyPair = toFile(signedPreKey.publicKey(), keyAgreement.serializePrivateKey(signedPreKey.keyPair().getPrivate()));
        file.signedPreKey.signature = Utils.toBase64(signedPreKey.signature());
        file.signedPreKey.timestamp = signedPreKey.timestamp();

        for(OneTimePreKey oneTimePreKey : store.getOneTimePreKeys()) {
            OneTimePreKeyFile keyFile = new OneTimePreKeyFile();
            keyFile.keyId = oneTimePreKey.getKeyId();
            keyFile.keyPair = toFile(oneTimePreKey.getPublicKey(), keyAgreement.serializePrivateKey(oneTimePreKey.getKeyPair().getPrivate()));
            keyFile.used = oneTimePreKey.isUsed();
            file.oneTimePreKeys.add(keyFile);
        }

        file.createdAt = store.getCreatedAt();
        file.fingerprint = store.getFingerprint();

        try {
            return mapper.writeValueAsBytes(file);
        } catch(JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize identity store", e);
        }
    }

    private IdentityStore deserialize(byte[] plaintext) throws BackupException {
        try {
            StoreFile file = mapper.readValue(plaintext, StoreFile.class);
            if(file.identityKeyPair == null || file.signingKeyPair == null || file.signedPreKey == null || file.signedPreKey.keyPair == null || file.oneTimePreKeys == null) {
                throw new IllegalArgumentException("Missing key pair");
            }

            RatchetKeyAgreement keyAgreement = suite.getKeyAgreement();
            SignatureScheme signatureScheme = suite.getSignatureScheme();

            byte[] identityPublicKey = field(file.identityKeyPair.publicKey);
            KeyPair identityKeyPair = keyAgreement.deserializeKeyPair(identityPublicKey, field(file.identityKeyPair.privateKey));
            byte[] signingPublicKey = field(file.signingKeyPair.publicKey);
            KeyPair signingKeyPair = signatureScheme.deserializeKeyPair(signingPublicKey, field(file.signingKeyPair.privateKey));

            byte[] signedPreKeyPublic = field(file.signedPreKey.keyPair.publicKey);
            SignedPreKey signedPreKey = new SignedPreKey(file.signedPreKey.keyId,
                    keyAgreement.deserializeKeyPair(signedPreKeyPublic, field(file.signedPreKey.keyPair.privateKey)),
                    signedPreKeyPublic, field(file.signedPreKey.signature), file.signedPreKey.timestamp);

            List<OneTimePreKey> oneTimePreKeys = new ArrayList<>();
            for(OneTimePreKeyFile keyFile : file.oneTimePreKeys) {
                if(keyFile == null || keyFile.keyPair == null) {
                    throw new IllegalArgumentException("Missing one-time pre-key pair");
                }
                byte[] publicKey = field(keyFile.keyPair.publicKey);
                oneTimePreKeys.add(new OneTimePreKey(keyFile.keyId, keyAgreement.deserializeKeyPair(publicKey, field(keyFile.keyPair.privateKey)),
                        publicKey, keyFile.used));
            }

            return new IdentityStore(identityKeyPair, identityPublicKey, signingKeyPair, signingPublicKey, file.registrationId,
                    signedPreKey, oneTimePreKeys, file.createdAt, file.fingerprint);
        } catch(IOException | IllegalArgumentException e) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Identity backup content is malformed", e);
        }
    }

    private static byte[] field(String base64) {
        if(base64 == null) {
            throw new IllegalArgumentException("Missing key material");
        }

        return Utils.fromBase64(base64);
    }

    private static KeyPairFile toFile(byte[] publicKey, byte[] privateKey) {
        KeyPairFile file = new KeyPairFile();
        file.publicKey = Utils.toBase64(publicKey);
        file.privateKey = Utils.toBase64(privateKey);
        return file;
    }

    private static byte[] decode(String base64, String field) throws BackupException {
        if(base64 == null) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Missing field " + field);
        }

        try {
            return Utils.fromBase64(base64);
        } catch(IllegalArgumentException e) {
            throw new BackupException(BackupException.Reason.MALFORMED, "Invalid base64 in field " + field, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackupFile {
        @JsonProperty("v")
        public Integer version;

        @JsonProperty("kdf")
        public String kdf;

        @JsonProperty("aead")
        public String aead;

        @JsonProperty("m")
        public Integer memoryKiB;

        @JsonProperty("t")
        public Integer iterations;

        @JsonProperty("p")
        public Integer parallelism;

        @JsonProperty("salt")
        public String salt;

        @JsonProperty("nonce")
        public String nonce;

        @JsonProperty("data")
        public String data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreFile {
        @JsonProperty("identityKeyPair")
        public KeyPairFile identityKeyPair;

        @JsonProperty("signingKeyPair")
        public KeyPairFile signingKeyPair;

        @JsonProperty("registrationId")
        public int registrationId;

        @JsonProperty("signedPreKey")
        public SignedPreKeyFile signedPreKey;

        @JsonProperty("oneTimePreKeys")
        public List<OneTimePreKeyFile> oneTimePreKeys = new ArrayList<>();

        @JsonProperty("createdAt")
        public long createdAt;

        @JsonProperty("fingerprint")
        public String fingerprint;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeyPairFile {
        @JsonProperty("publicKey")
        public String publicKey;

        @JsonProperty("privateKey")
        public String privateKey;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SignedPreKeyFile {
        @JsonProperty("keyId")
        public int keyId;

        @JsonProperty("keyPair")
        public KeyPairFile keyPair;

        @JsonProperty("signature")
        public String signature;

        @JsonProperty("timestamp")
        public long timestamp;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OneTimePreKeyFile {
        @JsonProperty("keyId")
        public int keyId;

        @JsonProperty("keyPair")
        public KeyPairFile keyPair;

        @JsonProperty("used")
        public boolean used;
    }
}
