package com.sparrowwallet.vortex.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sparrowwallet.vortex.ProtocolConfig;
import com.sparrowwallet.vortex.TestConfig;
import com.sparrowwallet.vortex.Utils;
import com.sparrowwallet.vortex.crypto.CipherSuite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentityBackupTest {
    private ProtocolConfig config;
    private CipherSuite suite;
    private IdentityManager manager;

    @BeforeEach
    public void setUp() {
        config = TestConfig.load();
        suite = TestConfig.suite(config);
        manager = new IdentityManager(suite, config);
        manager.generateIdentity();
    }

    @Test
    public void testRoundTrip() throws Exception {
        IdentityStore original = manager.getStore().orElseThrow();
        manager.markOneTimePreKeyUsed(original.getOneTimePreKeys().get(0).getPublicKey());
        String backup = manager.exportIdentity("hunter2".toCharArray());

        IdentityManager restoredManager = new IdentityManager(suite, config);
        IdentityStore restored = restoredManager.importIdentity(backup, "hunter2".toCharArray());

        assertArrayEquals(original.getIdentityPublicKey(), restored.getIdentityPublicKey());
        assertArrayEquals(suite.getKeyAgreement().serializePrivateKey(original.getIdentityKeyPair().getPrivate()),
                suite.getKeyAgreement().serializePrivateKey(restored.getIdentityKeyPair().getPrivate()));
        assertArrayEquals(original.getSigningPublicKey(), restored.getSigningPublicKey());
        assertArrayEquals(suite.getSignatureScheme().serializePrivateKey(original.getSigningKeyPair().getPrivate()),
                suite.getSignatureScheme().serializePrivateKey(restored.getSigningKeyPair().getPrivate()));
        assertEquals(original.getRegistrationId(), restored.getRegistrationId());
        assertEquals(original.getFingerprint(), restored.getFingerprint());
        assertEquals(original.getCreatedAt(), restored.getCreatedAt());
        assertEquals(original.getSignedPreKey().keyId(), restored.getSignedPreKey().keyId());
        assertArrayEquals(original.getSignedPreKey().publicKey(), restored.getSignedPreKey().publicKey());
        assertArrayEquals(original.getSignedPreKey().signature(), restored.getSignedPreKey().signature());
        assertEquals(original.getOneTimePreKeys().size(), restored.getOneTimePreKeys().size());
        assertTrue(restored.getOneTimePreKeys().get(0).isUsed());
        assertFalse(restored.getOneTimePreKeys().get(1).isUsed());
        assertArrayEquals(original.getOneTimePreKeys().get(5).getPublicKey(), restored.getOneTimePreKeys().get(5).getPublicKey());

        assertEquals(manager.getFingerprint(), restoredManager.getFingerprint());
        assertTrue(restoredManager.verifyPreKeyBundle(restoredManager.getPreKeyBundle().orElseThrow(), original.getSigningPublicKey()));
    }

    @Test
    public void testRestoredSigningKeyStillSigns() throws Exception {
        String backup = manager.exportIdentity("pw".toCharArray());
        IdentityManager restoredManager = new IdentityManager(suite, config);
        restoredManager.importIdentity(backup, "pw".toCharArray());

        restoredManager.rotateSignedPreKey();
        assertTrue(restoredManager.verifyPreKeyBundle(restoredManager.getPreKeyBundle().orElseThrow(), manager.getSigningPublicKey().orElseThrow()));
    }

    @Test
    public void testWrongPassword() {
        String backup = manager.exportIdentity("correct".toCharArray());
        IdentityManager restoredManager = new IdentityManager(suite, config);

        BackupException e = assertThrows(BackupException.class, () -> restoredManager.importIdentity(backup, "incorrect".toCharArray()));
        assertEquals(BackupException.Reason.AUTHENTICATION_FAILURE, e.getReason());
        assertFalse(restoredManager.isInitialized());
    }

    @Test
    public void testCorruptedCiphertext() throws Exception {
        String backup = manager.exportIdentity("pw".toCharArray());
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode node = (ObjectNode)mapper.readTree(backup);
        byte[] data = Utils.fromBase64(node.get("data").asText());
        data[data.length / 2] ^= 0x01;
        node.put("data", Utils.toBase64(data));

        BackupException e = assertThrows(BackupException.class, () -> manager.importIdentity(mapper.writeValueAsString(node), "pw".toCharArray()));
        assertEquals(BackupException.Reason.AUTHENTICATION_FAILURE, e.getReason());
    }

    @Test
    public void testTamperedParametersFailAuthentication() throws Exception {
        String backup = manager.exportIdentity("pw".toCharArray());
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode node = (ObjectNode)mapper.readTree(backup);
        node.put("t", 2);

        BackupException e = assertThrows(BackupException.class, () -> manager.importIdentity(mapper.writeValueAsString(node), "pw".toCharArray()));
        assertEquals(BackupException.Reason.AUTHENTICATION_FAILURE, e.getReason());
    }

    @Test
    public void testOversizedParametersRejectedBeforeKeyDerivation() throws Exception {
        String backup = manager.exportIdentity("pw".toCharArray());
        ObjectMapper mapper = new ObjectMapper();

        ObjectNode memory = (ObjectNode)mapper.readTree(backup);
        memory.put("m", 4194304);
        BackupException e = assertThrows(BackupException.class, () -> manager.importIdentity(mapper.writeValueAsString(memory), "pw".toCharArray()));
        assertEquals(BackupException.Reason.MALFORMED, e.getReason());

        ObjectNode iterations = (ObjectNode)mapper.readTree(backup);
        iterations.put("t", 64);
        e = assertThrows(BackupException.class, () -> manager.importIdentity(mapper.writeValueAsString(iterations), "pw".toCharArray()));
        assertEquals(BackupException.Reason.MALFORMED, e.getReason());

        assertTrue(manager.isInitialized());
    }

    @Test
    public void testUnsupportedVersion() throws Exception {
        String backup = manager.exportIdentity("pw".toCharArray());
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode node = (ObjectNode)mapper.readTree(backup);
        node.put("v", 2);

        BackupException e = assertThrows(BackupException.class, () -> manager.importIdentity(mapper.writeValueAsString(node), "pw".toCharArray()));
        assertEquals(BackupException.Reason.UNSUPPORTED_VERSION, e.getReason());
    }

    @Test
    public void testMalformedBackup() {
        BackupException e = assertThrows(BackupException.class, () -> manager.importIdentity("not json", "pw".toCharArray()));
        assertEquals(BackupException.Reason.MALFORMED, e.getReason());

        e = assertThrows(BackupException.class, () -> manager.importIdentity("{\"v\":1,\"kdf\":\"argon2id\",\"m\":1024,\"t\":1,\"p\":1,\"salt\":\"!!\",\"nonce\":\"AA\",\"data\":\"AA\"}", "pw".toCharArray()));
        assertEquals(BackupException.Reason.MALFORMED, e.getReason());

        e = assertThrows(BackupException.class, () -> manager.importIdentity("{\"v\":1,\"kdf\":\"argon2id\",\"m\":1073741824,\"t\":1,\"p\":1}", "pw".toCharArray()));
        assertEquals(BackupException.Reason.MALFORMED, e.getReason());
    }

    @Test
    public void testFailedImportKeepsCurrentIdentity() {
        String fingerprint = manager.getFingerprint();
        assertThrows(BackupException.class, () -> manager.importIdentity("{\"v\":9}", "pw".toCharArray()));
        assertEquals(fingerprint, manager.getFingerprint());
    }
}
