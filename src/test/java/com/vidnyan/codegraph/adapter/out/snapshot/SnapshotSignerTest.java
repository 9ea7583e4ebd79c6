package com.vidnyan.codegraph.adapter.out.snapshot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SnapshotSignerTest {

    @TempDir
    Path tempDir;

    private SigningKeyProvider keys() {
        return new SigningKeyProvider(tempDir.resolve("keys.p12"), "secret", tempDir.resolve("hmac.key"));
    }

    @Test
    void verify_ShouldAcceptOwnSignature() {
        SnapshotSigner signer = new SnapshotSigner(keys());
        byte[] data = "snapshot bytes".getBytes(StandardCharsets.UTF_8);

        String hmac = signer.sign(data);

        assertEquals(64, hmac.length());
        assertTrue(signer.verify(data, hmac));
        assertTrue(signer.verify(data, hmac.toUpperCase()));
    }

    @Test
    void verify_ShouldRejectFlippedByte() {
        SnapshotSigner signer = new SnapshotSigner(keys());
        byte[] data = "snapshot bytes".getBytes(StandardCharsets.UTF_8);
        String hmac = signer.sign(data);

        data[3] ^= 0x01;

        assertFalse(signer.verify(data, hmac));
    }

    @Test
    void verify_ShouldRejectMissingSignature() {
        SnapshotSigner signer = new SnapshotSigner(keys());

        assertFalse(signer.verify(new byte[]{1}, null));
        assertFalse(signer.verify(new byte[]{1}, " "));
    }

    @Test
    void getKey_ShouldPersistAcrossProviders() {
        byte[] data = {1, 2, 3};
        String first = new SnapshotSigner(keys()).sign(data);

        String second = new SnapshotSigner(keys()).sign(data);

        assertEquals(first, second);
        assertTrue(Files.exists(tempDir.resolve("keys.p12")));
    }

    @Test
    void getKey_ShouldCreateKeyStoreReadableByOwnerOnly() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));

        new SnapshotSigner(keys()).sign(new byte[]{1});

        assertEquals(PosixFilePermissions.fromString("rw-------"),
                Files.getPosixFilePermissions(tempDir.resolve("keys.p12")));
    }

    @Test
    void getKey_ShouldFallBackToKeyFileWhenKeyStoreIsUnreadable() throws Exception {
        // Arrange
        Path keyStore = tempDir.resolve("keys.p12");
        Files.writeString(keyStore, "not a key store");
        SigningKeyProvider provider = new SigningKeyProvider(keyStore, "secret", tempDir.resolve("hmac.key"));

        // Act
        String hmac = new SnapshotSigner(provider).sign(new byte[]{7});

        // Assert
        assertTrue(Files.exists(tempDir.resolve("hmac.key")));
        SigningKeyProvider again = new SigningKeyProvider(keyStore, "secret", tempDir.resolve("hmac.key"));
        assertEquals(hmac, new SnapshotSigner(again).sign(new byte[]{7}));
    }

    @Test
    void differentKeys_ShouldProduceDifferentSignatures() {
        byte[] data = {1, 2, 3};
        String first = new SnapshotSigner(keys()).sign(data);
        Path other = tempDir.resolve("other");
        SigningKeyProvider otherKeys = new SigningKeyProvider(other.resolve("keys.p12"), "secret",
                other.resolve("hmac.key"));

        assertNotEquals(first, new SnapshotSigner(otherKeys).sign(data));
    }
}
