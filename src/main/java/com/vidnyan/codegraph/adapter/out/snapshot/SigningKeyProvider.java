package com.vidnyan.codegraph.adapter.out.snapshot;

import com.vidnyan.codegraph.exception.SnapshotException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Base64;

/**
 * Per-machine 256-bit HMAC key, generated once.
 * <p>
 * Stored as a secret key entry in a password-protected PKCS#12 key store. If
 * the key store cannot be read or written, an owner-only key file is used.
 * If neither can be persisted the key lives for this process only, which
 * invalidates every snapshot on the next start.
 * <p>
 * The default key store password ({@code codegraph.snapshot.key-store-password})
 * is public, so with it the key store is no stronger than the plain key file:
 * the key is protected only by the owner-only file permissions set here. Set a
 * private password to have the key encrypted at rest.
 */
@Slf4j
public class SigningKeyProvider {

    static final String ALGORITHM = "HmacSHA256";
    static final String ALIAS = "codegraph-snapshot";

    private final Path keyStorePath;
    private final char[] password;
    private final Path keyFilePath;

    private SecretKey key;

    public SigningKeyProvider(Path keyStorePath, String password, Path keyFilePath) {
        this.keyStorePath = keyStorePath;
        this.password = password.toCharArray();
        this.keyFilePath = keyFilePath;
    }

    public synchronized SecretKey getKey() {
        if (key == null) {
            key = loadOrCreate();
        }
        return key;
    }

    private SecretKey loadOrCreate() {
        try {
            return fromKeyStore();
        } catch (IOException | GeneralSecurityException e) {
            log.warn("Key store {} unavailable, using key file: {}", keyStorePath, e.getMessage());
        }
        try {
            return fromKeyFile();
        } catch (IOException e) {
            log.warn("Key file {} unavailable, snapshot key will not survive restart: {}",
                    keyFilePath, e.getMessage());
            return generate();
        }
    }

    private SecretKey fromKeyStore() throws IOException, GeneralSecurityException {
        KeyStore store = KeyStore.getInstance("PKCS12");
        KeyStore.PasswordProtection protection = new KeyStore.PasswordProtection(password);

        if (Files.exists(keyStorePath)) {
            try (InputStream in = Files.newInputStream(keyStorePath)) {
                store.load(in, password);
            }
            KeyStore.Entry entry = store.getEntry(ALIAS, protection);
            if (entry instanceof KeyStore.SecretKeyEntry secret) {
                return new SecretKeySpec(secret.getSecretKey().getEncoded(), ALGORITHM);
            }
        } else {
            store.load(null, password);
        }

        SecretKey generated = generate();
        store.setEntry(ALIAS, new KeyStore.SecretKeyEntry(generated), protection);
        createParent(keyStorePath);
        Path tmp = keyStorePath.resolveSibling(keyStorePath.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp)) {
            store.store(out, password);
        }
        restrictToOwner(tmp);
        Files.move(tmp, keyStorePath, StandardCopyOption.REPLACE_EXISTING);
        log.info("Generated snapshot signing key in {}", keyStorePath);
        return generated;
    }

    private SecretKey fromKeyFile() throws IOException {
        if (Files.exists(keyFilePath)) {
            byte[] raw = Base64.getDecoder().decode(Files.readString(keyFilePath).trim());
            return new SecretKeySpec(raw, ALGORITHM);
        }
        SecretKey generated = generate();
        createParent(keyFilePath);
        Files.writeString(keyFilePath, Base64.getEncoder().encodeToString(generated.getEncoded()));
        restrictToOwner(keyFilePath);
        log.info("Generated snapshot signing key in {}", keyFilePath);
        return generated;
    }

    private static SecretKey generate() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance(ALGORITHM);
            generator.init(256);
            return generator.generateKey();
        } catch (GeneralSecurityException e) {
            throw new SnapshotException("Cannot generate snapshot signing key", e);
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
