package io.taskvault.security;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.error.AuthenticationFailedException;
import io.taskvault.error.DecryptionFailedException;
import io.taskvault.error.ValidationException;
import io.taskvault.storage.AtomicFiles;
import io.taskvault.util.Jsons;
import io.taskvault.util.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;

/**
 * Derives the session key from the user's password and the persisted envelope.
 *
 * <p>Only the envelope (salt, work factor, sealed canary) reaches disk. Checking a password costs a
 * full PBKDF2 derivation followed by an authenticated decryption of the canary, which is the same
 * work an attacker would spend trying the password against a real document.
 */
public final class KeyManager {
    static final String VERIFIER_DOCUMENT = "envelope.verifier";
    private static final byte[] CANARY = "taskvault-key-verifier-v1".getBytes(StandardCharsets.UTF_8);
    private static final int SALT_BYTES = 16;
    private static final int KEY_BITS = 256;
    private static final Logger log = LoggerFactory.getLogger(KeyManager.class);

    private final Path envelopeFile;
    private final int iterations;
    private final Retry retry;
    private final SecureRandom secureRandom;

    public KeyManager(TaskVaultConfig config) {
        this(config.envelopeFile(), config.kdfIterations(), Retry.defaults());
    }

    KeyManager(Path envelopeFile, int iterations, Retry retry) {
        this.envelopeFile = envelopeFile;
        this.iterations = iterations;
        this.retry = retry;
        this.secureRandom = new SecureRandom();
    }

    public boolean isInitialized() {
        return Files.isRegularFile(envelopeFile);
    }

    /**
     * First-run setup. Fails when an envelope already exists so an existing store is never
     * silently re-keyed.
     */
    public synchronized SecretKey initialize(char[] password) {
        requirePassword(password, "password");
        if (isInitialized()) {
            throw new IllegalStateException("Storage is already initialized: " + envelopeFile);
        }
        byte[] salt = newSalt();
        SecretKey key = deriveKey(password, salt, iterations);
        byte[] envelope = envelopeBytes(key, salt, iterations);
        try {
            AtomicFiles.write(envelopeFile, envelope, retry);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist key envelope: " + envelopeFile, e);
        }
        log.info("Key envelope created at {} ({} iterations)", envelopeFile, iterations);
        return key;
    }

    public SecretKey login(char[] password) {
        requirePassword(password, "password");
        EncryptionEnvelope envelope = readEnvelope();
        byte[] salt = decodeSalt(envelope);
        SecretKey key = deriveKey(password, salt, envelope.iterations());
        if (!verifies(key, envelope)) {
            log.warn("Login rejected: password did not verify");
            throw new AuthenticationFailedException();
        }
        return key;
    }

    /**
     * Re-keys the store. The old envelope stays live until {@code rekeyer} has durably committed
     * the re-encrypted documents together with the new envelope.
     */
    public synchronized SecretKey changePassword(char[] oldPassword, char[] newPassword, Rekeyer rekeyer) {
        Rotation rotation = prepareRotation(oldPassword, newPassword);
        rekeyer.rekey(rotation);
        log.info("Password changed; store re-encrypted under a new salt");
        return rotation.newKey();
    }

    Rotation prepareRotation(char[] oldPassword, char[] newPassword) {
        requirePassword(newPassword, "new_password");
        SecretKey current = login(oldPassword);
        byte[] salt = newSalt();
        SecretKey next = deriveKey(newPassword, salt, iterations);
        return new Rotation(current, next, envelopeBytes(next, salt, iterations));
    }

    public EncryptionEnvelope readEnvelope() {
        if (!isInitialized()) {
            throw new IllegalStateException("Storage is not initialized: " + envelopeFile);
        }
        try {
            EncryptionEnvelope envelope = Jsons.mapper().readValue(Files.readAllBytes(envelopeFile), EncryptionEnvelope.class);
            if (!EncryptionEnvelope.SCHEMA.equals(envelope.schema()) || !EncryptionEnvelope.KDF.equals(envelope.kdf())) {
                throw new IllegalStateException("Unsupported key envelope: " + envelope.schema() + "/" + envelope.kdf());
            }
            return envelope;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read key envelope: " + envelopeFile, e);
        }
    }

    static SecretKey deriveKey(char[] password, byte[] salt, int iterations) {
        PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, KEY_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(EncryptionEnvelope.KDF);
            byte[] raw = factory.generateSecret(spec).getEncoded();
            SecretKey key = new SecretKeySpec(raw, "AES");
            Arrays.fill(raw, (byte) 0);
            return key;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }

    private byte[] envelopeBytes(SecretKey key, byte[] salt, int workFactor) {
        byte[] sealedCanary = new PayloadCrypto(key).seal(VERIFIER_DOCUMENT, CANARY);
        EncryptionEnvelope envelope = new EncryptionEnvelope(
                EncryptionEnvelope.SCHEMA,
                EncryptionEnvelope.KDF,
                workFactor,
                Base64.getEncoder().encodeToString(salt),
                Base64.getEncoder().encodeToString(sealedCanary),
                Instant.now().toString()
        );
        return Jsons.toJson(envelope).getBytes(StandardCharsets.UTF_8);
    }

    private static boolean verifies(SecretKey key, EncryptionEnvelope envelope) {
        try {
            byte[] sealed = Base64.getDecoder().decode(envelope.verifier());
            byte[] canary = new PayloadCrypto(key).open(VERIFIER_DOCUMENT, sealed);
            return MessageDigest.isEqual(CANARY, canary);
        } catch (DecryptionFailedException | IllegalArgumentException e) {
            return false;
        }
    }

    private static byte[] decodeSalt(EncryptionEnvelope envelope) {
        try {
            return Base64.getDecoder().decode(envelope.salt());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Key envelope salt is corrupt", e);
        }
    }

    private byte[] newSalt() {
        byte[] salt = new byte[SALT_BYTES];
        secureRandom.nextBytes(salt);
        return salt;
    }

    private static void requirePassword(char[] password, String field) {
        if (password == null) {
            throw new ValidationException(field, "must not be empty");
        }
        for (char ch : password) {
            if (!Character.isWhitespace(ch)) {
                return;
            }
        }
        throw new ValidationException(field, "must not be empty");
    }

    /**
     * Keys for a pending password change: the verified current key, the new key and the
     * serialized envelope that must be committed together with the re-encrypted documents.
     */
    public record Rotation(SecretKey currentKey, SecretKey newKey, byte[] envelope) {
    }

    @FunctionalInterface
    public interface Rekeyer {
        void rekey(Rotation rotation);
    }
}
