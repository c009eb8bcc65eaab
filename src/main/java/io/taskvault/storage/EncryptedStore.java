package io.taskvault.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskvault.config.TaskVaultConfig;
import io.taskvault.error.SessionLockedException;
import io.taskvault.error.StorageBusyException;
import io.taskvault.security.KeyManager;
import io.taskvault.security.PayloadCrypto;
import io.taskvault.util.Jsons;
import io.taskvault.util.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Named JSON documents, each sealed with AES-GCM into {@code <name>.enc} under the storage root.
 *
 * <p>Document writes hold the shared side of the root lock plus that document's own lock, so two
 * documents can be written concurrently but never the same one. Backup, restore and re-keying take
 * the root lock exclusively and therefore never observe a half-written document.
 */
public final class EncryptedStore {
    private static final Pattern DOCUMENT_NAME = Pattern.compile("[a-z0-9][a-z0-9_-]{0,63}");
    private static final Logger log = LoggerFactory.getLogger(EncryptedStore.class);

    private final Path rootDir;
    private final Path envelopeFile;
    private final Retry retry;
    private final long lockTimeoutMs;
    private final ReentrantReadWriteLock rootLock = new ReentrantReadWriteLock();
    private final ConcurrentHashMap<String, ReentrantLock> documentLocks = new ConcurrentHashMap<>();
    private volatile PayloadCrypto crypto;
    private volatile AtomicFiles.BeforeReplace beforeReplace = temp -> {
    };

    public EncryptedStore(TaskVaultConfig config) {
        this(config.rootDir(), config.envelopeFile(), Retry.defaults(), config.lockTimeoutMs());
    }

    EncryptedStore(Path rootDir, Path envelopeFile, Retry retry, long lockTimeoutMs) {
        this.rootDir = rootDir;
        this.envelopeFile = envelopeFile;
        this.retry = retry;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Unlocks the store with a session key and removes temp files left by interrupted writes.
     */
    public void open(SecretKey key) {
        try {
            AtomicFiles.sweepTempFiles(rootDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to sweep temp files in " + rootDir, e);
        }
        this.crypto = new PayloadCrypto(key);
    }

    public boolean isOpen() {
        return crypto != null;
    }

    public void lock() {
        this.crypto = null;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path documentFile(String name) {
        return rootDir.resolve(checkName(name) + TaskVaultConfig.DOCUMENT_SUFFIX);
    }

    public void save(String name, Object value) {
        PayloadCrypto session = session();
        byte[] sealed = session.seal(checkName(name), Jsons.toCompactBytes(value));
        Path file = documentFile(name);
        withShared("save " + name, () -> {
            ReentrantLock documentLock = documentLock(name);
            documentLock.lock();
            try {
                AtomicFiles.write(file, sealed, retry, beforeReplace);
            } finally {
                documentLock.unlock();
            }
            return null;
        });
        log.debug("Saved document {} ({} bytes)", name, sealed.length);
    }

    /**
     * Reads and authenticates a document. Empty when the document was never written; a
     * {@link io.taskvault.error.DecryptionFailedException} when it exists but does not open under
     * the session key.
     */
    public <T> Optional<T> load(String name, Class<T> type) {
        return readPlaintext(name).map(plain -> {
            try {
                return Jsons.mapper().readValue(plain, type);
            } catch (IOException e) {
                throw new UncheckedIOException("Document " + name + " has an unexpected shape", e);
            }
        });
    }

    public Optional<JsonNode> loadTree(String name) {
        return readPlaintext(name).map(plain -> {
            try {
                return Jsons.mapper().readTree(plain);
            } catch (IOException e) {
                throw new UncheckedIOException("Document " + name + " is not valid JSON", e);
            }
        });
    }

    public boolean delete(String name) {
        Path file = documentFile(name);
        return withShared("delete " + name, () -> {
            ReentrantLock documentLock = documentLock(name);
            documentLock.lock();
            try {
                boolean deleted = Files.deleteIfExists(file);
                AtomicFiles.syncDirectory(rootDir);
                return deleted;
            } finally {
                documentLock.unlock();
            }
        });
    }

    public List<String> documentNames() {
        if (!Files.isDirectory(rootDir)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(rootDir, "*" + TaskVaultConfig.DOCUMENT_SUFFIX)) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - TaskVaultConfig.DOCUMENT_SUFFIX.length());
                if (Files.isRegularFile(file) && DOCUMENT_NAME.matcher(name).matches()) {
                    names.add(name);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list documents in " + rootDir, e);
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Checks that sealed bytes taken from elsewhere (a backup) authenticate under the session key.
     */
    public void verifySealed(String name, byte[] sealed) {
        session().open(checkName(name), sealed);
    }

    /**
     * Runs {@code action} while holding the root lock exclusively. Waits at most the configured
     * lock timeout.
     */
    public <T> T withExclusive(String operation, Retry.IoCallable<T> action) {
        return locked(rootLock.writeLock(), operation, action);
    }

    /**
     * Runs {@code action} on the shared side of the root lock, excluding backup, restore and
     * re-keying but not other document writes.
     */
    public <T> T withShared(String operation, Retry.IoCallable<T> action) {
        return locked(rootLock.readLock(), operation, action);
    }

    /**
     * Re-encrypts every document under the rotation's new key and installs the new envelope, all
     * in one staged commit. If the commit cannot be finished the store is locked.
     */
    public void rotate(KeyManager.Rotation rotation) {
        rotate(rotation, commit -> {
        });
    }

    void rotate(KeyManager.Rotation rotation, BeforeCommit beforeCommit) {
        withExclusive("rekey", () -> {
            PayloadCrypto current = new PayloadCrypto(rotation.currentKey());
            PayloadCrypto next = new PayloadCrypto(rotation.newKey());
            StagedCommit commit = StagedCommit.begin(rootDir, "rekey", retry);
            try {
                List<String> names = documentNames();
                for (String name : names) {
                    byte[] plain = current.open(name, Files.readAllBytes(documentFile(name)));
                    commit.stage(name + TaskVaultConfig.DOCUMENT_SUFFIX, next.seal(name, plain));
                }
                commit.stage(envelopeFile.getFileName().toString(), rotation.envelope());
                beforeCommit.accept(commit);
                try {
                    commit.commit();
                } catch (IncompleteCommitException e) {
                    // Live files are now under mixed keys; no session key may write until recovery.
                    this.crypto = null;
                    log.error("Re-key could not be finished, store locked: {}", e.toString());
                    throw e;
                }
                log.info("Re-encrypted {} document(s) under the new key", names.size());
            } finally {
                commit.abort();
            }
            this.crypto = next;
            return null;
        });
    }

    private Optional<byte[]> readPlaintext(String name) {
        PayloadCrypto session = session();
        Path file = documentFile(name);
        byte[] sealed;
        try {
            sealed = retry.call("read " + name, () -> Files.exists(file) ? Files.readAllBytes(file) : null);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read document " + file, e);
        }
        if (sealed == null) {
            return Optional.empty();
        }
        return Optional.of(session.open(name, sealed));
    }

    private <T> T locked(Lock lock, String operation, Retry.IoCallable<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageBusyException(operation, lockTimeoutMs);
        }
        if (!acquired) {
            log.warn("{} timed out after {}ms waiting for the storage lock", operation, lockTimeoutMs);
            throw new StorageBusyException(operation, lockTimeoutMs);
        }
        try {
            return action.call();
        } catch (IOException e) {
            throw new UncheckedIOException(operation + " failed under " + rootDir, e);
        } finally {
            lock.unlock();
        }
    }

    private PayloadCrypto session() {
        PayloadCrypto current = crypto;
        if (current == null) {
            throw new SessionLockedException();
        }
        return current;
    }

    private ReentrantLock documentLock(String name) {
        return documentLocks.computeIfAbsent(name, ignored -> new ReentrantLock());
    }

    private static String checkName(String name) {
        if (name == null || !DOCUMENT_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid document name: " + name);
        }
        return name;
    }

    void beforeReplace(AtomicFiles.BeforeReplace hook) {
        this.beforeReplace = hook;
    }

    @FunctionalInterface
    interface BeforeCommit {
        void accept(StagedCommit commit) throws IOException;
    }
}
