package io.taskvault.backup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.taskvault.config.TaskVaultConfig;
import io.taskvault.error.NotFoundException;
import io.taskvault.error.VersionMismatchException;
import io.taskvault.model.BackupInfo;
import io.taskvault.model.BackupType;
import io.taskvault.storage.AtomicFiles;
import io.taskvault.storage.EncryptedStore;
import io.taskvault.storage.IncompleteCommitException;
import io.taskvault.storage.StagedCommit;
import io.taskvault.tasks.TaskRepository;
import io.taskvault.util.Jsons;
import io.taskvault.util.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Snapshots of the encrypted documents under {@code backups/<timestamp>-<type>/}.
 *
 * <p>Backups copy ciphertext byte for byte, so nothing readable ever lands in the backups
 * directory. A snapshot is assembled in a hidden staging directory and renamed into place only
 * when complete, which keeps half-written backups out of {@link #list()}.
 */
public final class BackupManager {
    public static final int FORMAT_VERSION = 1;
    static final String MANIFEST_FILE = "manifest.json";
    static final String STAGING_PREFIX = ".staging-";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");
    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    private final EncryptedStore store;
    private final TaskRepository repository;
    private final Path backupsRoot;
    private final Path envelopeFile;
    private final int retention;
    private final Clock clock;
    private final Retry retry;

    public BackupManager(TaskVaultConfig config, EncryptedStore store, TaskRepository repository, Clock clock) {
        this.store = store;
        this.repository = repository;
        this.backupsRoot = config.backupsRoot();
        this.envelopeFile = config.envelopeFile();
        this.retention = Math.max(1, config.backupRetention());
        this.clock = clock;
        this.retry = Retry.defaults();
    }

    /**
     * Flushes pending task changes and snapshots every document while holding the storage lock
     * exclusively.
     */
    public BackupInfo create(BackupType type) {
        BackupType backupType = type == null ? BackupType.MANUAL : type;
        BackupInfo info = store.withExclusive("backup", () -> {
            repository.flush();
            Files.createDirectories(backupsRoot);
            Instant createdAt = clock.instant();
            String name = nameFor(createdAt, backupType);
            while (Files.exists(backupsRoot.resolve(name))) {
                createdAt = createdAt.plusMillis(1);
                name = nameFor(createdAt, backupType);
            }
            Path staging = backupsRoot.resolve(STAGING_PREFIX + UUID.randomUUID());
            Files.createDirectories(staging);
            boolean committed = false;
            try {
                List<String> files = new ArrayList<>();
                for (String document : store.documentNames()) {
                    Path source = store.documentFile(document);
                    AtomicFiles.copyDurably(source, staging.resolve(source.getFileName()));
                    files.add(source.getFileName().toString());
                }
                if (Files.isRegularFile(envelopeFile)) {
                    AtomicFiles.copyDurably(envelopeFile, staging.resolve(envelopeFile.getFileName()));
                    files.add(envelopeFile.getFileName().toString());
                }
                Manifest manifest = new Manifest(FORMAT_VERSION, backupType, createdAt, TaskVaultConfig.APP_VERSION, files);
                AtomicFiles.writeDurably(staging.resolve(MANIFEST_FILE), Jsons.toJson(manifest).getBytes(StandardCharsets.UTF_8));
                AtomicFiles.syncDirectory(staging);
                AtomicFiles.moveAtomically(staging, backupsRoot.resolve(name));
                committed = true;
                AtomicFiles.syncDirectory(backupsRoot);
                prune();
                return manifest.toInfo(name);
            } finally {
                if (!committed) {
                    deleteRecursively(staging);
                }
            }
        });
        log.info("Created {} backup {} with {} file(s)", backupType.dirName(), info.name(), info.files());
        return info;
    }

    /**
     * Completed backups, newest first. Staging leftovers and directories without a readable
     * manifest are skipped.
     */
    public List<BackupInfo> list() {
        if (!Files.isDirectory(backupsRoot)) {
            return List.of();
        }
        List<BackupInfo> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupsRoot)) {
            for (Path dir : stream) {
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || !Files.isDirectory(dir)) {
                    continue;
                }
                readManifest(dir).ifPresent(manifest -> out.add(manifest.toInfo(name)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list backups in " + backupsRoot, e);
        }
        out.sort(Comparator.comparing(BackupInfo::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(BackupInfo::name)
                .reversed());
        return out;
    }

    /**
     * Replaces the live documents with a snapshot and reloads the repository, all under the
     * exclusive storage lock. The live key envelope is kept; a snapshot that does not open under
     * the current session key is refused before anything is touched. A restore that cannot be
     * finished locks the store so stale in-memory state is never written over it.
     */
    public void restore(String name) {
        Path dir = resolveBackup(name);
        store.withExclusive("restore", () -> {
            if (!Files.isDirectory(dir)) {
                throw new NotFoundException("Backup", name);
            }
            Manifest manifest = readManifest(dir).orElseThrow(() -> new NotFoundException("Backup", name));
            if (manifest.formatVersion() != FORMAT_VERSION) {
                throw new VersionMismatchException(name, manifest.formatVersion(), FORMAT_VERSION);
            }
            Set<String> restored = new HashSet<>();
            for (String file : manifest.files()) {
                if (!file.endsWith(TaskVaultConfig.DOCUMENT_SUFFIX)) {
                    continue;
                }
                String document = file.substring(0, file.length() - TaskVaultConfig.DOCUMENT_SUFFIX.length());
                store.verifySealed(document, Files.readAllBytes(dir.resolve(file)));
                restored.add(document);
            }
            StagedCommit commit = StagedCommit.begin(store.rootDir(), "restore", retry);
            try {
                for (String document : restored) {
                    commit.stageCopy(document + TaskVaultConfig.DOCUMENT_SUFFIX,
                            dir.resolve(document + TaskVaultConfig.DOCUMENT_SUFFIX));
                }
                for (String live : store.documentNames()) {
                    if (!restored.contains(live)) {
                        commit.stageDelete(live + TaskVaultConfig.DOCUMENT_SUFFIX);
                    }
                }
                commit.commit();
            } catch (IncompleteCommitException e) {
                store.lock();
                log.error("Restore of {} could not be finished, store locked: {}", name, e.toString());
                throw e;
            } finally {
                commit.abort();
            }
            try {
                repository.reload();
            } catch (RuntimeException e) {
                // In-memory state predates the restore and must not be flushed over it.
                store.lock();
                throw e;
            }
            return null;
        });
        log.info("Restored backup {}", name);
    }

    /**
     * Removes staging directories left by a backup that was interrupted.
     */
    public int sweepStaging() {
        if (!Files.isDirectory(backupsRoot)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupsRoot, STAGING_PREFIX + "*")) {
            for (Path leftover : stream) {
                deleteRecursively(leftover);
                removed++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to sweep backup staging in " + backupsRoot, e);
        }
        if (removed > 0) {
            log.info("Removed {} interrupted backup staging director(ies)", removed);
        }
        return removed;
    }

    private void prune() throws IOException {
        List<BackupInfo> all = list();
        for (int i = retention; i < all.size(); i++) {
            String name = all.get(i).name();
            deleteRecursively(backupsRoot.resolve(name));
            log.info("Pruned backup {}", name);
        }
    }

    private Path resolveBackup(String name) {
        if (name == null || name.isBlank() || name.startsWith(".") || name.contains("/") || name.contains("\\")) {
            throw new NotFoundException("Backup", name);
        }
        return backupsRoot.resolve(name);
    }

    private Optional<Manifest> readManifest(Path dir) {
        Path file = dir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(file.toFile(), Manifest.class));
        } catch (IOException e) {
            log.warn("Ignoring backup {} with unreadable manifest: {}", dir.getFileName(), e.toString());
            return Optional.empty();
        }
    }

    private String nameFor(Instant createdAt, BackupType type) {
        return STAMP.withZone(clock.getZone()).format(createdAt) + "-" + type.dirName();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            for (Path p : stream.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record Manifest(int formatVersion, BackupType type, Instant createdAt, String appVersion, List<String> files) {
        Manifest {
            files = files == null ? List.of() : List.copyOf(files);
        }

        BackupInfo toInfo(String name) {
            return new BackupInfo(name, type, formatVersion, appVersion, createdAt, files.size());
        }
    }
}
