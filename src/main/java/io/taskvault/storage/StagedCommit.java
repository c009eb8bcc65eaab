package io.taskvault.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.taskvault.util.Jsons;
import io.taskvault.util.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Replaces several files in the storage root as one unit.
 *
 * <p>New contents are staged in a hidden directory next to the live files. Writing the journal is
 * the commit point: before it exists the staging directory is garbage and the live files are
 * untouched; after it exists the replacement is rolled forward, at once or by {@link #recover}
 * on the next start.
 */
public final class StagedCommit {
    static final String DIR_PREFIX = ".commit-";
    static final String JOURNAL_FILE = "journal.json";
    private static final Logger log = LoggerFactory.getLogger(StagedCommit.class);

    private final Path root;
    private final Path stagingDir;
    private final String operation;
    private final Retry retry;
    private final List<String> replaced = new ArrayList<>();
    private final List<String> deleted = new ArrayList<>();
    private boolean committed;

    private StagedCommit(Path root, Path stagingDir, String operation, Retry retry) {
        this.root = root;
        this.stagingDir = stagingDir;
        this.operation = operation;
        this.retry = retry;
    }

    public static StagedCommit begin(Path root, String operation, Retry retry) throws IOException {
        Path staging = root.resolve(DIR_PREFIX + operation + "-" + UUID.randomUUID());
        Files.createDirectories(staging);
        return new StagedCommit(root, staging, operation, retry);
    }

    public void stage(String fileName, byte[] contents) throws IOException {
        requirePlainName(fileName);
        AtomicFiles.writeDurably(stagingDir.resolve(fileName), contents);
        replaced.add(fileName);
    }

    public void stageCopy(String fileName, Path source) throws IOException {
        requirePlainName(fileName);
        AtomicFiles.copyDurably(source, stagingDir.resolve(fileName));
        replaced.add(fileName);
    }

    public void stageDelete(String fileName) {
        requirePlainName(fileName);
        deleted.add(fileName);
    }

    /**
     * Writes the journal and replaces the live files. A failed replacement is retried once through
     * {@link #recover(Path)}; if that fails too the commit stays pending on disk and
     * {@link IncompleteCommitException} is thrown. Callers must hold the root exclusively.
     */
    public void commit() throws IOException {
        Journal journal = writeJournal();
        try {
            apply(root, stagingDir, journal);
        } catch (IOException first) {
            log.warn("Applying '{}' commit failed, retrying from its journal: {}", operation, first.toString());
            try {
                recover(root);
            } catch (IOException second) {
                second.addSuppressed(first);
                throw new IncompleteCommitException(operation, stagingDir, second);
            }
        }
    }

    public void abort() {
        if (committed) {
            return;
        }
        try {
            deleteRecursively(stagingDir);
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", stagingDir, e.toString());
        }
    }

    Journal writeJournal() throws IOException {
        AtomicFiles.syncDirectory(stagingDir);
        Journal journal = new Journal(operation, List.copyOf(replaced), List.copyOf(deleted), Instant.now().toString());
        AtomicFiles.write(stagingDir.resolve(JOURNAL_FILE), Jsons.toCompactBytes(journal), retry);
        committed = true;
        return journal;
    }

    Path stagingDir() {
        return stagingDir;
    }

    /**
     * Finishes committed replacements and discards uncommitted ones left by an interrupted run.
     */
    public static RecoveryOutcome recover(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return new RecoveryOutcome(0, 0);
        }
        List<Path> pending = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, DIR_PREFIX + "*")) {
            for (Path dir : stream) {
                if (Files.isDirectory(dir)) {
                    pending.add(dir);
                }
            }
        }
        pending.sort(Comparator.comparing(Path::toString));
        int rolledForward = 0;
        int discarded = 0;
        for (Path dir : pending) {
            if (Files.isRegularFile(dir.resolve(JOURNAL_FILE))) {
                Journal journal = readJournal(dir);
                log.warn("Completing interrupted '{}' commit from {}", journal.operation(), dir.getFileName());
                apply(root, dir, journal);
                rolledForward++;
            } else {
                log.warn("Discarding uncommitted staging directory {}", dir.getFileName());
                deleteRecursively(dir);
                discarded++;
            }
        }
        return new RecoveryOutcome(rolledForward, discarded);
    }

    private static void apply(Path root, Path staging, Journal journal) throws IOException {
        for (String name : journal.replace()) {
            Path staged = staging.resolve(name);
            // Already moved by an earlier, interrupted apply.
            if (Files.exists(staged)) {
                AtomicFiles.moveAtomically(staged, root.resolve(name));
            }
        }
        for (String name : journal.delete()) {
            Files.deleteIfExists(root.resolve(name));
        }
        AtomicFiles.syncDirectory(root);
        deleteRecursively(staging);
    }

    private static Journal readJournal(Path staging) throws IOException {
        return Jsons.mapper().readValue(staging.resolve(JOURNAL_FILE).toFile(), Journal.class);
    }

    private static void requirePlainName(String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")
                || fileName.equals(JOURNAL_FILE) || fileName.startsWith(".")) {
            throw new IllegalArgumentException("Invalid staged file name: " + fileName);
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            for (Path p : stream.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record Journal(String operation, List<String> replace, List<String> delete, String createdAt) {
    }

    public record RecoveryOutcome(int rolledForward, int discarded) {
    }
}
