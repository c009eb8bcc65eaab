package io.taskvault.storage;

import io.taskvault.error.StorageUnavailableException;
import io.taskvault.util.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Picks the first candidate directory that really accepts writes.
 *
 * <p>A candidate passes only when it can be created (or already exists as a directory) and a probe
 * file can be written, flushed, read back byte-for-byte and deleted. Existence alone proves nothing
 * on locked-down hosts, so a directory that was created but rejects the probe counts as a failure.
 */
public final class PathResolver {
    static final String PROBE_PREFIX = ".write-probe-";
    private static final String APP_DIR = "TaskVault";
    private static final Logger log = LoggerFactory.getLogger(PathResolver.class);

    private final List<Path> candidates;
    private final Retry retry;
    private final ProbeWriter probeWriter;

    public PathResolver(List<Path> candidates) {
        this(candidates, Retry.defaults(), PathResolver::writeProbe);
    }

    PathResolver(List<Path> candidates, Retry retry, ProbeWriter probeWriter) {
        this.candidates = List.copyOf(candidates);
        this.retry = retry;
        this.probeWriter = probeWriter;
    }

    public static List<Path> defaultCandidates(Path installDir, String override) {
        return candidatesFor(
                installDir,
                override,
                System.getenv(),
                System.getProperty("os.name", ""),
                System.getProperty("user.home", ""),
                System.getProperty("java.io.tmpdir", "")
        );
    }

    static List<Path> candidatesFor(
            Path installDir,
            String override,
            Map<String, String> env,
            String osName,
            String userHome,
            String tmpDir
    ) {
        LinkedHashSet<Path> out = new LinkedHashSet<>();
        addCandidate(out, override);
        addCandidate(out, env.get("TASKVAULT_ROOT"));
        if (installDir != null) {
            out.add(installDir.resolve("data").toAbsolutePath().normalize());
        }
        if (userHome != null && !userHome.isBlank()) {
            addCandidate(out, userHome, ".taskvault");
        }
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            if (appData != null && !appData.isBlank()) {
                addCandidate(out, appData, APP_DIR);
            } else if (userHome != null && !userHome.isBlank()) {
                addCandidate(out, userHome, "AppData", "Roaming", APP_DIR);
            }
        } else if (os.contains("mac")) {
            if (userHome != null && !userHome.isBlank()) {
                addCandidate(out, userHome, "Library", "Application Support", APP_DIR);
            }
        } else {
            String xdg = env.get("XDG_DATA_HOME");
            if (xdg != null && !xdg.isBlank()) {
                addCandidate(out, xdg, "taskvault");
            } else if (userHome != null && !userHome.isBlank()) {
                addCandidate(out, userHome, ".local", "share", "taskvault");
            }
        }
        if (tmpDir != null && !tmpDir.isBlank()) {
            addCandidate(out, tmpDir, "taskvault-data");
        }
        return new ArrayList<>(out);
    }

    private static void addCandidate(LinkedHashSet<Path> out, String first, String... more) {
        if (first == null || first.isBlank()) {
            return;
        }
        try {
            out.add(Path.of(first.trim(), more).toAbsolutePath().normalize());
        } catch (InvalidPathException e) {
            log.warn("Ignoring unusable storage candidate {}: {}", first, e.getMessage());
        }
    }

    public List<Path> candidates() {
        return candidates;
    }

    public StorageLocation resolve() {
        List<StorageLocation.Attempt> attempts = new ArrayList<>();
        for (Path candidate : candidates) {
            StorageLocation.Attempt attempt = probe(candidate);
            attempts.add(attempt);
            if (attempt.succeeded()) {
                log.info("Storage root resolved to {}", candidate);
                return new StorageLocation(candidates, candidate, attempts);
            }
            log.warn("Storage candidate {} rejected: {} {}", candidate, attempt.reason(), attempt.detail());
        }
        throw new StorageUnavailableException(attempts);
    }

    StorageLocation.Attempt probe(Path candidate) {
        Path dir = candidate.toAbsolutePath().normalize();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            return failed(dir, e);
        }
        if (!Files.isDirectory(dir)) {
            return new StorageLocation.Attempt(dir, StorageLocation.FailureReason.NOT_A_DIRECTORY, "exists but is not a directory");
        }
        final Path probe;
        try {
            probe = dir.resolve(PROBE_PREFIX + UUID.randomUUID());
        } catch (InvalidPathException e) {
            return new StorageLocation.Attempt(dir, StorageLocation.FailureReason.PATH_TOO_LONG, e.getMessage());
        }
        byte[] token = ("taskvault-probe:" + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        try {
            retry.run("write probe in " + dir, () -> {
                Files.deleteIfExists(probe);
                probeWriter.write(probe, token);
            });
            byte[] readBack = Files.readAllBytes(probe);
            if (!Arrays.equals(token, readBack)) {
                return new StorageLocation.Attempt(dir, StorageLocation.FailureReason.PROBE_MISMATCH,
                        "probe content did not read back intact");
            }
            Files.delete(probe);
            return new StorageLocation.Attempt(dir, StorageLocation.FailureReason.NONE, "");
        } catch (IOException e) {
            return failed(dir, e);
        } finally {
            cleanupProbe(probe);
        }
    }

    private static void cleanupProbe(Path probe) {
        try {
            Files.deleteIfExists(probe);
        } catch (IOException e) {
            log.warn("Could not remove write probe {}: {}", probe, e.toString());
        }
    }

    private static StorageLocation.Attempt failed(Path dir, IOException e) {
        return new StorageLocation.Attempt(dir, classify(e), e.getMessage() == null ? e.toString() : e.getMessage());
    }

    static StorageLocation.FailureReason classify(IOException e) {
        if (e instanceof AccessDeniedException) {
            return StorageLocation.FailureReason.PERMISSION_DENIED;
        }
        if (e instanceof NotDirectoryException || e instanceof FileAlreadyExistsException) {
            return StorageLocation.FailureReason.NOT_A_DIRECTORY;
        }
        String text = e instanceof FileSystemException fse && fse.getReason() != null
                ? fse.getReason()
                : String.valueOf(e.getMessage());
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("read-only")) {
            return StorageLocation.FailureReason.READ_ONLY_FILESYSTEM;
        }
        if (lower.contains("name too long") || lower.contains("path too long")) {
            return StorageLocation.FailureReason.PATH_TOO_LONG;
        }
        if (lower.contains("no space") || lower.contains("disk full") || lower.contains("not enough space")) {
            return StorageLocation.FailureReason.DISK_FULL;
        }
        if (lower.contains("permission denied") || lower.contains("access is denied")) {
            return StorageLocation.FailureReason.PERMISSION_DENIED;
        }
        return StorageLocation.FailureReason.IO_ERROR;
    }

    private static void writeProbe(Path probe, byte[] data) throws IOException {
        try (FileChannel channel = FileChannel.open(probe, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    @FunctionalInterface
    interface ProbeWriter {
        void write(Path probe, byte[] data) throws IOException;
    }
}
