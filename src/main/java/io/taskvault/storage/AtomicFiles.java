package io.taskvault.storage;

import io.taskvault.util.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Temp-write, fsync, atomic-rename helpers. The previous file stays readable until the rename commits.
 */
public final class AtomicFiles {
    static final String TEMP_MARKER = ".tmp-";
    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {
    }

    public static void write(Path target, byte[] data, Retry retry) throws IOException {
        write(target, data, retry, temp -> {
        });
    }

    static void write(Path target, byte[] data, Retry retry, BeforeReplace beforeReplace) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        retry.run("write " + target.getFileName(), () -> {
            Path temp = dir.resolve("." + target.getFileName() + TEMP_MARKER + UUID.randomUUID());
            boolean committed = false;
            try {
                writeDurably(temp, data);
                beforeReplace.accept(temp);
                moveAtomically(temp, target);
                committed = true;
            } finally {
                if (!committed) {
                    Files.deleteIfExists(temp);
                }
            }
        });
        syncDirectory(dir);
    }

    public static void writeDurably(Path file, byte[] data) throws IOException {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    public static void copyDurably(Path source, Path target) throws IOException {
        writeDurably(target, Files.readAllBytes(source));
    }

    public static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static void syncDirectory(Path dir) {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            // Some platforms (Windows) cannot open a directory as a channel.
            log.debug("Directory sync not available for {}: {}", dir, e.toString());
        }
    }

    public static int sweepTempFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + TEMP_MARKER + "*")) {
            for (Path leftover : stream) {
                if (Files.isRegularFile(leftover) && Files.deleteIfExists(leftover)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("Removed {} interrupted temp file(s) from {}", removed, dir);
        }
        return removed;
    }

    @FunctionalInterface
    interface BeforeReplace {
        void accept(Path temp) throws IOException;
    }
}
