package io.taskvault.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.NotDirectoryException;
import java.util.Locale;

/**
 * Bounded retry with exponential backoff for filesystem operations.
 *
 * <p>Only transient-looking {@link IOException}s are retried. Permission problems, read-only
 * filesystems and over-long paths fail on the first attempt because another try cannot fix them.
 */
public final class Retry {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 50L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 1_000L;

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public Retry(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        this(maxAttempts, baseBackoffMs, maxBackoffMs, Thread::sleep);
    }

    Retry(int maxAttempts, long baseBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
    }

    public static Retry defaults() {
        return new Retry(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_BACKOFF_MS, DEFAULT_MAX_BACKOFF_MS);
    }

    public static Retry once() {
        return new Retry(1, 0L, 0L);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public void run(String operation, IoRunnable action) throws IOException {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public <T> T call(String operation, IoCallable<T> action) throws IOException {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.call();
            } catch (IOException e) {
                last = e;
                if (!isRetryable(e) || attempt == maxAttempts) {
                    break;
                }
                long backoff = backoffMs(attempt);
                log.debug("{} failed on attempt {}/{}, retrying in {}ms: {}",
                        operation, attempt, maxAttempts, backoff, e.toString());
                pause(backoff);
            }
        }
        throw last;
    }

    long backoffMs(int attempt) {
        long delay = baseBackoffMs;
        for (int i = 1; i < attempt && delay < maxBackoffMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoffMs);
    }

    static boolean isRetryable(IOException e) {
        if (e instanceof AccessDeniedException || e instanceof NotDirectoryException
                || e instanceof InterruptedIOException) {
            return false;
        }
        if (e instanceof FileSystemException fse) {
            String reason = fse.getReason() == null ? "" : fse.getReason().toLowerCase(Locale.ROOT);
            return !reason.contains("read-only") && !reason.contains("name too long");
        }
        return true;
    }

    private void pause(long millis) throws InterruptedIOException {
        if (millis <= 0L) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while backing off");
        }
    }

    @FunctionalInterface
    public interface IoCallable<T> {
        T call() throws IOException;
    }

    @FunctionalInterface
    public interface IoRunnable {
        void run() throws IOException;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
