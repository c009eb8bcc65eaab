package io.taskvault.config;

import java.nio.file.Path;

public final class TaskVaultConfig {
    public static final String APP_VERSION = "0.1.0";
    public static final String TASKS_DOCUMENT = "tasks";
    public static final String SETTINGS_DOCUMENT = "settings";
    public static final String DOCUMENT_SUFFIX = ".enc";
    public static final String ENVELOPE_FILE = "envelope.json";
    public static final String BACKUPS_DIR = "backups";

    // PBKDF2WithHmacSHA256 work factor; changing it only affects envelopes written afterwards.
    public static final int DEFAULT_KDF_ITERATIONS = 310_000;
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_BACKUP_RETENTION = 10;
    public static final long DEFAULT_RESET_CHECK_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_WEB_PORT = 8989;

    private final Path rootDir;
    private final int kdfIterations;
    private final long lockTimeoutMs;
    private final int backupRetention;
    private final long resetCheckIntervalMs;

    public TaskVaultConfig(Path rootDir, int kdfIterations, long lockTimeoutMs, int backupRetention, long resetCheckIntervalMs) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
        this.kdfIterations = Math.max(1, kdfIterations);
        this.lockTimeoutMs = Math.max(1L, lockTimeoutMs);
        this.backupRetention = Math.max(1, backupRetention);
        this.resetCheckIntervalMs = Math.max(10L, resetCheckIntervalMs);
    }

    public static TaskVaultConfig fromRoot(Path rootDir) {
        return new TaskVaultConfig(
                rootDir,
                DEFAULT_KDF_ITERATIONS,
                DEFAULT_LOCK_TIMEOUT_MS,
                DEFAULT_BACKUP_RETENTION,
                DEFAULT_RESET_CHECK_INTERVAL_MS
        );
    }

    public TaskVaultConfig withKdfIterations(int iterations) {
        return new TaskVaultConfig(rootDir, iterations, lockTimeoutMs, backupRetention, resetCheckIntervalMs);
    }

    public TaskVaultConfig withLockTimeoutMs(long timeoutMs) {
        return new TaskVaultConfig(rootDir, kdfIterations, timeoutMs, backupRetention, resetCheckIntervalMs);
    }

    public TaskVaultConfig withBackupRetention(int retention) {
        return new TaskVaultConfig(rootDir, kdfIterations, lockTimeoutMs, retention, resetCheckIntervalMs);
    }

    public Path rootDir() {
        return rootDir;
    }

    public int kdfIterations() {
        return kdfIterations;
    }

    public long lockTimeoutMs() {
        return lockTimeoutMs;
    }

    public int backupRetention() {
        return backupRetention;
    }

    public long resetCheckIntervalMs() {
        return resetCheckIntervalMs;
    }

    public Path documentFile(String name) {
        return rootDir.resolve(name + DOCUMENT_SUFFIX);
    }

    public Path envelopeFile() {
        return rootDir.resolve(ENVELOPE_FILE);
    }

    public Path backupsRoot() {
        return rootDir.resolve(BACKUPS_DIR);
    }
}
