package io.taskvault.runtime;

import io.taskvault.backup.BackupManager;
import io.taskvault.config.TaskVaultConfig;
import io.taskvault.error.SessionLockedException;
import io.taskvault.model.BackupInfo;
import io.taskvault.model.BackupType;
import io.taskvault.model.Settings;
import io.taskvault.model.SettingsPatch;
import io.taskvault.model.SlotChange;
import io.taskvault.model.StrikeMode;
import io.taskvault.model.Task;
import io.taskvault.model.TaskDraft;
import io.taskvault.model.TaskPatch;
import io.taskvault.model.TaskQuery;
import io.taskvault.security.KeyManager;
import io.taskvault.storage.EncryptedStore;
import io.taskvault.storage.StagedCommit;
import io.taskvault.storage.StorageLocation;
import io.taskvault.tasks.TaskImporter;
import io.taskvault.tasks.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Application context: owns every persistence component and both background timers for one
 * storage root.
 *
 * <p>Opening a runtime finishes or discards multi-file commits left by an interrupted run. Task and
 * backup operations are available once {@link #initialize(char[])} or {@link #login(char[])} has
 * unlocked the store.
 */
public final class TaskVaultRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskVaultRuntime.class);

    private final TaskVaultConfig config;
    private final StorageLocation location;
    private final Clock clock;
    private final KeyManager keyManager;
    private final EncryptedStore store;
    private final TaskRepository repository;
    private final BackupManager backups;
    private final TaskImporter importer;
    private final AutoSaveWorker autoSave;
    private final DailyResetScheduler dailyReset;
    private volatile boolean unlocked;
    private boolean closed;

    public TaskVaultRuntime(TaskVaultConfig config, StorageLocation location, Clock clock) {
        this.config = config;
        this.location = location;
        this.clock = clock;
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create storage root " + config.rootDir(), e);
        }
        recoverPendingCommits();
        this.keyManager = new KeyManager(config);
        this.store = new EncryptedStore(config);
        this.repository = new TaskRepository(store, clock);
        this.backups = new BackupManager(config, store, repository, clock);
        this.importer = new TaskImporter();
        this.autoSave = new AutoSaveWorker(repository);
        this.dailyReset = new DailyResetScheduler(repository, clock, config.resetCheckIntervalMs());
        repository.addSettingsListener(this::applySettings);
        backups.sweepStaging();
    }

    public static TaskVaultRuntime open(TaskVaultConfig config, StorageLocation location) {
        return new TaskVaultRuntime(config, location, Clock.systemDefaultZone());
    }

    public TaskVaultConfig config() {
        return config;
    }

    /**
     * Where the data lives and how it was chosen. Null location when the root was given directly.
     */
    public StorageLocation storage() {
        return location;
    }

    public boolean isInitialized() {
        return keyManager.isInitialized();
    }

    public boolean isUnlocked() {
        return unlocked;
    }

    /**
     * Current date on the clock that drives strikes and the daily reset.
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public synchronized void initialize(char[] password) {
        requireOpen();
        startSession(keyManager.initialize(password));
        log.info("Storage initialized at {}", config.rootDir());
    }

    public synchronized void login(char[] password) {
        requireOpen();
        if (!unlocked) {
            recoverPendingCommits();
        }
        SecretKey key = keyManager.login(password);
        if (!unlocked) {
            startSession(key);
        }
    }

    public synchronized void changePassword(char[] oldPassword, char[] newPassword) {
        changePassword(oldPassword, newPassword, store::rotate);
    }

    synchronized void changePassword(char[] oldPassword, char[] newPassword, KeyManager.Rekeyer rekeyer) {
        requireUnlocked();
        try {
            keyManager.changePassword(oldPassword, newPassword, rekeyer);
        } catch (RuntimeException e) {
            endSessionIfStoreLocked();
            throw e;
        }
    }

    /**
     * Writes pending changes, stops both timers and forgets the session key. A later
     * {@link #login(char[])} starts a fresh session. If the final write fails the session stays
     * open.
     */
    public synchronized void logout() {
        requireUnlocked();
        repository.flush();
        endSession();
        log.info("Session locked for {}", config.rootDir());
    }

    public Task create(TaskDraft draft) {
        requireUnlocked();
        return repository.create(draft);
    }

    public Task update(String id, TaskPatch patch) {
        requireUnlocked();
        return repository.update(id, patch);
    }

    public void delete(String id) {
        requireUnlocked();
        repository.delete(id);
    }

    public Task get(String id) {
        requireUnlocked();
        return repository.get(id);
    }

    public List<Task> list(TaskQuery query) {
        requireUnlocked();
        return repository.list(query);
    }

    public Task strike(String id, StrikeMode mode, String report) {
        requireUnlocked();
        return repository.strike(id, mode, report);
    }

    public Task undoStrike(String id) {
        requireUnlocked();
        return repository.undoStrike(id);
    }

    public Task complete(String id) {
        requireUnlocked();
        return repository.complete(id);
    }

    public Task uncomplete(String id) {
        requireUnlocked();
        return repository.uncomplete(id);
    }

    public Task schedule(String id, String hour, LocalDate date, Integer duration) {
        requireUnlocked();
        return repository.schedule(id, hour, date, duration);
    }

    public Task unschedule(String id) {
        requireUnlocked();
        return repository.unschedule(id);
    }

    public List<Task> applySchedule(List<SlotChange> changes) {
        requireUnlocked();
        return repository.applySchedule(changes);
    }

    public List<Task> scheduleFor(LocalDate date) {
        requireUnlocked();
        return repository.scheduleFor(date);
    }

    public TaskRepository.ImportResult importTasks(TaskImporter.Format format, String content) {
        requireUnlocked();
        TaskImporter.Parsed parsed = importer.parse(format, content);
        TaskRepository.ImportResult result = repository.importTasks(parsed.drafts());
        List<String> errors = new ArrayList<>(parsed.errors());
        errors.addAll(result.errors());
        return new TaskRepository.ImportResult(result.imported(), errors);
    }

    public Settings settings() {
        requireUnlocked();
        return repository.settings();
    }

    public Settings updateSettings(SettingsPatch patch) {
        requireUnlocked();
        return repository.updateSettings(patch);
    }

    public List<BackupInfo> listBackups() {
        requireUnlocked();
        return backups.list();
    }

    public BackupInfo createBackup(BackupType type) {
        requireUnlocked();
        return backups.create(type);
    }

    public void restoreBackup(String name) {
        requireUnlocked();
        try {
            backups.restore(name);
        } catch (RuntimeException e) {
            endSessionIfStoreLocked();
            throw e;
        }
    }

    public boolean flush() {
        requireUnlocked();
        return autoSave.flushNow();
    }

    AutoSaveWorker autoSave() {
        return autoSave;
    }

    DailyResetScheduler dailyReset() {
        return dailyReset;
    }

    /**
     * Stops both timers, writes pending changes and forgets the session key.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        dailyReset.shutdown();
        autoSave.shutdown();
        unlocked = false;
        store.lock();
        log.info("Runtime closed for {}", config.rootDir());
    }

    private void startSession(SecretKey key) {
        store.open(key);
        repository.reload();
        Settings settings = repository.settings();
        autoSave.start(settings.autosaveIntervalSeconds() * 1_000L);
        dailyReset.start(LocalTime.parse(settings.dailyResetTime()));
        unlocked = true;
    }

    private void recoverPendingCommits() {
        try {
            StagedCommit.RecoveryOutcome recovered = StagedCommit.recover(config.rootDir());
            if (recovered.rolledForward() > 0 || recovered.discarded() > 0) {
                log.warn("Recovered interrupted commits: {} completed, {} discarded",
                        recovered.rolledForward(), recovered.discarded());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to recover storage root " + config.rootDir(), e);
        }
    }

    private synchronized void endSession() {
        autoSave.stop();
        dailyReset.stop();
        store.lock();
        unlocked = false;
    }

    private void endSessionIfStoreLocked() {
        if (unlocked && !store.isOpen()) {
            log.error("Store was locked by a failed commit; log in again once storage is repaired");
            endSession();
        }
    }

    private void applySettings(Settings settings) {
        autoSave.reschedule(settings.autosaveIntervalSeconds() * 1_000L);
        dailyReset.reschedule(LocalTime.parse(settings.dailyResetTime()));
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Runtime is closed");
        }
    }

    private void requireUnlocked() {
        if (!unlocked) {
            throw new SessionLockedException();
        }
    }
}
