package io.taskvault.backup;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskvault.config.TaskVaultConfig;
import io.taskvault.error.DecryptionFailedException;
import io.taskvault.error.NotFoundException;
import io.taskvault.error.SessionLockedException;
import io.taskvault.error.VersionMismatchException;
import io.taskvault.model.BackupInfo;
import io.taskvault.model.BackupType;
import io.taskvault.model.Settings;
import io.taskvault.model.SettingsPatch;
import io.taskvault.model.Task;
import io.taskvault.model.TaskDraft;
import io.taskvault.model.TaskQuery;
import io.taskvault.storage.EncryptedStore;
import io.taskvault.storage.StagedCommit;
import io.taskvault.tasks.TaskRepository;
import io.taskvault.util.Jsons;
import io.taskvault.util.MutableClock;
import io.taskvault.util.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackupManagerTest {
    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private final TempDirs temp = new TempDirs();

    @AfterEach
    void deleteTempDirs() throws Exception {
        temp.deleteAll();
    }

    @Test
    void backupShouldHoldCiphertextAndManifest() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);
        f.repository.create(TaskDraft.titled("Write report"));

        BackupInfo info = f.backups.create(BackupType.MANUAL);

        assertEquals("20240501-100000-000-manual", info.name());
        assertEquals(BackupManager.FORMAT_VERSION, info.formatVersion());
        assertEquals(2, info.files());
        Path dir = f.config.backupsRoot().resolve(info.name());
        assertTrue(Files.isRegularFile(dir.resolve(BackupManager.MANIFEST_FILE)));
        assertArrayEquals(Files.readAllBytes(f.config.documentFile(TaskVaultConfig.TASKS_DOCUMENT)),
                Files.readAllBytes(dir.resolve("tasks.enc")));
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.toList()) {
                assertFalse(Files.readString(file).contains("Write report"), file.toString());
            }
        }
        assertEquals(List.of(info), f.backups.list());
    }

    @Test
    void restoreShouldBringBackStateAtBackupTime() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);
        Task kept = f.repository.create(TaskDraft.titled("Kept"));
        f.repository.flush();
        f.repository.create(TaskDraft.titled("Unflushed"));
        BackupInfo info = f.backups.create(BackupType.MANUAL);

        f.repository.create(TaskDraft.titled("Later"));
        f.repository.delete(kept.id());
        f.repository.flush();

        f.backups.restore(info.name());

        assertEquals(Set.of("Kept", "Unflushed"), titles(f.repository));
        assertFalse(f.repository.isDirty());
        TaskRepository reopened = new TaskRepository(f.store, f.clock);
        reopened.reload();
        assertEquals(Set.of("Kept", "Unflushed"), titles(reopened));
    }

    @Test
    void restoreShouldRemoveDocumentsMissingFromSnapshot() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);
        f.repository.create(TaskDraft.titled("Only tasks"));
        BackupInfo info = f.backups.create(BackupType.AUTOMATIC);
        f.repository.updateSettings(SettingsPatch.empty().withTheme("blue"));
        assertTrue(Files.exists(f.config.documentFile(TaskVaultConfig.SETTINGS_DOCUMENT)));

        f.backups.restore(info.name());

        assertFalse(Files.exists(f.config.documentFile(TaskVaultConfig.SETTINGS_DOCUMENT)));
        assertEquals(Settings.DEFAULT_THEME, f.repository.settings().theme());
    }

    @Test
    void restoreThatCannotFinishShouldLockStoreAndKeepStaleStateOffDisk() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);
        f.repository.updateSettings(SettingsPatch.empty().withTheme("snapshot"));
        f.repository.create(TaskDraft.titled("Snapshot"));
        BackupInfo info = f.backups.create(BackupType.MANUAL);
        f.repository.create(TaskDraft.titled("Live"));
        f.repository.flush();
        Path settingsFile = f.config.documentFile(TaskVaultConfig.SETTINGS_DOCUMENT);
        Files.delete(settingsFile);
        Files.createDirectories(settingsFile);
        Files.writeString(settingsFile.resolve("blocker"), "x");

        assertThrows(UncheckedIOException.class, () -> f.backups.restore(info.name()));

        assertFalse(f.store.isOpen());
        f.repository.create(TaskDraft.titled("Stale"));
        assertThrows(SessionLockedException.class, f.repository::flush);

        Files.delete(settingsFile.resolve("blocker"));
        Files.delete(settingsFile);
        StagedCommit.recover(f.config.rootDir());
        f.store.open(key(1));
        TaskRepository reopened = new TaskRepository(f.store, f.clock);
        reopened.reload();
        assertEquals(Set.of("Snapshot"), titles(reopened));
        assertEquals("snapshot", reopened.settings().theme());
    }

    @Test
    void unknownBackupShouldBeNotFound() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);

        assertThrows(NotFoundException.class, () -> f.backups.restore("20200101-000000-000-manual"));
        assertThrows(NotFoundException.class, () -> f.backups.restore("../tasks"));
        assertThrows(NotFoundException.class, () -> f.backups.restore(""));
    }

    @Test
    void newerFormatShouldBeRefusedWithoutTouchingLiveData() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);
        f.repository.create(TaskDraft.titled("Old"));
        BackupInfo info = f.backups.create(BackupType.MANUAL);
        Path manifest = f.config.backupsRoot().resolve(info.name()).resolve(BackupManager.MANIFEST_FILE);
        ObjectNode node = (ObjectNode) Jsons.mapper().readTree(manifest.toFile());
        node.put("format_version", 99);
        Files.writeString(manifest, Jsons.toJson(node));
        f.repository.create(TaskDraft.titled("New"));
        f.repository.flush();

        VersionMismatchException error = assertThrows(VersionMismatchException.class, () -> f.backups.restore(info.name()));

        assertTrue(error.getMessage().contains("99"));
        assertEquals(Set.of("Old", "New"), titles(f.repository));
    }

    @Test
    void snapshotUnderAnotherKeyShouldBeRefused() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);
        f.repository.create(TaskDraft.titled("Mine"));
        BackupInfo info = f.backups.create(BackupType.MANUAL);
        Path other = temp.create("taskvault-backup-foreign-test-");
        EncryptedStore foreign = new EncryptedStore(TaskVaultConfig.fromRoot(other));
        foreign.open(key(7));
        foreign.save(TaskVaultConfig.TASKS_DOCUMENT, List.of());
        Files.copy(foreign.documentFile(TaskVaultConfig.TASKS_DOCUMENT),
                f.config.backupsRoot().resolve(info.name()).resolve("tasks.enc"),
                StandardCopyOption.REPLACE_EXISTING);
        byte[] live = Files.readAllBytes(f.config.documentFile(TaskVaultConfig.TASKS_DOCUMENT));

        assertThrows(DecryptionFailedException.class, () -> f.backups.restore(info.name()));

        assertArrayEquals(live, Files.readAllBytes(f.config.documentFile(TaskVaultConfig.TASKS_DOCUMENT)));
        assertEquals(Set.of("Mine"), titles(f.repository));
    }

    @Test
    void retentionShouldKeepNewestBackups() throws Exception {
        Fixture f = fixture(2);
        BackupInfo first = f.backups.create(BackupType.MANUAL);
        f.clock.advance(Duration.ofMinutes(1));
        BackupInfo second = f.backups.create(BackupType.AUTOMATIC);
        f.clock.advance(Duration.ofMinutes(1));
        BackupInfo third = f.backups.create(BackupType.PRE_UPDATE);

        List<BackupInfo> listed = f.backups.list();

        assertEquals(List.of(third.name(), second.name()), listed.stream().map(BackupInfo::name).toList());
        assertFalse(Files.exists(f.config.backupsRoot().resolve(first.name())));
        assertTrue(third.name().endsWith("-pre-update"));
    }

    @Test
    void backupsInSameMillisecondShouldGetDistinctNames() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);

        BackupInfo a = f.backups.create(BackupType.MANUAL);
        BackupInfo b = f.backups.create(BackupType.MANUAL);

        assertFalse(a.name().equals(b.name()));
        assertEquals(2, f.backups.list().size());
    }

    @Test
    void stagingLeftoversShouldStayInvisibleAndBeSwept() throws Exception {
        Fixture f = fixture(TaskVaultConfig.DEFAULT_BACKUP_RETENTION);
        Path leftover = f.config.backupsRoot().resolve(BackupManager.STAGING_PREFIX + "crashed");
        Files.createDirectories(leftover);
        Files.writeString(leftover.resolve(BackupManager.MANIFEST_FILE),
                "{\"format_version\":1,\"type\":\"manual\",\"files\":[]}", StandardCharsets.UTF_8);
        Files.createDirectories(f.config.backupsRoot().resolve("no-manifest"));

        assertTrue(f.backups.list().isEmpty());
        assertEquals(1, f.backups.sweepStaging());
        assertFalse(Files.exists(leftover));
    }

    private static Set<String> titles(TaskRepository repository) {
        return repository.list(TaskQuery.all()).stream().map(Task::title).collect(Collectors.toSet());
    }

    private Fixture fixture(int retention) throws Exception {
        Path root = temp.create("taskvault-backup-test-");
        TaskVaultConfig config = TaskVaultConfig.fromRoot(root).withBackupRetention(retention);
        Files.writeString(config.envelopeFile(), "{}");
        EncryptedStore store = new EncryptedStore(config);
        store.open(key(1));
        MutableClock clock = new MutableClock(START);
        TaskRepository repository = new TaskRepository(store, clock);
        repository.reload();
        return new Fixture(config, store, clock, repository, new BackupManager(config, store, repository, clock));
    }

    private static SecretKey key(int seed) {
        byte[] raw = new byte[32];
        Arrays.fill(raw, (byte) seed);
        return new SecretKeySpec(raw, "AES");
    }

    private record Fixture(TaskVaultConfig config, EncryptedStore store, MutableClock clock,
                           TaskRepository repository, BackupManager backups) {
    }
}
