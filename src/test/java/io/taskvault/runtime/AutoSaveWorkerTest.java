package io.taskvault.runtime;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.TaskDraft;
import io.taskvault.model.TaskQuery;
import io.taskvault.storage.EncryptedStore;
import io.taskvault.tasks.TaskRepository;
import io.taskvault.util.MutableClock;
import io.taskvault.util.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.crypto.spec.SecretKeySpec;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoSaveWorkerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final TempDirs temp = new TempDirs();

    @AfterEach
    void deleteTempDirs() throws Exception {
        temp.deleteAll();
    }

    @Test
    void tickShouldFlushDirtyState() throws Exception {
        EncryptedStore store = openStore();
        TaskRepository repository = new TaskRepository(store, new MutableClock(NOW));
        repository.reload();
        AutoSaveWorker worker = new AutoSaveWorker(repository);
        try {
            worker.start(20L);
            repository.create(TaskDraft.titled("Autosaved"));

            long deadline = System.currentTimeMillis() + 5_000L;
            while (repository.isDirty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }

            assertFalse(repository.isDirty());
            assertEquals(1, reloaded(store).list(TaskQuery.all()).size());
        } finally {
            worker.shutdown();
        }
    }

    @Test
    void shutdownShouldWritePendingChanges() throws Exception {
        EncryptedStore store = openStore();
        TaskRepository repository = new TaskRepository(store, new MutableClock(NOW));
        repository.reload();
        AutoSaveWorker worker = new AutoSaveWorker(repository);
        worker.start(60_000L);
        repository.create(TaskDraft.titled("Saved on exit"));

        worker.shutdown();

        assertFalse(repository.isDirty());
        assertEquals(1, reloaded(store).list(TaskQuery.all()).size());
        assertThrows(IllegalStateException.class, () -> worker.start(1_000L));
    }

    @Test
    void rescheduleShouldOnlyApplyToRunningWorker() throws Exception {
        TaskRepository repository = new TaskRepository(openStore(), new MutableClock(NOW));
        repository.reload();
        AutoSaveWorker worker = new AutoSaveWorker(repository);
        try {
            worker.reschedule(5_000L);
            assertEquals(0L, worker.intervalMs());

            worker.start(30_000L);
            worker.reschedule(120_000L);
            assertEquals(120_000L, worker.intervalMs());
        } finally {
            worker.shutdown();
        }
    }

    @Test
    void flushNowShouldReportWhetherAnythingWasWritten() throws Exception {
        TaskRepository repository = new TaskRepository(openStore(), new MutableClock(NOW));
        repository.reload();
        AutoSaveWorker worker = new AutoSaveWorker(repository);
        try {
            assertFalse(worker.flushNow());
            repository.create(TaskDraft.titled("x"));
            assertTrue(worker.flushNow());
        } finally {
            worker.shutdown();
        }
    }

    @Test
    void secondFlushShouldBeSkippedWhileOneIsRunning() throws Exception {
        EncryptedStore store = openStore();
        TaskRepository repository = new TaskRepository(store, new MutableClock(NOW));
        repository.reload();
        AutoSaveWorker worker = new AutoSaveWorker(repository);
        repository.create(TaskDraft.titled("Queued"));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<Object> holdStorage = () -> store.withExclusive("hold", () -> {
                holding.countDown();
                awaitQuietly(release);
                return null;
            });
            Future<Object> holder = pool.submit(holdStorage);
            assertTrue(holding.await(5, TimeUnit.SECONDS));
            Callable<Boolean> blockedFlush = worker::flushNow;
            Future<Boolean> first = pool.submit(blockedFlush);
            long deadline = System.currentTimeMillis() + 5_000L;
            while (!worker.isFlushing() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5L);
            }
            assertTrue(worker.isFlushing());

            assertFalse(worker.flushNow());
            assertTrue(repository.isDirty());
            assertFalse(Files.exists(store.documentFile(TaskVaultConfig.TASKS_DOCUMENT)));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            assertTrue(first.get(5, TimeUnit.SECONDS));
            assertFalse(repository.isDirty());
            assertEquals(1, reloaded(store).list(TaskQuery.all()).size());
        } finally {
            release.countDown();
            pool.shutdownNow();
            worker.shutdown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private EncryptedStore openStore() throws Exception {
        EncryptedStore store = new EncryptedStore(TaskVaultConfig.fromRoot(temp.create("taskvault-autosave-test-")));
        byte[] raw = new byte[32];
        Arrays.fill(raw, (byte) 3);
        store.open(new SecretKeySpec(raw, "AES"));
        return store;
    }

    private static TaskRepository reloaded(EncryptedStore store) {
        TaskRepository repository = new TaskRepository(store, new MutableClock(NOW));
        repository.reload();
        return repository;
    }
}
