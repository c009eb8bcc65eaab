package io.taskvault.runtime;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.StrikeMode;
import io.taskvault.model.Task;
import io.taskvault.model.TaskDraft;
import io.taskvault.model.TasksDocument;
import io.taskvault.storage.EncryptedStore;
import io.taskvault.tasks.TaskRepository;
import io.taskvault.util.MutableClock;
import io.taskvault.util.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.crypto.spec.SecretKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DailyResetSchedulerTest {
    private static final long NEVER_MS = 3_600_000L;

    private final TempDirs temp = new TempDirs();

    @AfterEach
    void deleteTempDirs() throws Exception {
        temp.deleteAll();
    }

    @Test
    void checkShouldFireOnceTargetIsReached() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        TaskRepository repository = repository(clock);
        Task task = repository.create(TaskDraft.titled("Stretch"));
        repository.strike(task.id(), StrikeMode.TODAY, "done");
        DailyResetScheduler scheduler = new DailyResetScheduler(repository, clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));
            assertTrue(repository.get(task.id()).struckToday());
            assertFalse(scheduler.check());

            clock.advance(Duration.ofMinutes(61));

            assertTrue(scheduler.check());
            assertFalse(repository.get(task.id()).struckToday());
            assertEquals(Instant.parse("2024-05-02T09:00:00Z"), scheduler.nextFireAt().orElseThrow());
            assertFalse(scheduler.check());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void wakingAfterSeveralDaysShouldResetOnce() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        TaskRepository repository = repository(clock);
        DailyResetScheduler scheduler = new DailyResetScheduler(repository, clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));
            clock.advance(Duration.ofDays(3));

            assertTrue(scheduler.check());
            assertFalse(scheduler.check());
            assertEquals(Instant.parse("2024-05-04T09:00:00Z"), scheduler.nextFireAt().orElseThrow());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void missedResetShouldRunOnStart() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        TaskRepository repository = repository(clock);
        repository.resetDailyStrikes();
        Task task = repository.create(TaskDraft.titled("Read"));
        repository.strike(task.id(), StrikeMode.TODAY, "chapter");
        clock.set(Instant.parse("2024-05-02T12:00:00Z"));
        DailyResetScheduler scheduler = new DailyResetScheduler(repository, clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));

            assertFalse(repository.get(task.id()).struckToday());
            assertEquals(Instant.parse("2024-05-02T12:00:00Z"), repository.lastDailyReset().orElseThrow());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void freshVaultShouldKeepStrikesMadeAfterTodaysReset() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        TaskRepository repository = repository(clock);
        Task task = repository.create(TaskDraft.titled("Read"));
        repository.strike(task.id(), StrikeMode.TODAY, "chapter");
        DailyResetScheduler scheduler = new DailyResetScheduler(repository, clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));

            assertTrue(repository.get(task.id()).struckToday());
            assertEquals(Instant.parse("2024-05-01T12:00:00Z"), repository.lastDailyReset().orElseThrow());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void firstDayStrikeShouldBeClearedWhenNextResetWasMissed() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        EncryptedStore store = openStore();
        TaskRepository firstDay = new TaskRepository(store, clock);
        firstDay.reload();
        Task task = firstDay.create(TaskDraft.titled("Read"));
        firstDay.strike(task.id(), StrikeMode.TODAY, "chapter");
        firstDay.flush();

        clock.set(Instant.parse("2024-05-02T10:00:00Z"));
        TaskRepository nextDay = new TaskRepository(store, clock);
        nextDay.reload();
        DailyResetScheduler scheduler = new DailyResetScheduler(nextDay, clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));

            Task after = nextDay.get(task.id());
            assertFalse(after.struckToday());
            assertEquals(0, after.strikesToday());
            assertEquals(Instant.parse("2024-05-03T09:00:00Z"), scheduler.nextFireAt().orElseThrow());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void documentWithoutResetStampShouldResetStaleStrikes() throws Exception {
        EncryptedStore store = openStore();
        Task stale = new Task.Builder()
                .id("legacy")
                .title("Old habit")
                .description("")
                .project("")
                .estimatedDuration(30)
                .struckToday(true)
                .strikeCount(1)
                .dailyStrikes(1, LocalDate.parse("2024-05-01"))
                .createdAt(Instant.parse("2024-05-01T08:00:00Z"))
                .updatedAt(Instant.parse("2024-05-01T08:00:00Z"))
                .build();
        store.save(TaskVaultConfig.TASKS_DOCUMENT, new TasksDocument(TasksDocument.FORMAT_VERSION, List.of(stale), null));
        MutableClock clock = new MutableClock(Instant.parse("2024-05-02T10:00:00Z"));
        TaskRepository repository = new TaskRepository(store, clock);
        repository.reload();
        assertTrue(repository.lastDailyReset().isEmpty());
        DailyResetScheduler scheduler = new DailyResetScheduler(repository, clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));

            assertFalse(repository.get("legacy").struckToday());
            assertEquals(1, repository.get("legacy").strikeCount());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void stoppedSchedulerShouldStartAgain() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        DailyResetScheduler scheduler = new DailyResetScheduler(repository(clock), clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));
            scheduler.stop();
            assertTrue(scheduler.nextFireAt().isEmpty());
            assertFalse(scheduler.check());

            scheduler.start(LocalTime.of(10, 0));

            assertEquals(Instant.parse("2024-05-01T10:00:00Z"), scheduler.nextFireAt().orElseThrow());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void rescheduleShouldReplaceTarget() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        DailyResetScheduler scheduler = new DailyResetScheduler(repository(clock), clock, NEVER_MS);
        try {
            scheduler.start(LocalTime.of(9, 0));

            scheduler.reschedule(LocalTime.of(7, 0));

            assertEquals(LocalTime.of(7, 0), scheduler.resetTime());
            assertEquals(Instant.parse("2024-05-02T07:00:00Z"), scheduler.nextFireAt().orElseThrow());
            clock.advance(Duration.ofMinutes(90));
            assertFalse(scheduler.check());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void occurrencesShouldFollowLocalZone() {
        ZoneId zone = ZoneId.of("Europe/Berlin");
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 30, 10, 0, 0, 0, zone);

        assertEquals(ZonedDateTime.of(2024, 3, 31, 9, 0, 0, 0, zone),
                DailyResetScheduler.nextOccurrence(LocalTime.of(9, 0), now));
        assertEquals(ZonedDateTime.of(2024, 3, 30, 11, 0, 0, 0, zone),
                DailyResetScheduler.nextOccurrence(LocalTime.of(11, 0), now));
        assertEquals(ZonedDateTime.of(2024, 3, 30, 9, 0, 0, 0, zone),
                DailyResetScheduler.mostRecentOccurrence(LocalTime.of(9, 0), now));
        assertEquals(ZonedDateTime.of(2024, 3, 29, 11, 0, 0, 0, zone),
                DailyResetScheduler.mostRecentOccurrence(LocalTime.of(11, 0), now));
    }

    private TaskRepository repository(MutableClock clock) throws Exception {
        TaskRepository repository = new TaskRepository(openStore(), clock);
        repository.reload();
        return repository;
    }

    private EncryptedStore openStore() throws Exception {
        EncryptedStore store = new EncryptedStore(TaskVaultConfig.fromRoot(temp.create("taskvault-reset-test-")));
        byte[] raw = new byte[32];
        Arrays.fill(raw, (byte) 4);
        store.open(new SecretKeySpec(raw, "AES"));
        return store;
    }
}
