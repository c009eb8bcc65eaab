package io.taskvault.runtime;

import io.taskvault.tasks.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Clears the "struck today" state once a day at a configured wall-clock time.
 *
 * <p>Rather than sleeping until the target, the scheduler checks the clock at a fixed interval and
 * fires once {@code now} has reached the target. A machine that was suspended across the reset
 * time therefore resets on its first check after waking.
 */
public final class DailyResetScheduler {
    private static final Logger log = LoggerFactory.getLogger(DailyResetScheduler.class);

    private final TaskRepository repository;
    private final Clock clock;
    private final long checkIntervalMs;
    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> pending;
    private LocalTime resetTime;
    private ZonedDateTime nextFireAt;

    public DailyResetScheduler(TaskRepository repository, Clock clock, long checkIntervalMs) {
        this.repository = repository;
        this.clock = clock;
        this.checkIntervalMs = Math.max(1L, checkIntervalMs);
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "taskvault-daily-reset");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Arms the timer. If a reset was due while the process was not running, it happens now.
     */
    public synchronized void start(LocalTime time) {
        if (pending != null) {
            throw new IllegalStateException("Daily reset scheduler already started");
        }
        arm(time);
        catchUp();
        pending = executor.scheduleWithFixedDelay(this::check, checkIntervalMs, checkIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Moves the daily target. The previous target is discarded before this returns.
     */
    public synchronized void reschedule(LocalTime time) {
        if (pending == null || time.equals(resetTime)) {
            return;
        }
        arm(time);
        log.info("Daily reset moved to {}, next at {}", resetTime, nextFireAt);
    }

    public synchronized Optional<Instant> nextFireAt() {
        return Optional.ofNullable(nextFireAt).map(ZonedDateTime::toInstant);
    }

    public synchronized LocalTime resetTime() {
        return resetTime;
    }

    /**
     * One timer tick: fires when the target has been reached, then aims at the next occurrence.
     *
     * @return true when a reset ran
     */
    synchronized boolean check() {
        if (nextFireAt == null) {
            return false;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        if (now.isBefore(nextFireAt)) {
            return false;
        }
        try {
            repository.resetDailyStrikes();
        } catch (RuntimeException e) {
            log.error("Daily reset failed: {}", e.toString());
        }
        nextFireAt = nextOccurrence(resetTime, now);
        log.debug("Next daily reset at {}", nextFireAt);
        return true;
    }

    /**
     * Disarms the timer but keeps the thread, so {@link #start(LocalTime)} can arm it again.
     */
    public synchronized void stop() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        nextFireAt = null;
    }

    public void shutdown() {
        synchronized (this) {
            if (pending != null) {
                pending.cancel(false);
            }
            nextFireAt = null;
        }
        executor.shutdownNow();
    }

    private void arm(LocalTime time) {
        this.resetTime = time;
        this.nextFireAt = nextOccurrence(time, ZonedDateTime.now(clock));
    }

    private void catchUp() {
        ZonedDateTime recent = mostRecentOccurrence(resetTime, ZonedDateTime.now(clock));
        Optional<Instant> last = repository.lastDailyReset();
        boolean missed = last.isPresent()
                ? last.get().isBefore(recent.toInstant())
                : repository.hasStrikesBefore(recent.toLocalDate());
        if (!missed) {
            return;
        }
        log.info("Daily reset at {} was missed, running it now", recent);
        try {
            repository.resetDailyStrikes();
        } catch (RuntimeException e) {
            log.error("Missed daily reset failed: {}", e.toString());
        }
    }

    static ZonedDateTime nextOccurrence(LocalTime time, ZonedDateTime now) {
        ZonedDateTime candidate = now.with(time).withSecond(0).withNano(0);
        return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
    }

    static ZonedDateTime mostRecentOccurrence(LocalTime time, ZonedDateTime now) {
        ZonedDateTime candidate = now.with(time).withSecond(0).withNano(0);
        return candidate.isAfter(now) ? candidate.minusDays(1) : candidate;
    }
}
