package io.taskvault.runtime;

import io.taskvault.error.TaskVaultException;
import io.taskvault.tasks.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically persists dirty repository state from a single background thread.
 */
public final class AutoSaveWorker {
    private static final Logger log = LoggerFactory.getLogger(AutoSaveWorker.class);

    private final TaskRepository repository;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private ScheduledFuture<?> pending;
    private long intervalMs;
    private boolean stopped;

    public AutoSaveWorker(TaskRepository repository) {
        this.repository = repository;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "taskvault-autosave");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start(long intervalMs) {
        if (stopped) {
            throw new IllegalStateException("Autosave worker already shut down");
        }
        scheduleAt(intervalMs);
        log.info("Autosave every {}ms", this.intervalMs);
    }

    /**
     * Replaces the tick interval. The next tick runs one full new interval from now.
     */
    public synchronized void reschedule(long intervalMs) {
        if (stopped || pending == null || intervalMs == this.intervalMs) {
            return;
        }
        scheduleAt(intervalMs);
        log.info("Autosave interval changed to {}ms", this.intervalMs);
    }

    public synchronized long intervalMs() {
        return intervalMs;
    }

    /**
     * Flushes right away unless a flush is already running.
     *
     * @return true when this call wrote something
     */
    public boolean flushNow() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Flush already in progress, skipping");
            return false;
        }
        try {
            return repository.flush();
        } finally {
            flushing.set(false);
        }
    }

    boolean isFlushing() {
        return flushing.get();
    }

    /**
     * Cancels the timer without shutting the thread down; {@link #start(long)} may follow.
     */
    public synchronized void stop() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    /**
     * Stops the timer and makes one last attempt to persist pending changes.
     */
    public void shutdown() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (pending != null) {
                pending.cancel(false);
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        try {
            if (repository.isDirty()) {
                repository.flush();
                log.info("Final autosave flush completed");
            }
        } catch (TaskVaultException | UncheckedIOException e) {
            log.error("Final autosave flush failed: {}", e.toString());
        }
    }

    private void scheduleAt(long requestedMs) {
        if (pending != null) {
            pending.cancel(false);
        }
        this.intervalMs = Math.max(1L, requestedMs);
        this.pending = executor.scheduleWithFixedDelay(this::tick, this.intervalMs, this.intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!repository.isDirty()) {
            return;
        }
        try {
            if (flushNow()) {
                log.debug("Autosave flushed pending changes");
            }
        } catch (RuntimeException e) {
            // The state stays dirty; the next tick retries.
            log.warn("Autosave failed: {}", e.toString());
        }
    }
}
