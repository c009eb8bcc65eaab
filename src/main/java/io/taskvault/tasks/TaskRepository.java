package io.taskvault.tasks;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.error.DecryptionFailedException;
import io.taskvault.error.LimitExceededException;
import io.taskvault.error.NotFoundException;
import io.taskvault.error.SlotConflictException;
import io.taskvault.error.ValidationException;
import io.taskvault.model.Settings;
import io.taskvault.model.SettingsPatch;
import io.taskvault.model.SlotChange;
import io.taskvault.model.StrikeMode;
import io.taskvault.model.Task;
import io.taskvault.model.TaskDraft;
import io.taskvault.model.TaskPatch;
import io.taskvault.model.TaskQuery;
import io.taskvault.model.TasksDocument;
import io.taskvault.model.UpdateSettings;
import io.taskvault.storage.EncryptedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Authoritative in-memory task and settings state on top of {@link EncryptedStore}.
 *
 * <p>Task mutations only bump a dirty version; {@link #flush()} persists it. Settings updates and
 * imports are written through before they become visible. Every operation is serialized on one
 * monitor, and no disk I/O runs while that monitor is held.
 */
public final class TaskRepository {
    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;
    public static final int MAX_PROJECT_LENGTH = 100;
    public static final int MAX_REPORT_LENGTH = 1000;
    public static final int MIN_DURATION_MINUTES = 5;
    public static final int MAX_DURATION_MINUTES = 480;
    public static final int DEFAULT_DURATION_MINUTES = 60;
    public static final int DEFAULT_SLOT_MINUTES = 30;
    public static final int DAILY_STRIKE_LIMIT = 2;

    private static final Pattern HOUR = Pattern.compile("([01]\\d|2[0-3]):[0-5]\\d");
    private static final Set<String> CHANNELS = Set.of("stable", "beta");
    private static final Logger log = LoggerFactory.getLogger(TaskRepository.class);

    private final EncryptedStore store;
    private final Clock clock;
    private final Object monitor = new Object();
    private final Object settingsWrite = new Object();
    private final List<Consumer<Settings>> settingsListeners = new CopyOnWriteArrayList<>();

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private Settings settings = Settings.defaults();
    private Instant lastDailyReset;
    private long version;
    private long savedVersion;
    private DecryptionFailedException tasksUnavailable;
    private DecryptionFailedException settingsUnavailable;

    public TaskRepository(EncryptedStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Replaces in-memory state with what is on disk. A document that fails to authenticate is
     * marked unavailable and left untouched; the other document still loads.
     */
    public void reload() {
        Optional<TasksDocument> loadedTasks = Optional.empty();
        DecryptionFailedException tasksFailure = null;
        try {
            loadedTasks = store.load(TaskVaultConfig.TASKS_DOCUMENT, TasksDocument.class);
        } catch (DecryptionFailedException e) {
            log.error("Tasks document could not be decrypted; keeping it on disk untouched");
            tasksFailure = e;
        }
        Optional<Settings> loadedSettings = Optional.empty();
        DecryptionFailedException settingsFailure = null;
        try {
            loadedSettings = store.load(TaskVaultConfig.SETTINGS_DOCUMENT, Settings.class);
        } catch (DecryptionFailedException e) {
            log.error("Settings document could not be decrypted; using defaults without saving them");
            settingsFailure = e;
        }
        Settings current;
        int count;
        synchronized (monitor) {
            tasks.clear();
            TasksDocument document = loadedTasks.orElse(TasksDocument.empty());
            if (document.formatVersion() > TasksDocument.FORMAT_VERSION) {
                log.warn("Tasks document has newer format version {}", document.formatVersion());
            }
            for (Task task : document.tasks()) {
                tasks.put(task.id(), task);
            }
            lastDailyReset = document.lastDailyReset();
            if (loadedTasks.isEmpty() && tasksFailure == null) {
                // Fresh vault: later catch-up is measured from the moment it was first opened.
                lastDailyReset = clock.instant();
            }
            settings = loadedSettings.orElse(Settings.defaults());
            tasksUnavailable = tasksFailure;
            settingsUnavailable = settingsFailure;
            version = 0L;
            savedVersion = 0L;
            current = settings;
            count = tasks.size();
        }
        log.info("Loaded {} task(s)", count);
        notifySettings(current);
    }

    public Task create(TaskDraft draft) {
        Task task = buildTask(draft);
        synchronized (monitor) {
            requireTasksAvailable();
            tasks.put(task.id(), task);
            markDirty();
        }
        return task;
    }

    public Task update(String id, TaskPatch patch) {
        if (patch == null || !patch.hasChanges()) {
            throw new ValidationException("patch", "no fields to update");
        }
        String title = patch.title().map(value -> requireTitle(value)).orElse(null);
        String description = patch.description().map(value -> limit("description", value, MAX_DESCRIPTION_LENGTH)).orElse(null);
        String project = patch.project().map(value -> limit("project", value, MAX_PROJECT_LENGTH)).orElse(null);
        Integer duration = patch.estimatedDuration().map(value -> requireDuration("estimated_duration", value)).orElse(null);
        synchronized (monitor) {
            Task current = requireTask(id);
            Task.Builder builder = current.toBuilder().updatedAt(clock.instant());
            if (title != null) {
                builder.title(title);
            }
            if (description != null) {
                builder.description(description);
            }
            if (project != null) {
                builder.project(project);
            }
            if (duration != null) {
                builder.estimatedDuration(duration);
            }
            if (patch.clearDueDate()) {
                builder.dueDate(null);
            } else {
                patch.dueDate().ifPresent(builder::dueDate);
            }
            return replace(builder.build());
        }
    }

    public void delete(String id) {
        synchronized (monitor) {
            requireTask(id);
            tasks.remove(id);
            markDirty();
        }
    }

    public Task get(String id) {
        synchronized (monitor) {
            return requireTask(id);
        }
    }

    public List<Task> list(TaskQuery query) {
        TaskQuery filter = query == null ? TaskQuery.all() : query;
        synchronized (monitor) {
            requireTasksAvailable();
            List<Task> out = new ArrayList<>();
            for (Task task : tasks.values()) {
                if (filter.matches(task)) {
                    out.add(task);
                }
            }
            return out;
        }
    }

    /**
     * Records progress on a task. {@code TODAY} strikes are limited per calendar day and never
     * complete the task; {@code FOREVER} completes it.
     */
    public Task strike(String id, StrikeMode mode, String report) {
        String text = requireReport(report);
        StrikeMode strikeMode = mode == null ? StrikeMode.TODAY : mode;
        synchronized (monitor) {
            Task current = requireTask(id);
            Instant now = clock.instant();
            if (strikeMode == StrikeMode.FOREVER) {
                if (current.completed()) {
                    return current;
                }
                return replace(current.toBuilder()
                        .completed(true, now)
                        .struckToday(false)
                        .strikeCount(current.strikeCount() + 1)
                        .strikeReport(text)
                        .updatedAt(now)
                        .build());
            }
            if (current.completed()) {
                throw new ValidationException("mode", "completed task cannot be struck for today");
            }
            LocalDate today = LocalDate.now(clock);
            int strikes = current.strikesOn(today);
            if (strikes >= DAILY_STRIKE_LIMIT) {
                throw new LimitExceededException(id, DAILY_STRIKE_LIMIT);
            }
            return replace(current.toBuilder()
                    .struckToday(true)
                    .strikeCount(current.strikeCount() + 1)
                    .dailyStrikes(strikes + 1, today)
                    .strikeReport(text)
                    .updatedAt(now)
                    .build());
        }
    }

    /**
     * Reverses the latest same-day strike and drops its report. The task stays struck while another
     * strike from today remains. The lifetime {@code strike_count} stays as it is.
     */
    public Task undoStrike(String id) {
        synchronized (monitor) {
            Task current = requireTask(id);
            if (current.completed() || !current.struckToday()) {
                throw new ValidationException("id", "task is not struck today");
            }
            LocalDate today = LocalDate.now(clock);
            int remaining = Math.max(0, current.strikesOn(today) - 1);
            return replace(current.toBuilder()
                    .struckToday(remaining > 0)
                    .dailyStrikes(remaining, remaining == 0 ? null : today)
                    .strikeReport(null)
                    .updatedAt(clock.instant())
                    .build());
        }
    }

    public Task complete(String id) {
        synchronized (monitor) {
            Task current = requireTask(id);
            if (current.completed()) {
                return current;
            }
            Instant now = clock.instant();
            return replace(current.toBuilder().completed(true, now).struckToday(false).updatedAt(now).build());
        }
    }

    public Task uncomplete(String id) {
        synchronized (monitor) {
            Task current = requireTask(id);
            if (!current.completed()) {
                return current;
            }
            return replace(current.toBuilder().completed(false, null).updatedAt(clock.instant()).build());
        }
    }

    /**
     * Claims a time slot. The slot must end by midnight and must not overlap the slot of another
     * open task on the same date.
     */
    public Task schedule(String id, String hour, LocalDate date, Integer duration) {
        int minutes = requireSlot(hour, date, duration);
        synchronized (monitor) {
            Task current = requireTask(id);
            if (current.completed()) {
                throw new ValidationException("id", "completed task cannot be scheduled");
            }
            Task next = current.toBuilder().slot(hour, date, minutes).updatedAt(clock.instant()).build();
            requireFreeSlot(tasks, next);
            return replace(next);
        }
    }

    /**
     * Applies a batch of planner changes as one unit. Overlaps are checked against the state after
     * every change is applied, so two tasks can swap slots; one bad entry rejects the whole batch.
     */
    public List<Task> applySchedule(List<SlotChange> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new ValidationException("changes", "at least one entry is required");
        }
        List<Integer> lengths = new ArrayList<>();
        for (SlotChange change : changes) {
            if (change == null) {
                throw new ValidationException("changes", "entries must not be null");
            }
            lengths.add(change.clearsSlot()
                    ? null
                    : requireSlot(change.scheduledHour(), change.scheduledDate(), change.scheduledDuration()));
        }
        synchronized (monitor) {
            requireTasksAvailable();
            Map<String, Task> working = new LinkedHashMap<>(tasks);
            Set<String> touched = new LinkedHashSet<>();
            Instant now = clock.instant();
            for (int i = 0; i < changes.size(); i++) {
                SlotChange change = changes.get(i);
                Task current = change.taskId() == null ? null : working.get(change.taskId());
                if (current == null) {
                    throw new NotFoundException("Task", change.taskId());
                }
                Task.Builder builder = current.toBuilder().updatedAt(now);
                if (change.clearsSlot()) {
                    builder.slot(null, null, null);
                } else {
                    if (current.completed()) {
                        throw new ValidationException("task_id", "completed task cannot be scheduled: " + current.id());
                    }
                    builder.slot(change.scheduledHour(), change.scheduledDate(), lengths.get(i));
                }
                working.put(current.id(), builder.build());
                touched.add(current.id());
            }
            List<Task> changed = new ArrayList<>();
            for (String id : touched) {
                Task task = working.get(id);
                if (task.scheduled()) {
                    requireFreeSlot(working, task);
                }
                changed.add(task);
            }
            tasks.putAll(working);
            markDirty();
            log.info("Planner update applied to {} task(s)", changed.size());
            return changed;
        }
    }

    public Task unschedule(String id) {
        synchronized (monitor) {
            Task current = requireTask(id);
            if (!current.scheduled()) {
                return current;
            }
            return replace(current.toBuilder().slot(null, null, null).updatedAt(clock.instant()).build());
        }
    }

    /**
     * Planner view: tasks with a slot on {@code date}, earliest first.
     */
    public List<Task> scheduleFor(LocalDate date) {
        synchronized (monitor) {
            requireTasksAvailable();
            List<Task> out = new ArrayList<>();
            for (Task task : tasks.values()) {
                if (task.scheduled() && date.equals(task.scheduledDate())) {
                    out.add(task);
                }
            }
            out.sort(Comparator.comparing(Task::scheduledHour));
            return out;
        }
    }

    /**
     * Clears every per-day strike flag and counter. Lifetime strike counts are kept.
     */
    public int resetDailyStrikes() {
        synchronized (monitor) {
            requireTasksAvailable();
            Instant now = clock.instant();
            int cleared = 0;
            for (Task task : List.copyOf(tasks.values())) {
                if (task.struckToday() || task.strikesToday() > 0 || task.strikeDay() != null) {
                    tasks.put(task.id(), task.toBuilder().struckToday(false).dailyStrikes(0, null).updatedAt(now).build());
                    cleared++;
                }
            }
            lastDailyReset = now;
            markDirty();
            log.info("Daily reset cleared strikes on {} task(s)", cleared);
            return cleared;
        }
    }

    /**
     * True when some open task still carries a per-day strike stamped before {@code day}.
     */
    public boolean hasStrikesBefore(LocalDate day) {
        synchronized (monitor) {
            for (Task task : tasks.values()) {
                if (!task.completed() && task.strikeDay() != null && task.strikeDay().isBefore(day)) {
                    return true;
                }
            }
            return false;
        }
    }

    public Optional<Instant> lastDailyReset() {
        synchronized (monitor) {
            return Optional.ofNullable(lastDailyReset);
        }
    }

    /**
     * Adds drafts that pass validation and writes them through. Rejected drafts are reported by
     * position and do not stop the rest.
     */
    public ImportResult importTasks(List<TaskDraft> drafts) {
        List<Task> accepted = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < drafts.size(); i++) {
            try {
                accepted.add(buildTask(drafts.get(i)));
            } catch (ValidationException e) {
                errors.add("Entry " + (i + 1) + ": " + e.getMessage());
            }
        }
        synchronized (monitor) {
            requireTasksAvailable();
            for (Task task : accepted) {
                tasks.put(task.id(), task);
            }
            if (!accepted.isEmpty()) {
                markDirty();
            }
        }
        if (!accepted.isEmpty()) {
            flush();
        }
        log.info("Imported {} task(s), rejected {}", accepted.size(), errors.size());
        return new ImportResult(accepted, errors);
    }

    public Settings settings() {
        synchronized (monitor) {
            return settings;
        }
    }

    /**
     * Validates and persists a settings change before publishing it to readers and listeners. Holds
     * the shared storage lock throughout so a concurrent restore cannot be overwritten.
     */
    public Settings updateSettings(SettingsPatch patch) {
        if (patch == null) {
            throw new ValidationException("patch", "is required");
        }
        Settings updated = store.withShared("update settings", () -> {
            synchronized (settingsWrite) {
                Settings base;
                synchronized (monitor) {
                    if (settingsUnavailable != null) {
                        throw settingsUnavailable;
                    }
                    base = settings;
                }
                Settings next = apply(base, patch);
                store.save(TaskVaultConfig.SETTINGS_DOCUMENT, next);
                synchronized (monitor) {
                    settings = next;
                }
                return next;
            }
        });
        log.info("Settings updated");
        notifySettings(updated);
        return updated;
    }

    public void addSettingsListener(Consumer<Settings> listener) {
        settingsListeners.add(listener);
    }

    /**
     * Writes pending task changes. Runs on the shared side of the storage lock so a concurrent
     * restore cannot be overwritten by state captured before it.
     *
     * @return true when something was written
     */
    public boolean flush() {
        return store.withShared("flush", () -> {
            TasksDocument snapshot;
            long flushing;
            synchronized (monitor) {
                if (version == savedVersion || tasksUnavailable != null) {
                    return false;
                }
                snapshot = new TasksDocument(TasksDocument.FORMAT_VERSION, List.copyOf(tasks.values()), lastDailyReset);
                flushing = version;
            }
            store.save(TaskVaultConfig.TASKS_DOCUMENT, snapshot);
            synchronized (monitor) {
                savedVersion = Math.max(savedVersion, flushing);
            }
            log.debug("Flushed {} task(s) at version {}", snapshot.tasks().size(), flushing);
            return true;
        });
    }

    public boolean isDirty() {
        synchronized (monitor) {
            return version != savedVersion;
        }
    }

    public long version() {
        synchronized (monitor) {
            return version;
        }
    }

    public Set<String> unavailableDocuments() {
        synchronized (monitor) {
            if (tasksUnavailable == null && settingsUnavailable == null) {
                return Set.of();
            }
            if (tasksUnavailable != null && settingsUnavailable != null) {
                return Set.of(TaskVaultConfig.TASKS_DOCUMENT, TaskVaultConfig.SETTINGS_DOCUMENT);
            }
            return Set.of(tasksUnavailable != null ? TaskVaultConfig.TASKS_DOCUMENT : TaskVaultConfig.SETTINGS_DOCUMENT);
        }
    }

    private Task buildTask(TaskDraft draft) {
        if (draft == null) {
            throw new ValidationException("task", "is required");
        }
        Instant now = clock.instant();
        return new Task.Builder()
                .id(UUID.randomUUID().toString())
                .title(requireTitle(draft.title()))
                .description(limit("description", orEmpty(draft.description()), MAX_DESCRIPTION_LENGTH))
                .project(limit("project", orEmpty(draft.project()), MAX_PROJECT_LENGTH))
                .dueDate(draft.dueDate())
                .estimatedDuration(requireDuration("estimated_duration",
                        draft.estimatedDuration() == null ? DEFAULT_DURATION_MINUTES : draft.estimatedDuration()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static Settings apply(Settings base, SettingsPatch patch) {
        String theme = patch.theme().map(value -> requireText("theme", value, 40)).orElse(base.theme());
        int scale = patch.displayScale().map(value -> requireRange("display_scale", value, 50, 200)).orElse(base.displayScale());
        int autosave = patch.autosaveIntervalSeconds()
                .map(value -> requireRange("autosave_interval_seconds", value, 5, 3600))
                .orElse(base.autosaveIntervalSeconds());
        String resetTime = patch.dailyResetTime().map(value -> {
            if (!HOUR.matcher(value).matches()) {
                throw new ValidationException("daily_reset_time", "must be HH:MM");
            }
            return value;
        }).orElse(base.dailyResetTime());
        UpdateSettings updates = base.updates() == null ? UpdateSettings.defaults() : base.updates();
        if (patch.updates().isPresent()) {
            SettingsPatch.Updates changes = patch.updates().get();
            String channel = changes.channel().map(value -> {
                if (!CHANNELS.contains(value)) {
                    throw new ValidationException("updates.channel", "must be stable or beta");
                }
                return value;
            }).orElse(updates.channel());
            updates = new UpdateSettings(
                    changes.autoCheckEnabled().orElse(updates.autoCheckEnabled()),
                    changes.checkIntervalHours().map(value -> requireRange("updates.check_interval_hours", value, 1, 720))
                            .orElse(updates.checkIntervalHours()),
                    changes.autoInstallEnabled().orElse(updates.autoInstallEnabled()),
                    changes.backupBeforeUpdate().orElse(updates.backupBeforeUpdate()),
                    channel
            );
        }
        return new Settings(theme, scale, autosave, resetTime,
                patch.autostart().orElse(base.autostart()),
                patch.notifications().orElse(base.notifications()),
                updates);
    }

    private Task replace(Task task) {
        tasks.put(task.id(), task);
        markDirty();
        return task;
    }

    private void markDirty() {
        version++;
    }

    private Task requireTask(String id) {
        requireTasksAvailable();
        Task task = id == null ? null : tasks.get(id);
        if (task == null) {
            throw new NotFoundException("Task", id);
        }
        return task;
    }

    private void requireTasksAvailable() {
        if (tasksUnavailable != null) {
            throw tasksUnavailable;
        }
    }

    private void notifySettings(Settings current) {
        for (Consumer<Settings> listener : settingsListeners) {
            try {
                listener.accept(current);
            } catch (RuntimeException e) {
                log.warn("Settings listener failed: {}", e.toString());
            }
        }
    }

    private static int requireSlot(String hour, LocalDate date, Integer duration) {
        if (hour == null || !HOUR.matcher(hour).matches()) {
            throw new ValidationException("hour", "must be HH:MM");
        }
        if (date == null) {
            throw new ValidationException("date", "is required");
        }
        int minutes = requireDuration("duration", duration == null ? DEFAULT_SLOT_MINUTES : duration);
        if (minuteOfDay(hour) + minutes > 24 * 60) {
            throw new ValidationException("duration", "slot must end by midnight");
        }
        return minutes;
    }

    private static void requireFreeSlot(Map<String, Task> state, Task candidate) {
        int start = minuteOfDay(candidate.scheduledHour());
        int end = start + slotLength(candidate);
        for (Task other : state.values()) {
            if (other.id().equals(candidate.id()) || other.completed() || !other.scheduled()
                    || !candidate.scheduledDate().equals(other.scheduledDate())) {
                continue;
            }
            int otherStart = minuteOfDay(other.scheduledHour());
            int otherEnd = otherStart + slotLength(other);
            if (start < otherEnd && otherStart < end) {
                throw new SlotConflictException(other.id(), other.title());
            }
        }
    }

    private static int slotLength(Task task) {
        return task.scheduledDuration() == null ? DEFAULT_SLOT_MINUTES : task.scheduledDuration();
    }

    private static int minuteOfDay(String hour) {
        LocalTime time = LocalTime.parse(hour);
        return time.getHour() * 60 + time.getMinute();
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "is required");
        }
        return limit("title", title.trim(), MAX_TITLE_LENGTH);
    }

    private static String requireReport(String report) {
        if (report == null || report.isBlank()) {
            throw new ValidationException("report", "is required");
        }
        return limit("report", report.trim(), MAX_REPORT_LENGTH);
    }

    private static int requireDuration(String field, int minutes) {
        return requireRange(field, minutes, MIN_DURATION_MINUTES, MAX_DURATION_MINUTES);
    }

    private static int requireRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ValidationException(field, "must be between " + min + " and " + max);
        }
        return value;
    }

    private static String requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be empty");
        }
        return limit(field, value.trim(), maxLength);
    }

    private static String limit(String field, String value, int maxLength) {
        if (value.length() > maxLength) {
            throw new ValidationException(field, "must be at most " + maxLength + " characters");
        }
        return value;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * Outcome of an import: the tasks that were added and one message per rejected entry.
     */
    public record ImportResult(List<Task> imported, List<String> errors) {
        public ImportResult {
            imported = List.copyOf(imported);
            errors = List.copyOf(errors);
        }
    }
}
