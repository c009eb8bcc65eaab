package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Persisted shape of the {@code tasks} document.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TasksDocument(int formatVersion, List<Task> tasks, Instant lastDailyReset) {
    public static final int FORMAT_VERSION = 1;

    public TasksDocument {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static TasksDocument empty() {
        return new TasksDocument(FORMAT_VERSION, List.of(), null);
    }
}
