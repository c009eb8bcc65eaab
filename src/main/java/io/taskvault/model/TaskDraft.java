package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskDraft(
        String title,
        String description,
        String project,
        LocalDate dueDate,
        Integer estimatedDuration
) {
    public static TaskDraft titled(String title) {
        return new TaskDraft(title, null, null, null, null);
    }
}
