package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Partial update of a task's editable fields. An empty field is left unchanged; the due date is
 * removed with {@code clear_due_date}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskPatch(
        Optional<String> title,
        Optional<String> description,
        Optional<String> project,
        Optional<LocalDate> dueDate,
        Optional<Integer> estimatedDuration,
        boolean clearDueDate
) {
    public TaskPatch {
        title = title == null ? Optional.empty() : title;
        description = description == null ? Optional.empty() : description;
        project = project == null ? Optional.empty() : project;
        dueDate = dueDate == null ? Optional.empty() : dueDate;
        estimatedDuration = estimatedDuration == null ? Optional.empty() : estimatedDuration;
    }

    public static TaskPatch empty() {
        return new TaskPatch(null, null, null, null, null, false);
    }

    public TaskPatch withTitle(String value) {
        return new TaskPatch(Optional.ofNullable(value), description, project, dueDate, estimatedDuration, clearDueDate);
    }

    public TaskPatch withDescription(String value) {
        return new TaskPatch(title, Optional.ofNullable(value), project, dueDate, estimatedDuration, clearDueDate);
    }

    public TaskPatch withProject(String value) {
        return new TaskPatch(title, description, Optional.ofNullable(value), dueDate, estimatedDuration, clearDueDate);
    }

    public TaskPatch withEstimatedDuration(int minutes) {
        return new TaskPatch(title, description, project, dueDate, Optional.of(minutes), clearDueDate);
    }

    public boolean hasChanges() {
        return title.isPresent() || description.isPresent() || project.isPresent()
                || dueDate.isPresent() || estimatedDuration.isPresent() || clearDueDate;
    }
}
