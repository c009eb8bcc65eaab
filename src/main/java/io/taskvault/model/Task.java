package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One task as persisted in the {@code tasks} document. Instances are immutable; the repository
 * replaces them through {@link #toBuilder()}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Task(
        String id,
        String title,
        String description,
        String project,
        LocalDate dueDate,
        int estimatedDuration,
        String scheduledHour,
        LocalDate scheduledDate,
        Integer scheduledDuration,
        boolean completed,
        Instant completedAt,
        boolean struckToday,
        int strikeCount,
        int strikesToday,
        LocalDate strikeDay,
        String strikeReport,
        Instant createdAt,
        Instant updatedAt
) {
    public TaskState state() {
        if (completed) {
            return TaskState.COMPLETED;
        }
        return struckToday ? TaskState.STRUCK_TODAY : TaskState.ACTIVE;
    }

    public boolean scheduled() {
        return scheduledHour != null && scheduledDate != null;
    }

    /**
     * Strikes counted against {@code day}; a counter stamped with another date no longer applies.
     */
    public int strikesOn(LocalDate day) {
        return day.equals(strikeDay) ? strikesToday : 0;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private String id;
        private String title;
        private String description;
        private String project;
        private LocalDate dueDate;
        private int estimatedDuration;
        private String scheduledHour;
        private LocalDate scheduledDate;
        private Integer scheduledDuration;
        private boolean completed;
        private Instant completedAt;
        private boolean struckToday;
        private int strikeCount;
        private int strikesToday;
        private LocalDate strikeDay;
        private String strikeReport;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder() {
        }

        private Builder(Task task) {
            this.id = task.id;
            this.title = task.title;
            this.description = task.description;
            this.project = task.project;
            this.dueDate = task.dueDate;
            this.estimatedDuration = task.estimatedDuration;
            this.scheduledHour = task.scheduledHour;
            this.scheduledDate = task.scheduledDate;
            this.scheduledDuration = task.scheduledDuration;
            this.completed = task.completed;
            this.completedAt = task.completedAt;
            this.struckToday = task.struckToday;
            this.strikeCount = task.strikeCount;
            this.strikesToday = task.strikesToday;
            this.strikeDay = task.strikeDay;
            this.strikeReport = task.strikeReport;
            this.createdAt = task.createdAt;
            this.updatedAt = task.updatedAt;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder dueDate(LocalDate dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder estimatedDuration(int estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder slot(String hour, LocalDate date, Integer duration) {
            this.scheduledHour = hour;
            this.scheduledDate = date;
            this.scheduledDuration = duration;
            return this;
        }

        public Builder completed(boolean completed, Instant completedAt) {
            this.completed = completed;
            this.completedAt = completedAt;
            return this;
        }

        public Builder struckToday(boolean struckToday) {
            this.struckToday = struckToday;
            return this;
        }

        public Builder strikeCount(int strikeCount) {
            this.strikeCount = strikeCount;
            return this;
        }

        public Builder dailyStrikes(int strikesToday, LocalDate strikeDay) {
            this.strikesToday = strikesToday;
            this.strikeDay = strikeDay;
            return this;
        }

        public Builder strikeReport(String strikeReport) {
            this.strikeReport = strikeReport;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(id, title, description, project, dueDate, estimatedDuration,
                    scheduledHour, scheduledDate, scheduledDuration, completed, completedAt,
                    struckToday, strikeCount, strikesToday, strikeDay, strikeReport, createdAt, updatedAt);
        }
    }
}
