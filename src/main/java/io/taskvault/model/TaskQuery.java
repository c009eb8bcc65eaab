package io.taskvault.model;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Filter for task listings. Null fields match everything.
 */
public record TaskQuery(String project, Boolean completed, LocalDate scheduledDate, String text) {
    public static TaskQuery all() {
        return new TaskQuery(null, null, null, null);
    }

    public boolean matches(Task task) {
        if (project != null && !project.isBlank() && !project.equalsIgnoreCase(task.project())) {
            return false;
        }
        if (completed != null && completed != task.completed()) {
            return false;
        }
        if (scheduledDate != null && !scheduledDate.equals(task.scheduledDate())) {
            return false;
        }
        if (text != null && !text.isBlank()) {
            String needle = text.toLowerCase(Locale.ROOT);
            return contains(task.title(), needle) || contains(task.description(), needle);
        }
        return true;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
