package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StrikeMode {
    TODAY("today"),
    FOREVER("forever");

    private final String label;

    StrikeMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static StrikeMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TODAY;
        }
        for (StrikeMode value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown strike mode: " + raw);
    }
}
