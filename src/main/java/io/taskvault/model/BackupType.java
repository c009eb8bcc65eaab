package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BackupType {
    MANUAL("manual"),
    AUTOMATIC("automatic"),
    PRE_UPDATE("pre-update");

    private final String dirName;

    BackupType(String dirName) {
        this.dirName = dirName;
    }

    @JsonValue
    public String dirName() {
        return dirName;
    }

    @JsonCreator
    public static BackupType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MANUAL;
        }
        for (BackupType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.dirName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown backup type: " + raw);
    }
}
