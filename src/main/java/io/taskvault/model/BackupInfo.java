package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BackupInfo(
        String name,
        BackupType type,
        int formatVersion,
        String appVersion,
        Instant createdAt,
        int files
) {
}
