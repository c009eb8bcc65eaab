package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Preferences of the external updater. Only stored here; nothing in this process checks for updates.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateSettings(
        boolean autoCheckEnabled,
        int checkIntervalHours,
        boolean autoInstallEnabled,
        boolean backupBeforeUpdate,
        String channel
) {
    public static UpdateSettings defaults() {
        return new UpdateSettings(true, 24, false, true, "stable");
    }
}
