package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Optional;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SettingsPatch(
        Optional<String> theme,
        Optional<Integer> displayScale,
        Optional<Integer> autosaveIntervalSeconds,
        Optional<String> dailyResetTime,
        Optional<Boolean> autostart,
        Optional<Boolean> notifications,
        Optional<Updates> updates
) {
    public SettingsPatch {
        theme = orEmpty(theme);
        displayScale = orEmpty(displayScale);
        autosaveIntervalSeconds = orEmpty(autosaveIntervalSeconds);
        dailyResetTime = orEmpty(dailyResetTime);
        autostart = orEmpty(autostart);
        notifications = orEmpty(notifications);
        updates = orEmpty(updates);
    }

    public static SettingsPatch empty() {
        return new SettingsPatch(null, null, null, null, null, null, null);
    }

    public SettingsPatch withAutosaveIntervalSeconds(int seconds) {
        return new SettingsPatch(theme, displayScale, Optional.of(seconds), dailyResetTime, autostart, notifications, updates);
    }

    public SettingsPatch withDailyResetTime(String time) {
        return new SettingsPatch(theme, displayScale, autosaveIntervalSeconds, Optional.of(time), autostart, notifications, updates);
    }

    public SettingsPatch withTheme(String value) {
        return new SettingsPatch(Optional.of(value), displayScale, autosaveIntervalSeconds, dailyResetTime, autostart, notifications, updates);
    }

    private static <T> Optional<T> orEmpty(Optional<T> value) {
        return value == null ? Optional.empty() : value;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Updates(
            Optional<Boolean> autoCheckEnabled,
            Optional<Integer> checkIntervalHours,
            Optional<Boolean> autoInstallEnabled,
            Optional<Boolean> backupBeforeUpdate,
            Optional<String> channel
    ) {
        public Updates {
            autoCheckEnabled = orEmpty(autoCheckEnabled);
            checkIntervalHours = orEmpty(checkIntervalHours);
            autoInstallEnabled = orEmpty(autoInstallEnabled);
            backupBeforeUpdate = orEmpty(backupBeforeUpdate);
            channel = orEmpty(channel);
        }
    }
}
