package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Settings(
        String theme,
        int displayScale,
        int autosaveIntervalSeconds,
        String dailyResetTime,
        boolean autostart,
        boolean notifications,
        UpdateSettings updates
) {
    public static final String DEFAULT_THEME = "orange";
    public static final int DEFAULT_DISPLAY_SCALE = 100;
    public static final int DEFAULT_AUTOSAVE_INTERVAL_SECONDS = 30;
    public static final String DEFAULT_DAILY_RESET_TIME = "09:00";

    public static Settings defaults() {
        return new Settings(DEFAULT_THEME, DEFAULT_DISPLAY_SCALE, DEFAULT_AUTOSAVE_INTERVAL_SECONDS,
                DEFAULT_DAILY_RESET_TIME, false, true, UpdateSettings.defaults());
    }
}
