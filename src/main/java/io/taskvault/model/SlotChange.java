package io.taskvault.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;

/**
 * One entry of a planner update. A null {@code scheduledHour} clears the task's slot.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SlotChange(
        String taskId,
        String scheduledHour,
        LocalDate scheduledDate,
        Integer scheduledDuration
) {
    public boolean clearsSlot() {
        return scheduledHour == null;
    }
}
