package com.streetsweeping.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A user's standing instruction to be notified at a given timing before (or after)
 * every cleaning occurrence of a parked location.
 *
 * @param id        unique preference id
 * @param title     notification title
 * @param message   notification body
 * @param timing    when the reminder fires relative to the occurrence
 * @param active    inactive preferences produce no reminders
 * @param createdAt creation time
 */
public record ReminderPreference(
    @NotBlank String id,
    @NotBlank String title,
    String message,
    @NotNull @Valid ReminderTiming timing,
    boolean active,
    Instant createdAt
) {

    public ReminderPreference withActive(boolean active) {
        return new ReminderPreference(id, title, message, timing, active, createdAt);
    }

    public ReminderPreference withContent(String title, String message, ReminderTiming timing) {
        return new ReminderPreference(id, title, message, timing, active, createdAt);
    }

    public String toLogString() {
        return String.format("Preference[id=%s, title=%s, timing=%s, active=%s]",
            id, title, timing.displayText(), active);
    }
}
