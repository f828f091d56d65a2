package com.streetsweeping.engine.dto;

import java.time.Instant;
import java.util.Map;

/**
 * A concrete reminder to be delivered at {@code fireAt}.
 *
 * The id is derived from location, rule, occurrence and preference, so scheduling the
 * same location twice yields the same ids.
 *
 * @param id              deterministic reminder id
 * @param locationId      location the reminder belongs to
 * @param ruleId          rule whose occurrence triggered it
 * @param preferenceId    preference that produced it
 * @param occurrenceStart start of the cleaning occurrence
 * @param fireAt          delivery instant, always after scheduling time
 * @param title           notification title
 * @param body            notification body
 * @param metadata        extra key/value pairs delivered with the notification
 */
public record ScheduledReminder(
    String id,
    String locationId,
    String ruleId,
    String preferenceId,
    Instant occurrenceStart,
    Instant fireAt,
    String title,
    String body,
    Map<String, String> metadata
) {

    public ScheduledReminder {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String toLogString() {
        return String.format("Reminder[id=%s, fireAt=%s]", id, fireAt);
    }
}
