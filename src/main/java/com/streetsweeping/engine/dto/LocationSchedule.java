package com.streetsweeping.engine.dto;

import java.time.Instant;

/**
 * Tracking record for a scheduled location: which rule and occurrence its current
 * reminders were built for.
 */
public record LocationSchedule(
    ParkedLocation location,
    String ruleId,
    StreetSide side,
    Instant occurrenceStart,
    Instant occurrenceEnd,
    Instant scheduledAt
) {
}
