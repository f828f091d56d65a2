package com.streetsweeping.engine.dto;

import java.util.List;

/**
 * Result of scheduling reminders for a location.
 *
 * @param locationId        the location
 * @param status            whether any restriction applies
 * @param match             resolved rule, null for {@link Status#NO_RESTRICTION}
 * @param occurrence        next occurrence the reminders target, may be null
 * @param reminders         reminders persisted for the location
 * @param failedReminderIds reminders persisted but not accepted by the delivery channel
 */
public record ScheduleOutcome(
    String locationId,
    Status status,
    ResolvedMatch match,
    Occurrence occurrence,
    List<ScheduledReminder> reminders,
    List<String> failedReminderIds
) {

    public enum Status {
        SCHEDULED,
        NO_RESTRICTION
    }

    public static ScheduleOutcome noRestriction(String locationId) {
        return new ScheduleOutcome(locationId, Status.NO_RESTRICTION, null, null, List.of(), List.of());
    }
}
