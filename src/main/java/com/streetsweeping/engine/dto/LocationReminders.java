package com.streetsweeping.engine.dto;

import java.util.List;

/**
 * A tracked location with the reminders currently scheduled for it, soonest first.
 */
public record LocationReminders(
    LocationSchedule schedule,
    List<ScheduledReminder> reminders
) {
}
