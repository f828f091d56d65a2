package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.CustomTiming;
import com.streetsweeping.engine.dto.Occurrence;
import com.streetsweeping.engine.dto.ReminderAnchor;
import com.streetsweeping.engine.dto.ReminderTiming;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Turns a reminder timing into a wall-clock instant for one occurrence.
 *
 * Day and week offsets move the calendar date and keep the local time, minute and hour
 * offsets are exact durations. "After" reminders are anchored on the assumed end of the
 * cleaning window, start + {@code sweeping.reminders.assumed-cleaning-duration}, not on
 * the rule's end hour.
 */
@Component
public class ReminderTimingCalculator {

    private final Duration assumedCleaningDuration;

    public ReminderTimingCalculator(SweepingProperties properties) {
        this.assumedCleaningDuration = properties.getReminders().getAssumedCleaningDuration();
    }

    public ZonedDateTime fireTime(ReminderTiming timing, Occurrence occurrence) {
        return fireTime(timing, occurrence.start());
    }

    public ZonedDateTime fireTime(ReminderTiming timing, ZonedDateTime cleaningStart) {
        CustomTiming custom = timing.normalized();
        ZonedDateTime base;
        if (custom.anchor() == ReminderAnchor.BEFORE_CLEANING) {
            base = cleaningStart.minus(custom.amount(), custom.unit().chronoUnit());
        } else {
            base = cleaningStart.plus(assumedCleaningDuration).plus(custom.amount(), custom.unit().chronoUnit());
        }
        if (custom.timeOfDay() == null) {
            return base;
        }
        ZoneId zone = base.getZone();
        return ZonedDateTime.of(base.toLocalDate(), custom.timeOfDay().toLocalTime(), zone);
    }

    public Duration assumedCleaningDuration() {
        return assumedCleaningDuration;
    }
}
