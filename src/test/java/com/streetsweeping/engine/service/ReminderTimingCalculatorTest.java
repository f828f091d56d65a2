package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.CustomTiming;
import com.streetsweeping.engine.dto.OffsetUnit;
import com.streetsweeping.engine.dto.PresetReminder;
import com.streetsweeping.engine.dto.PresetTiming;
import com.streetsweeping.engine.dto.ReminderAnchor;
import com.streetsweeping.engine.dto.ReminderTiming;
import com.streetsweeping.engine.dto.TimeOfDay;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;

import static com.streetsweeping.engine.service.TestRules.SF;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ReminderTimingCalculatorTest {

    private static final ZonedDateTime MONDAY_8AM = ZonedDateTime.of(2025, 10, 6, 8, 0, 0, 0, SF);

    private final ReminderTimingCalculator calculator = new ReminderTimingCalculator(new SweepingProperties());

    private LocalDateTime fire(ReminderTiming timing) {
        return calculator.fireTime(timing, MONDAY_8AM).toLocalDateTime();
    }

    @Test
    void presetsFireAtTheirDocumentedTimes() {
        assertEquals(LocalDateTime.of(2025, 9, 29, 8, 0), fire(new PresetTiming(PresetReminder.WEEK_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 3, 8, 0), fire(new PresetTiming(PresetReminder.THREE_DAYS_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 5, 20, 0), fire(new PresetTiming(PresetReminder.DAY_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 8, 0), fire(new PresetTiming(PresetReminder.MORNING_OF)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 6, 0), fire(new PresetTiming(PresetReminder.TWO_HOURS_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 7, 0), fire(new PresetTiming(PresetReminder.ONE_HOUR_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 7, 30), fire(new PresetTiming(PresetReminder.THIRTY_MINUTES_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 7, 45), fire(new PresetTiming(PresetReminder.FIFTEEN_MINUTES_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 7, 55), fire(new PresetTiming(PresetReminder.FIVE_MINUTES_BEFORE)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 8, 0), fire(new PresetTiming(PresetReminder.AT_CLEANING_TIME)));
        assertEquals(LocalDateTime.of(2025, 10, 6, 10, 0), fire(new PresetTiming(PresetReminder.AFTER_CLEANING)));
    }

    @Test
    void customTimeOfDaySnapsTheOffsetDate() {
        CustomTiming eveningBefore = CustomTiming.before(1, OffsetUnit.DAYS, TimeOfDay.of(17, 0));

        assertEquals(LocalDateTime.of(2025, 10, 5, 17, 0), fire(eveningBefore));
    }

    @Test
    void afterReminderIsAnchoredOnAssumedEnd() {
        CustomTiming halfHourAfter = new CustomTiming(30, OffsetUnit.MINUTES, ReminderAnchor.AFTER_CLEANING, null);

        assertEquals(LocalDateTime.of(2025, 10, 6, 10, 30), fire(halfHourAfter));
    }

    @Test
    void assumedDurationIsConfigurable() {
        SweepingProperties properties = new SweepingProperties();
        properties.getReminders().setAssumedCleaningDuration(Duration.ofMinutes(90));
        ReminderTimingCalculator custom = new ReminderTimingCalculator(properties);

        assertEquals(LocalDateTime.of(2025, 10, 6, 9, 30),
            custom.fireTime(new PresetTiming(PresetReminder.AFTER_CLEANING), MONDAY_8AM).toLocalDateTime());
    }

    @Test
    void dayOffsetsKeepWallClockAcrossDaylightSavingChange() {
        ZonedDateTime afterChange = ZonedDateTime.of(2025, 11, 3, 8, 0, 0, 0, SF);

        ZonedDateTime weekBefore = calculator.fireTime(CustomTiming.before(1, OffsetUnit.WEEKS), afterChange);
        ZonedDateTime hoursBefore = calculator.fireTime(CustomTiming.before(168, OffsetUnit.HOURS), afterChange);

        assertEquals(LocalDateTime.of(2025, 10, 27, 8, 0), weekBefore.toLocalDateTime());
        assertEquals(Duration.ofHours(169), Duration.between(weekBefore, afterChange));
        assertEquals(LocalDateTime.of(2025, 10, 27, 9, 0), hoursBefore.toLocalDateTime());
    }
}
