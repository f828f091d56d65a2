package com.streetsweeping.engine.dto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CustomTimingTest {

    @Test
    void foldsWholeMultiplesIntoLargerUnits() {
        assertEquals(CustomTiming.before(1, OffsetUnit.HOURS), CustomTiming.before(60, OffsetUnit.MINUTES).normalized());
        assertEquals(CustomTiming.before(2, OffsetUnit.HOURS), CustomTiming.before(120, OffsetUnit.MINUTES).normalized());
        assertEquals(CustomTiming.before(2, OffsetUnit.WEEKS), CustomTiming.before(14, OffsetUnit.DAYS).normalized());
        assertEquals(CustomTiming.before(90, OffsetUnit.MINUTES), CustomTiming.before(90, OffsetUnit.MINUTES).normalized());
    }

    @Test
    void doesNotFoldHoursIntoDays() {
        assertEquals(CustomTiming.before(24, OffsetUnit.HOURS), CustomTiming.before(24, OffsetUnit.HOURS).normalized());
        assertNotEquals(CustomTiming.before(1, OffsetUnit.DAYS).normalized(),
            CustomTiming.before(24, OffsetUnit.HOURS).normalized());
    }

    @Test
    void zeroOffsetIgnoresUnit() {
        assertEquals(CustomTiming.before(0, OffsetUnit.DAYS, TimeOfDay.of(8, 0)).normalized(),
            CustomTiming.before(0, OffsetUnit.WEEKS, TimeOfDay.of(8, 0)).normalized());
        assertEquals(OffsetUnit.MINUTES, CustomTiming.after(0, OffsetUnit.HOURS).normalized().unit());
    }

    @Test
    void presetsNormalizeToTheirCustomEquivalent() {
        assertEquals(CustomTiming.before(0, OffsetUnit.DAYS, TimeOfDay.of(8, 0)).normalized(),
            new PresetTiming(PresetReminder.MORNING_OF).normalized());
        assertEquals(CustomTiming.before(60, OffsetUnit.MINUTES).normalized(),
            new PresetTiming(PresetReminder.ONE_HOUR_BEFORE).normalized());
        assertEquals(CustomTiming.before(7, OffsetUnit.DAYS).normalized(),
            new PresetTiming(PresetReminder.WEEK_BEFORE).normalized());
    }

    @Test
    void anchorAndTimeOfDayDistinguishTimings() {
        assertNotEquals(CustomTiming.before(0, OffsetUnit.MINUTES).normalized(),
            CustomTiming.after(0, OffsetUnit.MINUTES).normalized());
        assertNotEquals(CustomTiming.before(1, OffsetUnit.DAYS, TimeOfDay.of(17, 0)).normalized(),
            CustomTiming.before(1, OffsetUnit.DAYS, TimeOfDay.of(20, 0)).normalized());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> CustomTiming.before(-1, OffsetUnit.DAYS));
        assertThrows(IllegalArgumentException.class, () -> TimeOfDay.of(24, 0));
        assertThrows(IllegalArgumentException.class, () -> TimeOfDay.of(8, 60));
    }

    @Test
    void describesTiming() {
        assertEquals("2 Hours Before", CustomTiming.before(2, OffsetUnit.HOURS).displayText());
        assertEquals("1 Day Before at 17:00", CustomTiming.before(1, OffsetUnit.DAYS, TimeOfDay.of(17, 0)).displayText());
        assertEquals("On The Day at 08:00", CustomTiming.before(0, OffsetUnit.DAYS, TimeOfDay.of(8, 0)).displayText());
        assertEquals("30 Minutes After", CustomTiming.after(30, OffsetUnit.MINUTES).displayText());
    }
}
