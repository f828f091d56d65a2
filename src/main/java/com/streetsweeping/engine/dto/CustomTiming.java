package com.streetsweeping.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * User-defined reminder offset.
 *
 * @param amount    non-negative offset size
 * @param unit      offset unit
 * @param anchor    before the cleaning start or after the assumed cleaning end
 * @param timeOfDay optional wall-clock override applied to the offset date
 */
public record CustomTiming(
    @PositiveOrZero int amount,
    @NotNull OffsetUnit unit,
    @NotNull ReminderAnchor anchor,
    @Valid TimeOfDay timeOfDay
) implements ReminderTiming {

    public CustomTiming {
        if (amount < 0) {
            throw new IllegalArgumentException("Reminder offset amount must be >= 0");
        }
        if (unit == null || anchor == null) {
            throw new IllegalArgumentException("Reminder offset unit and anchor are required");
        }
    }

    public static CustomTiming before(int amount, OffsetUnit unit) {
        return new CustomTiming(amount, unit, ReminderAnchor.BEFORE_CLEANING, null);
    }

    public static CustomTiming before(int amount, OffsetUnit unit, TimeOfDay timeOfDay) {
        return new CustomTiming(amount, unit, ReminderAnchor.BEFORE_CLEANING, timeOfDay);
    }

    public static CustomTiming after(int amount, OffsetUnit unit) {
        return new CustomTiming(amount, unit, ReminderAnchor.AFTER_CLEANING, null);
    }

    /**
     * A zero offset fires at the anchor whatever the unit, and whole multiples fold into
     * the larger unit (60 minutes = 1 hour, 7 days = 1 week). Hours are not folded into
     * days because the two differ across DST transitions.
     */
    @Override
    public CustomTiming normalized() {
        if (amount == 0) {
            return new CustomTiming(0, OffsetUnit.MINUTES, anchor, timeOfDay);
        }
        int normalizedAmount = amount;
        OffsetUnit normalizedUnit = unit;
        if (normalizedUnit == OffsetUnit.MINUTES && normalizedAmount % 60 == 0) {
            normalizedAmount /= 60;
            normalizedUnit = OffsetUnit.HOURS;
        }
        if (normalizedUnit == OffsetUnit.DAYS && normalizedAmount % 7 == 0) {
            normalizedAmount /= 7;
            normalizedUnit = OffsetUnit.WEEKS;
        }
        return new CustomTiming(normalizedAmount, normalizedUnit, anchor, timeOfDay);
    }

    @Override
    public String displayText() {
        String suffix = timeOfDay != null ? " at " + timeOfDay : "";
        if (anchor == ReminderAnchor.BEFORE_CLEANING && amount == 0 && unit == OffsetUnit.DAYS) {
            return "On The Day" + suffix;
        }
        String direction = anchor == ReminderAnchor.BEFORE_CLEANING ? "Before" : "After";
        return amount + " " + capitalize(unit.label(amount)) + " " + direction + suffix;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
