package com.streetsweeping.engine.dto;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Optional;

/**
 * Day of week a sweeping rule applies to.
 *
 * The numbering (Sunday = 1 .. Saturday = 7) matches the source table and is used
 * both when parsing weekday strings and when doing calendar arithmetic.
 */
public enum SweepDay {

    SUNDAY(1, DayOfWeek.SUNDAY, "Sun"),
    MONDAY(2, DayOfWeek.MONDAY, "Mon"),
    TUESDAY(3, DayOfWeek.TUESDAY, "Tue"),
    WEDNESDAY(4, DayOfWeek.WEDNESDAY, "Wed"),
    THURSDAY(5, DayOfWeek.THURSDAY, "Thu"),
    FRIDAY(6, DayOfWeek.FRIDAY, "Fri"),
    SATURDAY(7, DayOfWeek.SATURDAY, "Sat");

    private final int number;
    private final DayOfWeek dayOfWeek;
    private final String abbreviation;

    SweepDay(int number, DayOfWeek dayOfWeek, String abbreviation) {
        this.number = number;
        this.dayOfWeek = dayOfWeek;
        this.abbreviation = abbreviation;
    }

    public int number() {
        return number;
    }

    public DayOfWeek toDayOfWeek() {
        return dayOfWeek;
    }

    public String abbreviation() {
        return abbreviation;
    }

    /**
     * Parses the weekday spellings found in the sweeping tables
     * ("Mon", "Monday", "Tues", "Thur", ...), case-insensitively.
     */
    public static Optional<SweepDay> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "sun", "sunday" -> Optional.of(SUNDAY);
            case "mon", "monday" -> Optional.of(MONDAY);
            case "tue", "tues", "tuesday" -> Optional.of(TUESDAY);
            case "wed", "wednesday" -> Optional.of(WEDNESDAY);
            case "thu", "thur", "thurs", "thursday" -> Optional.of(THURSDAY);
            case "fri", "friday" -> Optional.of(FRIDAY);
            case "sat", "saturday" -> Optional.of(SATURDAY);
            default -> Optional.empty();
        };
    }

    public static SweepDay fromNumber(int number) {
        for (SweepDay day : values()) {
            if (day.number == number) {
                return day;
            }
        }
        throw new IllegalArgumentException("Weekday number must be 1-7, got " + number);
    }
}
