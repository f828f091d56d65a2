package com.streetsweeping.engine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.LocalTime;

/**
 * Wall-clock time a reminder is snapped to, e.g. "the evening before at 17:00".
 */
public record TimeOfDay(
    @Min(0) @Max(23) int hour,
    @Min(0) @Max(59) int minute
) {

    public TimeOfDay {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour must be 0-23, got " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Minute must be 0-59, got " + minute);
        }
    }

    public static TimeOfDay of(int hour, int minute) {
        return new TimeOfDay(hour, minute);
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }

    @Override
    public String toString() {
        return String.format("%02d:%02d", hour, minute);
    }
}
