package com.streetsweeping.engine.dto;

import java.time.temporal.ChronoUnit;

/**
 * Unit of a reminder offset. Day and week offsets are applied on the calendar, so a
 * "1 day before" reminder keeps its wall-clock time across DST changes.
 */
public enum OffsetUnit {
    MINUTES(ChronoUnit.MINUTES, "minute"),
    HOURS(ChronoUnit.HOURS, "hour"),
    DAYS(ChronoUnit.DAYS, "day"),
    WEEKS(ChronoUnit.WEEKS, "week");

    private final ChronoUnit chronoUnit;
    private final String singularName;

    OffsetUnit(ChronoUnit chronoUnit, String singularName) {
        this.chronoUnit = chronoUnit;
        this.singularName = singularName;
    }

    public ChronoUnit chronoUnit() {
        return chronoUnit;
    }

    public String label(int amount) {
        return amount == 1 ? singularName : singularName + "s";
    }
}
