package com.streetsweeping.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * One concrete firing of a rule: the restriction window on a specific date.
 *
 * @param ruleId      rule this occurrence belongs to
 * @param start       window start, local to the catalog's zone
 * @param end         window end, always after {@code start}
 * @param weekOfMonth which occurrence of the weekday in its month (1-5)
 */
public record Occurrence(
    String ruleId,
    ZonedDateTime start,
    ZonedDateTime end,
    int weekOfMonth
) {

    public Occurrence {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Occurrence end must be after its start");
        }
    }

    @JsonIgnore
    public Instant startInstant() {
        return start.toInstant();
    }

    @JsonIgnore
    public Instant endInstant() {
        return end.toInstant();
    }
}
