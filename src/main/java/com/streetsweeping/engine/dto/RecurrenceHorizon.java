package com.streetsweeping.engine.dto;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Bounded lookahead for occurrence searches.
 *
 * A month horizon covers the reference month plus {@code amount - 1} following whole
 * calendar months. A week horizon ends exactly {@code amount} weeks after the reference.
 *
 * @param unit       {@link ChronoUnit#MONTHS} or {@link ChronoUnit#WEEKS}
 * @param amount     size of the window, at least 1
 * @param maxResults stop after this many occurrences
 */
public record RecurrenceHorizon(
    ChronoUnit unit,
    int amount,
    int maxResults
) {

    public RecurrenceHorizon {
        if (unit != ChronoUnit.MONTHS && unit != ChronoUnit.WEEKS) {
            throw new IllegalArgumentException("Horizon unit must be MONTHS or WEEKS, got " + unit);
        }
        if (amount < 1) {
            throw new IllegalArgumentException("Horizon amount must be >= 1");
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("Horizon maxResults must be >= 1");
        }
    }

    public static RecurrenceHorizon months(int amount, int maxResults) {
        return new RecurrenceHorizon(ChronoUnit.MONTHS, amount, maxResults);
    }

    public static RecurrenceHorizon weeks(int amount, int maxResults) {
        return new RecurrenceHorizon(ChronoUnit.WEEKS, amount, maxResults);
    }

    /**
     * First instant no longer covered by this horizon (exclusive bound).
     */
    public ZonedDateTime cutoff(ZonedDateTime reference) {
        if (unit == ChronoUnit.WEEKS) {
            return reference.plusWeeks(amount);
        }
        return reference.toLocalDate()
            .withDayOfMonth(1)
            .plusMonths(amount)
            .atStartOfDay(reference.getZone());
    }
}
