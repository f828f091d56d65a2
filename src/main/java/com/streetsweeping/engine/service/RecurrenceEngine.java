package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.Occurrence;
import com.streetsweeping.engine.dto.RecurrenceHorizon;
import com.streetsweeping.engine.dto.ScheduleRule;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Expands a rule's "k-th weekday of the month" pattern into concrete occurrences.
 *
 * Hours are wall-clock times in the configured zone. A start hour that falls into a DST
 * gap is shifted forward by the gap length, as {@link ZonedDateTime#of} does.
 */
@Component
public class RecurrenceEngine {

    private final ZoneId zone;
    private final RecurrenceHorizon defaultHorizon;

    public RecurrenceEngine(SweepingProperties properties) {
        this.zone = properties.getZone();
        this.defaultHorizon = RecurrenceHorizon.months(
            properties.getRecurrence().getHorizonMonths(),
            properties.getRecurrence().getMaxResults());
    }

    public RecurrenceHorizon defaultHorizon() {
        return defaultHorizon;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Occurrences strictly after {@code after} and before the horizon cutoff, ascending,
     * at most {@code horizon.maxResults()} of them.
     */
    public List<Occurrence> nextOccurrences(ScheduleRule rule, ZonedDateTime after, RecurrenceHorizon horizon) {
        if (!rule.weeks().anyActive()) {
            return List.of();
        }
        ZonedDateTime reference = after.withZoneSameInstant(zone);
        ZonedDateTime cutoff = horizon.cutoff(reference);

        List<Occurrence> occurrences = new ArrayList<>();
        YearMonth month = YearMonth.from(reference);
        YearMonth lastMonth = YearMonth.from(cutoff);

        while (!month.isAfter(lastMonth) && occurrences.size() < horizon.maxResults()) {
            LocalDate day = month.atDay(1).with(TemporalAdjusters.firstInMonth(rule.weekday().toDayOfWeek()));
            int ordinal = 1;
            while (day.getMonth() == month.getMonth() && occurrences.size() < horizon.maxResults()) {
                if (rule.weeks().isActive(ordinal)) {
                    ZonedDateTime start = ZonedDateTime.of(day, LocalTime.of(rule.fromHour(), 0), zone);
                    if (start.isAfter(reference) && start.isBefore(cutoff)) {
                        occurrences.add(new Occurrence(rule.id(), start, endOf(rule, day), ordinal));
                    }
                }
                day = day.plusWeeks(1);
                ordinal++;
            }
            month = month.plusMonths(1);
        }

        occurrences.sort(Comparator.comparing(Occurrence::start));
        return List.copyOf(occurrences);
    }

    public List<Occurrence> nextOccurrences(ScheduleRule rule, ZonedDateTime after) {
        return nextOccurrences(rule, after, defaultHorizon);
    }

    /**
     * The first occurrence within the default horizon.
     */
    public Optional<Occurrence> nextOccurrence(ScheduleRule rule, ZonedDateTime after) {
        List<Occurrence> occurrences = nextOccurrences(rule, after, defaultHorizon);
        return occurrences.isEmpty() ? Optional.empty() : Optional.of(occurrences.get(0));
    }

    /** An end hour at or before the start hour means the window runs past midnight. */
    private ZonedDateTime endOf(ScheduleRule rule, LocalDate day) {
        LocalDate endDay = rule.toHour() <= rule.fromHour() ? day.plusDays(1) : day;
        return ZonedDateTime.of(endDay, LocalTime.of(rule.toHour(), 0), zone);
    }
}
