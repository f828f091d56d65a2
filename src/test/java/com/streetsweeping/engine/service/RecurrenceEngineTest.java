package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.Occurrence;
import com.streetsweeping.engine.dto.RecurrenceHorizon;
import com.streetsweeping.engine.dto.ScheduleRule;
import com.streetsweeping.engine.dto.SweepDay;
import com.streetsweeping.engine.dto.WeekOfMonthMask;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.List;

import static com.streetsweeping.engine.service.TestRules.SF;
import static com.streetsweeping.engine.service.TestRules.WEDNESDAY_NOON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurrenceEngineTest {

    private final RecurrenceEngine engine = new RecurrenceEngine(new SweepingProperties());

    private static List<LocalDateTime> starts(List<Occurrence> occurrences) {
        return occurrences.stream().map(o -> o.start().toLocalDateTime()).toList();
    }

    @Test
    void firstAndThirdMondaysWithinThreeMonths() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.of(1, 3));

        List<Occurrence> occurrences = engine.nextOccurrences(rule, WEDNESDAY_NOON, RecurrenceHorizon.months(3, 10));

        assertEquals(List.of(
            LocalDateTime.of(2025, 10, 6, 8, 0),
            LocalDateTime.of(2025, 10, 20, 8, 0),
            LocalDateTime.of(2025, 11, 3, 8, 0),
            LocalDateTime.of(2025, 11, 17, 8, 0),
            LocalDateTime.of(2025, 12, 1, 8, 0),
            LocalDateTime.of(2025, 12, 15, 8, 0)), starts(occurrences));
        for (Occurrence occurrence : occurrences) {
            assertEquals(DayOfWeek.MONDAY, occurrence.start().getDayOfWeek());
            assertTrue(occurrence.weekOfMonth() == 1 || occurrence.weekOfMonth() == 3);
            assertEquals(occurrence.start().plusHours(2), occurrence.end());
            assertEquals("1001", occurrence.ruleId());
        }
    }

    @Test
    void noActiveWeekMeansNoOccurrences() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.NONE);

        assertTrue(engine.nextOccurrences(rule, WEDNESDAY_NOON, RecurrenceHorizon.months(12, 100)).isEmpty());
        assertTrue(engine.nextOccurrences(rule, WEDNESDAY_NOON, RecurrenceHorizon.weeks(8, 100)).isEmpty());
        assertTrue(engine.nextOccurrence(rule, WEDNESDAY_NOON).isEmpty());
    }

    @Test
    void occurrencesAreStrictlyAfterTheReference() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.of(1, 3));
        ZonedDateTime exactlyAtStart = ZonedDateTime.of(2025, 10, 6, 8, 0, 0, 0, SF);

        assertEquals(LocalDateTime.of(2025, 10, 20, 8, 0),
            engine.nextOccurrence(rule, exactlyAtStart).orElseThrow().start().toLocalDateTime());
        assertEquals(LocalDateTime.of(2025, 10, 6, 8, 0),
            engine.nextOccurrence(rule, exactlyAtStart.minusMinutes(1)).orElseThrow().start().toLocalDateTime());

        for (Occurrence occurrence : engine.nextOccurrences(rule, exactlyAtStart)) {
            assertTrue(occurrence.start().isAfter(exactlyAtStart));
        }
    }

    @Test
    void sequenceContinuesAfterTheFirstWeek() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.of(1, 3));
        ZonedDateTime tuesday = ZonedDateTime.of(2025, 10, 7, 0, 0, 0, 0, SF);

        List<Occurrence> occurrences = engine.nextOccurrences(rule, tuesday, RecurrenceHorizon.months(3, 5));

        assertEquals(List.of(
            LocalDateTime.of(2025, 10, 20, 8, 0),
            LocalDateTime.of(2025, 11, 3, 8, 0),
            LocalDateTime.of(2025, 11, 17, 8, 0),
            LocalDateTime.of(2025, 12, 1, 8, 0),
            LocalDateTime.of(2025, 12, 15, 8, 0)), starts(occurrences));
    }

    @Test
    void weekHorizonCutsOffAfterThatManyWeeks() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.EVERY_WEEK);

        List<Occurrence> occurrences = engine.nextOccurrences(rule, WEDNESDAY_NOON, RecurrenceHorizon.weeks(2, 10));

        assertEquals(List.of(
            LocalDateTime.of(2025, 10, 6, 8, 0),
            LocalDateTime.of(2025, 10, 13, 8, 0)), starts(occurrences));
    }

    @Test
    void stopsAtMaxResults() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.EVERY_WEEK);

        assertEquals(2, engine.nextOccurrences(rule, WEDNESDAY_NOON, RecurrenceHorizon.months(3, 2)).size());
    }

    @Test
    void fifthWeekOnlyInMonthsThatHaveOne() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.of(5));

        List<Occurrence> occurrences = engine.nextOccurrences(rule, WEDNESDAY_NOON, RecurrenceHorizon.months(3, 10));

        assertEquals(List.of(LocalDateTime.of(2025, 12, 29, 8, 0)), starts(occurrences));
        assertEquals(5, occurrences.get(0).weekOfMonth());
    }

    @Test
    void windowEndingAtOrBeforeStartHourRunsPastMidnight() {
        ScheduleRule overnight = TestRules.rule("night", "Market St", "1st St - 2nd St", "North",
            SweepDay.FRIDAY, 22, 2, WeekOfMonthMask.EVERY_WEEK, -122.40, 37.79, -122.39, 37.79);

        Occurrence first = engine.nextOccurrence(overnight, WEDNESDAY_NOON).orElseThrow();

        assertEquals(LocalDateTime.of(2025, 10, 3, 22, 0), first.start().toLocalDateTime());
        assertEquals(LocalDateTime.of(2025, 10, 4, 2, 0), first.end().toLocalDateTime());
    }

    @Test
    void hoursAreWallClockAcrossDaylightSavingChange() {
        ScheduleRule rule = TestRules.mondayRule(WeekOfMonthMask.EVERY_WEEK);
        ZonedDateTime beforeChange = ZonedDateTime.of(2025, 10, 28, 0, 0, 0, 0, SF);

        List<Occurrence> occurrences = engine.nextOccurrences(rule, beforeChange, RecurrenceHorizon.weeks(1, 10));

        // 2 Nov 2025 ends daylight saving time; 3 Nov is still 08:00 local
        assertEquals(LocalDateTime.of(2025, 11, 3, 8, 0), occurrences.get(0).start().toLocalDateTime());
        assertEquals(-8 * 3600, occurrences.get(0).start().getOffset().getTotalSeconds());
    }
}
