package com.streetsweeping.engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.GeoPoint;
import com.streetsweeping.engine.dto.LocationSchedule;
import com.streetsweeping.engine.dto.Occurrence;
import com.streetsweeping.engine.dto.ParkedLocation;
import com.streetsweeping.engine.dto.ReconcileReport;
import com.streetsweeping.engine.dto.ReminderPreference;
import com.streetsweeping.engine.dto.ReminderSet;
import com.streetsweeping.engine.dto.ResolutionResult;
import com.streetsweeping.engine.dto.ResolvedMatch;
import com.streetsweeping.engine.dto.ScheduleOutcome;
import com.streetsweeping.engine.dto.ScheduledReminder;
import com.streetsweeping.engine.dto.StreetSide;
import com.streetsweeping.engine.dto.WeekOfMonthMask;
import com.streetsweeping.engine.repository.InMemoryKeyValueStore;
import com.streetsweeping.engine.repository.ReminderSetRepository;
import com.streetsweeping.engine.service.delivery.DeliveryGateway;
import com.streetsweeping.engine.service.delivery.DeliveryRequest;
import com.streetsweeping.engine.service.delivery.DeliverySubmissionException;
import com.streetsweeping.engine.service.delivery.ReminderDeliveredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static com.streetsweeping.engine.service.TestRules.SF;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReminderSchedulerTest {

    /** Wednesday 1 October 2025, noon in San Francisco. */
    private static final Instant NOW = Instant.parse("2025-10-01T19:00:00Z");

    private static final ParkedLocation CAR = new ParkedLocation("car-1", 37.7755, -122.419286, "Work");

    private static final ResolvedMatch MATCH =
        new ResolvedMatch(TestRules.mondayRule(WeekOfMonthMask.of(1, 3)), StreetSide.EAST, 10.0);

    private static final Occurrence OCT_6 = occurrence(ZonedDateTime.of(2025, 10, 6, 8, 0, 0, 0, SF));
    private static final Occurrence OCT_20 = occurrence(ZonedDateTime.of(2025, 10, 20, 8, 0, 0, 0, SF));

    private static final String EVENING_ID = "rem_car-1_1001_2025-10-06T08:00_default-evening-before";
    private static final String HALF_HOUR_ID = "rem_car-1_1001_2025-10-06T08:00_default-30-minutes";
    private static final String MORNING_ID = "rem_car-1_1001_2025-10-06T08:00_default-morning-of";

    @Mock
    private ScheduleResolutionService resolutionService;

    @Mock
    private ReminderPreferenceService preferenceService;

    @Mock
    private DeliveryGateway deliveryGateway;

    private ReminderSetRepository repository;
    private ReminderScheduler scheduler;

    @BeforeEach
    void setUp() {
        SweepingProperties properties = new SweepingProperties();
        properties.getReminders().setSubmitRetryBackoff(Duration.ofMillis(10));
        repository = new ReminderSetRepository(new InMemoryKeyValueStore(),
            new ObjectMapper().registerModule(new JavaTimeModule()), properties);
        scheduler = new ReminderScheduler(resolutionService, new ReminderTimingCalculator(properties),
            preferenceService, repository, deliveryGateway, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    private static Occurrence occurrence(ZonedDateTime start) {
        return new Occurrence("1001", start, start.plusHours(2), start.getDayOfMonth() <= 7 ? 1 : 3);
    }

    private static ResolutionResult restricted(Occurrence occurrence) {
        return new ResolutionResult(ResolutionResult.Status.RESTRICTED, MATCH, List.of(occurrence), true);
    }

    private static List<ReminderPreference> defaults() {
        return ReminderPreferenceService.defaultPreferences(NOW);
    }

    private ScheduleOutcome scheduleCar() throws Exception {
        return scheduler.schedule(CAR).get(5, TimeUnit.SECONDS);
    }

    private void givenRestrictedWithDefaults() {
        when(resolutionService.resolve(any(GeoPoint.class))).thenReturn(restricted(OCT_6));
        when(preferenceService.activePreferences()).thenReturn(defaults());
    }

    @Test
    void schedulesOneReminderPerPreferenceSoonestFirst() throws Exception {
        givenRestrictedWithDefaults();

        ScheduleOutcome outcome = scheduleCar();

        assertEquals(ScheduleOutcome.Status.SCHEDULED, outcome.status());
        assertEquals(List.of(EVENING_ID, HALF_HOUR_ID, MORNING_ID),
            outcome.reminders().stream().map(ScheduledReminder::id).toList());
        assertTrue(outcome.failedReminderIds().isEmpty());
        assertEquals(Instant.parse("2025-10-06T00:00:00Z"), outcome.reminders().get(0).fireAt());
        verify(deliveryGateway, times(3)).submit(any(DeliveryRequest.class));
        verify(deliveryGateway, never()).cancel(any());

        LocationSchedule tracked = scheduler.findLocation("car-1").orElseThrow().schedule();
        assertEquals("1001", tracked.ruleId());
        assertEquals(OCT_6.startInstant(), tracked.occurrenceStart());
        assertEquals(NOW, tracked.scheduledAt());
    }

    @Test
    void reminderCarriesMessageAndMetadata() throws Exception {
        givenRestrictedWithDefaults();

        ScheduledReminder evening = scheduleCar().reminders().get(0);

        assertEquals("Evening Before", evening.title());
        assertEquals("Street cleaning tomorrow - move your car tonight! Polk St (East side): Mon 8:00 AM - 10:00 AM, 2025-10-06",
            evening.body());
        Map<String, String> metadata = evening.metadata();
        assertEquals("car-1", metadata.get("locationId"));
        assertEquals("Work", metadata.get("locationLabel"));
        assertEquals("1001", metadata.get("ruleId"));
        assertEquals("Polk St", metadata.get("street"));
        assertEquals("East", metadata.get("side"));
        assertEquals("2025-10-06T08:00-07:00", metadata.get("occurrenceStart"));
        assertEquals("default-evening-before", metadata.get("preferenceId"));
    }

    @Test
    void dropsFireTimesThatAlreadyPassed() {
        Instant quarterToEight = ZonedDateTime.of(2025, 10, 6, 7, 45, 0, 0, SF).toInstant();

        List<ScheduledReminder> reminders = scheduler.computeReminders(CAR, MATCH, OCT_6, defaults(), quarterToEight);

        assertEquals(List.of(MORNING_ID), reminders.stream().map(ScheduledReminder::id).toList());
    }

    @Test
    void ignoresInactivePreferences() {
        List<ReminderPreference> preferences = List.of(defaults().get(0).withActive(false), defaults().get(1));

        List<ScheduledReminder> reminders = scheduler.computeReminders(CAR, MATCH, OCT_6, preferences, NOW);

        assertEquals(List.of(MORNING_ID), reminders.stream().map(ScheduledReminder::id).toList());
    }

    @Test
    void reschedulingSameDataKeepsIdsAndCancelsPreviousSubmission() throws Exception {
        givenRestrictedWithDefaults();

        List<String> first = scheduleCar().reminders().stream().map(ScheduledReminder::id).toList();
        List<String> second = scheduleCar().reminders().stream().map(ScheduledReminder::id).toList();

        assertEquals(first, second);
        verify(deliveryGateway).cancel(first);
        assertEquals(3, repository.load().reminders().size());
    }

    @Test
    void reschedulingOntoNextOccurrenceReplacesReminders() throws Exception {
        when(resolutionService.resolve(any(GeoPoint.class))).thenReturn(restricted(OCT_6), restricted(OCT_20));
        when(preferenceService.activePreferences()).thenReturn(defaults());

        scheduleCar();
        scheduleCar();

        verify(deliveryGateway).cancel(List.of(EVENING_ID, HALF_HOUR_ID, MORNING_ID));
        ReminderSet stored = repository.load();
        assertEquals(3, stored.reminders().size());
        assertTrue(stored.reminders().keySet().stream().allMatch(id -> id.contains("2025-10-20T08:00")));
        assertEquals(OCT_20.startInstant(), stored.locations().get("car-1").occurrenceStart());
    }

    @Test
    void retriesRejectedSubmissionOnce() throws Exception {
        givenRestrictedWithDefaults();
        doThrow(new DeliverySubmissionException("busy")).doNothing()
            .when(deliveryGateway).submit(any(DeliveryRequest.class));

        ScheduleOutcome outcome = scheduleCar();

        assertTrue(outcome.failedReminderIds().isEmpty());
        verify(deliveryGateway, times(4)).submit(any(DeliveryRequest.class));
    }

    @Test
    void reportsRemindersRejectedTwiceButKeepsThemPersisted() throws Exception {
        givenRestrictedWithDefaults();
        doThrow(new DeliverySubmissionException("down"))
            .when(deliveryGateway).submit(any(DeliveryRequest.class));

        ScheduleOutcome outcome = scheduleCar();

        assertEquals(Set.of(EVENING_ID, HALF_HOUR_ID, MORNING_ID), Set.copyOf(outcome.failedReminderIds()));
        assertEquals(3, scheduler.findLocation("car-1").orElseThrow().reminders().size());
        verify(deliveryGateway, times(6)).submit(any(DeliveryRequest.class));
    }

    @Test
    void locationWithoutRestrictionStopsBeingTracked() throws Exception {
        when(resolutionService.resolve(any(GeoPoint.class)))
            .thenReturn(restricted(OCT_6), ResolutionResult.noRestriction(true));
        when(preferenceService.activePreferences()).thenReturn(defaults());

        scheduleCar();
        ScheduleOutcome outcome = scheduleCar();

        assertEquals(ScheduleOutcome.Status.NO_RESTRICTION, outcome.status());
        assertTrue(scheduler.findLocation("car-1").isEmpty());
        assertTrue(repository.load().reminders().isEmpty());
        verify(deliveryGateway).cancel(List.of(EVENING_ID, HALF_HOUR_ID, MORNING_ID));
    }

    @Test
    void missingScheduleDataLeavesRemindersUntouched() throws Exception {
        when(resolutionService.resolve(any(GeoPoint.class)))
            .thenReturn(restricted(OCT_6), ResolutionResult.noRestriction(false));
        when(preferenceService.activePreferences()).thenReturn(defaults());

        scheduleCar();
        ScheduleOutcome outcome = scheduleCar();

        assertEquals(ScheduleOutcome.Status.NO_RESTRICTION, outcome.status());
        assertEquals(3, scheduler.findLocation("car-1").orElseThrow().reminders().size());
        verify(deliveryGateway, never()).cancel(any());
    }

    @Test
    void cancelLocationOfUnknownIdReturnsFalse() {
        assertFalse(scheduler.cancelLocation("nobody"));
        verify(deliveryGateway, never()).cancel(any());
    }

    @Test
    void reconcileDropsExpiredAndResubmitsMissing() throws Exception {
        repository.save(ReminderSet.empty().withReminders(List.of(
            reminder("expired", NOW.minusSeconds(60)),
            reminder("queued", NOW.plusSeconds(3600)),
            reminder("lost", NOW.plusSeconds(7200)))));
        when(deliveryGateway.pendingIds()).thenReturn(Set.of("queued"));

        ReconcileReport report = scheduler.reconcile();

        assertEquals(1, report.expiredDropped());
        assertEquals(1, report.alreadyPending());
        assertEquals(List.of("lost"), report.resubmitted());
        assertTrue(report.failed().isEmpty());
        ArgumentCaptor<DeliveryRequest> submitted = ArgumentCaptor.forClass(DeliveryRequest.class);
        verify(deliveryGateway).submit(submitted.capture());
        assertEquals("lost", submitted.getValue().id());
        assertEquals(Set.of("queued", "lost"), repository.load().reminders().keySet());
    }

    @Test
    void removedPreferenceCancelsOnlyItsReminders() throws Exception {
        givenRestrictedWithDefaults();
        scheduleCar();

        scheduler.onPreferenceChanged(
            new PreferenceChangedEvent("default-morning-of", PreferenceChangedEvent.Change.REMOVED));

        verify(deliveryGateway).cancel(List.of(MORNING_ID));
        assertEquals(Set.of(EVENING_ID, HALF_HOUR_ID), repository.load().reminders().keySet());
    }

    @Test
    void addedPreferenceReschedulesTrackedLocations() throws Exception {
        givenRestrictedWithDefaults();
        scheduleCar();

        scheduler.onPreferenceChanged(new PreferenceChangedEvent("new-one", PreferenceChangedEvent.Change.ADDED));

        verify(resolutionService, times(2)).resolve(any(GeoPoint.class));
    }

    @Test
    void deliveredReminderIsForgotten() throws Exception {
        givenRestrictedWithDefaults();
        scheduleCar();

        scheduler.onReminderDelivered(new ReminderDeliveredEvent(EVENING_ID, NOW));

        assertEquals(Set.of(HALF_HOUR_ID, MORNING_ID), repository.load().reminders().keySet());
    }

    @Test
    void rollsOverLocationsWhoseCleaningStarted() {
        ParkedLocation past = new ParkedLocation("past", 37.7755, -122.419286, null);
        ParkedLocation future = new ParkedLocation("future", 37.7755, -122.419286, null);
        repository.save(ReminderSet.empty()
            .withLocation(tracked(past, NOW.minusSeconds(3600)))
            .withLocation(tracked(future, NOW.plusSeconds(3600))));
        when(resolutionService.resolve(any(GeoPoint.class))).thenReturn(ResolutionResult.noRestriction(true));

        assertEquals(1, scheduler.rollOverElapsed());

        verify(resolutionService, times(1)).resolve(any(GeoPoint.class));
        assertEquals(Set.of("future"), repository.load().locations().keySet());
    }

    @Test
    void reconcileDoesNotResubmitReminderCancelledMeanwhile() throws Exception {
        repository.save(ReminderSet.empty()
            .withLocation(tracked(CAR, NOW.plusSeconds(7200)))
            .withReminders(List.of(reminder("stale", NOW.plusSeconds(3600)))));
        when(deliveryGateway.pendingIds()).thenAnswer(invocation -> {
            scheduler.cancelLocation("car-1");
            return Set.of();
        });

        ReconcileReport report = scheduler.reconcile();

        assertTrue(report.resubmitted().isEmpty());
        assertTrue(repository.load().reminders().isEmpty());
        verify(deliveryGateway, never()).submit(any(DeliveryRequest.class));
    }

    @Test
    void preferenceRemovedWhileSchedulingLeavesNoReminderBehind() throws Exception {
        when(resolutionService.resolve(any(GeoPoint.class))).thenReturn(restricted(OCT_6));
        Thread[] remover = new Thread[1];
        when(preferenceService.activePreferences()).thenAnswer(invocation -> {
            remover[0] = new Thread(() -> scheduler.onPreferenceChanged(
                new PreferenceChangedEvent("default-morning-of", PreferenceChangedEvent.Change.REMOVED)));
            remover[0].start();
            awaitBlockedOrDone(remover[0]);
            return defaults();
        });

        scheduleCar();
        remover[0].join(5000);

        assertFalse(remover[0].isAlive());
        assertEquals(Set.of(EVENING_ID, HALF_HOUR_ID), repository.load().reminders().keySet());
        verify(deliveryGateway).cancel(List.of(MORNING_ID));
    }

    @Test
    void remindersCancelledDuringSubmissionAreNotRetried() throws Exception {
        givenRestrictedWithDefaults();
        doAnswer(invocation -> {
            scheduler.cancelLocation("car-1");
            throw new DeliverySubmissionException("busy");
        }).when(deliveryGateway).submit(any(DeliveryRequest.class));

        ScheduleOutcome outcome = scheduleCar();

        assertTrue(outcome.failedReminderIds().isEmpty());
        assertTrue(repository.load().reminders().isEmpty());
        verify(deliveryGateway, times(1)).submit(any(DeliveryRequest.class));
    }

    private static void awaitBlockedOrDone(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (thread.getState() != Thread.State.WAITING
            && thread.getState() != Thread.State.TERMINATED
            && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
    }

    private static ScheduledReminder reminder(String id, Instant fireAt) {
        return new ScheduledReminder(id, "car-1", "1001", "pref", fireAt.plusSeconds(60), fireAt,
            "Title", "Body", Map.of());
    }

    private static LocationSchedule tracked(ParkedLocation location, Instant occurrenceStart) {
        return new LocationSchedule(location, "1001", StreetSide.EAST, occurrenceStart,
            occurrenceStart.plusSeconds(7200), NOW.minusSeconds(86400));
    }
}
