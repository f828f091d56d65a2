package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.LocationReminders;
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
import com.streetsweeping.engine.repository.ReminderSetRepository;
import com.streetsweeping.engine.repository.StoreUnavailableException;
import com.streetsweeping.engine.service.delivery.DeliveryGateway;
import com.streetsweeping.engine.service.delivery.DeliveryRequest;
import com.streetsweeping.engine.service.delivery.DeliverySubmissionException;
import com.streetsweeping.engine.service.delivery.ReminderDeliveredEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns resolved cleaning occurrences into persisted, delivered reminders.
 *
 * Scheduling a location:
 * 1. Resolve the applicable rule and its next occurrence
 * 2. Compute one reminder per active preference, keeping only instants in the future
 * 3. Cancel the location's previous reminders in the delivery channel
 * 4. Persist the new reminders (replacing the old ones) in one store update
 * 5. Submit them to the delivery channel, retrying a failed submission once
 *
 * Reminders are persisted before submission, so a reminder the channel rejected is not
 * lost; the next {@link #reconcile()} pass submits it again.
 *
 * Reminder ids are derived from location, rule, occurrence and preference. Scheduling the
 * same location twice against the same data produces the same ids.
 */
@Service
@Slf4j
public class ReminderScheduler {

    private final ScheduleResolutionService resolutionService;
    private final ReminderTimingCalculator timingCalculator;
    private final ReminderPreferenceService preferenceService;
    private final ReminderSetRepository reminderSetRepository;
    private final DeliveryGateway deliveryGateway;
    private final Clock clock;
    private final Duration retryBackoff;

    // Guards every read-compute-persist sequence, every cancellation and every submission
    private final ReentrantLock schedulingLock = new ReentrantLock();

    public ReminderScheduler(ScheduleResolutionService resolutionService,
                             ReminderTimingCalculator timingCalculator,
                             ReminderPreferenceService preferenceService,
                             ReminderSetRepository reminderSetRepository,
                             DeliveryGateway deliveryGateway,
                             Clock clock,
                             SweepingProperties properties) {
        this.resolutionService = resolutionService;
        this.timingCalculator = timingCalculator;
        this.preferenceService = preferenceService;
        this.reminderSetRepository = reminderSetRepository;
        this.deliveryGateway = deliveryGateway;
        this.clock = clock;
        this.retryBackoff = properties.getReminders().getSubmitRetryBackoff();
    }

    /**
     * Resolves the location and (re)schedules its reminders.
     *
     * The future completes once every reminder was accepted by the delivery channel or
     * failed its retry. Without schedule data the store is left untouched.
     */
    public CompletableFuture<ScheduleOutcome> schedule(ParkedLocation location) {
        ResolutionResult resolution = resolutionService.resolve(location.point());
        if (!resolution.dataAvailable()) {
            log.info("No schedule data yet, not scheduling {}", location.toLogString());
            return CompletableFuture.completedFuture(ScheduleOutcome.noRestriction(location.id()));
        }

        Occurrence occurrence = resolution.nextOccurrence();
        if (resolution.status() != ResolutionResult.Status.RESTRICTED || occurrence == null) {
            cancelLocation(location.id());
            log.info("No upcoming cleaning for {}", location.toLogString());
            return CompletableFuture.completedFuture(ScheduleOutcome.noRestriction(location.id()));
        }

        ResolvedMatch match = resolution.match();
        List<ScheduledReminder> reminders;
        schedulingLock.lock();
        try {
            Instant now = clock.instant();
            reminders = computeReminders(location, match, occurrence, preferenceService.activePreferences(), now);
            LocationSchedule schedule = new LocationSchedule(location, match.rule().id(), match.side(),
                occurrence.startInstant(), occurrence.endInstant(), now);
            List<String> previousIds = reminderSetRepository.load().remindersForLocation(location.id()).stream()
                .map(ScheduledReminder::id)
                .toList();
            if (!previousIds.isEmpty()) {
                deliveryGateway.cancel(previousIds);
            }
            reminderSetRepository.update(set -> set
                .withoutLocation(location.id())
                .withLocation(schedule)
                .withReminders(reminders));
        } finally {
            schedulingLock.unlock();
        }

        log.info("Scheduled {} reminders for {} ({}, next cleaning {})",
            reminders.size(), location.toLogString(), match.toLogString(), occurrence.start());

        return submitAll(reminders).thenApply(failed -> {
            if (!failed.isEmpty()) {
                log.warn("{} of {} reminders for {} were not accepted for delivery; they stay persisted",
                    failed.size(), reminders.size(), location.id());
            }
            return new ScheduleOutcome(location.id(), ScheduleOutcome.Status.SCHEDULED, match,
                occurrence, reminders, failed);
        });
    }

    /**
     * Reminders for one occurrence, one per preference, keeping only instants after {@code now}.
     * Pure: touches neither the store nor the delivery channel.
     */
    public List<ScheduledReminder> computeReminders(ParkedLocation location, ResolvedMatch match,
                                                    Occurrence occurrence, List<ReminderPreference> preferences,
                                                    Instant now) {
        List<ScheduledReminder> reminders = new ArrayList<>();
        for (ReminderPreference preference : preferences) {
            if (!preference.active()) {
                continue;
            }
            Instant fireAt = timingCalculator.fireTime(preference.timing(), occurrence).toInstant();
            if (!fireAt.isAfter(now)) {
                log.debug("Skipping preference {}: {} is not in the future", preference.id(), fireAt);
                continue;
            }
            reminders.add(new ScheduledReminder(
                reminderId(location.id(), match.rule().id(), occurrence, preference.id()),
                location.id(),
                match.rule().id(),
                preference.id(),
                occurrence.startInstant(),
                fireAt,
                preference.title(),
                body(preference, match, occurrence),
                metadata(location, match, occurrence, preference)));
        }
        reminders.sort(Comparator.comparing(ScheduledReminder::fireAt));
        return reminders;
    }

    public static String reminderId(String locationId, String ruleId, Occurrence occurrence, String preferenceId) {
        return "rem_" + locationId + "_" + ruleId + "_" + occurrence.start().toLocalDateTime() + "_" + preferenceId;
    }

    /**
     * Stops tracking a location and cancels all of its reminders.
     *
     * @return false if the location was not tracked
     */
    public boolean cancelLocation(String locationId) {
        schedulingLock.lock();
        try {
            ReminderSet before = reminderSetRepository.load();
            List<String> ids = before.remindersForLocation(locationId).stream()
                .map(ScheduledReminder::id)
                .toList();
            boolean tracked = before.locations().containsKey(locationId);
            if (!tracked && ids.isEmpty()) {
                return false;
            }
            deliveryGateway.cancel(ids);
            reminderSetRepository.update(set -> set.withoutLocation(locationId));
            log.info("Cancelled {} reminders for location {}", ids.size(), locationId);
            return true;
        } finally {
            schedulingLock.unlock();
        }
    }

    public Optional<LocationReminders> findLocation(String locationId) {
        ReminderSet set = reminderSetRepository.load();
        LocationSchedule schedule = set.locations().get(locationId);
        if (schedule == null) {
            return Optional.empty();
        }
        List<ScheduledReminder> reminders = set.remindersForLocation(locationId).stream()
            .sorted(Comparator.comparing(ScheduledReminder::fireAt))
            .toList();
        return Optional.of(new LocationReminders(schedule, reminders));
    }

    /**
     * Brings the delivery channel in line with the persisted reminder set: drops reminders
     * whose time has passed and resubmits persisted ones the channel does not know.
     */
    public ReconcileReport reconcile() {
        AtomicInteger expired = new AtomicInteger();
        List<ScheduledReminder> current;
        List<ScheduledReminder> missing;

        schedulingLock.lock();
        try {
            Instant now = clock.instant();
            reminderSetRepository.update(set -> {
                List<String> expiredIds = set.reminders().values().stream()
                    .filter(r -> !r.fireAt().isAfter(now))
                    .map(ScheduledReminder::id)
                    .toList();
                expired.set(expiredIds.size());
                return set.withoutReminders(expiredIds);
            });

            Set<String> pending = deliveryGateway.pendingIds();
            current = List.copyOf(reminderSetRepository.load().reminders().values());
            missing = current.stream()
                .filter(r -> !pending.contains(r.id()))
                .toList();
        } finally {
            schedulingLock.unlock();
        }

        List<String> failed = submitAll(missing).join();
        List<String> resubmitted = missing.stream()
            .map(ScheduledReminder::id)
            .filter(id -> !failed.contains(id))
            .toList();

        ReconcileReport report = new ReconcileReport(expired.get(), current.size() - missing.size(),
            resubmitted, failed);
        if (report.expiredDropped() > 0 || !missing.isEmpty()) {
            log.info("Reconciled reminders: {} expired dropped, {} already pending, {} resubmitted, {} failed",
                report.expiredDropped(), report.alreadyPending(), resubmitted.size(), failed.size());
        }
        return report;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        try {
            reconcile();
        } catch (StoreUnavailableException e) {
            log.error("Startup reconcile failed; will retry on the next scheduled run", e);
        }
    }

    @Scheduled(fixedDelayString = "${sweeping.reminders.reconcile-interval-ms:900000}",
               initialDelayString = "${sweeping.reminders.reconcile-interval-ms:900000}")
    public void scheduledReconcile() {
        try {
            reconcile();
        } catch (StoreUnavailableException e) {
            log.error("Scheduled reconcile failed", e);
        }
    }

    /**
     * Re-schedules every tracked location whose tracked cleaning has started, so its
     * reminders move on to the following occurrence.
     *
     * @return number of locations re-scheduled
     */
    public int rollOverElapsed() {
        Instant now = clock.instant();
        List<ParkedLocation> elapsed = reminderSetRepository.load().locations().values().stream()
            .filter(s -> !s.occurrenceStart().isAfter(now))
            .map(LocationSchedule::location)
            .toList();
        elapsed.forEach(location -> schedule(location).whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Rollover of location {} failed", location.id(), error);
            }
        }));
        if (!elapsed.isEmpty()) {
            log.info("Rolled {} locations over to their next cleaning", elapsed.size());
        }
        return elapsed.size();
    }

    @Scheduled(fixedDelayString = "${sweeping.reminders.rollover-interval-ms:300000}",
               initialDelayString = "${sweeping.reminders.rollover-interval-ms:300000}")
    public void scheduledRollover() {
        try {
            rollOverElapsed();
        } catch (StoreUnavailableException e) {
            log.error("Scheduled rollover failed", e);
        }
    }

    /**
     * Re-schedules every tracked location, e.g. after the preference list changed.
     */
    public List<CompletableFuture<ScheduleOutcome>> rescheduleAll() {
        return reminderSetRepository.load().locations().values().stream()
            .map(LocationSchedule::location)
            .map(this::schedule)
            .toList();
    }

    @EventListener
    public void onPreferenceChanged(PreferenceChangedEvent event) {
        if (event.change().cancelsReminders()) {
            cancelPreference(event.preferenceId());
        } else {
            rescheduleAll();
        }
    }

    @EventListener
    public void onReminderDelivered(ReminderDeliveredEvent event) {
        reminderSetRepository.update(set -> set.withoutReminders(List.of(event.reminderId())));
    }

    private void cancelPreference(String preferenceId) {
        schedulingLock.lock();
        try {
            List<String> ids = reminderSetRepository.load().remindersForPreference(preferenceId).stream()
                .map(ScheduledReminder::id)
                .toList();
            if (ids.isEmpty()) {
                return;
            }
            deliveryGateway.cancel(ids);
            reminderSetRepository.update(set -> set.withoutReminders(ids));
            log.info("Cancelled {} reminders of preference {}", ids.size(), preferenceId);
        } finally {
            schedulingLock.unlock();
        }
    }

    /**
     * Submits reminders, each retried once after the backoff.
     *
     * @return future of the ids that failed both attempts
     */
    private CompletableFuture<List<String>> submitAll(List<ScheduledReminder> reminders) {
        Map<String, CompletableFuture<Boolean>> attempts = new LinkedHashMap<>();
        for (ScheduledReminder reminder : reminders) {
            attempts.put(reminder.id(), submitWithRetry(DeliveryRequest.from(reminder)));
        }
        return CompletableFuture.allOf(attempts.values().toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                List<String> failed = new ArrayList<>();
                attempts.forEach((id, attempt) -> {
                    if (!attempt.join()) {
                        failed.add(id);
                    }
                });
                return failed;
            });
    }

    private CompletableFuture<Boolean> submitWithRetry(DeliveryRequest request) {
        return CompletableFuture.supplyAsync(() -> trySubmit(request, 1))
            .thenCompose(accepted -> accepted
                ? CompletableFuture.completedFuture(true)
                : CompletableFuture.supplyAsync(() -> trySubmit(request, 2),
                    CompletableFuture.delayedExecutor(retryBackoff.toMillis(), TimeUnit.MILLISECONDS)));
    }

    /**
     * Submits while holding the scheduling lock, and only if the reminder is still persisted.
     * A reminder cancelled after it was selected for submission is therefore never handed
     * to the gateway, and one submitted first is removed by the cancel that follows.
     */
    private boolean trySubmit(DeliveryRequest request, int attempt) {
        schedulingLock.lock();
        try {
            if (!reminderSetRepository.load().reminders().containsKey(request.id())) {
                log.debug("Reminder {} was cancelled before submission, skipping", request.id());
                return true;
            }
            deliveryGateway.submit(request);
            return true;
        } catch (DeliverySubmissionException e) {
            log.warn("Delivery submission of {} failed (attempt {}): {}", request.id(), attempt, e.getMessage());
            return false;
        } finally {
            schedulingLock.unlock();
        }
    }

    /** Metadata keys delivered with every reminder. */
    private static Map<String, String> metadata(ParkedLocation location, ResolvedMatch match,
                                                Occurrence occurrence, ReminderPreference preference) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("locationId", location.id());
        if (location.label() != null) {
            metadata.put("locationLabel", location.label());
        }
        metadata.put("ruleId", match.rule().id());
        metadata.put("street", match.rule().corridorName());
        metadata.put("side", match.side().displayName());
        metadata.put("occurrenceStart", occurrence.start().toOffsetDateTime().toString());
        metadata.put("preferenceId", preference.id());
        return metadata;
    }

    private static String body(ReminderPreference preference, ResolvedMatch match, Occurrence occurrence) {
        String where = match.rule().corridorName() + " (" + match.side().displayName() + " side)";
        String when = match.rule().describeWindow() + ", " + occurrence.start().toLocalDate();
        String message = preference.message() == null || preference.message().isBlank()
            ? "Street cleaning coming up"
            : preference.message();
        return message + " " + where + ": " + when;
    }
}
