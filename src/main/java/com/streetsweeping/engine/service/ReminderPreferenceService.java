package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.AddPreferenceResult;
import com.streetsweeping.engine.dto.CustomTiming;
import com.streetsweeping.engine.dto.OffsetUnit;
import com.streetsweeping.engine.dto.PreferenceChange;
import com.streetsweeping.engine.dto.PresetReminder;
import com.streetsweeping.engine.dto.PresetTiming;
import com.streetsweeping.engine.dto.ReminderPreference;
import com.streetsweeping.engine.dto.ReminderTiming;
import com.streetsweeping.engine.dto.TimeOfDay;
import com.streetsweeping.engine.repository.PreferenceRepository;
import com.streetsweeping.engine.repository.PreferenceRepository.PreferenceList;
import com.streetsweeping.engine.repository.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manages reminder preferences.
 *
 * Two preferences whose timings normalize to the same (amount, unit, anchor, time of day)
 * fire at the same instant for every occurrence, so adding the second one is reported as
 * {@link AddPreferenceResult#DUPLICATE} unless forced. The preference count is capped;
 * the cap is checked before duplicates and cannot be forced.
 *
 * Every change publishes a {@link PreferenceChangedEvent}; the reminder scheduler
 * listens to it to cancel or re-apply reminders.
 */
@Service
@Slf4j
public class ReminderPreferenceService {

    private final PreferenceRepository repository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxPreferences;
    private final boolean seedDefaults;

    public ReminderPreferenceService(PreferenceRepository repository,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock,
                                     SweepingProperties properties) {
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxPreferences = properties.getReminders().getMaxPreferences();
        this.seedDefaults = properties.getReminders().isSeedDefaults();
    }

    /**
     * Writes the default preferences the first time the application starts against an
     * empty store.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public void seedDefaultsOnStartup() {
        if (!seedDefaults) {
            return;
        }
        try {
            int seeded = seedDefaultPreferences();
            if (seeded > 0) {
                log.info("Seeded {} default reminder preferences", seeded);
            }
        } catch (StoreUnavailableException e) {
            log.error("Could not seed default reminder preferences", e);
        }
    }

    /**
     * @return number of preferences written, 0 when the store was seeded before
     */
    public int seedDefaultPreferences() {
        AtomicReference<Integer> written = new AtomicReference<>(0);
        repository.update(list -> {
            if (list.wasSeeded()) {
                return list;
            }
            List<ReminderPreference> preferences = new ArrayList<>(list.preferences());
            if (preferences.isEmpty()) {
                preferences.addAll(defaultPreferences(clock.instant()));
                written.set(preferences.size());
            }
            return new PreferenceList(true, preferences);
        });
        return written.get();
    }

    public List<ReminderPreference> list() {
        return repository.load().preferences();
    }

    public List<ReminderPreference> activePreferences() {
        return list().stream().filter(ReminderPreference::active).toList();
    }

    public Optional<ReminderPreference> find(String id) {
        return list().stream().filter(p -> p.id().equals(id)).findFirst();
    }

    /**
     * Adds a preference.
     *
     * @param force store it even if an existing preference fires at the same time
     */
    public PreferenceChange add(String title, String message, ReminderTiming timing, boolean force) {
        AtomicReference<PreferenceChange> change = new AtomicReference<>();
        repository.update(list -> {
            List<ReminderPreference> preferences = list.preferences();
            if (preferences.size() >= maxPreferences) {
                change.set(new PreferenceChange(AddPreferenceResult.LIMIT_REACHED, null));
                return list;
            }
            if (!force) {
                Optional<ReminderPreference> duplicate = findSameTiming(preferences, timing, null);
                if (duplicate.isPresent()) {
                    change.set(new PreferenceChange(AddPreferenceResult.DUPLICATE, duplicate.get()));
                    return list;
                }
            }
            ReminderPreference created = new ReminderPreference(
                UUID.randomUUID().toString(),
                titleOrDefault(title, timing),
                messageOrDefault(message, timing),
                timing,
                true,
                clock.instant());
            change.set(new PreferenceChange(AddPreferenceResult.ADDED, created));
            return list.append(created);
        });

        PreferenceChange result = change.get();
        if (result.result() == AddPreferenceResult.ADDED) {
            log.info("Added reminder preference {}", result.preference().toLogString());
            eventPublisher.publishEvent(new PreferenceChangedEvent(result.preference().id(), PreferenceChangedEvent.Change.ADDED));
        } else {
            log.info("Reminder preference '{}' not added: {}", title, result.result());
        }
        return result;
    }

    /**
     * Replaces title, message and timing of a preference.
     *
     * @return empty if no preference has this id
     */
    public Optional<PreferenceChange> update(String id, String title, String message, ReminderTiming timing, boolean force) {
        AtomicReference<PreferenceChange> change = new AtomicReference<>();
        repository.update(list -> {
            List<ReminderPreference> preferences = new ArrayList<>(list.preferences());
            for (int i = 0; i < preferences.size(); i++) {
                ReminderPreference existing = preferences.get(i);
                if (!existing.id().equals(id)) {
                    continue;
                }
                if (!force) {
                    Optional<ReminderPreference> duplicate = findSameTiming(preferences, timing, id);
                    if (duplicate.isPresent()) {
                        change.set(new PreferenceChange(AddPreferenceResult.DUPLICATE, duplicate.get()));
                        return list;
                    }
                }
                ReminderPreference updated = existing.withContent(
                    titleOrDefault(title, timing), messageOrDefault(message, timing), timing);
                preferences.set(i, updated);
                change.set(new PreferenceChange(AddPreferenceResult.UPDATED, updated));
                return list.with(preferences);
            }
            return list;
        });

        PreferenceChange result = change.get();
        if (result != null && result.result() == AddPreferenceResult.UPDATED) {
            log.info("Updated reminder preference {}", result.preference().toLogString());
            eventPublisher.publishEvent(new PreferenceChangedEvent(id, PreferenceChangedEvent.Change.UPDATED));
        }
        return Optional.ofNullable(result);
    }

    /**
     * Enables or disables a preference. Disabling cancels its scheduled reminders.
     */
    public Optional<ReminderPreference> setActive(String id, boolean active) {
        AtomicReference<ReminderPreference> changed = new AtomicReference<>();
        AtomicReference<Boolean> wasActive = new AtomicReference<>();
        repository.update(list -> list.with(list.preferences().stream()
            .map(p -> {
                if (!p.id().equals(id)) {
                    return p;
                }
                wasActive.set(p.active());
                ReminderPreference updated = p.withActive(active);
                changed.set(updated);
                return updated;
            })
            .toList()));

        if (changed.get() != null && wasActive.get() != active) {
            log.info("Reminder preference {} {}", id, active ? "enabled" : "disabled");
            eventPublisher.publishEvent(new PreferenceChangedEvent(id,
                active ? PreferenceChangedEvent.Change.ENABLED : PreferenceChangedEvent.Change.DISABLED));
        }
        return Optional.ofNullable(changed.get());
    }

    /**
     * Removes a preference and cancels its scheduled reminders.
     *
     * @return false if no preference has this id
     */
    public boolean remove(String id) {
        AtomicReference<Boolean> removed = new AtomicReference<>(false);
        repository.update(list -> {
            List<ReminderPreference> remaining = list.preferences().stream()
                .filter(p -> !p.id().equals(id))
                .toList();
            removed.set(remaining.size() != list.preferences().size());
            return list.with(remaining);
        });

        if (removed.get()) {
            log.info("Removed reminder preference {}", id);
            eventPublisher.publishEvent(new PreferenceChangedEvent(id, PreferenceChangedEvent.Change.REMOVED));
        }
        return removed.get();
    }

    public int maxPreferences() {
        return maxPreferences;
    }

    static List<ReminderPreference> defaultPreferences(Instant createdAt) {
        return List.of(
            new ReminderPreference("default-evening-before", "Evening Before",
                "Street cleaning tomorrow - move your car tonight!",
                CustomTiming.before(1, OffsetUnit.DAYS, TimeOfDay.of(17, 0)), true, createdAt),
            new ReminderPreference("default-morning-of", "Morning Of",
                PresetReminder.MORNING_OF.defaultMessage(),
                CustomTiming.before(0, OffsetUnit.DAYS, TimeOfDay.of(8, 0)), true, createdAt),
            new ReminderPreference("default-30-minutes", "30 Minutes Before",
                PresetReminder.THIRTY_MINUTES_BEFORE.defaultMessage(),
                new PresetTiming(PresetReminder.THIRTY_MINUTES_BEFORE), true, createdAt));
    }

    private static Optional<ReminderPreference> findSameTiming(List<ReminderPreference> preferences,
                                                               ReminderTiming timing, String excludeId) {
        CustomTiming normalized = timing.normalized();
        return preferences.stream()
            .filter(p -> !p.id().equals(excludeId))
            .filter(p -> p.timing().normalized().equals(normalized))
            .findFirst();
    }

    private static String titleOrDefault(String title, ReminderTiming timing) {
        return title == null || title.isBlank() ? timing.displayText() : title.trim();
    }

    private static String messageOrDefault(String message, ReminderTiming timing) {
        if (message != null && !message.isBlank()) {
            return message.trim();
        }
        if (timing instanceof PresetTiming preset) {
            return preset.preset().defaultMessage();
        }
        return "Street cleaning is coming up - check where you parked!";
    }
}
