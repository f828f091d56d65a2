package com.streetsweeping.engine.dto;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted scheduling state: tracked locations and their pending reminders.
 *
 * Stored as a single document and always replaced as a whole. Mutators return copies.
 */
public record ReminderSet(
    Map<String, LocationSchedule> locations,
    Map<String, ScheduledReminder> reminders
) {

    public ReminderSet {
        locations = locations == null ? new LinkedHashMap<>() : new LinkedHashMap<>(locations);
        reminders = reminders == null ? new LinkedHashMap<>() : new LinkedHashMap<>(reminders);
    }

    public static ReminderSet empty() {
        return new ReminderSet(Map.of(), Map.of());
    }

    public List<ScheduledReminder> remindersForLocation(String locationId) {
        return reminders.values().stream()
            .filter(r -> r.locationId().equals(locationId))
            .toList();
    }

    public List<ScheduledReminder> remindersForPreference(String preferenceId) {
        return reminders.values().stream()
            .filter(r -> r.preferenceId().equals(preferenceId))
            .toList();
    }

    public ReminderSet withLocation(LocationSchedule schedule) {
        ReminderSet copy = new ReminderSet(locations, reminders);
        copy.locations.put(schedule.location().id(), schedule);
        return copy;
    }

    /**
     * Removes the location together with every reminder that belongs to it.
     */
    public ReminderSet withoutLocation(String locationId) {
        ReminderSet copy = new ReminderSet(locations, reminders);
        copy.locations.remove(locationId);
        copy.reminders.values().removeIf(r -> r.locationId().equals(locationId));
        return copy;
    }

    public ReminderSet withReminders(Collection<ScheduledReminder> added) {
        ReminderSet copy = new ReminderSet(locations, reminders);
        added.forEach(r -> copy.reminders.put(r.id(), r));
        return copy;
    }

    public ReminderSet withoutReminders(Collection<String> ids) {
        ReminderSet copy = new ReminderSet(locations, reminders);
        ids.forEach(copy.reminders::remove);
        return copy;
    }
}
