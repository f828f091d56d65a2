package com.streetsweeping.engine.service;

/**
 * Published synchronously after a reminder preference was stored or removed.
 */
public record PreferenceChangedEvent(String preferenceId, Change change) {

    public enum Change {
        ADDED,
        UPDATED,
        ENABLED,
        DISABLED,
        REMOVED;

        /** True when reminders tied to the preference must be cancelled. */
        public boolean cancelsReminders() {
            return this == DISABLED || this == REMOVED;
        }
    }
}
