package com.streetsweeping.engine.dto;

/**
 * Result of a preference mutation. {@code preference} is the stored preference when
 * the change was applied, or the conflicting existing one for {@link AddPreferenceResult#DUPLICATE}.
 */
public record PreferenceChange(
    AddPreferenceResult result,
    ReminderPreference preference
) {
}
