package com.streetsweeping.engine.dto;

/**
 * Outcome of adding or updating a reminder preference.
 */
public enum AddPreferenceResult {
    ADDED,
    /** An existing preference was changed. */
    UPDATED,
    /** An existing preference already fires at the same time. */
    DUPLICATE,
    /** The preference list is full. */
    LIMIT_REACHED
}
