package com.streetsweeping.engine.dto;

/**
 * What a reminder offset is measured from.
 */
public enum ReminderAnchor {
    /** Offset is subtracted from the start of the cleaning window. */
    BEFORE_CLEANING,
    /** Offset is added to the assumed end of the cleaning window. */
    AFTER_CLEANING
}
