package com.streetsweeping.engine.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * When a reminder fires relative to a cleaning occurrence: either a named preset or a
 * custom offset rule.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PresetTiming.class, name = "preset"),
    @JsonSubTypes.Type(value = CustomTiming.class, name = "custom")
})
public interface ReminderTiming {

    /**
     * Canonical (amount, unit, anchor, time-of-day) form. Two timings with equal
     * normalized forms always fire at the same instant.
     */
    CustomTiming normalized();

    String displayText();
}
