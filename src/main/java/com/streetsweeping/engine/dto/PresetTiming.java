package com.streetsweeping.engine.dto;

import jakarta.validation.constraints.NotNull;

public record PresetTiming(@NotNull PresetReminder preset) implements ReminderTiming {

    @Override
    public CustomTiming normalized() {
        return preset.timing().normalized();
    }

    @Override
    public String displayText() {
        return preset.displayText();
    }
}
