package com.streetsweeping.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of a preference create or update request. A blank title defaults to the timing's
 * display text.
 */
public record PreferenceRequest(
    @Size(max = 100) String title,
    @Size(max = 500) String message,
    @NotNull @Valid ReminderTiming timing
) {
}
