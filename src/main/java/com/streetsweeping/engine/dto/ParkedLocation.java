package com.streetsweeping.engine.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

/**
 * A location the user wants cleaning reminders for, typically where the car is parked.
 */
public record ParkedLocation(
    @NotBlank String id,
    @DecimalMin("-90.0") @DecimalMax("90.0") double latitude,
    @DecimalMin("-180.0") @DecimalMax("180.0") double longitude,
    String label
) {

    public GeoPoint point() {
        return GeoPoint.of(latitude, longitude);
    }

    public String toLogString() {
        return String.format("Location[id=%s, lat=%.6f, lon=%.6f]", id, latitude, longitude);
    }
}
