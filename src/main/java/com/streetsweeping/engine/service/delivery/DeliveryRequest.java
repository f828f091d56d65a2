package com.streetsweeping.engine.service.delivery;

import com.streetsweeping.engine.dto.ScheduledReminder;

import java.time.Instant;
import java.util.Map;

/**
 * A reminder as handed to the delivery channel.
 */
public record DeliveryRequest(
    String id,
    Instant fireAt,
    String title,
    String body,
    Map<String, String> metadata
) {

    public static DeliveryRequest from(ScheduledReminder reminder) {
        return new DeliveryRequest(reminder.id(), reminder.fireAt(), reminder.title(),
            reminder.body(), reminder.metadata());
    }
}
