package com.streetsweeping.engine.service.delivery;

import java.time.Instant;

/**
 * Published after a reminder was handed to subscribers.
 */
public record ReminderDeliveredEvent(String reminderId, Instant deliveredAt) {
}
