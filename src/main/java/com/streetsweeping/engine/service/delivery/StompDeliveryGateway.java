package com.streetsweeping.engine.service.delivery;

import com.streetsweeping.engine.config.SweepingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivery gateway that holds reminders in memory and publishes each one on the STOMP
 * reminder topic once it is due.
 *
 * Pending requests live only in this process. After a restart the scheduler's reconcile
 * pass resubmits every persisted reminder that is still in the future.
 *
 * Message Flow:
 * 1. Scheduler submits a reminder
 * 2. The dispatcher polls for due reminders every few seconds
 * 3. Due reminders are sent to {@code /topic/reminders}
 * 4. A {@link ReminderDeliveredEvent} tells the scheduler to forget the reminder
 */
@Component
@Slf4j
public class StompDeliveryGateway implements DeliveryGateway {

    private final SimpMessagingTemplate messagingTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final String destination;
    private final int maxPending;

    private final Map<String, DeliveryRequest> pending = new ConcurrentHashMap<>();

    public StompDeliveryGateway(SimpMessagingTemplate messagingTemplate,
                                ApplicationEventPublisher eventPublisher,
                                Clock clock,
                                SweepingProperties properties,
                                @Value("${sweeping.delivery.max-pending:10000}") int maxPending) {
        this.messagingTemplate = messagingTemplate;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.destination = properties.getReminders().getDestination();
        this.maxPending = maxPending;
    }

    @Override
    public void submit(DeliveryRequest request) throws DeliverySubmissionException {
        if (request.id() == null || request.fireAt() == null) {
            throw new DeliverySubmissionException("Reminder id and fire time are required");
        }
        if (pending.size() >= maxPending && !pending.containsKey(request.id())) {
            throw new DeliverySubmissionException(
                "Delivery queue is full (" + maxPending + " pending), rejected " + request.id());
        }
        pending.put(request.id(), request);
        log.debug("Queued reminder {} for {}", request.id(), request.fireAt());
    }

    @Override
    public Set<String> pendingIds() {
        return Set.copyOf(pending.keySet());
    }

    @Override
    public void cancel(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            if (pending.remove(id) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Cancelled {} pending reminders", removed);
        }
    }

    @Scheduled(fixedDelayString = "${sweeping.delivery.dispatch-interval-ms:5000}")
    public void scheduledDispatch() {
        dispatchDue();
    }

    /**
     * Publishes every reminder whose fire time has come. A reminder that cannot be sent
     * stays queued for the next run.
     *
     * @return number of reminders delivered
     */
    public int dispatchDue() {
        Instant now = clock.instant();
        List<DeliveryRequest> due = new ArrayList<>();
        for (DeliveryRequest request : pending.values()) {
            if (!request.fireAt().isAfter(now)) {
                due.add(request);
            }
        }

        int delivered = 0;
        for (DeliveryRequest request : due) {
            try {
                messagingTemplate.convertAndSend(destination, toMessage(request, now));
            } catch (MessagingException e) {
                log.error("Failed to publish reminder {}, will retry", request.id(), e);
                continue;
            }
            // Only forget it if it was not cancelled or replaced meanwhile
            if (pending.remove(request.id(), request)) {
                delivered++;
                eventPublisher.publishEvent(new ReminderDeliveredEvent(request.id(), now));
            }
        }
        if (delivered > 0) {
            log.info("Delivered {} reminders to {}", delivered, destination);
        }
        return delivered;
    }

    private static Map<String, Object> toMessage(DeliveryRequest request, Instant now) {
        Map<String, Object> message = new HashMap<>();
        message.put("type", "REMINDER");
        message.put("id", request.id());
        message.put("title", request.title());
        message.put("body", request.body());
        message.put("fireAt", request.fireAt().toString());
        message.put("metadata", request.metadata());
        message.put("timestamp", now.toString());
        return message;
    }
}
