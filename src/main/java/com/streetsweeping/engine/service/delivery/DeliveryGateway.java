package com.streetsweeping.engine.service.delivery;

import java.util.Collection;
import java.util.Set;

/**
 * Channel that fires reminders at their scheduled instant.
 *
 * Submitting an id that is already pending replaces the pending request.
 */
public interface DeliveryGateway {

    void submit(DeliveryRequest request) throws DeliverySubmissionException;

    /**
     * Ids submitted and not yet delivered or cancelled.
     */
    Set<String> pendingIds();

    /**
     * Cancels pending requests. Unknown ids are ignored.
     */
    void cancel(Collection<String> ids);
}
