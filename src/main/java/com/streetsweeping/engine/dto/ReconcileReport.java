package com.streetsweeping.engine.dto;

import java.util.List;

/**
 * Summary of a reconcile pass between the persisted reminder set and the delivery channel.
 */
public record ReconcileReport(
    int expiredDropped,
    int alreadyPending,
    List<String> resubmitted,
    List<String> failed
) {
}
