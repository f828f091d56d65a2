package com.streetsweeping.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Answer to "what cleaning restriction applies here?".
 *
 * @param status        whether a restriction applies
 * @param match         the applicable rule, null without a restriction
 * @param upcoming      next occurrences of the matched rule, ascending
 * @param dataAvailable false while the schedule catalog is not loaded
 */
public record ResolutionResult(
    Status status,
    ResolvedMatch match,
    List<Occurrence> upcoming,
    boolean dataAvailable
) {

    public enum Status {
        RESTRICTED,
        NO_RESTRICTION
    }

    public static ResolutionResult noRestriction(boolean dataAvailable) {
        return new ResolutionResult(Status.NO_RESTRICTION, null, List.of(), dataAvailable);
    }

    @JsonProperty("nextOccurrence")
    public Occurrence nextOccurrence() {
        return upcoming.isEmpty() ? null : upcoming.get(0);
    }
}
