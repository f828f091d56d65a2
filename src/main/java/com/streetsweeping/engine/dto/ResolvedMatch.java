package com.streetsweeping.engine.dto;

/**
 * Result of resolving a point against the schedule catalog.
 *
 * A match is only ever built for a segment within the configured matching radius,
 * so {@code distanceMeters} never exceeds it.
 *
 * @param rule           the applicable rule
 * @param side           side of the street the query point is on
 * @param distanceMeters distance from the point to the rule's nearest segment
 */
public record ResolvedMatch(
    ScheduleRule rule,
    StreetSide side,
    double distanceMeters
) {

    public String toLogString() {
        return String.format("Match[rule=%s, street=%s, side=%s, distance=%.1fm]",
            rule.id(), rule.corridorName(), side.displayName(), distanceMeters);
    }
}
