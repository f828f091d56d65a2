package com.streetsweeping.engine.dto;

/**
 * A rule found by the "everything nearby" query, with the side of its street the
 * query point is on.
 */
public record NearbyRule(
    ScheduleRule rule,
    StreetSide side,
    double distanceMeters,
    boolean sideMatches
) {
}
