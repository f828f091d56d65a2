package com.streetsweeping.engine.service;

import com.streetsweeping.engine.dto.StreetSide;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides which side of a street segment a point is on, and whether a free-text block
 * side from the schedule table covers that side.
 *
 * Coordinates are in a local metric frame: x grows east, y grows north.
 */
public final class StreetSideClassifier {

    private static final Map<String, Set<StreetSide>> ABBREVIATIONS = Map.of(
        "n", EnumSet.of(StreetSide.NORTH),
        "s", EnumSet.of(StreetSide.SOUTH),
        "e", EnumSet.of(StreetSide.EAST),
        "w", EnumSet.of(StreetSide.WEST),
        "ne", EnumSet.of(StreetSide.NORTH, StreetSide.EAST),
        "nw", EnumSet.of(StreetSide.NORTH, StreetSide.WEST),
        "se", EnumSet.of(StreetSide.SOUTH, StreetSide.EAST),
        "sw", EnumSet.of(StreetSide.SOUTH, StreetSide.WEST)
    );

    private StreetSideClassifier() {
    }

    /**
     * Compass bearing of the direction (dx, dy), in degrees [0, 360), 0 = north.
     */
    public static double bearing(double dx, double dy) {
        double degrees = Math.toDegrees(Math.atan2(dx, dy));
        return degrees < 0 ? degrees + 360.0 : degrees;
    }

    /**
     * Side of segment a-b that point p lies on.
     *
     * Segments heading within 45 degrees of north or south belong to a north-south
     * street, whose sides are East and West; all others to an east-west street. The
     * result does not depend on the order of a and b. A point exactly on the line is
     * reported on the East (north-south street) or North (east-west street) side.
     */
    public static StreetSide classify(double ax, double ay, double bx, double by, double px, double py) {
        double dx = bx - ax;
        double dy = by - ay;
        double cross = dx * (py - ay) - dy * (px - ax);
        double bearing = bearing(dx, dy);

        boolean northbound = bearing >= 315.0 || bearing < 45.0;
        boolean southbound = bearing >= 135.0 && bearing < 225.0;
        boolean eastbound = bearing >= 45.0 && bearing < 135.0;

        if (northbound || southbound) {
            if (cross == 0.0) {
                return StreetSide.EAST;
            }
            boolean left = cross > 0;
            // Left of northbound is West, left of southbound is East
            return left == northbound ? StreetSide.WEST : StreetSide.EAST;
        }
        if (cross == 0.0) {
            return StreetSide.NORTH;
        }
        boolean left = cross > 0;
        // Left of eastbound is North, left of westbound is South
        return left == eastbound ? StreetSide.NORTH : StreetSide.SOUTH;
    }

    /**
     * True when the block side text names {@code side}: "North", "Northeast", "N", "NE", ...
     */
    public static boolean isCompatible(String blockSide, StreetSide side) {
        if (blockSide == null || blockSide.isBlank()) {
            return false;
        }
        String normalized = blockSide.toLowerCase(Locale.ROOT);
        if (normalized.contains(side.displayName().toLowerCase(Locale.ROOT))) {
            return true;
        }
        for (String token : normalized.split("[^a-z]+")) {
            Set<StreetSide> sides = ABBREVIATIONS.get(token);
            if (sides != null && sides.contains(side)) {
                return true;
            }
        }
        return false;
    }
}
