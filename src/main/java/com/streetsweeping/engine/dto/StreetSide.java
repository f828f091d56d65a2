package com.streetsweeping.engine.dto;

/**
 * Cardinal side of a street a point lies on.
 */
public enum StreetSide {
    NORTH("North"),
    SOUTH("South"),
    EAST("East"),
    WEST("West");

    private final String displayName;

    StreetSide(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
