package com.streetsweeping.engine.dto;

import java.time.Instant;

/**
 * Load status of the schedule catalog.
 */
public record CatalogStats(
    boolean loaded,
    int ruleCount,
    int blockCount,
    int gridCellCount,
    int rejectedRows,
    Instant loadedAt,
    String source
) {
}
