package com.streetsweeping.engine.dto;

/**
 * Citation statistics attached to a block in the source table.
 * Informational only, never used to resolve a rule.
 *
 * @param count       number of sweeping citations recorded on the block
 * @param averageHour average citation time as fractional hour (9.5 = 9:30)
 * @param minHour     earliest citation time as fractional hour
 * @param maxHour     latest citation time as fractional hour
 */
public record CitationStats(
    int count,
    Double averageHour,
    Double minHour,
    Double maxHour
) {
}
