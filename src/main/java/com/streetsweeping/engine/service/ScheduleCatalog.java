package com.streetsweeping.engine.service;

import com.streetsweeping.engine.dto.CatalogStats;
import com.streetsweeping.engine.dto.GeoPoint;
import com.streetsweeping.engine.dto.ScheduleRule;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A loaded schedule table with its spatial index. Immutable; a reload builds a new one.
 */
public final class ScheduleCatalog {

    private final List<ScheduleRule> rules;
    private final Map<String, ScheduleRule> rulesById;
    private final SpatialGrid grid;
    private final boolean loaded;
    private final int rejectedRows;
    private final Instant loadedAt;
    private final String source;

    private ScheduleCatalog(List<ScheduleRule> rules, SpatialGrid grid, boolean loaded,
                            int rejectedRows, Instant loadedAt, String source) {
        this.rules = List.copyOf(rules);
        this.grid = grid;
        this.loaded = loaded;
        this.rejectedRows = rejectedRows;
        this.loadedAt = loadedAt;
        this.source = source;

        Map<String, ScheduleRule> byId = new LinkedHashMap<>();
        for (ScheduleRule rule : this.rules) {
            byId.putIfAbsent(rule.id(), rule);
        }
        this.rulesById = Map.copyOf(byId);
    }

    public static ScheduleCatalog of(List<ScheduleRule> rules, double cellSizeDegrees,
                                     int rejectedRows, Instant loadedAt, String source) {
        return new ScheduleCatalog(rules, new SpatialGrid(rules, cellSizeDegrees), true,
            rejectedRows, loadedAt, source);
    }

    /**
     * The "no data" catalog: nothing loaded yet, or the table was unusable.
     */
    public static ScheduleCatalog empty(String source) {
        return new ScheduleCatalog(List.of(), new SpatialGrid(List.of(), 1.0), false, 0, null, source);
    }

    /**
     * True when the catalog can answer queries. An empty catalog answers every query
     * with "no restriction".
     */
    public boolean hasData() {
        return loaded && !rules.isEmpty();
    }

    public List<ScheduleRule> rules() {
        return rules;
    }

    public Optional<ScheduleRule> findRule(String id) {
        return Optional.ofNullable(rulesById.get(id));
    }

    public List<ScheduleRule> candidatesNear(GeoPoint point, int radiusCells) {
        return grid.candidatesNear(point, radiusCells);
    }

    public CatalogStats stats() {
        long blocks = rules.stream().map(ScheduleRule::blockKey).distinct().count();
        return new CatalogStats(loaded, rules.size(), (int) blocks, grid.cellCount(),
            rejectedRows, loadedAt, source);
    }
}
