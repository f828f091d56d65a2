package com.streetsweeping.engine.service;

import com.streetsweeping.engine.dto.GeoPoint;
import com.streetsweeping.engine.dto.ScheduleRule;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform lat/lon grid over schedule rules.
 *
 * Every rule is registered in each cell that contains one of its vertices. A query
 * collects the square block of cells around the query cell, so candidate lookup costs
 * O((2r+1)^2) map reads regardless of catalog size.
 *
 * Only vertices are registered: a long segment that crosses a cell without a vertex
 * in it is not found from that cell. Street segments in the schedule table are short
 * (one block), and the default two-cell search radius covers the gap.
 *
 * Immutable after construction.
 */
public class SpatialGrid {

    private final double cellSize;
    private final List<ScheduleRule> rules;
    private final Map<Long, int[]> cells;

    public SpatialGrid(List<ScheduleRule> rules, double cellSizeDegrees) {
        if (!(cellSizeDegrees > 0) || !Double.isFinite(cellSizeDegrees)) {
            throw new IllegalArgumentException("Cell size must be positive, got " + cellSizeDegrees);
        }
        this.cellSize = cellSizeDegrees;
        this.rules = List.copyOf(rules);

        Map<Long, List<Integer>> building = new HashMap<>();
        for (int index = 0; index < this.rules.size(); index++) {
            for (Coordinate vertex : this.rules.get(index).vertices()) {
                long key = cellKey(cellX(vertex.getX()), cellY(vertex.getY()));
                List<Integer> members = building.computeIfAbsent(key, k -> new ArrayList<>());
                // Vertices of one rule are visited in order, so a repeat is always the last entry
                if (members.isEmpty() || members.get(members.size() - 1) != index) {
                    members.add(index);
                }
            }
        }

        this.cells = new HashMap<>(building.size() * 2);
        building.forEach((key, members) ->
            cells.put(key, members.stream().mapToInt(Integer::intValue).toArray()));
    }

    /**
     * Rules registered within {@code radiusCells} cells of the point, each once, in
     * catalog order.
     */
    public List<ScheduleRule> candidatesNear(GeoPoint point, int radiusCells) {
        if (radiusCells < 0) {
            throw new IllegalArgumentException("Radius must be >= 0, got " + radiusCells);
        }
        int centerX = cellX(point.longitude());
        int centerY = cellY(point.latitude());

        BitSet hits = new BitSet(rules.size());
        for (int dx = -radiusCells; dx <= radiusCells; dx++) {
            for (int dy = -radiusCells; dy <= radiusCells; dy++) {
                int[] members = cells.get(cellKey(centerX + dx, centerY + dy));
                if (members != null) {
                    for (int index : members) {
                        hits.set(index);
                    }
                }
            }
        }

        List<ScheduleRule> candidates = new ArrayList<>(hits.cardinality());
        for (int index = hits.nextSetBit(0); index >= 0; index = hits.nextSetBit(index + 1)) {
            candidates.add(rules.get(index));
        }
        return candidates;
    }

    public int cellCount() {
        return cells.size();
    }

    public double cellSize() {
        return cellSize;
    }

    int cellX(double longitude) {
        return (int) Math.floor(longitude / cellSize);
    }

    int cellY(double latitude) {
        return (int) Math.floor(latitude / cellSize);
    }

    private static long cellKey(int x, int y) {
        return ((long) x << 32) | (y & 0xFFFFFFFFL);
    }
}
