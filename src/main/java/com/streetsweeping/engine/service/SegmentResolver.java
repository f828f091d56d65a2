package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.GeoPoint;
import com.streetsweeping.engine.dto.NearbyRule;
import com.streetsweeping.engine.dto.Occurrence;
import com.streetsweeping.engine.dto.ResolvedMatch;
import com.streetsweeping.engine.dto.ScheduleRule;
import com.streetsweeping.engine.dto.StreetSide;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the rule that applies to a point from a list of nearby candidates.
 *
 * Algorithm:
 * 1. Project the point onto every segment of every candidate, in an equirectangular
 *    metric frame centred on the point (accurate to well under a metre at block scale)
 * 2. The closest segment within the matching radius fixes the block and the side of
 *    the street
 * 3. Rules on that block whose block side covers the detected side, and which are
 *    themselves within the radius, are the applicable rules
 * 4. The applicable rule with the soonest next cleaning wins; rules that never
 *    occur rank last
 *
 * A point with no applicable rule has no restriction; that is an empty result, not an error.
 */
@Component
@Slf4j
public class SegmentResolver {

    /** Mean Earth radius (IUGG), metres. */
    private static final double EARTH_RADIUS_METERS = 6_371_008.8;
    private static final double METERS_PER_DEGREE = EARTH_RADIUS_METERS * Math.PI / 180.0;

    private final double maxMatchRadiusMeters;
    private final RecurrenceEngine recurrenceEngine;

    public SegmentResolver(SweepingProperties properties, RecurrenceEngine recurrenceEngine) {
        this.maxMatchRadiusMeters = properties.getResolver().getMaxMatchRadiusMeters();
        this.recurrenceEngine = recurrenceEngine;
    }

    public double maxMatchRadiusMeters() {
        return maxMatchRadiusMeters;
    }

    /**
     * Resolves the applicable rule for {@code point}.
     *
     * @param candidates rules near the point, typically from {@link SpatialGrid#candidatesNear}
     * @param reference  "now", used to rank rules by their next cleaning
     */
    public Optional<ResolvedMatch> resolve(GeoPoint point, List<ScheduleRule> candidates, ZonedDateTime reference) {
        List<SegmentHit> hits = measure(point, candidates);

        SegmentHit best = null;
        for (SegmentHit hit : hits) {
            if (hit.distanceMeters() <= maxMatchRadiusMeters
                && (best == null || hit.distanceMeters() < best.distanceMeters())) {
                best = hit;
            }
        }
        if (best == null) {
            log.debug("No segment within {}m of {}", maxMatchRadiusMeters, point.toLogString());
            return Optional.empty();
        }

        String blockKey = best.rule().blockKey();
        StreetSide side = best.side();
        List<SegmentHit> applicable = new ArrayList<>();
        for (SegmentHit hit : hits) {
            if (hit.rule().blockKey().equals(blockKey)
                && hit.distanceMeters() <= maxMatchRadiusMeters
                && StreetSideClassifier.isCompatible(hit.rule().blockSide(), side)) {
                applicable.add(hit);
            }
        }
        if (applicable.isEmpty()) {
            log.debug("Closest block {} has no rule for the {} side", blockKey, side.displayName());
            return Optional.empty();
        }

        applicable.sort(Comparator.comparingDouble(SegmentHit::distanceMeters));
        SegmentHit chosen = soonest(applicable, reference);
        return Optional.of(new ResolvedMatch(chosen.rule(), side, chosen.distanceMeters()));
    }

    /**
     * Every candidate within {@code radiusMeters}, with the side of its own closest
     * segment, nearest first.
     */
    public List<NearbyRule> findNearby(GeoPoint point, List<ScheduleRule> candidates, double radiusMeters) {
        return measure(point, candidates).stream()
            .filter(hit -> hit.distanceMeters() <= radiusMeters)
            .sorted(Comparator.comparingDouble(SegmentHit::distanceMeters))
            .map(hit -> new NearbyRule(hit.rule(), hit.side(), hit.distanceMeters(),
                StreetSideClassifier.isCompatible(hit.rule().blockSide(), hit.side())))
            .toList();
    }

    /**
     * Distance in metres from the point to the closest segment of the rule.
     */
    public double distanceMeters(GeoPoint point, ScheduleRule rule) {
        return closestSegment(point, rule).distanceMeters();
    }

    private SegmentHit soonest(List<SegmentHit> applicable, ZonedDateTime reference) {
        SegmentHit chosen = null;
        ZonedDateTime chosenStart = null;
        for (SegmentHit hit : applicable) {
            Optional<ZonedDateTime> start = recurrenceEngine.nextOccurrence(hit.rule(), reference)
                .map(Occurrence::start);
            if (chosen == null) {
                chosen = hit;
                chosenStart = start.orElse(null);
            } else if (start.isPresent() && (chosenStart == null || start.get().isBefore(chosenStart))) {
                chosen = hit;
                chosenStart = start.get();
            }
        }
        return chosen;
    }

    private List<SegmentHit> measure(GeoPoint point, List<ScheduleRule> candidates) {
        List<SegmentHit> hits = new ArrayList<>(candidates.size());
        for (ScheduleRule rule : candidates) {
            hits.add(closestSegment(point, rule));
        }
        return hits;
    }

    private SegmentHit closestSegment(GeoPoint point, ScheduleRule rule) {
        double metersPerDegreeLon = METERS_PER_DEGREE * Math.cos(Math.toRadians(point.latitude()));
        Coordinate origin = new Coordinate(0, 0);
        Coordinate[] vertices = rule.vertices();

        double bestDistance = Double.POSITIVE_INFINITY;
        StreetSide bestSide = null;
        for (int i = 0; i + 1 < vertices.length; i++) {
            Coordinate a = toLocal(vertices[i], point, metersPerDegreeLon);
            Coordinate b = toLocal(vertices[i + 1], point, metersPerDegreeLon);
            double distance = new LineSegment(a, b).distance(origin);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestSide = StreetSideClassifier.classify(a.x, a.y, b.x, b.y, 0, 0);
            }
        }
        return new SegmentHit(rule, bestDistance, bestSide);
    }

    private static Coordinate toLocal(Coordinate lonLat, GeoPoint origin, double metersPerDegreeLon) {
        return new Coordinate(
            (lonLat.getX() - origin.longitude()) * metersPerDegreeLon,
            (lonLat.getY() - origin.latitude()) * METERS_PER_DEGREE);
    }

    private record SegmentHit(ScheduleRule rule, double distanceMeters, StreetSide side) {
    }
}
