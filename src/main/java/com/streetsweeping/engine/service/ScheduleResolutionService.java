package com.streetsweeping.engine.service;

import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.GeoPoint;
import com.streetsweeping.engine.dto.NearbyRule;
import com.streetsweeping.engine.dto.Occurrence;
import com.streetsweeping.engine.dto.RecurrenceHorizon;
import com.streetsweeping.engine.dto.ResolutionResult;
import com.streetsweeping.engine.dto.ResolvedMatch;
import com.streetsweeping.engine.dto.ScheduleRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Point-to-schedule pipeline: grid lookup, segment resolution, recurrence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleResolutionService {

    private final ScheduleCatalogService catalogService;
    private final SegmentResolver segmentResolver;
    private final RecurrenceEngine recurrenceEngine;
    private final SweepingProperties properties;
    private final Clock clock;

    public ResolutionResult resolve(GeoPoint point) {
        return resolve(point, ZonedDateTime.now(clock).withZoneSameInstant(recurrenceEngine.zone()));
    }

    public ResolutionResult resolve(GeoPoint point, ZonedDateTime reference) {
        ScheduleCatalog catalog = catalogService.current();
        if (!catalog.hasData()) {
            log.info("Schedule data unavailable, reporting no restriction for {}", point.toLogString());
            return ResolutionResult.noRestriction(false);
        }

        List<ScheduleRule> candidates = catalog.candidatesNear(point, properties.getGrid().getResolveRadiusCells());
        Optional<ResolvedMatch> match = segmentResolver.resolve(point, candidates, reference);
        if (match.isEmpty()) {
            return ResolutionResult.noRestriction(true);
        }

        List<Occurrence> upcoming = recurrenceEngine.nextOccurrences(match.get().rule(), reference);
        log.debug("Resolved {} to {} ({} upcoming)", point.toLogString(), match.get().toLogString(), upcoming.size());
        return new ResolutionResult(ResolutionResult.Status.RESTRICTED, match.get(), upcoming, true);
    }

    /**
     * Every rule around the point, nearest first.
     *
     * @param radiusCells grid radius to search, defaults to the configured nearby radius
     */
    public List<NearbyRule> nearby(GeoPoint point, Integer radiusCells) {
        ScheduleCatalog catalog = catalogService.current();
        int radius = radiusCells != null ? radiusCells : properties.getGrid().getNearbyRadiusCells();
        List<ScheduleRule> candidates = catalog.candidatesNear(point, radius);
        return segmentResolver.findNearby(point, candidates, properties.getResolver().getNearbyRadiusMeters());
    }

    /**
     * Occurrences of a rule after {@code after} (default: now), or empty if the rule is unknown.
     */
    public Optional<List<Occurrence>> occurrences(String ruleId, ZonedDateTime after, Integer months, Integer limit) {
        RecurrenceHorizon defaults = recurrenceEngine.defaultHorizon();
        RecurrenceHorizon horizon = RecurrenceHorizon.months(
            months != null ? months : defaults.amount(),
            limit != null ? limit : defaults.maxResults());
        ZonedDateTime reference = after != null ? after : ZonedDateTime.now(clock);
        return catalogService.current().findRule(ruleId)
            .map(rule -> recurrenceEngine.nextOccurrences(rule, reference, horizon));
    }
}
