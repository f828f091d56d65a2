package com.streetsweeping.engine.controller;

import com.streetsweeping.engine.dto.CatalogStats;
import com.streetsweeping.engine.dto.GeoPoint;
import com.streetsweeping.engine.dto.NearbyRule;
import com.streetsweeping.engine.dto.Occurrence;
import com.streetsweeping.engine.dto.ResolutionResult;
import com.streetsweeping.engine.service.ScheduleCatalogService;
import com.streetsweeping.engine.service.ScheduleResolutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * REST Controller for schedule lookups.
 *
 * Endpoints:
 * 1. Resolve the restriction at a point
 * 2. List every rule around a point
 * 3. List upcoming occurrences of a rule
 * 4. Inspect and reload the schedule catalog
 */
@RestController
@RequestMapping("/api/sweeping")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Street Sweeping", description = "Street cleaning schedule resolution API")
public class ScheduleController {

    private static final int MAX_MONTHS = 24;
    private static final int MAX_OCCURRENCES = 100;

    private final ScheduleResolutionService resolutionService;
    private final ScheduleCatalogService catalogService;

    /**
     * Example:
     * GET /api/sweeping/resolve?lat=37.7755&lon=-122.4193
     */
    @Operation(
            summary = "Resolve the cleaning restriction at a point",
            description = "Finds the closest street segment within 50 ft, the side of the street the point is on, " +
                    "and the applicable rule's upcoming cleanings."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Resolution result",
                    content = @Content(
                            mediaType = "application/json",
                            examples = {
                                    @ExampleObject(
                                            name = "No restriction",
                                            value = "{\"status\":\"NO_RESTRICTION\",\"dataAvailable\":true,\"location\":{\"latitude\":37.78,\"longitude\":-122.415}}"
                                    )
                            }
                    )
            )
    })
    @GetMapping("/resolve")
    public ResponseEntity<Map<String, Object>> resolve(
            @Parameter(description = "Latitude", example = "37.7755") @RequestParam double lat,
            @Parameter(description = "Longitude", example = "-122.4193") @RequestParam double lon,
            @Parameter(description = "Reference time, defaults to now")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime at) {
        GeoPoint point = RequestPoints.of(lat, lon);
        ResolutionResult result = at != null
                ? resolutionService.resolve(point, at.toZonedDateTime())
                : resolutionService.resolve(point);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.status().name());
        body.put("dataAvailable", result.dataAvailable());
        body.put("location", Map.of("latitude", lat, "longitude", lon));
        if (result.match() != null) {
            body.put("rule", result.match().rule());
            body.put("side", result.match().side().displayName());
            body.put("distanceMeters", result.match().distanceMeters());
            body.put("nextOccurrence", result.nextOccurrence());
            body.put("upcoming", result.upcoming());
        }
        return ResponseEntity.ok(body);
    }

    @Operation(
            summary = "List rules near a point",
            description = "Every rule within the nearby radius, nearest first, with the side of the street " +
                    "and whether the rule covers that side."
    )
    @GetMapping("/nearby")
    public ResponseEntity<Map<String, Object>> nearby(
            @Parameter(description = "Latitude", example = "37.7755") @RequestParam double lat,
            @Parameter(description = "Longitude", example = "-122.4193") @RequestParam double lon,
            @Parameter(description = "Grid radius in cells (~100 m each)", example = "10")
            @RequestParam(required = false) Integer radiusCells) {
        if (radiusCells != null && (radiusCells < 0 || radiusCells > 50)) {
            throw new IllegalArgumentException("radiusCells must be between 0 and 50");
        }
        List<NearbyRule> rules = resolutionService.nearby(RequestPoints.of(lat, lon), radiusCells);
        return ResponseEntity.ok(Map.of(
                "count", rules.size(),
                "rules", rules
        ));
    }

    @Operation(
            summary = "Upcoming occurrences of a rule",
            description = "Occurrences strictly after the reference time, within the given number of months."
    )
    @GetMapping("/rules/{id}/occurrences")
    public ResponseEntity<?> occurrences(
            @PathVariable String id,
            @Parameter(description = "Reference time, defaults to now")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime after,
            @Parameter(description = "Horizon in months", example = "3") @RequestParam(required = false) Integer months,
            @Parameter(description = "Maximum results", example = "10") @RequestParam(required = false) Integer limit) {
        if (months != null && (months < 1 || months > MAX_MONTHS)) {
            throw new IllegalArgumentException("months must be between 1 and " + MAX_MONTHS);
        }
        if (limit != null && (limit < 1 || limit > MAX_OCCURRENCES)) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_OCCURRENCES);
        }
        ZonedDateTime reference = after != null ? after.toZonedDateTime() : null;
        Optional<List<Occurrence>> occurrences = resolutionService.occurrences(id, reference, months, limit);
        if (occurrences.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "status", "NOT_FOUND",
                    "message", "Unknown rule: " + id
            ));
        }
        return ResponseEntity.ok(Map.of(
                "ruleId", id,
                "count", occurrences.get().size(),
                "occurrences", occurrences.get()
        ));
    }

    @Operation(summary = "Schedule catalog statistics")
    @GetMapping("/catalog/stats")
    public ResponseEntity<CatalogStats> catalogStats() {
        return ResponseEntity.ok(catalogService.current().stats());
    }

    @Operation(
            summary = "Reload the schedule table",
            description = "Parses and indexes the configured table in the background; responds when the new catalog is live."
    )
    @PostMapping("/catalog/reload")
    public CompletableFuture<ResponseEntity<CatalogStats>> reloadCatalog() {
        log.info("Schedule catalog reload requested");
        return catalogService.reload().thenApply(catalog -> ResponseEntity.ok(catalog.stats()));
    }

    @Operation(summary = "Health check")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        CatalogStats stats = catalogService.current().stats();
        return ResponseEntity.ok(Map.of(
                "status", stats.loaded() ? "UP" : "LOADING",
                "rules", stats.ruleCount(),
                "timestamp", Instant.now().toString()
        ));
    }
}
