package com.streetsweeping.engine.controller;

import com.streetsweeping.engine.dto.ActiveRequest;
import com.streetsweeping.engine.dto.AddPreferenceResult;
import com.streetsweeping.engine.dto.LocationReminders;
import com.streetsweeping.engine.dto.ParkedLocation;
import com.streetsweeping.engine.dto.PreferenceChange;
import com.streetsweeping.engine.dto.PreferenceRequest;
import com.streetsweeping.engine.dto.PresetReminder;
import com.streetsweeping.engine.dto.ReconcileReport;
import com.streetsweeping.engine.dto.ReminderPreference;
import com.streetsweeping.engine.dto.ScheduleOutcome;
import com.streetsweeping.engine.service.ReminderPreferenceService;
import com.streetsweeping.engine.service.ReminderScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * REST Controller for reminder preferences and location scheduling.
 *
 * Preference responses:
 * - 201 when added, 200 when updated
 * - 409 when an existing preference fires at the same time (retry with ?force=true)
 * - 422 when the preference list is full
 */
@RestController
@RequestMapping("/api/reminders")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reminders", description = "Reminder preferences and scheduling API")
public class ReminderController {

    private final ReminderPreferenceService preferenceService;
    private final ReminderScheduler reminderScheduler;

    @Operation(summary = "List reminder preferences")
    @GetMapping("/preferences")
    public ResponseEntity<Map<String, Object>> listPreferences() {
        List<ReminderPreference> preferences = preferenceService.list();
        return ResponseEntity.ok(Map.of(
                "count", preferences.size(),
                "max", preferenceService.maxPreferences(),
                "preferences", preferences
        ));
    }

    /**
     * Example request:
     * POST /api/reminders/preferences
     * {
     *   "title": "Two hours before",
     *   "timing": {"kind": "custom", "amount": 2, "unit": "HOURS", "anchor": "BEFORE_CLEANING"}
     * }
     */
    @Operation(
            summary = "Add a reminder preference",
            description = "Rejects a preference that fires at the same time as an existing one unless force=true. " +
                    "The preference count is capped."
    )
    @PostMapping("/preferences")
    public ResponseEntity<Map<String, Object>> addPreference(
            @Valid @RequestBody PreferenceRequest request,
            @Parameter(description = "Add even if an existing preference has the same timing")
            @RequestParam(defaultValue = "false") boolean force) {
        PreferenceChange change = preferenceService.add(request.title(), request.message(), request.timing(), force);
        return toResponse(change);
    }

    @Operation(summary = "Update a reminder preference")
    @PutMapping("/preferences/{id}")
    public ResponseEntity<Map<String, Object>> updatePreference(
            @PathVariable String id,
            @Valid @RequestBody PreferenceRequest request,
            @RequestParam(defaultValue = "false") boolean force) {
        Optional<PreferenceChange> change =
                preferenceService.update(id, request.title(), request.message(), request.timing(), force);
        return change.map(this::toResponse).orElseGet(() -> notFound("Unknown preference: " + id));
    }

    @Operation(
            summary = "Enable or disable a reminder preference",
            description = "Disabling cancels the preference's scheduled reminders; enabling schedules them again."
    )
    @PutMapping("/preferences/{id}/active")
    public ResponseEntity<?> setActive(@PathVariable String id, @Valid @RequestBody ActiveRequest request) {
        Optional<ReminderPreference> updated = preferenceService.setActive(id, request.active());
        if (updated.isEmpty()) {
            return notFound("Unknown preference: " + id);
        }
        return ResponseEntity.ok(updated.get());
    }

    @Operation(summary = "Remove a reminder preference", description = "Also cancels its scheduled reminders.")
    @DeleteMapping("/preferences/{id}")
    public ResponseEntity<?> removePreference(@PathVariable String id) {
        if (!preferenceService.remove(id)) {
            return notFound("Unknown preference: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List built-in reminder presets")
    @GetMapping("/presets")
    public ResponseEntity<List<Map<String, Object>>> presets() {
        List<Map<String, Object>> presets = Arrays.stream(PresetReminder.values())
                .map(preset -> Map.<String, Object>of(
                        "preset", preset.name(),
                        "displayText", preset.displayText(),
                        "defaultMessage", preset.defaultMessage(),
                        "timing", preset.timing()
                ))
                .toList();
        return ResponseEntity.ok(presets);
    }

    /**
     * Example request:
     * POST /api/reminders/locations
     * {"id": "car-1", "latitude": 37.7755, "longitude": -122.4193, "label": "Home"}
     */
    @Operation(
            summary = "Schedule reminders for a location",
            description = "Resolves the location, replaces its previous reminders with reminders for the next " +
                    "cleaning and hands them to the delivery channel."
    )
    @PostMapping("/locations")
    public CompletableFuture<ResponseEntity<ScheduleOutcome>> scheduleLocation(@Valid @RequestBody ParkedLocation location) {
        log.info("Scheduling reminders for {}", location.toLogString());
        return reminderScheduler.schedule(location).thenApply(ResponseEntity::ok);
    }

    @Operation(summary = "Reminders scheduled for a location")
    @GetMapping("/locations/{id}")
    public ResponseEntity<?> getLocation(@PathVariable String id) {
        Optional<LocationReminders> location = reminderScheduler.findLocation(id);
        if (location.isEmpty()) {
            return notFound("Location not tracked: " + id);
        }
        return ResponseEntity.ok(location.get());
    }

    @Operation(summary = "Stop tracking a location and cancel its reminders")
    @DeleteMapping("/locations/{id}")
    public ResponseEntity<?> cancelLocation(@PathVariable String id) {
        if (!reminderScheduler.cancelLocation(id)) {
            return notFound("Location not tracked: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(
            summary = "Reconcile persisted reminders with the delivery channel",
            description = "Drops expired reminders and resubmits persisted ones the channel lost."
    )
    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileReport> reconcile() {
        return ResponseEntity.ok(reminderScheduler.reconcile());
    }

    private ResponseEntity<Map<String, Object>> toResponse(PreferenceChange change) {
        AddPreferenceResult result = change.result();
        return switch (result) {
            case ADDED -> ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                    "status", result.name(),
                    "preference", change.preference()
            ));
            case UPDATED -> ResponseEntity.ok(Map.of(
                    "status", result.name(),
                    "preference", change.preference()
            ));
            case DUPLICATE -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "status", result.name(),
                    "message", "A preference with the same timing already exists",
                    "existing", change.preference()
            ));
            case LIMIT_REACHED -> ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                    "status", result.name(),
                    "message", "At most " + preferenceService.maxPreferences() + " reminder preferences are allowed"
            ));
        };
    }

    private static ResponseEntity<Map<String, Object>> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "status", "NOT_FOUND",
                "message", message
        ));
    }
}
