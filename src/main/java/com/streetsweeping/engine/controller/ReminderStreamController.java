package com.streetsweeping.engine.controller;

import com.streetsweeping.engine.dto.GeoPoint;
import com.streetsweeping.engine.dto.ResolutionResult;
import com.streetsweeping.engine.service.ScheduleResolutionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebSocket Controller for clients connected to the reminder stream.
 *
 * Message Flow:
 * 1. Client subscribes to /topic/reminders for due reminders
 * 2. Client may send a position to /app/resolve
 * 3. The resolution is sent back via /user/queue/resolution
 *
 * Usage:
 * - Connect to: ws://localhost:8080/ws/reminders
 * - Send to: /app/resolve, /app/ping
 * - Subscribe to: /topic/reminders, /user/queue/resolution
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ReminderStreamController {

    private final ScheduleResolutionService resolutionService;

    @MessageMapping("/resolve")
    @SendToUser("/queue/resolution")
    public Map<String, Object> resolve(@Payload GeoPoint point) {
        log.debug("Resolve request over WebSocket for {}", point.toLogString());
        ResolutionResult result = resolutionService.resolve(point);

        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("type", "RESOLUTION");
        reply.put("status", result.status().name());
        reply.put("dataAvailable", result.dataAvailable());
        if (result.match() != null) {
            reply.put("ruleId", result.match().rule().id());
            reply.put("street", result.match().rule().corridorName());
            reply.put("side", result.match().side().displayName());
            reply.put("window", result.match().rule().describeWindow());
            reply.put("nextOccurrence", result.nextOccurrence());
        }
        reply.put("timestamp", Instant.now().toString());
        return reply;
    }

    @MessageMapping("/ping")
    @SendToUser("/queue/reply")
    public Map<String, Object> handlePing(Principal principal) {
        log.debug("Ping received from {}", principal != null ? principal.getName() : "anonymous");
        return Map.of(
                "type", "PONG",
                "serverTime", Instant.now().toString(),
                "status", "OK"
        );
    }
}
