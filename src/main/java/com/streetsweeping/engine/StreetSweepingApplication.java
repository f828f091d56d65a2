package com.streetsweeping.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Street Sweeping Schedule engine.
 *
 * Flow:
 * 1. The schedule table is parsed and indexed in a spatial grid on a background thread
 * 2. A location is resolved to the closest street segment and side within 50 ft
 * 3. The matching rule's next cleaning occurrences are computed
 * 4. Active reminder preferences become concrete reminder instants
 * 5. Reminders are persisted (Redis) and handed to the delivery gateway, which
 *    publishes them over STOMP when due
 *
 * Scheduled tasks reconcile persisted reminders with the gateway, roll locations
 * over to their next occurrence and dispatch due reminders.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class StreetSweepingApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreetSweepingApplication.class, args);
    }
}
