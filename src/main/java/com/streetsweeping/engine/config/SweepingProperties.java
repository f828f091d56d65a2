package com.streetsweeping.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Engine settings bound from the {@code sweeping.*} namespace of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "sweeping")
public class SweepingProperties {

    /** Time zone every rule's hours are interpreted in. */
    private ZoneId zone = ZoneId.of("America/Los_Angeles");

    private Source data = new Source();
    private Grid grid = new Grid();
    private Resolver resolver = new Resolver();
    private Recurrence recurrence = new Recurrence();
    private Reminders reminders = new Reminders();
    private Store store = new Store();

    @Data
    public static class Source {
        /** Spring resource location of the schedule table. */
        private String location = "classpath:data/street_sweeping_schedule.csv";
        private char delimiter = ',';
        /** Load the table on startup. */
        private boolean loadOnStartup = true;
    }

    @Data
    public static class Grid {
        /** Cell edge in degrees; 0.001 is roughly 100 m in San Francisco. */
        private double cellSizeDegrees = 0.001;
        private int resolveRadiusCells = 2;
        private int nearbyRadiusCells = 10;
    }

    @Data
    public static class Resolver {
        /** 50 ft. */
        private double maxMatchRadiusMeters = 15.24;
        private double nearbyRadiusMeters = 500.0;
    }

    @Data
    public static class Recurrence {
        private int horizonMonths = 3;
        private int maxResults = 10;
    }

    @Data
    public static class Reminders {
        private int maxPreferences = 25;
        /** Cleaning windows are assumed to last this long when anchoring "after" reminders. */
        private Duration assumedCleaningDuration = Duration.ofHours(2);
        private Duration submitRetryBackoff = Duration.ofSeconds(1);
        /** Seed the default preferences when none are stored. */
        private boolean seedDefaults = true;
        private String destination = "/topic/reminders";
    }

    @Data
    public static class Store {
        /** {@code redis} or {@code memory}. */
        private String type = "redis";
        private String keyPrefix = "sweeping:";
    }
}
