package com.streetsweeping.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.util.ArrayList;
import java.util.List;

/**
 * One street-segment sweeping restriction, as loaded from the schedule table.
 *
 * Instances are built once at load time and never modified afterwards, so they can
 * be shared between concurrent resolution requests.
 *
 * @param id                stable identifier of the rule (block sweep id)
 * @param cnn               street centerline network number, may be null
 * @param corridorName      street name, e.g. "Market St"
 * @param limitsDescription block bounds, e.g. "Larkin St - Polk St"
 * @param blockSide         free-text side descriptor ("North", "Northeast", ...)
 * @param weekday           day the restriction applies
 * @param fromHour          start hour of the window, 0-23
 * @param toHour            end hour of the window, 0-23
 * @param weeks             which occurrences of the weekday in a month are swept
 * @param sweepsOnHolidays  whether the block is also swept on public holidays
 * @param geometry          street centerline, x = longitude, y = latitude
 * @param citationStats     optional informational citation numbers
 */
public record ScheduleRule(
    String id,
    String cnn,
    String corridorName,
    String limitsDescription,
    String blockSide,
    SweepDay weekday,
    int fromHour,
    int toHour,
    WeekOfMonthMask weeks,
    boolean sweepsOnHolidays,
    @JsonIgnore LineString geometry,
    CitationStats citationStats
) {

    /**
     * Identity of the physical block (same street, same limits), shared by all rules
     * describing different days or sides of that block.
     */
    @JsonIgnore
    public String blockKey() {
        return corridorName + "|" + limitsDescription;
    }

    @JsonIgnore
    public Coordinate[] vertices() {
        return geometry.getCoordinates();
    }

    @JsonProperty("coordinates")
    public List<double[]> coordinates() {
        List<double[]> coordinates = new ArrayList<>();
        for (Coordinate c : geometry.getCoordinates()) {
            coordinates.add(new double[]{c.getX(), c.getY()});
        }
        return coordinates;
    }

    /**
     * Human-readable window, e.g. "Mon 8:00 AM - 10:00 AM".
     */
    @JsonProperty("window")
    public String describeWindow() {
        return weekday.abbreviation() + " " + formatHour(fromHour) + " - " + formatHour(toHour);
    }

    public String toLogString() {
        return String.format("Rule[id=%s, street=%s, limits=%s, side=%s, %s]",
            id, corridorName, limitsDescription, blockSide, describeWindow());
    }

    static String formatHour(int hour) {
        String period = hour < 12 ? "AM" : "PM";
        int displayHour = hour % 12 == 0 ? 12 : hour % 12;
        return displayHour + ":00 " + period;
    }
}
