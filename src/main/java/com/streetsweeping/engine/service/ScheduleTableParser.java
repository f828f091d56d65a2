package com.streetsweeping.engine.service;

import com.streetsweeping.engine.dto.CitationStats;
import com.streetsweeping.engine.dto.ScheduleRule;
import com.streetsweeping.engine.dto.SweepDay;
import com.streetsweeping.engine.dto.WeekOfMonthMask;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.LineString;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the street sweeping schedule table into {@link ScheduleRule}s.
 *
 * Columns are located by header name, case-insensitively and ignoring punctuation, so
 * {@code BlockSweepID}, {@code block_sweep_id} and {@code blocksweepid} are the same
 * column. A table without a corridor, weekday or geometry column is unusable as a whole.
 *
 * Per-row leniency:
 * - hour and citation numbers that do not parse become 0
 * - missing or unparseable week flags are inactive
 * - rows with an unknown weekday or a bad geometry are dropped and counted
 */
@Slf4j
public class ScheduleTableParser {

    /** Parse failures logged at WARN before switching to DEBUG. */
    private static final int WARN_LIMIT = 5;

    private static final Map<String, String> HEADER_ALIASES = Map.ofEntries(
        Map.entry("id", "id"),
        Map.entry("blocksweepid", "id"),
        Map.entry("cleanid", "id"),
        Map.entry("cnn", "cnn"),
        Map.entry("corridor", "corridor"),
        Map.entry("limits", "limits"),
        Map.entry("blockside", "blockside"),
        Map.entry("weekday", "weekday"),
        Map.entry("fromhour", "fromhour"),
        Map.entry("tohour", "tohour"),
        Map.entry("week1", "week1"),
        Map.entry("week2", "week2"),
        Map.entry("week3", "week3"),
        Map.entry("week4", "week4"),
        Map.entry("week5", "week5"),
        Map.entry("holidays", "holidays"),
        Map.entry("citationcount", "citationcount"),
        Map.entry("avgcitationtime", "avgcitationtime"),
        Map.entry("mincitationtime", "mincitationtime"),
        Map.entry("maxcitationtime", "maxcitationtime"),
        Map.entry("line", "geometry"),
        Map.entry("geometry", "geometry"),
        Map.entry("thegeom", "geometry")
    );

    private static final List<String> REQUIRED = List.of("corridor", "weekday", "geometry");

    private final DelimitedRecordReader recordReader;
    private final GeometryParser geometryParser;

    public ScheduleTableParser(char delimiter, GeometryParser geometryParser) {
        this.recordReader = new DelimitedRecordReader(delimiter);
        this.geometryParser = geometryParser;
    }

    /**
     * Outcome of parsing a table.
     *
     * @param usable   false when a required column is missing
     * @param rules    rules in table order
     * @param rowsRead data rows seen, header excluded
     * @param rejected rows dropped for a bad weekday or geometry
     */
    public record ParseResult(boolean usable, List<ScheduleRule> rules, int rowsRead, int rejected) {

        static ParseResult unusable(int rowsRead) {
            return new ParseResult(false, List.of(), rowsRead, 0);
        }
    }

    public ParseResult parse(Reader reader) throws IOException {
        List<List<String>> records = recordReader.readAll(reader);
        if (records.isEmpty()) {
            log.warn("Schedule table is empty");
            return ParseResult.unusable(0);
        }

        Map<String, Integer> columns = mapHeader(records.get(0));
        List<String> missing = REQUIRED.stream().filter(c -> !columns.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            log.warn("Schedule table is missing required columns {}; header was {}", missing, records.get(0));
            return ParseResult.unusable(records.size() - 1);
        }

        List<ScheduleRule> rules = new ArrayList<>(records.size());
        int rejected = 0;
        for (int i = 1; i < records.size(); i++) {
            Row row = new Row(records.get(i), columns);
            try {
                rules.add(toRule(row, i));
            } catch (GeometryParseException | IllegalArgumentException e) {
                rejected++;
                if (rejected <= WARN_LIMIT) {
                    log.warn("Skipping schedule row {}: {}", i, e.getMessage());
                } else {
                    log.debug("Skipping schedule row {}: {}", i, e.getMessage());
                }
            }
        }
        return new ParseResult(true, List.copyOf(rules), records.size() - 1, rejected);
    }

    private ScheduleRule toRule(Row row, int rowNumber) throws GeometryParseException {
        String rawWeekday = row.get("weekday");
        SweepDay weekday = SweepDay.parse(rawWeekday)
            .orElseThrow(() -> new IllegalArgumentException("Unknown weekday '" + rawWeekday + "'"));

        LineString geometry = geometryParser.parse(row.get("geometry"));

        String id = row.get("id");
        if (id.isEmpty()) {
            id = "row-" + rowNumber;
        }

        WeekOfMonthMask weeks = new WeekOfMonthMask(
            flag(row.get("week1")),
            flag(row.get("week2")),
            flag(row.get("week3")),
            flag(row.get("week4")),
            flag(row.get("week5")));

        CitationStats citations = null;
        if (row.has("citationcount")) {
            citations = new CitationStats(
                (int) number(row.get("citationcount")),
                optionalNumber(row.get("avgcitationtime")).orElse(null),
                optionalNumber(row.get("mincitationtime")).orElse(null),
                optionalNumber(row.get("maxcitationtime")).orElse(null));
        }

        String cnn = row.get("cnn");
        return new ScheduleRule(
            id,
            cnn.isEmpty() ? null : cnn,
            row.get("corridor"),
            row.get("limits"),
            row.get("blockside"),
            weekday,
            hour(row.get("fromhour")),
            hour(row.get("tohour")),
            weeks,
            flag(row.get("holidays")),
            geometry,
            citations);
    }

    private static Map<String, Integer> mapHeader(List<String> header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String canonical = HEADER_ALIASES.get(normalizeHeader(header.get(i)));
            if (canonical != null) {
                columns.putIfAbsent(canonical, i);
            }
        }
        return columns;
    }

    static String normalizeHeader(String name) {
        // Strip a UTF-8 BOM and anything that is not a letter or digit
        return name.replace("\uFEFF", "").toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    /** Hours wrap into 0-23, so a "24" end hour means midnight. */
    private static int hour(String value) {
        return Math.floorMod((int) number(value), 24);
    }

    private static double number(String value) {
        return optionalNumber(value).orElse(0.0);
    }

    private static Optional<Double> optionalNumber(String value) {
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean flag(String value) {
        String v = value.toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("yes") || v.equals("y") || v.equals("t")) {
            return true;
        }
        return optionalNumber(v).map(n -> n != 0.0).orElse(false);
    }

    private static final class Row {
        private final List<String> values;
        private final Map<String, Integer> columns;

        Row(List<String> values, Map<String, Integer> columns) {
            this.values = values;
            this.columns = columns;
        }

        boolean has(String column) {
            return columns.containsKey(column);
        }

        /** Trimmed value, or "" when the column or cell is absent. */
        String get(String column) {
            Integer index = columns.get(column);
            if (index == null || index >= values.size()) {
                return "";
            }
            String value = values.get(index);
            return value == null ? "" : value.trim();
        }
    }
}
