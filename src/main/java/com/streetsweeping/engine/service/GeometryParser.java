package com.streetsweeping.engine.service;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses street centerline geometries from the schedule table.
 *
 * Two encodings are accepted:
 * <ul>
 *   <li>a serialized GeoJSON-like mapping, {@code {'type': 'LineString', 'coordinates': [[lon, lat], ...]}},
 *       with single or double quotes</li>
 *   <li>WKT, {@code LINESTRING (lon lat, lon lat, ...)}</li>
 * </ul>
 *
 * Coordinates are longitude first. Consecutive repeated vertices are collapsed; a line
 * that has fewer than two distinct vertices afterwards is rejected.
 *
 * Thread-safe: {@link WKTReader} is created per call.
 */
public class GeometryParser {

    /** WGS84. */
    public static final int SRID = 4326;

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), SRID);

    public LineString parse(String text) throws GeometryParseException {
        if (text == null || text.isBlank()) {
            throw new GeometryParseException("Empty geometry");
        }
        String trimmed = text.trim();
        List<Coordinate> coordinates;
        if (trimmed.regionMatches(true, 0, "LINESTRING", 0, "LINESTRING".length())) {
            coordinates = parseWkt(trimmed);
        } else {
            coordinates = parseCoordinateArray(trimmed);
        }
        return toLineString(coordinates);
    }

    public LineString toLineString(List<Coordinate> coordinates) throws GeometryParseException {
        List<Coordinate> distinct = new ArrayList<>(coordinates.size());
        for (Coordinate c : coordinates) {
            if (!Double.isFinite(c.getX()) || !Double.isFinite(c.getY())) {
                throw new GeometryParseException("Non-finite coordinate: " + c);
            }
            if (distinct.isEmpty() || !distinct.get(distinct.size() - 1).equals2D(c)) {
                distinct.add(new Coordinate(c.getX(), c.getY()));
            }
        }
        if (distinct.size() < 2) {
            throw new GeometryParseException("Line needs at least 2 distinct points, got " + distinct.size());
        }
        return geometryFactory.createLineString(distinct.toArray(new Coordinate[0]));
    }

    private List<Coordinate> parseWkt(String text) throws GeometryParseException {
        Geometry geometry;
        try {
            geometry = new WKTReader(geometryFactory).read(text);
        } catch (ParseException e) {
            throw new GeometryParseException("Invalid WKT: " + e.getMessage(), e);
        }
        return List.of(geometry.getCoordinates());
    }

    /**
     * Finds the {@code coordinates} key and reads the bracket-matched array after it.
     */
    private List<Coordinate> parseCoordinateArray(String text) throws GeometryParseException {
        int keyIndex = text.indexOf("coordinates");
        if (keyIndex < 0) {
            throw new GeometryParseException("No 'coordinates' key");
        }
        int open = text.indexOf('[', keyIndex);
        if (open < 0) {
            throw new GeometryParseException("No coordinate array after 'coordinates'");
        }
        int close = matchingBracket(text, open);

        List<Coordinate> coordinates = new ArrayList<>();
        int i = open + 1;
        while (i < close) {
            int pairOpen = text.indexOf('[', i);
            if (pairOpen < 0 || pairOpen > close) {
                break;
            }
            int pairClose = text.indexOf(']', pairOpen);
            if (pairClose < 0 || pairClose > close) {
                throw new GeometryParseException("Unterminated coordinate pair");
            }
            coordinates.add(parsePair(text.substring(pairOpen + 1, pairClose)));
            i = pairClose + 1;
        }
        return coordinates;
    }

    private static int matchingBracket(String text, int open) throws GeometryParseException {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '[') {
                depth++;
            } else if (ch == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new GeometryParseException("Unbalanced brackets in coordinate array");
    }

    private static Coordinate parsePair(String pair) throws GeometryParseException {
        String[] parts = pair.split(",");
        if (parts.length < 2) {
            throw new GeometryParseException("Coordinate pair needs 2 values: [" + pair + "]");
        }
        try {
            double lon = Double.parseDouble(parts[0].trim());
            double lat = Double.parseDouble(parts[1].trim());
            return new Coordinate(lon, lat);
        } catch (NumberFormatException e) {
            throw new GeometryParseException("Invalid coordinate pair: [" + pair + "]", e);
        }
    }
}
