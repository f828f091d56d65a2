package com.streetsweeping.engine.controller;

import com.streetsweeping.engine.dto.GeoPoint;

final class RequestPoints {

    private RequestPoints() {
    }

    static GeoPoint of(double lat, double lon) {
        if (lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            throw new IllegalArgumentException("Coordinates out of range: lat=" + lat + ", lon=" + lon);
        }
        return GeoPoint.of(lat, lon);
    }
}
