package com.geobuffer.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable latitude/longitude pair in degrees.
 * Encoded on the wire as a {@code [lat, lng]} array.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GeoPoint {

    double lat;
    double lng;

    public static GeoPoint of(double lat, double lng) {
        return new GeoPoint(lat, lng);
    }

    /**
     * {@code [lat, lng]}
     */
    public double[] toArray() {
        return new double[]{lat, lng};
    }

    @Override
    public String toString() {
        return "[" + lat + ", " + lng + "]";
    }
}
