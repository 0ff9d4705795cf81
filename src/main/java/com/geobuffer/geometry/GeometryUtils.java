package com.geobuffer.geometry;

import com.geobuffer.model.GeoPoint;

/**
 * Spherical geometry helpers used by buffer analysis.
 *
 * <p>All distances are great-circle distances in meters on a sphere of radius
 * {@link #EARTH_RADIUS_METERS}. The model assumes short segments and narrow buffers,
 * where curvature effects stay below {@link #MIN_BUFFER_WIDTH}.
 */
public final class GeometryUtils {

    public static final double EARTH_RADIUS_METERS = 6378137.0;

    /**
     * Smallest accepted buffer width in meters. Also the tolerance under which a
     * distance counts as zero and a point counts as inside a buffer.
     */
    public static final double MIN_BUFFER_WIDTH = 0.1;

    // Below ~0.1 degree or above ~179.9 degrees the triangle is too flat for acos.
    private static final double MIN_STABLE_ANGLE = 0.0017;
    private static final double MAX_STABLE_ANGLE = 3.14;

    // Angular separation below which interpolation degrades to a linear blend
    private static final double MIN_SLERP_SIN = 1E-6;

    private GeometryUtils() {
    }

    /**
     * Great-circle distance between two points in meters (haversine)
     */
    public static double distance(GeoPoint p1, GeoPoint p2) {
        return angleBetween(p1, p2) * EARTH_RADIUS_METERS;
    }

    /**
     * Point reached by travelling {@code byMeters} from {@code from} along the great
     * circle towards {@code towards}. The two points must be distinct.
     */
    public static GeoPoint moveTowards(GeoPoint from, GeoPoint towards, double byMeters) {
        double d = distance(from, towards);
        return interpolate(from, towards, byMeters / d);
    }

    /**
     * Point at {@code fraction} of the way from {@code from} to {@code to} on the
     * great circle through both.
     */
    public static GeoPoint interpolate(GeoPoint from, GeoPoint to, double fraction) {
        double fromLat = Math.toRadians(from.getLat());
        double fromLng = Math.toRadians(from.getLng());
        double toLat = Math.toRadians(to.getLat());
        double toLng = Math.toRadians(to.getLng());
        double cosFromLat = Math.cos(fromLat);
        double cosToLat = Math.cos(toLat);

        double angle = angleBetween(from, to);
        double sinAngle = Math.sin(angle);
        if (sinAngle < MIN_SLERP_SIN) {
            return GeoPoint.of(
                    from.getLat() + fraction * (to.getLat() - from.getLat()),
                    from.getLng() + fraction * (to.getLng() - from.getLng()));
        }

        double a = Math.sin((1 - fraction) * angle) / sinAngle;
        double b = Math.sin(fraction * angle) / sinAngle;

        double x = a * cosFromLat * Math.cos(fromLng) + b * cosToLat * Math.cos(toLng);
        double y = a * cosFromLat * Math.sin(fromLng) + b * cosToLat * Math.sin(toLng);
        double z = a * Math.sin(fromLat) + b * Math.sin(toLat);

        double lat = Math.atan2(z, Math.sqrt(x * x + y * y));
        double lng = Math.atan2(y, x);
        return GeoPoint.of(Math.toDegrees(lat), Math.toDegrees(lng));
    }

    /**
     * Shortest distance in meters from {@code point} to the segment
     * {@code [segStart, segEnd]}.
     *
     * <p>Works on the triangle formed by the segment and the point: a is the segment
     * length, b and c the distances from its start and end to the point. The law of
     * cosines gives the angle C at the segment start, and {@code sin(C) * b} is the
     * perpendicular distance when the foot of the perpendicular lies on the segment.
     * Every degenerate triangle falls back to an endpoint distance. The order of the
     * checks decides which degeneracy wins and must not change.
     */
    public static double closestDistanceToSegment(GeoPoint segStart, GeoPoint segEnd, GeoPoint point) {
        double a = distance(segStart, segEnd);
        double b = distance(segStart, point);
        double c = distance(segEnd, point);

        // Segment too short to have a direction
        if (a < MIN_BUFFER_WIDTH) {
            return Math.min(b, c);
        }
        if (b < MIN_BUFFER_WIDTH) {
            return b;
        }
        if (c < MIN_BUFFER_WIDTH) {
            return c;
        }

        // Obtuse angle at the segment end: the point lies beyond it
        double cosB = (a * a + c * c - b * b) / (2 * a * c);
        if (cosB <= 0) {
            return c;
        }

        // Obtuse angle at the segment start: the point lies before it
        double cosC = (a * a + b * b - c * c) / (2 * a * b);
        if (cosC <= 0) {
            return b;
        }

        // Collinear
        if (cosC <= -1 || cosC >= 1) {
            return Math.min(b, c);
        }

        double angleC = Math.acos(cosC);
        if (angleC < MIN_STABLE_ANGLE || angleC > MAX_STABLE_ANGLE) {
            return Math.min(b, c);
        }

        return Math.sin(angleC) * b;
    }

    /**
     * Central angle between two points in radians
     */
    static double angleBetween(GeoPoint p1, GeoPoint p2) {
        double lat1 = Math.toRadians(p1.getLat());
        double lat2 = Math.toRadians(p2.getLat());
        double lng1 = Math.toRadians(p1.getLng());
        double lng2 = Math.toRadians(p2.getLng());
        double dlat = Math.sin(0.5 * (lat2 - lat1));
        double dlng = Math.sin(0.5 * (lng2 - lng1));
        double x = dlat * dlat + dlng * dlng * Math.cos(lat1) * Math.cos(lat2);
        return 2 * Math.asin(Math.sqrt(Math.min(1.0, x)));
    }
}
