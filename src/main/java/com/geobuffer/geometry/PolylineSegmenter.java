package com.geobuffer.geometry;

import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.QuerySection;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns legs into the sample points at which circular queries are issued.
 */
public final class PolylineSegmenter {

    private static final double SIXTY_DEGREES_IN_RADIANS = Math.PI / 3;

    private PolylineSegmenter() {
    }

    /**
     * Spacing, and query radius, of circular buffers along a line.
     *
     * <p>Two circles of this radius placed this far apart intersect at exactly
     * {@code bufferWidth} from the line joining their centers, so a chain of them
     * covers the whole corridor.
     */
    public static double stepLength(double bufferWidth) {
        return bufferWidth / Math.sin(SIXTY_DEGREES_IN_RADIANS);
    }

    /**
     * Sample one leg. Zero-length segments are skipped; the leg's last point is
     * always the last sample.
     */
    public static QuerySection buildQuerySection(List<GeoPoint> leg, double stepLength) {
        GeoPoint startPoint = leg.get(0);
        GeoPoint endPoint = leg.get(0);
        double totalDistance = 0;
        List<GeoPoint> samplePoints = new ArrayList<>();

        for (int i = 1; i < leg.size(); i++) {
            endPoint = leg.get(i);
            double distance = GeometryUtils.distance(startPoint, endPoint);
            if (distance == 0) {
                continue;
            }
            long stepCount = (long) Math.floor(distance / stepLength);
            totalDistance += distance;

            samplePoints.add(startPoint);
            GeoPoint current = startPoint;
            for (long k = 0; k < stepCount; k++) {
                current = GeometryUtils.moveTowards(current, endPoint, stepLength);
                samplePoints.add(current);
            }

            // endPoint opens the next segment, so it is added there or after the loop
            startPoint = endPoint;
        }
        samplePoints.add(endPoint);

        return QuerySection.builder()
                           .start(leg.get(0))
                           .end(endPoint)
                           .distance(totalDistance)
                           .samplePoints(samplePoints)
                           .build();
    }

    /**
     * Sample each leg, preserving order
     */
    public static List<QuerySection> buildQuerySections(List<List<GeoPoint>> legs, double stepLength) {
        List<QuerySection> sections = new ArrayList<>(legs.size());
        for (List<GeoPoint> leg : legs) {
            sections.add(buildQuerySection(leg, stepLength));
        }
        return sections;
    }
}
