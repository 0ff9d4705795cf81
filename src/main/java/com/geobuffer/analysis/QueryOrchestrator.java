package com.geobuffer.analysis;

import com.geobuffer.geometry.GeometryUtils;
import com.geobuffer.index.SpatialIndex;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexMatch;
import com.geobuffer.model.LegResult;
import com.geobuffer.model.QuerySection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Issues one radius query per sample point of a query section, keeps the matches that
 * lie inside the corridor and merges them into a {@link LegResult}.
 *
 * <p>All sample point queries of a section are in flight together. The merge runs once,
 * after every query has completed, and walks the per-point results in sample order, so
 * the first sample point to find a key decides its location.
 */
public class QueryOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(QueryOrchestrator.class);

    private static final double METERS_PER_KILOMETER = 1000.0;

    private final SpatialIndex index;

    public QueryOrchestrator(SpatialIndex index) {
        this.index = index;
    }

    /**
     * Query every sample point of {@code section} with {@code queryRadius} meters and
     * keep the matches within {@code bufferWidth} meters of the sampled line.
     */
    public CompletableFuture<LegResult> querySection(QuerySection section, double queryRadius, double bufferWidth) {
        List<GeoPoint> samples = section.getSamplePoints();
        double radiusKm = queryRadius / METERS_PER_KILOMETER;

        List<CompletableFuture<List<IndexMatch>>> pointQueries = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            GeoPoint prev = i == 0 ? null : samples.get(i - 1);
            GeoPoint current = samples.get(i);
            GeoPoint next = i + 1 == samples.size() ? null : samples.get(i + 1);
            pointQueries.add(queryPoint(prev, current, next, radiusKm, bufferWidth));
        }

        return CompletableFuture.allOf(pointQueries.toArray(new CompletableFuture[0]))
                                .thenApply(ignored -> merge(section, pointQueries));
    }

    /**
     * One radius query around {@code current}, filtered against the segments to its
     * neighbours. Either neighbour is {@code null} at the ends of a section.
     */
    CompletableFuture<List<IndexMatch>> queryPoint(GeoPoint prev, GeoPoint current, GeoPoint next,
                                                   double radiusKm, double bufferWidth) {
        return index.query(current, radiusKm).thenApply(found -> {
            List<IndexMatch> accepted = new ArrayList<>();
            for (IndexMatch match : found) {
                double minDistance = corridorDistance(prev, current, next, match.getLocation());
                if (withinBuffer(minDistance, bufferWidth)) {
                    accepted.add(match);
                }
            }
            logger.debug("Sample point {} kept {} of {} candidates", current, accepted.size(), found.size());
            return accepted;
        });
    }

    /**
     * Distance from {@code location} to the part of the line a sample point covers: its
     * two adjacent segments for an inner point, the point itself for a section end.
     */
    static double corridorDistance(GeoPoint prev, GeoPoint current, GeoPoint next, GeoPoint location) {
        if (prev != null && next != null) {
            double d1 = GeometryUtils.closestDistanceToSegment(prev, current, location);
            double d2 = GeometryUtils.closestDistanceToSegment(current, next, location);
            return Math.min(d1, d2);
        }
        return GeometryUtils.distance(current, location);
    }

    /**
     * Whether a point {@code distance} meters from the line is inside the buffer, with
     * {@link GeometryUtils#MIN_BUFFER_WIDTH} of tolerance
     */
    static boolean withinBuffer(double distance, double bufferWidth) {
        return distance - bufferWidth < GeometryUtils.MIN_BUFFER_WIDTH;
    }

    private static LegResult merge(QuerySection section, List<CompletableFuture<List<IndexMatch>>> pointQueries) {
        Map<String, IndexMatch> matches = new LinkedHashMap<>();
        for (CompletableFuture<List<IndexMatch>> pointQuery : pointQueries) {
            for (IndexMatch match : pointQuery.join()) {
                matches.putIfAbsent(match.getKey(), match);
            }
        }
        return LegResult.builder()
                        .querySection(section)
                        .matches(matches)
                        .build();
    }
}
