package com.geobuffer.analysis;

import com.geobuffer.exception.IndexUnavailableException;
import com.geobuffer.exception.InvalidBufferWidthException;
import com.geobuffer.exception.InvalidLegException;
import com.geobuffer.geometry.GeometryUtils;
import com.geobuffer.geometry.PolylineSegmenter;
import com.geobuffer.index.SpatialIndex;
import com.geobuffer.model.AnalysisResult;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.LegResult;
import com.geobuffer.model.QuerySection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Linear buffer analysis over a spatial index that only answers circular queries.
 *
 * <p>Each leg is sampled into points spaced so that circular queries of radius
 * {@link PolylineSegmenter#stepLength(double)} overlap into a corridor of the requested
 * width; hits are then checked against the exact distance to the line. All legs are
 * processed concurrently and the result keeps the input leg order.
 *
 * <p>The analyzer holds no state besides the index, so one instance can serve any number
 * of concurrent calls. There is no cancellation; a query that never completes keeps the
 * whole call pending unless the index itself times it out.
 */
@Slf4j
public class BufferAnalyzer {

    private final QueryOrchestrator orchestrator;

    public BufferAnalyzer(SpatialIndex index) {
        if (index == null) {
            throw new IndexUnavailableException("A spatial index is required to run buffer analysis");
        }
        this.orchestrator = new QueryOrchestrator(index);
    }

    /**
     * Find every indexed point within {@code bufferWidth} meters of the given legs.
     *
     * @param legs ordered legs, each an ordered list of at least one point
     * @param bufferWidth corridor half-width in meters, at least {@link GeometryUtils#MIN_BUFFER_WIDTH}
     * @return future of one leg result per input leg, in input order
     * @throws InvalidBufferWidthException if the width is not finite or too small
     * @throws InvalidLegException if the legs are missing or a leg is empty
     */
    public CompletableFuture<AnalysisResult> analyze(List<List<GeoPoint>> legs, double bufferWidth) {
        validateBufferWidth(bufferWidth);
        validateLegs(legs);

        double stepLength = PolylineSegmenter.stepLength(bufferWidth);
        List<QuerySection> sections = PolylineSegmenter.buildQuerySections(legs, stepLength);
        log.info("Analyzing {} legs with buffer width {}m, step length {}m, {} sample points",
                 sections.size(), bufferWidth, stepLength,
                 sections.stream().mapToInt(QuerySection::size).sum());

        List<CompletableFuture<LegResult>> legQueries = new ArrayList<>(sections.size());
        for (QuerySection section : sections) {
            legQueries.add(orchestrator.querySection(section, stepLength, bufferWidth));
        }

        return CompletableFuture.allOf(legQueries.toArray(new CompletableFuture[0]))
                                .thenApply(ignored -> {
                                    List<LegResult> results = new ArrayList<>(legQueries.size());
                                    for (CompletableFuture<LegResult> legQuery : legQueries) {
                                        results.add(legQuery.join());
                                    }
                                    return new AnalysisResult(results);
                                });
    }

    static void validateBufferWidth(double bufferWidth) {
        if (Double.isNaN(bufferWidth) || Double.isInfinite(bufferWidth)) {
            throw new InvalidBufferWidthException(bufferWidth, "Invalid buffer width: " + bufferWidth);
        }
        if (bufferWidth < GeometryUtils.MIN_BUFFER_WIDTH) {
            throw new InvalidBufferWidthException(bufferWidth,
                    "Buffer width cannot be smaller than " + GeometryUtils.MIN_BUFFER_WIDTH + " meters");
        }
    }

    static void validateLegs(List<List<GeoPoint>> legs) {
        if (legs == null) {
            throw new InvalidLegException("Legs are required");
        }
        for (int i = 0; i < legs.size(); i++) {
            List<GeoPoint> leg = legs.get(i);
            if (leg == null || leg.isEmpty()) {
                throw new InvalidLegException("Leg " + i + " has no points");
            }
            for (GeoPoint point : leg) {
                if (point == null) {
                    throw new InvalidLegException("Leg " + i + " contains a null point");
                }
            }
        }
    }
}
