package com.geobuffer.analysis;

import com.geobuffer.geometry.GeometryUtils;
import com.geobuffer.index.SpatialIndex;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexMatch;
import com.geobuffer.model.LegResult;
import com.geobuffer.model.QuerySection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueryOrchestratorTest {
    
    private static final double METERS_PER_DEGREE = GeometryUtils.EARTH_RADIUS_METERS * Math.PI / 180;
    private static final double BUFFER_WIDTH = 50;
    private static final double QUERY_RADIUS = 57.735026918962575;
    
    private static final GeoPoint S0 = GeoPoint.of(0, 0);
    private static final GeoPoint S1 = GeoPoint.of(0, 0.0005);
    private static final GeoPoint S2 = GeoPoint.of(0, 0.001);
    
    @Mock
    private SpatialIndex index;
    
    private static QuerySection section() {
        return QuerySection.builder()
                .start(S0)
                .end(S2)
                .distance(GeometryUtils.distance(S0, S2))
                .samplePoints(List.of(S0, S1, S2))
                .build();
    }
    
    private static GeoPoint north(GeoPoint point, double meters) {
        return GeoPoint.of(point.getLat() + meters / METERS_PER_DEGREE, point.getLng());
    }
    
    @Test
    void testDeduplicatesKeysAndKeepsFirstSamplePointLocation() throws Exception {
        // Given
        GeoPoint foundFirst = north(S0, 10);
        GeoPoint foundLast = north(S2, 10);
        when(index.query(any(GeoPoint.class), anyDouble())).thenAnswer(invocation -> {
            GeoPoint center = invocation.getArgument(0);
            if (center.equals(S0)) {
                return CompletableFuture.completedFuture(Set.of(IndexMatch.of("shared", foundFirst)));
            }
            if (center.equals(S2)) {
                return CompletableFuture.completedFuture(Set.of(IndexMatch.of("shared", foundLast)));
            }
            return CompletableFuture.completedFuture(Set.of());
        });
        QueryOrchestrator orchestrator = new QueryOrchestrator(index);
        
        // When
        LegResult result = orchestrator.querySection(section(), QUERY_RADIUS, BUFFER_WIDTH).get(5, TimeUnit.SECONDS);
        
        // Then
        assertEquals(1, result.getMatches().size());
        assertEquals(foundFirst, result.getMatches().get("shared").getLocation());
        assertSame(section().getSamplePoints().get(0), result.getQuerySection().getSamplePoints().get(0));
    }
    
    @Test
    void testFiltersCandidatesAgainstCorridor() throws Exception {
        // Given
        IndexMatch inside = IndexMatch.of("inside", north(S1, 45));
        IndexMatch lateral = IndexMatch.of("lateral", north(S1, 55));
        IndexMatch pastEnd = IndexMatch.of("pastEnd", GeoPoint.of(0, -52 / METERS_PER_DEGREE));
        when(index.query(any(GeoPoint.class), anyDouble())).thenAnswer(invocation -> {
            GeoPoint center = invocation.getArgument(0);
            if (center.equals(S1)) {
                return CompletableFuture.completedFuture(Set.of(inside, lateral));
            }
            if (center.equals(S0)) {
                return CompletableFuture.completedFuture(Set.of(pastEnd));
            }
            return CompletableFuture.completedFuture(Set.of());
        });
        QueryOrchestrator orchestrator = new QueryOrchestrator(index);
        
        // When
        LegResult result = orchestrator.querySection(section(), QUERY_RADIUS, BUFFER_WIDTH).get(5, TimeUnit.SECONDS);
        
        // Then
        assertTrue(result.contains("inside"));
        assertFalse(result.contains("lateral"), "55m from the line is outside a 50m buffer");
        assertFalse(result.contains("pastEnd"), "52m past the end is outside a 50m buffer");
    }
    
    @Test
    void testQueriesEverySamplePointWithRadiusInKilometers() throws Exception {
        // Given
        when(index.query(any(GeoPoint.class), anyDouble()))
                .thenReturn(CompletableFuture.completedFuture(Set.of()));
        QueryOrchestrator orchestrator = new QueryOrchestrator(index);
        
        // When
        orchestrator.querySection(section(), QUERY_RADIUS, BUFFER_WIDTH).get(5, TimeUnit.SECONDS);
        
        // Then
        verify(index).query(eq(S0), eq(QUERY_RADIUS / 1000));
        verify(index).query(eq(S1), eq(QUERY_RADIUS / 1000));
        verify(index).query(eq(S2), eq(QUERY_RADIUS / 1000));
        verifyNoMoreInteractions(index);
    }
    
    @Test
    void testMergeIgnoresCompletionOrder() throws Exception {
        // Given
        List<CompletableFuture<Set<IndexMatch>>> pending = new ArrayList<>();
        when(index.query(any(GeoPoint.class), anyDouble())).thenAnswer(invocation -> {
            CompletableFuture<Set<IndexMatch>> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        });
        QueryOrchestrator orchestrator = new QueryOrchestrator(index);
        GeoPoint fromFirst = north(S0, 5);
        GeoPoint fromLast = north(S2, 5);
        
        // When
        CompletableFuture<LegResult> result = orchestrator.querySection(section(), QUERY_RADIUS, BUFFER_WIDTH);
        assertEquals(3, pending.size());
        pending.get(2).complete(Set.of(IndexMatch.of("shared", fromLast), IndexMatch.of("last", fromLast)));
        pending.get(1).complete(Set.of());
        assertFalse(result.isDone());
        pending.get(0).complete(Set.of(IndexMatch.of("shared", fromFirst)));
        
        // Then
        LegResult legResult = result.get(5, TimeUnit.SECONDS);
        assertEquals(Set.of("shared", "last"), legResult.getMatches().keySet());
        assertEquals(fromFirst, legResult.getMatches().get("shared").getLocation());
    }
    
    @Test
    void testIndexFailureFailsSection() {
        // Given
        when(index.query(any(GeoPoint.class), anyDouble())).thenAnswer(invocation -> {
            GeoPoint center = invocation.getArgument(0);
            return center.equals(S1)
                    ? CompletableFuture.failedFuture(new IllegalStateException("index offline"))
                    : CompletableFuture.completedFuture(Set.of());
        });
        QueryOrchestrator orchestrator = new QueryOrchestrator(index);
        
        // When
        CompletableFuture<LegResult> result = orchestrator.querySection(section(), QUERY_RADIUS, BUFFER_WIDTH);
        
        // Then
        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }
    
    @Test
    void testCorridorDistanceUsesBothNeighbourSegmentsForInnerPoints() {
        GeoPoint location = north(S1, 20);
        
        double inner = QueryOrchestrator.corridorDistance(S0, S1, S2, location);
        
        assertEquals(20, inner, 0.01);
    }
    
    @Test
    void testCorridorDistanceUsesPointDistanceAtSectionEnds() {
        GeoPoint location = north(GeoPoint.of(0, 0.0002), 20);
        
        assertEquals(GeometryUtils.distance(S0, location), QueryOrchestrator.corridorDistance(null, S0, S1, location));
        assertEquals(GeometryUtils.distance(S1, location), QueryOrchestrator.corridorDistance(S0, S1, null, location));
    }
    
    @Test
    void testWithinBufferTolerance() {
        assertTrue(QueryOrchestrator.withinBuffer(10, BUFFER_WIDTH));
        assertTrue(QueryOrchestrator.withinBuffer(BUFFER_WIDTH, BUFFER_WIDTH));
        assertTrue(QueryOrchestrator.withinBuffer(BUFFER_WIDTH + 0.05, BUFFER_WIDTH));
        assertFalse(QueryOrchestrator.withinBuffer(BUFFER_WIDTH + GeometryUtils.MIN_BUFFER_WIDTH, BUFFER_WIDTH));
        assertFalse(QueryOrchestrator.withinBuffer(BUFFER_WIDTH + 1, BUFFER_WIDTH));
    }
}
