package com.geobuffer.service.impl;

import com.geobuffer.config.GeoBufferProperties;
import com.geobuffer.exception.InvalidBufferWidthException;
import com.geobuffer.model.AnalysisResult;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexedPoint;
import com.geobuffer.repository.impl.SpatialRepositoryImpl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BufferAnalysisServiceImplTest {
    
    private static final String KEY = "stations";
    
    private SimpleMeterRegistry meterRegistry;
    private BufferAnalysisServiceImpl service;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new BufferAnalysisServiceImpl(new SpatialRepositoryImpl(), Runnable::run,
                                                new GeoBufferProperties(), meterRegistry);
    }
    
    private static IndexedPoint point(String id, double lat, double lng) {
        return IndexedPoint.builder()
                           .id(id)
                           .location(GeoPoint.of(lat, lng))
                           .timestamp(System.currentTimeMillis())
                           .build();
    }
    
    @Test
    void testPointLifecycle() {
        service.set(KEY, "a", point("a", 0, 0));
        service.bulkSet("another", Map.of("b", point("b", 1, 1), "c", point("c", 1, 1.001)));
        
        assertTrue(service.get(KEY, "a").isPresent());
        assertEquals(List.of("another", KEY), service.keys());
        assertEquals(2, service.count("another"));
        
        assertTrue(service.del(KEY, "a"));
        assertFalse(service.del(KEY, "a"));
        assertTrue(service.drop("another"));
        
        service.flushdb();
        assertTrue(service.keys().isEmpty());
    }
    
    @Test
    void testAnalyzeFindsPointsAlongLeg() throws Exception {
        // Given
        service.set(KEY, "onLine", point("onLine", 0.0002, 0.005));
        service.set(KEY, "offLine", point("offLine", 0.002, 0.005));
        
        // When
        AnalysisResult result = service.analyze(KEY, List.of(List.of(GeoPoint.of(0, 0), GeoPoint.of(0, 0.01))), 50)
                                       .get(5, TimeUnit.SECONDS);
        
        // Then
        assertEquals(1, result.size());
        assertTrue(result.getLeg(0).contains("onLine"));
        assertFalse(result.getLeg(0).contains("offLine"));
        assertEquals(1.0, meterRegistry.get("geobuffer.analysis.requests").counter().count());
        assertEquals(1.0, meterRegistry.get("geobuffer.analysis.matches").counter().count());
        assertEquals(1L, meterRegistry.get("geobuffer.analysis.duration").timer().count());
    }
    
    @Test
    void testAnalyzeOnUnknownCollectionIsEmpty() throws Exception {
        AnalysisResult result = service.analyze("nothing", List.of(List.of(GeoPoint.of(0, 0))), 10)
                                       .get(5, TimeUnit.SECONDS);
        
        assertEquals(1, result.size());
        assertTrue(result.getLeg(0).getMatches().isEmpty());
    }
    
    @Test
    void testInvalidWidthIsThrownBeforeAnyQuery() {
        assertThrows(InvalidBufferWidthException.class,
                () -> service.analyze(KEY, List.of(List.of(GeoPoint.of(0, 0))), 0.01));
        assertEquals(0.0, meterRegistry.get("geobuffer.analysis.requests").counter().count());
    }
    
    @Test
    void testFailedAnalysisIsCounted() {
        // Given
        BufferAnalysisServiceImpl failing = new BufferAnalysisServiceImpl(new SpatialRepositoryImpl(),
                task -> { throw new IllegalStateException("executor closed"); },
                new GeoBufferProperties(), meterRegistry);
        
        // When
        CompletableFuture<AnalysisResult> future =
                failing.analyze(KEY, List.of(List.of(GeoPoint.of(0, 0), GeoPoint.of(0, 0.001))), 50);
        
        // Then
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals("executor closed", error.getCause().getMessage());
        assertEquals(1.0, meterRegistry.get("geobuffer.analysis.failures").counter().count());
    }
}
