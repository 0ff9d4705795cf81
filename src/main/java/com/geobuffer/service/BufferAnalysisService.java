package com.geobuffer.service;

import com.geobuffer.index.SpatialIndex;
import com.geobuffer.model.AnalysisResult;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexedPoint;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Point storage and buffer analysis per collection
 */
public interface BufferAnalysisService {
    
    /**
     * Store a point
     */
    void set(String key, String id, IndexedPoint point);
    
    /**
     * Store many points in one pass
     */
    void bulkSet(String key, Map<String, IndexedPoint> points);
    
    /**
     * Get a point by key and id
     */
    Optional<IndexedPoint> get(String key, String id);
    
    /**
     * Delete a point
     */
    boolean del(String key, String id);
    
    /**
     * Drop an entire collection
     */
    boolean drop(String key);
    
    /**
     * Get all keys (collections)
     */
    List<String> keys();
    
    /**
     * Number of live points in a collection
     */
    long count(String key);
    
    /**
     * Flush all data
     */
    void flushdb();
    
    /**
     * Find every point of collection {@code key} within {@code bufferWidth} meters of the legs
     */
    CompletableFuture<AnalysisResult> analyze(String key, List<List<GeoPoint>> legs, double bufferWidth);
    
    /**
     * Radius query handle over one collection
     */
    SpatialIndex indexFor(String key);
}
