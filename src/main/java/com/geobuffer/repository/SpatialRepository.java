package com.geobuffer.repository;

import com.geobuffer.model.IndexedPoint;
import com.geobuffer.model.SearchResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for spatial indexing and radius queries
 */
public interface SpatialRepository {
    
    /**
     * Index a point, replacing any previous entry with the same id
     */
    void index(String key, String id, IndexedPoint object);
    
    /**
     * Bulk index multiple points for better performance
     */
    void bulkIndex(String key, Map<String, IndexedPoint> objects);
    
    /**
     * Get a point by key and id
     */
    Optional<IndexedPoint> get(String key, String id);
    
    /**
     * Get all keys (collections)
     */
    Set<String> keys();
    
    /**
     * Remove a point from the spatial index
     */
    boolean remove(String key, String id);
    
    /**
     * Drop all points of a collection
     */
    boolean drop(String key);
    
    /**
     * Search for points within {@code radius} meters of a location, nearest first
     */
    List<SearchResult> nearby(String key, double lat, double lon, double radius);
    
    /**
     * Get number of live points in a specific collection
     */
    long getObjectCount(String key);
    
    /**
     * Get total number of live points across all collections
     */
    long getTotalObjectCount();
    
    /**
     * Clear all spatial indexes
     */
    void flushAll();
}
