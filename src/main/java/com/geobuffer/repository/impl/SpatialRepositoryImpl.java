package com.geobuffer.repository.impl;

import com.geobuffer.geometry.GeometryUtils;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexedPoint;
import com.geobuffer.model.SearchResult;
import com.geobuffer.repository.SpatialRepository;

import org.springframework.stereotype.Repository;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.quadtree.Quadtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Implementation of SpatialRepository using a JTS Quadtree per collection.
 * Readers share a collection lock, so radius queries run in parallel with each other
 * but never with writes.
 */
@Repository
public class SpatialRepositoryImpl implements SpatialRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(SpatialRepositoryImpl.class);
    
    // Meters per degree of latitude, rounded down so envelopes err on the wide side
    private static final double METERS_PER_DEGREE = 111000.0;
    
    // Expired entries are purged every this many inserts
    private static final int EXPIRY_SWEEP_INTERVAL = 1000;
    
    private final Map<String, CollectionIndex> collections = new ConcurrentHashMap<>();
    
    @Override
    public void index(String key, String id, IndexedPoint object) {
        if (object == null || object.getLocation() == null) {
            return;
        }
        if (object.getId() == null) {
            object.setId(id);
        }
        
        CollectionIndex collection = collections.computeIfAbsent(key, k -> new CollectionIndex());
        collection.lock.writeLock().lock();
        try {
            collection.removeLocked(id);
            collection.tree.insert(object.getEnvelope(), id);
            collection.storage.put(id, object);
            
            if (++collection.insertsSinceSweep >= EXPIRY_SWEEP_INTERVAL) {
                int purged = collection.purgeExpiredLocked();
                collection.insertsSinceSweep = 0;
                if (purged > 0) {
                    logger.debug("Cleaned up {} expired points from collection '{}'", purged, key);
                }
            }
        } finally {
            collection.lock.writeLock().unlock();
        }
    }
    
    @Override
    public void bulkIndex(String key, Map<String, IndexedPoint> objects) {
        if (objects == null || objects.isEmpty()) {
            return;
        }
        
        logger.info("Starting bulk index for collection '{}' with {} points", key, objects.size());
        long startTime = System.currentTimeMillis();
        
        CollectionIndex collection = collections.computeIfAbsent(key, k -> new CollectionIndex());
        int skipped = 0;
        collection.lock.writeLock().lock();
        try {
            for (Map.Entry<String, IndexedPoint> entry : objects.entrySet()) {
                IndexedPoint object = entry.getValue();
                if (object == null || object.getLocation() == null || object.isExpired()) {
                    skipped++;
                    continue;
                }
                if (object.getId() == null) {
                    object.setId(entry.getKey());
                }
                collection.removeLocked(entry.getKey());
                collection.tree.insert(object.getEnvelope(), entry.getKey());
                collection.storage.put(entry.getKey(), object);
            }
        } finally {
            collection.lock.writeLock().unlock();
        }
        
        long endTime = System.currentTimeMillis();
        logger.info("Completed bulk index for collection '{}' in {}ms, skipped {} invalid or expired points",
                   key, (endTime - startTime), skipped);
    }
    
    @Override
    public Optional<IndexedPoint> get(String key, String id) {
        CollectionIndex collection = collections.get(key);
        if (collection == null) {
            return Optional.empty();
        }
        
        IndexedPoint object = collection.storage.get(id);
        if (object != null && object.isExpired()) {
            remove(key, id);
            return Optional.empty();
        }
        
        return Optional.ofNullable(object);
    }
    
    @Override
    public Set<String> keys() {
        return new HashSet<>(collections.keySet());
    }
    
    @Override
    public boolean remove(String key, String id) {
        CollectionIndex collection = collections.get(key);
        if (collection == null) {
            return false;
        }
        
        collection.lock.writeLock().lock();
        try {
            return collection.removeLocked(id);
        } finally {
            collection.lock.writeLock().unlock();
        }
    }
    
    @Override
    public boolean drop(String key) {
        boolean dropped = collections.remove(key) != null;
        if (dropped) {
            logger.info("Dropped collection: {}", key);
        }
        return dropped;
    }
    
    @Override
    public List<SearchResult> nearby(String key, double lat, double lon, double radius) {
        CollectionIndex collection = collections.get(key);
        if (collection == null) {
            return Collections.emptyList();
        }
        
        double latDelta = radius / METERS_PER_DEGREE;
        double lonDelta = radius / (METERS_PER_DEGREE * Math.max(Math.cos(Math.toRadians(lat)), 1E-9));
        List<Envelope> searchEnvelopes = searchEnvelopes(lon - lonDelta, lon + lonDelta, lat - latDelta, lat + latDelta);
        
        GeoPoint center = GeoPoint.of(lat, lon);
        List<SearchResult> results = new ArrayList<>();
        
        collection.lock.readLock().lock();
        try {
            Set<String> candidates = new LinkedHashSet<>();
            for (Envelope searchEnvelope : searchEnvelopes) {
                for (Object item : collection.tree.query(searchEnvelope)) {
                    candidates.add((String) item);
                }
            }
            for (String id : candidates) {
                IndexedPoint object = collection.storage.get(id);
                if (object == null || object.isExpired()) {
                    continue;
                }
                
                double distance = GeometryUtils.distance(center, object.getLocation());
                if (distance <= radius) {
                    results.add(SearchResult.builder()
                                            .id(id)
                                            .object(object)
                                            .distance(distance)
                                            .build());
                }
            }
        } finally {
            collection.lock.readLock().unlock();
        }
        
        results.sort(Comparator.comparingDouble(SearchResult::getDistance));
        return results;
    }
    
    /**
     * Search envelopes in lng/lat order; a box crossing the antimeridian is split in two
     */
    static List<Envelope> searchEnvelopes(double minLon, double maxLon, double minLat, double maxLat) {
        if (maxLon - minLon >= 360) {
            return List.of(new Envelope(-180, 180, minLat, maxLat));
        }
        if (minLon < -180) {
            return List.of(new Envelope(minLon + 360, 180, minLat, maxLat),
                           new Envelope(-180, maxLon, minLat, maxLat));
        }
        if (maxLon > 180) {
            return List.of(new Envelope(minLon, 180, minLat, maxLat),
                           new Envelope(-180, maxLon - 360, minLat, maxLat));
        }
        return List.of(new Envelope(minLon, maxLon, minLat, maxLat));
    }
    
    @Override
    public long getObjectCount(String key) {
        CollectionIndex collection = collections.get(key);
        if (collection == null) {
            return 0;
        }
        
        return collection.storage.values().stream()
                                 .mapToLong(obj -> obj.isExpired() ? 0 : 1)
                                 .sum();
    }
    
    @Override
    public long getTotalObjectCount() {
        return collections.keySet().stream()
                          .mapToLong(this::getObjectCount)
                          .sum();
    }
    
    @Override
    public void flushAll() {
        collections.clear();
        logger.info("Flushed all collections");
    }
    
    /**
     * Quadtree plus point storage of one collection, guarded by its lock
     */
    private static final class CollectionIndex {
        
        private final Quadtree tree = new Quadtree();
        private final Map<String, IndexedPoint> storage = new ConcurrentHashMap<>();
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private int insertsSinceSweep;
        
        private boolean removeLocked(String id) {
            IndexedPoint existing = storage.remove(id);
            if (existing == null) {
                return false;
            }
            tree.remove(existing.getEnvelope(), id);
            return true;
        }
        
        private int purgeExpiredLocked() {
            List<String> expiredIds = new ArrayList<>();
            for (Map.Entry<String, IndexedPoint> entry : storage.entrySet()) {
                if (entry.getValue().isExpired()) {
                    expiredIds.add(entry.getKey());
                }
            }
            expiredIds.forEach(this::removeLocked);
            return expiredIds.size();
        }
    }
}
