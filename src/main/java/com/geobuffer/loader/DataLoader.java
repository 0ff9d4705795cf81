package com.geobuffer.loader;

import java.util.concurrent.CompletableFuture;

/**
 * Interface for bulk data loading operations
 */
public interface DataLoader {
    
    /**
     * Load points from a JSON file shaped {@code {collection: [{id, lat, lon, fields?}, ...]}}
     */
    CompletableFuture<LoadResult> loadFromJson(String filePath);
    
    /**
     * Generate uniformly distributed points for performance testing
     */
    CompletableFuture<LoadResult> generateTestData(String collectionName, int numberOfRecords,
                                                   double minLat, double maxLat, double minLon, double maxLon);
    
    /**
     * Result of a data loading operation
     */
    class LoadResult {
        private final boolean success;
        private final long recordsLoaded;
        private final long durationMs;
        private final String message;
        
        public LoadResult(boolean success, long recordsLoaded, long durationMs, String message) {
            this.success = success;
            this.recordsLoaded = recordsLoaded;
            this.durationMs = durationMs;
            this.message = message;
        }
        
        public boolean isSuccess() { return success; }
        public long getRecordsLoaded() { return recordsLoaded; }
        public long getDurationMs() { return durationMs; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("LoadResult{success=%s, records=%d, duration=%dms, message='%s'}",
                               success, recordsLoaded, durationMs, message);
        }
    }
}
