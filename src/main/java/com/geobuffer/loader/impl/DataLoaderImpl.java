package com.geobuffer.loader.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobuffer.loader.DataLoader;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexedPoint;
import com.geobuffer.service.BufferAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * Batched bulk loading into the spatial index
 */
@Component
public class DataLoaderImpl implements DataLoader {
    
    private static final Logger logger = LoggerFactory.getLogger(DataLoaderImpl.class);
    
    // Batch size for processing - tuned for memory efficiency
    private static final int BATCH_SIZE = 10000;
    
    private final BufferAnalysisService bufferAnalysisService;
    private final ObjectMapper objectMapper;
    private final Random random = new Random();
    
    public DataLoaderImpl(BufferAnalysisService bufferAnalysisService, ObjectMapper objectMapper) {
        this.bufferAnalysisService = bufferAnalysisService;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public CompletableFuture<LoadResult> loadFromJson(String filePath) {
        return CompletableFuture.supplyAsync(() -> {
            logger.info("Starting JSON data load from: {}", filePath);
            long startTime = System.currentTimeMillis();
            
            File file = new File(filePath);
            if (!file.exists()) {
                return new LoadResult(false, 0, 0, "File not found: " + filePath);
            }
            
            JsonNode root;
            try {
                root = objectMapper.readTree(file);
            } catch (IOException e) {
                logger.error("Failed to parse JSON file {}", filePath, e);
                return new LoadResult(false, 0, System.currentTimeMillis() - startTime,
                                      "Invalid JSON: " + e.getMessage());
            }
            
            long totalRecords = 0;
            Iterator<Map.Entry<String, JsonNode>> collections = root.fields();
            while (collections.hasNext()) {
                Map.Entry<String, JsonNode> collectionEntry = collections.next();
                String collectionName = collectionEntry.getKey();
                JsonNode pointsArray = collectionEntry.getValue();
                
                if (!pointsArray.isArray()) {
                    logger.warn("Skipping collection '{}': expected an array of points", collectionName);
                    continue;
                }
                
                Map<String, IndexedPoint> batch = new HashMap<>();
                for (JsonNode pointNode : pointsArray) {
                    if (!pointNode.hasNonNull("id") || !pointNode.has("lat") || !pointNode.has("lon")) {
                        logger.warn("Skipping point without id/lat/lon in collection '{}': {}", collectionName, pointNode);
                        continue;
                    }
                    
                    String id = pointNode.get("id").asText();
                    Map<String, Object> fields = null;
                    if (pointNode.has("fields")) {
                        fields = new HashMap<>();
                        Map<String, Object> target = fields;
                        pointNode.get("fields").fields().forEachRemaining(entry ->
                            target.put(entry.getKey(), entry.getValue().asText()));
                    }
                    
                    batch.put(id, IndexedPoint.builder()
                            .id(id)
                            .location(GeoPoint.of(pointNode.get("lat").asDouble(), pointNode.get("lon").asDouble()))
                            .fields(fields)
                            .timestamp(System.currentTimeMillis())
                            .build());
                    totalRecords++;
                    
                    if (batch.size() >= BATCH_SIZE) {
                        bufferAnalysisService.bulkSet(collectionName, batch);
                        logger.info("Processed batch of {} points for collection '{}', total: {}",
                                  batch.size(), collectionName, totalRecords);
                        batch = new HashMap<>();
                    }
                }
                
                if (!batch.isEmpty()) {
                    bufferAnalysisService.bulkSet(collectionName, batch);
                }
            }
            
            long duration = System.currentTimeMillis() - startTime;
            logger.info("Completed JSON data load: {} records in {}ms", totalRecords, duration);
            return new LoadResult(true, totalRecords, duration, "Loaded " + totalRecords + " points from " + filePath);
        });
    }
    
    @Override
    public CompletableFuture<LoadResult> generateTestData(String collectionName, int numberOfRecords,
                                                          double minLat, double maxLat, double minLon, double maxLon) {
        return CompletableFuture.supplyAsync(() -> {
            logger.info("Generating {} test points for collection '{}'", numberOfRecords, collectionName);
            long startTime = System.currentTimeMillis();
            
            Map<String, IndexedPoint> batch = new HashMap<>();
            for (int i = 0; i < numberOfRecords; i++) {
                String id = collectionName + "_" + i;
                double lat = minLat + random.nextDouble() * (maxLat - minLat);
                double lon = minLon + random.nextDouble() * (maxLon - minLon);
                
                batch.put(id, IndexedPoint.builder()
                        .id(id)
                        .location(GeoPoint.of(lat, lon))
                        .timestamp(System.currentTimeMillis())
                        .build());
                
                if (batch.size() >= BATCH_SIZE) {
                    bufferAnalysisService.bulkSet(collectionName, batch);
                    batch = new HashMap<>();
                }
            }
            
            if (!batch.isEmpty()) {
                bufferAnalysisService.bulkSet(collectionName, batch);
            }
            
            // At least 1ms
            long duration = Math.max(1, System.currentTimeMillis() - startTime);
            logger.info("Generated {} test points for collection '{}' in {}ms", numberOfRecords, collectionName, duration);
            return new LoadResult(true, numberOfRecords, duration,
                                  "Generated " + numberOfRecords + " points for " + collectionName);
        });
    }
}
