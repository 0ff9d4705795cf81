package com.geobuffer.controller;

import com.geobuffer.aspect.TimingAspect;
import com.geobuffer.exception.IndexUnavailableException;
import com.geobuffer.exception.InvalidBufferWidthException;
import com.geobuffer.exception.InvalidLegException;
import com.geobuffer.loader.DataLoader;
import com.geobuffer.model.AnalysisResult;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexedPoint;
import com.geobuffer.model.param.BufferAnalysisParam;
import com.geobuffer.model.param.SetPointParam;
import com.geobuffer.model.result.ApiResponse;
import com.geobuffer.model.result.CollectionResult;
import com.geobuffer.model.result.PointResult;
import com.geobuffer.service.BufferAnalysisService;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP REST API for point storage and buffer analysis
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class BufferAnalysisController {
    
    private final BufferAnalysisService bufferAnalysisService;
    
    private final DataLoader dataLoader;
    
    public BufferAnalysisController(BufferAnalysisService bufferAnalysisService, DataLoader dataLoader) {
        this.bufferAnalysisService = bufferAnalysisService;
        this.dataLoader = dataLoader;
    }
    
    /**
     * POST /api/v1/keys/{key}/points/{id} - index a point
     */
    @PostMapping("/keys/{key}/points/{id}")
    public ResponseEntity<ApiResponse<PointResult>> setPoint(
            @PathVariable String key,
            @PathVariable String id,
            @RequestBody SetPointParam param) {
        
        if (param == null || !param.hasValidLocation()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Valid lat and lon are required"));
        }
        
        IndexedPoint point = IndexedPoint.builder()
                .id(id)
                .location(GeoPoint.of(param.getLat(), param.getLon()))
                .fields(param.getFields())
                .timestamp(System.currentTimeMillis())
                .build();
        if (param.getEx() != null) {
            point.setExpirationSeconds(param.getEx());
        }
        
        bufferAnalysisService.set(key, id, point);
        
        return ResponseEntity.ok(ApiResponse.success(PointResult.builder().build(),
                                                     TimingAspect.getAndClearExecutionTime()));
    }
    
    /**
     * GET /api/v1/keys/{key}/points/{id}
     */
    @GetMapping("/keys/{key}/points/{id}")
    public ResponseEntity<ApiResponse<PointResult>> getPoint(@PathVariable String key, @PathVariable String id) {
        long startTime = System.currentTimeMillis();
        Optional<IndexedPoint> point = bufferAnalysisService.get(key, id);
        
        if (point.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Point not found"));
        }
        
        PointResult result = PointResult.builder()
                .point(point.get())
                .found(true)
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, elapsedSince(startTime)));
    }
    
    /**
     * DELETE /api/v1/keys/{key}/points/{id}
     */
    @DeleteMapping("/keys/{key}/points/{id}")
    public ResponseEntity<ApiResponse<PointResult>> deletePoint(@PathVariable String key, @PathVariable String id) {
        long startTime = System.currentTimeMillis();
        boolean deleted = bufferAnalysisService.del(key, id);
        
        PointResult result = PointResult.builder()
                .deleted(deleted ? 1 : 0)
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, elapsedSince(startTime)));
    }
    
    /**
     * DELETE /api/v1/keys/{key} - drop a collection
     */
    @DeleteMapping("/keys/{key}")
    public ResponseEntity<ApiResponse<CollectionResult>> dropCollection(@PathVariable String key) {
        long startTime = System.currentTimeMillis();
        boolean dropped = bufferAnalysisService.drop(key);
        
        return ResponseEntity.ok(ApiResponse.success(CollectionResult.builder().dropped(dropped).build(),
                                                     elapsedSince(startTime)));
    }
    
    /**
     * GET /api/v1/keys
     */
    @GetMapping("/keys")
    public ResponseEntity<ApiResponse<CollectionResult>> getKeys() {
        long startTime = System.currentTimeMillis();
        CollectionResult result = CollectionResult.builder()
                .keys(bufferAnalysisService.keys())
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, elapsedSince(startTime)));
    }
    
    /**
     * GET /api/v1/keys/{key} - collection size
     */
    @GetMapping("/keys/{key}")
    public ResponseEntity<ApiResponse<CollectionResult>> getCollection(@PathVariable String key) {
        long startTime = System.currentTimeMillis();
        CollectionResult result = CollectionResult.builder()
                .count(bufferAnalysisService.count(key))
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, elapsedSince(startTime)));
    }
    
    /**
     * POST /api/v1/flushdb
     */
    @PostMapping("/flushdb")
    public ResponseEntity<ApiResponse<Void>> flushdb() {
        long startTime = System.currentTimeMillis();
        bufferAnalysisService.flushdb();
        return ResponseEntity.ok(ApiResponse.success(null, elapsedSince(startTime)));
    }
    
    /**
     * POST /api/v1/keys/{key}/buffer - linear buffer analysis along the given legs
     */
    @PostMapping("/keys/{key}/buffer")
    public CompletableFuture<ResponseEntity<ApiResponse<AnalysisResult>>> analyze(
            @PathVariable String key,
            @RequestBody BufferAnalysisParam param) {
        
        long startTime = System.currentTimeMillis();
        CompletableFuture<AnalysisResult> analysis;
        try {
            analysis = bufferAnalysisService.analyze(key, param.getLegs(), param.getEffectiveBufferWidth());
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(errorResponse(key, e));
        }
        
        return analysis
                .thenApply(result -> ResponseEntity.ok(ApiResponse.success(result, elapsedSince(startTime))))
                .exceptionally(error -> errorResponse(key, error));
    }
    
    /**
     * POST /api/v1/generate/test-data - fill a collection with random points
     */
    @PostMapping("/generate/test-data")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> generateTestData(
            @RequestParam String collection,
            @RequestParam(defaultValue = "1000") int records,
            @RequestParam double minLat,
            @RequestParam double maxLat,
            @RequestParam double minLon,
            @RequestParam double maxLon) {
        
        return dataLoader.generateTestData(collection, records, minLat, maxLat, minLon, maxLon)
                .thenApply(this::loadResponse);
    }
    
    /**
     * POST /api/v1/load/json - bulk load points from a JSON file on the server
     */
    @PostMapping("/load/json")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> loadJson(@RequestParam String path) {
        return dataLoader.loadFromJson(path).thenApply(this::loadResponse);
    }
    
    private ResponseEntity<Map<String, Object>> loadResponse(DataLoader.LoadResult result) {
        Map<String, Object> response = new HashMap<>();
        response.put("ok", result.isSuccess());
        response.put("records_generated", result.getRecordsLoaded());
        response.put("message", result.getMessage());
        response.put("elapsed", result.getDurationMs() + "ms");
        return result.isSuccess() ? ResponseEntity.ok(response) : ResponseEntity.badRequest().body(response);
    }
    
    private <T> ResponseEntity<ApiResponse<T>> errorResponse(String key, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        
        if (cause instanceof InvalidBufferWidthException || cause instanceof InvalidLegException) {
            log.debug("Rejected buffer analysis on collection '{}': {}", key, cause.getMessage());
            return ResponseEntity.badRequest().body(ApiResponse.error(cause.getMessage()));
        }
        if (cause instanceof IndexUnavailableException) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(cause.getMessage()));
        }
        
        log.error("Error running buffer analysis on collection '{}'", key, cause);
        return ResponseEntity.internalServerError().body(ApiResponse.error(String.valueOf(cause.getMessage())));
    }
    
    private static String elapsedSince(long startTime) {
        return (System.currentTimeMillis() - startTime) + "ms";
    }
}
