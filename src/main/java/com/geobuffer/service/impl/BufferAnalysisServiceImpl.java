package com.geobuffer.service.impl;

import com.geobuffer.analysis.BufferAnalyzer;
import com.geobuffer.aspect.Timed;
import com.geobuffer.config.GeoBufferProperties;
import com.geobuffer.index.SpatialIndex;
import com.geobuffer.index.SubscriptionSpatialIndex;
import com.geobuffer.index.impl.RepositoryGeoIndex;
import com.geobuffer.model.AnalysisResult;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexedPoint;
import com.geobuffer.repository.SpatialRepository;
import com.geobuffer.service.BufferAnalysisService;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Implementation of BufferAnalysisService using the repository as single source of truth.
 * Every analysis gets its own {@link BufferAnalyzer} over the collection's index.
 */
@Service
public class BufferAnalysisServiceImpl implements BufferAnalysisService {
    
    private static final Logger logger = LoggerFactory.getLogger(BufferAnalysisServiceImpl.class);
    
    private final SpatialRepository spatialRepository;
    private final Executor indexQueryExecutor;
    private final GeoBufferProperties properties;
    private final MeterRegistry meterRegistry;
    
    private final Counter analysisCounter;
    private final Counter failedAnalysisCounter;
    private final Counter matchCounter;
    private final Timer analysisTimer;
    
    public BufferAnalysisServiceImpl(SpatialRepository spatialRepository,
                                     @Qualifier("indexQueryExecutor") Executor indexQueryExecutor,
                                     GeoBufferProperties properties,
                                     MeterRegistry meterRegistry) {
        this.spatialRepository = spatialRepository;
        this.indexQueryExecutor = indexQueryExecutor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        
        this.analysisCounter = Counter.builder("geobuffer.analysis.requests")
                .description("Number of buffer analyses started")
                .register(meterRegistry);
        
        this.failedAnalysisCounter = Counter.builder("geobuffer.analysis.failures")
                .description("Number of buffer analyses that completed exceptionally")
                .register(meterRegistry);
        
        this.matchCounter = Counter.builder("geobuffer.analysis.matches")
                .description("Number of unique points reported by buffer analyses")
                .register(meterRegistry);
        
        this.analysisTimer = Timer.builder("geobuffer.analysis.duration")
                .description("Buffer analysis execution time")
                .register(meterRegistry);
    }
    
    @Override
    @Timed
    public void set(String key, String id, IndexedPoint point) {
        logger.debug("Setting point {}/{}", key, id);
        spatialRepository.index(key, id, point);
    }
    
    @Override
    @Timed(logLevel = Timed.LogLevel.INFO)
    public void bulkSet(String key, Map<String, IndexedPoint> points) {
        spatialRepository.bulkIndex(key, points);
    }
    
    @Override
    public Optional<IndexedPoint> get(String key, String id) {
        return spatialRepository.get(key, id);
    }
    
    @Override
    public boolean del(String key, String id) {
        return spatialRepository.remove(key, id);
    }
    
    @Override
    public boolean drop(String key) {
        return spatialRepository.drop(key);
    }
    
    @Override
    public List<String> keys() {
        List<String> keys = new ArrayList<>(spatialRepository.keys());
        Collections.sort(keys);
        return keys;
    }
    
    @Override
    public long count(String key) {
        return spatialRepository.getObjectCount(key);
    }
    
    @Override
    public void flushdb() {
        spatialRepository.flushAll();
        logger.info("Database flushed");
    }
    
    @Override
    @Timed("analyze.dispatch")
    public CompletableFuture<AnalysisResult> analyze(String key, List<List<GeoPoint>> legs, double bufferWidth) {
        BufferAnalyzer analyzer = new BufferAnalyzer(indexFor(key));
        
        Timer.Sample sample = Timer.start(meterRegistry);
        CompletableFuture<AnalysisResult> future = analyzer.analyze(legs, bufferWidth);
        analysisCounter.increment();
        
        return future.whenComplete((result, error) -> {
            sample.stop(analysisTimer);
            if (error != null) {
                failedAnalysisCounter.increment();
                logger.error("Buffer analysis on collection '{}' failed", key, error);
                return;
            }
            int unique = result.uniqueMatches().size();
            matchCounter.increment(unique);
            logger.info("Buffer analysis on collection '{}' found {} points along {} legs ({}m)",
                        key, unique, result.size(), Math.round(result.totalDistance()));
        });
    }
    
    @Override
    public SpatialIndex indexFor(String key) {
        return new SubscriptionSpatialIndex(new RepositoryGeoIndex(spatialRepository, key, indexQueryExecutor),
                                            properties.getAnalysis().getQueryTimeout());
    }
}
