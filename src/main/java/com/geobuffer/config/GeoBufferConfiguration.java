package com.geobuffer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.geobuffer.config.serializer.BufferAnalysisParamDeserializer;
import com.geobuffer.config.serializer.GeoPointDeserializer;
import com.geobuffer.config.serializer.GeoPointSerializer;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.param.BufferAnalysisParam;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application configuration for Geo Buffer
 */
@Configuration
public class GeoBufferConfiguration {

    /**
     * Executor on which index radius queries complete
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService indexQueryExecutor(GeoBufferProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "index-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getIndex().getQueryThreads(), threadFactory);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Points travel as [lat, lng]; buffer requests accept legs or WKT
        SimpleModule geoModule = new SimpleModule();
        geoModule.addSerializer(GeoPoint.class, new GeoPointSerializer());
        geoModule.addDeserializer(GeoPoint.class, new GeoPointDeserializer());
        geoModule.addDeserializer(BufferAnalysisParam.class, new BufferAnalysisParamDeserializer());
        mapper.registerModule(geoModule);

        return mapper;
    }
}
