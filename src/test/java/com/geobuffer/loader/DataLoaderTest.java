package com.geobuffer.loader;

import com.geobuffer.config.GeoBufferConfiguration;
import com.geobuffer.loader.impl.DataLoaderImpl;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexedPoint;
import com.geobuffer.service.BufferAnalysisService;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DataLoaderTest {
    
    @Mock
    private BufferAnalysisService bufferAnalysisService;
    
    private DataLoaderImpl dataLoader;
    
    @BeforeEach
    void setUp() {
        dataLoader = new DataLoaderImpl(bufferAnalysisService, new GeoBufferConfiguration().objectMapper());
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void testLoadFromJson() throws Exception {
        // Given
        String path = Paths.get(getClass().getResource("/points.json").toURI()).toString();
        
        // When
        DataLoader.LoadResult result = dataLoader.loadFromJson(path).get();
        
        // Then
        assertTrue(result.isSuccess());
        assertEquals(4, result.getRecordsLoaded());
        
        ArgumentCaptor<Map<String, IndexedPoint>> stations = ArgumentCaptor.forClass(Map.class);
        verify(bufferAnalysisService).bulkSet(eq("stations"), stations.capture());
        assertEquals(3, stations.getValue().size());
        assertEquals(GeoPoint.of(0.0003, 0.005), stations.getValue().get("s1").getLocation());
        assertEquals("inside", stations.getValue().get("s1").getFields().get("kind"));
        
        ArgumentCaptor<Map<String, IndexedPoint>> broken = ArgumentCaptor.forClass(Map.class);
        verify(bufferAnalysisService).bulkSet(eq("broken"), broken.capture());
        assertEquals(Set.of("b2"), broken.getValue().keySet());
    }
    
    @Test
    void testLoadFromMissingFile() throws Exception {
        DataLoader.LoadResult result = dataLoader.loadFromJson("/definitely/not/here.json").get();
        
        assertFalse(result.isSuccess());
        assertEquals(0, result.getRecordsLoaded());
        assertTrue(result.getMessage().contains("File not found"));
        verifyNoInteractions(bufferAnalysisService);
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void testGenerateTestData() throws Exception {
        // Given
        double minLat = 30.0;
        double maxLat = 40.0;
        double minLon = -120.0;
        double maxLon = -110.0;
        
        // When
        DataLoader.LoadResult result = dataLoader.generateTestData("generated", 500, minLat, maxLat, minLon, maxLon).get();
        
        // Then
        assertTrue(result.isSuccess());
        assertEquals(500, result.getRecordsLoaded());
        assertTrue(result.getDurationMs() > 0);
        
        ArgumentCaptor<Map<String, IndexedPoint>> batch = ArgumentCaptor.forClass(Map.class);
        verify(bufferAnalysisService).bulkSet(eq("generated"), batch.capture());
        assertEquals(500, batch.getValue().size());
        for (IndexedPoint point : batch.getValue().values()) {
            assertTrue(point.getLocation().getLat() >= minLat && point.getLocation().getLat() <= maxLat);
            assertTrue(point.getLocation().getLng() >= minLon && point.getLocation().getLng() <= maxLon);
        }
    }
    
    @Test
    void testGenerateTestDataInBatches() throws Exception {
        DataLoader.LoadResult result = dataLoader.generateTestData("large", 25000, 0, 1, 0, 1).get();
        
        assertEquals(25000, result.getRecordsLoaded());
        verify(bufferAnalysisService, times(3)).bulkSet(eq("large"), anyMap());
    }
}
