package com.geobuffer.model.param;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.geobuffer.model.GeoPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Parameters of a buffer analysis request.
 * Legs arrive either as {@code [lat, lng]} arrays or as WKT and are resolved to points
 * while deserializing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BufferAnalysisParam {

    private List<List<GeoPoint>> legs;

    /**
     * Corridor half-width in meters; NaN when the request carried a non-numeric value
     */
    private Double bufferWidth;

    @JsonIgnore
    public double getEffectiveBufferWidth() {
        return bufferWidth != null ? bufferWidth : Double.NaN;
    }
}
