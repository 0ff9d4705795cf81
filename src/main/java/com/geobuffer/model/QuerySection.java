package com.geobuffer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sampled representation of one leg.
 *
 * <p>{@code samplePoints} starts at the leg's first point and ends at its last point.
 * Points sampled from the same original segment are one step length apart, except for
 * the final sub-step which may be shorter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuerySection {

    private GeoPoint start;

    private GeoPoint end;

    /**
     * Sum of the leg's segment lengths in meters
     */
    private double distance;

    @JsonProperty("queryPolyline")
    private List<GeoPoint> samplePoints;

    public int size() {
        return samplePoints == null ? 0 : samplePoints.size();
    }
}
