package com.geobuffer.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

/**
 * Result of a radius search on the spatial repository
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    private String id;

    private IndexedPoint object;

    /**
     * Great-circle distance from the search center in meters
     */
    private double distance;
}
