package com.geobuffer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry delivered by the spatial index for a circular query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexMatch {

    private String key;

    private GeoPoint location;

    public static IndexMatch of(String key, GeoPoint location) {
        return new IndexMatch(key, location);
    }
}
