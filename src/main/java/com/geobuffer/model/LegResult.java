package com.geobuffer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Matches found along one leg, keyed by index key
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegResult {

    private QuerySection querySection;

    @JsonProperty("queryResult")
    private Map<String, IndexMatch> matches;

    public boolean contains(String key) {
        return matches != null && matches.containsKey(key);
    }
}
