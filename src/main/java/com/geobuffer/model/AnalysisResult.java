package com.geobuffer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered leg results of one buffer analysis, one entry per input leg
 */
@ToString
@EqualsAndHashCode
public class AnalysisResult {

    private final List<LegResult> legs;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AnalysisResult(List<LegResult> legs) {
        this.legs = legs == null ? Collections.emptyList() : Collections.unmodifiableList(legs);
    }

    @JsonValue
    public List<LegResult> getLegs() {
        return legs;
    }

    public LegResult getLeg(int index) {
        return legs.get(index);
    }

    public int size() {
        return legs.size();
    }

    /**
     * Matches of all legs merged by key; the earliest leg wins
     */
    public Map<String, IndexMatch> uniqueMatches() {
        Map<String, IndexMatch> unique = new LinkedHashMap<>();
        for (LegResult leg : legs) {
            leg.getMatches().forEach(unique::putIfAbsent);
        }
        return unique;
    }

    /**
     * Total length in meters of all analyzed legs
     */
    public double totalDistance() {
        return legs.stream()
                   .mapToDouble(leg -> leg.getQuerySection().getDistance())
                   .sum();
    }
}
