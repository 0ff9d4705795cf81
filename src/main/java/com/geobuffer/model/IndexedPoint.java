package com.geobuffer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.geobuffer.model.base.BaseEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;
import org.locationtech.jts.geom.Envelope;

import java.util.Map;

/**
 * A geolocated key stored in the spatial index
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexedPoint extends BaseEntity<String> {

    private GeoPoint location;

    private Map<String, Object> fields;

    /**
     * Degenerate envelope in lng/lat order, as the index stores it
     */
    @JsonIgnore
    public Envelope getEnvelope() {
        return new Envelope(location.getLng(), location.getLng(), location.getLat(), location.getLat());
    }

    public IndexMatch toMatch() {
        return IndexMatch.of(getId(), location);
    }
}
