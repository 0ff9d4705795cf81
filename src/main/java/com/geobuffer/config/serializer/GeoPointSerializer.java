package com.geobuffer.config.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.geobuffer.model.GeoPoint;

import java.io.IOException;

/**
 * Writes a {@link GeoPoint} as a {@code [lat, lng]} array
 */
public class GeoPointSerializer extends JsonSerializer<GeoPoint> {

    @Override
    public void serialize(GeoPoint point, JsonGenerator gen, SerializerProvider serializers)
            throws IOException {
        if (point == null) {
            gen.writeNull();
            return;
        }
        double[] latLng = point.toArray();
        gen.writeArray(latLng, 0, latLng.length);
    }
}
