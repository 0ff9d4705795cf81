package com.geobuffer.config.serializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.geobuffer.model.GeoPoint;

import java.io.IOException;

/**
 * Reads a {@link GeoPoint} from a {@code [lat, lng]} array or a {@code {lat, lon}} object
 */
public class GeoPointDeserializer extends JsonDeserializer<GeoPoint> {

    @Override
    public GeoPoint deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return parse(node);
    }

    static GeoPoint parse(JsonNode node) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isArray()) {
            if (node.size() != 2 || !node.get(0).isNumber() || !node.get(1).isNumber()) {
                throw new IOException("A point must be a [lat, lng] pair of numbers, got " + node);
            }
            return GeoPoint.of(node.get(0).asDouble(), node.get(1).asDouble());
        }

        if (node.has("lat") && (node.has("lon") || node.has("lng"))) {
            JsonNode lng = node.has("lon") ? node.get("lon") : node.get("lng");
            return GeoPoint.of(node.get("lat").asDouble(), lng.asDouble());
        }

        throw new IOException("Unsupported point format. Expected [lat, lng] or {lat, lon}.");
    }
}
