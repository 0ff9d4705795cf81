package com.geobuffer.config.serializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.param.BufferAnalysisParam;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Custom Jackson deserializer for BufferAnalysisParam.
 * Supports legs as nested {@code [lat, lng]} arrays, or a WKT geometry where every
 * point and line string becomes one leg. WKT coordinates are in {@code lon lat} order.
 */
public class BufferAnalysisParamDeserializer extends JsonDeserializer<BufferAnalysisParam> {

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final WKTReader wktReader = new WKTReader(geometryFactory);

    @Override
    public BufferAnalysisParam deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        BufferAnalysisParam.BufferAnalysisParamBuilder builder = BufferAnalysisParam.builder();

        if (node.has("legs")) {
            builder.legs(parseLegs(node.get("legs")));
        } else if (node.has("wkt")) {
            builder.legs(parseWkt(node.get("wkt").asText()));
        }

        // Anything but a number is kept as NaN and rejected by validation
        if (node.has("bufferWidth")) {
            JsonNode width = node.get("bufferWidth");
            builder.bufferWidth(width.isNumber() ? width.asDouble() : Double.NaN);
        }

        return builder.build();
    }

    private List<List<GeoPoint>> parseLegs(JsonNode legsNode) throws IOException {
        if (!legsNode.isArray()) {
            throw new IOException("legs must be an array of [lat, lng] arrays");
        }
        List<List<GeoPoint>> legs = new ArrayList<>(legsNode.size());
        for (JsonNode legNode : legsNode) {
            if (!legNode.isArray()) {
                throw new IOException("Each leg must be an array of [lat, lng] pairs");
            }
            List<GeoPoint> leg = new ArrayList<>(legNode.size());
            for (JsonNode pointNode : legNode) {
                leg.add(GeoPointDeserializer.parse(pointNode));
            }
            legs.add(leg);
        }
        return legs;
    }

    List<List<GeoPoint>> parseWkt(String wkt) throws IOException {
        Geometry geometry;
        try {
            geometry = wktReader.read(wkt);
        } catch (ParseException e) {
            throw new IOException("Invalid WKT format: " + wkt, e);
        }

        if (!(geometry instanceof Point || geometry instanceof LineString
                || geometry instanceof MultiPoint || geometry instanceof MultiLineString)) {
            throw new IOException("Unsupported WKT geometry for buffer analysis: " + geometry.getGeometryType());
        }

        List<List<GeoPoint>> legs = new ArrayList<>(geometry.getNumGeometries());
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            List<GeoPoint> leg = new ArrayList<>();
            for (Coordinate coordinate : geometry.getGeometryN(i).getCoordinates()) {
                leg.add(GeoPoint.of(coordinate.getY(), coordinate.getX()));
            }
            legs.add(leg);
        }
        return legs;
    }
}
