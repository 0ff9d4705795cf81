package com.geobuffer.index;

import com.geobuffer.model.GeoPoint;

/**
 * Event based index: a query is a live subscription rather than a result
 */
public interface GeoIndex {

    /**
     * Open a subscription over entries within {@code radiusKm} kilometers of {@code center}
     */
    GeoQuery query(GeoPoint center, double radiusKm);
}
