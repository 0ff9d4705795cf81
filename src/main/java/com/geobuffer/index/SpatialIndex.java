package com.geobuffer.index;

import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexMatch;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Circular radius query capability that buffer analysis depends on.
 *
 * <p>Implementations must not block the caller. The returned future completes once the
 * index has delivered every entry within the radius and has released the resources of
 * the query.
 */
public interface SpatialIndex {

    /**
     * Find indexed entries within {@code radiusKm} kilometers of {@code center}
     */
    CompletableFuture<Set<IndexMatch>> query(GeoPoint center, double radiusKm);
}
