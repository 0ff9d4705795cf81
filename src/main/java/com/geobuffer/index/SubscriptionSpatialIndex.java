package com.geobuffer.index;

import com.geobuffer.exception.IndexUnavailableException;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapts an event based {@link GeoIndex} to the future based {@link SpatialIndex}.
 *
 * <p>Entered keys are collected until the ready signal, at which point the subscription
 * is cancelled and the future completes with everything collected so far. An error
 * signal also cancels the subscription and fails the future. With a non-zero timeout a
 * query that is not ready in time is cancelled and fails with a
 * {@link java.util.concurrent.TimeoutException}. Every subscription is cancelled exactly once.
 */
public class SubscriptionSpatialIndex implements SpatialIndex {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionSpatialIndex.class);

    private final GeoIndex geoIndex;

    // Zero disables the timeout
    private final Duration queryTimeout;

    public SubscriptionSpatialIndex(GeoIndex geoIndex) {
        this(geoIndex, Duration.ZERO);
    }

    public SubscriptionSpatialIndex(GeoIndex geoIndex, Duration queryTimeout) {
        if (geoIndex == null) {
            throw new IndexUnavailableException("A GeoIndex is required");
        }
        this.geoIndex = geoIndex;
        this.queryTimeout = queryTimeout == null ? Duration.ZERO : queryTimeout;
    }

    @Override
    public CompletableFuture<Set<IndexMatch>> query(GeoPoint center, double radiusKm) {
        CompletableFuture<Set<IndexMatch>> future = new CompletableFuture<>();
        Set<IndexMatch> entered = Collections.synchronizedSet(new LinkedHashSet<>());

        GeoQuery query;
        try {
            query = geoIndex.query(center, radiusKm);
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
            return future;
        }
        AtomicBoolean released = new AtomicBoolean();

        query.onKeyEntered((key, location) -> entered.add(IndexMatch.of(key, location)));
        query.onReady(() -> {
            try {
                release(query, released);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                return;
            }
            Set<IndexMatch> snapshot;
            synchronized (entered) {
                snapshot = new LinkedHashSet<>(entered);
            }
            logger.debug("Query at {} within {}km ready with {} entries", center, radiusKm, snapshot.size());
            future.complete(snapshot);
        });
        query.onError(error -> {
            try {
                release(query, released);
            } catch (RuntimeException e) {
                error.addSuppressed(e);
            }
            logger.warn("Query at {} within {}km failed: {}", center, radiusKm, error.getMessage());
            future.completeExceptionally(error);
        });

        if (queryTimeout.isZero()) {
            return future;
        }
        // Callers see the timeout only after the subscription is released
        return future.orTimeout(queryTimeout.toMillis(), TimeUnit.MILLISECONDS)
                     .whenComplete((result, error) -> {
                         if (error == null || released.get()) {
                             return;
                         }
                         logger.warn("Query at {} within {}km not ready after {}ms, cancelling",
                                     center, radiusKm, queryTimeout.toMillis());
                         try {
                             release(query, released);
                         } catch (RuntimeException e) {
                             error.addSuppressed(e);
                         }
                     });
    }

    private static void release(GeoQuery query, AtomicBoolean released) {
        if (released.compareAndSet(false, true)) {
            query.cancel();
        }
    }
}
