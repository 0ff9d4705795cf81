package com.geobuffer.index.impl;

import com.geobuffer.index.GeoIndex;
import com.geobuffer.index.GeoQuery;
import com.geobuffer.model.GeoPoint;
import com.geobuffer.model.IndexMatch;
import com.geobuffer.model.SearchResult;
import com.geobuffer.repository.SpatialRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * {@link GeoIndex} over one collection of the {@link SpatialRepository}.
 * Each query runs on the supplied executor and is tracked until cancelled.
 */
@Slf4j
public class RepositoryGeoIndex implements GeoIndex {

    private final SpatialRepository repository;
    private final String collection;
    private final Executor executor;
    private final AtomicInteger openQueries = new AtomicInteger();

    public RepositoryGeoIndex(SpatialRepository repository, String collection, Executor executor) {
        this.repository = repository;
        this.collection = collection;
        this.executor = executor;
    }

    @Override
    public GeoQuery query(GeoPoint center, double radiusKm) {
        RepositoryGeoQuery query = new RepositoryGeoQuery(center, radiusKm);
        openQueries.incrementAndGet();
        try {
            executor.execute(query::run);
        } catch (RuntimeException e) {
            query.cancel();
            throw e;
        }
        return query;
    }

    /**
     * Number of queries issued and not yet cancelled
     */
    public int getOpenQueryCount() {
        return openQueries.get();
    }

    private final class RepositoryGeoQuery implements GeoQuery {

        private final GeoPoint center;
        private final double radiusKm;

        private final List<IndexMatch> delivered = new ArrayList<>();
        private final List<BiConsumer<String, GeoPoint>> enteredListeners = new ArrayList<>();
        private final List<Runnable> readyListeners = new ArrayList<>();
        private final List<Consumer<Throwable>> errorListeners = new ArrayList<>();
        private boolean ready;
        private Throwable failure;
        private boolean cancelled;

        private RepositoryGeoQuery(GeoPoint center, double radiusKm) {
            this.center = center;
            this.radiusKm = radiusKm;
        }

        private void run() {
            List<SearchResult> results;
            try {
                results = repository.nearby(collection, center.getLat(), center.getLng(), radiusKm * 1000);
            } catch (RuntimeException e) {
                log.error("Radius query on collection '{}' at {} failed", collection, center, e);
                fail(e);
                return;
            }

            for (SearchResult result : results) {
                enter(result.getObject().toMatch());
            }
            markReady();
        }

        private void enter(IndexMatch match) {
            List<BiConsumer<String, GeoPoint>> listeners;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                delivered.add(match);
                listeners = new ArrayList<>(enteredListeners);
            }
            listeners.forEach(listener -> listener.accept(match.getKey(), match.getLocation()));
        }

        private void markReady() {
            List<Runnable> listeners;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                ready = true;
                listeners = new ArrayList<>(readyListeners);
            }
            listeners.forEach(Runnable::run);
        }

        private void fail(Throwable error) {
            List<Consumer<Throwable>> listeners;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                failure = error;
                listeners = new ArrayList<>(errorListeners);
            }
            listeners.forEach(listener -> listener.accept(error));
        }

        @Override
        public void onKeyEntered(BiConsumer<String, GeoPoint> listener) {
            List<IndexMatch> replay;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                enteredListeners.add(listener);
                replay = new ArrayList<>(delivered);
            }
            replay.forEach(match -> listener.accept(match.getKey(), match.getLocation()));
        }

        @Override
        public void onReady(Runnable listener) {
            boolean fireNow;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                readyListeners.add(listener);
                fireNow = ready;
            }
            if (fireNow) {
                listener.run();
            }
        }

        @Override
        public void onError(Consumer<Throwable> listener) {
            Throwable error;
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                errorListeners.add(listener);
                error = failure;
            }
            if (error != null) {
                listener.accept(error);
            }
        }

        @Override
        public void cancel() {
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                cancelled = true;
                enteredListeners.clear();
                readyListeners.clear();
                errorListeners.clear();
            }
            openQueries.decrementAndGet();
            log.debug("Cancelled radius query on collection '{}' at {}", collection, center);
        }

        @Override
        public synchronized boolean isCancelled() {
            return cancelled;
        }
    }
}
