package com.geobuffer.index;

import com.geobuffer.model.GeoPoint;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Subscription returned by {@link GeoIndex#query}.
 *
 * <p>Emits one "key entered" event per matching entry, then exactly one "ready" signal
 * once the initial matching set has been delivered. A query that fails signals its error
 * instead of ready. {@link #cancel()} releases the subscription and must be called once
 * the caller is done with it. Listeners registered late still see every event that has
 * already been emitted.
 */
public interface GeoQuery {

    void onKeyEntered(BiConsumer<String, GeoPoint> listener);

    void onReady(Runnable listener);

    void onError(Consumer<Throwable> listener);

    void cancel();

    boolean isCancelled();
}
