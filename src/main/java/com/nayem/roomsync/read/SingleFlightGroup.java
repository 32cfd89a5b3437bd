package com.nayem.roomsync.read;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Implements the "SingleFlight" pattern (popularized by Go's
 * sync/singleflight).
 * <p>
 * If multiple callers request the same key while a load for it is running,
 * only one load is launched and its result is shared among all callers.
 * </p>
 * <p>
 * Used on room state cache misses, where a burst of readers joining the same
 * room would otherwise each issue a Redis GET.
 * </p>
 */
public class SingleFlightGroup<V> {

    private final ConcurrentHashMap<String, CompletableFuture<V>> flights = new ConcurrentHashMap<>();
    private final Executor executor;

    public SingleFlightGroup(Executor executor) {
        this.executor = executor;
    }

    /**
     * Runs {@code supplier} for {@code key} unless a run for the same key is
     * already in progress, in which case that run's future is returned.
     * <p>
     * The returned future is shared: callers must not complete or cancel it.
     * </p>
     *
     * @param key      The unique key identifying the resource.
     * @param supplier The load to execute.
     * @return A future holding the load's result.
     */
    public CompletableFuture<V> doCall(String key, Supplier<V> supplier) {
        final Map<String, String> mdcContext = MDC.getCopyOfContextMap();

        return flights.computeIfAbsent(key, k -> {
            CompletableFuture<V> flight = new CompletableFuture<>();
            executor.execute(() -> {
                if (mdcContext != null) {
                    MDC.setContextMap(mdcContext);
                }
                try {
                    flight.complete(supplier.get());
                } catch (Throwable e) {
                    flight.completeExceptionally(e);
                } finally {
                    MDC.clear();
                    flights.remove(key, flight);
                }
            });
            return flight;
        });
    }

    /**
     * Checks if a load is currently in flight for the key.
     */
    public boolean isInFlight(String key) {
        return flights.containsKey(key);
    }
}
