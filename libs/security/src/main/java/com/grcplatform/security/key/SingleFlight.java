package com.grcplatform.security.key;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent calls for the same key into one in-flight execution.
 * <p>
 * Every caller receives its own copy of the shared future, so cancelling one caller's future
 * never cancels the work the others are waiting on. Once the shared work completes the key is
 * released and the next call starts a fresh execution.
 *
 * @param <K> key type
 * @param <V> result type
 */
public final class SingleFlight<K, V> {

    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * Returns a future for the result of {@code work}, starting it only if no execution for
     * {@code key} is already in flight.
     */
    public CompletableFuture<V> execute(K key, Supplier<CompletableFuture<V>> work) {
        CompletableFuture<V> shared = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, shared);
        if (existing != null) {
            return existing.copy();
        }
        try {
            work.get().whenComplete((value, error) -> {
                inFlight.remove(key, shared);
                if (error != null) {
                    shared.completeExceptionally(error);
                } else {
                    shared.complete(value);
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(key, shared);
            shared.completeExceptionally(e);
        }
        return shared.copy();
    }

    /** Number of executions currently in flight. */
    public int inFlightCount() {
        return inFlight.size();
    }
}
