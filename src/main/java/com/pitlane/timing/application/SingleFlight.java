package com.pitlane.timing.application;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Coalesces concurrent calls for the same key into one in-flight computation.
 * The key is released as soon as the computation completes, so later calls start afresh.
 */
public class SingleFlight<K, V> {

    private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public CompletableFuture<V> execute(K key, Supplier<CompletableFuture<V>> work) {
        CompletableFuture<V> promise = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            return existing.copy();
        }

        try {
            work.get().whenComplete((value, error) -> {
                inFlight.remove(key, promise);
                if (error != null) {
                    promise.completeExceptionally(error);
                } else {
                    promise.complete(value);
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(key, promise);
            promise.completeExceptionally(e);
        }
        // callers get copies so none of them can complete the shared promise
        return promise.copy();
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
