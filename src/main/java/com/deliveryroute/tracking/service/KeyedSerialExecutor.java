package com.deliveryroute.tracking.service;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs tasks on a shared pool while keeping tasks with the same key strictly sequential,
 * in submission order. Tasks with different keys run in parallel.
 */
@Slf4j
public class KeyedSerialExecutor {

    private final Executor delegate;

    /** Tail of each key's chain; removed once the chain drains. */
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    public CompletableFuture<Void> submit(String key, Runnable task) {
        CompletableFuture<Void> next = new CompletableFuture<>();
        AtomicReference<CompletableFuture<Void>> previous = new AtomicReference<>();
        tails.compute(key, (k, tail) -> {
            previous.set(tail != null ? tail : CompletableFuture.completedFuture(null));
            return next;
        });
        // Hand-off to the pool happens outside compute(). handle() so a failed task never
        // blocks the tasks queued behind it; a pool rejection fails the stage and frees the key.
        previous.get().handle((ignored, error) -> null)
                .thenRunAsync(() -> runSafely(key, task), delegate)
                .whenComplete((ignored, error) -> finish(key, next, error));
        return next;
    }

    /** Number of keys with queued or running work. */
    public int activeKeys() {
        return tails.size();
    }

    private void finish(String key, CompletableFuture<Void> next, Throwable error) {
        tails.remove(key, next);
        if (error != null) {
            next.completeExceptionally(error);
        } else {
            next.complete(null);
        }
    }

    private void runSafely(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Serial task for {} failed", key, e);
            throw e;
        }
    }
}
