package com.anonymizer.sidecar;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Lets a caller abandon an in-flight worker call.
 * <p>
 * {@link #cancel()} is idempotent and thread-safe. A callback registered with
 * {@link #onCancel(Runnable)} runs exactly once: at cancellation, or
 * immediately if the token was already cancelled.
 */
@Slf4j
public final class CancellationToken {

    /** Handle returned by {@link #onCancel(Runnable)}; closing it unregisters the callback. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
    }

    public Registration onCancel(Runnable callback) {
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> {
        };
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
