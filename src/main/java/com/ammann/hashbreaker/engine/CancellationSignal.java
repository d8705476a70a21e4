/* (C)2026 */
package com.ammann.hashbreaker.engine;

import java.time.Clock;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation check handed down from the pipeline to long-running work.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();

    /**
     * Wraps an expensive check (typically a job store read) so it runs at most once per
     * {@code interval}. Once cancellation has been observed it is remembered.
     */
    static CancellationSignal throttled(BooleanSupplier check, Duration interval, Clock clock) {
        return new CancellationSignal() {
            private long nextCheckMillis = Long.MIN_VALUE;
            private boolean cancelled;

            @Override
            public synchronized boolean isCancelled() {
                if (cancelled) {
                    return true;
                }
                long now = clock.millis();
                if (now >= nextCheckMillis) {
                    nextCheckMillis = now + interval.toMillis();
                    cancelled = check.getAsBoolean();
                }
                return cancelled;
            }
        };
    }
}
