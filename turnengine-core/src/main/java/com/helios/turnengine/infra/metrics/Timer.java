package com.helios.turnengine.infra.metrics;

import java.time.Duration;

/**
 * Wall-clock durations of repeated engine work. The turn coordinator
 * records one sample per command cycle.
 */
public interface Timer {

    void record(Duration duration);

    /**
     * Runs {@code action} and records how long it took, even when it throws.
     */
    default void time(Runnable action) {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    long count();

    Duration total();
}
