package com.helios.turnengine.infra.metrics;

/**
 * Running total of engine occurrences such as fired triggers, skipped
 * actions or autosaves. Counts only go up for the life of the process.
 */
public interface Counter {
    void increment(long amount);

    default void increment() {
        increment(1);
    }

    long count();
}
