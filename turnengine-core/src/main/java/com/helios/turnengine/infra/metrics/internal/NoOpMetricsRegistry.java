package com.helios.turnengine.infra.metrics.internal;

import com.helios.turnengine.infra.metrics.Counter;
import com.helios.turnengine.infra.metrics.Gauge;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.infra.metrics.Timer;

import java.time.Duration;

/**
 * Registry for processes with no metrics provider registered. Every name
 * maps to one shared instrument that drops its input and reads zero.
 */
enum NoOpMetricsRegistry implements MetricsRegistry {
    INSTANCE;

    @Override
    public Counter counter(String name, String... tags) {
        return Discarding.INSTRUMENT;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return Discarding.INSTRUMENT;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return Discarding.INSTRUMENT;
    }

    private enum Discarding implements Counter, Gauge, Timer {
        INSTRUMENT;

        @Override
        public void increment(long amount) {
        }

        @Override
        public void set(double value) {
        }

        @Override
        public double value() {
            return 0.0;
        }

        @Override
        public void record(Duration duration) {
        }

        @Override
        public long count() {
            return 0L;
        }

        @Override
        public Duration total() {
            return Duration.ZERO;
        }
    }
}
