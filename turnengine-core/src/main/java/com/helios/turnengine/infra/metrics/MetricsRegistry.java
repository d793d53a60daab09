package com.helios.turnengine.infra.metrics;

import com.helios.turnengine.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Where sessions report their counters, gauges and timers.
 *
 * <p>Each engine component asks the registry for its instruments once, at
 * construction, under a name from {@link MetricNames}. The registry a
 * session uses is passed through {@code TurnEngine.Builder#metrics}; when
 * none is given, the process-wide one from {@link #getInstance()} is used.
 *
 * <pre>{@code
 * TurnEngine engine = TurnEngine.builder(model)
 *         .metrics(MetricsRegistry.getInstance())
 *         .build();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * @param name one of the {@link MetricNames} constants
     * @param tags alternating label keys and values; registries may ignore them
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * The registry built by the highest-priority provider on the classpath,
     * or a registry that records nothing when there is no provider.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NO_OP;
    }
}
