package com.helios.turnengine.infra.metrics.impl.inmemory;

import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.infra.metrics.api.MetricsRegistryProvider;

/**
 * Makes {@link InMemoryMetricsRegistry} the process-wide registry. The
 * service module registers it, so a hosted game keeps its counts in memory
 * where {@code :metrics} can read them.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
