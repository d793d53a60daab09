package com.helios.turnengine.infra.metrics.api;

import com.helios.turnengine.infra.metrics.MetricsRegistry;

/**
 * Plugs a {@link MetricsRegistry} into {@link MetricsRegistry#getInstance()}.
 *
 * <p>Providers are found with {@link java.util.ServiceLoader}, so an
 * implementation needs a public no-arg constructor and a line in
 * {@code META-INF/services/com.helios.turnengine.infra.metrics.api.MetricsRegistryProvider}.
 * The hosting service registers the in-memory provider so the developer
 * console can show live counts.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /** The highest priority wins when several providers are registered. */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
