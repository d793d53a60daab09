package com.helios.turnengine.infra.metrics.internal;

import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Resolves the process-wide registry on first use of
 * {@link MetricsRegistry#getInstance()}: every session started without an
 * explicit registry shares it.
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry NO_OP = NoOpMetricsRegistry.INSTANCE;
    public static final MetricsRegistry INSTANCE;

    static {
        ServiceLoader<MetricsRegistryProvider> loader = ServiceLoader.load(MetricsRegistryProvider.class);

        MetricsRegistryProvider provider = StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider != null) {
            INSTANCE = provider.create();
            logger.info(String.format("Turn engine metrics go to provider %s (priority %d)",
                    provider.name(), provider.priority()));
        } else {
            INSTANCE = NO_OP;
            logger.fine("No metrics provider registered; session metrics are discarded");
        }
    }

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }
}
