package com.helios.turnengine.infra.metrics.impl.inmemory;

import com.helios.turnengine.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {
    private volatile double value;

    @Override
    public void set(double newValue) {
        value = newValue;
    }

    @Override
    public double value() {
        return value;
    }
}
