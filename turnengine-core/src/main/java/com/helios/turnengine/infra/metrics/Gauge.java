package com.helios.turnengine.infra.metrics;

/**
 * Last reported level of something the engine holds, e.g. the number of
 * events waiting in the scheduler after a drain.
 */
public interface Gauge {
    void set(double value);
    double value();
}
