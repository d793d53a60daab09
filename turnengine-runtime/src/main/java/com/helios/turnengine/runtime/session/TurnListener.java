package com.helios.turnengine.runtime.session;

import com.helios.turnengine.api.model.TurnReport;

/**
 * Callback run after every command cycle of a {@link TurnEngine}, once the
 * cycle's output has been flushed. Anything a listener pushes to
 * {@link TurnEngine#view()} is delivered with the next cycle.
 */
@FunctionalInterface
public interface TurnListener {

    void turnCompleted(TurnEngine engine, TurnReport report);
}
