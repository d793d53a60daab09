package com.helios.turnengine.service.persistence;

import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.api.model.TurnReport;
import com.helios.turnengine.infra.metrics.Counter;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.runtime.session.TurnEngine;
import com.helios.turnengine.runtime.session.TurnListener;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Saves the session to the {@value #SLOT} slot every N advanced turns.
 *
 * <p>A failed autosave does not interrupt play: it is logged, counted and
 * reported to the player as an {@link OutputTag#ERROR} line.
 */
public final class Autosaver implements TurnListener {
    private static final Logger logger = Logger.getLogger(Autosaver.class.getName());

    public static final String SLOT = "autosave";

    private final SaveSlotRepository slots;
    private final int everyTurns;
    private final Counter saves;
    private final Counter failures;

    public Autosaver(SaveSlotRepository slots, int everyTurns, MetricsRegistry metrics) {
        if (everyTurns < 1) {
            throw new IllegalArgumentException("everyTurns must be >= 1, got " + everyTurns);
        }
        this.slots = slots;
        this.everyTurns = everyTurns;
        this.saves = metrics.counter(MetricNames.AUTOSAVES);
        this.failures = metrics.counter(MetricNames.AUTOSAVE_FAILURES);
    }

    @Override
    public void turnCompleted(TurnEngine engine, TurnReport report) {
        if (!report.turnAdvanced() || report.turn() % everyTurns != 0) {
            return;
        }
        try {
            slots.save(SLOT, engine);
            saves.increment();
        } catch (SnapshotException e) {
            failures.increment();
            logger.log(Level.WARNING, "Autosave at turn " + report.turn() + " failed", e);
            engine.view().push(OutputTag.ERROR, "Autosave failed: " + e.getMessage());
        }
    }

    public int getEveryTurns() {
        return everyTurns;
    }
}
