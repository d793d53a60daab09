/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.turn;

import com.helios.turnengine.api.model.DrainReport;
import com.helios.turnengine.api.model.EventKind;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.TurnReport;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.infra.metrics.Timer;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.npc.NpcMovementPass;
import com.helios.turnengine.runtime.output.OutputBuffer;
import com.helios.turnengine.runtime.output.OutputSink;
import com.helios.turnengine.runtime.scheduler.Scheduler;
import com.helios.turnengine.runtime.status.StatusEffectTicker;
import com.helios.turnengine.runtime.trigger.TriggerRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs the end-of-command sequence.
 *
 * <p>The command handler owns the turn increment. When the counter has moved
 * since the previous cycle, the coordinator runs NPC movement, then the
 * scheduler drain for the new turn, then status effect ticks. Every cycle,
 * counting or not, then checks ambient triggers and flushes output.
 *
 * <p>Because the increment happens before the drain, an event scheduled one
 * turn ahead while handling turn N is due at N+1 and fires in the same cycle.
 */
public final class TurnCoordinator {
    private static final Logger logger = Logger.getLogger(TurnCoordinator.class.getName());

    private final NpcMovementPass movement;
    private final Scheduler scheduler;
    private final StatusEffectTicker statusTicker;
    private final TriggerRegistry registry;
    private final OutputSink sink;
    private final Tracer tracer;
    private final Timer turnTimer;

    private long lastCycleTurn;

    public TurnCoordinator(NpcMovementPass movement, Scheduler scheduler, StatusEffectTicker statusTicker,
                           TriggerRegistry registry, OutputSink sink, Tracer tracer,
                           MetricsRegistry metrics, long lastCycleTurn) {
        this.movement = movement;
        this.scheduler = scheduler;
        this.statusTicker = statusTicker;
        this.registry = registry;
        this.sink = sink;
        this.tracer = tracer;
        this.turnTimer = metrics.timer(MetricNames.TURN_DURATION);
        this.lastCycleTurn = lastCycleTurn;
    }

    public TurnReport advanceTurn(World world, OutputBuffer view) {
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("advance-turn").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long turn = world.getTurnCount();
            boolean advanced = turn != lastCycleTurn;
            span.setAttribute("turn", turn);
            span.setAttribute("turnAdvanced", advanced);

            DrainReport drain = DrainReport.empty(turn);
            if (advanced) {
                int moved = movement.run(world, view);
                drain = scheduler.drainDue(turn, world, view);
                tickStatusEffects(world, view);
                lastCycleTurn = turn;
                span.setAttribute("npcsMoved", moved);
                span.setAttribute("scheduledResolved", drain.resolutions().size());
            }

            List<String> ambient = registry.checkTriggers(GameEvent.always(), world, view);
            span.setAttribute("ambientTriggers", ambient.size());

            List<OutputItem> output = view.flush();
            sink.accept(output);

            TurnReport report = new TurnReport(turn, advanced, drain, ambient, output);
            logger.fine(() -> String.format("Turn %d cycle: advanced=%s, resolved=%d, ambient=%d, output=%d",
                    report.turn(), report.turnAdvanced(), report.drain().resolutions().size(),
                    report.ambientTriggers().size(), report.output().size()));
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            turnTimer.record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private void tickStatusEffects(World world, OutputBuffer view) {
        StatusEffectTicker.Result result = statusTicker.tick(world, view);
        if (result.died()) {
            GameEvent death = result.cause() == null
                    ? GameEvent.of(EventKind.PLAYER_DEATH)
                    : new GameEvent(EventKind.PLAYER_DEATH, Map.of("cause", result.cause()));
            registry.checkTriggers(death, world, view);
        }
    }

    public long lastCycleTurn() {
        return lastCycleTurn;
    }
}
