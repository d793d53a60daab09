/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.scheduler;

import com.helios.turnengine.api.model.DrainReport;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.api.model.OnFalsePolicy;
import com.helios.turnengine.api.model.PendingEventView;
import com.helios.turnengine.api.model.ScheduledEvent;
import com.helios.turnengine.api.model.SchedulerState;
import com.helios.turnengine.api.model.Tombstone;
import com.helios.turnengine.infra.metrics.Counter;
import com.helios.turnengine.infra.metrics.Gauge;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.runtime.action.ActionContext;
import com.helios.turnengine.runtime.action.ActionExecutor;
import com.helios.turnengine.runtime.evaluation.ConditionEvaluator;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.output.OutputBuffer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Resolves due events from an {@link EventQueue}.
 *
 * <h2>Drain algorithm</h2>
 * <ol>
 *   <li>The events due at or before the current turn are copied out of the
 *       queue before any of them is processed. Anything inserted while the
 *       drain runs, including retry clones and events scheduled by fired
 *       actions, waits for the next drain.</li>
 *   <li>Each event is removed and tombstoned before its actions run, so it
 *       gets exactly one terminal resolution.</li>
 *   <li>A false condition applies the event's {@link OnFalsePolicy}: cancel,
 *       or clone it under a new id due {@code turns} after the current turn.</li>
 * </ol>
 *
 * <p>The developer operations ({@link #listPending()}, {@link #cancel},
 * {@link #delay}) act directly on the queue and never evaluate conditions.
 */
public final class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final EventQueue queue;
    private final ConditionEvaluator evaluator;
    private final ActionExecutor executor;
    private final Tracer tracer;

    private final Counter firedCounter;
    private final Counter cancelledCounter;
    private final Counter rescheduledCounter;
    private final Gauge pendingGauge;

    public Scheduler(EventQueue queue, ConditionEvaluator evaluator, ActionExecutor executor,
                     Tracer tracer, MetricsRegistry metrics) {
        this.queue = queue;
        this.evaluator = evaluator;
        this.executor = executor;
        this.tracer = tracer;
        this.firedCounter = metrics.counter(MetricNames.SCHEDULED_FIRED);
        this.cancelledCounter = metrics.counter(MetricNames.SCHEDULED_CANCELLED);
        this.rescheduledCounter = metrics.counter(MetricNames.SCHEDULED_RESCHEDULED);
        this.pendingGauge = metrics.gauge(MetricNames.SCHEDULER_PENDING);
    }

    /**
     * Resolves every event due at or before {@code currentTurn}.
     */
    public DrainReport drainDue(long currentTurn, World world, OutputBuffer view) {
        Span span = tracer.spanBuilder("drain-due").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<ScheduledEvent> due = queue.due(currentTurn);
            span.setAttribute("turn", currentTurn);
            span.setAttribute("dueEvents", due.size());

            if (due.isEmpty()) {
                return DrainReport.empty(currentTurn);
            }

            List<Tombstone> resolutions = new ArrayList<>(due.size());
            for (ScheduledEvent event : due) {
                if (!queue.isPending(event.id())) {
                    continue;
                }
                resolutions.add(resolve(event, currentTurn, world, view));
            }

            span.setAttribute("resolved", resolutions.size());
            return new DrainReport(currentTurn, resolutions);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            pendingGauge.set(queue.size());
            span.end();
        }
    }

    private Tombstone resolve(ScheduledEvent event, long currentTurn, World world, OutputBuffer view) {
        if (evaluator.evaluate(event.condition(), world, GameEvent.always(), "scheduled#" + event.id())) {
            Tombstone tombstone = Tombstone.fired(event, currentTurn);
            queue.resolve(event, tombstone);
            firedCounter.increment();
            logger.fine(() -> "Scheduled event #" + event.id() + " fired on turn " + currentTurn);
            executor.execute(event.actions(), world, view, ActionContext.forScheduled(event));
            return tombstone;
        }

        OnFalsePolicy policy = event.onFalse();
        if (!policy.isRetry()) {
            Tombstone tombstone = Tombstone.cancelled(event, currentTurn);
            queue.resolve(event, tombstone);
            cancelledCounter.increment();
            logger.fine(() -> "Scheduled event #" + event.id() + " cancelled on turn " + currentTurn);
            return tombstone;
        }

        ScheduledEvent clone = queue.insertClone(event, currentTurn + policy.turns());
        Tombstone tombstone = Tombstone.rescheduled(event, currentTurn, clone.id());
        queue.resolve(event, tombstone);
        rescheduledCounter.increment();
        logger.fine(() -> String.format("Scheduled event #%d retried as #%d due on turn %d",
                event.id(), clone.id(), clone.dueTurn()));
        return tombstone;
    }

    // ==================== Developer operations ====================

    public List<PendingEventView> listPending() {
        List<PendingEventView> views = new ArrayList<>(queue.size());
        for (ScheduledEvent event : queue.pending()) {
            views.add(new PendingEventView(
                    event.id(),
                    event.dueTurn(),
                    event.actions().size(),
                    event.onFalse().summary(),
                    ConditionSummary.describe(event.condition()),
                    event.note()));
        }
        return views;
    }

    /**
     * @return false when no pending event has {@code eventId}
     */
    public boolean cancel(long eventId, long currentTurn) {
        ScheduledEvent event = queue.get(eventId).orElse(null);
        if (event == null) {
            return false;
        }
        queue.resolve(event, Tombstone.cancelled(event, currentTurn));
        pendingGauge.set(queue.size());
        logger.info("Scheduled event #" + eventId + " cancelled by developer command");
        return true;
    }

    /**
     * Moves a pending event {@code turns} later by cloning it under a new id.
     *
     * @return the new id, or empty when no pending event has {@code eventId}
     */
    public OptionalLong delay(long eventId, int turns, long currentTurn) {
        if (turns < 0) {
            throw new IllegalArgumentException("Delay must be non-negative: " + turns);
        }
        ScheduledEvent event = queue.get(eventId).orElse(null);
        if (event == null) {
            return OptionalLong.empty();
        }
        ScheduledEvent clone = queue.insertClone(event, event.dueTurn() + turns);
        queue.resolve(event, Tombstone.rescheduled(event, currentTurn, clone.id()));
        logger.info(String.format("Scheduled event #%d delayed by %d turn(s) as #%d",
                eventId, turns, clone.id()));
        return OptionalLong.of(clone.id());
    }

    public int pendingCount() {
        return queue.size();
    }

    public SchedulerState snapshot() {
        return queue.snapshot();
    }
}
