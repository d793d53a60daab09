/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.session;

import com.helios.turnengine.api.ITurnEngine;
import com.helios.turnengine.api.exceptions.QueueCorruptionException;
import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.EngineSnapshot;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.api.model.PendingEventView;
import com.helios.turnengine.api.model.TriggerState;
import com.helios.turnengine.api.model.TurnReport;
import com.helios.turnengine.infra.config.EngineConfig;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.runtime.action.ActionContext;
import com.helios.turnengine.runtime.action.ActionExecutor;
import com.helios.turnengine.runtime.evaluation.ConditionEvaluator;
import com.helios.turnengine.runtime.model.GameModel;
import com.helios.turnengine.runtime.model.Goal;
import com.helios.turnengine.runtime.model.GoalStatus;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.npc.NpcMovementPass;
import com.helios.turnengine.runtime.output.OutputBuffer;
import com.helios.turnengine.runtime.output.OutputSink;
import com.helios.turnengine.runtime.random.TurnRandom;
import com.helios.turnengine.runtime.scheduler.EventQueue;
import com.helios.turnengine.runtime.scheduler.Scheduler;
import com.helios.turnengine.runtime.status.StatusEffectTicker;
import com.helios.turnengine.runtime.trigger.TriggerRegistry;
import com.helios.turnengine.runtime.trigger.TriggerStateTable;
import com.helios.turnengine.runtime.turn.TurnCoordinator;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * One play session over a compiled {@link GameModel}.
 *
 * <p>The session owns its world copy, output buffer, trigger state and
 * scheduler queue, and wires the evaluator, executor, registry, scheduler
 * and coordinator around them. Sessions are single-threaded.
 *
 * <pre>{@code
 * TurnEngine engine = TurnEngine.builder(model)
 *         .config(EngineConfig.loadDefault())
 *         .outputSink(renderer::render)
 *         .build();
 * }</pre>
 */
public final class TurnEngine implements ITurnEngine {
    private static final Logger logger = Logger.getLogger(TurnEngine.class.getName());

    private final GameModel model;
    private final EngineConfig config;
    private final World world;
    private final OutputBuffer view = new OutputBuffer();

    private final TriggerStateTable triggerStates;
    private final ConditionEvaluator evaluator;
    private final ActionExecutor executor;
    private final TriggerRegistry registry;
    private final Scheduler scheduler;
    private final TurnCoordinator coordinator;
    private final List<TurnListener> listeners;

    private TurnEngine(Builder builder, World world, EventQueue queue, long lastCycleTurn) {
        this.model = builder.model;
        this.config = builder.config;
        this.world = world;
        this.listeners = List.copyOf(builder.listeners);

        TurnRandom random = new TurnRandom(config.getRandomSeed());
        this.triggerStates = new TriggerStateTable(model.getTriggers());
        this.evaluator = new ConditionEvaluator(builder.metrics, random);
        this.executor = new ActionExecutor(queue, triggerStates, builder.metrics, random);
        this.registry = new TriggerRegistry(model.getTriggers(), triggerStates, evaluator, executor, builder.metrics);
        this.scheduler = new Scheduler(queue, evaluator, executor, builder.tracer, builder.metrics);
        this.coordinator = new TurnCoordinator(
                new NpcMovementPass(random),
                scheduler,
                new StatusEffectTicker(),
                registry,
                builder.sink,
                builder.tracer,
                builder.metrics,
                lastCycleTurn);
    }

    public static Builder builder(GameModel model) {
        return new Builder(model);
    }

    /**
     * Resumes a session from a snapshot taken by {@link #snapshot()}.
     *
     * @throws QueueCorruptionException if the scheduler state is inconsistent
     */
    public static TurnEngine restore(GameModel model, EngineSnapshot snapshot, EngineConfig config) {
        return builder(model).config(config).build(snapshot);
    }

    // ==================== Gameplay ====================

    @Override
    public List<String> checkTriggers(GameEvent event) {
        return registry.checkTriggers(event, world, view);
    }

    @Override
    public List<String> react(GameEvent event) {
        List<String> fired = registry.checkTriggers(event, world, view);
        if (fired.isEmpty() && event.isPlayerInitiated()) {
            view.push(OutputTag.ACTION_FAILURE, config.getFallbackMessage());
        }
        return fired;
    }

    @Override
    public void spawnIntoInventory(String itemId) {
        executor.execute(new Action.SpawnItemInInventory(itemId), world, view, ActionContext.direct());
    }

    /**
     * Runs a single action outside of any trigger.
     *
     * @return true if the action applied
     */
    public boolean apply(Action action) {
        return executor.execute(action, world, view, ActionContext.direct()) == 0;
    }

    @Override
    public long advanceClock() {
        return world.incrementTurn();
    }

    @Override
    public TurnReport advanceTurn() {
        TurnReport report = coordinator.advanceTurn(world, view);
        for (TurnListener listener : listeners) {
            listener.turnCompleted(this, report);
        }
        return report;
    }

    @Override
    public List<OutputItem> pendingOutput() {
        return view.peek();
    }

    @Override
    public World world() {
        return world;
    }

    public GoalStatus goalStatus(String goalId) {
        Goal goal = world.goal(goalId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown goal: " + goalId));
        return evaluator.goalStatus(goal, world);
    }

    /**
     * Status of every goal, in definition order.
     */
    public Map<String, GoalStatus> goalStatuses() {
        Map<String, GoalStatus> statuses = new LinkedHashMap<>();
        for (Goal goal : world.getGoals()) {
            statuses.put(goal.id(), evaluator.goalStatus(goal, world));
        }
        return statuses;
    }

    /** Buffer the developer console writes into. */
    public OutputBuffer view() {
        return view;
    }

    public EngineConfig config() {
        return config;
    }

    public GameModel model() {
        return model;
    }

    // ==================== Developer surface ====================

    @Override
    public List<PendingEventView> listPending() {
        return scheduler.listPending();
    }

    @Override
    public boolean cancelScheduled(long eventId) {
        return scheduler.cancel(eventId, world.getTurnCount());
    }

    @Override
    public OptionalLong delayScheduled(long eventId, int turns) {
        return scheduler.delay(eventId, turns, world.getTurnCount());
    }

    @Override
    public Map<String, TriggerState> triggerStates() {
        return triggerStates.snapshot();
    }

    // ==================== Persistence ====================

    @Override
    public EngineSnapshot snapshot() {
        return new EngineSnapshot(
                EngineSnapshot.CURRENT_FORMAT,
                world.copy(),
                triggerStates.snapshot(),
                scheduler.snapshot(),
                coordinator.lastCycleTurn());
    }

    public static final class Builder {
        private final GameModel model;
        private EngineConfig config = EngineConfig.loadDefault();
        private Tracer tracer = OpenTelemetry.noop().getTracer("turn-engine");
        private MetricsRegistry metrics = MetricsRegistry.getInstance();
        private OutputSink sink = OutputSink.DISCARD;
        private final List<TurnListener> listeners = new ArrayList<>();

        private Builder(GameModel model) {
            this.model = Objects.requireNonNull(model, "model");
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer, "tracer");
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder outputSink(OutputSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /** Adds a listener run after each command cycle, in registration order. */
        public Builder turnListener(TurnListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Starts a fresh session on a copy of the model's world.
         */
        public TurnEngine build() {
            World world = model.newWorld();
            TurnEngine engine = new TurnEngine(this, world,
                    new EventQueue(config.getMaxTombstones()), world.getTurnCount());
            logger.info(String.format("Started session: %d trigger(s), %d room(s)",
                    model.getNumTriggers(), world.getRooms().size()));
            return engine;
        }

        /**
         * Resumes a session from {@code snapshot}.
         *
         * @throws QueueCorruptionException if the scheduler state is inconsistent
         */
        public TurnEngine build(EngineSnapshot snapshot) {
            Objects.requireNonNull(snapshot, "snapshot");
            if (snapshot.formatVersion() != EngineSnapshot.CURRENT_FORMAT) {
                throw new QueueCorruptionException("Unsupported snapshot format version "
                        + snapshot.formatVersion() + " (expected " + EngineSnapshot.CURRENT_FORMAT + ")");
            }
            if (snapshot.world() == null) {
                throw new QueueCorruptionException("Snapshot has no world state");
            }
            World world = snapshot.world().copy();
            if (snapshot.lastCycleTurn() > world.getTurnCount()) {
                throw new QueueCorruptionException("Snapshot last processed turn " + snapshot.lastCycleTurn()
                        + " is ahead of the world turn " + world.getTurnCount());
            }

            EventQueue queue = EventQueue.restore(snapshot.scheduler(), world.getTurnCount(),
                    config.getMaxTombstones());
            TurnEngine engine = new TurnEngine(this, world, queue, snapshot.lastCycleTurn());
            engine.triggerStates.restore(snapshot.triggers());
            logger.info(String.format("Restored session at turn %d with %d pending event(s)",
                    world.getTurnCount(), queue.size()));
            return engine;
        }
    }
}
