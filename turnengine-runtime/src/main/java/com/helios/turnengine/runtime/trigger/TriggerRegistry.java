/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.trigger;

import com.helios.turnengine.api.model.EventKind;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.api.model.TriggerDefinition;
import com.helios.turnengine.api.model.TriggerState;
import com.helios.turnengine.infra.metrics.Counter;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.runtime.action.ActionContext;
import com.helios.turnengine.runtime.action.ActionExecutor;
import com.helios.turnengine.runtime.evaluation.ConditionEvaluator;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.output.OutputBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches events to triggers bucketed by {@link EventKind}.
 *
 * <p>Within a bucket triggers are checked in registration order, which is
 * also their priority. Each trigger is evaluated against the world as left
 * by the triggers before it, so an earlier trigger can enable or disable a
 * later one for the same event.
 *
 * <p>A trigger is recorded as fired before its actions run. An action that
 * re-dispatches the same event therefore cannot fire a fire-once trigger a
 * second time.
 */
public final class TriggerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TriggerRegistry.class);

    private final Map<EventKind, List<TriggerDefinition>> index = new EnumMap<>(EventKind.class);
    private final TriggerStateTable states;
    private final ConditionEvaluator evaluator;
    private final ActionExecutor executor;
    private final Counter triggersFired;

    public TriggerRegistry(List<TriggerDefinition> triggers, TriggerStateTable states,
                           ConditionEvaluator evaluator, ActionExecutor executor, MetricsRegistry metrics) {
        this.states = states;
        this.evaluator = evaluator;
        this.executor = executor;
        this.triggersFired = metrics.counter(MetricNames.TRIGGERS_FIRED);
        for (TriggerDefinition trigger : triggers) {
            index.computeIfAbsent(trigger.event().kind(), k -> new ArrayList<>()).add(trigger);
        }
    }

    /**
     * Fires every eligible trigger for {@code event}.
     *
     * @return ids of fired triggers, in firing order
     */
    public List<String> checkTriggers(GameEvent event, World world, OutputBuffer view) {
        List<TriggerDefinition> bucket = index.getOrDefault(event.kind(), Collections.emptyList());
        if (bucket.isEmpty()) {
            return List.of();
        }

        boolean ambient = event.kind() == EventKind.ALWAYS;
        List<String> fired = new ArrayList<>();
        for (TriggerDefinition trigger : bucket) {
            if (!isEligible(trigger) || !trigger.event().matches(event)) {
                continue;
            }
            if (!evaluator.evaluate(trigger.condition(), world, event, trigger.id())) {
                continue;
            }

            states.recordFiring(trigger.id(), world.getTurnCount());
            triggersFired.increment();
            logger.debug("Trigger '{}' fired on {} at turn {}", trigger.id(), event.kind(), world.getTurnCount());

            executor.execute(trigger.actions(), world, view, ActionContext.forTrigger(trigger.id(), ambient));
            fired.add(trigger.id());
        }
        return fired;
    }

    private boolean isEligible(TriggerDefinition trigger) {
        TriggerState state = states.get(trigger.id());
        if (state == null || !state.enabled()) {
            return false;
        }
        return !(trigger.fireOnce() && state.fired());
    }

    public int size(EventKind kind) {
        return index.getOrDefault(kind, Collections.emptyList()).size();
    }
}
