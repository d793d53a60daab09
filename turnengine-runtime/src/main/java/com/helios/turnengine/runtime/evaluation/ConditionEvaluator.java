/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.evaluation;

import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.ConditionVisitor;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.infra.metrics.Counter;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.runtime.model.Flag;
import com.helios.turnengine.runtime.model.Goal;
import com.helios.turnengine.runtime.model.GoalStatus;
import com.helios.turnengine.runtime.model.Item;
import com.helios.turnengine.runtime.model.Location;
import com.helios.turnengine.runtime.model.Npc;
import com.helios.turnengine.runtime.model.Room;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.random.TurnRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Read-only boolean evaluation of {@link Condition} trees.
 *
 * <p>{@code all} stops at the first false child and {@code any} at the first
 * true child. A leaf that names a room, item, NPC or goal that does not exist
 * is a reference error: it evaluates to {@code false}, is logged and counted,
 * and the rest of the tree is still evaluated normally.
 *
 * <p>{@code chance} leaves draw from {@link TurnRandom}, keyed by the scope
 * passed to {@link #evaluate(Condition, World, GameEvent, String)}, so the
 * same trigger on the same turn of the same world always draws the same way.
 *
 * <p>Evaluation never mutates the world.
 */
public final class ConditionEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    private static final String UNSCOPED = "";

    private final Counter referenceErrors;
    private final TurnRandom random;

    public ConditionEvaluator(MetricsRegistry metrics, TurnRandom random) {
        this.referenceErrors = metrics.counter(MetricNames.REFERENCE_ERRORS);
        this.random = random;
    }

    public ConditionEvaluator(MetricsRegistry metrics) {
        this(metrics, new TurnRandom(0L));
    }

    /**
     * Evaluates outside of any event; {@code event_matches} only matches
     * {@code ALWAYS}.
     */
    public boolean evaluate(Condition condition, World world) {
        return evaluate(condition, world, GameEvent.always());
    }

    public boolean evaluate(Condition condition, World world, GameEvent event) {
        return evaluate(condition, world, event, UNSCOPED);
    }

    /**
     * @param scope id of whatever asked for the evaluation, used to key random draws
     */
    public boolean evaluate(Condition condition, World world, GameEvent event, String scope) {
        if (condition == null) {
            return true;
        }
        return condition.accept(new Evaluation(new EvaluationContext(world, event, scope)));
    }

    /**
     * Derives a goal's status: failed wins, then activation gates completion.
     */
    public GoalStatus goalStatus(Goal goal, World world) {
        return goalStatus(goal, new EvaluationContext(world, GameEvent.always(), "goal:" + goal.id()));
    }

    private GoalStatus goalStatus(Goal goal, EvaluationContext ctx) {
        if (!ctx.enterGoal(goal.id())) {
            logger.warn("Goal '{}' depends on itself; treating it as inactive", goal.id());
            return GoalStatus.INACTIVE;
        }
        try {
            Evaluation evaluation = new Evaluation(ctx);
            if (goal.failedWhen() != null && goal.failedWhen().accept(evaluation)) {
                return GoalStatus.FAILED;
            }
            if (goal.activateWhen() != null && !goal.activateWhen().accept(evaluation)) {
                return GoalStatus.INACTIVE;
            }
            return goal.finishedWhen().accept(evaluation) ? GoalStatus.COMPLETE : GoalStatus.ACTIVE;
        } finally {
            ctx.exitGoal(goal.id());
        }
    }

    private boolean missing(String kind, String id) {
        referenceErrors.increment();
        logger.warn("Condition references unknown {} '{}'; evaluating as false", kind, id);
        return false;
    }

    private final class Evaluation implements ConditionVisitor<Boolean> {
        private final EvaluationContext ctx;

        Evaluation(EvaluationContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public Boolean visitAll(Condition.All condition) {
            for (Condition child : condition.conditions()) {
                if (!child.accept(this)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitAny(Condition.Any condition) {
            for (Condition child : condition.conditions()) {
                if (child.accept(this)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Boolean visitHasFlag(Condition.HasFlag condition) {
            return hasFlag(condition.flag());
        }

        @Override
        public Boolean visitMissingFlag(Condition.MissingFlag condition) {
            return !hasFlag(condition.flag());
        }

        @Override
        public Boolean visitFlagInProgress(Condition.FlagInProgress condition) {
            return ctx.world().getPlayer().flag(condition.flag())
                    .map(f -> f.isSequence() && !f.isComplete())
                    .orElse(false);
        }

        @Override
        public Boolean visitFlagComplete(Condition.FlagComplete condition) {
            return ctx.world().getPlayer().flag(condition.flag())
                    .map(Flag::isComplete)
                    .orElse(false);
        }

        @Override
        public Boolean visitHasItem(Condition.HasItem condition) {
            Optional<Item> item = ctx.world().item(condition.item());
            if (item.isEmpty()) {
                return missing("item", condition.item());
            }
            return item.get().getLocation().equals(Location.inventory());
        }

        @Override
        public Boolean visitMissingItem(Condition.MissingItem condition) {
            Optional<Item> item = ctx.world().item(condition.item());
            if (item.isEmpty()) {
                return missing("item", condition.item());
            }
            return !item.get().getLocation().equals(Location.inventory());
        }

        @Override
        public Boolean visitContainerHasItem(Condition.ContainerHasItem condition) {
            if (ctx.world().item(condition.container()).isEmpty()) {
                return missing("item", condition.container());
            }
            Optional<Item> item = ctx.world().item(condition.item());
            if (item.isEmpty()) {
                return missing("item", condition.item());
            }
            return item.get().getLocation().equals(Location.container(condition.container()));
        }

        @Override
        public Boolean visitInRoom(Condition.InRoom condition) {
            if (ctx.world().room(condition.room()).isEmpty()) {
                return missing("room", condition.room());
            }
            return condition.room().equals(ctx.world().getPlayer().getRoom());
        }

        @Override
        public Boolean visitReachedRoom(Condition.ReachedRoom condition) {
            Optional<Room> room = ctx.world().room(condition.room());
            if (room.isEmpty()) {
                return missing("room", condition.room());
            }
            return room.get().isVisited();
        }

        @Override
        public Boolean visitGoalComplete(Condition.GoalComplete condition) {
            Optional<Goal> goal = ctx.world().goal(condition.goal());
            if (goal.isEmpty()) {
                return missing("goal", condition.goal());
            }
            return goalStatus(goal.get(), ctx) == GoalStatus.COMPLETE;
        }

        @Override
        public Boolean visitWithNpc(Condition.WithNpc condition) {
            Optional<Npc> npc = ctx.world().npc(condition.npc());
            if (npc.isEmpty()) {
                return missing("npc", condition.npc());
            }
            String room = npc.get().getRoom();
            return room != null && room.equals(ctx.world().getPlayer().getRoom());
        }

        @Override
        public Boolean visitNpcHasItem(Condition.NpcHasItem condition) {
            if (ctx.world().npc(condition.npc()).isEmpty()) {
                return missing("npc", condition.npc());
            }
            Optional<Item> item = ctx.world().item(condition.item());
            if (item.isEmpty()) {
                return missing("item", condition.item());
            }
            return item.get().getLocation().equals(Location.npc(condition.npc()));
        }

        @Override
        public Boolean visitNpcInState(Condition.NpcInState condition) {
            Optional<Npc> npc = ctx.world().npc(condition.npc());
            if (npc.isEmpty()) {
                return missing("npc", condition.npc());
            }
            return npc.get().getState().equalsIgnoreCase(condition.state());
        }

        @Override
        public Boolean visitEventMatches(Condition.EventMatches condition) {
            return condition.toMatcher().matches(ctx.event());
        }

        @Override
        public Boolean visitChance(Condition.Chance condition) {
            if (condition.oneIn() <= 1.0) {
                return true;
            }
            double roll = random.forKey(ctx.world(), ctx.nextDrawKey()).nextDouble();
            return roll < 1.0 / condition.oneIn();
        }

        /**
         * {@code name} matches a flag of that name; {@code name#n} matches a
         * sequence flag currently at step {@code n}.
         */
        private boolean hasFlag(String value) {
            int hash = value.indexOf('#');
            if (hash < 0) {
                return ctx.world().getPlayer().flag(value).isPresent();
            }
            String name = value.substring(0, hash);
            return ctx.world().getPlayer().flag(name)
                    .map(f -> f.value().equals(value))
                    .orElse(false);
        }
    }
}
