package com.helios.turnengine.compiler.normalize;

import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.ConditionVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges nested same-kind composites: {@code all(all(a, b), c)} becomes
 * {@code all(a, b, c)} and likewise for {@code any}. Mixed nesting such as
 * {@code all(any(a, b), c)} is left alone. The rewrite never changes the
 * truth value of the tree.
 */
public final class ConditionFlattener {

    private final FlattenVisitor visitor = new FlattenVisitor();

    public Condition flatten(Condition condition) {
        return condition == null ? null : condition.accept(visitor);
    }

    /**
     * Flattens the conditions carried by scheduling actions, recursing into
     * their nested action lists. Other actions are returned unchanged.
     */
    public Action flatten(Action action) {
        if (action instanceof Action.ScheduleIn in) {
            return new Action.ScheduleIn(in.turns(), flatten(in.condition()), in.onFalse(),
                    flattenActions(in.actions()), in.note());
        }
        if (action instanceof Action.ScheduleAt at) {
            return new Action.ScheduleAt(at.turn(), flatten(at.condition()), at.onFalse(),
                    flattenActions(at.actions()), at.note());
        }
        return action;
    }

    public List<Action> flattenActions(List<Action> actions) {
        List<Action> result = new ArrayList<>(actions.size());
        for (Action action : actions) {
            result.add(flatten(action));
        }
        return result;
    }

    /**
     * Number of nodes in a condition tree, composites included.
     */
    public static int countNodes(Condition condition) {
        if (condition == null) {
            return 0;
        }
        if (condition instanceof Condition.All all) {
            return 1 + all.conditions().stream().mapToInt(ConditionFlattener::countNodes).sum();
        }
        if (condition instanceof Condition.Any any) {
            return 1 + any.conditions().stream().mapToInt(ConditionFlattener::countNodes).sum();
        }
        return 1;
    }

    private static final class FlattenVisitor implements ConditionVisitor<Condition> {

        @Override
        public Condition visitAll(Condition.All condition) {
            List<Condition> merged = new ArrayList<>();
            for (Condition child : condition.conditions()) {
                Condition flat = child.accept(this);
                if (flat instanceof Condition.All nested) {
                    merged.addAll(nested.conditions());
                } else {
                    merged.add(flat);
                }
            }
            return new Condition.All(merged);
        }

        @Override
        public Condition visitAny(Condition.Any condition) {
            List<Condition> merged = new ArrayList<>();
            for (Condition child : condition.conditions()) {
                Condition flat = child.accept(this);
                if (flat instanceof Condition.Any nested) {
                    merged.addAll(nested.conditions());
                } else {
                    merged.add(flat);
                }
            }
            return new Condition.Any(merged);
        }

        // Leaves are already flat.

        @Override public Condition visitHasFlag(Condition.HasFlag c) { return c; }
        @Override public Condition visitMissingFlag(Condition.MissingFlag c) { return c; }
        @Override public Condition visitFlagInProgress(Condition.FlagInProgress c) { return c; }
        @Override public Condition visitFlagComplete(Condition.FlagComplete c) { return c; }
        @Override public Condition visitHasItem(Condition.HasItem c) { return c; }
        @Override public Condition visitMissingItem(Condition.MissingItem c) { return c; }
        @Override public Condition visitContainerHasItem(Condition.ContainerHasItem c) { return c; }
        @Override public Condition visitInRoom(Condition.InRoom c) { return c; }
        @Override public Condition visitReachedRoom(Condition.ReachedRoom c) { return c; }
        @Override public Condition visitGoalComplete(Condition.GoalComplete c) { return c; }
        @Override public Condition visitWithNpc(Condition.WithNpc c) { return c; }
        @Override public Condition visitNpcHasItem(Condition.NpcHasItem c) { return c; }
        @Override public Condition visitNpcInState(Condition.NpcInState c) { return c; }
        @Override public Condition visitEventMatches(Condition.EventMatches c) { return c; }
        @Override public Condition visitChance(Condition.Chance c) { return c; }
    }
}
