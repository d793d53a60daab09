package com.helios.turnengine.api.model;

/**
 * Visitor over the closed {@link Condition} vocabulary.
 *
 * @param <R> result type
 */
public interface ConditionVisitor<R> {
    R visitAll(Condition.All condition);
    R visitAny(Condition.Any condition);
    R visitHasFlag(Condition.HasFlag condition);
    R visitMissingFlag(Condition.MissingFlag condition);
    R visitFlagInProgress(Condition.FlagInProgress condition);
    R visitFlagComplete(Condition.FlagComplete condition);
    R visitHasItem(Condition.HasItem condition);
    R visitMissingItem(Condition.MissingItem condition);
    R visitContainerHasItem(Condition.ContainerHasItem condition);
    R visitInRoom(Condition.InRoom condition);
    R visitReachedRoom(Condition.ReachedRoom condition);
    R visitGoalComplete(Condition.GoalComplete condition);
    R visitWithNpc(Condition.WithNpc condition);
    R visitNpcHasItem(Condition.NpcHasItem condition);
    R visitNpcInState(Condition.NpcInState condition);
    R visitEventMatches(Condition.EventMatches condition);
    R visitChance(Condition.Chance condition);
}
