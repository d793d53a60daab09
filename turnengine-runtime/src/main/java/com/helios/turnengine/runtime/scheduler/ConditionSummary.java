package com.helios.turnengine.runtime.scheduler;

import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.ConditionVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One-line rendering of a condition for the developer queue listing,
 * e.g. {@code all(hasFlag:lamp, inRoom:cellar)}.
 */
final class ConditionSummary implements ConditionVisitor<String> {

    private static final ConditionSummary INSTANCE = new ConditionSummary();

    static String describe(Condition condition) {
        if (condition == null) {
            return "always";
        }
        return condition.accept(INSTANCE);
    }

    private String join(String name, List<Condition> children) {
        if (children.isEmpty()) {
            return name.equals("all") ? "always" : "never";
        }
        return children.stream().map(c -> c.accept(this)).collect(Collectors.joining(", ", name + "(", ")"));
    }

    @Override public String visitAll(Condition.All c) { return join("all", c.conditions()); }
    @Override public String visitAny(Condition.Any c) { return join("any", c.conditions()); }
    @Override public String visitHasFlag(Condition.HasFlag c) { return "hasFlag:" + c.flag(); }
    @Override public String visitMissingFlag(Condition.MissingFlag c) { return "missingFlag:" + c.flag(); }
    @Override public String visitFlagInProgress(Condition.FlagInProgress c) { return "flagInProgress:" + c.flag(); }
    @Override public String visitFlagComplete(Condition.FlagComplete c) { return "flagComplete:" + c.flag(); }
    @Override public String visitHasItem(Condition.HasItem c) { return "hasItem:" + c.item(); }
    @Override public String visitMissingItem(Condition.MissingItem c) { return "missingItem:" + c.item(); }
    @Override public String visitContainerHasItem(Condition.ContainerHasItem c) { return "containerHasItem:" + c.container() + "/" + c.item(); }
    @Override public String visitInRoom(Condition.InRoom c) { return "inRoom:" + c.room(); }
    @Override public String visitReachedRoom(Condition.ReachedRoom c) { return "reachedRoom:" + c.room(); }
    @Override public String visitGoalComplete(Condition.GoalComplete c) { return "goalComplete:" + c.goal(); }
    @Override public String visitWithNpc(Condition.WithNpc c) { return "withNpc:" + c.npc(); }
    @Override public String visitNpcHasItem(Condition.NpcHasItem c) { return "npcHasItem:" + c.npc() + "/" + c.item(); }
    @Override public String visitNpcInState(Condition.NpcInState c) { return "npcInState:" + c.npc() + "=" + c.state(); }
    @Override public String visitEventMatches(Condition.EventMatches c) { return "event:" + c.kind(); }
    @Override public String visitChance(Condition.Chance c) { return "chance:1/" + c.oneIn(); }
}
