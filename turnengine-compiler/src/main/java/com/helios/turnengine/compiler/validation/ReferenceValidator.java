package com.helios.turnengine.compiler.validation;

import com.helios.turnengine.api.exceptions.CompilationException;
import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.ActionVisitor;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.ConditionVisitor;

import java.util.List;
import java.util.Set;

/**
 * Checks that every entity named by a condition or action tree is declared
 * in the bundle. Flags are not checked; they come into existence at runtime.
 *
 * <p>The first dangling reference aborts compilation with a message naming
 * the owner, e.g. {@code Trigger 'open-gate' references unknown room: vault}.
 */
public final class ReferenceValidator {

    private final KnownEntities known;

    public ReferenceValidator(KnownEntities known) {
        this.known = known;
    }

    public void validate(String owner, Condition condition) {
        if (condition != null) {
            condition.accept(new ConditionChecker(owner));
        }
    }

    public void validate(String owner, List<Action> actions) {
        ActionChecker checker = new ActionChecker(owner);
        for (Action action : actions) {
            if (action == null) {
                throw new CompilationException(owner + " has a null action");
            }
            action.accept(checker);
        }
    }

    private void require(String owner, String kind, Set<String> ids, String id) {
        if (id == null || !ids.contains(id)) {
            throw new CompilationException(owner + " references unknown " + kind + ": " + id);
        }
    }

    private void requireText(String owner, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new CompilationException(owner + " has missing or empty " + field);
        }
    }

    private final class ConditionChecker implements ConditionVisitor<Void> {
        private final String owner;

        ConditionChecker(String owner) {
            this.owner = owner;
        }

        @Override
        public Void visitAll(Condition.All c) {
            c.conditions().forEach(child -> child.accept(this));
            return null;
        }

        @Override
        public Void visitAny(Condition.Any c) {
            c.conditions().forEach(child -> child.accept(this));
            return null;
        }

        @Override
        public Void visitHasFlag(Condition.HasFlag c) {
            requireText(owner, "flag", c.flag());
            return null;
        }

        @Override
        public Void visitMissingFlag(Condition.MissingFlag c) {
            requireText(owner, "flag", c.flag());
            return null;
        }

        @Override
        public Void visitFlagInProgress(Condition.FlagInProgress c) {
            requireText(owner, "flag", c.flag());
            return null;
        }

        @Override
        public Void visitFlagComplete(Condition.FlagComplete c) {
            requireText(owner, "flag", c.flag());
            return null;
        }

        @Override
        public Void visitHasItem(Condition.HasItem c) {
            require(owner, "item", known.items(), c.item());
            return null;
        }

        @Override
        public Void visitMissingItem(Condition.MissingItem c) {
            require(owner, "item", known.items(), c.item());
            return null;
        }

        @Override
        public Void visitContainerHasItem(Condition.ContainerHasItem c) {
            require(owner, "item", known.items(), c.container());
            require(owner, "item", known.items(), c.item());
            return null;
        }

        @Override
        public Void visitInRoom(Condition.InRoom c) {
            require(owner, "room", known.rooms(), c.room());
            return null;
        }

        @Override
        public Void visitReachedRoom(Condition.ReachedRoom c) {
            require(owner, "room", known.rooms(), c.room());
            return null;
        }

        @Override
        public Void visitGoalComplete(Condition.GoalComplete c) {
            require(owner, "goal", known.goals(), c.goal());
            return null;
        }

        @Override
        public Void visitWithNpc(Condition.WithNpc c) {
            require(owner, "npc", known.npcs(), c.npc());
            return null;
        }

        @Override
        public Void visitNpcHasItem(Condition.NpcHasItem c) {
            require(owner, "npc", known.npcs(), c.npc());
            require(owner, "item", known.items(), c.item());
            return null;
        }

        @Override
        public Void visitNpcInState(Condition.NpcInState c) {
            require(owner, "npc", known.npcs(), c.npc());
            requireText(owner, "state", c.state());
            return null;
        }

        @Override
        public Void visitEventMatches(Condition.EventMatches c) {
            if (c.kind() == null) {
                throw new CompilationException(owner + " has event_matches without kind");
            }
            return null;
        }

        @Override
        public Void visitChance(Condition.Chance c) {
            if (!(c.oneIn() >= 1.0) || Double.isInfinite(c.oneIn())) {
                throw new CompilationException(owner + " has chance one_in " + c.oneIn() + "; must be at least 1");
            }
            return null;
        }
    }

    private final class ActionChecker implements ActionVisitor<Void> {
        private final String owner;

        ActionChecker(String owner) {
            this.owner = owner;
        }

        private Void room(String id) {
            require(owner, "room", known.rooms(), id);
            return null;
        }

        private Void item(String id) {
            require(owner, "item", known.items(), id);
            return null;
        }

        private Void npc(String id) {
            require(owner, "npc", known.npcs(), id);
            return null;
        }

        private Void flag(String name) {
            requireText(owner, "flag", name);
            return null;
        }

        @Override
        public Void visitShowMessage(Action.ShowMessage a) {
            requireText(owner, "text", a.text());
            return null;
        }

        @Override
        public Void visitNpcSays(Action.NpcSays a) {
            return npc(a.npc());
        }

        @Override
        public Void visitNpcSaysRandom(Action.NpcSaysRandom a) {
            return npc(a.npc());
        }

        @Override
        public Void visitSpinnerMessage(Action.SpinnerMessage a) {
            require(owner, "spinner", known.spinners(), a.spinner());
            return null;
        }

        @Override
        public Void visitAwardPoints(Action.AwardPoints a) {
            return null;
        }

        @Override
        public Void visitAddFlag(Action.AddFlag a) {
            if (a.limit() != null && a.limit() < 1) {
                throw new CompilationException(owner + " declares sequence flag '" + a.flag()
                        + "' with limit " + a.limit() + "; limit must be at least 1");
            }
            return flag(a.flag());
        }

        @Override
        public Void visitRemoveFlag(Action.RemoveFlag a) {
            return flag(a.flag());
        }

        @Override
        public Void visitAdvanceFlag(Action.AdvanceFlag a) {
            return flag(a.flag());
        }

        @Override
        public Void visitResetFlag(Action.ResetFlag a) {
            return flag(a.flag());
        }

        @Override
        public Void visitSpawnItemInRoom(Action.SpawnItemInRoom a) {
            item(a.item());
            return room(a.room());
        }

        @Override
        public Void visitSpawnItemCurrentRoom(Action.SpawnItemCurrentRoom a) {
            return item(a.item());
        }

        @Override
        public Void visitSpawnItemInInventory(Action.SpawnItemInInventory a) {
            return item(a.item());
        }

        @Override
        public Void visitSpawnItemInContainer(Action.SpawnItemInContainer a) {
            item(a.item());
            return item(a.container());
        }

        @Override
        public Void visitDespawnItem(Action.DespawnItem a) {
            return item(a.item());
        }

        @Override
        public Void visitReplaceItem(Action.ReplaceItem a) {
            item(a.oldItem());
            return item(a.newItem());
        }

        @Override
        public Void visitSetItemDescription(Action.SetItemDescription a) {
            return item(a.item());
        }

        @Override
        public Void visitGiveItemToPlayer(Action.GiveItemToPlayer a) {
            npc(a.npc());
            return item(a.item());
        }

        @Override
        public Void visitSetContainerState(Action.SetContainerState a) {
            return item(a.item());
        }

        @Override
        public Void visitLockItem(Action.LockItem a) {
            return item(a.item());
        }

        @Override
        public Void visitUnlockItem(Action.UnlockItem a) {
            return item(a.item());
        }

        @Override
        public Void visitRevealExit(Action.RevealExit a) {
            requireText(owner, "direction", a.direction());
            room(a.room());
            if (a.to() != null) {
                room(a.to());
            }
            return null;
        }

        @Override
        public Void visitLockExit(Action.LockExit a) {
            requireText(owner, "direction", a.direction());
            return room(a.room());
        }

        @Override
        public Void visitUnlockExit(Action.UnlockExit a) {
            requireText(owner, "direction", a.direction());
            return room(a.room());
        }

        @Override
        public Void visitPushPlayerTo(Action.PushPlayerTo a) {
            return room(a.room());
        }

        @Override
        public Void visitSetNpcState(Action.SetNpcState a) {
            requireText(owner, "state", a.state());
            return npc(a.npc());
        }

        @Override
        public Void visitPauseNpc(Action.PauseNpc a) {
            if (a.turns() < 1) {
                throw new CompilationException(owner + " pauses npc '" + a.npc() + "' for " + a.turns()
                        + " turn(s); pause must be at least 1");
            }
            return npc(a.npc());
        }

        @Override
        public Void visitSetNpcActive(Action.SetNpcActive a) {
            return npc(a.npc());
        }

        @Override
        public Void visitApplyStatus(Action.ApplyStatus a) {
            requireText(owner, "status name", a.name());
            if (a.turns() < 1) {
                throw new CompilationException(owner + " applies status '" + a.name()
                        + "' for " + a.turns() + " turn(s); duration must be at least 1");
            }
            return null;
        }

        @Override
        public Void visitRemoveStatus(Action.RemoveStatus a) {
            requireText(owner, "status name", a.name());
            return null;
        }

        @Override
        public Void visitSetTriggerEnabled(Action.SetTriggerEnabled a) {
            require(owner, "trigger", known.triggers(), a.trigger());
            return null;
        }

        @Override
        public Void visitScheduleIn(Action.ScheduleIn a) {
            if (a.turns() < 0) {
                throw new CompilationException(owner + " schedules an event with negative delay: " + a.turns());
            }
            validate(owner, a.condition());
            validate(owner, a.actions());
            return null;
        }

        @Override
        public Void visitScheduleAt(Action.ScheduleAt a) {
            if (a.turn() < 0) {
                throw new CompilationException(owner + " schedules an event at negative turn: " + a.turn());
            }
            validate(owner, a.condition());
            validate(owner, a.actions());
            return null;
        }
    }
}
