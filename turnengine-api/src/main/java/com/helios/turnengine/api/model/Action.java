package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.helios.turnengine.runtime.model.ContainerState;

import java.util.List;

/**
 * A single world mutation in an authored action list.
 *
 * <p>Like {@link Condition}, the vocabulary is closed and dispatched through
 * {@link ActionVisitor}. Actions carry entity ids only; resolution happens at
 * execution time so a dangling id fails that one action and nothing else.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Action.ShowMessage.class, name = "show_message"),
        @JsonSubTypes.Type(value = Action.NpcSays.class, name = "npc_says"),
        @JsonSubTypes.Type(value = Action.NpcSaysRandom.class, name = "npc_says_random"),
        @JsonSubTypes.Type(value = Action.SpinnerMessage.class, name = "spinner_message"),
        @JsonSubTypes.Type(value = Action.AwardPoints.class, name = "award_points"),
        @JsonSubTypes.Type(value = Action.AddFlag.class, name = "add_flag"),
        @JsonSubTypes.Type(value = Action.RemoveFlag.class, name = "remove_flag"),
        @JsonSubTypes.Type(value = Action.AdvanceFlag.class, name = "advance_flag"),
        @JsonSubTypes.Type(value = Action.ResetFlag.class, name = "reset_flag"),
        @JsonSubTypes.Type(value = Action.SpawnItemInRoom.class, name = "spawn_item_in_room"),
        @JsonSubTypes.Type(value = Action.SpawnItemCurrentRoom.class, name = "spawn_item_current_room"),
        @JsonSubTypes.Type(value = Action.SpawnItemInInventory.class, name = "spawn_item_in_inventory"),
        @JsonSubTypes.Type(value = Action.SpawnItemInContainer.class, name = "spawn_item_in_container"),
        @JsonSubTypes.Type(value = Action.DespawnItem.class, name = "despawn_item"),
        @JsonSubTypes.Type(value = Action.ReplaceItem.class, name = "replace_item"),
        @JsonSubTypes.Type(value = Action.SetItemDescription.class, name = "set_item_description"),
        @JsonSubTypes.Type(value = Action.GiveItemToPlayer.class, name = "give_item_to_player"),
        @JsonSubTypes.Type(value = Action.SetContainerState.class, name = "set_container_state"),
        @JsonSubTypes.Type(value = Action.LockItem.class, name = "lock_item"),
        @JsonSubTypes.Type(value = Action.UnlockItem.class, name = "unlock_item"),
        @JsonSubTypes.Type(value = Action.RevealExit.class, name = "reveal_exit"),
        @JsonSubTypes.Type(value = Action.LockExit.class, name = "lock_exit"),
        @JsonSubTypes.Type(value = Action.UnlockExit.class, name = "unlock_exit"),
        @JsonSubTypes.Type(value = Action.PushPlayerTo.class, name = "push_player_to"),
        @JsonSubTypes.Type(value = Action.SetNpcState.class, name = "set_npc_state"),
        @JsonSubTypes.Type(value = Action.PauseNpc.class, name = "pause_npc"),
        @JsonSubTypes.Type(value = Action.SetNpcActive.class, name = "set_npc_active"),
        @JsonSubTypes.Type(value = Action.ApplyStatus.class, name = "apply_status"),
        @JsonSubTypes.Type(value = Action.RemoveStatus.class, name = "remove_status"),
        @JsonSubTypes.Type(value = Action.SetTriggerEnabled.class, name = "set_trigger_enabled"),
        @JsonSubTypes.Type(value = Action.ScheduleIn.class, name = "schedule_in"),
        @JsonSubTypes.Type(value = Action.ScheduleAt.class, name = "schedule_at")
})
public sealed interface Action {

    <R> R accept(ActionVisitor<R> visitor);

    record ShowMessage(@JsonProperty("text") String text) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitShowMessage(this);
        }
    }

    record NpcSays(
            @JsonProperty("npc") String npc,
            @JsonProperty("quote") String quote) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitNpcSays(this);
        }
    }

    /** Says a random line from the NPC's dialogue for its current state. */
    record NpcSaysRandom(@JsonProperty("npc") String npc) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitNpcSaysRandom(this);
        }
    }

    /** Shows a random line from a world spinner; an empty line shows nothing. */
    record SpinnerMessage(@JsonProperty("spinner") String spinner) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSpinnerMessage(this);
        }
    }

    record AwardPoints(
            @JsonProperty("amount") int amount,
            @JsonProperty("reason") String reason) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitAwardPoints(this);
        }
    }

    /** Sets a flag. A non-null {@code limit} makes it a sequence flag starting at step 0. */
    record AddFlag(
            @JsonProperty("flag") String flag,
            @JsonProperty("limit") Integer limit) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitAddFlag(this);
        }
    }

    record RemoveFlag(@JsonProperty("flag") String flag) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitRemoveFlag(this);
        }
    }

    record AdvanceFlag(@JsonProperty("flag") String flag) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitAdvanceFlag(this);
        }
    }

    record ResetFlag(@JsonProperty("flag") String flag) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitResetFlag(this);
        }
    }

    record SpawnItemInRoom(
            @JsonProperty("item") String item,
            @JsonProperty("room") String room) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSpawnItemInRoom(this);
        }
    }

    record SpawnItemCurrentRoom(@JsonProperty("item") String item) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSpawnItemCurrentRoom(this);
        }
    }

    record SpawnItemInInventory(@JsonProperty("item") String item) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSpawnItemInInventory(this);
        }
    }

    record SpawnItemInContainer(
            @JsonProperty("item") String item,
            @JsonProperty("container") String container) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSpawnItemInContainer(this);
        }
    }

    record DespawnItem(@JsonProperty("item") String item) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitDespawnItem(this);
        }
    }

    /** Puts {@code newItem} where {@code oldItem} was and moves the old one nowhere. */
    record ReplaceItem(
            @JsonProperty("old_item") String oldItem,
            @JsonProperty("new_item") String newItem) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitReplaceItem(this);
        }
    }

    record SetItemDescription(
            @JsonProperty("item") String item,
            @JsonProperty("text") String text) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSetItemDescription(this);
        }
    }

    record GiveItemToPlayer(
            @JsonProperty("npc") String npc,
            @JsonProperty("item") String item) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitGiveItemToPlayer(this);
        }
    }

    /**
     * Sets a container's state. A null {@code state} turns the item back
     * into a plain item.
     */
    record SetContainerState(
            @JsonProperty("item") String item,
            @JsonProperty("state") ContainerState state) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSetContainerState(this);
        }
    }

    record LockItem(@JsonProperty("item") String item) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitLockItem(this);
        }
    }

    /** Opens a locked container. */
    record UnlockItem(@JsonProperty("item") String item) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitUnlockItem(this);
        }
    }

    /** Unhides an existing exit, or creates it leading to {@code to}. */
    record RevealExit(
            @JsonProperty("room") String room,
            @JsonProperty("direction") String direction,
            @JsonProperty("to") String to) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitRevealExit(this);
        }
    }

    record LockExit(
            @JsonProperty("room") String room,
            @JsonProperty("direction") String direction) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitLockExit(this);
        }
    }

    record UnlockExit(
            @JsonProperty("room") String room,
            @JsonProperty("direction") String direction) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitUnlockExit(this);
        }
    }

    record PushPlayerTo(@JsonProperty("room") String room) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitPushPlayerTo(this);
        }
    }

    record SetNpcState(
            @JsonProperty("npc") String npc,
            @JsonProperty("state") String state) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSetNpcState(this);
        }
    }

    /** Holds a moving NPC in place for {@code turns} turns. */
    record PauseNpc(
            @JsonProperty("npc") String npc,
            @JsonProperty("turns") int turns) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitPauseNpc(this);
        }
    }

    record SetNpcActive(
            @JsonProperty("npc") String npc,
            @JsonProperty("active") boolean active) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSetNpcActive(this);
        }
    }

    record ApplyStatus(
            @JsonProperty("name") String name,
            @JsonProperty("hp_per_turn") int hpPerTurn,
            @JsonProperty("turns") int turns) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitApplyStatus(this);
        }
    }

    record RemoveStatus(@JsonProperty("name") String name) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitRemoveStatus(this);
        }
    }

    record SetTriggerEnabled(
            @JsonProperty("trigger") String trigger,
            @JsonProperty("enabled") boolean enabled) implements Action {
        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitSetTriggerEnabled(this);
        }
    }

    /**
     * Schedules {@code actions} to run {@code turns} after the current turn,
     * gated by {@code condition} and resolved by {@code onFalse}.
     */
    record ScheduleIn(
            @JsonProperty("turns") int turns,
            @JsonProperty("condition") Condition condition,
            @JsonProperty("on_false") OnFalsePolicy onFalse,
            @JsonProperty("actions") List<Action> actions,
            @JsonProperty("note") String note) implements Action {

        public ScheduleIn {
            actions = actions == null ? List.of() : List.copyOf(actions);
        }

        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitScheduleIn(this);
        }
    }

    /** Same as {@link ScheduleIn} but on an absolute turn. */
    record ScheduleAt(
            @JsonProperty("turn") long turn,
            @JsonProperty("condition") Condition condition,
            @JsonProperty("on_false") OnFalsePolicy onFalse,
            @JsonProperty("actions") List<Action> actions,
            @JsonProperty("note") String note) implements Action {

        public ScheduleAt {
            actions = actions == null ? List.of() : List.copyOf(actions);
        }

        @Override
        public <R> R accept(ActionVisitor<R> visitor) {
            return visitor.visitScheduleAt(this);
        }
    }
}
