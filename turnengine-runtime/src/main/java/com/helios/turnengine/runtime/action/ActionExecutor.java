/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.action;

import com.helios.turnengine.api.exceptions.ActionException;
import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.ActionVisitor;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.OnFalsePolicy;
import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.infra.metrics.Counter;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.runtime.model.ContainerState;
import com.helios.turnengine.runtime.model.Exit;
import com.helios.turnengine.runtime.model.Flag;
import com.helios.turnengine.runtime.model.Item;
import com.helios.turnengine.runtime.model.Location;
import com.helios.turnengine.runtime.model.Npc;
import com.helios.turnengine.runtime.model.NpcMovement;
import com.helios.turnengine.runtime.model.Player;
import com.helios.turnengine.runtime.model.Room;
import com.helios.turnengine.runtime.model.StatusEffect;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.output.OutputBuffer;
import com.helios.turnengine.runtime.random.TurnRandom;
import com.helios.turnengine.runtime.scheduler.EventQueue;
import com.helios.turnengine.runtime.trigger.TriggerStateTable;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies action lists to the world, in order.
 *
 * <p>Failure policy is best-effort: an action that cannot be applied throws
 * {@link ActionException} from its handler, which is logged, counted and
 * skipped. Earlier actions are not rolled back and later ones still run.
 *
 * <p>{@code schedule_in}/{@code schedule_at} insert into the shared
 * {@link EventQueue}; the new event's due turn is relative to the world's
 * turn counter at the moment the action runs.
 *
 * <p>{@code spinner_message} and {@code npc_says_random} pick their line
 * through {@link TurnRandom}, keyed by the running trigger and the position
 * of the draw within the action list.
 */
public final class ActionExecutor {
    private static final Logger logger = Logger.getLogger(ActionExecutor.class.getName());

    static final String NPC_IGNORE_SPINNER = "npc_ignore";
    static final String DEFAULT_IGNORE_LINE = "Ignores you.";

    private final EventQueue queue;
    private final TriggerStateTable triggerStates;
    private final TurnRandom random;
    private final Counter actionFailures;

    public ActionExecutor(EventQueue queue, TriggerStateTable triggerStates, MetricsRegistry metrics,
                          TurnRandom random) {
        this.queue = queue;
        this.triggerStates = triggerStates;
        this.random = random;
        this.actionFailures = metrics.counter(MetricNames.ACTION_FAILURES);
    }

    public ActionExecutor(EventQueue queue, TriggerStateTable triggerStates, MetricsRegistry metrics) {
        this(queue, triggerStates, metrics, new TurnRandom(0L));
    }

    /**
     * Runs {@code actions} sequentially.
     *
     * @return number of actions that failed
     */
    public int execute(List<Action> actions, World world, OutputBuffer view, ActionContext context) {
        Handler handler = new Handler(world, view, context);
        int failures = 0;
        for (Action action : actions) {
            try {
                action.accept(handler);
            } catch (ActionException e) {
                failures++;
                actionFailures.increment();
                logger.log(Level.WARNING, String.format("Skipping %s action from %s: %s",
                        e.getActionType(), context.describe(), e.getMessage()));
            }
        }
        return failures;
    }

    public int execute(Action action, World world, OutputBuffer view, ActionContext context) {
        return execute(List.of(action), world, view, context);
    }

    private final class Handler implements ActionVisitor<Void> {
        private final World world;
        private final OutputBuffer view;
        private final ActionContext context;
        private int draws;

        Handler(World world, OutputBuffer view, ActionContext context) {
            this.world = world;
            this.view = view;
            this.context = context;
        }

        // ==================== Lookups ====================

        private Room room(String type, String id) {
            return world.room(id).orElseThrow(() -> new ActionException(type, "unknown room '" + id + "'"));
        }

        private Item item(String type, String id) {
            return world.item(id).orElseThrow(() -> new ActionException(type, "unknown item '" + id + "'"));
        }

        private Npc npc(String type, String id) {
            return world.npc(id).orElseThrow(() -> new ActionException(type, "unknown npc '" + id + "'"));
        }

        private Flag flag(String type, String name) {
            return world.getPlayer().flag(name)
                    .orElseThrow(() -> new ActionException(type, "player has no flag '" + name + "'"));
        }

        private Exit exit(String type, Room room, String direction) {
            return room.exit(direction).orElseThrow(() -> new ActionException(type,
                    "room '" + room.getId() + "' has no exit '" + direction + "'"));
        }

        private String pick(String kind, List<String> lines) {
            String origin = context.originTriggerId() == null ? "direct" : context.originTriggerId();
            String key = kind + ":" + origin + ":" + draws++;
            return lines.get(random.forKey(world, key).nextInt(lines.size()));
        }

        private Item container(String type, String id) {
            Item item = item(type, id);
            if (!item.isContainer()) {
                throw new ActionException(type, "item '" + id + "' is not a container");
            }
            return item;
        }

        // ==================== Output ====================

        @Override
        public Void visitShowMessage(Action.ShowMessage action) {
            view.push(context.messageTag(), action.text());
            return null;
        }

        @Override
        public Void visitNpcSays(Action.NpcSays action) {
            Npc npc = npc("npc_says", action.npc());
            view.push(OutputTag.NPC_SPEECH, npc.getName() + ": \"" + action.quote() + "\"");
            return null;
        }

        @Override
        public Void visitNpcSaysRandom(Action.NpcSaysRandom action) {
            Npc npc = npc("npc_says_random", action.npc());
            List<String> lines = npc.dialogueFor(npc.getState());
            String line;
            if (!lines.isEmpty()) {
                line = pick("dialogue:" + npc.getId(), lines);
            } else {
                logger.fine(() -> "No dialogue for npc '" + npc.getId() + "' in state '" + npc.getState() + "'");
                line = world.spinner(NPC_IGNORE_SPINNER)
                        .filter(ignore -> !ignore.isEmpty())
                        .map(ignore -> pick("spinner:" + NPC_IGNORE_SPINNER, ignore))
                        .orElse(DEFAULT_IGNORE_LINE);
            }
            view.push(OutputTag.NPC_SPEECH, npc.getName() + ": \"" + line + "\"");
            return null;
        }

        @Override
        public Void visitSpinnerMessage(Action.SpinnerMessage action) {
            List<String> lines = world.spinner(action.spinner())
                    .filter(l -> !l.isEmpty())
                    .orElseThrow(() -> new ActionException("spinner_message",
                            "unknown spinner '" + action.spinner() + "'"));
            String line = pick("spinner:" + action.spinner(), lines);
            if (!line.isEmpty()) {
                view.push(context.messageTag(), line);
            }
            return null;
        }

        @Override
        public Void visitAwardPoints(Action.AwardPoints action) {
            world.getPlayer().addScore(action.amount());
            String reason = action.reason() == null ? "" : " (" + action.reason() + ")";
            view.push(OutputTag.POINTS_AWARDED, String.format("%+d points%s", action.amount(), reason));
            return null;
        }

        // ==================== Flags ====================

        @Override
        public Void visitAddFlag(Action.AddFlag action) {
            Player player = world.getPlayer();
            if (player.flag(action.flag()).isPresent()) {
                logger.fine("Flag '" + action.flag() + "' already set");
                return null;
            }
            player.putFlag(action.limit() == null
                    ? Flag.simple(action.flag(), world.getTurnCount())
                    : Flag.sequence(action.flag(), action.limit(), world.getTurnCount()));
            return null;
        }

        @Override
        public Void visitRemoveFlag(Action.RemoveFlag action) {
            flag("remove_flag", action.flag());
            world.getPlayer().removeFlag(action.flag());
            return null;
        }

        @Override
        public Void visitAdvanceFlag(Action.AdvanceFlag action) {
            Flag flag = flag("advance_flag", action.flag());
            if (!flag.isSequence()) {
                throw new ActionException("advance_flag", "flag '" + action.flag() + "' is not a sequence flag");
            }
            world.getPlayer().putFlag(flag.advance());
            return null;
        }

        @Override
        public Void visitResetFlag(Action.ResetFlag action) {
            world.getPlayer().putFlag(flag("reset_flag", action.flag()).reset());
            return null;
        }

        // ==================== Items ====================

        @Override
        public Void visitSpawnItemInRoom(Action.SpawnItemInRoom action) {
            Item item = item("spawn_item_in_room", action.item());
            room("spawn_item_in_room", action.room());
            item.setLocation(Location.room(action.room()));
            return null;
        }

        @Override
        public Void visitSpawnItemCurrentRoom(Action.SpawnItemCurrentRoom action) {
            Item item = item("spawn_item_current_room", action.item());
            Room room = room("spawn_item_current_room", world.getPlayer().getRoom());
            item.setLocation(Location.room(room.getId()));
            return null;
        }

        @Override
        public Void visitSpawnItemInInventory(Action.SpawnItemInInventory action) {
            item("spawn_item_in_inventory", action.item()).setLocation(Location.inventory());
            return null;
        }

        @Override
        public Void visitSpawnItemInContainer(Action.SpawnItemInContainer action) {
            Item item = item("spawn_item_in_container", action.item());
            Item container = item("spawn_item_in_container", action.container());
            if (!container.isContainer()) {
                throw new ActionException("spawn_item_in_container",
                        "item '" + container.getId() + "' is not a container");
            }
            item.setLocation(Location.container(container.getId()));
            return null;
        }

        @Override
        public Void visitDespawnItem(Action.DespawnItem action) {
            item("despawn_item", action.item()).setLocation(Location.nowhere());
            return null;
        }

        @Override
        public Void visitReplaceItem(Action.ReplaceItem action) {
            Item oldItem = item("replace_item", action.oldItem());
            Item newItem = item("replace_item", action.newItem());
            if (oldItem == newItem) {
                throw new ActionException("replace_item", "item '" + oldItem.getId() + "' cannot replace itself");
            }
            newItem.setLocation(oldItem.getLocation());
            oldItem.setLocation(Location.nowhere());
            return null;
        }

        @Override
        public Void visitSetItemDescription(Action.SetItemDescription action) {
            item("set_item_description", action.item()).setDescription(action.text());
            return null;
        }

        @Override
        public Void visitGiveItemToPlayer(Action.GiveItemToPlayer action) {
            Npc npc = npc("give_item_to_player", action.npc());
            Item item = item("give_item_to_player", action.item());
            if (!item.getLocation().equals(Location.npc(npc.getId()))) {
                throw new ActionException("give_item_to_player",
                        "npc '" + npc.getId() + "' does not hold item '" + item.getId() + "'");
            }
            item.setLocation(Location.inventory());
            return null;
        }

        @Override
        public Void visitSetContainerState(Action.SetContainerState action) {
            item("set_container_state", action.item()).setContainerState(action.state());
            return null;
        }

        @Override
        public Void visitLockItem(Action.LockItem action) {
            container("lock_item", action.item()).setContainerState(ContainerState.LOCKED);
            return null;
        }

        @Override
        public Void visitUnlockItem(Action.UnlockItem action) {
            Item item = container("unlock_item", action.item());
            if (item.getContainerState() != ContainerState.LOCKED) {
                throw new ActionException("unlock_item", "container '" + item.getId() + "' is not locked");
            }
            item.setContainerState(ContainerState.OPEN);
            return null;
        }

        // ==================== Exits ====================

        @Override
        public Void visitRevealExit(Action.RevealExit action) {
            Room room = room("reveal_exit", action.room());
            Exit existing = room.exit(action.direction()).orElse(null);
            if (existing != null) {
                room.putExit(action.direction(), existing.withHidden(false));
                return null;
            }
            if (action.to() == null) {
                throw new ActionException("reveal_exit", "room '" + room.getId() + "' has no exit '"
                        + action.direction() + "' and no destination was given");
            }
            room("reveal_exit", action.to());
            room.putExit(action.direction(), new Exit(action.to(), false, false));
            return null;
        }

        @Override
        public Void visitLockExit(Action.LockExit action) {
            Room room = room("lock_exit", action.room());
            room.putExit(action.direction(), exit("lock_exit", room, action.direction()).withLocked(true));
            return null;
        }

        @Override
        public Void visitUnlockExit(Action.UnlockExit action) {
            Room room = room("unlock_exit", action.room());
            room.putExit(action.direction(), exit("unlock_exit", room, action.direction()).withLocked(false));
            return null;
        }

        // ==================== Player and NPCs ====================

        @Override
        public Void visitPushPlayerTo(Action.PushPlayerTo action) {
            Room room = room("push_player_to", action.room());
            world.getPlayer().setRoom(room.getId());
            room.setVisited(true);
            return null;
        }

        @Override
        public Void visitSetNpcState(Action.SetNpcState action) {
            npc("set_npc_state", action.npc()).setState(action.state());
            return null;
        }

        @Override
        public Void visitPauseNpc(Action.PauseNpc action) {
            NpcMovement movement = movement("pause_npc", action.npc());
            movement.setPausedUntil(world.getTurnCount() + Math.max(action.turns(), 0));
            return null;
        }

        @Override
        public Void visitSetNpcActive(Action.SetNpcActive action) {
            NpcMovement movement = movement("set_npc_active", action.npc());
            movement.setActive(action.active());
            return null;
        }

        private NpcMovement movement(String type, String npcId) {
            Npc npc = npc(type, npcId);
            if (npc.getMovement() == null) {
                throw new ActionException(type, "npc '" + npcId + "' has no movement");
            }
            return npc.getMovement();
        }

        @Override
        public Void visitApplyStatus(Action.ApplyStatus action) {
            world.getPlayer().applyEffect(new StatusEffect(action.name(), action.hpPerTurn(), action.turns()));
            return null;
        }

        @Override
        public Void visitRemoveStatus(Action.RemoveStatus action) {
            if (!world.getPlayer().removeEffect(action.name())) {
                logger.fine("Status '" + action.name() + "' was not active");
            }
            return null;
        }

        @Override
        public Void visitSetTriggerEnabled(Action.SetTriggerEnabled action) {
            if (!triggerStates.setEnabled(action.trigger(), action.enabled())) {
                throw new ActionException("set_trigger_enabled", "unknown trigger '" + action.trigger() + "'");
            }
            return null;
        }

        // ==================== Scheduling ====================

        @Override
        public Void visitScheduleIn(Action.ScheduleIn action) {
            int turns = action.turns();
            if (turns < 0) {
                logger.warning("schedule_in with negative delay " + turns + " from " + context.describe()
                        + "; scheduling for the current turn");
                turns = 0;
            }
            schedule(world.getTurnCount() + turns, action.condition(), action.onFalse(),
                    action.actions(), action.note());
            return null;
        }

        @Override
        public Void visitScheduleAt(Action.ScheduleAt action) {
            long due = action.turn();
            if (due < world.getTurnCount()) {
                logger.info("schedule_at turn " + due + " is in the past; scheduling for turn "
                        + world.getTurnCount());
                due = world.getTurnCount();
            }
            schedule(due, action.condition(), action.onFalse(), action.actions(), action.note());
            return null;
        }

        private void schedule(long dueTurn, Condition condition, OnFalsePolicy onFalse,
                              List<Action> actions, String note) {
            long id = queue.insert(dueTurn, condition, actions, onFalse, context.originTriggerId(), note);
            logger.fine(() -> String.format("Scheduled event #%d for turn %d from %s",
                    id, dueTurn, context.describe()));
        }
    }
}
