package com.helios.turnengine.service.dev;

import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.api.model.PendingEventView;
import com.helios.turnengine.api.model.TriggerState;
import com.helios.turnengine.infra.metrics.MetricsRegistry;
import com.helios.turnengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.turnengine.runtime.model.Flag;
import com.helios.turnengine.runtime.model.GoalStatus;
import com.helios.turnengine.runtime.model.Npc;
import com.helios.turnengine.runtime.output.OutputBuffer;
import com.helios.turnengine.runtime.session.TurnEngine;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Colon-prefixed developer commands for play-testing a session.
 *
 * <p>Results go to the session's output buffer: listings and confirmations
 * as {@link OutputTag#ENGINE_MESSAGE}, problems as {@link OutputTag#ERROR}.
 * None of these commands advance the turn.
 *
 * <ul>
 *   <li>{@code :sched} / {@code :schedule} lists pending scheduled events</li>
 *   <li>{@code :sched cancel <id>}</li>
 *   <li>{@code :sched delay <id> <turns>}</li>
 *   <li>{@code :triggers}, {@code :flags}, {@code :goals}, {@code :npcs}</li>
 *   <li>{@code :metrics} lists counters and gauges when metrics are kept in memory</li>
 *   <li>{@code :spawn <item>}, {@code :port <room>}</li>
 *   <li>{@code :set-flag <flag>}, {@code :init-seq <flag> <limit>},
 *       {@code :adv-seq <flag>}, {@code :reset-seq <flag>}</li>
 * </ul>
 */
public class DevConsole {
    private static final Logger logger = Logger.getLogger(DevConsole.class.getName());

    private final TurnEngine engine;
    private final MetricsRegistry metrics;

    public DevConsole(TurnEngine engine, MetricsRegistry metrics) {
        this.engine = engine;
        this.metrics = metrics;
    }

    public DevConsole(TurnEngine engine) {
        this(engine, MetricsRegistry.getInstance());
    }

    /**
     * @return false when {@code input} is not a developer command
     */
    public boolean handle(String input) {
        String trimmed = input == null ? "" : input.trim();
        if (!trimmed.startsWith(":")) {
            return false;
        }
        OutputBuffer view = engine.view();
        if (!engine.config().isDevCommandsEnabled()) {
            view.push(OutputTag.ERROR, "Developer commands are disabled.");
            logger.warning("Rejected developer command while disabled: " + trimmed);
            return true;
        }

        String[] words = trimmed.substring(1).trim().split("\\s+");
        logger.info("Developer command: " + trimmed);
        switch (words[0]) {
            case "sched":
            case "schedule":
                schedule(Arrays.copyOfRange(words, 1, words.length), view);
                break;
            case "triggers":
                listTriggers(view);
                break;
            case "flags":
                listFlags(view);
                break;
            case "goals":
                listGoals(view);
                break;
            case "npcs":
                listNpcs(view);
                break;
            case "metrics":
                listMetrics(view);
                break;
            case "spawn":
            case "item":
                withArgument(words, view, "Usage: :spawn <item>",
                        item -> apply(new Action.SpawnItemInInventory(item), "Spawned " + item + ".", view));
                break;
            case "port":
            case "teleport":
                withArgument(words, view, "Usage: :port <room>",
                        room -> apply(new Action.PushPlayerTo(room), "Moved to " + room + ".", view));
                break;
            case "set-flag":
                withArgument(words, view, "Usage: :set-flag <flag>",
                        flag -> apply(new Action.AddFlag(flag, null), "Flag " + flag + " set.", view));
                break;
            case "init-seq":
                initSequence(words, view);
                break;
            case "adv-seq":
                withArgument(words, view, "Usage: :adv-seq <flag>",
                        flag -> apply(new Action.AdvanceFlag(flag), "Sequence " + flag + " advanced.", view));
                break;
            case "reset-seq":
                withArgument(words, view, "Usage: :reset-seq <flag>",
                        flag -> apply(new Action.ResetFlag(flag), "Sequence " + flag + " reset.", view));
                break;
            default:
                view.push(OutputTag.ERROR, "Unknown developer command: " + trimmed);
        }
        return true;
    }

    // ==================== Scheduler ====================

    private void schedule(String[] args, OutputBuffer view) {
        if (args.length == 0) {
            List<PendingEventView> pending = engine.listPending();
            if (pending.isEmpty()) {
                view.push(OutputTag.ENGINE_MESSAGE, "No scheduled events.");
                return;
            }
            view.push(OutputTag.ENGINE_MESSAGE, "Scheduled events (" + pending.size() + "):");
            for (PendingEventView event : pending) {
                view.push(OutputTag.ENGINE_MESSAGE, event.toString());
            }
            return;
        }

        if (args[0].equals("cancel") && args.length == 2) {
            Long id = parseLong(args[1]);
            if (id == null) {
                view.push(OutputTag.ERROR, "Invalid id '" + args[1] + "' for :sched cancel.");
            } else if (engine.cancelScheduled(id)) {
                view.push(OutputTag.ENGINE_MESSAGE, "Scheduled event " + id + " canceled.");
            } else {
                view.push(OutputTag.ERROR, noSuchEvent(id));
            }
            return;
        }

        if (args[0].equals("delay") && args.length == 3) {
            Long id = parseLong(args[1]);
            Long turns = parseLong(args[2]);
            if (id == null || turns == null || turns < 0 || turns > Integer.MAX_VALUE) {
                view.push(OutputTag.ERROR, "Usage: :sched delay <id> <+turns>");
                return;
            }
            OptionalLong newId = engine.delayScheduled(id, turns.intValue());
            if (newId.isPresent()) {
                view.push(OutputTag.ENGINE_MESSAGE, String.format(
                        "Scheduled event %d delayed by %d turn(s) (now #%d).", id, turns, newId.getAsLong()));
            } else {
                view.push(OutputTag.ERROR, noSuchEvent(id));
            }
            return;
        }

        view.push(OutputTag.ERROR, "Usage: :sched [cancel <id> | delay <id> <+turns>]");
    }

    static String noSuchEvent(long id) {
        return "No scheduled event found with id " + id + ".";
    }

    // ==================== Listings ====================

    private void listTriggers(OutputBuffer view) {
        Map<String, TriggerState> states = engine.triggerStates();
        view.push(OutputTag.ENGINE_MESSAGE, "Triggers (" + states.size() + "):");
        states.forEach((id, state) -> view.push(OutputTag.ENGINE_MESSAGE, String.format(
                "%s: %s, fired %d time(s)%s", id,
                state.enabled() ? "enabled" : "disabled",
                state.fireCount(),
                state.fired() ? " (last on turn " + state.lastFiredTurn() + ")" : "")));
    }

    private void listFlags(OutputBuffer view) {
        Collection<Flag> flags = engine.world().getPlayer().getFlags();
        if (flags.isEmpty()) {
            view.push(OutputTag.ENGINE_MESSAGE, "No flags set.");
            return;
        }
        for (Flag flag : flags) {
            String detail = flag.isSequence()
                    ? String.format(" (step %d of %d)", flag.step(), flag.limit())
                    : "";
            view.push(OutputTag.ENGINE_MESSAGE, flag.value() + detail);
        }
    }

    private void listGoals(OutputBuffer view) {
        Map<String, GoalStatus> statuses = engine.goalStatuses();
        if (statuses.isEmpty()) {
            view.push(OutputTag.ENGINE_MESSAGE, "No goals defined.");
            return;
        }
        statuses.forEach((id, status) -> view.push(OutputTag.ENGINE_MESSAGE, id + ": " + status));
    }

    private void listNpcs(OutputBuffer view) {
        for (Npc npc : engine.world().getNpcs()) {
            view.push(OutputTag.ENGINE_MESSAGE, String.format("%s (%s) in %s, state %s",
                    npc.getName(), npc.getId(), npc.getRoom(), npc.getState()));
        }
    }

    private void listMetrics(OutputBuffer view) {
        if (!(metrics instanceof InMemoryMetricsRegistry)) {
            view.push(OutputTag.ERROR, "Metrics are not kept in memory for this session.");
            return;
        }
        InMemoryMetricsRegistry registry = (InMemoryMetricsRegistry) metrics;
        Map<String, Long> counters = registry.getCounterValues();
        Map<String, Double> gauges = registry.getGaugeValues();
        if (counters.isEmpty() && gauges.isEmpty()) {
            view.push(OutputTag.ENGINE_MESSAGE, "No metrics recorded.");
            return;
        }
        counters.forEach((name, count) -> view.push(OutputTag.ENGINE_MESSAGE, name + " = " + count));
        gauges.forEach((name, value) -> view.push(OutputTag.ENGINE_MESSAGE,
                String.format("%s = %.0f", name, value)));
    }

    // ==================== Helpers ====================

    private void initSequence(String[] words, OutputBuffer view) {
        Long limit = words.length == 3 ? parseLong(words[2]) : null;
        if (limit == null || limit < 1 || limit > Integer.MAX_VALUE) {
            view.push(OutputTag.ERROR, "Usage: :init-seq <flag> <limit>");
            return;
        }
        apply(new Action.AddFlag(words[1], limit.intValue()), "Sequence " + words[1] + " started.", view);
    }

    private void withArgument(String[] words, OutputBuffer view, String usage,
                              Consumer<String> command) {
        if (words.length != 2) {
            view.push(OutputTag.ERROR, usage);
            return;
        }
        command.accept(words[1]);
    }

    private void apply(Action action, String confirmation, OutputBuffer view) {
        if (engine.apply(action)) {
            view.push(OutputTag.ENGINE_MESSAGE, confirmation);
        } else {
            view.push(OutputTag.ERROR, "Command failed; see the log for details.");
        }
    }

    private static Long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
