/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.turnengine.api.CompilationListener;
import com.helios.turnengine.api.ITriggerCompiler;
import com.helios.turnengine.api.exceptions.CompilationException;
import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.BundleDefinition;
import com.helios.turnengine.api.model.TriggerDefinition;
import com.helios.turnengine.api.model.WorldDefinition;
import com.helios.turnengine.compiler.normalize.ConditionFlattener;
import com.helios.turnengine.compiler.validation.KnownEntities;
import com.helios.turnengine.compiler.validation.ReferenceValidator;
import com.helios.turnengine.infra.telemetry.TracingService;
import com.helios.turnengine.runtime.model.Exit;
import com.helios.turnengine.runtime.model.GameModel;
import com.helios.turnengine.runtime.model.Goal;
import com.helios.turnengine.runtime.model.Item;
import com.helios.turnengine.runtime.model.Location;
import com.helios.turnengine.runtime.model.ModelStats;
import com.helios.turnengine.runtime.model.Npc;
import com.helios.turnengine.runtime.model.Player;
import com.helios.turnengine.runtime.model.Room;
import com.helios.turnengine.runtime.model.World;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles a JSON game bundle into an immutable {@link GameModel}.
 *
 * The compilation process has four stages:
 * 1. PARSING: read the JSON document into {@link BundleDefinition}.
 * 2. VALIDATION: reject duplicate ids, missing events and dangling entity
 *    references anywhere in the world or trigger data.
 * 3. NORMALIZATION: flatten nested all/any conditions in triggers, scheduled
 *    actions and goals.
 * 4. INDEXING: build the prototype world and assemble the model.
 *
 * Any structural problem raises {@link CompilationException} before a world
 * exists, so a loaded model is always playable.
 */
public class TriggerCompiler implements ITriggerCompiler {
    private static final Logger logger = Logger.getLogger(TriggerCompiler.class.getName());

    private static final int TOTAL_STAGES = 4;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ConditionFlattener flattener = new ConditionFlattener();
    private Tracer tracer;
    private CompilationListener listener;

    /**
     * Used by {@link java.util.ServiceLoader}; traces nothing until
     * {@link #setTracer(Tracer)} is called.
     */
    public TriggerCompiler() {
        this(OpenTelemetry.noop().getTracer(TracingService.INSTRUMENTATION_NAME));
    }

    public TriggerCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public GameModel compile(Path bundlePath) throws IOException, CompilationException {
        Span span = tracer.spanBuilder("compile-bundle").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("bundlePath", bundlePath.toString());
            String content = Files.readString(bundlePath);
            BundleDefinition bundle = stage("PARSING", 1, () -> parse(content),
                    b -> Map.of("triggerCount", b.triggers().size()));
            return compileParsed(bundle, span);
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public GameModel compile(BundleDefinition bundle) throws CompilationException {
        Span span = tracer.spanBuilder("compile-bundle").startSpan();
        try (Scope scope = span.makeCurrent()) {
            return compileParsed(bundle, span);
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private GameModel compileParsed(BundleDefinition bundle, Span span) {
        long startTime = System.nanoTime();
        if (bundle == null || bundle.world() == null) {
            throw new CompilationException("Bundle is missing its world definition");
        }

        stage("VALIDATION", 2, () -> {
            validate(bundle);
            return bundle;
        }, b -> Map.of("rooms", b.world().rooms().size(), "items", b.world().items().size()));

        int nodesBefore = countConditionNodes(bundle.triggers());
        List<TriggerDefinition> triggers = stage("NORMALIZATION", 3, () -> normalize(bundle.triggers()),
                t -> Map.of("conditionNodesBefore", nodesBefore,
                        "conditionNodesAfter", countConditionNodes(t)));
        int nodesAfter = countConditionNodes(triggers);

        World prototype = stage("INDEXING", 4, () -> buildWorld(bundle.world()),
                w -> Map.of("npcs", w.getNpcs().size(), "goals", w.getGoals().size()));

        long compilationTime = System.nanoTime() - startTime;
        span.setAttribute("triggerCount", triggers.size());
        span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("rooms", bundle.world().rooms().size());
        metadata.put("items", bundle.world().items().size());
        metadata.put("npcs", bundle.world().npcs().size());
        metadata.put("goals", bundle.world().goals().size());

        logger.info(String.format("Compiled %d trigger(s), %d room(s) in %d ms (condition nodes %d -> %d)",
                triggers.size(), bundle.world().rooms().size(),
                TimeUnit.NANOSECONDS.toMillis(compilationTime), nodesBefore, nodesAfter));

        return new GameModel(prototype, triggers,
                new ModelStats(triggers.size(), nodesBefore, nodesAfter, compilationTime, metadata));
    }

    // ==================== Stage plumbing ====================

    private <T> T stage(String name, int number, Supplier<T> body,
                        Function<T, Map<String, Object>> metrics) {
        Span span = tracer.spanBuilder("compile-" + name.toLowerCase()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (listener != null) {
                listener.onStageStart(name, number, TOTAL_STAGES);
            }
            long start = System.nanoTime();
            T result = body.get();
            if (listener != null) {
                listener.onStageComplete(name, new CompilationListener.StageResult(
                        name, System.nanoTime() - start, metrics.apply(result)));
            }
            return result;
        } catch (CompilationException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(name, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    private BundleDefinition parse(String content) {
        try {
            return objectMapper.readValue(content, BundleDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Invalid bundle JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ==================== Validation ====================

    /**
     * Validates the world and trigger definitions.
     *
     * Validations include:
     * - Non-empty, unique ids for rooms, items, NPCs, goals and triggers.
     * - An existing start room and existing exit targets.
     * - Item, NPC and movement locations that resolve.
     * - Every trigger has an event matcher.
     * - Every entity named by a condition or action is declared.
     */
    private void validate(BundleDefinition bundle) {
        WorldDefinition world = bundle.world();

        Set<String> rooms = uniqueIds("room", world.rooms().stream().map(WorldDefinition.RoomDefinition::id).toList());
        Set<String> items = uniqueIds("item", world.items().stream().map(WorldDefinition.ItemDefinition::id).toList());
        Set<String> npcs = uniqueIds("npc", world.npcs().stream().map(WorldDefinition.NpcDefinition::id).toList());
        Set<String> goals = uniqueIds("goal", world.goals().stream().map(Goal::id).toList());
        Set<String> triggers = uniqueIds("trigger", bundle.triggers().stream().map(TriggerDefinition::id).toList());
        ReferenceValidator references = new ReferenceValidator(
                new KnownEntities(rooms, items, npcs, goals, triggers, world.spinners().keySet()));

        if (world.startRoom() == null || !rooms.contains(world.startRoom())) {
            throw new CompilationException("Start room does not exist: " + world.startRoom());
        }

        for (WorldDefinition.RoomDefinition room : world.rooms()) {
            for (WorldDefinition.ExitDefinition exit : room.exits()) {
                if (exit.direction() == null || exit.direction().isBlank()) {
                    throw new CompilationException("Room '" + room.id() + "' has an exit without direction");
                }
                if (!rooms.contains(exit.to())) {
                    throw new CompilationException("Room '" + room.id() + "' exit '" + exit.direction()
                            + "' leads to unknown room: " + exit.to());
                }
            }
        }

        Map<String, WorldDefinition.ItemDefinition> itemsById = new HashMap<>();
        world.items().forEach(i -> itemsById.put(i.id(), i));
        for (WorldDefinition.ItemDefinition item : world.items()) {
            Location location = item.location();
            String owner = "Item '" + item.id() + "'";
            switch (location.type()) {
                case ROOM -> requireKnown(owner, "room", rooms, location.id());
                case NPC -> requireKnown(owner, "npc", npcs, location.id());
                case CONTAINER -> {
                    WorldDefinition.ItemDefinition container = itemsById.get(location.id());
                    if (container == null || container.container() == null) {
                        throw new CompilationException(owner + " is placed in unknown container: " + location.id());
                    }
                    if (container.id().equals(item.id())) {
                        throw new CompilationException(owner + " is placed inside itself");
                    }
                }
                default -> {
                }
            }
        }

        for (WorldDefinition.NpcDefinition npc : world.npcs()) {
            String owner = "NPC '" + npc.id() + "'";
            if (npc.room() != null) {
                requireKnown(owner, "room", rooms, npc.room());
            }
            if (npc.movement() != null) {
                if (npc.movement().type() == null) {
                    throw new CompilationException(owner + " has movement without type");
                }
                if (npc.movement().rooms().isEmpty()) {
                    throw new CompilationException(owner + " has movement without rooms");
                }
                npc.movement().rooms().forEach(r -> requireKnown(owner, "room", rooms, r));
            }
            npc.dialogue().forEach((state, lines) -> {
                if (lines == null || lines.contains(null)) {
                    throw new CompilationException(owner + " has missing dialogue lines for state: " + state);
                }
            });
        }

        world.spinners().forEach((id, lines) -> {
            if (id.isBlank() || lines == null || lines.isEmpty() || lines.contains(null)) {
                throw new CompilationException("Spinner '" + id + "' has missing or empty lines");
            }
        });

        for (Goal goal : world.goals()) {
            String owner = "Goal '" + goal.id() + "'";
            if (goal.finishedWhen() == null) {
                throw new CompilationException(owner + " has no finished_when condition");
            }
            references.validate(owner, goal.activateWhen());
            references.validate(owner, goal.finishedWhen());
            references.validate(owner, goal.failedWhen());
        }

        for (TriggerDefinition trigger : bundle.triggers()) {
            String owner = "Trigger '" + trigger.id() + "'";
            if (trigger.event() == null) {
                throw new CompilationException(owner + " has no event");
            }
            references.validate(owner, trigger.condition());
            references.validate(owner, trigger.actions());
        }
    }

    private Set<String> uniqueIds(String kind, List<String> ids) {
        Set<String> seen = new LinkedHashSet<>();
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            if (id == null || id.isBlank()) {
                throw new CompilationException(capitalize(kind) + " at index " + i + " has missing or empty id");
            }
            if (!seen.add(id)) {
                throw new CompilationException("Duplicate " + kind + " id: " + id);
            }
        }
        return seen;
    }

    private static void requireKnown(String owner, String kind, Set<String> ids, String id) {
        if (id == null || !ids.contains(id)) {
            throw new CompilationException(owner + " references unknown " + kind + ": " + id);
        }
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    // ==================== Normalization ====================

    private List<TriggerDefinition> normalize(List<TriggerDefinition> triggers) {
        List<TriggerDefinition> result = new ArrayList<>(triggers.size());
        for (TriggerDefinition trigger : triggers) {
            List<Action> actions = flattener.flattenActions(trigger.actions());
            result.add(trigger.withCondition(flattener.flatten(trigger.condition())).withActions(actions));
        }
        return result;
    }

    private int countConditionNodes(List<TriggerDefinition> triggers) {
        int total = 0;
        for (TriggerDefinition trigger : triggers) {
            total += ConditionFlattener.countNodes(trigger.condition());
        }
        return total;
    }

    // ==================== World construction ====================

    private World buildWorld(WorldDefinition def) {
        Player player = new Player(def.startRoom(), def.player().maxHp());
        World world = new World(def.seed(), player);

        for (WorldDefinition.RoomDefinition r : def.rooms()) {
            Room room = new Room(r.id(), r.name(), r.description());
            for (WorldDefinition.ExitDefinition e : r.exits()) {
                room.putExit(e.direction(), new Exit(e.to(), e.locked(), e.hidden()));
            }
            if (r.id().equals(def.startRoom())) {
                room.setVisited(true);
            }
            world.addRoom(room);
        }
        for (WorldDefinition.ItemDefinition i : def.items()) {
            world.addItem(new Item(i.id(), i.name(), i.description(), i.location(), i.container()));
        }
        for (WorldDefinition.NpcDefinition n : def.npcs()) {
            world.addNpc(new Npc(n.id(), n.name(), n.description(), n.room(), n.state(),
                    n.movement() == null ? null : n.movement().toMovement(), n.dialogue()));
        }
        def.spinners().forEach(world::addSpinner);
        for (Goal g : def.goals()) {
            world.addGoal(g.withConditions(flattener.flatten(g.activateWhen()),
                    flattener.flatten(g.finishedWhen()), flattener.flatten(g.failedWhen())));
        }
        return world;
    }
}
