/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The mutable aggregate of game state for one session.
 *
 * <p>A {@code World} is owned by exactly one session and handed by reference
 * to each stage of a command cycle in turn. It is not thread-safe and is
 * never shared; {@link #copy()} produces an independent deep copy for
 * snapshots.
 *
 * <p>Lookups return {@link Optional} because authored data may name entities
 * that do not exist; callers decide whether that is a false predicate or a
 * skipped action.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class World {

    @JsonProperty("turn_count")
    private long turnCount;
    @JsonProperty("seed")
    private long seed;
    @JsonProperty("player")
    private Player player;
    @JsonProperty("rooms")
    private LinkedHashMap<String, Room> rooms = new LinkedHashMap<>();
    @JsonProperty("items")
    private LinkedHashMap<String, Item> items = new LinkedHashMap<>();
    @JsonProperty("npcs")
    private LinkedHashMap<String, Npc> npcs = new LinkedHashMap<>();
    @JsonProperty("goals")
    private List<Goal> goals = new ArrayList<>();
    @JsonProperty("spinners")
    private LinkedHashMap<String, List<String>> spinners = new LinkedHashMap<>();

    private World() {
    }

    public World(long seed, Player player) {
        this.seed = seed;
        this.player = player;
    }

    // ==================== Clock ====================

    public long getTurnCount() {
        return turnCount;
    }

    /** Advances the game clock by one turn; called by command handlers. */
    public long incrementTurn() {
        return ++turnCount;
    }

    public long getSeed() {
        return seed;
    }

    public Player getPlayer() {
        return player;
    }

    // ==================== Entities ====================

    public Optional<Room> room(String id) {
        return Optional.ofNullable(id == null ? null : rooms.get(id));
    }

    public Optional<Item> item(String id) {
        return Optional.ofNullable(id == null ? null : items.get(id));
    }

    public Optional<Npc> npc(String id) {
        return Optional.ofNullable(id == null ? null : npcs.get(id));
    }

    public Optional<Goal> goal(String id) {
        return goals.stream().filter(g -> g.id().equals(id)).findFirst();
    }

    public Collection<Room> getRooms() {
        return Collections.unmodifiableCollection(rooms.values());
    }

    public Collection<Item> getItems() {
        return Collections.unmodifiableCollection(items.values());
    }

    public Collection<Npc> getNpcs() {
        return Collections.unmodifiableCollection(npcs.values());
    }

    public List<Goal> getGoals() {
        return Collections.unmodifiableList(goals);
    }

    public void addRoom(Room room) {
        rooms.put(room.getId(), room);
    }

    public void addItem(Item item) {
        items.put(item.getId(), item);
    }

    public void addNpc(Npc npc) {
        npcs.put(npc.getId(), npc);
    }

    public void addGoal(Goal goal) {
        goals.add(goal);
    }

    /** Registers a named pool of interchangeable lines, replacing any pool with the same id. */
    public void addSpinner(String id, List<String> lines) {
        spinners.put(id, List.copyOf(lines));
    }

    public Optional<List<String>> spinner(String id) {
        return Optional.ofNullable(id == null ? null : spinners.get(id));
    }

    public Collection<String> getSpinnerIds() {
        return Collections.unmodifiableCollection(spinners.keySet());
    }

    /** Items whose location is exactly {@code location}, in registration order. */
    public List<Item> itemsAt(Location location) {
        List<Item> result = new ArrayList<>();
        for (Item item : items.values()) {
            if (item.getLocation().equals(location)) {
                result.add(item);
            }
        }
        return result;
    }

    public Optional<Room> currentRoom() {
        return room(player.getRoom());
    }

    // ==================== Copying ====================

    public World copy() {
        World copy = new World(seed, player.copy());
        copy.turnCount = turnCount;
        for (Map.Entry<String, Room> e : rooms.entrySet()) {
            copy.rooms.put(e.getKey(), e.getValue().copy());
        }
        for (Map.Entry<String, Item> e : items.entrySet()) {
            copy.items.put(e.getKey(), e.getValue().copy());
        }
        for (Map.Entry<String, Npc> e : npcs.entrySet()) {
            copy.npcs.put(e.getKey(), e.getValue().copy());
        }
        copy.goals = new ArrayList<>(goals);
        copy.spinners = new LinkedHashMap<>(spinners);
        return copy;
    }
}
