package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Where an item is: in a room, in the player's inventory, inside a
 * container item, held by an NPC, or nowhere (despawned or not yet spawned).
 */
public record Location(
        @JsonProperty("type") Type type,
        @JsonProperty("id") String id) {

    public enum Type {
        ROOM,
        INVENTORY,
        CONTAINER,
        NPC,
        NOWHERE
    }

    private static final Location INVENTORY = new Location(Type.INVENTORY, null);
    private static final Location NOWHERE = new Location(Type.NOWHERE, null);

    public Location {
        Objects.requireNonNull(type, "type");
        if (type == Type.INVENTORY || type == Type.NOWHERE) {
            id = null;
        } else if (id == null) {
            throw new IllegalArgumentException("Location of type " + type + " requires an id");
        }
    }

    public static Location room(String roomId) {
        return new Location(Type.ROOM, roomId);
    }

    public static Location container(String itemId) {
        return new Location(Type.CONTAINER, itemId);
    }

    public static Location npc(String npcId) {
        return new Location(Type.NPC, npcId);
    }

    public static Location inventory() {
        return INVENTORY;
    }

    public static Location nowhere() {
        return NOWHERE;
    }

    @JsonIgnore
    public boolean isNowhere() {
        return type == Type.NOWHERE;
    }

    @Override
    public String toString() {
        return id == null ? type.name().toLowerCase() : type.name().toLowerCase() + ":" + id;
    }
}
