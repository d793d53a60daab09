package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.turnengine.runtime.model.ContainerState;
import com.helios.turnengine.runtime.model.Goal;
import com.helios.turnengine.runtime.model.Location;
import com.helios.turnengine.runtime.model.NpcMovement;

import java.util.List;
import java.util.Map;

/**
 * JSON representation of the initial world. Lists keep authoring order.
 */
public record WorldDefinition(
        @JsonProperty("seed") Long seed,
        @JsonProperty("start_room") String startRoom,
        @JsonProperty("player") PlayerDefinition player,
        @JsonProperty("rooms") List<RoomDefinition> rooms,
        @JsonProperty("items") List<ItemDefinition> items,
        @JsonProperty("npcs") List<NpcDefinition> npcs,
        @JsonProperty("goals") List<Goal> goals,
        @JsonProperty("spinners") Map<String, List<String>> spinners
) {

    public record PlayerDefinition(
            @JsonProperty("max_hp") Integer maxHp
    ) {
        public Integer maxHp() {
            return maxHp != null ? maxHp : 20;
        }
    }

    public record RoomDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("exits") List<ExitDefinition> exits
    ) {
        public List<ExitDefinition> exits() {
            return exits != null ? exits : List.of();
        }
    }

    public record ExitDefinition(
            @JsonProperty("direction") String direction,
            @JsonProperty("to") String to,
            @JsonProperty("locked") boolean locked,
            @JsonProperty("hidden") boolean hidden
    ) {}

    public record ItemDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("location") Location location,
            @JsonProperty("container") ContainerState container
    ) {
        public Location location() {
            return location != null ? location : Location.nowhere();
        }
    }

    public record NpcDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("room") String room,
            @JsonProperty("state") String state,
            @JsonProperty("movement") MovementDefinition movement,
            @JsonProperty("dialogue") Map<String, List<String>> dialogue
    ) {
        /** Lines keyed by NPC state. */
        public Map<String, List<String>> dialogue() {
            return dialogue != null ? dialogue : Map.of();
        }
    }

    public record MovementDefinition(
            @JsonProperty("type") NpcMovement.Type type,
            @JsonProperty("rooms") List<String> rooms,
            @JsonProperty("loop") boolean loop,
            @JsonProperty("every") Integer every,
            @JsonProperty("on_turn") Long onTurn,
            @JsonProperty("active") Boolean active
    ) {
        public List<String> rooms() {
            return rooms != null ? rooms : List.of();
        }

        public NpcMovement toMovement() {
            return new NpcMovement(type, rooms(), loop, every != null ? every : 0, onTurn,
                    active == null || active);
        }
    }

    // Default values for optional fields

    public Long seed() {
        return seed != null ? seed : 0L;
    }

    public PlayerDefinition player() {
        return player != null ? player : new PlayerDefinition(null);
    }

    public List<RoomDefinition> rooms() {
        return rooms != null ? rooms : List.of();
    }

    public List<ItemDefinition> items() {
        return items != null ? items : List.of();
    }

    public List<NpcDefinition> npcs() {
        return npcs != null ? npcs : List.of();
    }

    public List<Goal> goals() {
        return goals != null ? goals : List.of();
    }

    public Map<String, List<String>> spinners() {
        return spinners != null ? spinners : Map.of();
    }
}
