package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Npc {

    public static final String DEFAULT_STATE = "normal";

    @JsonProperty("id")
    private String id;
    @JsonProperty("name")
    private String name;
    @JsonProperty("description")
    private String description;
    @JsonProperty("room")
    private String room;
    @JsonProperty("state")
    private String state = DEFAULT_STATE;
    @JsonProperty("movement")
    private NpcMovement movement;
    @JsonProperty("dialogue")
    private LinkedHashMap<String, List<String>> dialogue = new LinkedHashMap<>();

    private Npc() {
    }

    public Npc(String id, String name, String description, String room, String state, NpcMovement movement) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.room = room;
        this.state = state == null ? DEFAULT_STATE : state;
        this.movement = movement;
    }

    public Npc(String id, String name, String description, String room, String state, NpcMovement movement,
               Map<String, List<String>> dialogue) {
        this(id, name, description, room, state, movement);
        if (dialogue != null) {
            dialogue.forEach((key, lines) -> this.dialogue.put(key, List.copyOf(lines)));
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Room the NPC is in, or null when off-map. */
    public String getRoom() {
        return room;
    }

    public void setRoom(String room) {
        this.room = room;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public NpcMovement getMovement() {
        return movement;
    }

    /**
     * Lines the NPC may say while in {@code state}. State names compare
     * case-insensitively, as they do for the {@code npc_in_state} condition.
     */
    public List<String> dialogueFor(String state) {
        if (state == null) {
            return List.of();
        }
        for (Map.Entry<String, List<String>> e : dialogue.entrySet()) {
            if (e.getKey().equalsIgnoreCase(state)) {
                return Collections.unmodifiableList(e.getValue());
            }
        }
        return List.of();
    }

    public Npc copy() {
        return new Npc(id, name, description, room, state, movement == null ? null : movement.copy(), dialogue);
    }
}
