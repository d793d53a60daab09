package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Room {

    @JsonProperty("id")
    private String id;
    @JsonProperty("name")
    private String name;
    @JsonProperty("description")
    private String description;
    @JsonProperty("visited")
    private boolean visited;
    @JsonProperty("exits")
    private LinkedHashMap<String, Exit> exits = new LinkedHashMap<>();

    private Room() {
    }

    public Room(String id, String name, String description) {
        this.id = id;
        this.name = name;
        this.description = description;
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

    public boolean isVisited() {
        return visited;
    }

    public void setVisited(boolean visited) {
        this.visited = visited;
    }

    public Map<String, Exit> getExits() {
        return Collections.unmodifiableMap(exits);
    }

    public Optional<Exit> exit(String direction) {
        return Optional.ofNullable(exits.get(direction));
    }

    public void putExit(String direction, Exit exit) {
        exits.put(direction, exit);
    }

    public Room copy() {
        Room copy = new Room(id, name, description);
        copy.visited = visited;
        copy.exits = new LinkedHashMap<>(exits);
        return copy;
    }
}
