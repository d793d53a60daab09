package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A thing in the world, possibly a container. The item's {@link Location} is the single
 * source of truth for where it is; rooms and containers do not keep lists.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Item {

    @JsonProperty("id")
    private String id;
    @JsonProperty("name")
    private String name;
    @JsonProperty("description")
    private String description;
    @JsonProperty("location")
    private Location location = Location.nowhere();
    @JsonProperty("container_state")
    private ContainerState containerState;

    private Item() {
    }

    public Item(String id, String name, String description, Location location,
                ContainerState containerState) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.location = location == null ? Location.nowhere() : location;
        this.containerState = containerState;
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

    public void setDescription(String description) {
        this.description = description;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location == null ? Location.nowhere() : location;
    }

    public ContainerState getContainerState() {
        return containerState;
    }

    public void setContainerState(ContainerState containerState) {
        this.containerState = containerState;
    }

    public boolean isContainer() {
        return containerState != null;
    }

    public Item copy() {
        return new Item(id, name, description, location, containerState);
    }
}
