package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Persistable copy of the scheduler: pending events in queue order,
 * tombstones in resolution order, and the next id to assign.
 */
public record SchedulerState(
        @JsonProperty("next_id") long nextId,
        @JsonProperty("pending") List<ScheduledEvent> pending,
        @JsonProperty("tombstones") List<Tombstone> tombstones) {

    public SchedulerState {
        pending = pending == null ? List.of() : List.copyOf(pending);
        tombstones = tombstones == null ? List.of() : List.copyOf(tombstones);
    }

    public static SchedulerState empty() {
        return new SchedulerState(1, List.of(), List.of());
    }
}
