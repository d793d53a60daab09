package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.turnengine.runtime.model.World;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time copy of everything a session needs to resume: the world,
 * per-trigger state, the scheduler and the coordinator's last processed turn.
 */
public record EngineSnapshot(
        @JsonProperty("format_version") int formatVersion,
        @JsonProperty("world") World world,
        @JsonProperty("triggers") Map<String, TriggerState> triggers,
        @JsonProperty("scheduler") SchedulerState scheduler,
        @JsonProperty("last_cycle_turn") long lastCycleTurn) {

    public static final int CURRENT_FORMAT = 1;

    public EngineSnapshot {
        triggers = triggers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(triggers));
        if (scheduler == null) {
            scheduler = SchedulerState.empty();
        }
    }
}
