package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Selects the events a trigger listens to: a kind plus optional parameters.
 * Parameters absent from the matcher act as wildcards.
 */
public record EventMatcher(
        @JsonProperty("kind") EventKind kind,
        @JsonProperty("params") Map<String, String> params) {

    public EventMatcher {
        Objects.requireNonNull(kind, "kind");
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static EventMatcher of(EventKind kind) {
        return new EventMatcher(kind, Map.of());
    }

    public boolean matches(GameEvent event) {
        if (event == null || event.kind() != kind) {
            return false;
        }
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (!entry.getValue().equals(event.params().get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
