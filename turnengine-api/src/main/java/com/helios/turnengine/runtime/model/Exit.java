package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed connection from one room to another.
 */
public record Exit(
        @JsonProperty("to") String to,
        @JsonProperty("locked") boolean locked,
        @JsonProperty("hidden") boolean hidden) {

    public Exit withLocked(boolean newLocked) {
        return new Exit(to, newLocked, hidden);
    }

    public Exit withHidden(boolean newHidden) {
        return new Exit(to, locked, newHidden);
    }
}
