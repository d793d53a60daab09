package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Top-level JSON document consumed by the trigger compiler.
 * This is a simple Data Transfer Object used only for loading.
 */
public record BundleDefinition(
        @JsonProperty("world") WorldDefinition world,
        @JsonProperty("triggers") List<TriggerDefinition> triggers
) {
    public List<TriggerDefinition> triggers() {
        return triggers != null ? triggers : List.of();
    }
}
