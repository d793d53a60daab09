/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON representation of an authored trigger.
 *
 * <p>After compilation the instance is immutable; runtime enabled/fired state
 * lives in {@link TriggerState}.
 */
public record TriggerDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("event") EventMatcher event,
        @JsonProperty("condition") Condition condition,
        @JsonProperty("actions") List<Action> actions,
        @JsonProperty("fire_once") Boolean fireOnce,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("description") String description) {

    public TriggerDefinition {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    // Default values for optional fields

    public Condition condition() {
        return condition != null ? condition : Condition.always();
    }

    public Boolean fireOnce() {
        return fireOnce != null ? fireOnce : false;
    }

    public Boolean enabled() {
        return enabled != null ? enabled : true;
    }

    public TriggerDefinition withCondition(Condition newCondition) {
        return new TriggerDefinition(id, event, newCondition, actions, fireOnce, enabled, description);
    }

    public TriggerDefinition withActions(List<Action> newActions) {
        return new TriggerDefinition(id, event, condition, newActions, fireOnce, enabled, description);
    }
}
