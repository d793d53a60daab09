package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A player flag. A flag with a {@code limit} is a sequence flag whose
 * {@code step} runs from 0 to {@code limit}; its value reads {@code name#step}.
 *
 * @param name    flag name
 * @param step    current step, always 0 for simple flags
 * @param limit   final step of a sequence flag, null for simple flags
 * @param turnSet turn on which the flag was added
 */
public record Flag(
        @JsonProperty("name") String name,
        @JsonProperty("step") int step,
        @JsonProperty("limit") Integer limit,
        @JsonProperty("turn_set") long turnSet) {

    public static Flag simple(String name, long turn) {
        return new Flag(name, 0, null, turn);
    }

    public static Flag sequence(String name, int limit, long turn) {
        return new Flag(name, 0, limit, turn);
    }

    @JsonIgnore
    public boolean isSequence() {
        return limit != null;
    }

    @JsonIgnore
    public boolean isComplete() {
        return !isSequence() || step >= limit;
    }

    public String value() {
        return isSequence() ? name + "#" + step : name;
    }

    public Flag advance() {
        if (!isSequence() || isComplete()) {
            return this;
        }
        return new Flag(name, step + 1, limit, turnSet);
    }

    public Flag reset() {
        return new Flag(name, 0, limit, turnSet);
    }
}
