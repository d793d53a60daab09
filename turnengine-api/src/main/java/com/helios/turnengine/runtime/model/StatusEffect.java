package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A timed effect on the player's health. Negative {@code hpPerTurn} is damage.
 */
public record StatusEffect(
        @JsonProperty("name") String name,
        @JsonProperty("hp_per_turn") int hpPerTurn,
        @JsonProperty("turns_remaining") int turnsRemaining) {

    public StatusEffect tick() {
        return new StatusEffect(name, hpPerTurn, turnsRemaining - 1);
    }
}
