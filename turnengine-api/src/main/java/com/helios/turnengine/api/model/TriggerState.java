package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mutable-by-replacement runtime state of one trigger.
 *
 * @param enabled       whether the trigger is considered at all
 * @param fired         whether it has fired at least once
 * @param fireCount     number of times it fired
 * @param lastFiredTurn turn of the most recent firing, or -1
 */
public record TriggerState(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("fired") boolean fired,
        @JsonProperty("fire_count") int fireCount,
        @JsonProperty("last_fired_turn") long lastFiredTurn) {

    public static TriggerState initial(boolean enabled) {
        return new TriggerState(enabled, false, 0, -1);
    }

    public TriggerState recordFiring(long turn) {
        return new TriggerState(enabled, true, fireCount + 1, turn);
    }

    public TriggerState withEnabled(boolean newEnabled) {
        return new TriggerState(newEnabled, fired, fireCount, lastFiredTurn);
    }
}
