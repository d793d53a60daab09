package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A deferred condition plus action bundle stamped with the turn at which it
 * becomes eligible. Instances are immutable; a retry produces a new event
 * with a fresh id.
 *
 * @param id              unique, monotonically assigned id
 * @param dueTurn         turn at or after which the event resolves
 * @param condition       gate evaluated when due; {@code null} means always
 * @param actions         actions run when the gate holds
 * @param onFalse         policy applied when the gate fails
 * @param originTriggerId trigger that scheduled it, may be null
 * @param note            free-form authoring note, may be null
 */
public record ScheduledEvent(
        @JsonProperty("id") long id,
        @JsonProperty("due_turn") long dueTurn,
        @JsonProperty("condition") Condition condition,
        @JsonProperty("actions") List<Action> actions,
        @JsonProperty("on_false") OnFalsePolicy onFalse,
        @JsonProperty("origin_trigger_id") String originTriggerId,
        @JsonProperty("note") String note) {

    public ScheduledEvent {
        actions = actions == null ? List.of() : List.copyOf(actions);
        if (onFalse == null) {
            onFalse = OnFalsePolicy.cancel();
        }
    }

    /**
     * Clone under a new id and due turn, used for retries and developer delays.
     */
    public ScheduledEvent reschedule(long newId, long newDueTurn) {
        return new ScheduledEvent(newId, newDueTurn, condition, actions, onFalse, originTriggerId, note);
    }
}
