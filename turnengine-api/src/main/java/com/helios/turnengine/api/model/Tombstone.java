package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal record left behind when a scheduled event leaves the queue.
 *
 * @param eventId      id of the consumed event
 * @param dueTurn      the event's due turn
 * @param status       how it was resolved
 * @param resolvedTurn turn at which it was resolved
 * @param successorId  id of the clone for {@link Status#RESCHEDULED}, else null
 * @param note         the event's authoring note
 */
public record Tombstone(
        @JsonProperty("event_id") long eventId,
        @JsonProperty("due_turn") long dueTurn,
        @JsonProperty("status") Status status,
        @JsonProperty("resolved_turn") long resolvedTurn,
        @JsonProperty("successor_id") Long successorId,
        @JsonProperty("note") String note) {

    public enum Status {
        FIRED,
        CANCELLED,
        RESCHEDULED
    }

    public static Tombstone fired(ScheduledEvent event, long turn) {
        return new Tombstone(event.id(), event.dueTurn(), Status.FIRED, turn, null, event.note());
    }

    public static Tombstone cancelled(ScheduledEvent event, long turn) {
        return new Tombstone(event.id(), event.dueTurn(), Status.CANCELLED, turn, null, event.note());
    }

    public static Tombstone rescheduled(ScheduledEvent event, long turn, long successorId) {
        return new Tombstone(event.id(), event.dueTurn(), Status.RESCHEDULED, turn, successorId, event.note());
    }

    @Override
    public String toString() {
        return status == Status.RESCHEDULED
                ? "#" + eventId + " RESCHEDULED->#" + successorId
                : "#" + eventId + " " + status;
    }
}
