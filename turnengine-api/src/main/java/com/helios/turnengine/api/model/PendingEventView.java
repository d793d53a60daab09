package com.helios.turnengine.api.model;

/**
 * Read-only row of the developer queue listing.
 */
public record PendingEventView(
        long id,
        long dueTurn,
        int actionCount,
        String policy,
        String condition,
        String note) {

    @Override
    public String toString() {
        return String.format("#%d turn %d: %d action(s), on_false=%s, cond=%s%s",
                id, dueTurn, actionCount, policy, condition,
                note == null ? "" : ", note=\"" + note + "\"");
    }
}
