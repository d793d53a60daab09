package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.logging.Logger;

/**
 * What the scheduler does with a due event whose condition is false.
 *
 * <ul>
 *   <li>{@link Kind#CANCEL}: drop the event.</li>
 *   <li>{@link Kind#RETRY_AFTER}: re-enqueue a clone {@code turns} later.</li>
 *   <li>{@link Kind#RETRY_NEXT_TURN}: shorthand for {@code RETRY_AFTER} with one turn.</li>
 * </ul>
 *
 * Retry delays below one are clamped to one with a warning, so a retry can
 * never land in the same drain pass.
 */
public record OnFalsePolicy(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("turns") int turns) {

    private static final Logger logger = Logger.getLogger(OnFalsePolicy.class.getName());

    public enum Kind {
        CANCEL,
        RETRY_AFTER,
        RETRY_NEXT_TURN
    }

    public OnFalsePolicy {
        if (kind == null) {
            kind = Kind.CANCEL;
        }
        switch (kind) {
            case CANCEL -> turns = 0;
            case RETRY_NEXT_TURN -> turns = 1;
            case RETRY_AFTER -> {
                if (turns < 1) {
                    logger.warning("Retry delay of " + turns + " turn(s) is not positive; clamping to 1");
                    turns = 1;
                }
            }
        }
    }

    public static OnFalsePolicy cancel() {
        return new OnFalsePolicy(Kind.CANCEL, 0);
    }

    public static OnFalsePolicy retryAfter(int turns) {
        return new OnFalsePolicy(Kind.RETRY_AFTER, turns);
    }

    public static OnFalsePolicy retryNextTurn() {
        return new OnFalsePolicy(Kind.RETRY_NEXT_TURN, 1);
    }

    @JsonIgnore
    public boolean isRetry() {
        return kind != Kind.CANCEL;
    }

    /** Short form used by the developer queue listing. */
    public String summary() {
        return switch (kind) {
            case CANCEL -> "cancel";
            case RETRY_AFTER -> "retry+" + turns;
            case RETRY_NEXT_TURN -> "retry-next";
        };
    }
}
