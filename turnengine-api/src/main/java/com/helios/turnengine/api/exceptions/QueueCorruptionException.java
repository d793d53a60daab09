package com.helios.turnengine.api.exceptions;

/**
 * Persisted scheduler state is inconsistent (duplicate ids, an event due
 * before the restored turn, or an id the counter has not reached). The save
 * cannot be resumed.
 */
public class QueueCorruptionException extends RuntimeException {

    public QueueCorruptionException(String message) {
        super(message);
    }
}
