package com.helios.turnengine.service.persistence;

/**
 * Raised when a snapshot cannot be written, read or decoded.
 */
public class SnapshotException extends RuntimeException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
