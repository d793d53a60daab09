package com.helios.turnengine.api.exceptions;

/**
 * A game bundle could not be turned into a playable model: the JSON is
 * malformed, an id is duplicated, or a reference points at nothing.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
