package com.helios.turnengine.api.exceptions;

/**
 * Raised by a single action that cannot be applied, typically because it
 * names an entity that does not exist. The executor catches it, logs it and
 * moves on to the next action in the list.
 */
public class ActionException extends RuntimeException {

    private final String actionType;

    public ActionException(String actionType, String message) {
        super(message);
        this.actionType = actionType;
    }

    public String getActionType() {
        return actionType;
    }
}
