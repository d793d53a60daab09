package com.helios.turnengine.runtime.model;

public enum GoalStatus {
    INACTIVE,
    ACTIVE,
    COMPLETE,
    FAILED
}
