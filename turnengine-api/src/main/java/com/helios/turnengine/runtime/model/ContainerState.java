package com.helios.turnengine.runtime.model;

public enum ContainerState {
    OPEN,
    CLOSED,
    LOCKED
}
