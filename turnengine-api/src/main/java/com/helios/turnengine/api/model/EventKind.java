package com.helios.turnengine.api.model;

/**
 * Kinds of game events a trigger can react to.
 * {@link #ALWAYS} is the ambient kind checked once per command cycle.
 */
public enum EventKind {
    ALWAYS,
    ENTER,
    LEAVE,
    TAKE,
    DROP,
    LOOK_AT,
    OPEN,
    UNLOCK,
    TOUCH,
    INSERT,
    TALK_TO_NPC,
    GIVE_TO_NPC,
    TAKE_FROM_NPC,
    USE_ITEM,
    USE_ITEM_ON_ITEM,
    INGEST,
    PLAYER_DEATH
}
