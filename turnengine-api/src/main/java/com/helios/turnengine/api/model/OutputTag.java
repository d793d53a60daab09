package com.helios.turnengine.api.model;

/**
 * Semantic tag carried by every output item. The presentation layer decides
 * how each tag is styled.
 */
public enum OutputTag {
    TRIGGERED_EVENT,
    AMBIENT_EVENT,
    NPC_SPEECH,
    NPC_MOVEMENT,
    POINTS_AWARDED,
    STATUS,
    ACTION_SUCCESS,
    ACTION_FAILURE,
    ENGINE_MESSAGE,
    ERROR
}
