package com.helios.turnengine.api.model;

import java.util.Map;
import java.util.Objects;

/**
 * An immutable event raised by a command handler or by the engine itself.
 *
 * <p>
 * Parameters name the entities involved, e.g. {@code room=lab} for
 * {@link EventKind#ENTER} or {@code item=key, npc=guard} for
 * {@link EventKind#GIVE_TO_NPC}.
 *
 * @param kind   the event kind (must not be null)
 * @param params entity parameters, never null
 */
public record GameEvent(EventKind kind, Map<String, String> params) {

    private static final GameEvent ALWAYS = new GameEvent(EventKind.ALWAYS, Map.of());

    public GameEvent {
        Objects.requireNonNull(kind, "kind");
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static GameEvent of(EventKind kind) {
        return new GameEvent(kind, Map.of());
    }

    public static GameEvent of(EventKind kind, String key, String value) {
        return new GameEvent(kind, Map.of(key, value));
    }

    public static GameEvent always() {
        return ALWAYS;
    }

    /**
     * Player events are everything except the engine-raised kinds.
     */
    public boolean isPlayerInitiated() {
        return kind != EventKind.ALWAYS && kind != EventKind.PLAYER_DEATH;
    }
}
