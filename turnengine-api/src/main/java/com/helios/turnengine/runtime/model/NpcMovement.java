package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Movement plan of an NPC: either a fixed route or a random walk over a set
 * of rooms, timed every {@code every} turns or once on {@code onTurn}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class NpcMovement {

    public enum Type {
        ROUTE,
        RANDOM
    }

    @JsonProperty("type")
    private Type type;
    @JsonProperty("rooms")
    private List<String> rooms = new ArrayList<>();
    @JsonProperty("loop")
    private boolean loop;
    @JsonProperty("every")
    private int every;
    @JsonProperty("on_turn")
    private Long onTurn;
    @JsonProperty("active")
    private boolean active = true;
    @JsonProperty("paused_until")
    private Long pausedUntil;
    @JsonProperty("current_index")
    private int currentIndex;
    @JsonProperty("last_moved_turn")
    private long lastMovedTurn = -1;

    private NpcMovement() {
    }

    public NpcMovement(Type type, List<String> rooms, boolean loop, int every, Long onTurn, boolean active) {
        this.type = type;
        this.rooms = new ArrayList<>(rooms);
        this.loop = loop;
        this.every = every;
        this.onTurn = onTurn;
        this.active = active;
    }

    /**
     * Whether the timing rule selects {@code turn}. Without an explicit
     * timing the NPC moves every turn.
     */
    public boolean isDue(long turn) {
        if (!active || (pausedUntil != null && turn < pausedUntil)) {
            return false;
        }
        if (onTurn != null) {
            return turn == onTurn;
        }
        int interval = every > 0 ? every : 1;
        return turn % interval == 0;
    }

    public Type getType() {
        return type;
    }

    public List<String> getRooms() {
        return Collections.unmodifiableList(rooms);
    }

    public boolean isLoop() {
        return loop;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Long getPausedUntil() {
        return pausedUntil;
    }

    public void setPausedUntil(Long pausedUntil) {
        this.pausedUntil = pausedUntil;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public void setCurrentIndex(int currentIndex) {
        this.currentIndex = currentIndex;
    }

    public long getLastMovedTurn() {
        return lastMovedTurn;
    }

    public void setLastMovedTurn(long lastMovedTurn) {
        this.lastMovedTurn = lastMovedTurn;
    }

    public NpcMovement copy() {
        NpcMovement copy = new NpcMovement(type, rooms, loop, every, onTurn, active);
        copy.pausedUntil = pausedUntil;
        copy.currentIndex = currentIndex;
        copy.lastMovedTurn = lastMovedTurn;
        return copy;
    }
}
