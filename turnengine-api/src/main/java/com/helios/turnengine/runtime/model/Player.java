package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Player {

    @JsonProperty("room")
    private String room;
    @JsonProperty("score")
    private int score;
    @JsonProperty("hp")
    private int hp;
    @JsonProperty("max_hp")
    private int maxHp;
    @JsonProperty("flags")
    private LinkedHashMap<String, Flag> flags = new LinkedHashMap<>();
    @JsonProperty("effects")
    private List<StatusEffect> effects = new ArrayList<>();

    private Player() {
    }

    public Player(String room, int maxHp) {
        this.room = room;
        this.maxHp = maxHp;
        this.hp = maxHp;
    }

    public String getRoom() {
        return room;
    }

    public void setRoom(String room) {
        this.room = room;
    }

    public int getScore() {
        return score;
    }

    public void addScore(int amount) {
        this.score += amount;
    }

    public int getHp() {
        return hp;
    }

    public int getMaxHp() {
        return maxHp;
    }

    /** Sets health clamped to {@code [0, maxHp]}. */
    public void setHp(int hp) {
        this.hp = Math.max(0, Math.min(maxHp, hp));
    }

    public boolean isAlive() {
        return hp > 0;
    }

    public Optional<Flag> flag(String name) {
        return Optional.ofNullable(flags.get(name));
    }

    public Collection<Flag> getFlags() {
        return Collections.unmodifiableCollection(flags.values());
    }

    public void putFlag(Flag flag) {
        flags.put(flag.name(), flag);
    }

    public boolean removeFlag(String name) {
        return flags.remove(name) != null;
    }

    public List<StatusEffect> getEffects() {
        return Collections.unmodifiableList(effects);
    }

    public void setEffects(List<StatusEffect> newEffects) {
        this.effects = new ArrayList<>(newEffects);
    }

    /** Adds an effect, replacing any active effect with the same name. */
    public void applyEffect(StatusEffect effect) {
        effects.removeIf(e -> e.name().equals(effect.name()));
        effects.add(effect);
    }

    public boolean removeEffect(String name) {
        return effects.removeIf(e -> e.name().equals(name));
    }

    public Player copy() {
        Player copy = new Player(room, maxHp);
        copy.score = score;
        copy.hp = hp;
        copy.flags = new LinkedHashMap<>(flags);
        copy.effects = new ArrayList<>(effects);
        return copy;
    }
}
