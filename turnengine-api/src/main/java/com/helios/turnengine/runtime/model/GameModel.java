/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.model;

import com.helios.turnengine.api.model.TriggerDefinition;

import java.util.List;
import java.util.Objects;

/**
 * The compiled, load-time-immutable game: a prototype world and the
 * validated, normalized trigger list in authoring order.
 *
 * <p>Sessions never touch the prototype; {@link #newWorld()} hands out a
 * fresh deep copy each time.
 */
public final class GameModel {

    private final World prototype;
    private final List<TriggerDefinition> triggers;
    private final ModelStats stats;

    public GameModel(World prototype, List<TriggerDefinition> triggers, ModelStats stats) {
        this.prototype = Objects.requireNonNull(prototype, "prototype");
        this.triggers = List.copyOf(triggers);
        this.stats = stats;
    }

    public World newWorld() {
        return prototype.copy();
    }

    public List<TriggerDefinition> getTriggers() {
        return triggers;
    }

    public int getNumTriggers() {
        return triggers.size();
    }

    public ModelStats getStats() {
        return stats;
    }
}
