/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Map;

/**
 * Boolean expression over world state.
 *
 * <p>The vocabulary is closed: every variant is a record nested in this
 * interface and is dispatched through {@link ConditionVisitor}. Composite
 * nodes ({@link All}, {@link Any}) hold child lists; everything else is a
 * leaf predicate naming the entities it reads.
 *
 * <p>JSON form uses a {@code type} discriminator, e.g.
 * <pre>{@code
 * {"type": "all", "conditions": [
 *     {"type": "has_flag", "flag": "lamp-lit"},
 *     {"type": "in_room", "room": "cellar"}
 * ]}
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Condition.All.class, name = "all"),
        @JsonSubTypes.Type(value = Condition.Any.class, name = "any"),
        @JsonSubTypes.Type(value = Condition.HasFlag.class, name = "has_flag"),
        @JsonSubTypes.Type(value = Condition.MissingFlag.class, name = "missing_flag"),
        @JsonSubTypes.Type(value = Condition.FlagInProgress.class, name = "flag_in_progress"),
        @JsonSubTypes.Type(value = Condition.FlagComplete.class, name = "flag_complete"),
        @JsonSubTypes.Type(value = Condition.HasItem.class, name = "has_item"),
        @JsonSubTypes.Type(value = Condition.MissingItem.class, name = "missing_item"),
        @JsonSubTypes.Type(value = Condition.ContainerHasItem.class, name = "container_has_item"),
        @JsonSubTypes.Type(value = Condition.InRoom.class, name = "in_room"),
        @JsonSubTypes.Type(value = Condition.ReachedRoom.class, name = "reached_room"),
        @JsonSubTypes.Type(value = Condition.GoalComplete.class, name = "goal_complete"),
        @JsonSubTypes.Type(value = Condition.WithNpc.class, name = "with_npc"),
        @JsonSubTypes.Type(value = Condition.NpcHasItem.class, name = "npc_has_item"),
        @JsonSubTypes.Type(value = Condition.NpcInState.class, name = "npc_in_state"),
        @JsonSubTypes.Type(value = Condition.EventMatches.class, name = "event_matches"),
        @JsonSubTypes.Type(value = Condition.Chance.class, name = "chance")
})
public sealed interface Condition {

    <R> R accept(ConditionVisitor<R> visitor);

    /** A condition that is always true. */
    static Condition always() {
        return new All(List.of());
    }

    static Condition all(Condition... children) {
        return new All(List.of(children));
    }

    static Condition any(Condition... children) {
        return new Any(List.of(children));
    }

    record All(@JsonProperty("conditions") List<Condition> conditions) implements Condition {
        public All {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitAll(this);
        }
    }

    record Any(@JsonProperty("conditions") List<Condition> conditions) implements Condition {
        public Any {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitAny(this);
        }
    }

    /**
     * True when the player holds the flag. A sequence flag matches either by
     * bare name or by {@code name#step}.
     */
    record HasFlag(@JsonProperty("flag") String flag) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitHasFlag(this);
        }
    }

    record MissingFlag(@JsonProperty("flag") String flag) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitMissingFlag(this);
        }
    }

    record FlagInProgress(@JsonProperty("flag") String flag) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitFlagInProgress(this);
        }
    }

    record FlagComplete(@JsonProperty("flag") String flag) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitFlagComplete(this);
        }
    }

    record HasItem(@JsonProperty("item") String item) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitHasItem(this);
        }
    }

    record MissingItem(@JsonProperty("item") String item) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitMissingItem(this);
        }
    }

    record ContainerHasItem(
            @JsonProperty("container") String container,
            @JsonProperty("item") String item) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitContainerHasItem(this);
        }
    }

    record InRoom(@JsonProperty("room") String room) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitInRoom(this);
        }
    }

    record ReachedRoom(@JsonProperty("room") String room) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitReachedRoom(this);
        }
    }

    record GoalComplete(@JsonProperty("goal") String goal) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitGoalComplete(this);
        }
    }

    record WithNpc(@JsonProperty("npc") String npc) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitWithNpc(this);
        }
    }

    record NpcHasItem(
            @JsonProperty("npc") String npc,
            @JsonProperty("item") String item) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitNpcHasItem(this);
        }
    }

    record NpcInState(
            @JsonProperty("npc") String npc,
            @JsonProperty("state") String state) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitNpcInState(this);
        }
    }

    /**
     * True only while evaluating on behalf of an event of {@code kind}
     * whose parameters include every entry of {@code params}.
     */
    record EventMatches(
            @JsonProperty("kind") EventKind kind,
            @JsonProperty("params") Map<String, String> params) implements Condition {

        public EventMatches {
            params = params == null ? Map.of() : Map.copyOf(params);
        }

        public EventMatcher toMatcher() {
            return new EventMatcher(kind, params);
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitEventMatches(this);
        }
    }

    /**
     * True with probability {@code 1 / oneIn}. Values at or below 1 are
     * always true. The draw is seeded from the world, so it repeats on replay.
     */
    record Chance(@JsonProperty("one_in") double oneIn) implements Condition {
        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitChance(this);
        }
    }
}
