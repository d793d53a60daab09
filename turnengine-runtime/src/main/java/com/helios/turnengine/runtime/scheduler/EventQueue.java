/*
 * Copyright (c) 2025 Helios Turn Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.turnengine.runtime.scheduler;

import com.helios.turnengine.api.exceptions.QueueCorruptionException;
import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.OnFalsePolicy;
import com.helios.turnengine.api.model.ScheduledEvent;
import com.helios.turnengine.api.model.SchedulerState;
import com.helios.turnengine.api.model.Tombstone;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import it.unimi.dsi.fastutil.objects.ObjectRBTreeSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Storage for scheduled events: the pending queue ordered by
 * ({@code dueTurn}, {@code id}), an id index, and tombstones in resolution
 * order.
 *
 * <p>Ids come from a counter that only moves forward and is part of the
 * persisted state, so an id is never handed out twice even after old
 * tombstones have been compacted away. Because ids grow with insertion,
 * ordering by id within a turn is insertion order.
 */
public final class EventQueue {

    private static final Comparator<ScheduledEvent> QUEUE_ORDER =
            Comparator.comparingLong(ScheduledEvent::dueTurn).thenComparingLong(ScheduledEvent::id);

    private final ObjectRBTreeSet<ScheduledEvent> pending = new ObjectRBTreeSet<>(QUEUE_ORDER);
    private final Long2ObjectOpenHashMap<ScheduledEvent> byId = new Long2ObjectOpenHashMap<>();
    private final Long2ObjectLinkedOpenHashMap<Tombstone> tombstones = new Long2ObjectLinkedOpenHashMap<>();
    private final int maxTombstones;
    private long nextId = 1;

    /**
     * @param maxTombstones tombstones retained before the oldest are dropped; 0 keeps all
     */
    public EventQueue(int maxTombstones) {
        if (maxTombstones < 0) {
            throw new IllegalArgumentException("maxTombstones must be >= 0");
        }
        this.maxTombstones = maxTombstones;
    }

    // ==================== Insertion ====================

    /**
     * Adds a new event and returns its id.
     */
    public long insert(long dueTurn, Condition condition, List<Action> actions,
                       OnFalsePolicy onFalse, String originTriggerId, String note) {
        long id = nextId++;
        add(new ScheduledEvent(id, dueTurn, condition, actions, onFalse, originTriggerId, note));
        return id;
    }

    /**
     * Clones {@code original} under a fresh id due at {@code newDueTurn}.
     * The original is left untouched; callers tombstone it.
     */
    public ScheduledEvent insertClone(ScheduledEvent original, long newDueTurn) {
        ScheduledEvent clone = original.reschedule(nextId++, newDueTurn);
        add(clone);
        return clone;
    }

    private void add(ScheduledEvent event) {
        pending.add(event);
        byId.put(event.id(), event);
    }

    // ==================== Queries ====================

    /**
     * Events due at or before {@code currentTurn}, in queue order, copied so
     * the caller may mutate the queue while iterating.
     */
    public List<ScheduledEvent> due(long currentTurn) {
        List<ScheduledEvent> result = new ArrayList<>();
        for (ScheduledEvent event : pending) {
            if (event.dueTurn() > currentTurn) {
                break;
            }
            result.add(event);
        }
        return result;
    }

    public Optional<ScheduledEvent> get(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean isPending(long id) {
        return byId.containsKey(id);
    }

    public List<ScheduledEvent> pending() {
        return new ArrayList<>(pending);
    }

    public int size() {
        return pending.size();
    }

    public Optional<Tombstone> tombstone(long id) {
        return Optional.ofNullable(tombstones.get(id));
    }

    public List<Tombstone> tombstones() {
        return new ArrayList<>(tombstones.values());
    }

    public long nextId() {
        return nextId;
    }

    // ==================== Resolution ====================

    /**
     * Removes a pending event and records its tombstone in one step.
     */
    public void resolve(ScheduledEvent event, Tombstone tombstone) {
        if (byId.remove(event.id()) == null) {
            throw new IllegalStateException("Event #" + event.id() + " is not pending");
        }
        pending.remove(event);
        tombstones.put(tombstone.eventId(), tombstone);
        compact();
    }

    private void compact() {
        if (maxTombstones == 0) {
            return;
        }
        while (tombstones.size() > maxTombstones) {
            tombstones.remove(tombstones.firstLongKey());
        }
    }

    // ==================== Persistence ====================

    public SchedulerState snapshot() {
        return new SchedulerState(nextId, pending(), tombstones());
    }

    /**
     * Rebuilds a queue from persisted state.
     *
     * @throws QueueCorruptionException on duplicate ids, ids the counter has
     *                                  not reached, or pending events due
     *                                  before {@code currentTurn}
     */
    public static EventQueue restore(SchedulerState state, long currentTurn, int maxTombstones) {
        EventQueue queue = new EventQueue(maxTombstones);
        LongSet seen = new LongOpenHashSet();

        for (ScheduledEvent event : state.pending()) {
            checkId(event.id(), state.nextId(), seen);
            if (event.dueTurn() < currentTurn) {
                throw new QueueCorruptionException("Scheduled event #" + event.id() + " is due on turn "
                        + event.dueTurn() + ", before the restored current turn " + currentTurn);
            }
            queue.add(event);
        }
        for (Tombstone tombstone : state.tombstones()) {
            checkId(tombstone.eventId(), state.nextId(), seen);
            queue.tombstones.put(tombstone.eventId(), tombstone);
        }
        queue.nextId = state.nextId();
        queue.compact();
        return queue;
    }

    private static void checkId(long id, long nextId, LongSet seen) {
        if (!seen.add(id)) {
            throw new QueueCorruptionException("Duplicate scheduled event id #" + id);
        }
        if (id <= 0 || id >= nextId) {
            throw new QueueCorruptionException("Scheduled event id #" + id
                    + " is outside the assigned range [1, " + nextId + ")");
        }
    }
}
