package com.helios.turnengine.api;

import com.helios.turnengine.api.model.EngineSnapshot;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.PendingEventView;
import com.helios.turnengine.api.model.TriggerState;
import com.helios.turnengine.api.model.TurnReport;
import com.helios.turnengine.runtime.model.World;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Entry points a command handler uses during one command cycle.
 *
 * <p>A handler mutates the world, dispatches events with {@link #react} or
 * {@link #checkTriggers}, optionally advances the clock with
 * {@link #advanceClock()}, and then calls {@link #advanceTurn()} exactly
 * once. Implementations are single-threaded.
 */
public interface ITurnEngine {

    /**
     * Fires every matching trigger for {@code event} in registration order.
     *
     * @return ids of the triggers that fired, possibly empty
     */
    List<String> checkTriggers(GameEvent event);

    /**
     * Same as {@link #checkTriggers} but writes the fallback message when
     * nothing fired for a player-initiated event.
     */
    List<String> react(GameEvent event);

    /**
     * Moves an item into the player's inventory through the action executor.
     */
    void spawnIntoInventory(String itemId);

    /**
     * Handler-driven clock increment.
     *
     * @return the new turn count
     */
    long advanceClock();

    /**
     * Runs NPC movement, the scheduler drain, status effects and ambient
     * triggers, then flushes buffered output.
     */
    TurnReport advanceTurn();

    /** Output buffered since the last flush, without flushing it. */
    List<OutputItem> pendingOutput();

    World world();

    // ==================== Developer surface ====================

    List<PendingEventView> listPending();

    boolean cancelScheduled(long eventId);

    /**
     * @return the id of the replacement event, or empty when {@code eventId} is unknown
     */
    OptionalLong delayScheduled(long eventId, int turns);

    Map<String, TriggerState> triggerStates();

    // ==================== Persistence ====================

    EngineSnapshot snapshot();
}
