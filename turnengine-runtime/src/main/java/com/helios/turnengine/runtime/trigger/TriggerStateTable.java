package com.helios.turnengine.runtime.trigger;

import com.helios.turnengine.api.model.TriggerDefinition;
import com.helios.turnengine.api.model.TriggerState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Enabled/fired state of every trigger, keyed by trigger id in registration
 * order. This is the only mutable part of a trigger.
 */
public final class TriggerStateTable {
    private static final Logger logger = Logger.getLogger(TriggerStateTable.class.getName());

    private final LinkedHashMap<String, TriggerState> states = new LinkedHashMap<>();

    public TriggerStateTable(List<TriggerDefinition> triggers) {
        for (TriggerDefinition trigger : triggers) {
            states.put(trigger.id(), TriggerState.initial(trigger.enabled()));
        }
    }

    public TriggerState get(String triggerId) {
        return states.get(triggerId);
    }

    public boolean contains(String triggerId) {
        return states.containsKey(triggerId);
    }

    /**
     * @return false when the trigger is unknown
     */
    public boolean setEnabled(String triggerId, boolean enabled) {
        TriggerState state = states.get(triggerId);
        if (state == null) {
            return false;
        }
        states.put(triggerId, state.withEnabled(enabled));
        return true;
    }

    void recordFiring(String triggerId, long turn) {
        states.computeIfPresent(triggerId, (id, state) -> state.recordFiring(turn));
    }

    public Map<String, TriggerState> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    /**
     * Overlays persisted state. Ids the current model no longer declares are
     * dropped with a warning; triggers absent from the save keep their
     * initial state.
     */
    public void restore(Map<String, TriggerState> saved) {
        for (Map.Entry<String, TriggerState> entry : saved.entrySet()) {
            if (states.containsKey(entry.getKey())) {
                states.put(entry.getKey(), entry.getValue());
            } else {
                logger.warning("Ignoring saved state for unknown trigger '" + entry.getKey() + "'");
            }
        }
    }
}
