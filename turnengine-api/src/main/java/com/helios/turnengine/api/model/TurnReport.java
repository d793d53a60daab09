package com.helios.turnengine.api.model;

import java.util.List;

/**
 * Summary of one command cycle.
 *
 * @param turn            turn counter seen by the cycle
 * @param turnAdvanced    whether movement and drain ran
 * @param drain           scheduler resolutions (empty when the turn did not advance)
 * @param ambientTriggers ids of ambient triggers that fired
 * @param output          output flushed at the end of the cycle
 */
public record TurnReport(
        long turn,
        boolean turnAdvanced,
        DrainReport drain,
        List<String> ambientTriggers,
        List<OutputItem> output) {

    public TurnReport {
        ambientTriggers = List.copyOf(ambientTriggers);
        output = List.copyOf(output);
    }
}
