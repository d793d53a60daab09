package com.helios.turnengine.compiler.validation;

import java.util.Set;

/**
 * Ids declared by a bundle, grouped by entity kind.
 */
public record KnownEntities(
        Set<String> rooms,
        Set<String> items,
        Set<String> npcs,
        Set<String> goals,
        Set<String> triggers,
        Set<String> spinners) {
}
