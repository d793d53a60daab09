package com.helios.turnengine.runtime.model;

import java.util.Map;

public record ModelStats(
        int triggerCount,
        int conditionNodesBefore,
        int conditionNodesAfter,
        long compilationTimeNanos,
        Map<String, Object> metadata
) {
}
