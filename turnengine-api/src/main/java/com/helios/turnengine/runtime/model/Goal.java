package com.helios.turnengine.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.turnengine.api.model.Condition;

/**
 * An authored objective. Status is derived from the three conditions each
 * time it is asked for; nothing about a goal is stored at runtime.
 *
 * @param activateWhen  null means active from the start
 * @param finishedWhen  completion condition, required
 * @param failedWhen    null means the goal cannot fail
 */
public record Goal(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("activate_when") Condition activateWhen,
        @JsonProperty("finished_when") Condition finishedWhen,
        @JsonProperty("failed_when") Condition failedWhen) {

    public Goal withConditions(Condition activate, Condition finished, Condition failed) {
        return new Goal(id, name, description, activate, finished, failed);
    }
}
