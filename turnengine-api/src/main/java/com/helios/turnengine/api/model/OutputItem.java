package com.helios.turnengine.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of unformatted output.
 *
 * @param tag  semantic tag
 * @param text message text
 */
public record OutputItem(
        @JsonProperty("tag") OutputTag tag,
        @JsonProperty("text") String text) {

    public static OutputItem of(OutputTag tag, String text) {
        return new OutputItem(tag, text);
    }
}
