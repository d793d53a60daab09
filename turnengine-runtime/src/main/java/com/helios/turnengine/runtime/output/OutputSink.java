package com.helios.turnengine.runtime.output;

import com.helios.turnengine.api.model.OutputItem;

import java.util.List;

/**
 * Receives flushed output at the end of each command cycle.
 */
@FunctionalInterface
public interface OutputSink {

    OutputSink DISCARD = items -> { };

    void accept(List<OutputItem> items);
}
