package com.helios.turnengine.runtime.output;

import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.OutputTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered output accumulated during one command cycle. Items are opaque to
 * the engine; formatting belongs to whoever consumes {@link #flush()}.
 */
public final class OutputBuffer {

    private final List<OutputItem> items = new ArrayList<>();

    public void push(OutputTag tag, String text) {
        items.add(OutputItem.of(tag, text));
    }

    public void push(OutputItem item) {
        items.add(item);
    }

    /** Items buffered so far, without clearing them. */
    public List<OutputItem> peek() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Returns everything buffered and clears the buffer.
     */
    public List<OutputItem> flush() {
        List<OutputItem> flushed = List.copyOf(items);
        items.clear();
        return flushed;
    }
}
