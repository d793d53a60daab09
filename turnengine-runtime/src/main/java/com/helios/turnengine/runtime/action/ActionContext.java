package com.helios.turnengine.runtime.action;

import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.api.model.ScheduledEvent;

/**
 * Who is running an action list: the originating trigger (carried into any
 * events it schedules) and the tag used for plain messages.
 */
public record ActionContext(String originTriggerId, OutputTag messageTag) {

    public static ActionContext forTrigger(String triggerId, boolean ambient) {
        return new ActionContext(triggerId, ambient ? OutputTag.AMBIENT_EVENT : OutputTag.TRIGGERED_EVENT);
    }

    public static ActionContext forScheduled(ScheduledEvent event) {
        return new ActionContext(event.originTriggerId(), OutputTag.TRIGGERED_EVENT);
    }

    public static ActionContext direct() {
        return new ActionContext(null, OutputTag.ACTION_SUCCESS);
    }

    String describe() {
        return originTriggerId == null ? "direct call" : "trigger '" + originTriggerId + "'";
    }
}
