package com.helios.turnengine.infra.metrics;

/**
 * Metric names recorded by the engine.
 */
public final class MetricNames {

    public static final String TRIGGERS_FIRED = "turnengine_triggers_fired_total";
    public static final String REFERENCE_ERRORS = "turnengine_reference_errors_total";
    public static final String ACTION_FAILURES = "turnengine_action_failures_total";
    public static final String SCHEDULED_FIRED = "turnengine_scheduled_fired_total";
    public static final String SCHEDULED_CANCELLED = "turnengine_scheduled_cancelled_total";
    public static final String SCHEDULED_RESCHEDULED = "turnengine_scheduled_rescheduled_total";
    public static final String SCHEDULER_PENDING = "turnengine_scheduler_pending";
    public static final String TURN_DURATION = "turnengine_turn_duration";
    public static final String AUTOSAVES = "turnengine_autosaves_total";
    public static final String AUTOSAVE_FAILURES = "turnengine_autosave_failures_total";

    private MetricNames() {
        throw new AssertionError("No instances");
    }
}
