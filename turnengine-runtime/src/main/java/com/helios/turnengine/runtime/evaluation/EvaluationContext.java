package com.helios.turnengine.runtime.evaluation;

import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.runtime.model.World;

import java.util.HashSet;
import java.util.Set;

/**
 * Per-evaluation state: the world being read, the event being handled (if
 * any), and the goals currently under evaluation so that goals referring to
 * each other cannot recurse forever.
 *
 * <p>{@code scope} names who asked for the evaluation (a trigger, a
 * scheduled event, a goal) and keys the {@code chance} draws together with
 * a running draw index.
 */
final class EvaluationContext {

    private final World world;
    private final GameEvent event;
    private final String scope;
    private final Set<String> goalsInProgress = new HashSet<>();
    private int draws;

    EvaluationContext(World world, GameEvent event, String scope) {
        this.world = world;
        this.event = event;
        this.scope = scope;
    }

    World world() {
        return world;
    }

    GameEvent event() {
        return event;
    }

    /** Key for the next random draw in this evaluation. */
    String nextDrawKey() {
        return "chance:" + scope + ":" + event.kind().name() + ":" + draws++;
    }

    boolean enterGoal(String goalId) {
        return goalsInProgress.add(goalId);
    }

    void exitGoal(String goalId) {
        goalsInProgress.remove(goalId);
    }
}
