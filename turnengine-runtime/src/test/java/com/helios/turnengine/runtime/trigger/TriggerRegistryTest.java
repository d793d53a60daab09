package com.helios.turnengine.runtime.trigger;

import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.EventKind;
import com.helios.turnengine.api.model.EventMatcher;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.api.model.TriggerDefinition;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.turnengine.runtime.TestWorlds;
import com.helios.turnengine.runtime.action.ActionExecutor;
import com.helios.turnengine.runtime.evaluation.ConditionEvaluator;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.output.OutputBuffer;
import com.helios.turnengine.runtime.scheduler.EventQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.helios.turnengine.runtime.TestWorlds.fireOnce;
import static com.helios.turnengine.runtime.TestWorlds.show;
import static com.helios.turnengine.runtime.TestWorlds.trigger;
import static org.assertj.core.api.Assertions.assertThat;

class TriggerRegistryTest {

    private InMemoryMetricsRegistry metrics;
    private World world;
    private OutputBuffer view;
    private TriggerStateTable states;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        world = TestWorlds.lab();
        view = new OutputBuffer();
    }

    private TriggerRegistry registry(TriggerDefinition... triggers) {
        List<TriggerDefinition> list = List.of(triggers);
        states = new TriggerStateTable(list);
        ActionExecutor executor = new ActionExecutor(new EventQueue(0), states, metrics);
        return new TriggerRegistry(list, states, new ConditionEvaluator(metrics), executor, metrics);
    }

    @Test
    @DisplayName("matching triggers fire in registration order")
    void registrationOrder() {
        TriggerRegistry registry = registry(
                trigger("second-kind", EventKind.DROP, null, show("drop")),
                trigger("first", EventKind.TAKE, null, show("one")),
                trigger("second", EventKind.TAKE, null, show("two")));

        List<String> fired = registry.checkTriggers(GameEvent.of(EventKind.TAKE, "item", "key"), world, view);

        assertThat(fired).containsExactly("first", "second");
        assertThat(view.flush()).extracting(OutputItem::text).containsExactly("one", "two");
        assertThat(metrics.getCounterValue(MetricNames.TRIGGERS_FIRED)).isEqualTo(2);
    }

    @Test
    @DisplayName("event params narrow the match")
    void paramsNarrowMatch() {
        TriggerDefinition onKey = new TriggerDefinition("key-taken",
                new EventMatcher(EventKind.TAKE, Map.of("item", "key")), null, List.of(show("k")), null, null, null);
        TriggerRegistry registry = registry(onKey);

        assertThat(registry.checkTriggers(GameEvent.of(EventKind.TAKE, "item", "coin"), world, view)).isEmpty();
        assertThat(registry.checkTriggers(GameEvent.of(EventKind.TAKE, "item", "key"), world, view))
                .containsExactly("key-taken");
    }

    @Test
    @DisplayName("a fire-once trigger never fires again even while its condition stays true")
    void fireOnceTrigger() {
        TriggerRegistry registry = registry(
                fireOnce("welcome", EventKind.ENTER, new Condition.InRoom("hall"), show("Welcome.")));

        GameEvent enter = GameEvent.of(EventKind.ENTER, "room", "hall");
        assertThat(registry.checkTriggers(enter, world, view)).containsExactly("welcome");
        assertThat(registry.checkTriggers(enter, world, view)).isEmpty();
        assertThat(registry.checkTriggers(enter, world, view)).isEmpty();

        assertThat(states.get("welcome").fired()).isTrue();
        assertThat(states.get("welcome").fireCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("repeatable triggers count each firing")
    void repeatableTrigger() {
        TriggerRegistry registry = registry(trigger("tick", EventKind.TOUCH, null, show("tick")));
        world.incrementTurn();

        registry.checkTriggers(GameEvent.of(EventKind.TOUCH), world, view);
        world.incrementTurn();
        registry.checkTriggers(GameEvent.of(EventKind.TOUCH), world, view);

        assertThat(states.get("tick").fireCount()).isEqualTo(2);
        assertThat(states.get("tick").lastFiredTurn()).isEqualTo(2);
    }

    @Test
    @DisplayName("a false condition or a disabled trigger does not fire")
    void conditionAndEnabled() {
        TriggerRegistry registry = registry(
                trigger("in-lab", EventKind.LOOK_AT, new Condition.InRoom("lab"), show("lab")),
                trigger("off", EventKind.LOOK_AT, null, show("off")));
        states.setEnabled("off", false);

        assertThat(registry.checkTriggers(GameEvent.of(EventKind.LOOK_AT), world, view)).isEmpty();
    }

    @Test
    @DisplayName("a trigger sees the effects of earlier triggers for the same event")
    void earlierTriggerEnablesLater() {
        TriggerRegistry registry = registry(
                trigger("setter", EventKind.OPEN, null, new Action.AddFlag("opened", null)),
                trigger("reader", EventKind.OPEN, new Condition.HasFlag("opened"), show("It opens.")));

        assertThat(registry.checkTriggers(GameEvent.of(EventKind.OPEN), world, view))
                .containsExactly("setter", "reader");
    }

    @Test
    @DisplayName("ambient triggers tag their messages as ambient")
    void ambientTag() {
        TriggerRegistry registry = registry(trigger("drip", EventKind.ALWAYS, null, show("Drip.")));

        registry.checkTriggers(GameEvent.always(), world, view);

        assertThat(view.flush()).containsExactly(OutputItem.of(OutputTag.AMBIENT_EVENT, "Drip."));
    }
}
