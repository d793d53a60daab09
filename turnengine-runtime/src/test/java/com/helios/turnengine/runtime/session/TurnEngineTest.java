package com.helios.turnengine.runtime.session;

import com.helios.turnengine.api.exceptions.QueueCorruptionException;
import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.EngineSnapshot;
import com.helios.turnengine.api.model.EventKind;
import com.helios.turnengine.api.model.GameEvent;
import com.helios.turnengine.api.model.OnFalsePolicy;
import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.api.model.ScheduledEvent;
import com.helios.turnengine.api.model.SchedulerState;
import com.helios.turnengine.api.model.TurnReport;
import com.helios.turnengine.infra.config.EngineConfig;
import com.helios.turnengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.turnengine.runtime.TestWorlds;
import com.helios.turnengine.runtime.model.GameModel;
import com.helios.turnengine.runtime.model.GoalStatus;
import com.helios.turnengine.runtime.model.Location;
import com.helios.turnengine.runtime.model.StatusEffect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.helios.turnengine.runtime.TestWorlds.fireOnce;
import static com.helios.turnengine.runtime.TestWorlds.show;
import static com.helios.turnengine.runtime.TestWorlds.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TurnEngine")
class TurnEngineTest {

    private GameModel model;
    private List<OutputItem> rendered;

    @BeforeEach
    void setUp() {
        model = TestWorlds.model(TestWorlds.lab(), List.of(
                trigger("ping", EventKind.TOUCH, null,
                        new Action.ScheduleIn(1, null, null, List.of(show("Ping")), "echo")),
                trigger("take-key", EventKind.TAKE, null,
                        new Action.SpawnItemInInventory("key"), show("Taken.")),
                fireOnce("enter-lab", EventKind.ENTER, new Condition.InRoom("lab"),
                        show("The lab hums."), new Action.AwardPoints(5, null)),
                trigger("wait-for-key", EventKind.LOOK_AT, null,
                        new Action.ScheduleIn(1, new Condition.HasItem("key"), OnFalsePolicy.retryNextTurn(),
                                List.of(show("The key glints.")), null)),
                trigger("drip", EventKind.ALWAYS, new Condition.InRoom("vault"), show("Water drips.")),
                trigger("death", EventKind.PLAYER_DEATH, null, show("You collapse."))));
        rendered = new ArrayList<>();
    }

    private TurnEngine newEngine() {
        return TurnEngine.builder(model)
                .config(EngineConfig.forTesting())
                .metrics(new InMemoryMetricsRegistry())
                .outputSink(rendered::addAll)
                .build();
    }

    /** One counting command: dispatch, advance the clock, finish the cycle. */
    private static TurnReport command(TurnEngine engine, GameEvent event) {
        engine.react(event);
        engine.advanceClock();
        return engine.advanceTurn();
    }

    private static List<String> texts(TurnReport report) {
        return report.output().stream().map(OutputItem::text).toList();
    }

    @Nested
    @DisplayName("turn cycle")
    class Cycle {

        @Test
        @DisplayName("an event scheduled one turn ahead fires at the end of the same command")
        void pingFiresInSameCycle() {
            TurnEngine engine = newEngine();

            TurnReport report = command(engine, GameEvent.of(EventKind.TOUCH));

            assertThat(report.turn()).isEqualTo(1);
            assertThat(texts(report)).containsExactly("Ping");
            assertThat(engine.listPending()).isEmpty();
        }

        @Test
        @DisplayName("a command that does not advance the clock skips the drain but still runs ambient triggers")
        void nonCountingCommand() {
            TurnEngine engine = newEngine();
            engine.world().getPlayer().setRoom("vault");

            engine.react(GameEvent.of(EventKind.TOUCH));
            TurnReport report = engine.advanceTurn();

            assertThat(report.turnAdvanced()).isFalse();
            assertThat(texts(report)).containsExactly("Water drips.");
            assertThat(engine.listPending()).hasSize(1);

            engine.advanceClock();
            assertThat(texts(engine.advanceTurn())).containsExactly("Ping", "Water drips.");
        }

        @Test
        @DisplayName("a retrying event fires once its condition becomes true")
        void retryUntilTrue() {
            TurnEngine engine = newEngine();

            assertThat(texts(command(engine, GameEvent.of(EventKind.LOOK_AT)))).isEmpty();
            assertThat(texts(command(engine, GameEvent.of(EventKind.TAKE)))).containsExactly("Taken.", "The key glints.");
        }

        @Test
        @DisplayName("output is flushed to the sink")
        void flushToSink() {
            TurnEngine engine = newEngine();

            command(engine, GameEvent.of(EventKind.TAKE));

            assertThat(rendered).containsExactly(OutputItem.of(OutputTag.TRIGGERED_EVENT, "Taken."));
            assertThat(engine.pendingOutput()).isEmpty();
        }

        @Test
        @DisplayName("status effects tick when the turn advances and death raises PLAYER_DEATH")
        void playerDeath() {
            TurnEngine engine = newEngine();
            engine.world().getPlayer().applyEffect(new StatusEffect("venom", -10, 2));

            TurnReport report = command(engine, GameEvent.of(EventKind.DROP));

            assertThat(engine.world().getPlayer().isAlive()).isFalse();
            assertThat(texts(report)).contains("You collapse.");
        }
    }

    @Nested
    @DisplayName("react")
    class React {

        @Test
        @DisplayName("the fallback message is written when nothing fires for a player event")
        void fallbackForPlayerEvents() {
            TurnEngine engine = newEngine();

            assertThat(engine.react(GameEvent.of(EventKind.INGEST))).isEmpty();

            assertThat(engine.pendingOutput())
                    .containsExactly(OutputItem.of(OutputTag.ACTION_FAILURE, "Nothing happens."));
        }

        @Test
        @DisplayName("engine events and checkTriggers never produce the fallback")
        void noFallbackOtherwise() {
            TurnEngine engine = newEngine();

            engine.react(GameEvent.always());
            engine.checkTriggers(GameEvent.of(EventKind.INGEST));

            assertThat(engine.pendingOutput()).isEmpty();
        }

        @Test
        void fireOnceAcrossCommands() {
            TurnEngine engine = newEngine();
            engine.world().getPlayer().setRoom("lab");

            assertThat(engine.react(GameEvent.of(EventKind.ENTER, "room", "lab"))).containsExactly("enter-lab");
            assertThat(engine.react(GameEvent.of(EventKind.ENTER, "room", "lab"))).isEmpty();
            assertThat(engine.world().getPlayer().getScore()).isEqualTo(5);
            assertThat(engine.triggerStates().get("enter-lab").fired()).isTrue();
        }
    }

    @Test
    @DisplayName("turn listeners run after every cycle in registration order")
    void turnListeners() {
        List<String> calls = new ArrayList<>();
        TurnEngine engine = TurnEngine.builder(model)
                .config(EngineConfig.forTesting())
                .metrics(new InMemoryMetricsRegistry())
                .turnListener((e, report) -> calls.add("first@" + report.turn()))
                .turnListener((e, report) -> calls.add("second@" + report.turn() + ":" + report.turnAdvanced()))
                .build();

        command(engine, GameEvent.of(EventKind.TOUCH));
        engine.advanceTurn();

        assertThat(calls).containsExactly("first@1", "second@1:true", "first@1", "second@1:false");
    }

    @Test
    void spawnIntoInventoryAndGoals() {
        TurnEngine engine = newEngine();
        assertThat(engine.goalStatus("find-key")).isEqualTo(GoalStatus.ACTIVE);

        engine.spawnIntoInventory("key");

        assertThat(engine.world().item("key").orElseThrow().getLocation()).isEqualTo(Location.inventory());
        assertThat(engine.goalStatuses()).containsEntry("find-key", GoalStatus.COMPLETE);
    }

    @Test
    @DisplayName("sessions do not share world state")
    void sessionsAreIsolated() {
        TurnEngine first = newEngine();
        first.spawnIntoInventory("key");

        assertThat(newEngine().world().item("key").orElseThrow().getLocation()).isEqualTo(Location.room("hall"));
    }

    @Nested
    @DisplayName("snapshot and restore")
    class SnapshotRestore {

        @Test
        @DisplayName("a restored session replays identically to an uninterrupted one")
        void deterministicReplay() {
            TurnEngine original = newEngine();
            command(original, GameEvent.of(EventKind.LOOK_AT));
            original.react(GameEvent.of(EventKind.TOUCH));
            EngineSnapshot snapshot = original.snapshot();

            TurnEngine restored = TurnEngine.restore(model, snapshot, EngineConfig.forTesting());

            List<GameEvent> script = List.of(
                    GameEvent.of(EventKind.LOOK_AT),
                    GameEvent.of(EventKind.TAKE),
                    GameEvent.of(EventKind.TOUCH));
            for (GameEvent event : script) {
                TurnReport a = command(original, event);
                TurnReport b = command(restored, event);
                assertThat(b.output()).isEqualTo(a.output());
                assertThat(b.drain()).isEqualTo(a.drain());
                assertThat(restored.listPending()).isEqualTo(original.listPending());
                assertThat(restored.triggerStates()).isEqualTo(original.triggerStates());
            }
        }

        @Test
        @DisplayName("pending events due before the current turn are rejected")
        void corruptQueue() {
            TurnEngine engine = newEngine();
            engine.advanceClock();
            engine.advanceClock();
            EngineSnapshot good = engine.snapshot();
            ScheduledEvent stale = new ScheduledEvent(1, 1, null, List.of(), null, null, null);
            EngineSnapshot bad = new EngineSnapshot(good.formatVersion(), good.world(), good.triggers(),
                    new SchedulerState(2, List.of(stale), List.of()), good.lastCycleTurn());

            assertThatThrownBy(() -> TurnEngine.restore(model, bad, EngineConfig.forTesting()))
                    .isInstanceOf(QueueCorruptionException.class)
                    .hasMessageContaining("Scheduled event #1");
        }

        @Test
        void unsupportedFormatIsRejected() {
            EngineSnapshot good = newEngine().snapshot();
            EngineSnapshot future = new EngineSnapshot(99, good.world(), good.triggers(), good.scheduler(),
                    good.lastCycleTurn());

            assertThatThrownBy(() -> TurnEngine.restore(model, future, EngineConfig.forTesting()))
                    .isInstanceOf(QueueCorruptionException.class)
                    .hasMessageContaining("format version 99");
        }
    }

    @Nested
    @DisplayName("developer surface")
    class DeveloperSurface {

        @Test
        void cancelAndDelay() {
            TurnEngine engine = newEngine();
            engine.react(GameEvent.of(EventKind.TOUCH));
            long id = engine.listPending().get(0).id();

            long delayed = engine.delayScheduled(id, 2).orElseThrow();
            assertThat(engine.listPending()).singleElement()
                    .satisfies(row -> assertThat(row.dueTurn()).isEqualTo(3));

            assertThat(engine.cancelScheduled(delayed)).isTrue();
            assertThat(engine.cancelScheduled(delayed)).isFalse();
            assertThat(engine.listPending()).isEmpty();
        }
    }
}
