package com.helios.turnengine.runtime.scheduler;

import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.DrainReport;
import com.helios.turnengine.api.model.OnFalsePolicy;
import com.helios.turnengine.api.model.OutputItem;
import com.helios.turnengine.api.model.PendingEventView;
import com.helios.turnengine.api.model.ScheduledEvent;
import com.helios.turnengine.api.model.Tombstone;
import com.helios.turnengine.infra.metrics.MetricNames;
import com.helios.turnengine.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.helios.turnengine.runtime.TestWorlds;
import com.helios.turnengine.runtime.action.ActionExecutor;
import com.helios.turnengine.runtime.evaluation.ConditionEvaluator;
import com.helios.turnengine.runtime.model.Flag;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.output.OutputBuffer;
import com.helios.turnengine.runtime.trigger.TriggerStateTable;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalLong;

import static com.helios.turnengine.runtime.TestWorlds.show;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Scheduler")
class SchedulerTest {

    private InMemoryMetricsRegistry metrics;
    private EventQueue queue;
    private Scheduler scheduler;
    private World world;
    private OutputBuffer view;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        queue = new EventQueue(0);
        ConditionEvaluator evaluator = new ConditionEvaluator(metrics);
        ActionExecutor executor = new ActionExecutor(queue, new TriggerStateTable(List.of()), metrics);
        scheduler = new Scheduler(queue, evaluator, executor, OpenTelemetry.noop().getTracer("test"), metrics);
        world = TestWorlds.lab();
        view = new OutputBuffer();
    }

    private long schedule(long due, Condition condition, OnFalsePolicy policy, Action... actions) {
        return queue.insert(due, condition, List.of(actions), policy, null, null);
    }

    private List<String> texts() {
        return view.flush().stream().map(OutputItem::text).toList();
    }

    @Nested
    @DisplayName("drainDue")
    class Drain {

        @Test
        @DisplayName("two events due on the same turn run in insertion order")
        void insertionOrder() {
            schedule(5, null, null, show("A"));
            schedule(5, null, null, show("B"));

            scheduler.drainDue(5, world, view);

            assertThat(texts()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("only events due at or before the current turn are resolved")
        void onlyDueEvents() {
            schedule(3, null, null, show("early"));
            schedule(6, null, null, show("late"));

            DrainReport report = scheduler.drainDue(4, world, view);

            assertThat(texts()).containsExactly("early");
            assertThat(report.resolutions()).hasSize(1);
            assertThat(queue.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("a true condition fires, runs the actions and tombstones the event")
        void fired() {
            long id = schedule(2, new Condition.InRoom("hall"), null, show("Ping"));

            DrainReport report = scheduler.drainDue(2, world, view);

            assertThat(report.count(Tombstone.Status.FIRED)).isEqualTo(1);
            assertThat(queue.tombstone(id)).hasValueSatisfying(t -> {
                assertThat(t.status()).isEqualTo(Tombstone.Status.FIRED);
                assertThat(t.resolvedTurn()).isEqualTo(2);
            });
            assertThat(queue.isPending(id)).isFalse();
            assertThat(metrics.getCounterValue(MetricNames.SCHEDULED_FIRED)).isEqualTo(1);
        }

        @Test
        @DisplayName("cancel removes the event for good")
        void cancelPolicy() {
            long id = schedule(2, new Condition.HasFlag("never"), OnFalsePolicy.cancel(), show("nope"));

            scheduler.drainDue(2, world, view);
            world.getPlayer().putFlag(Flag.simple("never", 2));
            scheduler.drainDue(3, world, view);
            scheduler.drainDue(4, world, view);

            assertThat(texts()).isEmpty();
            assertThat(queue.size()).isZero();
            assertThat(queue.tombstone(id).orElseThrow().status()).isEqualTo(Tombstone.Status.CANCELLED);
        }

        @Test
        @DisplayName("retry clones the event under a new id due after the current turn")
        void retryAfter() {
            long id = schedule(2, new Condition.HasFlag("ready"), OnFalsePolicy.retryAfter(3), show("go"));

            scheduler.drainDue(2, world, view);

            Tombstone tombstone = queue.tombstone(id).orElseThrow();
            assertThat(tombstone.status()).isEqualTo(Tombstone.Status.RESCHEDULED);
            ScheduledEvent clone = queue.get(tombstone.successorId()).orElseThrow();
            assertThat(clone.id()).isNotEqualTo(id);
            assertThat(clone.dueTurn()).isEqualTo(5);

            world.getPlayer().putFlag(Flag.simple("ready", 4));
            scheduler.drainDue(5, world, view);
            assertThat(texts()).containsExactly("go");
        }

        @Test
        @DisplayName("RetryAfter{0} behaves as RetryAfter{1} and is not retried within the same pass")
        void retryZeroIsClamped() {
            schedule(2, new Condition.HasFlag("ready"), OnFalsePolicy.retryAfter(0), show("go"));

            DrainReport report = scheduler.drainDue(2, world, view);

            assertThat(report.resolutions()).hasSize(1);
            assertThat(queue.pending()).singleElement()
                    .extracting(ScheduledEvent::dueTurn).isEqualTo(3L);
        }

        @Test
        @DisplayName("each due event gets exactly one terminal resolution")
        void singleResolution() {
            long fired = schedule(1, null, null, show("x"));
            long cancelled = schedule(1, Condition.any(), OnFalsePolicy.cancel());
            long retried = schedule(1, Condition.any(), OnFalsePolicy.retryNextTurn());

            DrainReport report = scheduler.drainDue(1, world, view);

            assertThat(report.resolutions()).extracting(Tombstone::eventId)
                    .containsExactly(fired, cancelled, retried);
            assertThat(queue.tombstones()).hasSize(3);
            assertThat(queue.pending()).hasSize(1);
        }

        @Test
        @DisplayName("events scheduled by fired actions wait for the next drain")
        void insertedDuringDrainWait() {
            schedule(2, null, null, new Action.ScheduleIn(0, null, null, List.of(show("chained")), null));

            scheduler.drainDue(2, world, view);
            assertThat(texts()).isEmpty();
            assertThat(queue.size()).isEqualTo(1);

            scheduler.drainDue(2, world, view);
            assertThat(texts()).containsExactly("chained");
        }

        @Test
        void pendingGaugeTracksQueueSize() {
            schedule(1, null, null);
            schedule(9, null, null);

            scheduler.drainDue(1, world, view);

            assertThat(metrics.getGaugeValue(MetricNames.SCHEDULER_PENDING)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("developer operations")
    class Developer {

        @Test
        void listPending() {
            queue.insert(4, Condition.all(new Condition.HasFlag("a"), new Condition.InRoom("lab")),
                    List.of(show("x"), show("y")), OnFalsePolicy.retryAfter(2), "t", "wake up");

            List<PendingEventView> pending = scheduler.listPending();

            assertThat(pending).singleElement().satisfies(row -> {
                assertThat(row.actionCount()).isEqualTo(2);
                assertThat(row.policy()).isEqualTo("retry+2");
                assertThat(row.condition()).isEqualTo("all(hasFlag:a, inRoom:lab)");
                assertThat(row.toString()).contains("#1 turn 4").contains("note=\"wake up\"");
            });
        }

        @Test
        void cancelById() {
            long id = schedule(4, null, null, show("x"));

            assertThat(scheduler.cancel(id, 1)).isTrue();
            assertThat(scheduler.cancel(id, 1)).isFalse();
            assertThat(queue.tombstone(id).orElseThrow().status()).isEqualTo(Tombstone.Status.CANCELLED);

            scheduler.drainDue(4, world, view);
            assertThat(texts()).isEmpty();
        }

        @Test
        @DisplayName("delay replaces the event with a later clone")
        void delayById() {
            long id = schedule(4, null, null, show("x"));

            OptionalLong newId = scheduler.delay(id, 3, 1);

            assertThat(newId).isPresent();
            assertThat(queue.get(newId.getAsLong()).orElseThrow().dueTurn()).isEqualTo(7);
            assertThat(queue.tombstone(id).orElseThrow().successorId()).isEqualTo(newId.getAsLong());
            assertThat(scheduler.delay(999, 1, 1)).isEmpty();
            assertThatThrownBy(() -> scheduler.delay(newId.getAsLong(), -1, 1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
