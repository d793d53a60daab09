package com.helios.turnengine.compiler;

import com.helios.turnengine.api.CompilationListener;
import com.helios.turnengine.api.ITriggerCompiler;
import com.helios.turnengine.api.exceptions.CompilationException;
import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.TriggerDefinition;
import com.helios.turnengine.runtime.model.ContainerState;
import com.helios.turnengine.runtime.model.GameModel;
import com.helios.turnengine.runtime.model.Location;
import com.helios.turnengine.runtime.model.Room;
import com.helios.turnengine.runtime.model.World;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggerCompilerValidationTest {

    private TriggerCompiler compiler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        compiler = new TriggerCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    private Path writeBundle(String json) throws IOException {
        Path bundleFile = tempDir.resolve("bundle.json");
        Files.writeString(bundleFile, json);
        return bundleFile;
    }

    private Path copyFixture() throws IOException {
        Path bundleFile = tempDir.resolve("cellar.json");
        try (InputStream in = getClass().getResourceAsStream("/bundles/cellar.json")) {
            assertThat(in).as("fixture on classpath").isNotNull();
            Files.copy(in, bundleFile);
        }
        return bundleFile;
    }

    /** A one-room world with the given triggers array spliced in. */
    private static String worldWithTriggers(String triggers) {
        return """
                {
                  "world": {
                    "start_room": "hall",
                    "rooms": [ { "id": "hall", "name": "Hall", "description": "Bare." } ],
                    "items": [ { "id": "lamp", "name": "Lamp", "description": "Oil.", "location": { "type": "ROOM", "id": "hall" } } ]
                  },
                  "triggers": %s
                }
                """.formatted(triggers);
    }

    @Nested
    @DisplayName("valid bundle")
    class ValidBundle {

        @Test
        @DisplayName("Should build the prototype world in authoring order")
        void shouldBuildWorld() throws Exception {
            GameModel model = compiler.compile(copyFixture());
            World world = model.newWorld();

            assertThat(world.getSeed()).isEqualTo(7L);
            assertThat(world.getPlayer().getRoom()).isEqualTo("hall");
            assertThat(world.getPlayer().getMaxHp()).isEqualTo(12);
            assertThat(world.getRooms()).extracting(Room::getId).containsExactly("hall", "cellar", "crypt");
            assertThat(world.room("hall").orElseThrow().isVisited()).isTrue();
            assertThat(world.room("cellar").orElseThrow().exit("east").orElseThrow().locked()).isTrue();
            assertThat(world.item("chest").orElseThrow().getContainerState()).isEqualTo(ContainerState.OPEN);
            assertThat(world.item("coin").orElseThrow().getLocation()).isEqualTo(Location.container("chest"));
            assertThat(world.npc("ghost").orElseThrow().getMovement().getRooms()).containsExactly("crypt", "cellar");
            assertThat(world.goal("light-up")).isPresent();
            assertThat(world.spinner("drip").orElseThrow()).hasSize(2);
            assertThat(world.npc("ghost").orElseThrow().dialogueFor("NORMAL")).containsExactly("Leave.", "Cold...");
        }

        @Test
        @DisplayName("Should keep trigger order and flatten nested conditions")
        void shouldFlattenTriggers() throws Exception {
            GameModel model = compiler.compile(copyFixture());

            assertThat(model.getTriggers()).extracting(TriggerDefinition::id)
                    .containsExactly("light-lamp", "enter-cellar", "cellar-drip");

            Condition light = model.getTriggers().get(0).condition();
            assertThat(light).isInstanceOf(Condition.All.class);
            assertThat(((Condition.All) light).conditions()).hasSize(3)
                    .noneMatch(c -> c instanceof Condition.All);

            Action.ScheduleIn warning = (Action.ScheduleIn) model.getTriggers().get(1).actions().get(1);
            assertThat(warning.condition()).isEqualTo(new Condition.All(List.of(new Condition.InRoom("cellar"))));
            assertThat(warning.onFalse().turns()).isEqualTo(1);

            assertThat(model.getStats().triggerCount()).isEqualTo(3);
            assertThat(model.getStats().conditionNodesBefore()).isEqualTo(7);
            assertThat(model.getStats().conditionNodesAfter()).isEqualTo(6);
        }

        @Test
        void newWorldReturnsIndependentCopies() throws Exception {
            GameModel model = compiler.compile(copyFixture());

            World first = model.newWorld();
            first.item("lamp").orElseThrow().setLocation(Location.inventory());

            assertThat(model.newWorld().item("lamp").orElseThrow().getLocation()).isEqualTo(Location.room("hall"));
        }

        @Test
        @DisplayName("Should report every stage to the listener")
        void shouldNotifyListener() throws Exception {
            List<String> started = new ArrayList<>();
            List<String> completed = new ArrayList<>();
            compiler.setCompilationListener(new CompilationListener() {
                @Override
                public void onStageStart(String stageName, int stageNumber, int totalStages) {
                    started.add(stageName + " " + stageNumber + "/" + totalStages);
                }

                @Override
                public void onStageComplete(String stageName, StageResult result) {
                    completed.add(stageName);
                }

                @Override
                public void onError(String stageName, Exception error) {
                    completed.add("error:" + stageName);
                }
            });

            compiler.compile(copyFixture());

            assertThat(started).containsExactly("PARSING 1/4", "VALIDATION 2/4", "NORMALIZATION 3/4", "INDEXING 4/4");
            assertThat(completed).containsExactly("PARSING", "VALIDATION", "NORMALIZATION", "INDEXING");
        }

        @Test
        void shouldBeDiscoverableThroughServiceLoader() {
            assertThat(ServiceLoader.load(ITriggerCompiler.class).findFirst())
                    .containsInstanceOf(TriggerCompiler.class);
        }
    }

    @Nested
    @DisplayName("structural errors")
    class StructuralErrors {

        @Test
        @DisplayName("Should reject malformed JSON")
        void shouldRejectMalformedJson() throws IOException {
            Path bundle = writeBundle("{ \"world\": ");

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Invalid bundle JSON");
        }

        @Test
        void shouldRejectMissingWorld() throws IOException {
            Path bundle = writeBundle("{ \"triggers\": [] }");

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("missing its world");
        }

        @Test
        void shouldRejectUnknownStartRoom() throws IOException {
            Path bundle = writeBundle("""
                    { "world": { "start_room": "attic", "rooms": [ { "id": "hall" } ] } }
                    """);

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Start room does not exist: attic");
        }

        @Test
        void shouldRejectDuplicateRoomIds() throws IOException {
            Path bundle = writeBundle("""
                    { "world": { "start_room": "hall", "rooms": [ { "id": "hall" }, { "id": "hall" } ] } }
                    """);

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Duplicate room id: hall");
        }

        @Test
        void shouldRejectDuplicateTriggerIds() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [
                      { "id": "t", "event": { "kind": "TOUCH" } },
                      { "id": "t", "event": { "kind": "TAKE" } }
                    ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Duplicate trigger id: t");
        }

        @Test
        void shouldRejectMissingTriggerId() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "event": { "kind": "TOUCH" } } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Trigger at index 0 has missing or empty id");
        }

        @Test
        void shouldRejectTriggerWithoutEvent() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "orphan", "actions": [ { "type": "show_message", "text": "Hi" } ] } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Trigger 'orphan' has no event");
        }

        @Test
        void shouldRejectExitToUnknownRoom() throws IOException {
            Path bundle = writeBundle("""
                    { "world": { "start_room": "hall",
                      "rooms": [ { "id": "hall", "exits": [ { "direction": "north", "to": "void" } ] } ] } }
                    """);

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("leads to unknown room: void");
        }
    }

    @Nested
    @DisplayName("dangling references")
    class DanglingReferences {

        @Test
        @DisplayName("Should reject a condition naming an unknown item")
        void shouldRejectUnknownItemInCondition() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "t", "event": { "kind": "TOUCH" },
                        "condition": { "type": "any", "conditions": [ { "type": "has_item", "item": "sword" } ] } } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Trigger 't' references unknown item: sword");
        }

        @Test
        void shouldRejectUnknownRoomInScheduledAction() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "t", "event": { "kind": "TOUCH" },
                        "actions": [ { "type": "schedule_in", "turns": 1,
                                       "actions": [ { "type": "push_player_to", "room": "moon" } ] } ] } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("references unknown room: moon");
        }

        @Test
        void shouldRejectUnknownTriggerInSetTriggerEnabled() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "t", "event": { "kind": "TOUCH" },
                        "actions": [ { "type": "set_trigger_enabled", "trigger": "ghost", "enabled": false } ] } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("references unknown trigger: ghost");
        }

        @Test
        void shouldRejectItemInNonContainer() throws IOException {
            Path bundle = writeBundle("""
                    { "world": { "start_room": "hall", "rooms": [ { "id": "hall" } ],
                      "items": [
                        { "id": "lamp", "location": { "type": "ROOM", "id": "hall" } },
                        { "id": "coin", "location": { "type": "CONTAINER", "id": "lamp" } }
                      ] } }
                    """);

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Item 'coin' is placed in unknown container: lamp");
        }

        @Test
        void shouldRejectNegativeScheduleDelay() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "t", "event": { "kind": "TOUCH" },
                        "actions": [ { "type": "schedule_in", "turns": -2, "actions": [] } ] } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("negative delay: -2");
        }
    }

    @Nested
    @DisplayName("random text and chance")
    class RandomText {

        @Test
        void shouldRejectUnknownSpinner() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "t", "event": { "kind": "ALWAYS" },
                        "actions": [ { "type": "spinner_message", "spinner": "wind" } ] } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("references unknown spinner: wind");
        }

        @Test
        @DisplayName("Should reject a spinner with no lines")
        void shouldRejectEmptySpinner() throws IOException {
            Path bundle = writeBundle("""
                    { "world": { "start_room": "hall", "rooms": [ { "id": "hall" } ],
                      "spinners": { "wind": [] } } }
                    """);

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("Spinner 'wind' has missing or empty lines");
        }

        @Test
        void shouldRejectChanceBelowOne() throws IOException {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "t", "event": { "kind": "ALWAYS" },
                        "condition": { "type": "chance", "one_in": 0.5 } } ]
                    """));

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("chance");
        }

        @Test
        void shouldRejectZeroTurnPause() throws IOException {
            Path bundle = writeBundle("""
                    { "world": { "start_room": "hall", "rooms": [ { "id": "hall" } ],
                      "npcs": [ { "id": "cat", "room": "hall" } ] },
                      "triggers": [ { "id": "t", "event": { "kind": "TOUCH" },
                        "actions": [ { "type": "pause_npc", "npc": "cat", "turns": 0 } ] } ] }
                    """);

            assertThatThrownBy(() -> compiler.compile(bundle))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("pause must be at least 1");
        }

        @Test
        @DisplayName("Should accept the container and NPC control actions")
        void shouldAcceptControlActions() throws Exception {
            Path bundle = writeBundle(worldWithTriggers("""
                    [ { "id": "t", "event": { "kind": "TOUCH" },
                        "condition": { "type": "chance", "one_in": 4 },
                        "actions": [
                          { "type": "set_container_state", "item": "lamp", "state": "CLOSED" },
                          { "type": "lock_item", "item": "lamp" },
                          { "type": "unlock_item", "item": "lamp" }
                        ] } ]
                    """));

            GameModel model = compiler.compile(bundle);

            assertThat(model.getTriggers().get(0).actions()).containsExactly(
                    new Action.SetContainerState("lamp", ContainerState.CLOSED),
                    new Action.LockItem("lamp"),
                    new Action.UnlockItem("lamp"));
        }
    }
}
