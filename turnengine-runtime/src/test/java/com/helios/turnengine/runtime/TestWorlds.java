package com.helios.turnengine.runtime;

import com.helios.turnengine.api.model.Action;
import com.helios.turnengine.api.model.Condition;
import com.helios.turnengine.api.model.EventKind;
import com.helios.turnengine.api.model.EventMatcher;
import com.helios.turnengine.api.model.TriggerDefinition;
import com.helios.turnengine.runtime.model.ContainerState;
import com.helios.turnengine.runtime.model.Exit;
import com.helios.turnengine.runtime.model.GameModel;
import com.helios.turnengine.runtime.model.Goal;
import com.helios.turnengine.runtime.model.Item;
import com.helios.turnengine.runtime.model.Location;
import com.helios.turnengine.runtime.model.ModelStats;
import com.helios.turnengine.runtime.model.Npc;
import com.helios.turnengine.runtime.model.Player;
import com.helios.turnengine.runtime.model.Room;
import com.helios.turnengine.runtime.model.World;

import java.util.List;
import java.util.Map;

/**
 * Small hand-built world shared by runtime tests.
 *
 * <pre>
 *   hall --north--> lab --east (locked)--> vault
 * </pre>
 */
public final class TestWorlds {

    private TestWorlds() {
    }

    public static World lab() {
        World world = new World(42L, new Player("hall", 10));

        Room hall = new Room("hall", "Hall", "A draughty hall.");
        hall.putExit("north", new Exit("lab", false, false));
        hall.setVisited(true);
        Room lab = new Room("lab", "Lab", "Benches and glassware.");
        lab.putExit("south", new Exit("hall", false, false));
        lab.putExit("east", new Exit("vault", true, false));
        Room vault = new Room("vault", "Vault", "Cold and quiet.");
        world.addRoom(hall);
        world.addRoom(lab);
        world.addRoom(vault);

        world.addItem(new Item("key", "Brass Key", "A small key.", Location.room("hall"), null));
        world.addItem(new Item("box", "Lead Box", "A heavy box.", Location.room("lab"), ContainerState.OPEN));
        world.addItem(new Item("coin", "Coin", "A coin.", Location.nowhere(), null));
        world.addItem(new Item("gem", "Gem", "A red gem.", Location.npc("guard"), null));

        world.addNpc(new Npc("guard", "Guard", "A bored guard.", "hall", Npc.DEFAULT_STATE, null,
                Map.of("normal", List.of("Move along.", "Nothing to see here.", "Hm."))));

        world.addSpinner("drip", List.of("Drip.", "Plink.", "Tap."));
        world.addSpinner("silence", List.of(""));

        world.addGoal(new Goal("find-key", "Find the key", null, null,
                new Condition.HasItem("key"), null));
        return world;
    }

    public static GameModel model(World world, List<TriggerDefinition> triggers) {
        return new GameModel(world, triggers, new ModelStats(triggers.size(), 0, 0, 0L, Map.of()));
    }

    public static TriggerDefinition trigger(String id, EventKind kind, Condition condition, Action... actions) {
        return new TriggerDefinition(id, EventMatcher.of(kind), condition, List.of(actions), null, null, null);
    }

    public static TriggerDefinition fireOnce(String id, EventKind kind, Condition condition, Action... actions) {
        return new TriggerDefinition(id, EventMatcher.of(kind), condition, List.of(actions), true, null, null);
    }

    public static Action show(String text) {
        return new Action.ShowMessage(text);
    }
}
