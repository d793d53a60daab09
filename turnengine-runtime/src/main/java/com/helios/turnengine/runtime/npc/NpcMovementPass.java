package com.helios.turnengine.runtime.npc;

import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.runtime.model.Npc;
import com.helios.turnengine.runtime.model.NpcMovement;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.output.OutputBuffer;
import com.helios.turnengine.runtime.random.TurnRandom;

import java.util.List;
import java.util.SplittableRandom;
import java.util.logging.Logger;

/**
 * Moves NPCs whose movement plan is due on the current turn.
 *
 * <p>Random walks draw from {@link TurnRandom} keyed by the NPC id, so the
 * same save replayed with the same commands moves every NPC identically.
 */
public final class NpcMovementPass {
    private static final Logger logger = Logger.getLogger(NpcMovementPass.class.getName());

    private final TurnRandom random;

    public NpcMovementPass(TurnRandom random) {
        this.random = random;
    }

    public NpcMovementPass(long seedSalt) {
        this(new TurnRandom(seedSalt));
    }

    /**
     * @return number of NPCs that changed rooms
     */
    public int run(World world, OutputBuffer view) {
        long turn = world.getTurnCount();
        int moved = 0;
        for (Npc npc : world.getNpcs()) {
            NpcMovement movement = npc.getMovement();
            if (movement == null || movement.getRooms().isEmpty() || !movement.isDue(turn)) {
                continue;
            }
            String destination = nextRoom(world, npc, movement);
            if (destination == null || destination.equals(npc.getRoom())) {
                continue;
            }
            if (world.room(destination).isEmpty()) {
                logger.warning("NPC '" + npc.getId() + "' cannot move to unknown room '" + destination + "'");
                continue;
            }
            move(world, view, npc, destination);
            movement.setLastMovedTurn(turn);
            moved++;
        }
        return moved;
    }

    private String nextRoom(World world, Npc npc, NpcMovement movement) {
        List<String> rooms = movement.getRooms();
        if (movement.getType() == NpcMovement.Type.RANDOM) {
            SplittableRandom draw = random.forKey(world, npc.getId());
            return rooms.get(draw.nextInt(rooms.size()));
        }

        int next = movement.getCurrentIndex() + 1;
        if (movement.isLoop()) {
            next %= rooms.size();
        } else if (next >= rooms.size()) {
            return null;
        }
        movement.setCurrentIndex(next);
        return rooms.get(next);
    }

    private void move(World world, OutputBuffer view, Npc npc, String destination) {
        String playerRoom = world.getPlayer().getRoom();
        String from = npc.getRoom();
        if (from != null && from.equals(playerRoom)) {
            view.push(OutputTag.NPC_MOVEMENT, npc.getName() + " left.");
        }
        if (destination.equals(playerRoom)) {
            view.push(OutputTag.NPC_MOVEMENT, npc.getName() + " entered.");
        }
        logger.fine(() -> "Moving NPC '" + npc.getId() + "' from " + from + " to " + destination);
        npc.setRoom(destination);
    }
}
