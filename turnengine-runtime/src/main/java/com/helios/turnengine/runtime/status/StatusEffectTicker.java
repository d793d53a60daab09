package com.helios.turnengine.runtime.status;

import com.helios.turnengine.api.model.OutputTag;
import com.helios.turnengine.runtime.model.Player;
import com.helios.turnengine.runtime.model.StatusEffect;
import com.helios.turnengine.runtime.model.World;
import com.helios.turnengine.runtime.output.OutputBuffer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Applies one turn of every status effect on the player.
 */
public final class StatusEffectTicker {
    private static final Logger logger = Logger.getLogger(StatusEffectTicker.class.getName());

    /**
     * Outcome of a tick.
     *
     * @param expired names of effects that ran out this turn
     * @param died    true when this tick took the player from alive to 0 HP
     * @param cause   effect that dealt the final damage, null unless {@code died}
     */
    public record Result(List<String> expired, boolean died, String cause) {
        public static final Result NONE = new Result(List.of(), false, null);
    }

    public Result tick(World world, OutputBuffer view) {
        Player player = world.getPlayer();
        if (player.getEffects().isEmpty()) {
            return Result.NONE;
        }

        boolean wasAlive = player.isAlive();
        String cause = null;
        List<StatusEffect> remaining = new ArrayList<>();
        List<String> expired = new ArrayList<>();

        for (StatusEffect effect : player.getEffects()) {
            if (effect.hpPerTurn() != 0) {
                player.setHp(player.getHp() + effect.hpPerTurn());
                if (cause == null && !player.isAlive()) {
                    cause = effect.name();
                }
            }
            StatusEffect next = effect.tick();
            if (next.turnsRemaining() > 0) {
                remaining.add(next);
            } else {
                expired.add(effect.name());
                view.push(OutputTag.STATUS, "The effect of " + effect.name() + " has worn off.");
            }
        }
        player.setEffects(remaining);

        boolean died = wasAlive && !player.isAlive();
        if (died) {
            logger.info("Player died from status effect '" + cause + "' on turn " + world.getTurnCount());
        }
        return new Result(expired, died, died ? cause : null);
    }
}
