package com.helios.turnengine.runtime.random;

import com.helios.turnengine.runtime.model.World;

import java.util.SplittableRandom;

/**
 * Source of the engine's random draws.
 *
 * <p>Every draw gets a fresh {@link SplittableRandom} seeded from the world
 * seed, the current turn, a per-session salt and a key naming what is being
 * drawn. Nothing is carried between draws, so a restored save replayed with
 * the same commands makes the same choices.
 */
public final class TurnRandom {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private final long salt;

    public TurnRandom(long salt) {
        this.salt = salt;
    }

    public SplittableRandom forKey(World world, String key) {
        return new SplittableRandom(seed(world.getSeed(), world.getTurnCount(), key));
    }

    long seed(long worldSeed, long turn, String key) {
        return worldSeed ^ salt ^ (turn * GOLDEN_GAMMA) ^ key.hashCode();
    }
}
