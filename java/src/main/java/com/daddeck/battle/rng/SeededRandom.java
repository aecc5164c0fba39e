package com.daddeck.battle.rng;

import java.security.SecureRandom;
import java.util.List;

/**
 * Seeded random number generator for reproducible battles.
 * Mulberry32 over the lower 32 bits of the seed, so a given seed always
 * yields the same sequence. Every battle owns its instance; nothing is shared.
 */
public final class SeededRandom {
    private final long seed;
    private long state;

    /**
     * Create a generator with the specified seed.
     */
    public SeededRandom(long seed) {
        this.seed = seed;
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a generator with a random seed from SecureRandom.
     * The chosen seed is available from {@link #getSeed()} so the battle can be replayed.
     */
    public SeededRandom() {
        this(new SecureRandom().nextInt() & 0xFFFFFFFFL);
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) Math.floor(next() * bound);
    }

    /**
     * Roll against a probability. Consumes exactly one value.
     */
    public boolean chance(double probability) {
        return next() < probability;
    }

    /**
     * Pick one element of a non-empty list.
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    /**
     * The seed this generator was created with.
     */
    public long getSeed() {
        return seed;
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
