package com.daddeck.battle.mechanics;

import java.util.Objects;

/**
 * A timed, stacking modifier on a card's stats.
 *
 * @param kind     what the effect does
 * @param duration turns remaining, never negative
 * @param stacks   1 or 2
 */
public record StatusEffect(StatusEffectKind kind, int duration, int stacks) {
    public static final int MAX_STACKS = 2;

    public StatusEffect {
        Objects.requireNonNull(kind, "status effect kind");
        if (duration < 0) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        if (stacks < 1 || stacks > MAX_STACKS) {
            throw new IllegalArgumentException("Stacks must be between 1 and " + MAX_STACKS + ": " + stacks);
        }
    }

    /**
     * Fresh single-stack effect.
     */
    public static StatusEffect of(StatusEffectKind kind, int duration) {
        return new StatusEffect(kind, duration, 1);
    }

    public StatusEffect withDuration(int newDuration) {
        return new StatusEffect(kind, newDuration, stacks);
    }

    @Override
    public String toString() {
        return kind.getJsonValue() + (stacks > 1 ? " x" + stacks : "") + " (" + duration + " turns)";
    }
}
