package com.daddeck.battle.mechanics;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Stat;
import com.daddeck.battle.card.StatSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;

/**
 * Applies, stacks, ticks and expires status effects.
 * Every operation returns a new list or stat set; inputs are never modified.
 */
public final class StatusEffectEngine {

    /** Potency of each stack beyond the first, relative to the first. */
    public static final double EXTRA_STACK_POTENCY = 0.5;

    private StatusEffectEngine() {
        // Utility class - prevent instantiation
    }

    /**
     * Modify a single stat value by one effect, unclamped.
     * A second stack is half as potent: grilled x2 takes 100 to 70.
     */
    public static double modifyStat(StatusEffect effect, Stat stat, double baseValue) {
        StatusEffectKind kind = effect.kind();
        if (!kind.modifiesStats() || !kind.getAffectedStats().contains(stat)) {
            return baseValue;
        }
        double stackMultiplier = 1 + (effect.stacks() - 1) * EXTRA_STACK_POTENCY;
        return baseValue * (1 + kind.getPercentage() * stackMultiplier);
    }

    public static StatSet applyEffects(Card card, List<StatusEffect> effects) {
        return applyEffects(card.getStats(), effects);
    }

    /**
     * Apply every effect in order, multiplicatively, then clamp each stat to [0, 100].
     * Null entries and kinds without a stat modifier are ignored.
     */
    public static StatSet applyEffects(StatSet stats, List<StatusEffect> effects) {
        EnumMap<Stat, Double> modified = new EnumMap<>(stats.asMap());
        for (StatusEffect effect : effects) {
            if (effect == null) {
                continue;
            }
            for (Stat stat : Stat.values()) {
                modified.put(stat, modifyStat(effect, stat, modified.get(stat)));
            }
        }
        return StatSet.clamped(modified);
    }

    /**
     * Advance one turn: every duration drops by one and effects reaching 0 are removed.
     */
    public static List<StatusEffect> tick(List<StatusEffect> effects) {
        List<StatusEffect> next = new ArrayList<>();
        for (StatusEffect effect : effects) {
            int remaining = effect.duration() - 1;
            if (remaining > 0) {
                next.add(effect.withDuration(remaining));
            }
        }
        return Collections.unmodifiableList(next);
    }

    /**
     * Add an effect. An effect of the same kind gains a stack (max 2) and takes the new
     * duration; durations are never summed. Otherwise the new effect is appended as given.
     */
    public static List<StatusEffect> addEffect(List<StatusEffect> effects, StatusEffect newEffect) {
        List<StatusEffect> next = new ArrayList<>(effects.size() + 1);
        boolean stacked = false;
        for (StatusEffect effect : effects) {
            if (!stacked && effect.kind() == newEffect.kind()) {
                int stacks = Math.min(StatusEffect.MAX_STACKS, effect.stacks() + 1);
                next.add(new StatusEffect(effect.kind(), newEffect.duration(), stacks));
                stacked = true;
            } else {
                next.add(effect);
            }
        }
        if (!stacked) {
            next.add(newEffect);
        }
        return Collections.unmodifiableList(next);
    }

    /**
     * Whether an effect of the kind is active.
     */
    public static boolean hasEffect(List<StatusEffect> effects, StatusEffectKind kind) {
        for (StatusEffect effect : effects) {
            if (effect.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * Stack count of the kind, 0 when absent.
     */
    public static int stacksOf(List<StatusEffect> effects, StatusEffectKind kind) {
        for (StatusEffect effect : effects) {
            if (effect.kind() == kind) {
                return effect.stacks();
            }
        }
        return 0;
    }
}
