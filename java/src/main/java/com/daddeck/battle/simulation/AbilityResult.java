package com.daddeck.battle.simulation;

import com.daddeck.battle.mechanics.DamageRoll;
import com.daddeck.battle.mechanics.HitType;
import com.daddeck.battle.mechanics.StatusEffect;

import java.util.List;

/**
 * Result of one ability use.
 */
public record AbilityResult(
    boolean success,
    int damage,
    String flavorText,
    List<StatusEffect> statusEffects,
    /**
     * Damage roll behind the hit, null when the ability failed.
     */
    DamageRoll roll
) {
    public AbilityResult {
        statusEffects = List.copyOf(statusEffects);
    }

    public static AbilityResult failed(String flavorText) {
        return new AbilityResult(false, 0, flavorText, List.of(), null);
    }

    /**
     * Damage branch, null when the ability failed.
     */
    public HitType hitType() {
        return roll != null ? roll.hitType() : null;
    }

    public boolean isCriticalHit() {
        return hitType() == HitType.CRITICAL;
    }
}
