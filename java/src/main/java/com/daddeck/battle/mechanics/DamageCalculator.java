package com.daddeck.battle.mechanics;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Stat;
import com.daddeck.battle.card.StatSet;
import com.daddeck.battle.rng.SeededRandom;

/**
 * Damage for a single attack.
 * <ol>
 *   <li>base = max(attack - defense * 0.5, 5)</li>
 *   <li>10% glancing blow: x0.5, no critical roll</li>
 *   <li>otherwise 5% critical hit: x1.5</li>
 *   <li>otherwise uniform variance in [0.8, 1.2]</li>
 *   <li>round, minimum 1</li>
 * </ol>
 */
public final class DamageCalculator {

    public static final double MIN_BASE_DAMAGE = 5.0;
    public static final double DEFENSE_FACTOR = 0.5;
    public static final double GLANCING_CHANCE = 0.10;
    public static final double GLANCING_MULTIPLIER = 0.5;
    public static final double CRITICAL_CHANCE = 0.05;
    public static final double CRITICAL_MULTIPLIER = 1.5;
    public static final double VARIANCE_MIN = 0.8;
    public static final double VARIANCE_SPAN = 0.4;

    private DamageCalculator() {
        // Utility class - prevent instantiation
    }

    public static double baseDamage(double attackValue, double defenseValue) {
        return Math.max(attackValue - defenseValue * DEFENSE_FACTOR, MIN_BASE_DAMAGE);
    }

    /**
     * Roll damage from raw attack and defense values.
     * Consumes one value from the generator on a glancing blow, two on a critical hit and
     * three on a normal hit.
     */
    public static DamageRoll roll(double attackValue, double defenseValue, SeededRandom rng) {
        double base = baseDamage(attackValue, defenseValue);

        HitType hitType;
        double multiplier;
        double variance = 1.0;
        if (rng.next() < GLANCING_CHANCE) {
            hitType = HitType.GLANCING;
            multiplier = GLANCING_MULTIPLIER;
        } else if (rng.next() < CRITICAL_CHANCE) {
            hitType = HitType.CRITICAL;
            multiplier = CRITICAL_MULTIPLIER;
        } else {
            hitType = HitType.NORMAL;
            variance = VARIANCE_MIN + rng.next() * VARIANCE_SPAN;
            multiplier = variance;
        }

        int damage = (int) Math.max(1, Math.round(base * multiplier));
        return new DamageRoll(damage, base, hitType, multiplier, variance);
    }

    public static DamageRoll calculate(StatSet attacker, StatSet defender,
                                       Stat attackStat, Stat defenseStat, SeededRandom rng) {
        return roll(attacker.get(attackStat), defender.get(defenseStat), rng);
    }

    public static DamageRoll calculate(Card attacker, Card defender,
                                       Stat attackStat, Stat defenseStat, SeededRandom rng) {
        return calculate(attacker.getStats(), defender.getStats(), attackStat, defenseStat, rng);
    }
}
