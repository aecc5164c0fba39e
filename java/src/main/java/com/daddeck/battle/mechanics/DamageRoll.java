package com.daddeck.battle.mechanics;

import java.util.Locale;

/**
 * One resolved attack.
 *
 * @param damage     final damage, at least 1
 * @param baseDamage damage before the hit multiplier, at least 5
 * @param hitType    branch that fired
 * @param multiplier factor applied to the base (0.5, 1.5 or the variance)
 * @param variance   uniform variance factor in [0.8, 1.2], exactly 1.0 on critical or glancing hits
 */
public record DamageRoll(int damage, double baseDamage, HitType hitType, double multiplier, double variance) {

    /**
     * Variance as a signed percentage, e.g. -12.5.
     */
    public double variancePercent() {
        return (variance - 1.0) * 100.0;
    }

    /**
     * Log text naming the branch and the variance applied.
     */
    public String describe() {
        return switch (hitType) {
            case NORMAL -> String.format(Locale.ROOT, "%s (variance %+.1f%%)", hitType.getLabel(), variancePercent());
            case CRITICAL, GLANCING -> String.format(Locale.ROOT, "%s (variance +0.0%%)", hitType.getLabel());
        };
    }
}
