package com.daddeck.battle.mechanics;

/**
 * Outcome of a card-vs-card synergy check.
 */
public record PairSynergy(boolean hasSynergy, double synergyBonus, String synergyName, String description) {
    public static final PairSynergy NONE = new PairSynergy(false, 1.0, "", "");
}
