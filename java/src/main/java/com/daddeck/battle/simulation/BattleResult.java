package com.daddeck.battle.simulation;

import com.daddeck.battle.deck.Deck;
import com.daddeck.battle.mechanics.HitType;

import java.util.List;

/**
 * Result of a deck-vs-deck battle.
 */
public record BattleResult(
    Deck winner,
    Deck loser,
    int damage,
    double typeAdvantage,
    double synergyBonus,
    SideStats attackerStats,
    SideStats defenderStats,
    HitType hitType,
    double variance,
    /**
     * Seed the battle was resolved with; replaying it reproduces this result.
     */
    long seed,
    int turns,
    List<String> log
) {
    public BattleResult {
        log = List.copyOf(log);
    }

    public boolean attackerWon(Deck attacker) {
        return winner == attacker;
    }
}
