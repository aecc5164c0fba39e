package com.daddeck.battle.simulation;

import com.daddeck.battle.card.Card;

import java.util.List;

/**
 * Outcome of a card-vs-card battle.
 */
public record DuelResult(Card winner, Card loser, int turns, double winnerHp, double loserHp, List<String> log) {
    public DuelResult {
        log = List.copyOf(log);
    }
}
