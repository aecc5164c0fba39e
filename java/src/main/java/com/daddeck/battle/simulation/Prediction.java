package com.daddeck.battle.simulation;

import com.daddeck.battle.card.Card;

/**
 * Heuristic outcome estimate for a card matchup.
 *
 * @param winner     card expected to win
 * @param confidence percentage in (0, 100]
 * @param reason     short explanation
 */
public record Prediction(Card winner, int confidence, String reason) {
}
