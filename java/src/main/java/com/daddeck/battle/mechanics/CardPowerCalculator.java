package com.daddeck.battle.mechanics;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Rarity;
import com.daddeck.battle.card.StatSet;
import com.daddeck.battle.deck.Deck;
import com.daddeck.battle.deck.DeckEntry;

/**
 * Scalar card power: the average of a card's stats scaled by its rarity multiplier.
 */
public final class CardPowerCalculator {

    private CardPowerCalculator() {
        // Utility class - prevent instantiation
    }

    public static double power(Card card) {
        return power(card.getStats(), card.getRarity());
    }

    public static double power(StatSet stats, Rarity rarity) {
        return stats.average() * rarity.getMultiplierTenths() / 10.0;
    }

    /**
     * Mean card power over every copy in the deck, 0 for an empty deck.
     */
    public static double deckPower(Deck deck) {
        int total = deck.size();
        if (total == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (DeckEntry entry : deck.getEntries()) {
            sum += power(entry.card()) * entry.count();
        }
        return sum / total;
    }
}
