package com.daddeck.battle.deck;

import com.daddeck.battle.card.Card;

import java.util.Objects;

/**
 * A card and how many copies of it a deck holds.
 */
public record DeckEntry(Card card, int count) {
    public DeckEntry {
        Objects.requireNonNull(card, "card");
        if (count < 1) {
            throw new IllegalArgumentException("Card count must be at least 1, got " + count + " for " + card.getId());
        }
    }
}
