package com.daddeck.battle.mechanics;

/**
 * Deck-wide themed synergy.
 *
 * @param multiplier  1.0, 1.05 or 1.15
 * @param theme       e.g. "BBQ_BROS", empty when the deck has no theme
 * @param description e.g. "BBQ BROS SYNERGY +15%", empty when the deck has no theme
 */
public record DeckSynergy(double multiplier, String theme, String description) {
    public static final DeckSynergy NONE = new DeckSynergy(1.0, "", "");

    public boolean isThemed() {
        return !theme.isEmpty();
    }
}
