package com.daddeck.battle.mechanics;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Category;
import com.daddeck.battle.card.Rarity;
import com.daddeck.battle.deck.Deck;
import com.daddeck.battle.deck.DeckEntry;
import com.daddeck.battle.deck.DeckStats;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Synergy bonuses: deck-wide category themes and named card-pair alliances.
 */
public final class SynergyCalculator {

    public static final int MAJOR_THEME_COUNT = 5;
    public static final int MINOR_THEME_COUNT = 3;
    public static final double MAJOR_THEME_MULTIPLIER = 1.15;
    public static final double MINOR_THEME_MULTIPLIER = 1.05;

    private static final double TYPE_ALLIANCE_BONUS = 1.3;

    private record Alliance(String name, double bonus, String description, BiPredicate<Card, Card> matches) {
    }

    // Checked in order, first match wins
    private static final List<Alliance> ALLIANCES = List.of(
        new Alliance("Mythic Alliance", 2.0, "Double damage from both mythic cards",
            (a, b) -> a.getRarity() == Rarity.MYTHIC && b.getRarity() == Rarity.MYTHIC),
        new Alliance("Ultimate Cookout", TYPE_ALLIANCE_BONUS, "+30% Grill Skill, both cards",
            bothIn(EnumSet.of(Category.BBQ_DICKTATOR, Category.CHEF_CUMSTERS))),
        new Alliance("HOA Nightmares", TYPE_ALLIANCE_BONUS, "+20% all stats for all lawn/car/warehouse dads",
            bothIn(EnumSet.of(Category.LAWN_LUNATIC, Category.CAR_COCK, Category.WAREHOUSE_WANKERS))),
        new Alliance("Infinite Nap", TYPE_ALLIANCE_BONUS, "Target never wakes up",
            bothIn(EnumSet.of(Category.COUCH_CUMMANDER)))
    );

    private static BiPredicate<Card, Card> bothIn(Set<Category> categories) {
        return (a, b) -> categories.contains(a.getCategory()) && categories.contains(b.getCategory());
    }

    private SynergyCalculator() {
        // Utility class - prevent instantiation
    }

    /**
     * Named alliance between two cards, or {@link PairSynergy#NONE}.
     */
    public static PairSynergy checkSynergy(Card first, Card second) {
        for (Alliance alliance : ALLIANCES) {
            if (alliance.matches().test(first, second)) {
                return new PairSynergy(true, alliance.bonus(), alliance.name(), alliance.description());
            }
        }
        return PairSynergy.NONE;
    }

    /**
     * Themed bonus for a deck whose dominant category reaches 3 (+5%) or 5 (+15%) copies.
     */
    public static DeckSynergy deckSynergy(Deck deck) {
        DeckStats stats = deck.getStats();
        int maxCount = stats.getMainCategoryCount();
        if (maxCount < MINOR_THEME_COUNT) {
            return DeckSynergy.NONE;
        }

        String theme = stats.getMainCategory().getPrefix() + "_BROS";
        String label = theme.replace('_', ' ');
        if (maxCount >= MAJOR_THEME_COUNT) {
            return new DeckSynergy(MAJOR_THEME_MULTIPLIER, theme, label + " SYNERGY +15%");
        }
        return new DeckSynergy(MINOR_THEME_MULTIPLIER, theme, label + " SYNERGY +5%");
    }

    /**
     * Strongest pair synergy between any card of one deck and any card of the other.
     */
    public static PairSynergy bestCrossDeckSynergy(Deck first, Deck second) {
        PairSynergy best = PairSynergy.NONE;
        for (DeckEntry a : first.getEntries()) {
            for (DeckEntry b : second.getEntries()) {
                PairSynergy synergy = checkSynergy(a.card(), b.card());
                if (synergy.hasSynergy() && synergy.synergyBonus() > best.synergyBonus()) {
                    best = synergy;
                }
            }
        }
        return best;
    }
}
