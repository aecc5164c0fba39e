package com.daddeck.battle.deck;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Category;
import com.daddeck.battle.card.Rarity;
import com.daddeck.battle.card.Stat;
import com.daddeck.battle.card.StatSet;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics derived from a deck's entries, counting every duplicate copy.
 * Average stats are normalized by total card count so deck size alone never wins a battle.
 */
public final class DeckStats {
    private final int totalCards;
    private final int uniqueCards;
    private final Map<Stat, Double> statTotals;
    private final StatSet averageStats;
    private final Map<Category, Integer> categoryBreakdown;
    private final Map<Rarity, Integer> rarityBreakdown;

    private DeckStats(int totalCards, int uniqueCards, Map<Stat, Double> statTotals, StatSet averageStats,
                      Map<Category, Integer> categoryBreakdown, Map<Rarity, Integer> rarityBreakdown) {
        this.totalCards = totalCards;
        this.uniqueCards = uniqueCards;
        this.statTotals = statTotals;
        this.averageStats = averageStats;
        this.categoryBreakdown = categoryBreakdown;
        this.rarityBreakdown = rarityBreakdown;
    }

    static DeckStats compute(List<DeckEntry> entries) {
        int total = 0;
        EnumMap<Stat, Double> totals = new EnumMap<>(Stat.class);
        EnumMap<Category, Integer> categories = new EnumMap<>(Category.class);
        EnumMap<Rarity, Integer> rarities = new EnumMap<>(Rarity.class);
        for (Stat stat : Stat.values()) {
            totals.put(stat, 0.0);
        }
        for (Category category : Category.values()) {
            categories.put(category, 0);
        }
        for (Rarity rarity : Rarity.values()) {
            rarities.put(rarity, 0);
        }

        for (DeckEntry entry : entries) {
            Card card = entry.card();
            int count = entry.count();
            total += count;
            for (Stat stat : Stat.values()) {
                totals.merge(stat, card.getStats().get(stat) * count, Double::sum);
            }
            categories.merge(card.getCategory(), count, Integer::sum);
            rarities.merge(card.getRarity(), count, Integer::sum);
        }

        EnumMap<Stat, Double> averages = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            averages.put(stat, total == 0 ? 0.0 : totals.get(stat) / total);
        }

        return new DeckStats(total, entries.size(),
                Collections.unmodifiableMap(totals),
                StatSet.of(averages),
                Collections.unmodifiableMap(categories),
                Collections.unmodifiableMap(rarities));
    }

    public int getTotalCards() {
        return totalCards;
    }

    public int getUniqueCards() {
        return uniqueCards;
    }

    /**
     * Sum of each stat across every card copy.
     */
    public Map<Stat, Double> getStatTotals() {
        return statTotals;
    }

    public StatSet getAverageStats() {
        return averageStats;
    }

    /**
     * Copies per category, every category present (zero when absent).
     */
    public Map<Category, Integer> getCategoryBreakdown() {
        return categoryBreakdown;
    }

    public Map<Rarity, Integer> getRarityBreakdown() {
        return rarityBreakdown;
    }

    /**
     * Most frequent category; ties resolve to the earliest declared category.
     * An empty deck reports the first category.
     */
    public Category getMainCategory() {
        Category main = Category.values()[0];
        int maxCount = 0;
        for (Map.Entry<Category, Integer> entry : categoryBreakdown.entrySet()) {
            if (entry.getValue() > maxCount) {
                maxCount = entry.getValue();
                main = entry.getKey();
            }
        }
        return main;
    }

    public int getMainCategoryCount() {
        return categoryBreakdown.get(getMainCategory());
    }
}
