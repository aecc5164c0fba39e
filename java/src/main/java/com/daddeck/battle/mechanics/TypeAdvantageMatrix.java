package com.daddeck.battle.mechanics;

import com.daddeck.battle.card.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Type advantage relation over the fifteen categories.
 * Each category beats exactly two others and loses to exactly two; the rest are neutral.
 * Disadvantages are derived from the single "beats" table, so the two can never disagree.
 */
public final class TypeAdvantageMatrix {

    public static final double ADVANTAGE_MULTIPLIER = 1.2;
    public static final double DISADVANTAGE_MULTIPLIER = 0.8;
    public static final double NEUTRAL_MULTIPLIER = 1.0;

    public static final int ADVANTAGES_PER_CATEGORY = 2;
    public static final int DISADVANTAGES_PER_CATEGORY = 2;

    private static final Map<Category, Set<Category>> BEATS = new EnumMap<>(Category.class);
    private static final Map<Category, Set<Category>> LOSES_TO = new EnumMap<>(Category.class);

    static {
        beats(Category.BBQ_DICKTATOR, Category.GOLF_GONAD, Category.COUCH_CUMMANDER);
        beats(Category.FIX_IT_FUCKBOY, Category.TECH_TWATS, Category.CAR_COCK);
        beats(Category.GOLF_GONAD, Category.COACH_CUMSTERS, Category.COOL_CUCKS);
        beats(Category.COUCH_CUMMANDER, Category.OFFICE_ORGASMS, Category.CHEF_CUMSTERS);
        beats(Category.LAWN_LUNATIC, Category.WAREHOUSE_WANKERS, Category.CHEF_CUMSTERS);
        beats(Category.CAR_COCK, Category.FASHION_FUCK, Category.HOLIDAY_HORNDOGS);
        beats(Category.OFFICE_ORGASMS, Category.CAR_COCK, Category.LAWN_LUNATIC);
        beats(Category.COOL_CUCKS, Category.FASHION_FUCK, Category.COACH_CUMSTERS);
        beats(Category.COACH_CUMSTERS, Category.TECH_TWATS, Category.FIX_IT_FUCKBOY);
        beats(Category.CHEF_CUMSTERS, Category.BBQ_DICKTATOR, Category.HOLIDAY_HORNDOGS);
        beats(Category.HOLIDAY_HORNDOGS, Category.LAWN_LUNATIC, Category.COUCH_CUMMANDER);
        beats(Category.WAREHOUSE_WANKERS, Category.VINTAGE_VAGABONDS, Category.BBQ_DICKTATOR);
        beats(Category.VINTAGE_VAGABONDS, Category.COOL_CUCKS, Category.FIX_IT_FUCKBOY);
        beats(Category.FASHION_FUCK, Category.WAREHOUSE_WANKERS, Category.OFFICE_ORGASMS);
        beats(Category.TECH_TWATS, Category.GOLF_GONAD, Category.VINTAGE_VAGABONDS);

        for (Category category : Category.values()) {
            BEATS.putIfAbsent(category, Collections.unmodifiableSet(EnumSet.noneOf(Category.class)));
            EnumSet<Category> losesTo = EnumSet.noneOf(Category.class);
            for (Category other : Category.values()) {
                if (BEATS.containsKey(other) && BEATS.get(other).contains(category)) {
                    losesTo.add(other);
                }
            }
            LOSES_TO.put(category, Collections.unmodifiableSet(losesTo));
        }

        validate();
    }

    private static void beats(Category attacker, Category first, Category second) {
        BEATS.put(attacker, Collections.unmodifiableSet(EnumSet.of(first, second)));
    }

    private TypeAdvantageMatrix() {
        // Utility class - prevent instantiation
    }

    /**
     * Damage multiplier for an attacker category against a defender category.
     * A null category on either side is neutral.
     *
     * @return 1.2 on advantage, 0.8 on disadvantage, 1.0 otherwise
     */
    public static double advantage(Category attacker, Category defender) {
        if (attacker == null || defender == null) {
            return NEUTRAL_MULTIPLIER;
        }
        if (BEATS.get(attacker).contains(defender)) {
            return ADVANTAGE_MULTIPLIER;
        }
        if (BEATS.get(defender).contains(attacker)) {
            return DISADVANTAGE_MULTIPLIER;
        }
        return NEUTRAL_MULTIPLIER;
    }

    /**
     * Categories this category deals bonus damage to.
     */
    public static Set<Category> advantagesOf(Category category) {
        return BEATS.get(category);
    }

    /**
     * Categories that deal bonus damage to this category.
     */
    public static Set<Category> disadvantagesOf(Category category) {
        return LOSES_TO.get(category);
    }

    /**
     * Categories with no advantage either way, excluding the category itself.
     */
    public static Set<Category> neutralsOf(Category category) {
        EnumSet<Category> neutrals = EnumSet.allOf(Category.class);
        neutrals.remove(category);
        neutrals.removeAll(advantagesOf(category));
        neutrals.removeAll(disadvantagesOf(category));
        return Collections.unmodifiableSet(neutrals);
    }

    public static boolean hasAdvantage(Category attacker, Category defender) {
        return advantage(attacker, defender) == ADVANTAGE_MULTIPLIER;
    }

    public static boolean hasDisadvantage(Category attacker, Category defender) {
        return advantage(attacker, defender) == DISADVANTAGE_MULTIPLIER;
    }

    /**
     * Check the table is balanced: 2 advantages, 2 disadvantages and the rest neutral for every
     * category, nothing beats itself and no pair beats each other.
     *
     * @throws IllegalStateException listing every violation found
     */
    public static void validate() {
        List<String> errors = new ArrayList<>();
        int expectedNeutrals = Category.values().length - 1
                - ADVANTAGES_PER_CATEGORY - DISADVANTAGES_PER_CATEGORY;

        for (Category category : Category.values()) {
            Set<Category> advantages = advantagesOf(category);
            Set<Category> disadvantages = disadvantagesOf(category);

            if (advantages.size() != ADVANTAGES_PER_CATEGORY) {
                errors.add(category + " has " + advantages.size() + " advantages (expected "
                        + ADVANTAGES_PER_CATEGORY + ")");
            }
            if (disadvantages.size() != DISADVANTAGES_PER_CATEGORY) {
                errors.add(category + " has " + disadvantages.size() + " disadvantages (expected "
                        + DISADVANTAGES_PER_CATEGORY + ")");
            }
            if (neutralsOf(category).size() != expectedNeutrals) {
                errors.add(category + " has " + neutralsOf(category).size() + " neutrals (expected "
                        + expectedNeutrals + ")");
            }
            if (advantages.contains(category)) {
                errors.add(category + " has an advantage over itself");
            }
            for (Category beaten : advantages) {
                if (advantagesOf(beaten).contains(category)) {
                    errors.add(category + " and " + beaten + " beat each other");
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Type advantage matrix is unbalanced:\n" + String.join("\n", errors));
        }
    }
}
