package com.daddeck.battle.simulation;

import com.daddeck.battle.card.Ability;
import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Category;
import com.daddeck.battle.card.Stat;
import com.daddeck.battle.card.StatSet;
import com.daddeck.battle.mechanics.DamageCalculator;
import com.daddeck.battle.mechanics.DamageRoll;
import com.daddeck.battle.mechanics.StatusEffect;
import com.daddeck.battle.mechanics.StatusEffectKind;
import com.daddeck.battle.rng.SeededRandom;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a single card ability against a target.
 */
public final class AbilityExecutor {

    public static final double STATUS_CHANCE = 0.30;

    // Keyword in the ability name -> attacking stat, first match wins
    private static final Map<String, Stat> STAT_KEYWORDS = new LinkedHashMap<>();

    static {
        STAT_KEYWORDS.put("Grill", Stat.GRILL_SKILL);
        STAT_KEYWORDS.put("Fix", Stat.FIX_IT);
        STAT_KEYWORDS.put("Nap", Stat.NAP_POWER);
        STAT_KEYWORDS.put("Remote", Stat.REMOTE_CONTROL);
        STAT_KEYWORDS.put("Thermostat", Stat.THERMOSTAT);
        STAT_KEYWORDS.put("Sock", Stat.SOCK_SANDAL);
        STAT_KEYWORDS.put("Beer", Stat.BEER_SNOB);
        STAT_KEYWORDS.put("Joke", Stat.DAD_JOKE);
    }

    private static final Map<Category, StatusEffect> CATEGORY_EFFECTS = new EnumMap<>(Category.class);

    static {
        CATEGORY_EFFECTS.put(Category.BBQ_DICKTATOR, StatusEffect.of(StatusEffectKind.GRILLED, 2));
        CATEGORY_EFFECTS.put(Category.COUCH_CUMMANDER, StatusEffect.of(StatusEffectKind.LECTURED, 2));
        CATEGORY_EFFECTS.put(Category.HOLIDAY_HORNDOGS, StatusEffect.of(StatusEffectKind.DRUNK, 2));
        CATEGORY_EFFECTS.put(Category.TECH_TWATS, StatusEffect.of(StatusEffectKind.WIRED, 2));
        CATEGORY_EFFECTS.put(Category.COACH_CUMSTERS, StatusEffect.of(StatusEffectKind.INSPIRED, 3));
    }

    // Rolled only when the category's main effect did not land
    private static final Map<Category, StatusEffect> FALLBACK_EFFECTS = new EnumMap<>(Category.class);

    static {
        FALLBACK_EFFECTS.put(Category.COUCH_CUMMANDER, StatusEffect.of(StatusEffectKind.BORED, 2));
    }

    private AbilityExecutor() {
        // Utility class - prevent instantiation
    }

    /**
     * Stat an ability attacks with, picked by keyword in its name. Defaults to dad joke.
     */
    public static Stat attackStatFor(Ability ability) {
        for (Map.Entry<String, Stat> entry : STAT_KEYWORDS.entrySet()) {
            if (ability.name().contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return Stat.DAD_JOKE;
    }

    /**
     * Status effect a category may attach on hit, or null.
     */
    public static StatusEffect statusEffectFor(Category category) {
        return CATEGORY_EFFECTS.get(category);
    }

    /**
     * Second-chance effect rolled when the main one misses, or null.
     */
    public static StatusEffect fallbackEffectFor(Category category) {
        return FALLBACK_EFFECTS.get(category);
    }

    public static AbilityResult execute(Card card, Card target, int abilityIndex, SeededRandom rng) {
        return execute(card, card.getStats(), target, target.getStats(), abilityIndex, rng);
    }

    /**
     * Use an ability with status-modified stat snapshots for both sides.
     * A missing ability fails without touching the generator.
     */
    public static AbilityResult execute(Card card, StatSet cardStats, Card target, StatSet targetStats,
                                        int abilityIndex, SeededRandom rng) {
        Ability ability = card.getAbility(abilityIndex);
        if (ability == null) {
            return AbilityResult.failed(card.getName() + " forgot what he was doing.");
        }

        Stat attackStat = attackStatFor(ability);
        DamageRoll roll = DamageCalculator.calculate(cardStats, targetStats, attackStat, attackStat, rng);

        List<StatusEffect> statusEffects = new ArrayList<>();
        StatusEffect effect = CATEGORY_EFFECTS.get(card.getCategory());
        if (effect != null && rng.chance(STATUS_CHANCE)) {
            statusEffects.add(effect);
        }
        StatusEffect fallback = FALLBACK_EFFECTS.get(card.getCategory());
        if (fallback != null && statusEffects.isEmpty() && rng.chance(STATUS_CHANCE)) {
            statusEffects.add(fallback);
        }

        List<String> flavorTexts = List.of(
            card.getName() + " uses " + ability.name() + "! " + ability.description(),
            card.getName() + ": \"" + ability.description() + "\"",
            card.getName() + " hits " + target.getName() + " with " + ability.name() + "!",
            ability.name() + " activates! " + target.getSubtitle() + " looks confused."
        );
        String flavorText = rng.pick(flavorTexts);

        return new AbilityResult(true, roll.damage(), flavorText, statusEffects, roll);
    }
}
