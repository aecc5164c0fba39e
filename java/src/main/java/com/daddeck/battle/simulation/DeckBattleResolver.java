package com.daddeck.battle.simulation;

import com.daddeck.battle.card.Category;
import com.daddeck.battle.deck.Deck;
import com.daddeck.battle.mechanics.CardPowerCalculator;
import com.daddeck.battle.mechanics.DamageCalculator;
import com.daddeck.battle.mechanics.DamageRoll;
import com.daddeck.battle.mechanics.DeckSynergy;
import com.daddeck.battle.mechanics.PairSynergy;
import com.daddeck.battle.mechanics.SynergyCalculator;
import com.daddeck.battle.mechanics.TypeAdvantageMatrix;
import com.daddeck.battle.rng.SeededRandom;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resolves a battle between two decks in a single exchange.
 *
 * <p>Deck power is normalized by card count, so a small deck of strong cards beats a large deck
 * of weak ones. The attacker's power is scaled by the type advantage of its main category and its
 * themed synergy bonus; the defender keeps its normalized power. The attacker wins only with
 * strictly greater final power. The damage roll's variance changes the reported damage, never
 * the verdict.
 *
 * <p>The same decks and seed always produce the same result, log included.
 */
public final class DeckBattleResolver {

    private DeckBattleResolver() {
        // Utility class - prevent instantiation
    }

    public static BattleResult resolve(Deck attacker, Deck defender) {
        return resolve(attacker, defender, new SeededRandom());
    }

    public static BattleResult resolve(Deck attacker, Deck defender, long seed) {
        return resolve(attacker, defender, new SeededRandom(seed));
    }

    public static BattleResult resolve(Deck attacker, Deck defender, SeededRandom rng) {
        double attackerPower = CardPowerCalculator.deckPower(attacker);
        double defenderPower = CardPowerCalculator.deckPower(defender);

        Category attackerType = attacker.getStats().getMainCategory();
        Category defenderType = defender.getStats().getMainCategory();

        double typeAdvantage = TypeAdvantageMatrix.advantage(attackerType, defenderType);
        DeckSynergy synergy = SynergyCalculator.deckSynergy(attacker);
        PairSynergy combo = SynergyCalculator.bestCrossDeckSynergy(attacker, defender);

        double effectiveAttackerPower = attackerPower * typeAdvantage;
        double finalAttackerPower = effectiveAttackerPower * synergy.multiplier();

        DamageRoll roll = DamageCalculator.roll(finalAttackerPower, defenderPower, rng);

        boolean attackerWins = finalAttackerPower > defenderPower;
        Deck winner = attackerWins ? attacker : defender;
        Deck loser = attackerWins ? defender : attacker;

        List<String> log = new ArrayList<>();
        log.add("⚔️ BATTLE: " + attacker.getName() + " (" + attacker.size() + " cards) vs "
                + defender.getName() + " (" + defender.size() + " cards)");
        log.add(String.format(Locale.ROOT, "Attacker normalized power: %.1f", attackerPower));
        log.add(String.format(Locale.ROOT, "Defender normalized power: %.1f", defenderPower));
        if (typeAdvantage > 1.0) {
            log.add(String.format(Locale.ROOT, "%s has advantage over %s! (+%d%% damage)",
                    attackerType, defenderType, Math.round((typeAdvantage - 1) * 100)));
        } else if (typeAdvantage < 1.0) {
            log.add(String.format(Locale.ROOT, "%s at disadvantage against %s! (%d%% damage)",
                    attackerType, defenderType, Math.round(typeAdvantage * 100)));
        } else {
            log.add("No type advantage");
        }
        if (synergy.isThemed()) {
            log.add(synergy.description());
        }
        if (combo.hasSynergy()) {
            log.add("Cross-deck combo available: " + combo.synergyName());
        }
        log.add(String.format(Locale.ROOT, "Final attacker power: %.1f", finalAttackerPower));
        log.add("");
        log.add("🎲 RNG System:");
        log.add("  " + roll.hitType().getLabel());
        log.add(String.format(Locale.ROOT, "  Variance: %+.1f%%", roll.variancePercent()));
        log.add(String.format(Locale.ROOT, "  Base damage: %.0f", Math.floor(roll.baseDamage())));
        log.add("  Final damage: " + roll.damage());
        log.add("");
        log.add("🏆 Winner: " + winner.getName());

        SideStats attackerStats = new SideStats(attackerPower, effectiveAttackerPower, finalAttackerPower,
                attackerType, attacker.getStats().getAverageStats());
        SideStats defenderStats = new SideStats(defenderPower, defenderPower, defenderPower,
                defenderType, defender.getStats().getAverageStats());

        return new BattleResult(winner, loser, roll.damage(), typeAdvantage, synergy.multiplier(),
                attackerStats, defenderStats, roll.hitType(), roll.variance(), rng.getSeed(), 1, log);
    }
}
