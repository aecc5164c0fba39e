package com.daddeck.battle.simulation;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.StatSet;
import com.daddeck.battle.mechanics.CardPowerCalculator;
import com.daddeck.battle.mechanics.PairSynergy;
import com.daddeck.battle.mechanics.StatusEffect;
import com.daddeck.battle.mechanics.StatusEffectEngine;
import com.daddeck.battle.mechanics.StatusEffectKind;
import com.daddeck.battle.mechanics.SynergyCalculator;
import com.daddeck.battle.mechanics.TypeAdvantageMatrix;
import com.daddeck.battle.rng.SeededRandom;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turn-based battle between two cards.
 * Each card starts with power x 10 HP. Every turn the active card uses its next ability on the
 * other, then both sides' status effects tick and roles swap. The battle ends when a card drops
 * to 0 HP or after 10 turns, when the card with more HP left wins.
 */
public final class BattleSimulator {

    public static final int MAX_TURNS = 10;
    public static final int HP_PER_POWER = 10;
    public static final double DRUNK_MISS_CHANCE = 0.30;

    private BattleSimulator() {
        // Utility class - prevent instantiation
    }

    public static DuelResult simulate(Card first, Card second) {
        return simulate(first, second, new SeededRandom());
    }

    public static DuelResult simulate(Card first, Card second, long seed) {
        return simulate(first, second, new SeededRandom(seed));
    }

    public static DuelResult simulate(Card first, Card second, SeededRandom rng) {
        Card[] cards = {first, second};
        double[] hp = {
            CardPowerCalculator.power(first) * HP_PER_POWER,
            CardPowerCalculator.power(second) * HP_PER_POWER
        };
        double[] dealt = {0.0, 0.0};
        int[] abilityUses = {0, 0};
        List<List<StatusEffect>> effects = new ArrayList<>();
        effects.add(List.of());
        effects.add(List.of());
        List<String> log = new ArrayList<>();

        log.add("⚔️ BATTLE: " + first.getName() + " vs " + second.getName() + "!");
        log.add(String.format(Locale.ROOT, "%s HP: %.0f", first.getName(), hp[0]));
        log.add(String.format(Locale.ROOT, "%s HP: %.0f", second.getName(), hp[1]));

        double openingAdvantage = TypeAdvantageMatrix.advantage(first.getCategory(), second.getCategory());
        if (openingAdvantage > 1.0) {
            log.add(first.getCategory() + " has advantage over " + second.getCategory() + "! (+20% damage)");
        } else if (openingAdvantage < 1.0) {
            log.add(first.getCategory() + " at disadvantage against " + second.getCategory() + "! (-20% damage)");
        }

        int turns = 0;
        int active = 0;
        while (turns < MAX_TURNS) {
            turns++;
            int target = 1 - active;
            Card attacker = cards[active];
            Card defender = cards[target];

            if (StatusEffectEngine.hasEffect(effects.get(active), StatusEffectKind.DRUNK)
                    && rng.chance(DRUNK_MISS_CHANCE)) {
                log.add("Turn " + turns + ": " + attacker.getName() + " is too drunk and misses!");
            } else {
                StatSet attackerStats = StatusEffectEngine.applyEffects(attacker, effects.get(active));
                StatSet defenderStats = StatusEffectEngine.applyEffects(defender, effects.get(target));
                int abilityIndex = attacker.getAbilities().isEmpty()
                        ? 0
                        : abilityUses[active] % attacker.getAbilities().size();
                abilityUses[active]++;

                AbilityResult result = AbilityExecutor.execute(
                        attacker, attackerStats, defender, defenderStats, abilityIndex, rng);

                if (!result.success()) {
                    log.add("Turn " + turns + ": " + result.flavorText());
                } else {
                    double typeAdvantage = TypeAdvantageMatrix.advantage(attacker.getCategory(), defender.getCategory());
                    PairSynergy synergy = SynergyCalculator.checkSynergy(attacker, defender);
                    long damage = Math.round(result.damage() * typeAdvantage * synergy.synergyBonus());

                    hp[target] -= damage;
                    dealt[active] += damage;

                    log.add("Turn " + turns + ": " + result.flavorText());
                    if (synergy.hasSynergy()) {
                        log.add("  💥 SYNERGY: " + synergy.synergyName() + "! " + synergy.description());
                    }
                    log.add("  → " + damage + " damage! " + result.roll().describe());

                    for (StatusEffect effect : result.statusEffects()) {
                        effects.set(target, StatusEffectEngine.addEffect(effects.get(target), effect));
                    }
                    if (!result.statusEffects().isEmpty()) {
                        log.add("  → Status effects on " + defender.getName() + ": "
                                + result.statusEffects().stream()
                                        .map(e -> e.kind().getJsonValue())
                                        .collect(Collectors.joining(", ")));
                    }

                    if (hp[target] <= 0) {
                        log.add("🏆 " + attacker.getName() + " wins in " + turns + " turns!");
                        return new DuelResult(attacker, defender, turns, hp[active], hp[target], log);
                    }
                }
            }

            effects.set(0, StatusEffectEngine.tick(effects.get(0)));
            effects.set(1, StatusEffectEngine.tick(effects.get(1)));
            log.add(String.format(Locale.ROOT, "  HP: %.0f vs %.0f", hp[0], hp[1]));
            active = target;
        }

        int winner = decideAtTurnCap(hp, dealt);
        int loser = 1 - winner;
        log.add("⏰ Time's up! " + cards[winner].getName() + " wins by HP!");
        return new DuelResult(cards[winner], cards[loser], turns, hp[winner], hp[loser], log);
    }

    /**
     * Higher remaining HP wins; equal HP falls back to damage dealt, then to the first card.
     */
    static int decideAtTurnCap(double[] hp, double[] dealt) {
        if (hp[0] != hp[1]) {
            return hp[0] > hp[1] ? 0 : 1;
        }
        if (dealt[0] != dealt[1]) {
            return dealt[0] > dealt[1] ? 0 : 1;
        }
        return 0;
    }
}
