package com.daddeck.battle;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Category;
import com.daddeck.battle.card.Stat;
import com.daddeck.battle.card.StatSet;
import com.daddeck.battle.deck.Deck;
import com.daddeck.battle.mechanics.CardPowerCalculator;
import com.daddeck.battle.mechanics.DamageCalculator;
import com.daddeck.battle.mechanics.DeckSynergy;
import com.daddeck.battle.mechanics.PairSynergy;
import com.daddeck.battle.mechanics.StatusEffect;
import com.daddeck.battle.mechanics.StatusEffectEngine;
import com.daddeck.battle.mechanics.SynergyCalculator;
import com.daddeck.battle.mechanics.TypeAdvantageMatrix;
import com.daddeck.battle.rng.SeededRandom;
import com.daddeck.battle.simulation.AbilityExecutor;
import com.daddeck.battle.simulation.AbilityResult;
import com.daddeck.battle.simulation.BattleResult;
import com.daddeck.battle.simulation.BattleSimulator;
import com.daddeck.battle.simulation.DeckBattleResolver;
import com.daddeck.battle.simulation.DuelResult;
import com.daddeck.battle.simulation.Prediction;
import com.daddeck.battle.simulation.WinnerPredictor;

import java.util.List;

/**
 * Entry points for the surrounding application.
 * Every call is pure given its inputs; calls without a seed draw a fresh one from SecureRandom.
 */
public final class BattleEngine {

    private BattleEngine() {
        // Utility class - prevent instantiation
    }

    // ==================== CARDS ====================

    public static double calculatePower(Card card) {
        return CardPowerCalculator.power(card);
    }

    public static double getTypeAdvantage(Category attacker, Category defender) {
        return TypeAdvantageMatrix.advantage(attacker, defender);
    }

    // ==================== STATUS EFFECTS ====================

    public static StatSet applyStatusEffectsToCard(Card card, List<StatusEffect> effects) {
        return StatusEffectEngine.applyEffects(card, effects);
    }

    public static List<StatusEffect> tickStatusEffects(List<StatusEffect> effects) {
        return StatusEffectEngine.tick(effects);
    }

    public static List<StatusEffect> addStatusEffect(List<StatusEffect> effects, StatusEffect newEffect) {
        return StatusEffectEngine.addEffect(effects, newEffect);
    }

    // ==================== SYNERGY ====================

    public static PairSynergy checkSynergy(Card first, Card second) {
        return SynergyCalculator.checkSynergy(first, second);
    }

    public static DeckSynergy calculateSynergyBonus(Deck deck) {
        return SynergyCalculator.deckSynergy(deck);
    }

    // ==================== COMBAT ====================

    public static int calculateDamage(Card attacker, Card defender, Stat attackStat, Stat defenseStat) {
        return calculateDamage(attacker, defender, attackStat, defenseStat, new SeededRandom());
    }

    public static int calculateDamage(Card attacker, Card defender, Stat attackStat, Stat defenseStat,
                                      SeededRandom rng) {
        return DamageCalculator.calculate(attacker, defender, attackStat, defenseStat, rng).damage();
    }

    public static AbilityResult executeAbility(Card card, Card target, int abilityIndex) {
        return executeAbility(card, target, abilityIndex, new SeededRandom());
    }

    public static AbilityResult executeAbility(Card card, Card target, int abilityIndex, SeededRandom rng) {
        return AbilityExecutor.execute(card, target, abilityIndex, rng);
    }

    public static DuelResult simulateBattle(Card first, Card second) {
        return BattleSimulator.simulate(first, second);
    }

    public static DuelResult simulateBattle(Card first, Card second, long seed) {
        return BattleSimulator.simulate(first, second, seed);
    }

    public static BattleResult calculateBattleResult(Deck attacker, Deck defender) {
        return DeckBattleResolver.resolve(attacker, defender);
    }

    public static BattleResult calculateBattleResult(Deck attacker, Deck defender, long seed) {
        return DeckBattleResolver.resolve(attacker, defender, seed);
    }

    public static Prediction predictWinner(Card first, Card second) {
        return WinnerPredictor.predict(first, second);
    }
}
