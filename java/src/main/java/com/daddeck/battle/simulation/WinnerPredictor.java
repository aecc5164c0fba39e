package com.daddeck.battle.simulation;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.mechanics.CardPowerCalculator;
import com.daddeck.battle.mechanics.PairSynergy;
import com.daddeck.battle.mechanics.SynergyCalculator;
import com.daddeck.battle.mechanics.TypeAdvantageMatrix;

import java.util.Locale;

/**
 * Cheap matchup estimate from power, type advantage and synergy. Never runs a battle.
 */
public final class WinnerPredictor {

    public static final int SYNERGY_CONFIDENCE = 85;
    public static final int CLOSE_MATCH_CAP = 75;
    public static final int MAX_CONFIDENCE = 95;
    public static final double DOMINANCE_RATIO = 1.2;

    private WinnerPredictor() {
        // Utility class - prevent instantiation
    }

    public static Prediction predict(Card first, Card second) {
        PairSynergy forward = SynergyCalculator.checkSynergy(first, second);
        if (forward.hasSynergy()) {
            return new Prediction(first, SYNERGY_CONFIDENCE, "Has synergy: " + forward.synergyName());
        }
        PairSynergy backward = SynergyCalculator.checkSynergy(second, first);
        if (backward.hasSynergy()) {
            return new Prediction(second, SYNERGY_CONFIDENCE, "Has synergy: " + backward.synergyName());
        }

        double power1 = CardPowerCalculator.power(first);
        double power2 = CardPowerCalculator.power(second);
        double effective1 = power1 * TypeAdvantageMatrix.advantage(first.getCategory(), second.getCategory());
        double effective2 = power2 * TypeAdvantageMatrix.advantage(second.getCategory(), first.getCategory());

        boolean firstAhead = effective1 >= effective2;
        Card winner = firstAhead ? first : second;
        double stronger = firstAhead ? effective1 : effective2;
        double weaker = firstAhead ? effective2 : effective1;
        double ratio;
        if (stronger == weaker) {
            ratio = 1.0;
        } else {
            ratio = weaker <= 0 ? Double.POSITIVE_INFINITY : stronger / weaker;
        }

        if (stronger > weaker * DOMINANCE_RATIO) {
            int confidence = (int) Math.min(MAX_CONFIDENCE, Math.round(60 + (ratio - 1) * 75));
            return new Prediction(winner, confidence, String.format(Locale.ROOT,
                    "Significantly higher power (%.1f vs %.1f)",
                    firstAhead ? power1 : power2, firstAhead ? power2 : power1));
        }

        int confidence = (int) Math.min(CLOSE_MATCH_CAP, Math.round(50 + (ratio - 1) * 100));
        return new Prediction(winner, confidence, "Close match! Could go either way.");
    }
}
