package com.daddeck.battle.simulation;

import com.daddeck.battle.CardFixtures;
import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.Category;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WinnerPredictor.
 */
class WinnerPredictorTest {

    @Test
    void testSynergyPrediction() {
        Card bbq = CardFixtures.common("bbq", Category.BBQ_DICKTATOR, 30);
        Card chef = CardFixtures.common("chef", Category.CHEF_CUMSTERS, 90);

        Prediction prediction = WinnerPredictor.predict(bbq, chef);
        assertSame(bbq, prediction.winner());
        assertEquals(85, prediction.confidence());
        assertEquals("Has synergy: Ultimate Cookout", prediction.reason());
    }

    @Test
    void testTypeAdvantageDominates() {
        Card bbq = CardFixtures.common("bbq", Category.BBQ_DICKTATOR, 50);
        Card golf = CardFixtures.common("golf", Category.GOLF_GONAD, 55);

        // effective 60 vs 44
        Prediction prediction = WinnerPredictor.predict(bbq, golf);
        assertSame(bbq, prediction.winner());
        assertEquals(87, prediction.confidence());
        assertEquals("Significantly higher power (50.0 vs 55.0)", prediction.reason());
    }

    @Test
    void testCloseMatch() {
        Card golf = CardFixtures.common("golf", Category.GOLF_GONAD, 50);
        Card fashion = CardFixtures.common("fashion", Category.FASHION_FUCK, 55);

        Prediction prediction = WinnerPredictor.predict(golf, fashion);
        assertSame(fashion, prediction.winner());
        assertEquals(60, prediction.confidence());
        assertEquals("Close match! Could go either way.", prediction.reason());
    }

    @Test
    void testEvenMatchFavorsFirst() {
        Card golf = CardFixtures.common("golf", Category.GOLF_GONAD, 50);
        Card fashion = CardFixtures.common("fashion", Category.FASHION_FUCK, 50);

        Prediction prediction = WinnerPredictor.predict(golf, fashion);
        assertSame(golf, prediction.winner());
        assertEquals(50, prediction.confidence());
    }

    @Test
    void testConfidenceIsCapped() {
        Card golf = CardFixtures.common("golf", Category.GOLF_GONAD, 10);
        Card fashion = CardFixtures.common("fashion", Category.FASHION_FUCK, 90);

        Prediction prediction = WinnerPredictor.predict(golf, fashion);
        assertSame(fashion, prediction.winner());
        assertEquals(95, prediction.confidence());

        Card zero = CardFixtures.common("zero", Category.GOLF_GONAD, 0);
        assertEquals(95, WinnerPredictor.predict(zero, fashion).confidence());
    }
}
