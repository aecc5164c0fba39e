package com.daddeck.battle.simulation;

import com.daddeck.battle.CardFixtures;
import com.daddeck.battle.card.Ability;
import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.CardDatabase;
import com.daddeck.battle.card.CardDatabaseException;
import com.daddeck.battle.card.Category;
import com.daddeck.battle.card.Rarity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BattleSimulator.
 */
class BattleSimulatorTest {

    @Test
    void testStrongCardKnocksOutWeakCard() {
        Card strong = CardFixtures.card("strong", Category.GOLF_GONAD, Rarity.MYTHIC, 100,
                new Ability("Dad Joke", "Hi hungry, I'm Dad."));
        Card weak = CardFixtures.card("weak", Category.FASHION_FUCK, Rarity.COMMON, 10);

        DuelResult result = BattleSimulator.simulate(strong, weak, 12345L);

        assertSame(strong, result.winner());
        assertSame(weak, result.loser());
        assertTrue(result.turns() <= BattleSimulator.MAX_TURNS);
        assertTrue(result.turns() % 2 == 1, "only the strong card ever attacks");
        assertTrue(result.loserHp() <= 0);
        assertEquals(3000.0, result.winnerHp(), 1e-9);

        List<String> log = result.log();
        assertEquals("⚔️ BATTLE: Dad strong vs Dad weak!", log.get(0));
        assertEquals("Dad strong HP: 3000", log.get(1));
        assertEquals("Dad weak HP: 100", log.get(2));
        assertTrue(log.contains("  → 94 damage! Normal (variance -0.6%)"));
        assertTrue(log.contains("Turn 2: Dad weak forgot what he was doing."));
        assertEquals("🏆 Dad strong wins in " + result.turns() + " turns!", log.get(log.size() - 1));
    }

    @Test
    void testTurnCapPicksHigherHp() {
        Card bigger = CardFixtures.card("bigger", Category.GOLF_GONAD, Rarity.COMMON, 60);
        Card smaller = CardFixtures.card("smaller", Category.FASHION_FUCK, Rarity.COMMON, 40);

        DuelResult result = BattleSimulator.simulate(smaller, bigger, 1L);

        assertSame(bigger, result.winner());
        assertEquals(BattleSimulator.MAX_TURNS, result.turns());
        assertEquals(600.0, result.winnerHp(), 1e-9);
        assertEquals(400.0, result.loserHp(), 1e-9);
        assertEquals("⏰ Time's up! Dad bigger wins by HP!", result.log().get(result.log().size() - 1));
    }

    @Test
    void testTurnCapTieBreaks() {
        assertEquals(1, BattleSimulator.decideAtTurnCap(new double[]{100, 200}, new double[]{0, 0}));
        assertEquals(0, BattleSimulator.decideAtTurnCap(new double[]{50, 50}, new double[]{80, 40}));
        assertEquals(1, BattleSimulator.decideAtTurnCap(new double[]{50, 50}, new double[]{40, 80}));
        assertEquals(0, BattleSimulator.decideAtTurnCap(new double[]{50, 50}, new double[]{40, 40}));
    }

    @Test
    void testSameSeedReplaysBattle() throws CardDatabaseException {
        CardDatabase db = CardDatabase.fromResource(CardDatabase.DEFAULT_RESOURCE);
        Card bbq = db.getCard("bbq-001");
        Card couch = db.getCard("couch-001");

        DuelResult first = BattleSimulator.simulate(bbq, couch, 2024L);
        DuelResult second = BattleSimulator.simulate(bbq, couch, 2024L);

        assertEquals(first.log(), second.log());
        assertEquals(first.winner(), second.winner());
        assertEquals(first.turns(), second.turns());
        assertTrue(first.log().contains("BBQ_DICKTATOR has advantage over COUCH_CUMMANDER! (+20% damage)"));
        assertTrue(first.log().stream().anyMatch(line -> line.contains("damage! ") && line.contains("variance")),
                "every hit records its branch and variance");
    }

    @Test
    void testBattleAlwaysEnds() throws CardDatabaseException {
        CardDatabase db = CardDatabase.fromResource(CardDatabase.DEFAULT_RESOURCE);
        Card holiday = db.getCard("holiday-001");
        Card tech = db.getCard("tech-001");

        for (long seed = 0; seed < 50; seed++) {
            DuelResult result = BattleSimulator.simulate(holiday, tech, seed);
            assertTrue(result.turns() >= 1 && result.turns() <= BattleSimulator.MAX_TURNS);
            assertNotSame(result.winner(), result.loser());
        }
    }
}
