package com.daddeck.battle.card;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CardDatabase.
 */
class CardDatabaseTest {

    private static CardDatabase db;

    @BeforeAll
    static void loadDatabase() throws CardDatabaseException {
        db = CardDatabase.fromResource(CardDatabase.DEFAULT_RESOURCE);
    }

    @Test
    void testLoadCards() {
        assertEquals(20, db.cardCount());
        assertEquals(20, db.getCards().size());
    }

    @Test
    void testGetCard() throws CardDatabaseException {
        Card card = db.getCard("bbq-001");
        assertEquals("Grill Sergeant Gary", card.getName());
        assertEquals("Flame Keeper of the Cul-de-sac", card.getSubtitle());
        assertEquals(Category.BBQ_DICKTATOR, card.getCategory());
        assertEquals(Rarity.RARE, card.getRarity());
        assertEquals(88.0, card.getStats().get(Stat.GRILL_SKILL));
        assertEquals(2, card.getAbilities().size());
        assertEquals("Grill Master", card.getAbilities().get(0).name());
    }

    @Test
    void testMythicCards() throws CardDatabaseException {
        assertEquals(Rarity.MYTHIC, db.getCard("mythic-001").getRarity());
        assertEquals(Rarity.MYTHIC, db.getCard("mythic-002").getRarity());
    }

    @Test
    void testCardNotFound() {
        assertThrows(CardDatabaseException.class, () -> db.getCard("nonexistent-card"));
    }

    @Test
    void testHasCard() {
        assertTrue(db.hasCard("tech-001"));
        assertFalse(db.hasCard("nonexistent-card"));
    }

    @Test
    void testFromJsonDefaults() throws CardDatabaseException {
        String json = """
            [{"id": "x-1", "type": "GOLF_GONAD",
              "stats": {"dadJoke": 10, "grillSkill": 20, "fixIt": 30, "napPower": 40,
                        "remoteControl": 50, "thermostat": 60, "sockSandal": 70, "beerSnob": 80}}]
            """;
        Card card = CardDatabase.fromJson(json).getCard("x-1");
        assertEquals("x-1", card.getName());
        assertEquals(Rarity.COMMON, card.getRarity());
        assertTrue(card.getAbilities().isEmpty());
        assertEquals(45.0, card.getStats().average(), 1e-9);
    }

    @Test
    void testMissingStatFailsToLoad() {
        String json = """
            [{"id": "x-1", "type": "GOLF_GONAD", "rarity": "rare",
              "stats": {"dadJoke": 10, "grillSkill": 20}}]
            """;
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromJson(json));
    }

    @Test
    void testUnknownCategoryFailsToLoad() {
        String json = """
            [{"id": "x-1", "type": "SPACE_DAD", "rarity": "rare",
              "stats": {"dadJoke": 10, "grillSkill": 20, "fixIt": 30, "napPower": 40,
                        "remoteControl": 50, "thermostat": 60, "sockSandal": 70, "beerSnob": 80}}]
            """;
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromJson(json));
    }

    @Test
    void testDuplicateIdFailsToLoad() {
        String card = """
            {"id": "x-1", "type": "GOLF_GONAD",
             "stats": {"dadJoke": 10, "grillSkill": 20, "fixIt": 30, "napPower": 40,
                       "remoteControl": 50, "thermostat": 60, "sockSandal": 70, "beerSnob": 80}}
            """;
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromJson("[" + card + "," + card + "]"));
    }

    @Test
    void testMissingFile() {
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromFile("does/not/exist.json"));
        assertThrows(CardDatabaseException.class, () -> CardDatabase.fromResource("missing.json"));
    }
}
