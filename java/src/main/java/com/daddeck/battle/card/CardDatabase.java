package com.daddeck.battle.card;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Card catalog loaded from a JSON array of cards, keyed by card id.
 */
public class CardDatabase {
    public static final String DEFAULT_RESOURCE = "cards.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Card> cards;

    private CardDatabase(Map<String, Card> cards) {
        this.cards = cards;
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new CardDatabaseException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            List<Card> cardList = MAPPER.readValue(is, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            List<Card> cardList = MAPPER.readValue(json, new TypeReference<List<Card>>() {});
            return fromCardList(cardList);
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CardDatabase fromCardList(List<Card> cardList) throws CardDatabaseException {
        Map<String, Card> cards = new LinkedHashMap<>();
        for (Card card : cardList) {
            if (cards.put(card.getId(), card) != null) {
                throw new CardDatabaseException("Duplicate card id: " + card.getId());
            }
        }
        return new CardDatabase(cards);
    }

    /**
     * Get a card by id.
     * @throws CardDatabaseException if the card is not found
     */
    public Card getCard(String id) throws CardDatabaseException {
        Card card = cards.get(id);
        if (card == null) {
            throw new CardDatabaseException("Card not found: " + id);
        }
        return card;
    }

    /**
     * All cards in catalog order.
     */
    public Collection<Card> getCards() {
        return Collections.unmodifiableCollection(cards.values());
    }

    /**
     * Get total number of cards.
     */
    public int cardCount() {
        return cards.size();
    }

    /**
     * Check if a card exists.
     */
    public boolean hasCard(String id) {
        return cards.containsKey(id);
    }
}
