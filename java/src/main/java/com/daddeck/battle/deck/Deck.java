package com.daddeck.battle.deck;

import com.daddeck.battle.card.Card;
import com.daddeck.battle.card.CardDatabase;
import com.daddeck.battle.card.CardDatabaseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of cards with copy counts. Statistics are computed once at construction.
 */
public class Deck {
    private final String name;
    private final List<DeckEntry> entries;
    private final DeckStats stats;

    public Deck(String name, List<DeckEntry> entries) {
        this.name = Objects.requireNonNull(name, "deck name");
        this.entries = List.copyOf(entries);
        this.stats = DeckStats.compute(this.entries);
    }

    /**
     * Deck holding one copy of each card.
     */
    public static Deck ofCards(String name, List<Card> cards) {
        List<DeckEntry> entries = new ArrayList<>();
        for (Card card : cards) {
            entries.add(new DeckEntry(card, 1));
        }
        return new Deck(name, entries);
    }

    /**
     * Load a deck from a file.
     * Format: "2 card-id" per line, supports comments with # or //
     *
     * @param path Path to the deck file
     * @param db   Card database
     * @return Parsed deck
     * @throws DeckException if parsing fails
     */
    public static Deck loadFromFile(String path, CardDatabase db) throws DeckException {
        try {
            String content = Files.readString(Path.of(path));
            String fileName = Path.of(path).getFileName().toString();
            String deckName = fileName.endsWith(".txt")
                    ? fileName.substring(0, fileName.length() - 4)
                    : fileName;
            return parse(deckName, content, db);
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage());
        }
    }

    /**
     * Parse deck list text. Repeated card ids are kept as separate entries in file order.
     */
    public static Deck parse(String deckName, String content, CardDatabase db) throws DeckException {
        List<DeckEntry> entries = new ArrayList<>();
        String[] lines = content.split("\n");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();

            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }

            int spaceIdx = line.indexOf(' ');
            if (spaceIdx == -1) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": Expected format 'COUNT CARD_ID'");
            }

            String countStr = line.substring(0, spaceIdx);
            String cardId = line.substring(spaceIdx + 1).trim();

            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": '" + countStr + "' is not a valid number");
            }
            if (count < 1) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": count must be at least 1");
            }

            try {
                entries.add(new DeckEntry(db.getCard(cardId), count));
            } catch (CardDatabaseException e) {
                throw new DeckException("Card not found at line " + (lineNum + 1) + ": " + cardId);
            }
        }

        return new Deck(deckName, entries);
    }

    public String getName() {
        return name;
    }

    public List<DeckEntry> getEntries() {
        return entries;
    }

    public DeckStats getStats() {
        return stats;
    }

    /**
     * Total copies across all entries.
     */
    public int size() {
        return stats.getTotalCards();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return name + " (" + size() + " cards)";
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }
    }
}
