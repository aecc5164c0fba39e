package com.daddeck.battle.card;

/**
 * Exception thrown when the card catalog cannot be loaded or a card is missing from it.
 */
public class CardDatabaseException extends Exception {
    public CardDatabaseException(String message) {
        super(message);
    }

    public CardDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
