package com.daddeck.battle.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card rarity tiers, ordered from common to mythic, each with a fixed power multiplier.
 * Multipliers are held in tenths so card power for whole-number averages is exact.
 */
public enum Rarity {
    COMMON("common", 10),
    UNCOMMON("uncommon", 12),
    RARE("rare", 15),
    EPIC("epic", 18),
    LEGENDARY("legendary", 22),
    MYTHIC("mythic", 30);

    private final String jsonValue;
    private final int multiplierTenths;

    Rarity(String jsonValue, int multiplierTenths) {
        this.jsonValue = jsonValue;
        this.multiplierTenths = multiplierTenths;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Power multiplier in tenths, e.g. 22 for legendary.
     */
    public int getMultiplierTenths() {
        return multiplierTenths;
    }

    @JsonCreator
    public static Rarity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rarity cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "common" -> COMMON;
            case "uncommon" -> UNCOMMON;
            case "rare" -> RARE;
            case "epic" -> EPIC;
            case "legendary" -> LEGENDARY;
            case "mythic" -> MYTHIC;
            default -> throw new IllegalArgumentException("Unknown rarity: " + value);
        };
    }
}
