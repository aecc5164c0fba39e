package com.daddeck.battle.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The eight card stats, each in [0, 100].
 * Declaration order is the canonical stat order used in logs and JSON output.
 */
public enum Stat {
    DAD_JOKE("dadJoke"),
    GRILL_SKILL("grillSkill"),
    FIX_IT("fixIt"),
    NAP_POWER("napPower"),
    REMOTE_CONTROL("remoteControl"),
    THERMOSTAT("thermostat"),
    SOCK_SANDAL("sockSandal"),
    BEER_SNOB("beerSnob");

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private final String jsonValue;

    Stat(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static Stat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stat name cannot be null");
        }
        for (Stat stat : values()) {
            if (stat.jsonValue.equalsIgnoreCase(value) || stat.name().equalsIgnoreCase(value)) {
                return stat;
            }
        }
        throw new IllegalArgumentException("Unknown stat: " + value);
    }
}
