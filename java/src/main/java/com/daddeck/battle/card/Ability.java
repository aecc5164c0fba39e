package com.daddeck.battle.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A named card ability.
 */
public record Ability(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description
) {
    public Ability {
        Objects.requireNonNull(name, "ability name");
        description = description != null ? description : "";
    }
}
