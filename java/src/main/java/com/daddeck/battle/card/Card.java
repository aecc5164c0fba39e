package com.daddeck.battle.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * An immutable DadDeck card.
 * The engine never mutates a card; status effects produce modified {@link StatSet} snapshots.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Card {
    private final String id;
    private final String name;
    private final String subtitle;
    private final Category category;
    private final Rarity rarity;
    private final StatSet stats;
    private final List<Ability> abilities;

    @JsonCreator
    public Card(@JsonProperty("id") String id,
                @JsonProperty("name") String name,
                @JsonProperty("subtitle") String subtitle,
                @JsonProperty("type") Category category,
                @JsonProperty("rarity") Rarity rarity,
                @JsonProperty("stats") StatSet stats,
                @JsonProperty("abilities") List<Ability> abilities) {
        this.id = Objects.requireNonNull(id, "card id");
        this.name = name != null ? name : id;
        this.subtitle = subtitle != null ? subtitle : this.name;
        this.category = Objects.requireNonNull(category, "card type");
        this.rarity = rarity != null ? rarity : Rarity.COMMON;
        this.stats = Objects.requireNonNull(stats, "card stats");
        this.abilities = abilities != null ? List.copyOf(abilities) : List.of();
    }

    public Card(String id, String name, Category category, Rarity rarity, StatSet stats, List<Ability> abilities) {
        this(id, name, null, category, rarity, stats, abilities);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("subtitle")
    public String getSubtitle() {
        return subtitle;
    }

    @JsonProperty("type")
    public Category getCategory() {
        return category;
    }

    @JsonProperty("rarity")
    public Rarity getRarity() {
        return rarity;
    }

    @JsonProperty("stats")
    public StatSet getStats() {
        return stats;
    }

    @JsonProperty("abilities")
    public List<Ability> getAbilities() {
        return abilities;
    }

    /**
     * Ability at the given index, or null when the card has none there.
     */
    public Ability getAbility(int index) {
        if (index < 0 || index >= abilities.size()) {
            return null;
        }
        return abilities.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Card other)) return false;
        return id.equals(other.id)
                && name.equals(other.name)
                && category == other.category
                && rarity == other.rarity
                && stats.equals(other.stats)
                && abilities.equals(other.abilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, category, rarity, stats, abilities);
    }

    @Override
    public String toString() {
        return name + " [" + category + ", " + rarity.getJsonValue() + "]";
    }
}
