package com.daddeck.battle.mechanics;

import com.daddeck.battle.card.Stat;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Status effect kinds and the stat modifier each one carries.
 * A kind with no affected stats leaves the stat set untouched.
 */
public enum StatusEffectKind {
    /** Burnt by the grill: -20% to the hands-on stats. */
    GRILLED("grilled", -0.20, EnumSet.of(Stat.GRILL_SKILL, Stat.FIX_IT)),
    /** Talked down to: -20% to the offensive stats. */
    LECTURED("lectured", -0.20, EnumSet.of(Stat.DAD_JOKE, Stat.REMOTE_CONTROL)),
    /** Too much coffee: +30% to everything. */
    WIRED("wired", 0.30, EnumSet.allOf(Stat.class)),
    /** Lowers accuracy, read by the duel loop as a miss chance. */
    DRUNK("drunk", 0.0, EnumSet.noneOf(Stat.class)),
    AWKWARD("awkward", 0.0, EnumSet.noneOf(Stat.class)),
    /** Couch dads' fallback when a lecture does not land. No stat change. */
    BORED("bored", 0.0, EnumSet.noneOf(Stat.class)),
    INSPIRED("inspired", 0.0, EnumSet.noneOf(Stat.class));

    private final String jsonValue;
    private final double percentage;
    private final Set<Stat> affectedStats;

    StatusEffectKind(String jsonValue, double percentage, EnumSet<Stat> affectedStats) {
        this.jsonValue = jsonValue;
        this.percentage = percentage;
        this.affectedStats = Collections.unmodifiableSet(affectedStats);
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Signed fractional change for a single stack, e.g. -0.20.
     */
    public double getPercentage() {
        return percentage;
    }

    public Set<Stat> getAffectedStats() {
        return affectedStats;
    }

    public boolean modifiesStats() {
        return percentage != 0.0 && !affectedStats.isEmpty();
    }
}
