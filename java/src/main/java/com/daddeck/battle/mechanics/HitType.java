package com.daddeck.battle.mechanics;

/**
 * Which branch of the damage roll fired. Critical and glancing never occur together.
 */
public enum HitType {
    NORMAL("Normal"),
    CRITICAL("CRITICAL ×1.5"),
    GLANCING("Glancing ×0.5");

    private final String label;

    HitType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
