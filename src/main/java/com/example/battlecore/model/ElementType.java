package com.example.battlecore.model;

/**
 * Elemental type of a move or a creature.
 */
public enum ElementType {
    NORMAL("Normal"),
    FIRE("Fire"),
    WATER("Water"),
    ELECTRIC("Electric"),
    GRASS("Grass"),
    ICE("Ice"),
    FIGHTING("Fighting"),
    POISON("Poison"),
    GROUND("Ground"),
    FLYING("Flying"),
    PSYCHIC("Psychic"),
    BUG("Bug"),
    ROCK("Rock"),
    GHOST("Ghost"),
    DRAGON("Dragon"),
    DARK("Dark"),
    STEEL("Steel"),
    FAIRY("Fairy");

    private final String displayName;

    ElementType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a type from a string key. Blank, "none" and unknown keys return null.
     */
    public static ElementType fromKey(String key) {
        if (key == null || key.isBlank()) return null;
        String k = key.trim();
        for (ElementType t : values()) {
            if (t.displayName.equalsIgnoreCase(k) || t.name().equalsIgnoreCase(k)) {
                return t;
            }
        }
        return null;
    }
}
