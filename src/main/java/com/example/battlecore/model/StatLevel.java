package com.example.battlecore.model;

/**
 * Named stat tiers. The modifier is the number added to rolls.
 */
public enum StatLevel {
    HOPELESS(-2),
    INCOMPETENT(-1),
    NOVICE(0),
    TRAINED(1),
    COMPETENT(2),
    EXPERT(3),
    MASTER(4),
    CHAMPION(5),
    EPIC(6),
    LEGENDARY(7);

    private final int modifier;

    StatLevel(int modifier) {
        this.modifier = modifier;
    }

    public int getModifier() {
        return modifier;
    }

    /**
     * Look up the level carrying the given modifier, clamped to HOPELESS..LEGENDARY.
     */
    public static StatLevel fromModifier(int modifier) {
        int clamped = Math.max(HOPELESS.modifier, Math.min(LEGENDARY.modifier, modifier));
        for (StatLevel level : values()) {
            if (level.modifier == clamped) {
                return level;
            }
        }
        return NOVICE;
    }

    /**
     * Parse a level by name (case-insensitive). Returns null if unknown.
     */
    public static StatLevel fromKey(String key) {
        if (key == null) return null;
        for (StatLevel level : values()) {
            if (level.name().equalsIgnoreCase(key.trim())) {
                return level;
            }
        }
        return null;
    }
}
