package com.example.battlecore.effect;

/**
 * A named status on a creature. Names are unique per creature (case-insensitive).
 *
 * @param name           display name, also the identity key
 * @param category       grouping of the effect
 * @param remainingTurns turns left, or null when the effect lasts until removed
 * @param severity       ruleset-defined strength, 1 for ordinary effects
 */
public record StatusEffect(String name, StatusCategory category, Integer remainingTurns, int severity) {

    public StatusEffect {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Status effect name is required");
        }
        if (category == null) {
            category = StatusCategory.OTHER;
        }
        if (remainingTurns != null && remainingTurns < 0) {
            throw new IllegalArgumentException("remainingTurns must not be negative");
        }
    }

    /**
     * An effect that lasts until explicitly removed.
     */
    public static StatusEffect indefinite(String name, StatusCategory category) {
        return new StatusEffect(name, category, null, 1);
    }

    public static StatusEffect forTurns(String name, StatusCategory category, int turns) {
        return new StatusEffect(name, category, turns, 1);
    }

    public boolean isIndefinite() {
        return remainingTurns == null;
    }

    public boolean hasName(String other) {
        return other != null && name.equalsIgnoreCase(other.trim());
    }
}
