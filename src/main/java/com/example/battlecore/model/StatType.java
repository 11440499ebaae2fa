package com.example.battlecore.model;

/**
 * The six battle stats shared by creatures and handlers.
 */
public enum StatType {
    /** Physical attack rolls and bonus damage dice */
    POWER("Power"),
    /** Initiative */
    SPEED("Speed"),
    /** Special attack rolls and bonus damage dice */
    MIND("Mind"),
    CHARM("Charm"),
    /** Physical defense value */
    DEFENSE("Defense"),
    /** Special defense value */
    SPIRIT("Spirit");

    private final String displayName;

    StatType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a stat from its display name or enum name. Returns null if unknown.
     */
    public static StatType fromKey(String key) {
        if (key == null) return null;
        for (StatType s : values()) {
            if (s.displayName.equalsIgnoreCase(key.trim()) || s.name().equalsIgnoreCase(key.trim())) {
                return s;
            }
        }
        return null;
    }
}
