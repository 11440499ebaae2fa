package com.example.battlecore.effect;

/**
 * Broad grouping of status effects.
 */
public enum StatusCategory {
    /** Persistent ailments (burn, poison, paralysis, sleep, freeze) */
    AILMENT,
    /** Wear off on switch-out (confusion, flinch, infatuation) */
    VOLATILE,
    /** Raised or lowered stats */
    STAT_CHANGE,
    /** Positive effects (shields, regeneration) */
    BUFF,
    OTHER;

    /**
     * Parse from a string key. Unknown keys map to OTHER.
     */
    public static StatusCategory fromKey(String key) {
        if (key == null) return OTHER;
        for (StatusCategory c : values()) {
            if (c.name().equalsIgnoreCase(key.trim())) {
                return c;
            }
        }
        return OTHER;
    }
}
