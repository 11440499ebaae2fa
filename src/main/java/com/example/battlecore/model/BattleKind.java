package com.example.battlecore.model;

/**
 * The kind of encounter. Decides the default victory conditions.
 */
public enum BattleKind {
    WILD("Wild"),
    TRAINER("Trainer"),
    GYM("Gym"),
    ELITE_FOUR("EliteFour"),
    CHAMPION("Champion"),
    LEGENDARY("Legendary");

    private final String displayName;

    BattleKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a battle kind from a string key (case-insensitive). Returns null if unknown.
     */
    public static BattleKind fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().replace(" ", "").replace("_", "");
        for (BattleKind kind : values()) {
            if (kind.displayName.equalsIgnoreCase(k) || kind.name().replace("_", "").equalsIgnoreCase(k)) {
                return kind;
            }
        }
        return null;
    }
}
