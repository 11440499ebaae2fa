package com.example.battlecore.combat;

/**
 * What a participant does with its turn.
 */
public enum ActionKind {
    ATTACK("Attack"),
    SWITCH("Switch"),
    ITEM("Item"),
    ESCAPE("Escape");

    private final String label;

    ActionKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parse an action label ("attack", "Escape", ...). Unknown or blank labels return null.
     */
    public static ActionKind fromLabel(String label) {
        if (label == null || label.isBlank()) return null;
        String k = label.trim();
        for (ActionKind kind : values()) {
            if (kind.label.equalsIgnoreCase(k) || kind.name().equalsIgnoreCase(k)) {
                return kind;
            }
        }
        return null;
    }
}
