package com.example.battlecore.model;

/**
 * How one participant regards another.
 */
public enum RelationshipType {
    HOSTILE("Hostile"),
    ALLIED("Allied"),
    NEUTRAL("Neutral");

    private final String displayName;

    RelationshipType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
