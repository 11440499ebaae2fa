package com.example.battlecore.model;

/**
 * A condition affecting a handler (e.g. "Injured", "Inspired").
 *
 * @param remainingTurns turns left, or null when it lasts until removed
 */
public record ActiveCondition(String name, Integer remainingTurns) {

    public ActiveCondition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Condition name is required");
        }
    }
}
