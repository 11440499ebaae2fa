package com.example.battlecore.model;

/**
 * A persistent battlefield effect anchored at a position (spikes, fire, deep water).
 * Applied by ruleset effect handlers during the ApplyEffects phase.
 */
public record Hazard(Position position, String effect) {

    public Hazard {
        if (effect == null || effect.isBlank()) {
            throw new IllegalArgumentException("Hazard effect is required");
        }
        if (position == null) {
            position = Position.ORIGIN;
        }
    }
}
