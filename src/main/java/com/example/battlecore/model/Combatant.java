package com.example.battlecore.model;

/**
 * The creature- or handler-specific payload of a {@link Participant}.
 * Only {@link CreatureCombatant} and {@link HandlerCombatant} extend this class,
 * so a participant always carries exactly one of the two.
 */
public abstract class Combatant {

    Combatant() {
    }

    public abstract Stats getStats();

    public abstract boolean isCreature();

    /**
     * Effective modifier for a stat, including any temporary adjustments.
     */
    public int getStatModifier(StatType stat) {
        return getStats().getModifier(stat);
    }

    public CreatureCombatant asCreature() {
        throw new IllegalStateException("Not a creature: " + this);
    }

    public HandlerCombatant asHandler() {
        throw new IllegalStateException("Not a handler: " + this);
    }
}
