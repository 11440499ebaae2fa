package com.example.battlecore.model;

import com.example.battlecore.effect.StatusEffect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Battle payload for a creature: vigor, types, status effects and move history.
 * Vigor is changed only through {@link Participant#setVigor(int)} so that the
 * defeated flag stays in step with it.
 */
public class CreatureCombatant extends Combatant {

    private final String species;
    private final Stats stats;
    private final ElementType primaryType;
    private final ElementType secondaryType;
    private final int maxVigor;
    private int currentVigor;

    /** Status effects keyed by lower-cased name */
    private final Map<String, StatusEffect> statusEffects = new LinkedHashMap<>();

    /** Temporary stat adjustments (stage changes), added to the stat modifier */
    private final Map<StatType, Integer> temporaryModifiers = new EnumMap<>(StatType.class);

    /** Moves used this battle, first use order, no duplicates */
    private final List<String> usedMoves = new ArrayList<>();

    private String lastAction;

    public CreatureCombatant(String species, Stats stats, ElementType primaryType, ElementType secondaryType,
                             int currentVigor, int maxVigor) {
        if (maxVigor <= 0) {
            throw new IllegalArgumentException("maxVigor must be positive, got " + maxVigor);
        }
        this.species = species == null ? "" : species;
        this.stats = stats == null ? new Stats() : stats;
        this.primaryType = primaryType == null ? ElementType.NORMAL : primaryType;
        this.secondaryType = secondaryType == this.primaryType ? null : secondaryType;
        this.maxVigor = maxVigor;
        this.currentVigor = Math.max(0, Math.min(currentVigor, maxVigor));
    }

    /**
     * A creature at full vigor.
     */
    public CreatureCombatant(String species, Stats stats, ElementType primaryType, ElementType secondaryType,
                             int maxVigor) {
        this(species, stats, primaryType, secondaryType, maxVigor, maxVigor);
    }

    public String getSpecies() { return species; }

    @Override
    public Stats getStats() { return stats; }

    @Override
    public boolean isCreature() { return true; }

    @Override
    public CreatureCombatant asCreature() { return this; }

    public ElementType getPrimaryType() { return primaryType; }

    /**
     * Secondary type, or null for single-typed creatures.
     */
    public ElementType getSecondaryType() { return secondaryType; }

    // Vigor

    public int getMaxVigor() { return maxVigor; }

    public int getCurrentVigor() { return currentVigor; }

    /**
     * Clamp and store a new vigor value. Returns the stored value.
     */
    int assignVigor(int newVigor) {
        this.currentVigor = Math.max(0, Math.min(newVigor, maxVigor));
        return currentVigor;
    }

    public int getVigorPercent() {
        return (currentVigor * 100) / maxVigor;
    }

    // Temporary modifiers

    @Override
    public int getStatModifier(StatType stat) {
        return stats.getModifier(stat) + temporaryModifiers.getOrDefault(stat, 0);
    }

    public int getTemporaryModifier(StatType stat) {
        return temporaryModifiers.getOrDefault(stat, 0);
    }

    public void setTemporaryModifier(StatType stat, int value) {
        if (value == 0) {
            temporaryModifiers.remove(stat);
        } else {
            temporaryModifiers.put(stat, value);
        }
    }

    public void clearTemporaryModifiers() {
        temporaryModifiers.clear();
    }

    public Map<StatType, Integer> getTemporaryModifiers() {
        return Collections.unmodifiableMap(temporaryModifiers);
    }

    // Status effects

    /**
     * Add an effect, replacing any effect with the same name.
     * @return the replaced effect, or null
     */
    public StatusEffect putStatusEffect(StatusEffect effect) {
        return statusEffects.put(key(effect.name()), effect);
    }

    /**
     * @return true if an effect with that name was present
     */
    public boolean removeStatusEffect(String name) {
        if (name == null) return false;
        return statusEffects.remove(key(name)) != null;
    }

    public boolean hasStatusEffect(String name) {
        return name != null && statusEffects.containsKey(key(name));
    }

    public StatusEffect getStatusEffect(String name) {
        return name == null ? null : statusEffects.get(key(name));
    }

    public List<StatusEffect> getStatusEffects() {
        return List.copyOf(statusEffects.values());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    // Move history

    public void recordMoveUsed(String moveName) {
        if (moveName == null || moveName.isBlank()) return;
        if (!usedMoves.contains(moveName)) {
            usedMoves.add(moveName);
        }
        this.lastAction = moveName;
    }

    public List<String> getUsedMoves() {
        return Collections.unmodifiableList(usedMoves);
    }

    public String getLastAction() { return lastAction; }

    @Override
    public String toString() {
        return String.format("Creature[%s %s%s %d/%d]", species, primaryType.getDisplayName(),
            secondaryType != null ? "/" + secondaryType.getDisplayName() : "", currentVigor, maxVigor);
    }
}
