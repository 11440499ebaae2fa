package com.example.battlecore.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Battle payload for a handler (the trainer who commands creatures).
 */
public class HandlerCombatant extends Combatant {

    private final String name;
    private final Stats stats;
    private final List<ActiveCondition> conditions = new ArrayList<>();
    private final List<String> remainingTeam = new ArrayList<>();
    private boolean canEscape;

    public HandlerCombatant(String name, Stats stats, List<String> remainingTeam, boolean canEscape) {
        this.name = name == null ? "" : name;
        this.stats = stats == null ? new Stats() : stats;
        if (remainingTeam != null) {
            this.remainingTeam.addAll(remainingTeam);
        }
        this.canEscape = canEscape;
    }

    public String getName() { return name; }

    @Override
    public Stats getStats() { return stats; }

    @Override
    public boolean isCreature() { return false; }

    @Override
    public HandlerCombatant asHandler() { return this; }

    public boolean canEscape() { return canEscape; }

    public void setCanEscape(boolean canEscape) { this.canEscape = canEscape; }

    /**
     * Creature ids (or names) this handler can still send out.
     */
    public List<String> getRemainingTeam() {
        return Collections.unmodifiableList(remainingTeam);
    }

    public boolean removeFromTeam(String creatureRef) {
        return remainingTeam.remove(creatureRef);
    }

    public void addToTeam(String creatureRef) {
        if (creatureRef != null && !remainingTeam.contains(creatureRef)) {
            remainingTeam.add(creatureRef);
        }
    }

    public List<ActiveCondition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public void addCondition(ActiveCondition condition) {
        conditions.removeIf(c -> c.name().equalsIgnoreCase(condition.name()));
        conditions.add(condition);
    }

    public boolean removeCondition(String conditionName) {
        return conditions.removeIf(c -> c.name().equalsIgnoreCase(conditionName));
    }

    @Override
    public String toString() {
        return "Handler[" + name + ", team=" + remainingTeam.size() + "]";
    }
}
