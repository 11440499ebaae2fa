package com.example.battlecore.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One battler in an encounter. Wraps either a {@link CreatureCombatant} or a
 * {@link HandlerCombatant} and tracks the per-battle bookkeeping around it:
 * faction, initiative, whether it has acted this turn, defeat, and how it
 * regards the other participants.
 */
public class Participant {

    private final String id;
    private final String name;
    private final ParticipantKind kind;
    private final String faction;
    private final Combatant combatant;

    private Position position;

    /** Initiative from the last roster change (higher acts first) */
    private int initiative;

    private boolean hasActed;

    /** Set once, never cleared */
    private boolean defeated;

    /** Other participant ID -> how this participant regards them */
    private final Map<String, RelationshipType> relationships = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if the id is blank, the combatant is missing,
     *         or the kind does not match the combatant
     */
    public Participant(String id, String name, ParticipantKind kind, String faction,
                       Position position, Combatant combatant) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Participant id is required");
        }
        if (combatant == null) {
            throw new IllegalArgumentException("Participant " + id + " needs a creature or handler payload");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Participant " + id + " needs a kind");
        }
        if (kind.isCreature() != combatant.isCreature()) {
            throw new IllegalArgumentException("Participant " + id + " kind " + kind.getDisplayName()
                + " does not match its payload " + combatant);
        }
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
        this.kind = kind;
        this.faction = faction == null ? "" : faction;
        this.position = position == null ? Position.ORIGIN : position;
        this.combatant = combatant;
        if (combatant.isCreature() && combatant.asCreature().getCurrentVigor() == 0) {
            this.defeated = true;
        }
    }

    /**
     * Creature participant; kind follows the faction ("Player" -> player side).
     */
    public static Participant creature(String id, String name, String faction, CreatureCombatant creature) {
        return new Participant(id, name, ParticipantKind.creatureFor(faction), faction, Position.ORIGIN, creature);
    }

    /**
     * Handler participant; kind follows the faction ("Player" -> player side).
     */
    public static Participant handler(String id, String name, String faction, HandlerCombatant handler) {
        return new Participant(id, name, ParticipantKind.handlerFor(faction), faction, Position.ORIGIN, handler);
    }

    // Identification

    public String getId() { return id; }

    public String getName() { return name; }

    public ParticipantKind getKind() { return kind; }

    public String getFaction() { return faction; }

    public boolean isInFaction(String other) {
        return other != null && faction.equalsIgnoreCase(other);
    }

    public boolean hasId(String other) {
        return other != null && id.equalsIgnoreCase(other.trim());
    }

    public Position getPosition() { return position; }

    public void setPosition(Position position) {
        this.position = position == null ? Position.ORIGIN : position;
    }

    // Payload

    public Combatant getCombatant() { return combatant; }

    public boolean isCreature() { return combatant.isCreature(); }

    public boolean isHandler() { return !combatant.isCreature(); }

    /**
     * @throws IllegalStateException if this participant is a handler
     */
    public CreatureCombatant getCreature() { return combatant.asCreature(); }

    /**
     * @throws IllegalStateException if this participant is a creature
     */
    public HandlerCombatant getHandler() { return combatant.asHandler(); }

    public int getStatModifier(StatType stat) {
        return combatant.getStatModifier(stat);
    }

    // Turn state

    public int getInitiative() { return initiative; }

    public void setInitiative(int initiative) { this.initiative = initiative; }

    public boolean hasActed() { return hasActed; }

    public void setHasActed(boolean hasActed) { this.hasActed = hasActed; }

    // Vigor and defeat

    public boolean isDefeated() { return defeated; }

    /**
     * Defeat this participant. There is no way back.
     * @return true if this call changed the flag
     */
    public boolean markDefeated() {
        if (defeated) return false;
        defeated = true;
        return true;
    }

    /**
     * Set a creature's vigor, clamped to [0, maxVigor]. Reaching 0 defeats it.
     * @return true if this call defeated the participant
     * @throws IllegalStateException if this participant is a handler
     */
    public boolean setVigor(int newVigor) {
        int stored = getCreature().assignVigor(newVigor);
        if (stored == 0) {
            return markDefeated();
        }
        return false;
    }

    /**
     * Subtract damage from a creature's vigor, never below 0.
     * @return true if this call defeated the participant
     */
    public boolean takeDamage(int damage) {
        return setVigor(getCreature().getCurrentVigor() - Math.max(0, damage));
    }

    // Relationships

    public RelationshipType getRelationship(String otherId) {
        return relationships.get(otherId);
    }

    public void setRelationship(String otherId, RelationshipType type) {
        if (otherId == null || type == null) return;
        relationships.put(otherId, type);
    }

    public void removeRelationship(String otherId) {
        relationships.remove(otherId);
    }

    public boolean isHostileTo(Participant other) {
        return relationships.get(other.getId()) == RelationshipType.HOSTILE;
    }

    public Map<String, RelationshipType> getRelationships() {
        return Collections.unmodifiableMap(relationships);
    }

    @Override
    public String toString() {
        return String.format("Participant[%s '%s' %s %s%s]", id, name, kind.getDisplayName(), faction,
            defeated ? " defeated" : "");
    }
}
