package com.example.battlecore.combat;

import com.example.battlecore.model.BattleKind;
import com.example.battlecore.model.Battlefield;
import com.example.battlecore.model.Participant;
import com.example.battlecore.model.VictoryCondition;
import com.example.battlecore.model.Weather;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything about one encounter: roster, turn order, phase, field, weather,
 * victory conditions and the battle log. Created once per encounter and
 * mutated in place by the engine.
 */
public class BattleState {

    private boolean active = true;

    private final BattleKind kind;

    /** Current turn number (starts at 1) */
    private int currentTurn = 1;

    private BattlePhase currentPhase = BattlePhase.INITIALIZE;

    /** Participants in the order they joined */
    private final List<Participant> participants = new ArrayList<>();

    /** Participant ids, highest initiative first */
    private List<String> turnOrder = new ArrayList<>();

    /** First id in the turn order, or null when there is nobody */
    private String currentActorId;

    private final Battlefield battlefield;

    private Weather weather;

    private List<VictoryCondition> victoryConditions = new ArrayList<>();

    private final BattleLog log = new BattleLog();

    private final Instant startedAt;

    public BattleState(BattleKind kind, Battlefield battlefield, Weather weather, Instant startedAt) {
        if (kind == null) {
            throw new IllegalArgumentException("Battle kind is required");
        }
        this.kind = kind;
        this.battlefield = battlefield == null ? new Battlefield(null) : battlefield;
        this.weather = weather == null ? new Weather(Weather.CLEAR) : weather;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    // Lifecycle

    public boolean isActive() { return active; }

    public void setActive(boolean active) { this.active = active; }

    public BattleKind getKind() { return kind; }

    public Instant getStartedAt() { return startedAt; }

    // Turn and phase

    public int getCurrentTurn() { return currentTurn; }

    public void setCurrentTurn(int currentTurn) {
        if (currentTurn < 1) {
            throw new IllegalArgumentException("Turn must be at least 1, got " + currentTurn);
        }
        this.currentTurn = currentTurn;
    }

    public BattlePhase getCurrentPhase() { return currentPhase; }

    public void setCurrentPhase(BattlePhase currentPhase) {
        if (currentPhase == null) {
            throw new IllegalArgumentException("Phase is required");
        }
        this.currentPhase = currentPhase;
    }

    // Roster

    public List<Participant> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    /**
     * Find a participant by id (case-insensitive).
     * @return the participant, or null if not present
     */
    public Participant findParticipant(String id) {
        if (id == null) return null;
        for (Participant p : participants) {
            if (p.hasId(id)) {
                return p;
            }
        }
        return null;
    }

    public boolean hasParticipant(String id) {
        return findParticipant(id) != null;
    }

    /**
     * Add a participant to the roster. The caller is responsible for recomputing initiative.
     * @throws IllegalArgumentException if a participant with the same id is present
     */
    public void addParticipant(Participant participant) {
        if (hasParticipant(participant.getId())) {
            throw new IllegalArgumentException("Duplicate participant id: " + participant.getId());
        }
        participants.add(participant);
    }

    /**
     * Remove a participant from the roster and the turn order.
     * @return the removed participant, or null if not present
     */
    public Participant removeParticipant(String id) {
        Participant p = findParticipant(id);
        if (p == null) return null;
        participants.remove(p);
        turnOrder.remove(p.getId());
        if (p.getId().equals(currentActorId)) {
            currentActorId = turnOrder.isEmpty() ? null : turnOrder.get(0);
        }
        return p;
    }

    public List<Participant> getActiveParticipants() {
        return participants.stream()
            .filter(p -> !p.isDefeated())
            .collect(Collectors.toList());
    }

    public List<Participant> getDefeatedParticipants() {
        return participants.stream()
            .filter(Participant::isDefeated)
            .collect(Collectors.toList());
    }

    /**
     * Distinct factions, in roster order.
     */
    public Set<String> getFactions() {
        Set<String> factions = new LinkedHashSet<>();
        for (Participant p : participants) {
            factions.add(p.getFaction());
        }
        return factions;
    }

    // Turn order

    public List<String> getTurnOrder() {
        return Collections.unmodifiableList(turnOrder);
    }

    public void setTurnOrder(List<String> turnOrder) {
        this.turnOrder = new ArrayList<>(turnOrder);
    }

    public String getCurrentActorId() { return currentActorId; }

    public void setCurrentActorId(String currentActorId) { this.currentActorId = currentActorId; }

    // Field

    public Battlefield getBattlefield() { return battlefield; }

    public Weather getWeather() { return weather; }

    public void setWeather(Weather weather) {
        this.weather = weather == null ? new Weather(Weather.CLEAR) : weather;
    }

    // Victory

    public List<VictoryCondition> getVictoryConditions() {
        return Collections.unmodifiableList(victoryConditions);
    }

    public void setVictoryConditions(List<VictoryCondition> victoryConditions) {
        this.victoryConditions = victoryConditions == null ? new ArrayList<>() : new ArrayList<>(victoryConditions);
    }

    // Log

    public BattleLog getLog() { return log; }

    /**
     * Append an entry stamped with the current turn and phase.
     */
    public BattleLogEntry logEvent(String actorId, String action, List<String> targetIds, String result,
                                   Instant timestamp) {
        BattleLogEntry entry = new BattleLogEntry(currentTurn, currentPhase, actorId, action, targetIds,
            result, timestamp);
        log.append(entry);
        return entry;
    }

    public String getSummary() {
        return String.format("Battle [%s] Turn %d %s - %d participants (%d defeated) on %s, %s",
            kind.getDisplayName(), currentTurn, currentPhase.getDisplayName(), participants.size(),
            getDefeatedParticipants().size(), battlefield.getName(), weather.getName());
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
