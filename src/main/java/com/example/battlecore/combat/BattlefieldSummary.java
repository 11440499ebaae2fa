package com.example.battlecore.combat;

import com.example.battlecore.model.BattleKind;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Overview of the battle for narration.
 */
public record BattlefieldSummary(
    BattleKind kind,
    int currentTurn,
    BattlePhase currentPhase,
    int totalParticipants,
    int activeParticipants,
    int defeatedParticipants,
    Set<String> factions,
    String weather,
    String battlefield,
    int hazardCount,
    List<BattleLogEntry> recentEvents) {

    public static final int RECENT_EVENT_COUNT = 3;

    public static BattlefieldSummary of(BattleState state) {
        return new BattlefieldSummary(
            state.getKind(),
            state.getCurrentTurn(),
            state.getCurrentPhase(),
            state.getParticipants().size(),
            state.getActiveParticipants().size(),
            state.getDefeatedParticipants().size(),
            Collections.unmodifiableSet(state.getFactions()),
            state.getWeather().getName(),
            state.getBattlefield().getName(),
            state.getBattlefield().getHazards().size(),
            state.getLog().recent(RECENT_EVENT_COUNT));
    }
}
