package com.example.battlecore.combat;

/**
 * Turn and phase after an advance.
 */
public record PhaseChange(int currentTurn, BattlePhase currentPhase) {
}
