package com.example.battlecore.combat;

import com.example.battlecore.model.Participant;
import com.example.battlecore.model.VictoryCondition;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks victory conditions against a battle. Never mutates the state.
 *
 * ESCAPE and OBJECTIVE need state the engine does not track yet (an escaped flag,
 * objective progress) and always report not met.
 * DEFEAT_ALL_ENEMIES is not met while the faction has no opponents at all, so a battle
 * whose other side has not joined yet is not already won.
 */
public class VictoryEvaluator {

    private final Clock clock;

    public VictoryEvaluator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Evaluate every condition on the battle; any met condition wins.
     */
    public VictoryResult evaluate(BattleState state) {
        List<ConditionResult> results = new ArrayList<>();
        for (VictoryCondition condition : state.getVictoryConditions()) {
            results.add(evaluate(state, condition));
        }
        return VictoryResult.from(results);
    }

    public ConditionResult evaluate(BattleState state, VictoryCondition condition) {
        switch (condition.getType()) {
            case DEFEAT_ALL_ENEMIES:
                return defeatAllEnemies(state, condition);
            case DEFEAT_SPECIFIC_TARGET:
                return defeatSpecificTarget(state, condition);
            case SURVIVAL:
                return survival(state, condition);
            case TIMER:
                return timer(condition);
            case ESCAPE:
                return new ConditionResult(condition, false, "Escape is not tracked");
            case OBJECTIVE:
                return new ConditionResult(condition, false, "Objectives are not tracked");
            default:
                return new ConditionResult(condition, false, "Unknown condition type " + condition.getType());
        }
    }

    private ConditionResult defeatAllEnemies(BattleState state, VictoryCondition condition) {
        String faction = condition.getFaction();
        List<Participant> opponents = opponentsOf(state, faction);
        if (opponents.isEmpty()) {
            return new ConditionResult(condition, false, "No opponents of " + faction + " in battle");
        }
        long standing = opponents.stream().filter(p -> !p.isDefeated()).count();
        if (standing == 0) {
            return new ConditionResult(condition, true, "All enemies of " + faction + " defeated");
        }
        return new ConditionResult(condition, false,
            standing + " of " + opponents.size() + " enemies of " + faction + " still standing");
    }

    /**
     * Participants of another faction on the opposite side from the given faction.
     * The faction's side is that of its first participant; a faction with nobody in
     * battle counts as the player side.
     */
    List<Participant> opponentsOf(BattleState state, String faction) {
        boolean playerSide = true;
        for (Participant p : state.getParticipants()) {
            if (p.isInFaction(faction)) {
                playerSide = p.getKind().isPlayerSide();
                break;
            }
        }
        List<Participant> opponents = new ArrayList<>();
        for (Participant p : state.getParticipants()) {
            if (!p.isInFaction(faction) && p.getKind().isPlayerSide() != playerSide) {
                opponents.add(p);
            }
        }
        return opponents;
    }

    private ConditionResult defeatSpecificTarget(BattleState state, VictoryCondition condition) {
        String targetId = condition.getString(VictoryCondition.PARAM_TARGET_ID);
        if (targetId == null) {
            return new ConditionResult(condition, false, "No target given");
        }
        Participant target = state.findParticipant(targetId);
        if (target == null) {
            return new ConditionResult(condition, false, "Target " + targetId + " is not in battle");
        }
        if (target.isDefeated()) {
            return new ConditionResult(condition, true, target.getName() + " defeated");
        }
        return new ConditionResult(condition, false, target.getName() + " still standing");
    }

    private ConditionResult survival(BattleState state, VictoryCondition condition) {
        Integer turns = condition.getInt(VictoryCondition.PARAM_TURNS);
        if (turns == null) {
            return new ConditionResult(condition, false, "No turn count given");
        }
        if (state.getCurrentTurn() >= turns) {
            return new ConditionResult(condition, true, "Survived " + turns + " turns");
        }
        return new ConditionResult(condition, false,
            "Turn " + state.getCurrentTurn() + " of " + turns);
    }

    private ConditionResult timer(VictoryCondition condition) {
        Instant limit = condition.getInstant(VictoryCondition.PARAM_TIME_LIMIT);
        if (limit == null) {
            return new ConditionResult(condition, false, "No time limit given");
        }
        if (!clock.instant().isBefore(limit)) {
            return new ConditionResult(condition, true, "Time limit reached");
        }
        return new ConditionResult(condition, false, "Time limit not reached");
    }
}
