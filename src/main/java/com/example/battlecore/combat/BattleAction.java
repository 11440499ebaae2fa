package com.example.battlecore.combat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An action submitted by one participant.
 *
 * For attacks either {@code move} is given directly, or {@code moveName} is looked up in the
 * move catalog. The other kinds ignore both. Target ids may contain nulls; each one resolves
 * to its own NOT_FOUND result.
 */
public record BattleAction(String actorId, ActionKind kind, List<String> targetIds, String moveName, MoveData move) {

    public BattleAction {
        targetIds = targetIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(targetIds));
    }

    public static BattleAction attack(String actorId, List<String> targetIds, MoveData move) {
        return new BattleAction(actorId, ActionKind.ATTACK, targetIds, move == null ? null : move.name(), move);
    }

    public static BattleAction attack(String actorId, List<String> targetIds, String moveName) {
        return new BattleAction(actorId, ActionKind.ATTACK, targetIds, moveName, null);
    }

    public static BattleAction of(String actorId, ActionKind kind, List<String> targetIds) {
        return new BattleAction(actorId, kind, targetIds, null, null);
    }
}
