package com.example.battlecore.combat;

import java.util.List;

/**
 * Receives battle events for text rendering. Both callbacks default to doing nothing.
 */
public interface BattleNarrationSink {

    BattleNarrationSink NONE = new BattleNarrationSink() { };

    /**
     * Called after an entry is appended to the battle log.
     */
    default void onLogEntry(BattleLogEntry entry) {
    }

    /**
     * Called once per resolveAction call with every per-target result.
     */
    default void onActionResolved(BattleAction action, List<ActionResult> results) {
    }
}
