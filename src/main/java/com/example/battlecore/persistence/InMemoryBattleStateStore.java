package com.example.battlecore.persistence;

import com.example.battlecore.combat.BattleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the battle in a field. Suitable for a single process and for tests.
 */
public class InMemoryBattleStateStore implements BattleStateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBattleStateStore.class);

    private BattleState current;

    @Override
    public synchronized BattleState load() {
        return current;
    }

    @Override
    public synchronized void save(BattleState state) {
        if (state == null) {
            throw new IllegalArgumentException("Cannot save a null battle state");
        }
        this.current = state;
        logger.debug("[BattleStateStore] Saved turn {} {}", state.getCurrentTurn(),
            state.getCurrentPhase().getDisplayName());
    }

    @Override
    public synchronized boolean hasActiveBattle() {
        return current != null && current.isActive();
    }

    @Override
    public synchronized void clear() {
        current = null;
    }
}
