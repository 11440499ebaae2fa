package com.example.battlecore.persistence;

import com.example.battlecore.combat.BattleState;

/**
 * Holds the current battle between engine calls. The engine saves after every
 * mutating call; failures thrown here propagate to the caller unchanged.
 */
public interface BattleStateStore {

    /**
     * @return the stored battle, or null if there is none
     */
    BattleState load();

    void save(BattleState state);

    boolean hasActiveBattle();

    /**
     * Forget the stored battle.
     */
    void clear();
}
