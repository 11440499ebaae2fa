package com.example.battlecore.combat;

/**
 * The call does not fit the current lifecycle: a battle is already running, or none is.
 */
public class BattleStateConflictException extends BattleException {

    public BattleStateConflictException(String message) {
        super(message);
    }

    public static BattleStateConflictException alreadyActive() {
        return new BattleStateConflictException("A battle is already active");
    }

    public static BattleStateConflictException noActiveBattle() {
        return new BattleStateConflictException("No active battle");
    }
}
