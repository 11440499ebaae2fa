package com.example.battlecore.combat;

/**
 * Base class for every engine operation failure.
 */
public class BattleException extends RuntimeException {

    public BattleException(String message) {
        super(message);
    }

    public BattleException(String message, Throwable cause) {
        super(message, cause);
    }
}
