package com.example.battlecore.combat;

/**
 * Malformed or missing input. Thrown before anything is mutated.
 */
public class BattleValidationException extends BattleException {

    public BattleValidationException(String message) {
        super(message);
    }
}
