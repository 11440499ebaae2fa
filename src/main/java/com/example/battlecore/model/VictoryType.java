package com.example.battlecore.model;

public enum VictoryType {
    /** Every opposing participant is defeated */
    DEFEAT_ALL_ENEMIES,
    /** A named participant is defeated (parameter "targetId") */
    DEFEAT_SPECIFIC_TARGET,
    /** The battle reached a turn count (parameter "turns") */
    SURVIVAL,
    /** A participant got away; needs escape tracking the engine does not have */
    ESCAPE,
    /** Custom goal; needs objective tracking the engine does not have */
    OBJECTIVE,
    /** Wall-clock deadline passed (parameter "timeLimit") */
    TIMER
}
