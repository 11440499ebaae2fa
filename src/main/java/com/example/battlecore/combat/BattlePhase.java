package com.example.battlecore.combat;

/**
 * Phases of a battle turn. The cycle is fixed:
 * INITIALIZE -> SELECT_ACTION -> RESOLVE_ACTIONS -> APPLY_EFFECTS -> CHECK_VICTORY -> END_TURN -> SELECT_ACTION ...
 * BATTLE_END only leads back to itself.
 */
public enum BattlePhase {

    /** Battle set up, turn order rolled */
    INITIALIZE("Initialize"),

    /** Participants choose actions; entering this phase starts a new turn */
    SELECT_ACTION("SelectAction"),

    /** Submitted actions are resolved */
    RESOLVE_ACTIONS("ResolveActions"),

    /** Status ticks, hazards and weather (ruleset effect handlers) */
    APPLY_EFFECTS("ApplyEffects"),

    /** Victory conditions are checked */
    CHECK_VICTORY("CheckVictory"),

    /** Turn wrap-up */
    END_TURN("EndTurn"),

    /** Battle is over */
    BATTLE_END("BattleEnd");

    private final String displayName;

    BattlePhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == BATTLE_END;
    }

    /**
     * The phase that follows this one.
     */
    public BattlePhase next() {
        switch (this) {
            case INITIALIZE:
                return SELECT_ACTION;
            case SELECT_ACTION:
                return RESOLVE_ACTIONS;
            case RESOLVE_ACTIONS:
                return APPLY_EFFECTS;
            case APPLY_EFFECTS:
                return CHECK_VICTORY;
            case CHECK_VICTORY:
                return END_TURN;
            case END_TURN:
                return SELECT_ACTION;
            case BATTLE_END:
            default:
                return BATTLE_END;
        }
    }
}
