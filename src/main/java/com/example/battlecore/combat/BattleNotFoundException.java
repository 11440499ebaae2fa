package com.example.battlecore.combat;

/**
 * An id that does not name a participant in the current battle.
 */
public class BattleNotFoundException extends BattleException {

    private final String participantId;

    public BattleNotFoundException(String participantId) {
        super("Participant not found: " + participantId);
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }
}
