package com.example.battlecore.combat;

import com.example.battlecore.effect.StatusEffect;
import com.example.battlecore.model.CreatureCombatant;
import com.example.battlecore.model.HandlerCombatant;
import com.example.battlecore.model.Participant;
import com.example.battlecore.model.ParticipantKind;

import java.util.List;

/**
 * Read-only snapshot of one participant. Creature fields are null for handlers and
 * handler fields are null for creatures.
 */
public record ParticipantStatus(
    String id,
    String name,
    ParticipantKind kind,
    String faction,
    int initiative,
    boolean hasActed,
    boolean defeated,
    Integer currentVigor,
    Integer maxVigor,
    Integer vigorPercent,
    List<StatusEffect> statusEffects,
    List<String> usedMoves,
    String lastAction,
    Boolean canEscape,
    List<String> remainingTeam) {

    public static ParticipantStatus of(Participant p) {
        if (p.isCreature()) {
            CreatureCombatant c = p.getCreature();
            return new ParticipantStatus(p.getId(), p.getName(), p.getKind(), p.getFaction(), p.getInitiative(),
                p.hasActed(), p.isDefeated(), c.getCurrentVigor(), c.getMaxVigor(), c.getVigorPercent(),
                c.getStatusEffects(), c.getUsedMoves(), c.getLastAction(), null, null);
        }
        HandlerCombatant h = p.getHandler();
        return new ParticipantStatus(p.getId(), p.getName(), p.getKind(), p.getFaction(), p.getInitiative(),
            p.hasActed(), p.isDefeated(), null, null, null, List.of(), List.of(), null,
            h.canEscape(), h.getRemainingTeam());
    }
}
