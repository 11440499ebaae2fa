package com.example.battlecore.combat;

import com.example.battlecore.model.Participant;

import java.util.ArrayList;
import java.util.List;

/**
 * Turn order as seen by a caller: who acts, in what order, and who already has.
 */
public record TurnOrderView(int currentTurn, BattlePhase currentPhase, String currentActorId, List<Slot> order) {

    public record Slot(String id, String name, int initiative, boolean hasActed, boolean defeated) {
    }

    public static TurnOrderView of(BattleState state) {
        List<Slot> slots = new ArrayList<>();
        for (String id : state.getTurnOrder()) {
            Participant p = state.findParticipant(id);
            if (p != null) {
                slots.add(new Slot(p.getId(), p.getName(), p.getInitiative(), p.hasActed(), p.isDefeated()));
            }
        }
        return new TurnOrderView(state.getCurrentTurn(), state.getCurrentPhase(), state.getCurrentActorId(),
            List.copyOf(slots));
    }

    public List<String> ids() {
        List<String> ids = new ArrayList<>(order.size());
        for (Slot s : order) {
            ids.add(s.id());
        }
        return ids;
    }
}
