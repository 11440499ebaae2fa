package com.example.battlecore.combat;

import com.example.battlecore.model.Participant;
import com.example.battlecore.model.StatType;
import com.example.battlecore.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolls initiative for every participant and rebuilds the turn order.
 *
 * initiative = Speed modifier * 10 + d20. Highest goes first; ties keep roster order.
 * The turn order is always rebuilt from the whole roster, never patched. Initiatives are
 * rolled for everyone at the start of a battle; a participant joining later rolls only its
 * own, so the others keep their place relative to each other.
 */
public class InitiativeCalculator {

    private static final Logger logger = LoggerFactory.getLogger(InitiativeCalculator.class);

    private static final int SPEED_WEIGHT = 10;

    private final RandomSource random;

    public InitiativeCalculator(RandomSource random) {
        this.random = random;
    }

    /**
     * Roll initiative for everyone in the state (one d20 per participant, in roster order),
     * then write the turn order and the current actor.
     */
    public void recompute(BattleState state) {
        List<Participant> roster = new ArrayList<>(state.getParticipants());
        for (Participant p : roster) {
            roll(p);
        }
        applyOrder(state, roster);
    }

    /**
     * Roll initiative for a participant already added to the state, then rebuild the
     * turn order from everyone's current initiative. Exactly one draw.
     */
    public void admit(BattleState state, Participant newcomer) {
        roll(newcomer);
        applyOrder(state, new ArrayList<>(state.getParticipants()));
    }

    /**
     * Rebuild the turn order from the initiatives already rolled, without new draws.
     * Used when someone leaves: nobody new needs a roll.
     */
    public void reorder(BattleState state) {
        applyOrder(state, new ArrayList<>(state.getParticipants()));
    }

    private void roll(Participant p) {
        int roll = random.roll(20);
        int initiative = p.getStatModifier(StatType.SPEED) * SPEED_WEIGHT + roll;
        p.setInitiative(initiative);
        logger.debug("[Initiative] {} rolled {} -> {}", p.getId(), roll, initiative);
    }

    private void applyOrder(BattleState state, List<Participant> roster) {
        // List.sort is stable, so equal initiatives stay in roster order
        roster.sort((a, b) -> Integer.compare(b.getInitiative(), a.getInitiative()));

        List<String> order = new ArrayList<>(roster.size());
        for (Participant p : roster) {
            order.add(p.getId());
        }
        state.setTurnOrder(order);
        state.setCurrentActorId(order.isEmpty() ? null : order.get(0));
    }
}
