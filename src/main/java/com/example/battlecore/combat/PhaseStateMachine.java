package com.example.battlecore.combat;

import com.example.battlecore.effect.PhaseEffectHandler;
import com.example.battlecore.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Moves a battle through its fixed phase cycle.
 *
 * Entering SELECT_ACTION starts a new turn: the turn counter goes up by one and every
 * participant's acted flag is cleared. Entering APPLY_EFFECTS runs the registered
 * effect handlers. BATTLE_END is absorbing. Every transition is logged.
 */
public class PhaseStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(PhaseStateMachine.class);

    public static final String PHASE_ADVANCED = "Phase Advanced";
    public static final String BATTLE_ENDED = "Battle Ended";

    private final Clock clock;
    private final List<PhaseEffectHandler> effectHandlers = new CopyOnWriteArrayList<>();

    public PhaseStateMachine(Clock clock) {
        this.clock = clock;
    }

    public void addEffectHandler(PhaseEffectHandler handler) {
        if (handler != null) {
            effectHandlers.add(handler);
        }
    }

    public List<PhaseEffectHandler> getEffectHandlers() {
        return List.copyOf(effectHandlers);
    }

    /**
     * Advance to the next phase.
     * @return the new phase
     */
    public BattlePhase advance(BattleState state) {
        BattlePhase from = state.getCurrentPhase();
        BattlePhase to = from.next();
        state.setCurrentPhase(to);

        if (to == BattlePhase.SELECT_ACTION) {
            state.setCurrentTurn(state.getCurrentTurn() + 1);
            for (Participant p : state.getParticipants()) {
                p.setHasActed(false);
            }
        }

        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, PHASE_ADVANCED, List.of(),
            "Battle phase changed to " + to.getDisplayName(), clock.instant());
        logger.debug("[PhaseStateMachine] Turn {}: {} -> {}", state.getCurrentTurn(),
            from.getDisplayName(), to.getDisplayName());

        if (to == BattlePhase.APPLY_EFFECTS) {
            for (PhaseEffectHandler handler : effectHandlers) {
                handler.applyEffects(state);
            }
        }
        return to;
    }

    /**
     * Jump straight to BATTLE_END and deactivate the battle.
     */
    public void finish(BattleState state, String reason) {
        state.setCurrentPhase(BattlePhase.BATTLE_END);
        state.setActive(false);
        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, BATTLE_ENDED, List.of(), reason, clock.instant());
        logger.debug("[PhaseStateMachine] Battle ended on turn {}: {}", state.getCurrentTurn(), reason);
    }
}
