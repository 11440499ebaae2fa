package com.example.battlecore.effect;

import com.example.battlecore.combat.BattleState;

/**
 * Ruleset hook run each time a battle enters the ApplyEffects phase.
 * Status ticks, weather damage and hazards are implemented here, outside the engine core.
 */
@FunctionalInterface
public interface PhaseEffectHandler {

    void applyEffects(BattleState state);
}
