package com.example.battlecore.combat;

import com.example.battlecore.model.Participant;
import com.example.battlecore.model.StatType;

/**
 * Hit and damage arithmetic for attacks.
 *
 * Hit: d20 + attack stat >= 10 + defense stat.
 * Physical moves use Power against Defense, special moves use Mind against Spirit.
 *
 * Damage: (move dice + floor(attack stat / 2) bonus dice) d6, then
 * floor(total * type multiplier * critical multiplier). The critical multiplier
 * only applies on a natural 20.
 */
public class DamageCalculator {

    /** Base of the defense value a hit roll must reach */
    public static final int BASE_DEFENSE = 10;

    public static final int HIT_DIE = 20;
    public static final int DAMAGE_DIE = 6;

    private final double criticalMultiplier;

    public DamageCalculator(double criticalMultiplier) {
        if (criticalMultiplier < 1.0) {
            throw new IllegalArgumentException("Critical multiplier must be at least 1.0, got " + criticalMultiplier);
        }
        this.criticalMultiplier = criticalMultiplier;
    }

    public double getCriticalMultiplier() {
        return criticalMultiplier;
    }

    public int attackStat(Participant attacker, boolean special) {
        return attacker.getStatModifier(special ? StatType.MIND : StatType.POWER);
    }

    public int defenseValue(Participant target, boolean special) {
        return BASE_DEFENSE + target.getStatModifier(special ? StatType.SPIRIT : StatType.DEFENSE);
    }

    public boolean isHit(int hitRoll, int attackStat, int defenseValue) {
        return hitRoll + attackStat >= defenseValue;
    }

    public boolean isCritical(int hitRoll) {
        return hitRoll == HIT_DIE;
    }

    /**
     * Extra d6 granted by the attack stat. Never negative.
     */
    public int bonusDice(int attackStat) {
        return Math.max(0, Math.floorDiv(attackStat, 2));
    }

    /**
     * Apply the type and critical multipliers to the dice total, rounding down once at the end.
     */
    public int finalDamage(int diceTotal, double typeMultiplier, boolean critical) {
        double damage = diceTotal * typeMultiplier * (critical ? criticalMultiplier : 1.0);
        return Math.max(0, (int) Math.floor(damage));
    }
}
