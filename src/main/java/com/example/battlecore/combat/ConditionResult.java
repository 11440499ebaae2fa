package com.example.battlecore.combat;

import com.example.battlecore.model.VictoryCondition;

/**
 * Whether one victory condition holds, and why.
 */
public record ConditionResult(VictoryCondition condition, boolean met, String reason) {
}
