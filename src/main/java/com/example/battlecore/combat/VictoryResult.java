package com.example.battlecore.combat;

import java.util.List;

/**
 * Aggregate victory check. The battle is won as soon as any condition is met; the
 * reason and winning faction come from the first condition that is.
 */
public class VictoryResult {

    private final boolean met;
    private final String reason;
    private final String winningFaction;
    private final List<ConditionResult> conditionResults;

    public VictoryResult(boolean met, String reason, String winningFaction, List<ConditionResult> conditionResults) {
        this.met = met;
        this.reason = reason;
        this.winningFaction = winningFaction;
        this.conditionResults = conditionResults == null ? List.of() : List.copyOf(conditionResults);
    }

    public static VictoryResult from(List<ConditionResult> results) {
        for (ConditionResult r : results) {
            if (r.met()) {
                return new VictoryResult(true, r.reason(), r.condition().getFaction(), results);
            }
        }
        String reason = results.isEmpty() ? "No victory conditions" : "No victory condition met";
        return new VictoryResult(false, reason, null, results);
    }

    public boolean isMet() { return met; }

    public String getReason() { return reason; }

    /** Faction of the first met condition, or null */
    public String getWinningFaction() { return winningFaction; }

    public List<ConditionResult> getConditionResults() { return conditionResults; }

    @Override
    public String toString() {
        return "VictoryResult[" + (met ? "met: " : "not met: ") + reason + "]";
    }
}
