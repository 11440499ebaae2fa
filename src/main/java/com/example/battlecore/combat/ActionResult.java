package com.example.battlecore.combat;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one action against one target (or of the whole action, for
 * rejected calls and non-attack placeholders).
 */
public class ActionResult {

    public enum ResultType {
        HIT,              // Damage dealt
        CRITICAL_HIT,     // Natural 20, damage multiplied
        MISS,             // Hit roll fell short
        NO_EFFECT,        // Hit, but the target's type is immune
        INVALID_TARGET,   // Target cannot be attacked (handler, already defeated)
        NOT_FOUND,        // Unknown actor or target id
        VALIDATION_ERROR, // Rejected before resolution
        SWITCH,           // Placeholder results for ruleset-owned actions
        ITEM,
        ESCAPE
    }

    private final ResultType type;
    private final String actorId;
    private final String targetId;
    private final boolean success;

    private String message;

    // Attack detail
    private int hitRoll;
    private int attackTotal;
    private int defenseValue;
    private final List<Integer> damageRolls = new ArrayList<>();
    private int rawDamage;
    private int finalDamage;
    private double effectiveness = 1.0;
    private String effectivenessLabel;
    private int remainingVigor;
    private boolean defeated;

    /** Extra notes such as "defeated" */
    private final List<String> notes = new ArrayList<>();

    private ActionResult(ResultType type, boolean success, String actorId, String targetId) {
        this.type = type;
        this.success = success;
        this.actorId = actorId;
        this.targetId = targetId;
    }

    // Static factory methods

    public static ActionResult hit(String actorId, String targetId, int finalDamage) {
        ActionResult r = new ActionResult(ResultType.HIT, true, actorId, targetId);
        r.finalDamage = finalDamage;
        return r;
    }

    public static ActionResult criticalHit(String actorId, String targetId, int finalDamage) {
        ActionResult r = new ActionResult(ResultType.CRITICAL_HIT, true, actorId, targetId);
        r.finalDamage = finalDamage;
        return r;
    }

    public static ActionResult miss(String actorId, String targetId) {
        return new ActionResult(ResultType.MISS, false, actorId, targetId);
    }

    public static ActionResult noEffect(String actorId, String targetId) {
        ActionResult r = new ActionResult(ResultType.NO_EFFECT, false, actorId, targetId);
        r.effectiveness = 0.0;
        return r;
    }

    public static ActionResult invalidTarget(String actorId, String targetId, String message) {
        ActionResult r = new ActionResult(ResultType.INVALID_TARGET, false, actorId, targetId);
        r.message = message;
        return r;
    }

    public static ActionResult notFound(String actorId, String targetId, String message) {
        ActionResult r = new ActionResult(ResultType.NOT_FOUND, false, actorId, targetId);
        r.message = message;
        return r;
    }

    public static ActionResult validationError(String actorId, String message) {
        ActionResult r = new ActionResult(ResultType.VALIDATION_ERROR, false, actorId, null);
        r.message = message;
        return r;
    }

    /**
     * Minimal result for Switch, Item and Escape, whose mechanics belong to the ruleset.
     */
    public static ActionResult placeholder(ActionKind kind, String actorId, boolean success, String message) {
        ResultType type;
        switch (kind) {
            case SWITCH:
                type = ResultType.SWITCH;
                break;
            case ITEM:
                type = ResultType.ITEM;
                break;
            case ESCAPE:
                type = ResultType.ESCAPE;
                break;
            default:
                throw new IllegalArgumentException("No placeholder result for " + kind);
        }
        ActionResult r = new ActionResult(type, success, actorId, null);
        r.message = message;
        return r;
    }

    // Getters

    public ResultType getType() { return type; }
    public String getActorId() { return actorId; }
    public String getTargetId() { return targetId; }
    public boolean isSuccess() { return success; }

    public String getMessage() { return message; }
    public ActionResult setMessage(String message) { this.message = message; return this; }

    public int getHitRoll() { return hitRoll; }
    public ActionResult setHitRoll(int hitRoll) { this.hitRoll = hitRoll; return this; }

    public int getAttackTotal() { return attackTotal; }
    public ActionResult setAttackTotal(int attackTotal) { this.attackTotal = attackTotal; return this; }

    public int getDefenseValue() { return defenseValue; }
    public ActionResult setDefenseValue(int defenseValue) { this.defenseValue = defenseValue; return this; }

    public List<Integer> getDamageRolls() { return List.copyOf(damageRolls); }
    public ActionResult setDamageRolls(List<Integer> rolls) {
        damageRolls.clear();
        damageRolls.addAll(rolls);
        return this;
    }

    public int getRawDamage() { return rawDamage; }
    public ActionResult setRawDamage(int rawDamage) { this.rawDamage = rawDamage; return this; }

    public int getFinalDamage() { return finalDamage; }

    public double getEffectiveness() { return effectiveness; }
    public ActionResult setEffectiveness(double effectiveness) { this.effectiveness = effectiveness; return this; }

    public String getEffectivenessLabel() { return effectivenessLabel; }
    public ActionResult setEffectivenessLabel(String label) { this.effectivenessLabel = label; return this; }

    public int getRemainingVigor() { return remainingVigor; }
    public ActionResult setRemainingVigor(int remainingVigor) { this.remainingVigor = remainingVigor; return this; }

    public boolean isDefeated() { return defeated; }
    public ActionResult setDefeated(boolean defeated) { this.defeated = defeated; return this; }

    public List<String> getNotes() { return List.copyOf(notes); }
    public ActionResult addNote(String note) { this.notes.add(note); return this; }

    public boolean isHit() { return type == ResultType.HIT || type == ResultType.CRITICAL_HIT; }
    public boolean isCritical() { return type == ResultType.CRITICAL_HIT; }
    public boolean isError() {
        return type == ResultType.NOT_FOUND || type == ResultType.VALIDATION_ERROR
            || type == ResultType.INVALID_TARGET;
    }

    /**
     * One-line summary used for the battle log.
     */
    public String summarize() {
        switch (type) {
            case HIT:
            case CRITICAL_HIT:
                String s = String.format("%s%s took %d damage (%s)", targetId,
                    type == ResultType.CRITICAL_HIT ? " [critical]" : "", finalDamage,
                    effectivenessLabel == null ? TypeChart.describe(effectiveness) : effectivenessLabel);
                return defeated ? s + ", defeated" : s;
            case MISS:
                return "missed " + targetId;
            case NO_EFFECT:
                return "no effect on " + targetId;
            default:
                return (targetId != null ? targetId + ": " : "") + (message != null ? message : type.name());
        }
    }

    @Override
    public String toString() {
        return String.format("ActionResult[%s %s -> %s, damage=%d, effectiveness=%s%s]",
            type, actorId, targetId, finalDamage, effectiveness, message != null ? ", " + message : "");
    }
}
