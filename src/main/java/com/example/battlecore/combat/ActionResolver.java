package com.example.battlecore.combat;

import com.example.battlecore.model.CreatureCombatant;
import com.example.battlecore.model.Participant;
import com.example.battlecore.ruleset.MoveCatalog;
import com.example.battlecore.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Executes a submitted action against the battle state.
 *
 * Rejected calls (unknown actor, defeated actor, missing kind, bad move) return a single
 * result and touch nothing. Accepted calls mark the actor as having acted and append
 * exactly one log entry, whatever the number of targets.
 *
 * Attack targets are processed independently in submission order. For each target the
 * hit roll is drawn first, then the damage dice.
 */
public class ActionResolver {

    private static final Logger logger = LoggerFactory.getLogger(ActionResolver.class);

    private final TypeChart typeChart;
    private final DamageCalculator calculator;
    private final RandomSource random;
    private final MoveCatalog moveCatalog;
    private final Clock clock;

    public ActionResolver(TypeChart typeChart, DamageCalculator calculator, RandomSource random,
                          MoveCatalog moveCatalog, Clock clock) {
        this.typeChart = typeChart;
        this.calculator = calculator;
        this.random = random;
        this.moveCatalog = moveCatalog == null ? MoveCatalog.EMPTY : moveCatalog;
        this.clock = clock;
    }

    public List<ActionResult> resolve(BattleState state, BattleAction action) {
        Participant actor = state.findParticipant(action.actorId());
        if (actor == null) {
            logger.warn("[ActionResolver] Unknown actor {}", action.actorId());
            return List.of(ActionResult.notFound(action.actorId(), null, "Actor not found: " + action.actorId()));
        }
        if (action.kind() == null) {
            return reject(actor, "Unknown action kind");
        }
        if (actor.isDefeated()) {
            return reject(actor, actor.getName() + " is defeated and cannot act");
        }

        switch (action.kind()) {
            case ATTACK:
                return resolveAttack(state, actor, action);
            case SWITCH:
            case ITEM:
            case ESCAPE:
                return resolvePlaceholder(state, actor, action);
            default:
                return reject(actor, "Unsupported action kind " + action.kind());
        }
    }

    private List<ActionResult> reject(Participant actor, String message) {
        logger.warn("[ActionResolver] Rejected action by {}: {}", actor.getId(), message);
        return List.of(ActionResult.validationError(actor.getId(), message));
    }

    // Attack

    private List<ActionResult> resolveAttack(BattleState state, Participant actor, BattleAction action) {
        if (!actor.isCreature()) {
            return reject(actor, actor.getName() + " is a handler and cannot attack");
        }
        MoveData move = action.move() != null ? action.move() : moveCatalog.findMove(action.moveName());
        if (move == null) {
            return reject(actor, "Unknown move: " + action.moveName());
        }
        if (!move.isValid()) {
            return reject(actor, "Invalid move " + move.name() + ": needs a name and at least one damage die");
        }
        if (action.targetIds().isEmpty()) {
            return reject(actor, "Attack needs at least one target");
        }

        List<ActionResult> results = new ArrayList<>();
        for (String targetId : action.targetIds()) {
            results.add(attackTarget(state, actor, move, targetId));
        }

        CreatureCombatant creature = actor.getCreature();
        creature.recordMoveUsed(move.name());
        actor.setHasActed(true);

        String summary = results.stream().map(ActionResult::summarize).collect(Collectors.joining("; "));
        state.logEvent(actor.getId(), "Attack: " + move.name(), action.targetIds(), summary, clock.instant());
        return results;
    }

    private ActionResult attackTarget(BattleState state, Participant actor, MoveData move, String targetId) {
        if (targetId == null) {
            return ActionResult.notFound(actor.getId(), null, "Target id is missing");
        }
        Participant target = state.findParticipant(targetId);
        if (target == null) {
            return ActionResult.notFound(actor.getId(), targetId, "Target not found: " + targetId);
        }
        if (!target.isCreature()) {
            return ActionResult.invalidTarget(actor.getId(), target.getId(), target.getName() + " cannot be attacked");
        }
        if (target.isDefeated()) {
            return ActionResult.invalidTarget(actor.getId(), target.getId(), target.getName() + " is already defeated");
        }

        int attackStat = calculator.attackStat(actor, move.special());
        int defenseValue = calculator.defenseValue(target, move.special());
        int hitRoll = random.roll(DamageCalculator.HIT_DIE);

        if (!calculator.isHit(hitRoll, attackStat, defenseValue)) {
            logger.debug("[ActionResolver] {} missed {} ({} + {} < {})", actor.getId(), target.getId(),
                hitRoll, attackStat, defenseValue);
            return ActionResult.miss(actor.getId(), target.getId())
                .setHitRoll(hitRoll)
                .setAttackTotal(hitRoll + attackStat)
                .setDefenseValue(defenseValue);
        }

        // Damage dice
        int totalDice = move.numDamageDice() + calculator.bonusDice(attackStat);
        List<Integer> rolls = new ArrayList<>(totalDice);
        int diceTotal = 0;
        for (int i = 0; i < totalDice; i++) {
            int roll = random.roll(DamageCalculator.DAMAGE_DIE);
            rolls.add(roll);
            diceTotal += roll;
        }

        CreatureCombatant defender = target.getCreature();
        double multiplier = typeChart.effectiveness(move.type(), defender.getPrimaryType(), defender.getSecondaryType());
        boolean critical = calculator.isCritical(hitRoll);
        int damage = calculator.finalDamage(diceTotal, multiplier, critical);

        ActionResult result;
        if (multiplier == 0.0) {
            result = ActionResult.noEffect(actor.getId(), target.getId());
        } else if (critical) {
            result = ActionResult.criticalHit(actor.getId(), target.getId(), damage);
        } else {
            result = ActionResult.hit(actor.getId(), target.getId(), damage);
        }
        result.setHitRoll(hitRoll)
            .setAttackTotal(hitRoll + attackStat)
            .setDefenseValue(defenseValue)
            .setDamageRolls(rolls)
            .setRawDamage(diceTotal)
            .setEffectiveness(multiplier)
            .setEffectivenessLabel(TypeChart.describe(multiplier));

        if (damage > 0) {
            boolean defeatedNow = target.takeDamage(damage);
            if (defeatedNow) {
                result.setDefeated(true).addNote(target.getName() + " was defeated");
            }
        }
        result.setRemainingVigor(defender.getCurrentVigor());

        logger.debug("[ActionResolver] {} -> {} with {}: roll {} dice {} x{}{} = {} (vigor {})",
            actor.getId(), target.getId(), move.name(), hitRoll, rolls, multiplier,
            critical ? " crit" : "", damage, defender.getCurrentVigor());
        return result;
    }

    // Switch, Item, Escape

    private List<ActionResult> resolvePlaceholder(BattleState state, Participant actor, BattleAction action) {
        ActionKind kind = action.kind();
        boolean success = true;
        String message;
        switch (kind) {
            case SWITCH:
                message = actor.getName() + " switches out";
                break;
            case ITEM:
                message = actor.getName() + " uses an item";
                break;
            case ESCAPE:
                if (actor.isHandler() && !actor.getHandler().canEscape()) {
                    success = false;
                    message = actor.getName() + " cannot escape";
                } else {
                    message = actor.getName() + " attempts to escape";
                }
                break;
            default:
                throw new IllegalArgumentException("Not a placeholder action: " + kind);
        }

        actor.setHasActed(true);
        ActionResult result = ActionResult.placeholder(kind, actor.getId(), success, message);
        state.logEvent(actor.getId(), kind.getLabel(), action.targetIds(), message, clock.instant());
        logger.debug("[ActionResolver] {}", message);
        return List.of(result);
    }
}
