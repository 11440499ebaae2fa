package com.example.battlecore.combat;

import com.example.battlecore.effect.PhaseEffectHandler;
import com.example.battlecore.effect.StatusEffect;
import com.example.battlecore.model.BattleKind;
import com.example.battlecore.model.Battlefield;
import com.example.battlecore.model.Participant;
import com.example.battlecore.model.RelationshipType;
import com.example.battlecore.model.VictoryCondition;
import com.example.battlecore.model.Weather;
import com.example.battlecore.persistence.BattleStateStore;
import com.example.battlecore.ruleset.MoveCatalog;
import com.example.battlecore.ruleset.YamlMoveCatalog;
import com.example.battlecore.util.BattleConfig;
import com.example.battlecore.util.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entry point for running one battle at a time.
 *
 * Every operation loads the current battle from the {@link BattleStateStore}, validates its
 * input before touching anything, mutates the state in place and saves it again. Callers
 * must serialize operations; the engine does no locking of its own.
 */
public class BattleEngine {

    private static final Logger logger = LoggerFactory.getLogger(BattleEngine.class);

    public static final String PLAYER_FACTION = "Player";
    public static final String ENEMY_FACTION = "Enemy";

    // Log action labels
    public static final String BATTLE_STARTED = "Battle Started";
    public static final String PARTICIPANT_ADDED = "Participant Added";
    public static final String PARTICIPANT_REMOVED = "Participant Removed";
    public static final String VIGOR_UPDATED = "Vigor Updated";
    public static final String CREATURE_DEFEATED = "Creature Defeated";
    public static final String PARTICIPANT_DEFEATED = "Participant Defeated";
    public static final String STATUS_APPLIED = "Status Effect Applied";
    public static final String STATUS_REMOVED = "Status Effect Removed";
    public static final String RELATIONSHIP_CHANGED = "Relationship Changed";

    private final BattleStateStore store;
    private final BattleConfig config;
    private final Clock clock;
    private final InitiativeCalculator initiative;
    private final ActionResolver resolver;
    private final PhaseStateMachine phases;
    private final VictoryEvaluator victory;

    private BattleNarrationSink narrationSink = BattleNarrationSink.NONE;

    public BattleEngine(BattleStateStore store, RandomSource random) {
        this(store, random, BattleConfig.load());
    }

    public BattleEngine(BattleStateStore store, RandomSource random, BattleConfig config) {
        this(store, random, config, TypeChart.load(config.getTypeChartResource()),
            YamlMoveCatalog.load(config.getMovesResource()), Clock.systemUTC());
    }

    public BattleEngine(BattleStateStore store, RandomSource random, BattleConfig config,
                        TypeChart typeChart, MoveCatalog moveCatalog, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.initiative = new InitiativeCalculator(random);
        this.resolver = new ActionResolver(typeChart, new DamageCalculator(config.getCriticalMultiplier()),
            random, moveCatalog, clock);
        this.phases = new PhaseStateMachine(clock);
        this.victory = new VictoryEvaluator(clock);
    }

    /**
     * Set the sink that receives log entries and action results.
     */
    public void setNarrationSink(BattleNarrationSink sink) {
        this.narrationSink = sink == null ? BattleNarrationSink.NONE : sink;
    }

    /**
     * Register a handler run on every entry into ApplyEffects.
     */
    public void addPhaseEffectHandler(PhaseEffectHandler handler) {
        phases.addEffectHandler(handler);
    }

    // Lifecycle

    public boolean hasActiveBattle() {
        return store.hasActiveBattle();
    }

    /**
     * Start a battle with the default victory conditions for its kind.
     */
    public BattleState startBattle(BattleKind kind, List<Participant> participants,
                                   String battlefieldName, String weather) {
        return startBattle(kind, participants, battlefieldName, weather, null);
    }

    /**
     * Start a battle from a kind label ("wild", "Trainer", ...).
     * @throws BattleValidationException if the label names no battle kind
     */
    public BattleState startBattle(String kind, List<Participant> participants,
                                   String battlefieldName, String weather) {
        BattleKind parsed = BattleKind.fromKey(kind);
        if (parsed == null) {
            throw new BattleValidationException("Invalid battle kind: " + kind);
        }
        return startBattle(parsed, participants, battlefieldName, weather, null);
    }

    /**
     * Start a battle.
     * @param victoryConditions conditions to use instead of the defaults for the kind; null or empty keeps the defaults
     * @throws BattleStateConflictException if a battle is already active
     * @throws BattleValidationException if the kind is missing, there are no participants or ids repeat
     */
    public BattleState startBattle(BattleKind kind, List<Participant> participants, String battlefieldName,
                                   String weather, List<VictoryCondition> victoryConditions) {
        if (store.hasActiveBattle()) {
            logger.warn("[BattleEngine] Refusing to start a battle while one is active");
            throw BattleStateConflictException.alreadyActive();
        }
        if (kind == null) {
            throw new BattleValidationException("Battle kind is required");
        }
        if (participants == null || participants.isEmpty()) {
            throw new BattleValidationException("A battle needs at least one participant");
        }
        Set<String> ids = new HashSet<>();
        for (Participant p : participants) {
            if (p == null) {
                throw new BattleValidationException("Participant list contains null");
            }
            if (!ids.add(p.getId().toLowerCase(Locale.ROOT))) {
                throw new BattleValidationException("Duplicate participant id: " + p.getId());
            }
        }

        String fieldName = isBlank(battlefieldName) ? config.getDefaultBattlefield() : battlefieldName;
        String weatherName = isBlank(weather) ? config.getDefaultWeather() : weather;
        BattleState state = new BattleState(kind, new Battlefield(fieldName), new Weather(weatherName), clock.instant());

        for (Participant p : participants) {
            state.addParticipant(p);
        }
        for (Participant p : participants) {
            for (Participant other : participants) {
                if (p != other) {
                    p.setRelationship(other.getId(), initialRelationship(p, other));
                }
            }
        }
        state.setVictoryConditions(victoryConditions == null || victoryConditions.isEmpty()
            ? defaultVictoryConditions(kind) : victoryConditions);
        initiative.recompute(state);

        List<String> allIds = new ArrayList<>();
        for (Participant p : participants) {
            allIds.add(p.getId());
        }
        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, BATTLE_STARTED, allIds,
            String.format("%s battle started on %s with %d participants", kind.getDisplayName(), fieldName,
                participants.size()), clock.instant());

        store.save(state);
        publishSince(state, 0);
        logger.info("[BattleEngine] Started {} battle with {} participants, turn order {}",
            kind.getDisplayName(), participants.size(), state.getTurnOrder());
        return state;
    }

    /**
     * Default conditions: wild battles are won by the player defeating the enemy or escaping,
     * trainer battles can be won by either side, everything else by the player.
     */
    public static List<VictoryCondition> defaultVictoryConditions(BattleKind kind) {
        List<VictoryCondition> conditions = new ArrayList<>();
        switch (kind) {
            case WILD:
                conditions.add(VictoryCondition.defeatAllEnemies(PLAYER_FACTION, "Defeat the wild creatures"));
                conditions.add(VictoryCondition.escape(PLAYER_FACTION, "Escape from battle"));
                break;
            case TRAINER:
                conditions.add(VictoryCondition.defeatAllEnemies(PLAYER_FACTION, "Defeat all enemy creatures"));
                conditions.add(VictoryCondition.defeatAllEnemies(ENEMY_FACTION, "Enemy defeats all player creatures"));
                break;
            default:
                conditions.add(VictoryCondition.defeatAllEnemies(PLAYER_FACTION, "Defeat all enemy creatures"));
                break;
        }
        return conditions;
    }

    /**
     * End the current battle. The returned state is the final one, already cleared from the store.
     * @throws BattleStateConflictException if no battle is active
     */
    public BattleState endBattle(String reason) {
        BattleState state = requireActive();
        int before = state.getLog().size();
        String why = isBlank(reason) ? "Battle concluded" : reason;
        phases.finish(state, why);
        store.save(state);
        store.clear();
        publishSince(state, before);
        logger.info("[BattleEngine] Battle ended on turn {}: {}", state.getCurrentTurn(), why);
        return state;
    }

    // Roster

    /**
     * Add a participant mid-battle. Relationships to everyone present are initialised,
     * the newcomer rolls initiative and the turn order is rebuilt.
     */
    public void addParticipant(Participant participant) {
        BattleState state = requireActive();
        if (participant == null) {
            throw new BattleValidationException("Participant is required");
        }
        if (state.hasParticipant(participant.getId())) {
            throw new BattleValidationException("Duplicate participant id: " + participant.getId());
        }
        int before = state.getLog().size();

        for (Participant other : state.getParticipants()) {
            participant.setRelationship(other.getId(), initialRelationship(participant, other));
            other.setRelationship(participant.getId(), initialRelationship(other, participant));
        }
        state.addParticipant(participant);
        initiative.admit(state, participant);

        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, PARTICIPANT_ADDED, List.of(participant.getId()),
            participant.getName() + " joined the battle", clock.instant());
        store.save(state);
        publishSince(state, before);
        logger.info("[BattleEngine] {} joined, turn order {}", participant.getId(), state.getTurnOrder());
    }

    /**
     * Remove a participant. Its id disappears from every relationship map and the turn order
     * is rebuilt from the remaining initiatives.
     * @throws BattleNotFoundException if no participant has that id
     */
    public void removeParticipant(String participantId) {
        BattleState state = requireActive();
        Participant removed = state.removeParticipant(participantId);
        if (removed == null) {
            throw new BattleNotFoundException(participantId);
        }
        int before = state.getLog().size();
        for (Participant other : state.getParticipants()) {
            other.removeRelationship(removed.getId());
        }
        initiative.reorder(state);

        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, PARTICIPANT_REMOVED, List.of(removed.getId()),
            removed.getName() + " left the battle", clock.instant());
        store.save(state);
        publishSince(state, before);
        logger.info("[BattleEngine] {} left, turn order {}", removed.getId(), state.getTurnOrder());
    }

    // Vigor, defeat, status

    /**
     * Set a creature's vigor directly. The value is clamped to [0, maxVigor]; reaching 0 defeats it.
     * @throws BattleNotFoundException if the id is unknown
     * @throws BattleValidationException if the participant is a handler
     */
    public VigorChange updateVigor(String participantId, int newVigor, String reason) {
        BattleState state = requireActive();
        Participant p = requireParticipant(state, participantId);
        if (!p.isCreature()) {
            throw new BattleValidationException(p.getId() + " is a handler and has no vigor");
        }
        int before = state.getLog().size();
        int oldVigor = p.getCreature().getCurrentVigor();
        boolean defeatedNow = p.setVigor(newVigor);
        int stored = p.getCreature().getCurrentVigor();

        String why = reason == null ? "" : reason;
        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, VIGOR_UPDATED, List.of(p.getId()),
            String.format("%s vigor %d -> %d%s", p.getName(), oldVigor, stored, why.isEmpty() ? "" : " (" + why + ")"),
            clock.instant());
        if (defeatedNow) {
            state.logEvent(BattleLogEntry.SYSTEM_ACTOR, CREATURE_DEFEATED, List.of(p.getId()),
                p.getName() + " was defeated", clock.instant());
        }
        store.save(state);
        publishSince(state, before);
        logger.debug("[BattleEngine] Vigor of {}: {} -> {}", p.getId(), oldVigor, stored);
        return new VigorChange(p.getId(), oldVigor, stored, p.isDefeated(), why);
    }

    /**
     * Defeat a participant outright (handlers have no vigor to run out of).
     * @return true if the participant was not already defeated
     */
    public boolean markDefeated(String participantId, String reason) {
        BattleState state = requireActive();
        Participant p = requireParticipant(state, participantId);
        if (!p.markDefeated()) {
            return false;
        }
        int before = state.getLog().size();
        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, PARTICIPANT_DEFEATED, List.of(p.getId()),
            p.getName() + " was defeated" + (isBlank(reason) ? "" : " (" + reason + ")"), clock.instant());
        store.save(state);
        publishSince(state, before);
        logger.info("[BattleEngine] {} marked defeated", p.getId());
        return true;
    }

    /**
     * Apply a status effect to a creature, replacing any effect with the same name.
     */
    public void applyStatusEffect(String targetId, StatusEffect effect) {
        BattleState state = requireActive();
        if (effect == null) {
            throw new BattleValidationException("Status effect is required");
        }
        Participant p = requireParticipant(state, targetId);
        if (!p.isCreature()) {
            throw new BattleValidationException(p.getId() + " is a handler and cannot carry status effects");
        }
        int before = state.getLog().size();
        p.getCreature().putStatusEffect(effect);
        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, STATUS_APPLIED, List.of(p.getId()),
            p.getName() + " is now " + effect.name(), clock.instant());
        store.save(state);
        publishSince(state, before);
    }

    /**
     * @return true if the creature had an effect with that name
     */
    public boolean removeStatusEffect(String targetId, String effectName) {
        BattleState state = requireActive();
        Participant p = requireParticipant(state, targetId);
        if (!p.isCreature()) {
            throw new BattleValidationException(p.getId() + " is a handler and cannot carry status effects");
        }
        if (!p.getCreature().removeStatusEffect(effectName)) {
            return false;
        }
        int before = state.getLog().size();
        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, STATUS_REMOVED, List.of(p.getId()),
            p.getName() + " is no longer " + effectName, clock.instant());
        store.save(state);
        publishSince(state, before);
        return true;
    }

    /**
     * Change how one participant regards another. Only the owner's side changes.
     */
    public void setRelationship(String ownerId, String otherId, RelationshipType type) {
        BattleState state = requireActive();
        if (type == null) {
            throw new BattleValidationException("Relationship type is required");
        }
        Participant owner = requireParticipant(state, ownerId);
        Participant other = requireParticipant(state, otherId);
        int before = state.getLog().size();
        owner.setRelationship(other.getId(), type);
        state.logEvent(BattleLogEntry.SYSTEM_ACTOR, RELATIONSHIP_CHANGED, List.of(owner.getId(), other.getId()),
            owner.getName() + " is now " + type.getDisplayName() + " toward " + other.getName(), clock.instant());
        store.save(state);
        publishSince(state, before);
    }

    // Actions and phases

    public List<ActionResult> resolveAction(BattleAction action) {
        BattleState state = requireActive();
        if (action == null) {
            throw new BattleValidationException("Action is required");
        }
        int before = state.getLog().size();
        List<ActionResult> results = resolver.resolve(state, action);
        if (state.getLog().size() > before) {
            store.save(state);
            publishSince(state, before);
        }
        narrationSink.onActionResolved(action, results);
        return results;
    }

    /**
     * Resolve an action given by label. An unknown label yields a single validation error result.
     */
    public List<ActionResult> resolveAction(String actorId, String kind, List<String> targetIds, MoveData move) {
        ActionKind parsed = ActionKind.fromLabel(kind);
        return resolveAction(new BattleAction(actorId, parsed, targetIds, move == null ? null : move.name(), move));
    }

    /**
     * Move to the next phase. A failing effect handler propagates, but the phase change it
     * interrupted is still saved.
     */
    public PhaseChange advancePhase() {
        BattleState state = requireActive();
        int before = state.getLog().size();
        try {
            phases.advance(state);
        } finally {
            store.save(state);
            publishSince(state, before);
        }
        return new PhaseChange(state.getCurrentTurn(), state.getCurrentPhase());
    }

    public VictoryResult evaluateVictory() {
        return victory.evaluate(requireActive());
    }

    // Queries

    public BattleState getBattleState() {
        return requireActive();
    }

    public ParticipantStatus getParticipantStatus(String participantId) {
        return ParticipantStatus.of(requireParticipant(requireActive(), participantId));
    }

    public TurnOrderView getTurnOrder() {
        return TurnOrderView.of(requireActive());
    }

    public BattlefieldSummary getBattlefieldSummary() {
        return BattlefieldSummary.of(requireActive());
    }

    /**
     * The most recent {@code battle.yaml log.default-count} entries.
     */
    public List<BattleLogEntry> getLog() {
        return getLog(config.getDefaultLogCount(), null);
    }

    /**
     * @param count       trailing entries to return; 0 or less returns all
     * @param actorFilter actor id to keep (case-insensitive); blank keeps everyone
     */
    public List<BattleLogEntry> getLog(int count, String actorFilter) {
        return requireActive().getLog().query(count, actorFilter);
    }

    // Helpers

    private BattleState requireActive() {
        BattleState state = store.load();
        if (state == null || !state.isActive()) {
            throw BattleStateConflictException.noActiveBattle();
        }
        return state;
    }

    private static Participant requireParticipant(BattleState state, String id) {
        Participant p = state.findParticipant(id);
        if (p == null) {
            throw new BattleNotFoundException(id);
        }
        return p;
    }

    private static RelationshipType initialRelationship(Participant owner, Participant other) {
        return owner.isInFaction(other.getFaction()) ? RelationshipType.ALLIED : RelationshipType.HOSTILE;
    }

    private void publishSince(BattleState state, int fromIndex) {
        List<BattleLogEntry> entries = state.getLog().getEntries();
        for (int i = fromIndex; i < entries.size(); i++) {
            narrationSink.onLogEntry(entries.get(i));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
