package com.example.battlecore;

import com.example.battlecore.combat.ActionResult;
import com.example.battlecore.combat.ActionResult.ResultType;
import com.example.battlecore.combat.BattleAction;
import com.example.battlecore.combat.BattleEngine;
import com.example.battlecore.combat.BattleLogEntry;
import com.example.battlecore.combat.BattleNarrationSink;
import com.example.battlecore.combat.BattleNotFoundException;
import com.example.battlecore.combat.BattlePhase;
import com.example.battlecore.combat.BattleState;
import com.example.battlecore.combat.BattleStateConflictException;
import com.example.battlecore.combat.BattleValidationException;
import com.example.battlecore.combat.BattlefieldSummary;
import com.example.battlecore.combat.MoveData;
import com.example.battlecore.combat.ParticipantStatus;
import com.example.battlecore.combat.PhaseChange;
import com.example.battlecore.combat.TurnOrderView;
import com.example.battlecore.combat.TypeChart;
import com.example.battlecore.combat.VictoryResult;
import com.example.battlecore.combat.VigorChange;
import com.example.battlecore.effect.StatusCategory;
import com.example.battlecore.effect.StatusEffect;
import com.example.battlecore.model.BattleKind;
import com.example.battlecore.model.ElementType;
import com.example.battlecore.model.HandlerCombatant;
import com.example.battlecore.model.Participant;
import com.example.battlecore.model.RelationshipType;
import com.example.battlecore.model.VictoryCondition;
import com.example.battlecore.persistence.InMemoryBattleStateStore;
import com.example.battlecore.ruleset.YamlMoveCatalog;
import com.example.battlecore.util.BattleConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the engine's public operations, end to end against the in-memory store.
 */
public class BattleEngineTest {

    private static TypeChart chart;

    private InMemoryBattleStateStore store;
    private ScriptedRandomSource random;
    private BattleEngine engine;

    private Participant pika;
    private Participant rat;

    @BeforeAll
    static void loadChart() {
        chart = TypeChart.standard();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryBattleStateStore();
        random = new ScriptedRandomSource();
        engine = new BattleEngine(store, random, BattleConfig.defaults(), chart,
            YamlMoveCatalog.load(YamlMoveCatalog.DEFAULT_RESOURCE), BattleFixtures.CLOCK);
        pika = BattleFixtures.creature("pika", "Player", BattleFixtures.stats(3, 0), ElementType.ELECTRIC, 40);
        rat = BattleFixtures.creature("rat", "Wild", 30);
    }

    private BattleState startWild() {
        random.then(12, 8);
        return engine.startBattle(BattleKind.WILD, List.of(pika, rat), null, null);
    }

    // === Starting and ending ===

    @Test
    void testStartBattle_initialState() {
        BattleState state = startWild();

        assertTrue(engine.hasActiveBattle());
        assertSame(state, store.load());
        assertEquals(1, state.getCurrentTurn());
        assertEquals(BattlePhase.INITIALIZE, state.getCurrentPhase());
        assertEquals(List.of("pika", "rat"), state.getTurnOrder());
        assertEquals("pika", state.getCurrentActorId());
        assertEquals("Standard Field", state.getBattlefield().getName());
        assertEquals("Clear", state.getWeather().getName());
        assertEquals(BattleFixtures.NOW, state.getStartedAt());
    }

    @Test
    void testStartBattle_relationshipsFromFactions() {
        Participant buddy = BattleFixtures.creature("buddy", "Player", 20);
        random.then(1, 2, 3);
        engine.startBattle(BattleKind.WILD, List.of(pika, rat, buddy), "Tall Grass", "Rain");

        assertEquals(RelationshipType.HOSTILE, pika.getRelationship("rat"));
        assertEquals(RelationshipType.HOSTILE, rat.getRelationship("pika"));
        assertEquals(RelationshipType.ALLIED, pika.getRelationship("buddy"));
        assertEquals(RelationshipType.ALLIED, buddy.getRelationship("pika"));
        assertNull(pika.getRelationship("pika"));
    }

    @Test
    void testStartBattle_defaultConditionsByKind() {
        BattleState state = startWild();
        List<VictoryCondition> conditions = state.getVictoryConditions();
        assertEquals(2, conditions.size());
        assertEquals("Player", conditions.get(0).getFaction());

        assertEquals(2, BattleEngine.defaultVictoryConditions(BattleKind.TRAINER).size());
        assertEquals("Enemy", BattleEngine.defaultVictoryConditions(BattleKind.TRAINER).get(1).getFaction());
        assertEquals(1, BattleEngine.defaultVictoryConditions(BattleKind.GYM).size());
    }

    @Test
    void testStartBattle_explicitConditionsReplaceDefaults() {
        random.then(12, 8);
        BattleState state = engine.startBattle(BattleKind.WILD, List.of(pika, rat), "Cave", "Clear",
            List.of(VictoryCondition.survival("Player", 5)));

        assertEquals(1, state.getVictoryConditions().size());
        assertEquals(Integer.valueOf(5), state.getVictoryConditions().get(0).getInt(VictoryCondition.PARAM_TURNS));
    }

    @Test
    void testStartBattle_logsStart() {
        startWild();

        List<BattleLogEntry> log = engine.getLog(0, null);
        assertEquals(1, log.size());
        assertEquals(BattleEngine.BATTLE_STARTED, log.get(0).action());
        assertEquals(List.of("pika", "rat"), log.get(0).targetIds());
    }

    @Test
    @DisplayName("Starting a second battle fails and leaves the first untouched")
    void testStartBattle_alreadyActive() {
        BattleState first = startWild();
        Participant other = BattleFixtures.creature("other", "Player", 10);

        assertThrows(BattleStateConflictException.class,
            () -> engine.startBattle(BattleKind.TRAINER, List.of(other), null, null));

        assertSame(first, store.load());
        assertEquals(2, first.getParticipants().size());
        assertEquals(1, first.getLog().size());
        assertEquals(BattleKind.WILD, first.getKind());
    }

    @Test
    void testStartBattle_rejectsBadInput() {
        assertThrows(BattleValidationException.class,
            () -> engine.startBattle("picnic", List.of(pika, rat), null, null));
        assertThrows(BattleValidationException.class,
            () -> engine.startBattle(BattleKind.WILD, List.of(), null, null));
        assertThrows(BattleValidationException.class,
            () -> engine.startBattle(BattleKind.WILD, null, null, null));
        Participant dup = BattleFixtures.creature("PIKA", "Wild", 10);
        assertThrows(BattleValidationException.class,
            () -> engine.startBattle(BattleKind.WILD, List.of(pika, dup), null, null));

        assertFalse(engine.hasActiveBattle());
        assertEquals(0, random.drawsUsed());
    }

    @Test
    void testStartBattle_kindLabel() {
        random.then(12, 8);
        BattleState state = engine.startBattle("trainer", List.of(pika, rat), null, null);
        assertEquals(BattleKind.TRAINER, state.getKind());
    }

    @Test
    void testEndBattle() {
        startWild();

        BattleState ended = engine.endBattle("Wild creature fled");

        assertFalse(ended.isActive());
        assertEquals(BattlePhase.BATTLE_END, ended.getCurrentPhase());
        assertEquals("Wild creature fled", ended.getLog().last().result());
        assertFalse(engine.hasActiveBattle());
        assertNull(store.load());
        assertThrows(BattleStateConflictException.class, () -> engine.getBattleState());
        assertThrows(BattleStateConflictException.class, () -> engine.endBattle("again"));
    }

    @Test
    void testOperationsNeedActiveBattle() {
        assertThrows(BattleStateConflictException.class, () -> engine.advancePhase());
        assertThrows(BattleStateConflictException.class, () -> engine.evaluateVictory());
        assertThrows(BattleStateConflictException.class, () -> engine.addParticipant(pika));
        assertThrows(BattleStateConflictException.class, () -> engine.getLog(0, null));
    }

    // === Roster changes ===

    @Test
    void testAddThenRemoveRestoresRoster() {
        BattleState state = startWild();
        List<String> orderBefore = new ArrayList<>(state.getTurnOrder());
        List<Participant> rosterBefore = new ArrayList<>(state.getParticipants());

        Participant crow = BattleFixtures.creature("crow", "Wild", 25);
        // pika 12, rat 8; crow lands in the middle
        random.then(10);
        engine.addParticipant(crow);
        assertEquals(List.of("pika", "crow", "rat"), state.getTurnOrder());
        assertEquals(RelationshipType.HOSTILE, pika.getRelationship("crow"));
        assertEquals(RelationshipType.ALLIED, rat.getRelationship("crow"));

        engine.removeParticipant("crow");

        assertEquals(orderBefore, state.getTurnOrder());
        assertEquals(rosterBefore, state.getParticipants());
        assertNull(pika.getRelationship("crow"));
        assertNull(rat.getRelationship("crow"));
    }

    @Test
    @DisplayName("Joining rolls only the newcomer; leaving restores the earlier order")
    void testAddThenRemove_keepsExistingInitiatives() {
        BattleState state = startWild();
        int pikaBefore = pika.getInitiative();
        int ratBefore = rat.getInitiative();

        // Rerolling pika and rat with 15 and 10 would put rat first; only crow's 5 is drawn
        random.then(5, 15, 10);
        engine.addParticipant(BattleFixtures.creature("crow", "Wild", 25));

        assertEquals(List.of("pika", "rat", "crow"), state.getTurnOrder());
        assertEquals(3, random.drawsUsed());
        assertEquals(2, random.remaining());
        assertEquals(pikaBefore, pika.getInitiative());
        assertEquals(ratBefore, rat.getInitiative());

        engine.removeParticipant("crow");

        assertEquals(List.of("pika", "rat"), state.getTurnOrder());
        assertEquals("pika", state.getCurrentActorId());
        assertEquals(3, random.drawsUsed());
    }

    @Test
    void testTurnOrderMatchesRoster() {
        BattleState state = startWild();
        random.then(3);
        engine.addParticipant(BattleFixtures.handler("ash", "Player", true));
        engine.removeParticipant("PIKA");

        List<String> ids = new ArrayList<>();
        for (Participant p : state.getParticipants()) {
            ids.add(p.getId());
        }
        assertEquals(ids.size(), state.getTurnOrder().size());
        assertTrue(state.getTurnOrder().containsAll(ids));
        assertTrue(state.getTurnOrder().contains(state.getCurrentActorId()));
    }

    @Test
    void testRosterErrors() {
        startWild();
        assertThrows(BattleValidationException.class,
            () -> engine.addParticipant(BattleFixtures.creature("Rat", "Wild", 5)));
        assertThrows(BattleValidationException.class, () -> engine.addParticipant(null));
        assertThrows(BattleNotFoundException.class, () -> engine.removeParticipant("nobody"));
    }

    // === Vigor ===

    @Test
    void testUpdateVigor_clampsAndDefeats() {
        startWild();

        VigorChange up = engine.updateVigor("rat", 500, "Potion");
        assertEquals(30, up.oldVigor());
        assertEquals(30, up.newVigor());
        assertFalse(up.defeated());

        VigorChange down = engine.updateVigor("rat", -5, "Crushed");
        assertEquals(0, down.newVigor());
        assertEquals(-30, down.change());
        assertTrue(down.defeated());
        assertTrue(rat.isDefeated());
        assertEquals(BattleEngine.CREATURE_DEFEATED, engine.getLog(1, null).get(0).action());
    }

    @Test
    void testUpdateVigor_defeatIsPermanent() {
        startWild();
        engine.updateVigor("rat", 0, "");

        VigorChange revived = engine.updateVigor("rat", 10, "Revive");

        assertEquals(10, revived.newVigor());
        assertTrue(revived.defeated());
        assertTrue(rat.isDefeated());
    }

    @Test
    void testUpdateVigor_errors() {
        random.then(1, 2, 3);
        engine.startBattle(BattleKind.TRAINER, List.of(pika, rat, BattleFixtures.handler("ash", "Player", true)),
            null, null);

        assertThrows(BattleNotFoundException.class, () -> engine.updateVigor("nobody", 5, ""));
        assertThrows(BattleValidationException.class, () -> engine.updateVigor("ash", 5, ""));
    }

    @Test
    void testMarkDefeated_handler() {
        random.then(1, 2, 3);
        engine.startBattle(BattleKind.TRAINER, List.of(pika, rat, BattleFixtures.handler("ash", "Player", true)),
            null, null);

        assertTrue(engine.markDefeated("ash", "Out of creatures"));
        assertFalse(engine.markDefeated("ash", "again"));
        assertTrue(engine.getParticipantStatus("ash").defeated());
    }

    // === Status effects and relationships ===

    @Test
    void testStatusEffects() {
        startWild();

        engine.applyStatusEffect("rat", StatusEffect.forTurns("Paralyzed", StatusCategory.AILMENT, 3));
        engine.applyStatusEffect("rat", StatusEffect.forTurns("paralyzed", StatusCategory.AILMENT, 5));

        ParticipantStatus status = engine.getParticipantStatus("rat");
        assertEquals(1, status.statusEffects().size());
        assertEquals(Integer.valueOf(5), status.statusEffects().get(0).remainingTurns());

        assertTrue(engine.removeStatusEffect("rat", "PARALYZED"));
        assertFalse(engine.removeStatusEffect("rat", "Paralyzed"));
        assertThrows(BattleNotFoundException.class,
            () -> engine.applyStatusEffect("nobody", StatusEffect.indefinite("Burned", StatusCategory.AILMENT)));
        assertThrows(BattleValidationException.class, () -> engine.applyStatusEffect("rat", null));
    }

    @Test
    void testSetRelationshipIsOneWay() {
        startWild();

        engine.setRelationship("pika", "rat", RelationshipType.NEUTRAL);

        assertEquals(RelationshipType.NEUTRAL, pika.getRelationship("rat"));
        assertEquals(RelationshipType.HOSTILE, rat.getRelationship("pika"));
    }

    // === Actions, phases, victory ===

    @Test
    void testResolveAction_throughEngine() {
        startWild();
        List<BattleLogEntry> narrated = new ArrayList<>();
        List<ActionResult> narratedResults = new ArrayList<>();
        engine.setNarrationSink(new BattleNarrationSink() {
            @Override
            public void onLogEntry(BattleLogEntry entry) {
                narrated.add(entry);
            }

            @Override
            public void onActionResolved(BattleAction action, List<ActionResult> results) {
                narratedResults.addAll(results);
            }
        });
        // Power 3: 2 dice + 1 bonus die
        random.then(15, 6, 6, 6);

        List<ActionResult> results = engine.resolveAction(BattleAction.attack("pika", List.of("rat"), "Tackle"));

        assertEquals(ResultType.HIT, results.get(0).getType());
        assertEquals(12, rat.getCreature().getCurrentVigor());
        assertEquals(1, narrated.size());
        assertEquals("pika", narrated.get(0).actorId());
        assertEquals(results, narratedResults);
    }

    @Test
    void testResolveAction_unknownKindLabel() {
        startWild();

        List<ActionResult> results = engine.resolveAction("pika", "dance", List.of("rat"), null);

        assertEquals(1, results.size());
        assertEquals(ResultType.VALIDATION_ERROR, results.get(0).getType());
        assertEquals(1, engine.getLog(0, null).size());
    }

    @Test
    void testResolveAction_kindLabel() {
        startWild();
        random.then(2);

        List<ActionResult> results = engine.resolveAction("pika", "attack", List.of("rat"),
            new MoveData("Thunder Shock", ElementType.ELECTRIC, 2, true));

        assertEquals(ResultType.MISS, results.get(0).getType());
    }

    @Test
    void testResolveAction_nullTargetIdIsNotFound() {
        startWild();
        random.then(15, 6, 6, 6);

        List<ActionResult> results = engine.resolveAction("pika", "attack", Arrays.asList("rat", null),
            new MoveData("Tackle", ElementType.NORMAL, 2, false));

        assertEquals(2, results.size());
        assertEquals(ResultType.HIT, results.get(0).getType());
        assertEquals(ResultType.NOT_FOUND, results.get(1).getType());
        assertNull(results.get(1).getTargetId());
        assertEquals(12, rat.getCreature().getCurrentVigor());

        BattleLogEntry entry = engine.getLog(1, null).get(0);
        assertEquals(List.of("rat"), entry.targetIds());
    }

    @Test
    void testResolveAction_placeholderWithNullTarget() {
        startWild();

        List<ActionResult> results = engine.resolveAction("pika", "switch", Arrays.asList(null, "rat"), null);

        assertEquals(ResultType.SWITCH, results.get(0).getType());
        assertEquals(List.of("rat"), engine.getLog(1, null).get(0).targetIds());
    }

    @Test
    void testAdvancePhase() {
        startWild();

        PhaseChange change = engine.advancePhase();

        assertEquals(2, change.currentTurn());
        assertEquals(BattlePhase.SELECT_ACTION, change.currentPhase());
    }

    @Test
    void testEffectHandlerInvokedOnApplyEffects() {
        startWild();
        List<Integer> turns = new ArrayList<>();
        engine.addPhaseEffectHandler(s -> turns.add(s.getCurrentTurn()));

        engine.advancePhase();
        engine.advancePhase();
        engine.advancePhase();

        assertEquals(List.of(2), turns);
    }

    @Test
    void testFailingEffectHandlerStillSavesPhase() {
        List<BattlePhase> saved = new ArrayList<>();
        InMemoryBattleStateStore countingStore = new InMemoryBattleStateStore() {
            @Override
            public synchronized void save(BattleState state) {
                super.save(state);
                saved.add(state.getCurrentPhase());
            }
        };
        BattleEngine failing = new BattleEngine(countingStore, random, BattleConfig.defaults(), chart,
            YamlMoveCatalog.load(YamlMoveCatalog.DEFAULT_RESOURCE), BattleFixtures.CLOCK);
        failing.addPhaseEffectHandler(s -> {
            throw new IllegalStateException("Hazard table missing");
        });
        random.then(12, 8);
        failing.startBattle(BattleKind.WILD, List.of(pika, rat), null, null);
        failing.advancePhase();
        failing.advancePhase();

        assertThrows(IllegalStateException.class, failing::advancePhase);

        assertEquals(BattlePhase.APPLY_EFFECTS, saved.get(saved.size() - 1));
        assertEquals(BattlePhase.APPLY_EFFECTS, failing.getBattleState().getCurrentPhase());
        assertEquals("Battle phase changed to ApplyEffects", failing.getLog(1, null).get(0).result());
    }

    @Test
    void testEvaluateVictory() {
        startWild();
        assertFalse(engine.evaluateVictory().isMet());

        engine.updateVigor("rat", 0, "Fainted");
        VictoryResult result = engine.evaluateVictory();

        assertTrue(result.isMet());
        assertEquals("Player", result.getWinningFaction());
    }

    // === Queries ===

    @Test
    void testGetLog_defaultCountAndFilter() {
        startWild();
        for (int i = 0; i < 12; i++) {
            engine.advancePhase();
        }

        assertEquals(10, engine.getLog().size());
        assertEquals(13, engine.getLog(0, "").size());
        assertEquals(13, engine.getLog(0, "system").size());
        assertTrue(engine.getLog(0, "pika").isEmpty());
    }

    @Test
    void testParticipantStatus() {
        random.then(1, 2, 3);
        engine.startBattle(BattleKind.TRAINER,
            List.of(pika, rat, Participant.handler("ash", "Ash", "Player",
                new HandlerCombatant("Ash", null, List.of("bulba"), true))),
            null, null);
        engine.updateVigor("pika", 10, "");

        ParticipantStatus creature = engine.getParticipantStatus("PIKA");
        assertEquals(Integer.valueOf(10), creature.currentVigor());
        assertEquals(Integer.valueOf(40), creature.maxVigor());
        assertEquals(Integer.valueOf(25), creature.vigorPercent());
        assertNull(creature.canEscape());

        ParticipantStatus handler = engine.getParticipantStatus("ash");
        assertNull(handler.currentVigor());
        assertTrue(handler.canEscape());
        assertEquals(List.of("bulba"), handler.remainingTeam());

        assertThrows(BattleNotFoundException.class, () -> engine.getParticipantStatus("nobody"));
    }

    @Test
    void testTurnOrderView() {
        startWild();
        random.then(15, 6, 6, 6);
        engine.resolveAction(BattleAction.attack("pika", List.of("rat"), "Tackle"));

        TurnOrderView view = engine.getTurnOrder();

        assertEquals(List.of("pika", "rat"), view.ids());
        assertEquals("pika", view.currentActorId());
        assertTrue(view.order().get(0).hasActed());
        assertFalse(view.order().get(1).hasActed());
    }

    @Test
    void testBattlefieldSummary() {
        random.then(12, 8);
        engine.startBattle(BattleKind.WILD, List.of(pika, rat), "Viridian Forest", "Rain");
        engine.updateVigor("rat", 0, "");
        engine.advancePhase();

        BattlefieldSummary summary = engine.getBattlefieldSummary();

        assertEquals(BattleKind.WILD, summary.kind());
        assertEquals(2, summary.totalParticipants());
        assertEquals(1, summary.activeParticipants());
        assertEquals(1, summary.defeatedParticipants());
        assertEquals("Viridian Forest", summary.battlefield());
        assertEquals("Rain", summary.weather());
        assertTrue(summary.factions().contains("Wild"));
        assertEquals(3, summary.recentEvents().size());
        assertEquals(0, summary.hazardCount());
    }
}
