package com.example.battlecore;

import com.example.battlecore.combat.BattleEngine;
import com.example.battlecore.combat.BattleState;
import com.example.battlecore.combat.ConditionResult;
import com.example.battlecore.combat.VictoryEvaluator;
import com.example.battlecore.combat.VictoryResult;
import com.example.battlecore.model.BattleKind;
import com.example.battlecore.model.Participant;
import com.example.battlecore.model.VictoryCondition;
import com.example.battlecore.model.VictoryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for victory conditions and their aggregation.
 */
public class VictoryEvaluatorTest {

    private BattleState state;
    private VictoryEvaluator evaluator;

    private Participant playerMon;
    private Participant wild1;
    private Participant wild2;

    @BeforeEach
    void setUp() {
        state = new BattleState(BattleKind.WILD, null, null, BattleFixtures.NOW);
        evaluator = new VictoryEvaluator(BattleFixtures.CLOCK);
        playerMon = BattleFixtures.creature("pika", "Player", 30);
        wild1 = BattleFixtures.creature("rat1", "Wild", 20);
        wild2 = BattleFixtures.creature("rat2", "Wild", 20);
        state.addParticipant(playerMon);
        state.addParticipant(wild1);
        state.addParticipant(wild2);
    }

    // === DefeatAllEnemies ===

    @Test
    void testDefeatAllEnemies_needsEveryOpponentDown() {
        VictoryCondition c = VictoryCondition.defeatAllEnemies("Player", "Win");

        wild1.setVigor(0);
        assertFalse(evaluator.evaluate(state, c).met());

        wild2.setVigor(0);
        ConditionResult r = evaluator.evaluate(state, c);
        assertTrue(r.met());
        assertEquals("All enemies of Player defeated", r.reason());
    }

    @Test
    void testDefeatAllEnemies_ignoresOwnSide() {
        VictoryCondition c = VictoryCondition.defeatAllEnemies("Player", "Win");
        // Teammates are never opponents
        Participant ally = BattleFixtures.creature("ally", "Player", 10);
        state.addParticipant(ally);

        wild1.setVigor(0);
        wild2.setVigor(0);

        assertTrue(evaluator.evaluate(state, c).met());
    }

    @Test
    void testDefeatAllEnemies_enemySideCondition() {
        VictoryCondition c = VictoryCondition.defeatAllEnemies("Wild", "Wild wins");

        assertFalse(evaluator.evaluate(state, c).met());
        playerMon.setVigor(0);
        assertTrue(evaluator.evaluate(state, c).met());
    }

    @Test
    void testDefeatAllEnemies_noOpponentsIsNotAWin() {
        BattleState lonely = new BattleState(BattleKind.WILD, null, null, BattleFixtures.NOW);
        lonely.addParticipant(BattleFixtures.creature("solo", "Player", 10));

        ConditionResult r = evaluator.evaluate(lonely, VictoryCondition.defeatAllEnemies("Player", "Win"));
        assertFalse(r.met());
        assertEquals("No opponents of Player in battle", r.reason());
    }

    @Test
    void testDefeatAllEnemies_handlersCountOnceMarkedDefeated() {
        BattleState trainer = new BattleState(BattleKind.TRAINER, null, null, BattleFixtures.NOW);
        Participant mine = BattleFixtures.creature("mine", "Player", 10);
        Participant theirs = BattleFixtures.creature("theirs", "Enemy", 10);
        Participant rival = BattleFixtures.handler("rival", "Enemy", false);
        trainer.addParticipant(mine);
        trainer.addParticipant(theirs);
        trainer.addParticipant(rival);
        VictoryCondition c = VictoryCondition.defeatAllEnemies("Player", "Win");

        theirs.setVigor(0);
        assertFalse(evaluator.evaluate(trainer, c).met());

        rival.markDefeated();
        assertTrue(evaluator.evaluate(trainer, c).met());
    }

    // === Other condition types ===

    @Test
    void testDefeatSpecificTarget() {
        VictoryCondition c = VictoryCondition.defeatTarget("Player", "RAT2");

        wild1.setVigor(0);
        assertFalse(evaluator.evaluate(state, c).met());
        wild2.setVigor(0);
        assertTrue(evaluator.evaluate(state, c).met());
    }

    @Test
    void testDefeatSpecificTarget_unknownTarget() {
        ConditionResult r = evaluator.evaluate(state, VictoryCondition.defeatTarget("Player", "ghost"));
        assertFalse(r.met());
    }

    @Test
    void testSurvival() {
        VictoryCondition c = VictoryCondition.survival("Player", 3);

        assertFalse(evaluator.evaluate(state, c).met());
        state.setCurrentTurn(3);
        assertTrue(evaluator.evaluate(state, c).met());
        state.setCurrentTurn(4);
        assertTrue(evaluator.evaluate(state, c).met());
    }

    @Test
    void testTimer() {
        assertTrue(evaluator.evaluate(state, VictoryCondition.timer("Player", BattleFixtures.NOW)).met());
        assertTrue(evaluator.evaluate(state, VictoryCondition.timer("Player", BattleFixtures.NOW.minusSeconds(1))).met());
        assertFalse(evaluator.evaluate(state, VictoryCondition.timer("Player", BattleFixtures.NOW.plusSeconds(60))).met());
    }

    @Test
    void testFactoriesRejectMissingParameters() {
        assertThrows(IllegalArgumentException.class, () -> VictoryCondition.defeatTarget("Player", null));
        assertThrows(IllegalArgumentException.class, () -> VictoryCondition.defeatTarget("Player", " "));
        assertThrows(IllegalArgumentException.class, () -> VictoryCondition.timer("Player", null));
    }

    @Test
    void testTimer_epochMillisParameter() {
        VictoryCondition c = new VictoryCondition(VictoryType.TIMER, "Player",
            Map.of(VictoryCondition.PARAM_TIME_LIMIT, BattleFixtures.NOW.toEpochMilli() - 1000L), "Timer");
        assertTrue(evaluator.evaluate(state, c).met());
    }

    @Test
    void testEscapeAndObjectiveAreNeverMet() {
        wild1.setVigor(0);
        wild2.setVigor(0);
        assertFalse(evaluator.evaluate(state, VictoryCondition.escape("Player", "Run")).met());
        assertFalse(evaluator.evaluate(state,
            new VictoryCondition(VictoryType.OBJECTIVE, "Player", null, "Grab the orb")).met());
    }

    // === Aggregation ===

    @Test
    void testAnyMetConditionWins() {
        state.setVictoryConditions(List.of(
            VictoryCondition.escape("Player", "Run"),
            VictoryCondition.survival("Player", 1),
            VictoryCondition.defeatTarget("Player", "rat1")));

        VictoryResult result = evaluator.evaluate(state);

        assertTrue(result.isMet());
        assertEquals("Survived 1 turns", result.getReason());
        assertEquals("Player", result.getWinningFaction());
        assertEquals(3, result.getConditionResults().size());
    }

    @Test
    void testNothingMet() {
        state.setVictoryConditions(BattleEngine.defaultVictoryConditions(BattleKind.WILD));

        VictoryResult result = evaluator.evaluate(state);

        assertFalse(result.isMet());
        assertNull(result.getWinningFaction());
    }

    @Test
    void testNoConditions() {
        VictoryResult result = evaluator.evaluate(state);
        assertFalse(result.isMet());
        assertEquals("No victory conditions", result.getReason());
    }

    @Test
    void testEvaluationDoesNotMutate() {
        state.setVictoryConditions(BattleEngine.defaultVictoryConditions(BattleKind.WILD));
        int logSize = state.getLog().size();

        evaluator.evaluate(state);

        assertEquals(logSize, state.getLog().size());
        assertEquals(1, state.getCurrentTurn());
    }
}
