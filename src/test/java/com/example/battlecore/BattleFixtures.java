package com.example.battlecore;

import com.example.battlecore.model.CreatureCombatant;
import com.example.battlecore.model.ElementType;
import com.example.battlecore.model.HandlerCombatant;
import com.example.battlecore.model.Participant;
import com.example.battlecore.model.StatLevel;
import com.example.battlecore.model.StatType;
import com.example.battlecore.model.Stats;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Participant builders shared by the tests.
 */
final class BattleFixtures {

    static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private BattleFixtures() {}

    static Stats stats(int power, int defense) {
        return new Stats()
            .with(StatType.POWER, StatLevel.fromModifier(power))
            .with(StatType.DEFENSE, StatLevel.fromModifier(defense));
    }

    static Participant creature(String id, String faction, Stats stats, ElementType type, int maxVigor) {
        return Participant.creature(id, id, faction, new CreatureCombatant(id, stats, type, null, maxVigor));
    }

    static Participant creature(String id, String faction, int maxVigor) {
        return creature(id, faction, new Stats(), ElementType.NORMAL, maxVigor);
    }

    static Participant handler(String id, String faction, boolean canEscape) {
        return Participant.handler(id, id, faction, new HandlerCombatant(id, new Stats(), List.of(), canEscape));
    }
}
