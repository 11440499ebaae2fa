package com.example.battlecore;

import com.example.battlecore.util.BattleConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading engine settings from YAML.
 */
public class BattleConfigTest {

    @Test
    void testBundledConfig() {
        BattleConfig config = BattleConfig.load();

        assertEquals("Standard Field", config.getDefaultBattlefield());
        assertEquals("Clear", config.getDefaultWeather());
        assertEquals(10, config.getDefaultLogCount());
        assertEquals(1.5, config.getCriticalMultiplier(), 0.0001);
        assertEquals("/data/type_chart.yaml", config.getTypeChartResource());
        assertEquals("/data/moves.yaml", config.getMovesResource());
    }

    @Test
    void testOverridesAndFallbacks() {
        BattleConfig config = BattleConfig.load("/battle-custom.yaml");

        assertEquals("Rocky Arena", config.getDefaultBattlefield());
        assertEquals("Sandstorm", config.getDefaultWeather());
        assertEquals(5, config.getDefaultLogCount());
        assertEquals(2.0, config.getCriticalMultiplier(), 0.0001);
        // Not in the file
        assertEquals("/data/moves.yaml", config.getMovesResource());
    }

    @Test
    void testMissingResourceUsesDefaults() {
        BattleConfig config = BattleConfig.load("/does-not-exist.yaml");

        assertEquals(BattleConfig.defaults().getDefaultBattlefield(), config.getDefaultBattlefield());
        assertEquals(10, config.getDefaultLogCount());
    }
}
