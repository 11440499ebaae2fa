package com.example.battlecore.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Engine settings read from a YAML resource (default {@code /battle.yaml}).
 *
 * Layout:
 * <pre>
 * defaults:
 *   battlefield: Standard Field
 *   weather: Clear
 * log:
 *   default-count: 10
 * critical:
 *   multiplier: 1.5
 * data:
 *   type-chart: /data/type_chart.yaml
 *   moves: /data/moves.yaml
 * </pre>
 * Missing keys (or a missing resource) fall back to the values above.
 */
public class BattleConfig {

    private static final Logger logger = LoggerFactory.getLogger(BattleConfig.class);

    public static final String DEFAULT_RESOURCE = "/battle.yaml";

    private String defaultBattlefield = "Standard Field";
    private String defaultWeather = "Clear";
    private int defaultLogCount = 10;
    private double criticalMultiplier = 1.5;
    private String typeChartResource = "/data/type_chart.yaml";
    private String movesResource = "/data/moves.yaml";

    /**
     * Built-in defaults, no resource lookup.
     */
    public static BattleConfig defaults() {
        return new BattleConfig();
    }

    /**
     * Load from {@link #DEFAULT_RESOURCE}.
     */
    public static BattleConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load from a classpath resource. A missing resource yields the defaults.
     */
    public static BattleConfig load(String resourcePath) {
        BattleConfig config = new BattleConfig();
        try (InputStream is = BattleConfig.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[BattleConfig] Resource not found: {} (using defaults)", resourcePath);
                return config;
            }
            Map<String, Object> data = new Yaml().load(is);
            if (data != null) {
                config.apply(data);
            }
            logger.info("[BattleConfig] Loaded {}", resourcePath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read battle config " + resourcePath, e);
        }
        return config;
    }

    private void apply(Map<String, Object> data) {
        Map<String, Object> defaults = section(data, "defaults");
        defaultBattlefield = str(defaults.get("battlefield"), defaultBattlefield);
        defaultWeather = str(defaults.get("weather"), defaultWeather);

        Map<String, Object> log = section(data, "log");
        defaultLogCount = parseInt(log.get("default-count"), defaultLogCount);

        Map<String, Object> critical = section(data, "critical");
        criticalMultiplier = parseDouble(critical.get("multiplier"), criticalMultiplier);

        Map<String, Object> dataFiles = section(data, "data");
        typeChartResource = str(dataFiles.get("type-chart"), typeChartResource);
        movesResource = str(dataFiles.get("moves"), movesResource);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> data, String key) {
        Object o = data.get(key);
        if (o instanceof Map) {
            return (Map<String, Object>) o;
        }
        return Map.of();
    }

    private static String str(Object o, String fallback) {
        return o == null ? fallback : o.toString();
    }

    private static int parseInt(Object o, int fallback) {
        if (o == null) return fallback;
        try {
            return Integer.parseInt(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("[BattleConfig] Not an integer: '{}' (keeping {})", o, fallback);
            return fallback;
        }
    }

    private static double parseDouble(Object o, double fallback) {
        if (o == null) return fallback;
        try {
            return Double.parseDouble(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("[BattleConfig] Not a number: '{}' (keeping {})", o, fallback);
            return fallback;
        }
    }

    public String getDefaultBattlefield() { return defaultBattlefield; }

    public String getDefaultWeather() { return defaultWeather; }

    public int getDefaultLogCount() { return defaultLogCount; }

    public double getCriticalMultiplier() { return criticalMultiplier; }

    public String getTypeChartResource() { return typeChartResource; }

    public String getMovesResource() { return movesResource; }
}
