package com.example.battlecore.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A way for a faction to win. Condition-specific values live in the parameter bag:
 * <ul>
 *   <li>DEFEAT_SPECIFIC_TARGET: "targetId" (String)</li>
 *   <li>SURVIVAL: "turns" (Integer)</li>
 *   <li>TIMER: "timeLimit" (Instant, or epoch millis as a Number)</li>
 * </ul>
 */
public class VictoryCondition {

    public static final String PARAM_TARGET_ID = "targetId";
    public static final String PARAM_TURNS = "turns";
    public static final String PARAM_TIME_LIMIT = "timeLimit";

    private final VictoryType type;
    private final String faction;
    private final Map<String, Object> parameters;
    private final String description;

    public VictoryCondition(VictoryType type, String faction, Map<String, Object> parameters, String description) {
        if (type == null) {
            throw new IllegalArgumentException("Victory condition type is required");
        }
        this.type = type;
        this.faction = faction == null ? "" : faction;
        this.parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.description = description == null ? "" : description;
    }

    public static VictoryCondition defeatAllEnemies(String faction, String description) {
        return new VictoryCondition(VictoryType.DEFEAT_ALL_ENEMIES, faction, null, description);
    }

    /**
     * @throws IllegalArgumentException if targetId is null or blank
     */
    public static VictoryCondition defeatTarget(String faction, String targetId) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Defeat-target condition needs a target id");
        }
        return new VictoryCondition(VictoryType.DEFEAT_SPECIFIC_TARGET, faction,
            Map.of(PARAM_TARGET_ID, targetId), "Defeat " + targetId);
    }

    public static VictoryCondition survival(String faction, int turns) {
        return new VictoryCondition(VictoryType.SURVIVAL, faction,
            Map.of(PARAM_TURNS, turns), "Survive " + turns + " turns");
    }

    /**
     * @throws IllegalArgumentException if timeLimit is null
     */
    public static VictoryCondition timer(String faction, Instant timeLimit) {
        if (timeLimit == null) {
            throw new IllegalArgumentException("Timer condition needs a time limit");
        }
        return new VictoryCondition(VictoryType.TIMER, faction,
            Map.of(PARAM_TIME_LIMIT, timeLimit), "Hold out until " + timeLimit);
    }

    public static VictoryCondition escape(String faction, String description) {
        return new VictoryCondition(VictoryType.ESCAPE, faction, null, description);
    }

    public VictoryType getType() { return type; }

    public String getFaction() { return faction; }

    public Map<String, Object> getParameters() { return parameters; }

    public String getDescription() { return description; }

    /**
     * String parameter, or null if absent or not a string.
     */
    public String getString(String key) {
        Object o = parameters.get(key);
        return o instanceof String ? (String) o : null;
    }

    /**
     * Integer parameter, or null if absent or not a whole number.
     */
    public Integer getInt(String key) {
        Object o = parameters.get(key);
        if (o instanceof Integer || o instanceof Long || o instanceof Short) {
            return ((Number) o).intValue();
        }
        return null;
    }

    /**
     * Instant parameter; epoch milliseconds are accepted as well. Null if absent.
     */
    public Instant getInstant(String key) {
        Object o = parameters.get(key);
        if (o instanceof Instant) {
            return (Instant) o;
        }
        if (o instanceof Long || o instanceof Integer) {
            return Instant.ofEpochMilli(((Number) o).longValue());
        }
        return null;
    }

    @Override
    public String toString() {
        return "VictoryCondition[" + type + " " + faction + (parameters.isEmpty() ? "" : " " + parameters) + "]";
    }
}
