package com.example.battlecore.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Stat block for a creature or handler. Every stat starts at {@link StatLevel#NOVICE}.
 */
public class Stats {

    private final Map<StatType, StatLevel> levels = new EnumMap<>(StatType.class);

    public Stats() {
        for (StatType stat : StatType.values()) {
            levels.put(stat, StatLevel.NOVICE);
        }
    }

    /**
     * Copy constructor.
     */
    public Stats(Stats other) {
        this();
        if (other != null) {
            levels.putAll(other.levels);
        }
    }

    public StatLevel getLevel(StatType stat) {
        return levels.get(stat);
    }

    public int getModifier(StatType stat) {
        return levels.get(stat).getModifier();
    }

    /**
     * Set a stat level. Returns this for chaining.
     */
    public Stats with(StatType stat, StatLevel level) {
        if (stat == null || level == null) {
            throw new IllegalArgumentException("stat and level are required");
        }
        levels.put(stat, level);
        return this;
    }

    public Map<StatType, StatLevel> asMap() {
        return Collections.unmodifiableMap(levels);
    }

    @Override
    public String toString() {
        return "Stats" + levels;
    }
}
