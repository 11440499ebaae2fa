package com.example.battlecore.combat;

import com.example.battlecore.model.ElementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Attack type vs. defending type(s) effectiveness lookup.
 *
 * The one-vs-one chart holds values in {0, 0.5, 1, 2}; pairs that are not listed are 1.0.
 * Against a dual-typed defender the two single-type multipliers are multiplied, so the
 * combined result is one of {0, 0.25, 0.5, 1, 2, 4}. Immutable once built.
 */
public class TypeChart {

    private static final Logger logger = LoggerFactory.getLogger(TypeChart.class);

    public static final String DEFAULT_RESOURCE = "/data/type_chart.yaml";

    private static final List<Double> ALLOWED_VALUES = Arrays.asList(0.0, 0.5, 1.0, 2.0);

    private final Map<ElementType, Map<ElementType, Double>> chart;

    public TypeChart(Map<ElementType, Map<ElementType, Double>> entries) {
        Map<ElementType, Map<ElementType, Double>> copy = new EnumMap<>(ElementType.class);
        if (entries != null) {
            for (Map.Entry<ElementType, Map<ElementType, Double>> row : entries.entrySet()) {
                Map<ElementType, Double> cells = new EnumMap<>(ElementType.class);
                for (Map.Entry<ElementType, Double> cell : row.getValue().entrySet()) {
                    double value = cell.getValue();
                    if (!ALLOWED_VALUES.contains(value)) {
                        throw new IllegalArgumentException("Invalid multiplier " + value + " for "
                            + row.getKey().getDisplayName() + " vs " + cell.getKey().getDisplayName());
                    }
                    cells.put(cell.getKey(), value);
                }
                copy.put(row.getKey(), Collections.unmodifiableMap(cells));
            }
        }
        this.chart = Collections.unmodifiableMap(copy);
    }

    /**
     * The bundled 18-type chart.
     */
    public static TypeChart standard() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load a chart from a classpath YAML resource shaped as
     * {@code AttackType: { DefendingType: multiplier }}.
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static TypeChart load(String resourcePath) {
        try (InputStream is = TypeChart.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("Type chart resource not found: " + resourcePath);
            }
            Object obj = new Yaml().load(new InputStreamReader(is, StandardCharsets.UTF_8));
            if (!(obj instanceof Map)) {
                throw new IllegalStateException("Type chart " + resourcePath + " is not a mapping");
            }
            TypeChart chart = new TypeChart(parse((Map<?, ?>) obj, resourcePath));
            logger.info("[TypeChart] Loaded {} attacking types from {}", chart.chart.size(), resourcePath);
            return chart;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read type chart " + resourcePath, e);
        }
    }

    private static Map<ElementType, Map<ElementType, Double>> parse(Map<?, ?> top, String resourcePath) {
        Map<ElementType, Map<ElementType, Double>> entries = new EnumMap<>(ElementType.class);
        for (Map.Entry<?, ?> row : top.entrySet()) {
            ElementType attack = ElementType.fromKey(String.valueOf(row.getKey()));
            if (attack == null) {
                throw new IllegalStateException("Unknown attacking type '" + row.getKey() + "' in " + resourcePath);
            }
            if (!(row.getValue() instanceof Map)) {
                continue;
            }
            Map<ElementType, Double> cells = new EnumMap<>(ElementType.class);
            for (Map.Entry<?, ?> cell : ((Map<?, ?>) row.getValue()).entrySet()) {
                ElementType defense = ElementType.fromKey(String.valueOf(cell.getKey()));
                if (defense == null) {
                    throw new IllegalStateException("Unknown defending type '" + cell.getKey() + "' in " + resourcePath);
                }
                if (!(cell.getValue() instanceof Number)) {
                    throw new IllegalStateException("Multiplier for " + attack.getDisplayName() + " vs "
                        + defense.getDisplayName() + " is not a number in " + resourcePath);
                }
                cells.put(defense, ((Number) cell.getValue()).doubleValue());
            }
            entries.put(attack, cells);
        }
        return entries;
    }

    /**
     * Single-type multiplier. A null defending type is neutral.
     */
    public double effectiveness(ElementType attackType, ElementType defenseType) {
        if (attackType == null || defenseType == null) {
            return 1.0;
        }
        Map<ElementType, Double> row = chart.get(attackType);
        if (row == null) {
            return 1.0;
        }
        return row.getOrDefault(defenseType, 1.0);
    }

    /**
     * Multiplier against a defender with one or two types. {@code type2} may be null.
     */
    public double effectiveness(ElementType attackType, ElementType type1, ElementType type2) {
        return effectiveness(attackType, type1) * effectiveness(attackType, type2);
    }

    public List<ElementType> allTypes() {
        return List.of(ElementType.values());
    }

    public List<ElementType> superEffectiveAgainst(ElementType attackType) {
        return typesWithMultiplier(attackType, 2.0);
    }

    public List<ElementType> notVeryEffectiveAgainst(ElementType attackType) {
        return typesWithMultiplier(attackType, 0.5);
    }

    public List<ElementType> noEffectAgainst(ElementType attackType) {
        return typesWithMultiplier(attackType, 0.0);
    }

    private List<ElementType> typesWithMultiplier(ElementType attackType, double multiplier) {
        List<ElementType> result = new ArrayList<>();
        for (ElementType defense : ElementType.values()) {
            if (effectiveness(attackType, defense) == multiplier) {
                result.add(defense);
            }
        }
        return result;
    }

    /**
     * Narration label for a combined multiplier.
     */
    public static String describe(double multiplier) {
        if (multiplier == 0.0) {
            return "No Effect";
        }
        if (multiplier < 1.0) {
            return "Not Very Effective";
        }
        if (multiplier > 1.0) {
            return "Super Effective";
        }
        return "Normal Effectiveness";
    }
}
