package com.example.battlecore.ruleset;

import com.example.battlecore.combat.MoveData;
import com.example.battlecore.model.ElementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Move catalog read from a YAML resource:
 * <pre>
 * moves:
 *   Tackle:
 *     type: Normal
 *     dice: 2
 *     special: false
 * </pre>
 */
public class YamlMoveCatalog implements MoveCatalog {

    private static final Logger logger = LoggerFactory.getLogger(YamlMoveCatalog.class);

    public static final String DEFAULT_RESOURCE = "/data/moves.yaml";

    private final Map<String, MoveData> moves = new LinkedHashMap<>();

    public YamlMoveCatalog(List<MoveData> moves) {
        for (MoveData m : moves) {
            register(m);
        }
    }

    /**
     * Load a catalog from a classpath resource. A missing resource yields an empty catalog.
     * @throws IllegalStateException on a malformed entry
     */
    public static YamlMoveCatalog load(String resourcePath) {
        try (InputStream is = YamlMoveCatalog.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[MoveCatalog] Resource not found: {} (no moves loaded)", resourcePath);
                return new YamlMoveCatalog(List.of());
            }
            Object obj = new Yaml().load(new InputStreamReader(is, StandardCharsets.UTF_8));
            List<MoveData> parsed = parse(obj, resourcePath);
            logger.info("[MoveCatalog] Loaded {} moves from {}", parsed.size(), resourcePath);
            return new YamlMoveCatalog(parsed);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read move catalog " + resourcePath, e);
        }
    }

    private static List<MoveData> parse(Object obj, String resourcePath) {
        List<MoveData> result = new ArrayList<>();
        if (!(obj instanceof Map)) {
            return result;
        }
        Object section = ((Map<?, ?>) obj).get("moves");
        if (!(section instanceof Map)) {
            return result;
        }
        for (Map.Entry<?, ?> e : ((Map<?, ?>) section).entrySet()) {
            String name = String.valueOf(e.getKey());
            if (!(e.getValue() instanceof Map)) {
                throw new IllegalStateException("Move '" + name + "' in " + resourcePath + " is not a mapping");
            }
            Map<?, ?> m = (Map<?, ?>) e.getValue();
            Object typeKey = m.get("type");
            ElementType type = ElementType.fromKey(typeKey == null ? null : typeKey.toString());
            if (typeKey != null && type == null) {
                throw new IllegalStateException("Move '" + name + "' has unknown type '" + typeKey + "'");
            }
            Object dice = m.get("dice");
            if (!(dice instanceof Number) || ((Number) dice).intValue() < 1) {
                throw new IllegalStateException("Move '" + name + "' needs a dice count of at least 1");
            }
            boolean special = Boolean.TRUE.equals(m.get("special"));
            result.add(new MoveData(name, type, ((Number) dice).intValue(), special));
        }
        return result;
    }

    private void register(MoveData move) {
        moves.put(move.name().toLowerCase(Locale.ROOT), move);
    }

    @Override
    public MoveData findMove(String name) {
        if (name == null || name.isBlank()) return null;
        return moves.get(name.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    public List<MoveData> allMoves() {
        return List.copyOf(moves.values());
    }
}
