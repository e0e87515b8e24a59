package pointersnake.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pointersnake.core.Margins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link EngineConfig} from JSON. Keys that are absent keep their default value;
 * the result is always validated.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String RESOURCE = "pointer-snake.json";

    private final ObjectMapper mapper;

    public ConfigLoader(ObjectMapper mapper) { this.mapper = Objects.requireNonNull(mapper); }

    public static ConfigLoader createDefault() { return new ConfigLoader(new ObjectMapper()); }

    public EngineConfig loadDefault() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath, using built-in defaults", RESOURCE);
                return EngineConfig.defaults();
            }
            return fromJson(mapper.readTree(in));
        } catch (IOException e) {
            throw new ConfigException("Cannot read " + RESOURCE, e);
        }
    }

    public EngineConfig load(Path file) {
        if (!Files.isRegularFile(file)) throw new ConfigException("Config file not found: " + file);
        try {
            EngineConfig cfg = fromJson(mapper.readTree(file.toFile()));
            log.info("Loaded config from {}", file);
            return cfg;
        } catch (IOException e) {
            throw new ConfigException("Cannot read config " + file, e);
        }
    }

    public EngineConfig parse(String json) {
        try {
            return fromJson(mapper.readTree(json));
        } catch (IOException e) {
            throw new ConfigException("Malformed config JSON", e);
        }
    }

    EngineConfig fromJson(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) return EngineConfig.defaults().validate();
        if (!root.isObject()) throw new ConfigException("Config root must be a JSON object");

        EngineConfig d = EngineConfig.defaults();
        Margins dm = d.margins();
        JsonNode m = root.path("margins");
        Margins margins = new Margins(
                intOr(m, "left", dm.left()),
                intOr(m, "right", dm.right()),
                intOr(m, "top", dm.top()),
                intOr(m, "bottom", dm.bottom()));

        return new EngineConfig(
                intOr(root, "pixelWidth", d.pixelWidth()),
                intOr(root, "pixelHeight", d.pixelHeight()),
                margins,
                intOr(root, "cellSize", d.cellSize()),
                intOr(root, "foodCells", d.foodCells()),
                longOr(root, "tickMs", d.tickMs()),
                doubleOr(root, "deadzoneFraction", d.deadzoneFraction()),
                longOr(root, "pauseAfterMs", d.pauseAfterMs()),
                intOr(root, "maxCatchUp", d.maxCatchUp()),
                intOr(root, "growPerFood", d.growPerFood()),
                longOr(root, "eatFlashMs", d.eatFlashMs())
        ).validate();
    }

    private static int intOr(JsonNode n, String field, int def) {
        JsonNode v = number(n, field);
        if (v == null) return def;
        if (!v.canConvertToInt()) throw new ConfigException("'" + field + "' is out of range: " + v);
        return v.intValue();
    }

    private static long longOr(JsonNode n, String field, long def) {
        JsonNode v = number(n, field);
        return v == null ? def : v.longValue();
    }

    private static double doubleOr(JsonNode n, String field, double def) {
        JsonNode v = number(n, field);
        return v == null ? def : v.doubleValue();
    }

    private static JsonNode number(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isNumber()) throw new ConfigException("'" + field + "' must be a number, got " + v);
        return v;
    }
}
