package in.perpscan.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.perpscan.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads {@link ScannerConfig}.
 *
 * Precedence, lowest first:
 * 1. Built-in defaults
 * 2. JSON file named by SCANNER_CONFIG (partial documents allowed, deep-merged)
 * 3. Individual environment overrides (SCANNER_MIN_SCORE, SCANNER_RISK_FRACTION, ...)
 */
public final class ScannerConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ScannerConfigLoader.class);

    public static final String CONFIG_PATH_KEY = "SCANNER_CONFIG";

    // env key -> JSON path inside the config tree
    private static final Map<String, String[]> ENV_OVERRIDES = Map.of(
        "SCANNER_MIN_SCORE", new String[] {"scoring", "minScore"},
        "SCANNER_MIN_CONFIDENCE", new String[] {"scoring", "minConfidence"},
        "SCANNER_RISK_FRACTION", new String[] {"risk", "riskFraction"},
        "SCANNER_FILTER_ENABLED", new String[] {"filter", "enabled"},
        "SCANNER_TOP_SIGNALS", new String[] {"scan", "topSignals"},
        "SCANNER_PARALLELISM", new String[] {"scan", "parallelism"}
    );

    private final ObjectMapper mapper;
    private final Function<String, String> lookup;

    public ScannerConfigLoader() {
        this(new ObjectMapper(), key -> Env.get(key, null));
    }

    ScannerConfigLoader(ObjectMapper mapper, Function<String, String> lookup) {
        this.mapper = mapper;
        this.lookup = lookup;
    }

    /**
     * Load configuration from defaults, the optional file and environment overrides.
     */
    public ScannerConfig load() {
        String path = lookup.apply(CONFIG_PATH_KEY);
        if (path == null) {
            log.info("No {} set, using built-in defaults", CONFIG_PATH_KEY);
            return applyOverrides(mapper.valueToTree(ScannerConfig.defaults()));
        }
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            log.info("Loading scanner config from {}", path);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read scanner config " + path, e);
        }
    }

    /**
     * Load configuration from a (possibly partial) JSON document merged over defaults.
     */
    public ScannerConfig load(InputStream json) throws IOException {
        ObjectNode tree = mapper.valueToTree(ScannerConfig.defaults());
        JsonNode overlay = mapper.readTree(json);
        if (overlay != null && overlay.isObject()) {
            merge(tree, (ObjectNode) overlay);
        }
        return applyOverrides(tree);
    }

    private ScannerConfig applyOverrides(ObjectNode tree) {
        ENV_OVERRIDES.forEach((key, jsonPath) -> {
            String value = lookup.apply(key);
            if (value == null) {
                return;
            }
            ObjectNode section = (ObjectNode) tree.get(jsonPath[0]);
            section.put(jsonPath[1], value);
            log.info("Config override {} -> {}.{} = {}", key, jsonPath[0], jsonPath[1], value);
        });
        try {
            return mapper.treeToValue(tree, ScannerConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid scanner config: " + e.getMessage(), e);
        }
    }

    private static void merge(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
