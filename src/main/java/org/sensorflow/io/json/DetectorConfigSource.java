package org.sensorflow.io.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.config.DetectorConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link DetectorConfig} from JSON.
 *
 * The bundled {@value #DEFAULT_RESOURCE} provides every value; an override document only needs
 * the keys it changes, e.g. { "classifier": { "warningDebounce": 5 } }.
 */
public final class DetectorConfigSource {

    private static final Logger logger = LogManager.getLogger(DetectorConfigSource.class);

    public static final String DEFAULT_RESOURCE = "sensorflow-defaults.json";

    private final ObjectMapper mapper = new ObjectMapper();

    public DetectorConfig loadDefaults() {
        return toConfig(defaultsTree());
    }

    public DetectorConfig load(Path overridePath) {
        Objects.requireNonNull(overridePath, "overridePath must not be null");
        DetectorConfig config = load(() -> Files.newInputStream(overridePath));
        logger.info("Loaded detector configuration overrides from {}", overridePath);
        return config;
    }

    public DetectorConfig load(InputStreamSupplier override) {
        Objects.requireNonNull(override, "override must not be null");
        JsonNode overrides = readTree(override, "configuration override");
        if (!overrides.isObject()) {
            throw new IllegalArgumentException("Configuration override must be a JSON object");
        }
        ObjectNode merged = defaultsTree();
        merge(merged, (ObjectNode) overrides);
        return toConfig(merged);
    }

    private ObjectNode defaultsTree() {
        JsonNode tree = readTree(() -> {
            InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
            if (in == null) {
                throw new IllegalStateException("Missing config resource: " + DEFAULT_RESOURCE);
            }
            return in;
        }, DEFAULT_RESOURCE);
        return (ObjectNode) tree;
    }

    private JsonNode readTree(InputStreamSupplier supplier, String what) {
        try (InputStream in = supplier.open()) {
            return mapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + what, e);
        }
    }

    private DetectorConfig toConfig(JsonNode tree) {
        try {
            return mapper.treeToValue(tree, DetectorConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid detector configuration", e);
        }
    }

    /**
     * Deep merge: objects merge key by key, anything else replaces the target value.
     */
    static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            JsonNode existing = target.get(e.getKey());
            if (existing instanceof ObjectNode existingObj && e.getValue() instanceof ObjectNode incoming) {
                merge(existingObj, incoming);
            } else {
                target.set(e.getKey(), e.getValue());
            }
        }
    }
}
