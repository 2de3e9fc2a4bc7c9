package org.sensorflow.io.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sensorflow.error.DimensionMismatchException;
import org.sensorflow.error.InvalidInputException;
import org.sensorflow.model.FitWindow;
import org.sensorflow.model.SensorSchema;
import org.sensorflow.model.TrainedModel;
import org.sensorflow.model.Vector;
import org.sensorflow.scoring.FusionPolicy;
import org.sensorflow.scoring.FusionSettings;
import org.sensorflow.scoring.Thresholds;
import org.sensorflow.subspace.SubspaceModel;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads and writes {@link TrainedModel} as a flat JSON record.
 *
 * Expected JSON shape:
 * {
 *   "schema": "sensorflow/trained-model", "schemaVersion": 1,
 *   "sensors": ["sensor_00", ...],
 *   "mean": [...], "scale": [...], "constantSensors": [3, 7],
 *   "components": [[...], [...]], "eigenvalues": [...], "visualComponents": 2,
 *   "thresholds": { "percentile": 99.0, "reconstruction": ..., "subspace": ..., "health": ... },
 *   "fusion": { "policy": "BLENDED", "reconstructionWeight": 0.5 },
 *   "fitWindow": { "start": "2018-04-01T00:00:00Z", "end": "...", "sampleCount": 1440 }
 * }
 *
 * Unknown fields are ignored so older readers accept additive changes; a higher schemaVersion is rejected.
 */
public final class ModelArtifactCodec {

    private static final Logger logger = LogManager.getLogger(ModelArtifactCodec.class);

    private final ObjectMapper mapper;

    public ModelArtifactCodec() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // -------------------------------------------------------------------------
    // Writing
    // -------------------------------------------------------------------------

    public void write(TrainedModel model, OutputStream out) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(out, "out must not be null");
        try {
            mapper.writeValue(out, toTree(model));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write model artifact", e);
        }
    }

    public void save(TrainedModel model, Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (OutputStream out = Files.newOutputStream(path)) {
            write(model, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write model artifact to " + path, e);
        }
        logger.info("Saved model artifact to {}", path);
    }

    ObjectNode toTree(TrainedModel model) {
        ObjectNode root = mapper.createObjectNode();
        root.put("schema", TrainedModel.SCHEMA_TAG);
        root.put("schemaVersion", TrainedModel.SCHEMA_VERSION);

        ArrayNode sensors = root.putArray("sensors");
        model.schema().sensorNames().forEach(sensors::add);

        writeVector(root.putArray("mean"), model.mean());
        writeVector(root.putArray("scale"), model.scale());
        ArrayNode constant = root.putArray("constantSensors");
        model.constantSensors().forEach(constant::add);

        SubspaceModel subspace = model.subspace();
        ArrayNode components = root.putArray("components");
        for (Vector c : subspace.reconstructionComponents()) {
            writeVector(components.addArray(), c);
        }
        ArrayNode eigen = root.putArray("eigenvalues");
        for (double ev : subspace.eigenvalues()) eigen.add(ev);
        root.put("visualComponents", subspace.visualRank());

        Thresholds t = model.thresholds();
        ObjectNode thresholds = root.putObject("thresholds");
        thresholds.put("percentile", t.percentile());
        thresholds.put("reconstruction", t.reconstruction());
        thresholds.put("subspace", t.subspace());
        thresholds.put("health", t.health());

        ObjectNode fusion = root.putObject("fusion");
        fusion.put("policy", model.fusion().policy().name());
        fusion.put("reconstructionWeight", model.fusion().reconstructionWeight());

        ObjectNode window = root.putObject("fitWindow");
        window.put("start", model.fitWindow().start().toString());
        window.put("end", model.fitWindow().end().toString());
        window.put("sampleCount", model.fitWindow().sampleCount());
        return root;
    }

    private static void writeVector(ArrayNode target, Vector v) {
        for (int i = 0; i < v.dim(); i++) target.add(v.get(i));
    }

    // -------------------------------------------------------------------------
    // Reading
    // -------------------------------------------------------------------------

    /**
     * @throws InvalidInputException if the document is malformed or from a newer schema version
     * @throws UncheckedIOException  if the stream cannot be read
     */
    public TrainedModel read(InputStreamSupplier source) {
        Objects.requireNonNull(source, "source must not be null");
        JsonNode root;
        try (InputStream in = source.open()) {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model artifact", e);
        }
        return fromTree(root);
    }

    public TrainedModel load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        TrainedModel model = read(() -> Files.newInputStream(path));
        logger.info("Loaded model artifact from {}: {}", path, model);
        return model;
    }

    TrainedModel fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidInputException("Model artifact must be a JSON object");
        }
        String tag = requireField(root, "schema").asText();
        if (!TrainedModel.SCHEMA_TAG.equals(tag)) {
            throw new InvalidInputException("Not a model artifact: schema '" + tag + "'");
        }
        int version = requireField(root, "schemaVersion").asInt(-1);
        if (version < 1 || version > TrainedModel.SCHEMA_VERSION) {
            throw new InvalidInputException("Unsupported model artifact version " + version
                    + " (this reader understands up to " + TrainedModel.SCHEMA_VERSION + ")");
        }

        try {
            List<String> names = new ArrayList<>();
            for (JsonNode n : requireArray(root, "sensors")) names.add(n.asText());
            SensorSchema schema = new SensorSchema(names);

            Vector mean = readVector(requireArray(root, "mean"), "mean");
            Vector scale = readVector(requireArray(root, "scale"), "scale");

            Set<Integer> constant = new LinkedHashSet<>();
            for (JsonNode n : requireArray(root, "constantSensors")) {
                if (!n.canConvertToInt()) throw new InvalidInputException("constantSensors must hold integers");
                constant.add(n.asInt());
            }

            List<Vector> components = new ArrayList<>();
            for (JsonNode row : requireArray(root, "components")) {
                if (!row.isArray()) throw new InvalidInputException("components must be an array of arrays");
                components.add(readVector(row, "components"));
            }
            Vector eigen = readVector(requireArray(root, "eigenvalues"), "eigenvalues");
            int visual = requireField(root, "visualComponents").asInt();
            SubspaceModel subspace = new SubspaceModel(components, eigen.toArrayCopy(), visual);

            JsonNode t = requireField(root, "thresholds");
            Thresholds thresholds = new Thresholds(
                    requireNumber(t, "percentile"),
                    requireNumber(t, "reconstruction"),
                    requireNumber(t, "subspace"),
                    requireNumber(t, "health"));

            JsonNode f = requireField(root, "fusion");
            FusionSettings fusion = new FusionSettings(
                    FusionPolicy.valueOf(requireField(f, "policy").asText()),
                    requireNumber(f, "reconstructionWeight"));

            JsonNode w = requireField(root, "fitWindow");
            FitWindow window = new FitWindow(
                    Instant.parse(requireField(w, "start").asText()),
                    Instant.parse(requireField(w, "end").asText()),
                    requireField(w, "sampleCount").asInt());

            return new TrainedModel(schema, mean, scale, constant, subspace, thresholds, fusion, window);
        } catch (IllegalArgumentException | DateTimeParseException | DimensionMismatchException e) {
            // domain validation failures mean the document is corrupt
            throw new InvalidInputException("Corrupt model artifact: " + e.getMessage(), e);
        }
    }

    private static JsonNode requireField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new InvalidInputException("Model artifact is missing field '" + field + "'");
        }
        return value;
    }

    private static JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = requireField(node, field);
        if (!value.isArray()) {
            throw new InvalidInputException("Field '" + field + "' must be an array");
        }
        return value;
    }

    private static double requireNumber(JsonNode node, String field) {
        JsonNode value = requireField(node, field);
        if (!value.isNumber()) {
            throw new InvalidInputException("Field '" + field + "' must be a number");
        }
        return value.asDouble();
    }

    private static Vector readVector(JsonNode array, String field) {
        double[] out = new double[array.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode n = array.get(i);
            if (!n.isNumber()) {
                throw new InvalidInputException("Field '" + field + "' must contain numbers only");
            }
            out[i] = n.asDouble();
        }
        return new Vector(out);
    }
}
