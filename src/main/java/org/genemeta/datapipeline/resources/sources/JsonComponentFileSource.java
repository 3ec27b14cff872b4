package org.genemeta.datapipeline.resources.sources;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.genemeta.datapipeline.api.resources.database.dto.MetricKind;
import org.genemeta.datapipeline.api.resources.database.dto.PerStudyComponent;
import org.genemeta.datapipeline.api.sources.IStudyComponentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;

/**
 * Reads per-study components from {@code <directory>/<study_key>.json}.
 * <p>
 * Each file holds a JSON array of component objects:
 * <pre>
 * [{"study_key":12,"pair_id":"101_205","metric_name":"shock_vs_sepsis_d","theta":0.42,"standard_error":0.11,"n_samples":80},
 *  {"study_key":12,"pair_id":"205_101","metric_name":"coexpr_spearman","r":0.63,"n_samples":80}]
 * </pre>
 * A component with {@code r} is a correlation, one with {@code theta} an effect size. Structural
 * problems (missing keys, both or neither value, a foreign study key) fail the whole file; value
 * problems such as a non-positive standard error are left to the statistics updater.
 * A missing file means the study supplied no components.
 */
public class JsonComponentFileSource implements IStudyComponentSource {

    private static final Logger log = LoggerFactory.getLogger(JsonComponentFileSource.class);

    private final Path directory;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JsonComponentFileSource(Path directory) {
        this.directory = directory;
    }

    /**
     * Creates a source from the {@code genemeta.components} configuration block.
     */
    public static JsonComponentFileSource fromConfig(Config options) {
        String dir = options.hasPath("directory") ? options.getString("directory") : "data/components";
        return new JsonComponentFileSource(Path.of(dir));
    }

    @Override
    public List<PerStudyComponent> fetchComponents(int studyKey) throws IOException {
        Path file = directory.resolve(studyKey + ".json");
        if (!Files.exists(file)) {
            log.warn("No component file for study {} at {}", studyKey, file);
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed component file " + file + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IOException("Component file " + file + " must contain a JSON array");
        }

        List<PerStudyComponent> components = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            components.add(parseComponent(node, studyKey, file, index++));
        }
        log.debug("Read {} components for study {} from {}", components.size(), studyKey, file);
        return components;
    }

    private static PerStudyComponent parseComponent(JsonNode node, int studyKey, Path file, int index)
            throws IOException {
        String where = file.getFileName() + "[" + index + "]";
        if (!node.isObject()) {
            throw new IOException(where + ": component must be a JSON object");
        }
        int declaredStudy = requireInt(node, "study_key", where);
        if (declaredStudy != studyKey) {
            throw new IOException(where + ": study_key " + declaredStudy + " does not match study " + studyKey);
        }
        String pairId = requireText(node, "pair_id", where);
        String metricName = requireText(node, "metric_name", where);
        Integer nSamples = optionalInt(node, "n_samples", where);

        boolean hasR = hasValue(node, "r");
        boolean hasTheta = hasValue(node, "theta");
        if (hasR == hasTheta) {
            throw new IOException(where + ": exactly one of 'theta' or 'r' is required");
        }

        if (hasR) {
            double r = requireNumber(node, "r", where);
            return new PerStudyComponent(studyKey, pairId, metricName, MetricKind.CORRELATION, r, null, nSamples);
        }
        double theta = requireNumber(node, "theta", where);
        Double standardError = hasValue(node, "standard_error") ? requireNumber(node, "standard_error", where) : null;
        return new PerStudyComponent(studyKey, pairId, metricName, MetricKind.EFFECT_SIZE, theta, standardError, nSamples);
    }

    private static boolean hasValue(JsonNode node, String field) {
        return node.hasNonNull(field);
    }

    private static String requireText(JsonNode node, String field, String where) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IOException(where + ": '" + field + "' must be a non-empty string");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field, String where) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IOException(where + ": '" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private static Integer optionalInt(JsonNode node, String field, String where) throws IOException {
        return hasValue(node, field) ? requireInt(node, field, where) : null;
    }

    private static double requireNumber(JsonNode node, String field, String where) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IOException(where + ": '" + field + "' must be a number");
        }
        return value.doubleValue();
    }
}
