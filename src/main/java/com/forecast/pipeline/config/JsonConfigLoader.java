package com.forecast.pipeline.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecast.pipeline.core.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads a {@link PipelineConfig} from JSON.
 *
 * <p>Expected layout:</p>
 * <pre>
 * {
 *   "trading_rules": {
 *     "ewmac8": {"forecast_scalar": 5.3}
 *   },
 *   "parameters": {"forecast_cap": 21.0}
 * }
 * </pre>
 * Both sections are optional; JSON {@code null} values are treated as absent.
 */
public class JsonConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonConfigLoader.class);

    static final String TRADING_RULES = "trading_rules";
    static final String PARAMETERS = "parameters";

    private final ObjectMapper objectMapper;

    public JsonConfigLoader() {
        this(new ObjectMapper());
    }

    public JsonConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PipelineConfig load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            PipelineConfig config = load(input);
            log.info("Loaded pipeline configuration from {}: {}", path, config);
            return config;
        } catch (IOException e) {
            throw new PipelineException("Failed to read configuration file " + path, e);
        }
    }

    public PipelineConfig load(InputStream input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new PipelineException("Failed to parse pipeline configuration", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return PipelineConfig.empty();
        }
        if (!root.isObject()) {
            throw new PipelineException("Pipeline configuration must be a JSON object");
        }

        PipelineConfig.Builder builder = PipelineConfig.builder();
        JsonNode rules = root.path(TRADING_RULES);
        if (rules.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> variants = rules.fields();
            while (variants.hasNext()) {
                Map.Entry<String, JsonNode> variant = variants.next();
                if (!variant.getValue().isObject()) {
                    log.warn("Ignoring trading rule '{}': expected an object", variant.getKey());
                    continue;
                }
                variant.getValue().fields().forEachRemaining(field ->
                        builder.variant(variant.getKey(), field.getKey(), toValue(field.getValue())));
            }
        }
        JsonNode parameters = root.path(PARAMETERS);
        if (parameters.isObject()) {
            parameters.fields().forEachRemaining(field -> builder.parameter(field.getKey(), toValue(field.getValue())));
        }
        return builder.build();
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, Object.class);
        } catch (IOException e) {
            throw new PipelineException("Failed to convert configuration value " + node, e);
        }
    }
}
