package com.phillippitts.wordassist.service.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.wordassist.domain.AiConfig;
import com.phillippitts.wordassist.domain.AppConfig;
import com.phillippitts.wordassist.domain.HealthStatus;
import com.phillippitts.wordassist.domain.ModelState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between {@link AppConfig} and the persisted JSON document.
 *
 * <p>Field order is preserved in both directions so that serializing the same config always
 * yields the same bytes. Top-level sections other than {@code version} and {@code aiConfig} are
 * carried as plain maps/lists and written back unchanged.
 */
@Component
public class ConfigCodec {

    private static final Logger LOG = LogManager.getLogger(ConfigCodec.class);

    static final String VERSION = "version";
    static final String AI_CONFIG = "aiConfig";
    static final String PROVIDER = "provider";
    static final String MODELS = "models";
    static final String FALLBACK_ORDER = "fallbackOrder";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Serializes a config. API keys are written as given; encryption is the caller's job.
     */
    public String encode(AppConfig config) {
        try {
            return mapper.writeValueAsString(toTree(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Configuration is not serializable", e);
        }
    }

    /**
     * Parses a stored blob.
     *
     * @param blob serialized configuration
     * @return the root object, or empty when the blob is not a JSON object
     */
    public Optional<ObjectNode> parse(String blob) {
        try {
            JsonNode root = mapper.readTree(blob);
            if (root instanceof ObjectNode object) {
                return Optional.of(object);
            }
            LOG.error("Stored configuration is not a JSON object");
        } catch (JsonProcessingException e) {
            LOG.error("Stored configuration is not valid JSON: {}", e.getOriginalMessage());
        }
        return Optional.empty();
    }

    ObjectNode toTree(AppConfig config) {
        ObjectNode root = mapper.createObjectNode();
        root.put(VERSION, config.version());

        AiConfig ai = config.aiConfig();
        ObjectNode aiNode = root.putObject(AI_CONFIG);
        aiNode.put(PROVIDER, ai.provider());
        ObjectNode models = aiNode.putObject(MODELS);
        ai.models().forEach((id, state) -> writeModelState(models.putObject(id), state));
        ArrayNode order = aiNode.putArray(FALLBACK_ORDER);
        ai.fallbackOrder().forEach(order::add);

        config.sections().forEach((name, value) -> root.set(name, mapper.valueToTree(value)));
        return root;
    }

    /**
     * Overlays the fields present in {@code node} onto {@code base}. Blank model names and API URLs
     * keep the base value; unknown health values become {@code unknown}.
     */
    ModelState mergeModelState(ModelState base, JsonNode node) {
        if (node == null || !node.isObject()) {
            return base;
        }
        String apiKey = node.path("apiKey").isTextual() ? node.get("apiKey").asText() : base.apiKey();
        String modelName = nonBlankText(node.path("modelName")).orElse(base.modelName());
        String apiUrl = nonBlankText(node.path("apiUrl")).orElse(base.apiUrl());
        HealthStatus status = node.has("healthStatus")
                ? HealthStatus.fromValue(node.path("healthStatus").asText(null))
                : base.healthStatus();
        Long lastCheck = node.path("lastHealthCheck").isNumber()
                ? Long.valueOf(node.get("lastHealthCheck").asLong())
                : base.lastHealthCheck();
        String lastError = node.path("lastErrorMessage").isTextual()
                ? node.get("lastErrorMessage").asText()
                : base.lastErrorMessage();
        return new ModelState(apiKey, modelName, apiUrl, status, lastCheck, lastError);
    }

    /** Text values of a JSON array, skipping non-text entries; empty for a missing array. */
    List<String> readTextArray(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual()) {
                    values.add(element.asText());
                }
            }
        }
        return values;
    }

    /** Every top-level section except {@code version} and {@code aiConfig}, in document order. */
    Map<String, Object> readSections(ObjectNode root) {
        Map<String, Object> sections = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!VERSION.equals(field.getKey()) && !AI_CONFIG.equals(field.getKey())) {
                sections.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        }
        return sections;
    }

    private static void writeModelState(ObjectNode node, ModelState state) {
        node.put("apiKey", state.apiKey());
        node.put("modelName", state.modelName());
        node.put("apiUrl", state.apiUrl());
        node.put("healthStatus", state.healthStatus().value());
        if (state.lastHealthCheck() == null) {
            node.putNull("lastHealthCheck");
        } else {
            node.put("lastHealthCheck", state.lastHealthCheck().longValue());
        }
        node.put("lastErrorMessage", state.lastErrorMessage());
    }

    private static Optional<String> nonBlankText(JsonNode node) {
        if (node != null && node.isTextual() && !node.asText().isBlank()) {
            return Optional.of(node.asText());
        }
        return Optional.empty();
    }
}
