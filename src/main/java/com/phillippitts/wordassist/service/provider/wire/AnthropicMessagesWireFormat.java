package com.phillippitts.wordassist.service.provider.wire;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anthropic Messages API: {@code POST /messages} with {@code x-api-key} and a pinned API version.
 */
public class AnthropicMessagesWireFormat implements WireFormat {

    static final String API_VERSION = "2023-06-01";

    @Override
    public String endpointPath(String modelName) {
        return "/messages";
    }

    @Override
    public Map<String, String> headers(String apiKey) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("x-api-key", apiKey);
        headers.put("anthropic-version", API_VERSION);
        return headers;
    }

    @Override
    public JSONObject payload(String modelName, String prompt, double temperature, int maxTokens) {
        JSONObject message = new JSONObject()
                .put("role", "user")
                .put("content", prompt);
        return new JSONObject()
                .put("model", modelName)
                .put("max_tokens", maxTokens)
                .put("temperature", temperature)
                .put("messages", new JSONArray().put(message));
    }

    @Override
    public String extractContent(JSONObject data) {
        JSONArray content = data.optJSONArray("content");
        if (content == null || content.isEmpty()) {
            return null;
        }
        String first = textOf(content.optJSONObject(0));
        if (first != null) {
            return first;
        }
        for (int i = 1; i < content.length(); i++) {
            String text = textOf(content.optJSONObject(i));
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    @Override
    public String apiUrlSuffix() {
        return "/messages";
    }

    private static String textOf(JSONObject block) {
        if (block == null) {
            return null;
        }
        Object text = block.opt("text");
        return text instanceof String value && !value.isBlank() ? value : null;
    }
}
