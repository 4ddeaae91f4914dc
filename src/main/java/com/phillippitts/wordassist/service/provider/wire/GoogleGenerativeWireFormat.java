package com.phillippitts.wordassist.service.provider.wire;

import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Google Generative Language API: {@code POST /models/{model}:generateContent} with an
 * {@code x-goog-api-key} header.
 */
public class GoogleGenerativeWireFormat implements WireFormat {

    private static final double TOP_P = 0.8;
    private static final int TOP_K = 10;

    @Override
    public String endpointPath(String modelName) {
        return "/models/" + UriUtils.encodePathSegment(modelName, StandardCharsets.UTF_8) + ":generateContent";
    }

    @Override
    public Map<String, String> headers(String apiKey) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("x-goog-api-key", apiKey);
        return headers;
    }

    @Override
    public JSONObject payload(String modelName, String prompt, double temperature, int maxTokens) {
        JSONObject part = new JSONObject().put("text", prompt);
        JSONObject content = new JSONObject().put("parts", new JSONArray().put(part));
        JSONObject generationConfig = new JSONObject()
                .put("temperature", temperature)
                .put("maxOutputTokens", maxTokens)
                .put("topP", TOP_P)
                .put("topK", TOP_K);
        return new JSONObject()
                .put("contents", new JSONArray().put(content))
                .put("generationConfig", generationConfig);
    }

    @Override
    public String extractContent(JSONObject data) {
        JSONArray candidates = data.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            return null;
        }
        JSONObject candidate = candidates.optJSONObject(0);
        if (candidate == null) {
            return null;
        }
        Object content = candidate.opt("content");
        if (content instanceof JSONObject contentObject) {
            return firstText(contentObject.optJSONArray("parts"));
        }
        if (content instanceof JSONArray legacy) {
            // Older responses: content is a list of blocks, each with its own parts or text
            for (int i = 0; i < legacy.length(); i++) {
                JSONObject block = legacy.optJSONObject(i);
                if (block == null) {
                    continue;
                }
                String text = block.has("parts") ? firstText(block.optJSONArray("parts")) : nonBlank(block.opt("text"));
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    @Override
    public String apiUrlSuffix() {
        return "/models";
    }

    private static String firstText(JSONArray parts) {
        if (parts == null) {
            return null;
        }
        for (int i = 0; i < parts.length(); i++) {
            JSONObject part = parts.optJSONObject(i);
            String text = part == null ? null : nonBlank(part.opt("text"));
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private static String nonBlank(Object value) {
        return value instanceof String text && !text.isBlank() ? text : null;
    }
}
