package com.phillippitts.wordassist.service.provider.wire;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OpenAI chat completions: {@code POST /chat/completions} with a bearer token.
 */
public class OpenAiLikeWireFormat implements WireFormat {

    @Override
    public String endpointPath(String modelName) {
        return "/chat/completions";
    }

    @Override
    public Map<String, String> headers(String apiKey) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Authorization", "Bearer " + apiKey);
        return headers;
    }

    @Override
    public JSONObject payload(String modelName, String prompt, double temperature, int maxTokens) {
        JSONObject message = new JSONObject()
                .put("role", "user")
                .put("content", prompt);
        return new JSONObject()
                .put("model", modelName)
                .put("messages", new JSONArray().put(message))
                .put("temperature", temperature)
                .put("max_tokens", maxTokens);
    }

    @Override
    public String extractContent(JSONObject data) {
        JSONArray choices = data.optJSONArray("choices");
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        JSONObject first = choices.optJSONObject(0);
        if (first == null) {
            return null;
        }
        JSONObject message = first.optJSONObject("message");
        if (message == null) {
            return null;
        }
        Object content = message.opt("content");
        return content instanceof String text ? text : null;
    }
}
