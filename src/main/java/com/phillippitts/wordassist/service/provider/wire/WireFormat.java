package com.phillippitts.wordassist.service.provider.wire;

import org.json.JSONObject;

import java.util.Map;

/**
 * Request/response translation for one provider API family.
 *
 * <p>Implementations are stateless and shared by every provider of the same compatibility mode.
 */
public interface WireFormat {

    /**
     * Path appended to the base URL, with a leading slash.
     *
     * @param modelName resolved model name
     * @return endpoint path, e.g. {@code /chat/completions}
     */
    String endpointPath(String modelName);

    /**
     * Request headers including authentication.
     *
     * @param apiKey plaintext API key
     * @return ordered header map
     */
    Map<String, String> headers(String apiKey);

    /**
     * Request body for a single user prompt.
     */
    JSONObject payload(String modelName, String prompt, double temperature, int maxTokens);

    /**
     * Extracts the completion text from a successful response body.
     *
     * @param data parsed response body
     * @return completion text, or null when the body has none
     */
    String extractContent(JSONObject data);

    /**
     * Suffix between the base URL and the API URL stored in a fresh model state.
     */
    default String apiUrlSuffix() {
        return "";
    }

    /**
     * Builds a human-readable message for a non-2xx response.
     *
     * <p>Tries {@code error.message}, then a string {@code error}, then {@code message};
     * falls back to {@code "{status} {statusText}"}.
     *
     * @param body       parsed error body, or null when the body was not JSON
     * @param status     HTTP status code
     * @param statusText HTTP reason phrase, may be null
     * @return error detail, never null
     */
    default String extractError(JSONObject body, int status, String statusText) {
        if (body != null) {
            Object error = body.opt("error");
            if (error instanceof JSONObject errorObject) {
                String message = errorObject.optString("message", "");
                if (!message.isBlank()) {
                    return message;
                }
            } else if (error instanceof String errorText && !errorText.isBlank()) {
                return errorText;
            }
            String message = body.optString("message", "");
            if (!message.isBlank()) {
                return message;
            }
        }
        String text = statusText == null ? "" : statusText;
        return (status + " " + text).trim();
    }
}
