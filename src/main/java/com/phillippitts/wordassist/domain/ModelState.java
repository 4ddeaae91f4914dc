package com.phillippitts.wordassist.domain;

/**
 * Per-provider state inside the configuration.
 *
 * <p>{@code apiKey} is plaintext in memory and ciphertext on disk; the config store converts
 * between the two. Null strings are normalized to "" and a null status to {@link HealthStatus#UNKNOWN}.
 *
 * @param apiKey           API key, "" when not configured
 * @param modelName        model override, "" to use the provider default
 * @param apiUrl           API URL shown to the user; differs from the default when a proxy is configured
 * @param healthStatus     verdict of the most recent call
 * @param lastHealthCheck  epoch millis of the most recent call, or null if never checked
 * @param lastErrorMessage message of the most recent failure, "" after a success
 */
public record ModelState(
        String apiKey,
        String modelName,
        String apiUrl,
        HealthStatus healthStatus,
        Long lastHealthCheck,
        String lastErrorMessage
) {

    public ModelState {
        apiKey = apiKey == null ? "" : apiKey;
        modelName = modelName == null ? "" : modelName;
        apiUrl = apiUrl == null ? "" : apiUrl;
        healthStatus = healthStatus == null ? HealthStatus.UNKNOWN : healthStatus;
        lastErrorMessage = lastErrorMessage == null ? "" : lastErrorMessage;
    }

    /**
     * Fresh state for a provider that has never been configured.
     *
     * @param defaultApiUrl the provider's default API URL
     * @return state without key or model override
     */
    public static ModelState initial(String defaultApiUrl) {
        return new ModelState("", "", defaultApiUrl, HealthStatus.UNKNOWN, null, "");
    }

    public boolean hasApiKey() {
        return !apiKey.isBlank();
    }

    public ModelState withApiKey(String newApiKey) {
        return new ModelState(newApiKey, modelName, apiUrl, healthStatus, lastHealthCheck, lastErrorMessage);
    }

    public ModelState withModelName(String newModelName) {
        return new ModelState(apiKey, newModelName, apiUrl, healthStatus, lastHealthCheck, lastErrorMessage);
    }

    public ModelState withApiUrl(String newApiUrl) {
        return new ModelState(apiKey, modelName, newApiUrl, healthStatus, lastHealthCheck, lastErrorMessage);
    }

    /** Records a successful call at {@code checkedAt}; clears the error message. */
    public ModelState markHealthy(long checkedAt) {
        return new ModelState(apiKey, modelName, apiUrl, HealthStatus.HEALTHY, checkedAt, "");
    }

    /** Records a failed call at {@code checkedAt}. */
    public ModelState markFailed(String errorMessage, long checkedAt) {
        return new ModelState(apiKey, modelName, apiUrl, HealthStatus.ERROR, checkedAt, errorMessage);
    }
}
