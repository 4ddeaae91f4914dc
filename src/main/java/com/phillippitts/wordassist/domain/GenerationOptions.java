package com.phillippitts.wordassist.domain;

/**
 * Per-call generation overrides. A null component means "use the configured default".
 *
 * @param temperature sampling temperature
 * @param maxTokens   maximum number of output tokens
 */
public record GenerationOptions(Double temperature, Integer maxTokens) {

    private static final GenerationOptions DEFAULTS = new GenerationOptions(null, null);

    public GenerationOptions {
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
    }

    public static GenerationOptions defaults() {
        return DEFAULTS;
    }

    public static GenerationOptions withTemperature(double temperature) {
        return new GenerationOptions(temperature, null);
    }

    public double temperatureOr(double fallback) {
        return temperature != null ? temperature : fallback;
    }

    public int maxTokensOr(int fallback) {
        return maxTokens != null ? maxTokens : fallback;
    }
}
