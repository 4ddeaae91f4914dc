package com.phillippitts.wordassist.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for provider orchestration: generation defaults, the system retry policy
 * and the retry budget of the dynamic field parsing driver.
 */
@Validated
@ConfigurationProperties(prefix = "wordassist.orchestration")
public class OrchestrationProperties {

    /** Temperature used when a call does not override it. */
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double defaultTemperature = 0.3;

    /** Max output tokens used when a call does not override it. */
    @Positive(message = "Default max tokens must be positive")
    private int defaultMaxTokens = 2000;

    /** Minimum number of dynamic parsing attempts, before the provider retry policy is considered. */
    @Min(1)
    private int dynamicRetries = 2;

    @Valid
    private Retry retry = new Retry();

    public double getDefaultTemperature() {
        return defaultTemperature;
    }

    public void setDefaultTemperature(double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    public int getDefaultMaxTokens() {
        return defaultMaxTokens;
    }

    public void setDefaultMaxTokens(int defaultMaxTokens) {
        this.defaultMaxTokens = defaultMaxTokens;
    }

    public int getDynamicRetries() {
        return dynamicRetries;
    }

    public void setDynamicRetries(int dynamicRetries) {
        this.dynamicRetries = dynamicRetries;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /**
     * System default retry policy, applied to providers that do not declare their own.
     */
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long baseDelayMs = 200;

        @DecimalMin("1.0")
        private double backoffFactor = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }
    }
}
