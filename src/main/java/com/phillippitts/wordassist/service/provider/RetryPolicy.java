package com.phillippitts.wordassist.service.provider;

/**
 * Bounded exponential backoff without jitter.
 *
 * @param maxAttempts   total attempts including the first; values below 1 are coerced to 1
 * @param baseDelayMs   delay after the first failed attempt; negative values are coerced to 0
 * @param backoffFactor multiplier applied to each subsequent delay
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, double backoffFactor) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelayMs = Math.max(0, baseDelayMs);
        if (backoffFactor <= 0 || Double.isNaN(backoffFactor)) {
            backoffFactor = 1.0;
        }
    }

    /**
     * Delay to wait after failed attempt {@code attempt} (1-based) before the next one:
     * {@code baseDelay * backoffFactor^(attempt-1)}, rounded to the nearest millisecond.
     *
     * @param attempt number of the attempt that just failed
     * @return delay in milliseconds, 0 when the base delay is 0
     */
    public long delayAfterAttempt(int attempt) {
        if (baseDelayMs == 0) {
            return 0;
        }
        return Math.round(baseDelayMs * Math.pow(backoffFactor, Math.max(0, attempt - 1)));
    }
}
