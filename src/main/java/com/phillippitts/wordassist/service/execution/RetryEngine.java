package com.phillippitts.wordassist.service.execution;

import com.phillippitts.wordassist.exception.RequestFailedException;
import com.phillippitts.wordassist.service.provider.PreparedRequest;
import com.phillippitts.wordassist.service.provider.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Runs a provider request with bounded exponential backoff.
 *
 * <p>Only {@link RequestFailedException} (transport failures) is retried; any other exception
 * propagates from the first attempt. Delays are deterministic: no jitter.
 */
@Service
public class RetryEngine {

    private static final Logger LOG = LogManager.getLogger(RetryEngine.class);

    private final RequestExecutor executor;
    private final Sleeper sleeper;

    public RetryEngine(RequestExecutor executor, Sleeper sleeper) {
        this.executor = Objects.requireNonNull(executor);
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    /**
     * Executes the request up to {@code policy.maxAttempts()} times.
     *
     * @param request prepared provider request
     * @param policy  retry policy of the provider
     * @return completion text of the first successful attempt
     * @throws RequestFailedException the last failure when every attempt failed, or the current
     *                                failure if the thread is interrupted while waiting
     */
    public String runWithRetry(PreparedRequest request, RetryPolicy policy) {
        int maxAttempts = policy.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return executor.execute(request);
            } catch (RequestFailedException e) {
                if (attempt >= maxAttempts) {
                    LOG.warn("Provider {} failed after {} attempt(s): {}", request.providerId(), attempt, e.getMessage());
                    throw e;
                }
                long delay = policy.delayAfterAttempt(attempt);
                LOG.info("Provider {} attempt {}/{} failed ({}), retrying in {} ms",
                        request.providerId(), attempt, maxAttempts, e.getReason(), delay);
                pause(delay, e);
            }
        }
    }

    private void pause(long delayMs, RequestFailedException pending) {
        if (delayMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(ie);
            throw pending;
        }
    }
}
