package com.phillippitts.wordassist.exception;

import java.util.List;

/**
 * Thrown when every fallback candidate was attempted and failed.
 *
 * <p>The message quotes only the most recent failure. Earlier failures are available through
 * {@link #getFailures()} and in the persisted per-provider health state.
 */
public class AllProvidersFailedException extends WordAssistException {

    private final List<String> failures;

    public AllProvidersFailedException(String lastFailure, List<String> failures, Throwable cause) {
        super(ErrorKind.EXHAUSTED, "All AI providers failed: " + lastFailure, cause);
        this.failures = List.copyOf(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
