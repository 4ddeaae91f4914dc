package com.phillippitts.wordassist.exception;

import java.util.List;

/**
 * Thrown when no fallback candidate could even be attempted, typically because
 * no provider has an API key configured.
 */
public class NoProvidersAvailableException extends WordAssistException {

    private final List<String> skipped;

    public NoProvidersAvailableException(List<String> skipped) {
        super(ErrorKind.EXHAUSTED, "No AI provider available: configure an API key for at least one provider");
        this.skipped = List.copyOf(skipped);
    }

    public List<String> getSkipped() {
        return skipped;
    }
}
