package com.phillippitts.wordassist.service.provider;

import com.phillippitts.wordassist.domain.GenerationOptions;

/**
 * Probe sent by a connection test: a tiny prompt with a small token budget.
 */
public record HealthCheck(String prompt, GenerationOptions options) {

    public static final HealthCheck DEFAULT = new HealthCheck(
            "This is a connection test. Reply with a short answer.",
            new GenerationOptions(0.0, 16));
}
