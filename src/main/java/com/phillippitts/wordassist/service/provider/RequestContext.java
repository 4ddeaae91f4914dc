package com.phillippitts.wordassist.service.provider;

import com.phillippitts.wordassist.domain.GenerationOptions;

/**
 * Inputs of a single provider call.
 *
 * @param apiKey          plaintext API key
 * @param modelName       resolved model name
 * @param prompt          full prompt text
 * @param options         generation overrides, null for defaults
 * @param overrideBaseUrl replaces the provider base URL when non-blank, may be null
 */
public record RequestContext(
        String apiKey,
        String modelName,
        String prompt,
        GenerationOptions options,
        String overrideBaseUrl
) {

    public RequestContext {
        options = options == null ? GenerationOptions.defaults() : options;
    }

    public RequestContext(String apiKey, String modelName, String prompt, GenerationOptions options) {
        this(apiKey, modelName, prompt, options, null);
    }
}
