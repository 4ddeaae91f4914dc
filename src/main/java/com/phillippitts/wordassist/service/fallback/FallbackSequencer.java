package com.phillippitts.wordassist.service.fallback;

import com.phillippitts.wordassist.domain.AiConfig;
import com.phillippitts.wordassist.domain.GenerationOptions;
import com.phillippitts.wordassist.domain.ModelState;
import com.phillippitts.wordassist.exception.AllProvidersFailedException;
import com.phillippitts.wordassist.exception.NoProvidersAvailableException;
import com.phillippitts.wordassist.exception.OutputValidationException;
import com.phillippitts.wordassist.exception.WordAssistException;
import com.phillippitts.wordassist.service.config.ConfigService;
import com.phillippitts.wordassist.service.execution.RetryEngine;
import com.phillippitts.wordassist.service.fallback.event.AllProvidersFailedEvent;
import com.phillippitts.wordassist.service.fallback.event.ProviderFallbackEvent;
import com.phillippitts.wordassist.service.health.ProviderHealthRecorder;
import com.phillippitts.wordassist.service.metrics.ProviderMetrics;
import com.phillippitts.wordassist.service.provider.PreparedRequest;
import com.phillippitts.wordassist.service.provider.ProviderDescriptor;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import com.phillippitts.wordassist.service.provider.RequestBuilder;
import com.phillippitts.wordassist.service.provider.RequestContext;
import com.phillippitts.wordassist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tries providers one at a time until one returns a JSON object.
 *
 * <p>Candidate order: the active provider, then the configured fallback order, then registry
 * order; each id once. Providers that are unknown or have no API key are skipped without an
 * attempt. Each attempted provider runs through {@link RetryEngine}; its outcome is persisted as
 * health state before the next candidate is tried. Providers are never called concurrently.
 */
@Service
public class FallbackSequencer {
    private static final Logger LOG = LogManager.getLogger(FallbackSequencer.class);

    private final ProviderRegistry registry;
    private final RequestBuilder requestBuilder;
    private final RetryEngine retryEngine;
    private final ConfigService configService;
    private final ProviderHealthRecorder healthRecorder;
    private final ProviderMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public FallbackSequencer(ProviderRegistry registry, RequestBuilder requestBuilder, RetryEngine retryEngine,
                             ConfigService configService, ProviderHealthRecorder healthRecorder,
                             ProviderMetrics metrics, ApplicationEventPublisher publisher) {
        this.registry = registry;
        this.requestBuilder = requestBuilder;
        this.retryEngine = retryEngine;
        this.configService = configService;
        this.healthRecorder = healthRecorder;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    /**
     * Sends the prompt to the first provider that succeeds.
     *
     * @param prompt  full prompt text
     * @param options generation overrides, null for defaults
     * @return parsed JSON answer and the provider that produced it
     * @throws NoProvidersAvailableException if no candidate could be attempted
     * @throws AllProvidersFailedException   if every attempted candidate failed; the message quotes
     *                                       the last failure only
     */
    public FallbackResult parseWithFallback(String prompt, GenerationOptions options) {
        AiConfig ai = configService.current().aiConfig();
        List<String> failures = new ArrayList<>();
        WordAssistException last = null;
        int attempted = 0;

        for (String id : candidateOrder(ai)) {
            Optional<ProviderDescriptor> descriptor = registry.find(id);
            if (descriptor.isEmpty()) {
                LOG.debug("Skipping provider {}: not registered", id);
                failures.add(id + ": unknown provider");
                continue;
            }
            ModelState state = ai.model(id).orElse(null);
            if (state == null || !state.hasApiKey()) {
                LOG.debug("Skipping provider {}: no API key configured", id);
                failures.add(id + ": no API key configured");
                continue;
            }

            attempted++;
            ThreadContext.put("provider", id);
            try {
                JSONObject json = callProvider(descriptor.get(), state, prompt, options);
                healthRecorder.recordSuccess(id);
                LOG.info("Provider {} answered (attempted={}, fields={})", id, attempted, json.length());
                return new FallbackResult(json, id);
            } catch (WordAssistException e) {
                last = e;
                failures.add(id + ": " + e.getMessage());
                LOG.warn("Provider {} failed: {}", id, e.getMessage());
                healthRecorder.recordFailure(id, e.getMessage());
                metrics.incrementFallback(id);
                publisher.publishEvent(new ProviderFallbackEvent(id, e.getKind(), e.getMessage(), Instant.now()));
            } finally {
                ThreadContext.remove("provider");
            }
        }

        if (last == null) {
            LOG.warn("No provider available: {}", failures);
            throw new NoProvidersAvailableException(failures);
        }
        publisher.publishEvent(new AllProvidersFailedEvent(attempted, last.getMessage(), Instant.now()));
        throw new AllProvidersFailedException(last.getMessage(), failures, last);
    }

    /**
     * Active provider, then configured fallback order, then registry order; aliases canonicalized,
     * duplicates removed (first occurrence wins).
     */
    List<String> candidateOrder(AiConfig ai) {
        Set<String> ids = new LinkedHashSet<>();
        String active = registry.canonicalize(ai.provider());
        if (!active.isEmpty()) {
            ids.add(active);
        }
        for (String id : ai.fallbackOrder()) {
            String canonical = registry.canonicalize(id);
            if (!canonical.isEmpty()) {
                ids.add(canonical);
            }
        }
        ids.addAll(registry.defaultFallbackOrder());
        return new ArrayList<>(ids);
    }

    /** Model override, then provider default, then the provider's test model. */
    static String resolveModel(ProviderDescriptor descriptor, ModelState state) {
        if (!state.modelName().isBlank()) {
            return state.modelName();
        }
        if (descriptor.defaultModel() != null && !descriptor.defaultModel().isBlank()) {
            return descriptor.defaultModel();
        }
        return descriptor.testModel();
    }

    private JSONObject callProvider(ProviderDescriptor descriptor, ModelState state, String prompt,
                                    GenerationOptions options) {
        RequestContext context = new RequestContext(
                state.apiKey(),
                resolveModel(descriptor, state),
                prompt,
                options,
                registry.resolveOverrideBaseUrl(descriptor, state.apiUrl()).orElse(null));
        PreparedRequest request = requestBuilder.build(descriptor, context);
        String text = retryEngine.runWithRetry(request, descriptor.retryPolicy());
        try {
            return new JSONObject(text);
        } catch (JSONException e) {
            LOG.debug("Non-JSON answer from {}: '{}'", descriptor.id(), LogSanitizer.truncate(text, 120));
            throw new OutputValidationException(descriptor.label() + " returned an answer that is not a JSON object");
        }
    }
}
