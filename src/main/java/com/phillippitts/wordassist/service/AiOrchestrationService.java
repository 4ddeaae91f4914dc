package com.phillippitts.wordassist.service;

import com.phillippitts.wordassist.domain.ConnectionTestResult;
import com.phillippitts.wordassist.domain.GenerationOptions;
import com.phillippitts.wordassist.domain.ModelState;
import com.phillippitts.wordassist.domain.ParseResult;
import com.phillippitts.wordassist.exception.WordAssistException;
import com.phillippitts.wordassist.service.config.ConfigService;
import com.phillippitts.wordassist.service.execution.RequestExecutor;
import com.phillippitts.wordassist.service.fallback.FallbackResult;
import com.phillippitts.wordassist.service.fallback.FallbackSequencer;
import com.phillippitts.wordassist.service.health.ProviderHealthRecorder;
import com.phillippitts.wordassist.service.prompt.DynamicParsingService;
import com.phillippitts.wordassist.service.prompt.PromptBuilder;
import com.phillippitts.wordassist.service.provider.HealthCheck;
import com.phillippitts.wordassist.service.provider.ProviderDescriptor;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import com.phillippitts.wordassist.service.provider.RequestBuilder;
import com.phillippitts.wordassist.service.provider.RequestContext;
import com.phillippitts.wordassist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Entry point for host code: field extraction with fallback, connection tests and raw
 * single-shot provider calls.
 */
@Service
public class AiOrchestrationService {

    private static final Logger LOG = LogManager.getLogger(AiOrchestrationService.class);

    static final String FRONT = "front";
    static final String BACK = "back";
    private static final int PREVIEW_LENGTH = 50;

    private final ProviderRegistry registry;
    private final RequestBuilder requestBuilder;
    private final RequestExecutor executor;
    private final FallbackSequencer sequencer;
    private final DynamicParsingService dynamicParsing;
    private final PromptBuilder promptBuilder;
    private final ConfigService configService;
    private final ProviderHealthRecorder healthRecorder;

    public AiOrchestrationService(ProviderRegistry registry,
                                  RequestBuilder requestBuilder,
                                  RequestExecutor executor,
                                  FallbackSequencer sequencer,
                                  DynamicParsingService dynamicParsing,
                                  PromptBuilder promptBuilder,
                                  ConfigService configService,
                                  ProviderHealthRecorder healthRecorder) {
        this.registry = Objects.requireNonNull(registry);
        this.requestBuilder = Objects.requireNonNull(requestBuilder);
        this.executor = Objects.requireNonNull(executor);
        this.sequencer = Objects.requireNonNull(sequencer);
        this.dynamicParsing = Objects.requireNonNull(dynamicParsing);
        this.promptBuilder = Objects.requireNonNull(promptBuilder);
        this.configService = Objects.requireNonNull(configService);
        this.healthRecorder = Objects.requireNonNull(healthRecorder);
    }

    /**
     * Splits text into {@code front}/{@code back} fields using the first provider that answers.
     *
     * @param text     text to parse
     * @param template optional template, may be null
     * @return fields {@code front} and {@code back} first, then any other returned fields sorted
     */
    public ParseResult parseWithFallback(String text, String template) {
        requireText(text);
        String prompt = promptBuilder.buildLegacyPrompt(text, template);
        FallbackResult result = sequencer.parseWithFallback(prompt, GenerationOptions.defaults());

        JSONObject json = result.json();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FRONT, text(json, FRONT));
        fields.put(BACK, text(json, BACK));
        for (String key : new TreeSet<>(json.keySet())) {
            fields.putIfAbsent(key, text(json, key));
        }
        return new ParseResult(fields, result.providerId());
    }

    /**
     * Extracts caller-defined fields.
     *
     * @see DynamicParsingService#runDynamicParsing(String, List, String)
     */
    public ParseResult parseWithDynamicFields(String text, List<String> fieldNames, String customTemplate) {
        requireText(text);
        return dynamicParsing.runDynamicParsing(text, fieldNames, customTemplate);
    }

    /**
     * Sends the provider's health-check probe with the given key. Never throws; the outcome is
     * also stored as the provider's health.
     *
     * @param providerId provider id or alias
     * @param apiKey     plaintext key to test
     * @param modelName  model to test, null or blank for the provider's test model
     * @return success with a preview of the answer, or failure with the error message
     */
    public ConnectionTestResult testConnection(String providerId, String apiKey, String modelName) {
        ProviderDescriptor descriptor = registry.find(providerId).orElse(null);
        if (descriptor == null) {
            return ConnectionTestResult.failed("Unknown AI provider: " + providerId);
        }
        String model = modelName == null || modelName.isBlank() ? descriptor.testModel() : modelName.trim();
        HealthCheck probe = descriptor.healthCheck();
        LOG.debug("Testing connection to provider {} (model={}, key={})", descriptor.id(), model,
                LogSanitizer.maskKey(apiKey));
        try {
            String answer = executor.execute(requestBuilder.build(descriptor,
                    new RequestContext(apiKey, model, probe.prompt(), probe.options(), storedOverride(descriptor))));
            healthRecorder.recordSuccess(descriptor.id());
            LOG.info("Connection test succeeded for provider {} (model={})", descriptor.id(), model);
            return ConnectionTestResult.ok("Connection successful: " + LogSanitizer.truncate(answer, PREVIEW_LENGTH));
        } catch (WordAssistException e) {
            healthRecorder.recordFailure(descriptor.id(), e.getMessage());
            LOG.warn("Connection test failed for provider {}: {}", descriptor.id(), e.getMessage());
            return ConnectionTestResult.failed(e.getMessage());
        }
    }

    /**
     * One call to one provider, without retry or fallback.
     *
     * @return completion text
     * @throws WordAssistException if the provider is unknown, the key or model is missing, or the
     *                             call fails
     */
    public String callProviderApi(String providerId, String apiKey, String modelName, String prompt,
                                  GenerationOptions options) {
        ProviderDescriptor descriptor = registry.require(providerId);
        return executor.execute(requestBuilder.build(descriptor,
                new RequestContext(apiKey, modelName, prompt, options, storedOverride(descriptor))));
    }

    private String storedOverride(ProviderDescriptor descriptor) {
        String storedUrl = configService.current().aiConfig().model(descriptor.id())
                .map(ModelState::apiUrl)
                .orElse("");
        return registry.resolveOverrideBaseUrl(descriptor, storedUrl).orElse(null);
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
    }

    private static String text(JSONObject json, String key) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return "";
        }
        return value instanceof String s ? s : value.toString();
    }
}
