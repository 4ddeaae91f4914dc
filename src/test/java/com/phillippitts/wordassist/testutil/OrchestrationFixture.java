package com.phillippitts.wordassist.testutil;

import com.phillippitts.wordassist.config.properties.ConfigStoreProperties;
import com.phillippitts.wordassist.config.properties.OrchestrationProperties;
import com.phillippitts.wordassist.domain.AppConfig;
import com.phillippitts.wordassist.domain.ModelState;
import com.phillippitts.wordassist.service.AiOrchestrationService;
import com.phillippitts.wordassist.service.config.ApiKeyCipher;
import com.phillippitts.wordassist.service.config.ConfigCodec;
import com.phillippitts.wordassist.service.config.ConfigMigrator;
import com.phillippitts.wordassist.service.config.ConfigService;
import com.phillippitts.wordassist.service.config.EncryptedConfigStore;
import com.phillippitts.wordassist.service.execution.RequestExecutor;
import com.phillippitts.wordassist.service.execution.RetryEngine;
import com.phillippitts.wordassist.service.fallback.FallbackSequencer;
import com.phillippitts.wordassist.service.health.ProviderHealthRecorder;
import com.phillippitts.wordassist.service.metrics.ProviderMetrics;
import com.phillippitts.wordassist.service.prompt.DynamicParsingService;
import com.phillippitts.wordassist.service.prompt.OutputValidator;
import com.phillippitts.wordassist.service.prompt.PromptBuilder;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import com.phillippitts.wordassist.service.provider.RequestBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Real orchestration beans wired by hand around in-memory storage, a scripted transport and a
 * recording sleeper.
 */
public class OrchestrationFixture {

    public final OrchestrationProperties props = new OrchestrationProperties();
    public final ConfigStoreProperties storeProps = new ConfigStoreProperties();
    public final ProviderRegistry registry = new ProviderRegistry(props);
    public final InMemoryConfigBlobStore blobStore = new InMemoryConfigBlobStore();
    public final ConfigCodec codec = new ConfigCodec();
    public final ApiKeyCipher cipher = new ApiKeyCipher(registry, storeProps);
    public final ConfigMigrator migrator = new ConfigMigrator(registry, codec);
    public final EncryptedConfigStore store = new EncryptedConfigStore(blobStore, codec, migrator, cipher);
    public final ConfigService configService = new ConfigService(store, blobStore);
    public final ProviderHealthRecorder healthRecorder = new ProviderHealthRecorder(configService);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ProviderMetrics metrics = new ProviderMetrics(meterRegistry);
    public final ScriptedTransport transport = new ScriptedTransport();
    public final RecordingSleeper sleeper = new RecordingSleeper();
    public final RequestExecutor executor = new RequestExecutor(transport, metrics);
    public final RetryEngine retryEngine = new RetryEngine(executor, sleeper);
    public final RequestBuilder requestBuilder = new RequestBuilder(props);
    public final EventCapturingPublisher publisher = new EventCapturingPublisher();
    public final FallbackSequencer sequencer = new FallbackSequencer(registry, requestBuilder, retryEngine,
            configService, healthRecorder, metrics, publisher);
    public final PromptBuilder promptBuilder = new PromptBuilder();
    public final OutputValidator validator = new OutputValidator();
    public final DynamicParsingService dynamicParsing = new DynamicParsingService(sequencer, promptBuilder,
            validator, registry, configService, props);
    public final AiOrchestrationService orchestration = new AiOrchestrationService(registry, requestBuilder,
            executor, sequencer, dynamicParsing, promptBuilder, configService, healthRecorder);

    /** Stores a plaintext API key for the provider. */
    public OrchestrationFixture withKey(String providerId, String apiKey) {
        configService.update(config -> config.withAiConfig(config.aiConfig().withModel(providerId,
                config.aiConfig().model(providerId).orElseThrow().withApiKey(apiKey))));
        return this;
    }

    public OrchestrationFixture withModelName(String providerId, String modelName) {
        configService.update(config -> config.withAiConfig(config.aiConfig().withModel(providerId,
                config.aiConfig().model(providerId).orElseThrow().withModelName(modelName))));
        return this;
    }

    /** Stores a user-edited API URL, as shown in settings; a non-default value acts as a proxy override. */
    public OrchestrationFixture withApiUrl(String providerId, String apiUrl) {
        configService.update(config -> config.withAiConfig(config.aiConfig().withModel(providerId,
                config.aiConfig().model(providerId).orElseThrow().withApiUrl(apiUrl))));
        return this;
    }

    public OrchestrationFixture withFallbackOrder(List<String> order) {
        configService.update(config -> config.withAiConfig(config.aiConfig().withFallbackOrder(order)));
        return this;
    }

    public OrchestrationFixture withActiveProvider(String providerId) {
        configService.update(config -> config.withAiConfig(config.aiConfig().withProvider(providerId)));
        return this;
    }

    public ModelState state(String providerId) {
        return configService.current().aiConfig().model(providerId).orElseThrow();
    }

    public AppConfig config() {
        return configService.current();
    }

    /** Body of a successful OpenAI chat completion answering {@code content}. */
    public static String openAiAnswer(String content) {
        return new JSONObject()
                .put("choices", new JSONArray()
                        .put(new JSONObject().put("message",
                                new JSONObject().put("role", "assistant").put("content", content))))
                .toString();
    }

    /** Body of a successful Gemini generateContent call answering {@code content}. */
    public static String googleAnswer(String content) {
        return new JSONObject()
                .put("candidates", new JSONArray()
                        .put(new JSONObject().put("content", new JSONObject()
                                .put("parts", new JSONArray()
                                        .put(new JSONObject().put("text", content))))))
                .toString();
    }

    /** Body of a successful Anthropic messages call answering {@code content}. */
    public static String anthropicAnswer(String content) {
        return new JSONObject()
                .put("content", new JSONArray()
                        .put(new JSONObject().put("type", "text").put("text", content)))
                .toString();
    }
}
