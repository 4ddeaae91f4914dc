package com.phillippitts.wordassist.service.prompt;

import com.phillippitts.wordassist.config.properties.OrchestrationProperties;
import com.phillippitts.wordassist.domain.GenerationOptions;
import com.phillippitts.wordassist.domain.ParseResult;
import com.phillippitts.wordassist.exception.AllProvidersFailedException;
import com.phillippitts.wordassist.exception.NoProvidersAvailableException;
import com.phillippitts.wordassist.exception.OutputValidationException;
import com.phillippitts.wordassist.exception.WordAssistException;
import com.phillippitts.wordassist.service.config.ConfigService;
import com.phillippitts.wordassist.service.fallback.FallbackResult;
import com.phillippitts.wordassist.service.fallback.FallbackSequencer;
import com.phillippitts.wordassist.service.provider.ProviderDescriptor;
import com.phillippitts.wordassist.service.provider.ProviderRegistry;
import com.phillippitts.wordassist.service.provider.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts a caller-defined set of fields from free text.
 *
 * <p>Each attempt runs the whole fallback chain and validates the answer against the field list.
 * Later attempts use a lower temperature. Output naming unknown fields, or with every allowed
 * field empty, is retried like a provider failure.
 */
@Service
public class DynamicParsingService {

    private static final Logger LOG = LogManager.getLogger(DynamicParsingService.class);

    static final double START_TEMPERATURE = 0.3;
    static final double MIN_TEMPERATURE = 0.1;

    private final FallbackSequencer sequencer;
    private final PromptBuilder promptBuilder;
    private final OutputValidator validator;
    private final ProviderRegistry registry;
    private final ConfigService configService;
    private final OrchestrationProperties props;

    public DynamicParsingService(FallbackSequencer sequencer, PromptBuilder promptBuilder, OutputValidator validator,
                                 ProviderRegistry registry, ConfigService configService,
                                 OrchestrationProperties props) {
        this.sequencer = Objects.requireNonNull(sequencer);
        this.promptBuilder = Objects.requireNonNull(promptBuilder);
        this.validator = Objects.requireNonNull(validator);
        this.registry = Objects.requireNonNull(registry);
        this.configService = Objects.requireNonNull(configService);
        this.props = Objects.requireNonNull(props);
    }

    /**
     * @param text       user input
     * @param fieldNames allowed output fields; non-empty, no blank or duplicate names
     * @param template   custom template, may be null
     * @return the allowed fields present in the answer, in {@code fieldNames} order
     * @throws IllegalArgumentException      if {@code fieldNames} is invalid
     * @throws NoProvidersAvailableException if no provider is configured
     * @throws WordAssistException           the last failure once all attempts are used
     */
    public ParseResult runDynamicParsing(String text, List<String> fieldNames, String template) {
        checkFieldNames(fieldNames);
        String prompt = promptBuilder.buildIntegratedPrompt(text, fieldNames, template);
        int attempts = attemptBudget();

        WordAssistException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            double temperature = temperatureFor(attempt);
            try {
                FallbackResult result = sequencer.parseWithFallback(prompt, GenerationOptions.withTemperature(temperature));
                return toParseResult(result, fieldNames);
            } catch (OutputValidationException | AllProvidersFailedException e) {
                last = e;
                LOG.warn("Dynamic parsing attempt {}/{} failed (temperature={}): {}",
                        attempt, attempts, temperature, e.getMessage());
            }
        }
        throw last;
    }

    /** {@code max(0.1, 0.3 - 0.1 * (attempt - 1))}, rounded to one decimal. */
    static double temperatureFor(int attempt) {
        double raw = START_TEMPERATURE - 0.1 * (attempt - 1);
        return Math.max(MIN_TEMPERATURE, Math.round(raw * 10) / 10.0);
    }

    int attemptBudget() {
        String active = configService.current().aiConfig().provider();
        int providerAttempts = registry.find(active)
                .map(ProviderDescriptor::retryPolicy)
                .map(RetryPolicy::maxAttempts)
                .orElse(1);
        return Math.max(Math.max(1, props.getDynamicRetries()), providerAttempts);
    }

    private ParseResult toParseResult(FallbackResult result, List<String> fieldNames) {
        ValidationResult validation = validator.validateAIOutput(result.json(), fieldNames);
        if (!validation.valid()) {
            throw new OutputValidationException("AI output contains unexpected fields", validation.invalidFields());
        }
        if (!validation.hasContent()) {
            throw new OutputValidationException("AI output has no content for any requested field");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (String field : validation.validFields()) {
            fields.put(field, OutputValidator.valueAsText(validation.parsedData(), field));
        }
        return new ParseResult(fields, result.providerId());
    }

    private static void checkFieldNames(List<String> fieldNames) {
        if (fieldNames == null || fieldNames.isEmpty()) {
            throw new IllegalArgumentException("fieldNames must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (String name : fieldNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("fieldNames must not contain blank names");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate field name: " + name);
            }
        }
    }
}
