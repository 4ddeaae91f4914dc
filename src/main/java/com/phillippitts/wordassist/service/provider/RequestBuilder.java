package com.phillippitts.wordassist.service.provider;

import com.phillippitts.wordassist.config.properties.OrchestrationProperties;
import com.phillippitts.wordassist.exception.ProviderConfigurationException;
import com.phillippitts.wordassist.service.provider.wire.WireFormat;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Objects;

/**
 * Translates an abstract "complete this prompt" call into a provider-specific HTTP request.
 *
 * <p>Pure transformation: no network or storage access. The wire format is selected by the
 * descriptor's {@link CompatibilityMode}.
 */
@Component
public class RequestBuilder {

    static final String METHOD_POST = "POST";

    private final OrchestrationProperties props;

    public RequestBuilder(OrchestrationProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    /**
     * Builds the request for one call.
     *
     * @param descriptor provider to call
     * @param context    key, model, prompt, options and optional base URL override
     * @return request with its response and error parsers
     * @throws ProviderConfigurationException if the API key or model name is missing, or the
     *                                        resulting URL is not a valid absolute URI
     */
    public PreparedRequest build(ProviderDescriptor descriptor, RequestContext context) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(context, "context");
        if (context.apiKey() == null || context.apiKey().isBlank()) {
            throw new ProviderConfigurationException("Missing API key", descriptor.id());
        }
        if (context.modelName() == null || context.modelName().isBlank()) {
            throw new ProviderConfigurationException("Missing model name", descriptor.id());
        }
        String prompt = Objects.requireNonNull(context.prompt(), "prompt");

        WireFormat wire = descriptor.mode().wireFormat();
        String modelName = context.modelName().trim();
        double temperature = context.options().temperatureOr(props.getDefaultTemperature());
        int maxTokens = context.options().maxTokensOr(props.getDefaultMaxTokens());
        JSONObject payload = wire.payload(modelName, prompt, temperature, maxTokens);
        String url = buildUrl(descriptor.baseUrl(), context.overrideBaseUrl(), wire.endpointPath(modelName));
        requireValidUrl(url, descriptor.id());

        return new PreparedRequest(
                descriptor.id(),
                descriptor.label(),
                url,
                METHOD_POST,
                wire.headers(context.apiKey().trim()),
                payload.toString(),
                wire::extractContent,
                wire::extractError);
    }

    private static void requireValidUrl(String url, String providerId) {
        try {
            if (!URI.create(url).isAbsolute()) {
                throw new ProviderConfigurationException("Request URL is not absolute: " + url, providerId);
            }
        } catch (IllegalArgumentException e) {
            throw new ProviderConfigurationException("Invalid request URL: " + url, providerId);
        }
    }

    static String buildUrl(String baseUrl, String overrideBaseUrl, String path) {
        String base = overrideBaseUrl != null && !overrideBaseUrl.isBlank() ? overrideBaseUrl.trim() : baseUrl;
        String normalizedPath = path.startsWith("/") ? path : "/" + path;
        return ProviderRegistry.stripTrailingSlashes(base) + normalizedPath;
    }
}
