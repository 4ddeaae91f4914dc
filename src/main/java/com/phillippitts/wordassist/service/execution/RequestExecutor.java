package com.phillippitts.wordassist.service.execution;

import com.phillippitts.wordassist.exception.FailureReason;
import com.phillippitts.wordassist.exception.RequestFailedException;
import com.phillippitts.wordassist.exception.RequestFailedExceptionBuilder;
import com.phillippitts.wordassist.service.metrics.ProviderMetrics;
import com.phillippitts.wordassist.service.provider.PreparedRequest;
import com.phillippitts.wordassist.service.transport.ProviderTransport;
import com.phillippitts.wordassist.service.transport.TransportResponse;
import com.phillippitts.wordassist.util.LogSanitizer;
import com.phillippitts.wordassist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Issues one provider HTTP call and normalizes the outcome to completion text or a
 * {@link RequestFailedException}.
 *
 * <p>Steps: send; parse the body as JSON (tolerated to fail only on error statuses); describe
 * non-2xx responses with the request's error parser; extract the completion with the response
 * parser; trim and strip a wrapping Markdown code fence.
 */
@Component
public class RequestExecutor {

    private static final Logger LOG = LogManager.getLogger(RequestExecutor.class);

    private static final Pattern CODE_FENCE = Pattern.compile("^```[\\w-]*[ \\t]*\\R?(.*?)\\R?[ \\t]*```$", Pattern.DOTALL);

    private final ProviderTransport transport;
    private final ProviderMetrics metrics;

    public RequestExecutor(ProviderTransport transport, ProviderMetrics metrics) {
        this.transport = Objects.requireNonNull(transport);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Executes the request once.
     *
     * @param request prepared provider request
     * @return completion text, trimmed and without code fence
     * @throws RequestFailedException on network failure, non-2xx status, or unusable success body
     */
    public String execute(PreparedRequest request) {
        String providerId = request.providerId();
        long start = System.nanoTime();
        TransportResponse response;
        try {
            response = transport.send(request);
        } catch (IOException e) {
            metrics.incrementFailure(providerId, reasonTag(FailureReason.NETWORK));
            throw RequestFailedExceptionBuilder.create(failed(request, describe(e)))
                    .provider(providerId)
                    .reason(FailureReason.NETWORK)
                    .cause(e)
                    .build();
        }
        metrics.recordLatency(providerId, System.nanoTime() - start);
        LOG.debug("Provider {} answered status={} in {} ms", providerId, response.status(),
                TimeUtils.elapsedMillis(start));

        JSONObject data = null;
        JSONException parseError = null;
        if (!response.body().isBlank()) {
            try {
                data = new JSONObject(response.body());
            } catch (JSONException e) {
                parseError = e;
            }
        }

        if (!response.isSuccessful()) {
            String detail = request.errorParser().describe(data, response.status(), response.statusText());
            RequestFailedException failure = RequestFailedExceptionBuilder.create(failed(request, detail))
                    .provider(providerId)
                    .status(response.status())
                    .build();
            metrics.incrementFailure(providerId, reasonTag(failure.getReason()));
            throw failure;
        }

        if (data == null) {
            LOG.warn("Provider {} returned a non-JSON success body: '{}'", providerId,
                    LogSanitizer.truncate(response.body(), 120));
            throw malformed(request, response.status(), "invalid JSON response", parseError);
        }

        String content;
        try {
            content = request.responseParser().parse(data);
        } catch (JSONException e) {
            throw malformed(request, response.status(), "unexpected response shape", e);
        }
        if (content == null || content.isBlank()) {
            throw malformed(request, response.status(), "empty response", null);
        }

        metrics.incrementSuccess(providerId);
        return stripCodeFence(content.trim());
    }

    /**
     * Removes a Markdown code fence wrapping the whole text, e.g. {@code ```json\n{...}\n```}.
     */
    static String stripCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        if (matcher.matches()) {
            return matcher.group(1).trim();
        }
        return text;
    }

    private RequestFailedException malformed(PreparedRequest request, int status, String detail, Throwable cause) {
        metrics.incrementFailure(request.providerId(), reasonTag(FailureReason.MALFORMED_RESPONSE));
        RequestFailedExceptionBuilder builder = RequestFailedExceptionBuilder.create(failed(request, detail))
                .provider(request.providerId())
                .status(status)
                .reason(FailureReason.MALFORMED_RESPONSE);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    private static String failed(PreparedRequest request, String detail) {
        return request.label() + " request failed: " + detail;
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String reasonTag(FailureReason reason) {
        return reason.name().toLowerCase(Locale.ROOT);
    }
}
