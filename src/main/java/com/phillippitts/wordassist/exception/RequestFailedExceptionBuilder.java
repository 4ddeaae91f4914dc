package com.phillippitts.wordassist.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link RequestFailedException} with contextual details.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Non-2xx response
 * throw RequestFailedExceptionBuilder.create("OpenAI GPT request failed: invalid key")
 *         .provider("openai")
 *         .status(401)
 *         .build();
 *
 * // Network failure with metadata
 * throw RequestFailedExceptionBuilder.create("Anthropic Claude request failed: connection refused")
 *         .provider("anthropic")
 *         .cause(ioException)
 *         .metadata("model", modelName)
 *         .build();
 * </pre>
 *
 * <p>When no explicit reason is set, it is derived from the status via
 * {@link FailureReason#fromStatus(int)}.
 */
public final class RequestFailedExceptionBuilder {

    private final String message;
    private String providerId;
    private int status = RequestFailedException.NO_STATUS;
    private FailureReason reason;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RequestFailedExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static RequestFailedExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RequestFailedExceptionBuilder(message);
    }

    public RequestFailedExceptionBuilder provider(String providerId) {
        this.providerId = providerId;
        return this;
    }

    /**
     * Sets the HTTP status of the failed response.
     *
     * @param status HTTP status code
     * @return this builder for chaining
     */
    public RequestFailedExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public RequestFailedExceptionBuilder reason(FailureReason reason) {
        this.reason = reason;
        return this;
    }

    public RequestFailedExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public RequestFailedExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (status={status}, {key1}={val1}, ...) (provider: {provider})
     * </pre>
     *
     * @return constructed RequestFailedException
     */
    public RequestFailedException build() {
        String detailedMessage = buildDetailedMessage();
        String provider = providerId != null ? providerId : "unknown";
        FailureReason resolved = reason != null ? reason : FailureReason.fromStatus(status);

        if (cause != null) {
            return new RequestFailedException(detailedMessage, provider, status, resolved, cause);
        } else {
            return new RequestFailedException(detailedMessage, provider, status, resolved);
        }
    }

    private String buildDetailedMessage() {
        boolean hasStatus = status != RequestFailedException.NO_STATUS;
        if (!hasStatus && metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (hasStatus) {
            sb.append("status=").append(status);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
