package com.phillippitts.wordassist.exception;

/**
 * Thrown when a single provider HTTP call fails: network error, non-2xx status,
 * or a success body that cannot be parsed. Retried up to the provider's retry policy.
 */
public class RequestFailedException extends WordAssistException {

    /** Status used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final String providerId;
    private final int statusCode;
    private final FailureReason reason;

    public RequestFailedException(String message, String providerId, int statusCode, FailureReason reason) {
        super(ErrorKind.TRANSPORT, message + " (provider: " + providerId + ")");
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public RequestFailedException(String message, String providerId, int statusCode, FailureReason reason,
                                  Throwable cause) {
        super(ErrorKind.TRANSPORT, message + " (provider: " + providerId + ")", cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public String getProviderId() {
        return providerId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public FailureReason getReason() {
        return reason;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }
}
