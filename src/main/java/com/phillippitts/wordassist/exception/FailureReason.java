package com.phillippitts.wordassist.exception;

/**
 * Why a provider request failed, decided where the failure happens.
 */
public enum FailureReason {
    NETWORK,
    AUTHENTICATION,
    RATE_LIMITED,
    BAD_REQUEST,
    UPSTREAM,
    MALFORMED_RESPONSE;

    /**
     * Maps a non-2xx HTTP status to a reason.
     *
     * @param status HTTP status code, or a negative value when no response was received
     * @return matching reason
     */
    public static FailureReason fromStatus(int status) {
        if (status < 0) {
            return NETWORK;
        }
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status >= 500) {
            return UPSTREAM;
        }
        return BAD_REQUEST;
    }
}
