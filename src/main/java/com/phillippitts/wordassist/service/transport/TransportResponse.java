package com.phillippitts.wordassist.service.transport;

/**
 * Raw HTTP response of a provider call.
 *
 * @param status     HTTP status code
 * @param statusText reason phrase, may be empty
 * @param body       response body as text, "" when empty
 */
public record TransportResponse(int status, String statusText, String body) {

    public TransportResponse {
        statusText = statusText == null ? "" : statusText;
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
