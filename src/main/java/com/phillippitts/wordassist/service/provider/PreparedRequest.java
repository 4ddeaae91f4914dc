package com.phillippitts.wordassist.service.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Concrete HTTP request for one provider call, with the parsers for its response.
 *
 * @param providerId     canonical provider id
 * @param label          provider display label, used in error messages
 * @param url            absolute request URL
 * @param method         HTTP method
 * @param headers        request headers
 * @param body           JSON request body
 * @param responseParser extracts completion text from a 2xx body
 * @param errorParser    describes a non-2xx response
 */
public record PreparedRequest(
        String providerId,
        String label,
        String url,
        String method,
        Map<String, String> headers,
        String body,
        ResponseParser responseParser,
        ErrorParser errorParser
) {

    public PreparedRequest {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(method, "method must not be null");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        Objects.requireNonNull(responseParser, "responseParser must not be null");
        Objects.requireNonNull(errorParser, "errorParser must not be null");
    }

    /** Header names only, safe to log. */
    @Override
    public String toString() {
        return "PreparedRequest[" + method + " " + url + ", provider=" + providerId
                + ", headers=" + headers.keySet() + "]";
    }
}
