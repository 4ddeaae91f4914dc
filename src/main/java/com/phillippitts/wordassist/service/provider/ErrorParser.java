package com.phillippitts.wordassist.service.provider;

import org.json.JSONObject;

/** Describes a non-2xx response; {@code body} is null when the response was not JSON. */
@FunctionalInterface
public interface ErrorParser {
    String describe(JSONObject body, int status, String statusText);
}
