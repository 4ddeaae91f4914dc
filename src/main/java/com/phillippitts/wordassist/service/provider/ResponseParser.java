package com.phillippitts.wordassist.service.provider;

import org.json.JSONObject;

/** Extracts completion text from a successful response body; returns null when absent. */
@FunctionalInterface
public interface ResponseParser {
    String parse(JSONObject data);
}
