package com.phillippitts.wordassist.service.fallback;

import org.json.JSONObject;

/**
 * JSON answer of the first provider that succeeded.
 *
 * @param json       parsed answer
 * @param providerId provider that produced it
 */
public record FallbackResult(JSONObject json, String providerId) { }
