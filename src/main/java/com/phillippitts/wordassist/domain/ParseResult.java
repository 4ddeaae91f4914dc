package com.phillippitts.wordassist.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured fields extracted from free text, plus the provider that produced them.
 *
 * @param fields     field name to value, in the order requested
 * @param providerId provider whose answer was accepted
 */
public record ParseResult(Map<String, String> fields, String providerId) {

    public ParseResult {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
        Objects.requireNonNull(providerId, "providerId must not be null");
    }

    public String field(String name) {
        return fields.getOrDefault(name, "");
    }
}
