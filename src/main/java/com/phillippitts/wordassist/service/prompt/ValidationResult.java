package com.phillippitts.wordassist.service.prompt;

import org.json.JSONObject;

import java.util.List;

/**
 * Result of checking AI output against a field schema.
 *
 * @param valid         true when the output names no field outside the schema
 * @param parsedData    parsed output, null when parsing failed
 * @param invalidFields output fields not in the schema, sorted
 * @param validFields   schema fields present in the output, in schema order
 * @param hasContent    true when at least one schema field has a non-blank value
 * @param error         parse error message, null when parsing succeeded
 */
public record ValidationResult(
        boolean valid,
        JSONObject parsedData,
        List<String> invalidFields,
        List<String> validFields,
        boolean hasContent,
        String error
) {

    public ValidationResult {
        invalidFields = List.copyOf(invalidFields);
        validFields = List.copyOf(validFields);
    }

    static ValidationResult parseFailure(String error) {
        return new ValidationResult(false, null, List.of(), List.of(), false, error);
    }
}
