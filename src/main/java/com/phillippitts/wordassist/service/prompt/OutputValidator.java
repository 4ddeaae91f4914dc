package com.phillippitts.wordassist.service.prompt;

import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks AI output against the requested field schema. Never throws for bad input: a parse
 * failure is reported as an invalid result carrying the parse error.
 */
@Component
public class OutputValidator {

    /**
     * @param output         raw output text or an already-parsed {@link JSONObject}
     * @param expectedFields allowed field names
     * @return validation result
     */
    public ValidationResult validateAIOutput(Object output, List<String> expectedFields) {
        JSONObject parsed;
        try {
            parsed = output instanceof JSONObject json ? json : new JSONObject(String.valueOf(output));
        } catch (JSONException e) {
            return ValidationResult.parseFailure("JSON parse failed: " + e.getMessage());
        }

        List<String> invalid = new ArrayList<>();
        for (String key : parsed.keySet()) {
            if (!expectedFields.contains(key)) {
                invalid.add(key);
            }
        }
        Collections.sort(invalid);

        List<String> valid = new ArrayList<>();
        boolean hasContent = false;
        for (String field : expectedFields) {
            if (parsed.has(field)) {
                valid.add(field);
                hasContent |= !valueAsText(parsed, field).isBlank();
            }
        }
        return new ValidationResult(invalid.isEmpty(), parsed, invalid, valid, hasContent, null);
    }

    /** String value of a field; "" for JSON null, string form for numbers and nested values. */
    static String valueAsText(JSONObject json, String field) {
        Object value = json.opt(field);
        if (value == null || JSONObject.NULL.equals(value)) {
            return "";
        }
        return value instanceof String text ? text : value.toString();
    }
}
