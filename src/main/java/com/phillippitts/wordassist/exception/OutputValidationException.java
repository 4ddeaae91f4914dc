package com.phillippitts.wordassist.exception;

import java.util.List;

/**
 * Thrown when AI output parses as JSON but does not fit the requested field schema:
 * it names fields outside the allowed list, or every allowed field is empty.
 */
public class OutputValidationException extends WordAssistException {

    private final List<String> invalidFields;

    public OutputValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
        this.invalidFields = List.of();
    }

    public OutputValidationException(String message, List<String> invalidFields) {
        super(ErrorKind.VALIDATION, message + " (invalid fields: " + String.join(", ", invalidFields) + ")");
        this.invalidFields = List.copyOf(invalidFields);
    }

    public List<String> getInvalidFields() {
        return invalidFields;
    }
}
