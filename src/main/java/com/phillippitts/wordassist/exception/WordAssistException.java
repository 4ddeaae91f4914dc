package com.phillippitts.wordassist.exception;

import java.util.Objects;

/**
 * Base exception for all WordAssist application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class WordAssistException extends RuntimeException {

    private final ErrorKind kind;

    public WordAssistException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public WordAssistException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
