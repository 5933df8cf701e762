package com.segments.domain.exception;

/**
 * Malformed table identity or request input. Raised before any query is compiled.
 */
public class ValidationException extends ReportingException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getKind() {
        return "VALIDATION_ERROR";
    }
}
