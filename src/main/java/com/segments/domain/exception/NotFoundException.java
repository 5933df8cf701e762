package com.segments.domain.exception;

/**
 * The query ran fine but the requested entity has no matching rows.
 */
public class NotFoundException extends ReportingException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getKind() {
        return "NOT_FOUND";
    }
}
