package com.segments.domain.exception;

/**
 * Base type for every failure the reporting core raises.
 *
 * The four subclasses are kept distinct all the way to the boundary layer,
 * which maps each of them to its own response status class.
 */
public abstract class ReportingException extends RuntimeException {

    protected ReportingException(String message) {
        super(message);
    }

    protected ReportingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable kind, surfaced in error responses.
     */
    public abstract String getKind();
}
