package com.segments.domain.exception;

/**
 * The backing store failed to execute a statement (connectivity, timeout, bad SQL).
 * Never retried at this layer.
 */
public class StoreException extends ReportingException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getKind() {
        return "STORE_ERROR";
    }
}
