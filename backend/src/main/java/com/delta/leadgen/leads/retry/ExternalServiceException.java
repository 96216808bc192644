package com.delta.leadgen.leads.retry;

/**
 * Failure reported by an external service. {@code statusCode} is the HTTP status when one was received.
 */
public class ExternalServiceException extends RuntimeException {
    private final Integer statusCode;

    public ExternalServiceException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExternalServiceException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
