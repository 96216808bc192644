package com.delta.leadgen.leads.retry;

public class RateLimitedException extends ExternalServiceException {
    public RateLimitedException(String message) {
        super(message, 429);
    }
}
