package com.delta.leadgen.leads.retry;

public enum FailureClass {
    PERMANENT,
    RETRYABLE_OVERLOAD,
    RETRYABLE_RATE_LIMIT,
    RETRYABLE_CONNECTION;

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
