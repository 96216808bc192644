package com.delta.leadgen.leads.retry;

@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = attempt -> {
    };

    void onRetry(RetryAttempt attempt);
}
