package com.delta.leadgen.leads.retry;

import java.time.Duration;

/**
 * Emitted before each backoff sleep. {@code attempt} is the attempt that just failed.
 */
public record RetryAttempt(
    String operation,
    int attempt,
    int maxAttempts,
    FailureClass failureClass,
    Duration delay,
    String errorMessage
) {
}
