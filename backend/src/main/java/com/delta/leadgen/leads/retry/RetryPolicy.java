package com.delta.leadgen.leads.retry;

import com.delta.leadgen.config.LeadGeneratorProperties;

import java.time.Duration;

/**
 * Capped exponential backoff: the delay after failed attempt {@code n} is
 * {@code min(initialDelay * 2^(n-1), maxDelay)}. No jitter.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least initialDelay");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
    }

    public static RetryPolicy from(LeadGeneratorProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.initialDelay(), retry.maxDelay());
    }

    public Duration delayAfterAttempt(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        long initialMs = initialDelay.toMillis();
        long capMs = maxDelay.toMillis();
        // 2^62 already overflows any realistic cap
        if (exponent >= 62 || initialMs > (capMs >> exponent)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(initialMs << exponent, capMs));
    }
}
