package com.delta.leadgen.leads.retry;

import com.delta.leadgen.config.LeadGeneratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs a call against the generation service with bounded retries. Transient failures (overload, rate limit,
 * connection trouble) are retried on a capped exponential schedule; permanent failures return after the first
 * attempt. Every outcome that is not a success surfaces as {@link LeadGenerationException}.
 */
@Component
public class ResilientCaller {
    private static final Logger log = LoggerFactory.getLogger(ResilientCaller.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    @Autowired
    public ResilientCaller(LeadGeneratorProperties properties, Sleeper sleeper) {
        this(RetryPolicy.from(properties.getRetry()), sleeper);
    }

    public ResilientCaller(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public <T> T call(String operation, Callable<T> fn) {
        return call(operation, fn, RetryListener.NONE);
    }

    public <T> T call(String operation, Callable<T> fn, RetryListener listener) {
        int maxAttempts = policy.maxAttempts();
        FailureClass lastFailure = null;
        for (int attempt = 1; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw LeadGenerationException.cancelled(operation, attempt - 1, lastFailure, null);
            }
            try {
                T value = fn.call();
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}/{}", operation, attempt, maxAttempts);
                }
                return value;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw LeadGenerationException.cancelled(operation, attempt, lastFailure, e);
            } catch (Exception e) {
                FailureClass failureClass = BackoffClassifier.classify(e);
                lastFailure = failureClass;
                if (!failureClass.isRetryable()) {
                    log.warn("{} failed permanently on attempt {}: {}", operation, attempt, e.toString());
                    throw LeadGenerationException.permanent(operation, attempt, e);
                }
                if (attempt >= maxAttempts) {
                    log.warn("{} exhausted {} attempts ({}): {}", operation, attempt, failureClass, e.toString());
                    throw LeadGenerationException.exhausted(operation, failureClass, attempt, e);
                }
                Duration delay = policy.delayAfterAttempt(attempt);
                log.warn(
                    "{} attempt {}/{} failed ({}), retrying in {} ms: {}",
                    operation,
                    attempt,
                    maxAttempts,
                    failureClass,
                    delay.toMillis(),
                    e.getMessage()
                );
                listener.onRetry(new RetryAttempt(operation, attempt, maxAttempts, failureClass, delay, e.getMessage()));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw LeadGenerationException.cancelled(operation, attempt, failureClass, e);
                }
            }
        }
    }
}
