package com.delta.leadgen.leads.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientCallerTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void retriesTransientFailuresThenReturnsValue() {
        ResilientCaller caller = new ResilientCaller(RetryPolicy.defaults(), sleeper);
        AtomicInteger calls = new AtomicInteger();

        String value = caller.call("op", () -> {
            if (calls.incrementAndGet() <= 3) {
                throw new ExternalServiceException("The model is overloaded", 503);
            }
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(4);
        assertThat(sleeper.sleeps).containsExactly(
            Duration.ofSeconds(2),
            Duration.ofSeconds(4),
            Duration.ofSeconds(8)
        );
    }

    @Test
    void permanentFailureStopsAfterFirstAttempt() {
        ResilientCaller caller = new ResilientCaller(RetryPolicy.defaults(), sleeper);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> caller.call("op", () -> {
            calls.incrementAndGet();
            throw new ExternalServiceException("Invalid API key", 401);
        }))
            .isInstanceOfSatisfying(LeadGenerationException.class, e -> {
                assertThat(e.getFailureClass()).isEqualTo(FailureClass.PERMANENT);
                assertThat(e.getAttempts()).isEqualTo(1);
                assertThat(e.isCancelled()).isFalse();
                assertThat(e.getMessage()).contains("Invalid API key");
            });
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void alwaysRetryableFailureExhaustsAttempts() {
        ResilientCaller caller = new ResilientCaller(RetryPolicy.defaults(), sleeper);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> caller.call("op", () -> {
            calls.incrementAndGet();
            throw new ConnectException("Connection refused");
        }))
            .isInstanceOfSatisfying(LeadGenerationException.class, e -> {
                assertThat(e.getFailureClass()).isEqualTo(FailureClass.RETRYABLE_CONNECTION);
                assertThat(e.getAttempts()).isEqualTo(5);
                assertThat(e.getCause()).isInstanceOf(ConnectException.class);
            });
        assertThat(calls.get()).isEqualTo(5);
        assertThat(sleeper.sleeps).containsExactly(
            Duration.ofSeconds(2),
            Duration.ofSeconds(4),
            Duration.ofSeconds(8),
            Duration.ofSeconds(16)
        );
    }

    @Test
    void delaysAreCappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(8, Duration.ofSeconds(2), Duration.ofSeconds(60));
        ResilientCaller caller = new ResilientCaller(policy, sleeper);

        assertThatThrownBy(() -> caller.call("op", () -> {
            throw new RateLimitedException("slow down");
        })).isInstanceOf(LeadGenerationException.class);

        assertThat(sleeper.sleeps).containsExactly(
            Duration.ofSeconds(2),
            Duration.ofSeconds(4),
            Duration.ofSeconds(8),
            Duration.ofSeconds(16),
            Duration.ofSeconds(32),
            Duration.ofSeconds(60),
            Duration.ofSeconds(60)
        );
    }

    @Test
    void listenerSeesEachRetry() {
        ResilientCaller caller = new ResilientCaller(RetryPolicy.defaults(), sleeper);
        List<RetryAttempt> events = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();

        caller.call("Lead generation", () -> {
            if (calls.incrementAndGet() <= 2) {
                throw new RateLimitedException("Too Many Requests");
            }
            return 1;
        }, events::add);

        assertThat(events).hasSize(2);
        assertThat(events.get(0).attempt()).isEqualTo(1);
        assertThat(events.get(0).maxAttempts()).isEqualTo(5);
        assertThat(events.get(0).failureClass()).isEqualTo(FailureClass.RETRYABLE_RATE_LIMIT);
        assertThat(events.get(0).delay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(events.get(1).attempt()).isEqualTo(2);
        assertThat(events.get(1).delay()).isEqualTo(Duration.ofSeconds(4));
        assertThat(events.get(1).operation()).isEqualTo("Lead generation");
    }

    @Test
    void interruptedSleepCancelsTheCall() {
        Sleeper interrupting = duration -> {
            throw new InterruptedException("stop");
        };
        ResilientCaller caller = new ResilientCaller(RetryPolicy.defaults(), interrupting);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> caller.call("op", () -> {
            calls.incrementAndGet();
            throw new ExternalServiceException("unavailable", 503);
        }))
            .isInstanceOfSatisfying(LeadGenerationException.class, e -> {
                assertThat(e.isCancelled()).isTrue();
                assertThat(e.getAttempts()).isEqualTo(1);
                assertThat(e.getFailureClass()).isEqualTo(FailureClass.RETRYABLE_OVERLOAD);
            });
        assertThat(calls.get()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void alreadyInterruptedThreadMakesNoAttempt() {
        ResilientCaller caller = new ResilientCaller(RetryPolicy.defaults(), sleeper);
        AtomicInteger calls = new AtomicInteger();
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> caller.call("op", calls::incrementAndGet))
            .isInstanceOfSatisfying(LeadGenerationException.class, e -> assertThat(e.isCancelled()).isTrue());
        assertThat(calls.get()).isZero();
    }

    @Test
    void policyRejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(2)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5)).delayAfterAttempt(200))
            .isEqualTo(Duration.ofMillis(5));
    }

    private static final class RecordingSleeper implements Sleeper {
        private final List<Duration> sleeps = new ArrayList<>();

        @Override
        public void sleep(Duration duration) {
            sleeps.add(duration);
        }
    }
}
