package com.delta.leadgen.leads.retry;

/**
 * Terminal outcome of {@link ResilientCaller}: a permanent failure, exhausted retries, or cancellation.
 * Keeps the classification of the last failure and the number of attempts made.
 */
public class LeadGenerationException extends RuntimeException {
    private final FailureClass failureClass;
    private final int attempts;
    private final boolean cancelled;

    private LeadGenerationException(
        String message,
        FailureClass failureClass,
        int attempts,
        boolean cancelled,
        Throwable cause
    ) {
        super(message, cause);
        this.failureClass = failureClass;
        this.attempts = attempts;
        this.cancelled = cancelled;
    }

    public static LeadGenerationException permanent(String operation, int attempts, Throwable cause) {
        return new LeadGenerationException(
            operation + " failed permanently: " + describe(cause),
            FailureClass.PERMANENT,
            attempts,
            false,
            cause
        );
    }

    public static LeadGenerationException exhausted(
        String operation,
        FailureClass failureClass,
        int attempts,
        Throwable cause
    ) {
        return new LeadGenerationException(
            operation + " failed after " + attempts + " attempts (" + failureClass + "): " + describe(cause),
            failureClass,
            attempts,
            false,
            cause
        );
    }

    public static LeadGenerationException cancelled(String operation, int attempts, FailureClass lastFailure, Throwable cause) {
        return new LeadGenerationException(
            operation + " cancelled after " + attempts + " attempts",
            lastFailure,
            attempts,
            true,
            cause
        );
    }

    public FailureClass getFailureClass() {
        return failureClass;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return (message == null || message.isBlank()) ? cause.getClass().getSimpleName() : message;
    }
}
