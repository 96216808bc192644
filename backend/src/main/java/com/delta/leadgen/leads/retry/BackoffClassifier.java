package com.delta.leadgen.leads.retry;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed external call is worth retrying. Checks run in a fixed precedence:
 * overload, then rate limit, then connection; anything else is permanent. An overload message that also
 * mentions "connection" is therefore an overload. Any transport {@link IOException} counts as a connection
 * failure.
 */
public final class BackoffClassifier {
    private static final int MAX_CAUSE_DEPTH = 10;

    private static final List<String> OVERLOAD_PATTERNS = List.of("overloaded", "unavailable", "service unavailable");
    private static final List<String> RATE_LIMIT_PATTERNS = List.of("rate limit", "too many requests");
    private static final List<String> CONNECTION_PATTERNS = List.of("connection", "timeout", "network");

    private BackoffClassifier() {}

    public static FailureClass classify(Throwable error) {
        if (error == null) {
            return FailureClass.PERMANENT;
        }
        List<Throwable> chain = causeChain(error);
        Integer status = statusCode(chain);
        String message = messages(chain);

        if (Integer.valueOf(503).equals(status) || containsAny(message, OVERLOAD_PATTERNS)) {
            return FailureClass.RETRYABLE_OVERLOAD;
        }
        if (Integer.valueOf(429).equals(status)
            || hasType(chain, RateLimitedException.class)
            || containsAny(message, RATE_LIMIT_PATTERNS)) {
            return FailureClass.RETRYABLE_RATE_LIMIT;
        }
        if (isConnectionFailure(chain) || containsAny(message, CONNECTION_PATTERNS)) {
            return FailureClass.RETRYABLE_CONNECTION;
        }
        return FailureClass.PERMANENT;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static Integer statusCode(List<Throwable> chain) {
        for (Throwable t : chain) {
            if (t instanceof ExternalServiceException external && external.getStatusCode() != null) {
                return external.getStatusCode();
            }
        }
        return null;
    }

    private static String messages(List<Throwable> chain) {
        StringBuilder out = new StringBuilder();
        for (Throwable t : chain) {
            if (t.getMessage() != null) {
                out.append(t.getMessage().toLowerCase(Locale.ROOT)).append('\n');
            }
        }
        return out.toString();
    }

    private static boolean containsAny(String haystack, List<String> patterns) {
        for (String pattern : patterns) {
            if (haystack.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasType(List<Throwable> chain, Class<? extends Throwable> type) {
        for (Throwable t : chain) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    // Transport failures from HttpClient.send are often bare IOExceptions (dropped connection, EOF).
    // Jackson's exceptions are IOExceptions too but describe bad content, not a broken transport.
    private static boolean isConnectionFailure(List<Throwable> chain) {
        for (Throwable t : chain) {
            if (t instanceof JsonProcessingException) {
                continue;
            }
            // Covers SocketException, SocketTimeoutException, HttpTimeoutException and UnknownHostException.
            if (t instanceof IOException || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }
}
