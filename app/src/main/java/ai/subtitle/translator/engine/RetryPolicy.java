package ai.subtitle.translator.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempts per provider, per-call timeout and the rate-limit backoff curve.
 */
public record RetryPolicy(int maxAttempts,
                          Duration callTimeout,
                          int initialBackoffSeconds,
                          int maxBackoffSeconds,
                          double jitterFactor) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(120);
    public static final int DEFAULT_INITIAL_BACKOFF_SECONDS = 2;
    public static final int DEFAULT_MAX_BACKOFF_SECONDS = 60;
    public static final double DEFAULT_JITTER_FACTOR = 0.3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        if (initialBackoffSeconds < 0) {
            throw new IllegalArgumentException("initialBackoffSeconds must be zero or greater");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_CALL_TIMEOUT, DEFAULT_INITIAL_BACKOFF_SECONDS,
                DEFAULT_MAX_BACKOFF_SECONDS, DEFAULT_JITTER_FACTOR);
    }
}
