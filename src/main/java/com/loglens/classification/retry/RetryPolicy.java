package com.loglens.classification.retry;

import java.time.Duration;
import java.util.List;

/**
 * Retry settings for classifier calls.
 * 
 * The delay before retry n (1-based) is
 * {@code min(initialDelay * backoffFactor^(n-1), maxDelay)} plus a uniform
 * jitter of up to {@code jitter * delay} in either direction, never negative.
 */
public class RetryPolicy {
    
    public static final List<String> DEFAULT_RETRYABLE_ERRORS = List.of(
        "timeout", "connection", "rate limit", "server error",
        "HTTP 500", "HTTP 502", "HTTP 503", "HTTP 504", "too many requests", "capacity", "empty response"
    );
    
    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffFactor;
    private final double jitter;
    private final List<String> retryableErrors;
    
    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay,
                       double backoffFactor, double jitter, List<String> retryableErrors) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1] but was " + jitter);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.backoffFactor = backoffFactor;
        this.jitter = jitter;
        this.retryableErrors = retryableErrors != null && !retryableErrors.isEmpty()
            ? List.copyOf(retryableErrors)
            : DEFAULT_RETRYABLE_ERRORS;
    }
    
    /**
     * 3 attempts, 1s initial delay, factor 2, 10s cap, 10% jitter.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, 0.1,
            DEFAULT_RETRYABLE_ERRORS);
    }
    
    /**
     * Base delay before the given retry, without jitter.
     *
     * @param retry 1 for the first retry
     */
    public long baseDelayMillis(int retry) {
        double delay = initialDelay.toMillis() * Math.pow(backoffFactor, retry - 1);
        return (long) Math.min(delay, maxDelay.toMillis());
    }
    
    /**
     * Delay with jitter applied.
     *
     * @param retry 1 for the first retry
     * @param random uniform sample in [0, 1)
     */
    public long delayMillis(int retry, double random) {
        long base = baseDelayMillis(retry);
        double offset = jitter * base * (2 * random - 1);
        return Math.max(0L, Math.round(base + offset));
    }
    
    public int getMaxAttempts() {
        return maxAttempts;
    }
    
    public Duration getInitialDelay() {
        return initialDelay;
    }
    
    public Duration getMaxDelay() {
        return maxDelay;
    }
    
    public double getBackoffFactor() {
        return backoffFactor;
    }
    
    public double getJitter() {
        return jitter;
    }
    
    public List<String> getRetryableErrors() {
        return retryableErrors;
    }
}
