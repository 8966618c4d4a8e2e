package com.loglens.classification.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs calls under a {@link RetryPolicy} using a resilience4j {@link Retry}.
 * 
 * A failure is retryable when the message of the exception, or of any cause,
 * contains one of the policy's keywords (case-insensitive). Anything else
 * fails after a single attempt.
 */
public class RetryExecutor {
    
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
    
    private final RetryPolicy policy;
    private final RetryConfig retryConfig;
    
    public RetryExecutor(RetryPolicy policy) {
        this(policy, () -> ThreadLocalRandom.current().nextDouble());
    }
    
    RetryExecutor(RetryPolicy policy, DoubleSupplier random) {
        this.policy = policy;
        IntervalFunction backoff = retry -> policy.delayMillis(retry, random.getAsDouble());
        this.retryConfig = RetryConfig.custom()
            .maxAttempts(policy.getMaxAttempts())
            .intervalFunction(backoff)
            .retryOnException(this::isRetryable)
            .build();
    }
    
    /**
     * Executes the call, retrying transient failures.
     *
     * @param name label for logging
     * @param call the operation
     * @return the call's result
     * @throws RetryExhaustedException when the call fails terminally
     */
    public <T> T execute(String name, Supplier<T> call) {
        return execute(name, call, new RetryState());
    }
    
    public <T> T execute(String name, Supplier<T> call, RetryState state) {
        Retry retry = Retry.of(name, retryConfig);
        retry.getEventPublisher().onRetry(event ->
            log.debug("Retrying {} (attempt {}) after {}ms: {}", name, event.getNumberOfRetryAttempts() + 1,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        
        Supplier<T> attempt = () -> {
            state.beginAttempt();
            try {
                return call.get();
            } catch (RuntimeException e) {
                state.recordFailure(e);
                throw e;
            }
        };
        
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (RuntimeException e) {
            String kind = isRetryable(e) ? "exhausted after" : "not retryable, gave up after";
            log.warn("{} {} {} attempt(s): {}", name, kind, state.getAttempts(), e.getMessage());
            throw new RetryExhaustedException(name + " failed after " + state.getAttempts()
                + " attempt(s): " + e.getMessage(), state, e);
        }
    }
    
    /**
     * @return true when the error or one of its causes mentions a retryable keyword
     */
    public boolean isRetryable(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String keyword : policy.getRetryableErrors()) {
                    if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                        return true;
                    }
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
    
    public RetryPolicy getPolicy() {
        return policy;
    }
}
