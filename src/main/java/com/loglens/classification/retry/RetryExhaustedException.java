package com.loglens.classification.retry;

/**
 * Terminal failure of a retried call: either the error was not retryable or
 * every attempt failed. Carries the attempt history.
 */
public class RetryExhaustedException extends RuntimeException {
    
    private final transient RetryState state;
    
    public RetryExhaustedException(String message, RetryState state, Throwable cause) {
        super(message, cause);
        this.state = state;
    }
    
    public RetryState getState() {
        return state;
    }
    
    public int getAttempts() {
        return state.getAttempts();
    }
}
