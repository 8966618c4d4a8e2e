package com.loglens.classification.retry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Attempt bookkeeping for one retried call.
 */
public class RetryState {
    
    private final long startNanos = System.nanoTime();
    private int attempts;
    private Throwable lastError;
    private final List<Attempt> history = new ArrayList<>();
    
    synchronized void beginAttempt() {
        attempts++;
    }
    
    synchronized void recordFailure(Throwable error) {
        lastError = error;
        history.add(new Attempt(attempts, String.valueOf(error.getMessage()), elapsedMillis()));
    }
    
    public synchronized int getAttempts() {
        return attempts;
    }
    
    public synchronized Throwable getLastError() {
        return lastError;
    }
    
    public synchronized List<Attempt> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
    
    public long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
    
    public static class Attempt {
        private final int attempt;
        private final String error;
        private final long elapsedMillis;
        
        Attempt(int attempt, String error, long elapsedMillis) {
            this.attempt = attempt;
            this.error = error;
            this.elapsedMillis = elapsedMillis;
        }
        
        public int getAttempt() {
            return attempt;
        }
        
        public String getError() {
            return error;
        }
        
        public long getElapsedMillis() {
            return elapsedMillis;
        }
    }
}
