package com.loglens.classification;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Classifier counters for one batch, updated concurrently by the worker threads.
 */
public class ClassificationStatistics {
    
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong totalElapsedMillis = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong tokensUsed = new AtomicLong();
    private final AtomicLong contextsTrimmed = new AtomicLong();
    
    public void recordCall(long elapsedMillis, long tokens) {
        totalCalls.incrementAndGet();
        totalElapsedMillis.addAndGet(elapsedMillis);
        tokensUsed.addAndGet(tokens);
    }
    
    public void recordError(long elapsedMillis) {
        totalCalls.incrementAndGet();
        totalElapsedMillis.addAndGet(elapsedMillis);
        errors.incrementAndGet();
    }
    
    public void recordContextTrimmed() {
        contextsTrimmed.incrementAndGet();
    }
    
    public long getTotalCalls() {
        return totalCalls.get();
    }
    
    public long getTotalElapsedMillis() {
        return totalElapsedMillis.get();
    }
    
    public long getErrors() {
        return errors.get();
    }
    
    public long getTokensUsed() {
        return tokensUsed.get();
    }
    
    public long getContextsTrimmed() {
        return contextsTrimmed.get();
    }
    
    public double getAverageLatencyMillis() {
        long calls = totalCalls.get();
        return calls == 0 ? 0.0 : (double) totalElapsedMillis.get() / calls;
    }
}
