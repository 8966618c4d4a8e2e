package com.loglens.classification;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer view of classifier activity across batches.
 * 
 * Tracks:
 * - classifier calls and terminal errors
 * - short-circuited secret leaks
 * - tokens reported by the provider
 * - context windows dropped for size
 * - call latency including retries
 */
public class ClassificationMetrics {
    
    private final Counter calls;
    private final Counter errors;
    private final Counter shortCircuits;
    private final Counter tokens;
    private final Counter contextsTrimmed;
    private final Timer latency;
    
    public ClassificationMetrics(MeterRegistry registry) {
        this.calls = Counter.builder("loglens.classifier.calls")
            .description("Number of classifier calls made")
            .tag("component", "classification")
            .register(registry);
        
        this.errors = Counter.builder("loglens.classifier.errors")
            .description("Number of candidates whose classification failed after retries")
            .tag("component", "classification")
            .register(registry);
        
        this.shortCircuits = Counter.builder("loglens.classifier.short_circuits")
            .description("Candidates labelled as secret leaks without a classifier call")
            .tag("component", "classification")
            .register(registry);
        
        this.tokens = Counter.builder("loglens.classifier.tokens")
            .description("Tokens reported by the classifier provider")
            .tag("component", "classification")
            .register(registry);
        
        this.contextsTrimmed = Counter.builder("loglens.classifier.contexts.trimmed")
            .description("Context windows dropped to stay within the token limit")
            .tag("component", "classification")
            .register(registry);
        
        this.latency = Timer.builder("loglens.classifier.latency")
            .description("Classifier call latency including retries")
            .tag("component", "classification")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }
    
    public void recordCall(long durationMs, long tokensUsed) {
        calls.increment();
        tokens.increment(tokensUsed);
        latency.record(durationMs, TimeUnit.MILLISECONDS);
    }
    
    public void recordError(long durationMs) {
        calls.increment();
        errors.increment();
        latency.record(durationMs, TimeUnit.MILLISECONDS);
    }
    
    public void recordShortCircuit() {
        shortCircuits.increment();
    }
    
    public void recordContextTrimmed() {
        contextsTrimmed.increment();
    }
    
    public double getErrorCount() {
        return errors.count();
    }
}
