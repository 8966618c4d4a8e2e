package com.loglens.classification;

/**
 * Tunables of the classification stage.
 */
public class ClassificationSettings {
    
    private int concurrency = 10;
    private int topN = 10;
    private int maxLogLength = 512;
    private int maxTotalTokens = 2048;
    private int contextWindow = 5;
    private boolean dependentFilterEnabled = true;
    private ClassificationPhase phase = ClassificationPhase.FULL;
    
    public int getConcurrency() {
        return concurrency;
    }
    
    public ClassificationSettings setConcurrency(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be >= 1: " + concurrency);
        }
        this.concurrency = concurrency;
        return this;
    }
    
    public int getTopN() {
        return topN;
    }
    
    public ClassificationSettings setTopN(int topN) {
        this.topN = topN;
        return this;
    }
    
    public int getMaxLogLength() {
        return maxLogLength;
    }
    
    public ClassificationSettings setMaxLogLength(int maxLogLength) {
        this.maxLogLength = maxLogLength;
        return this;
    }
    
    public int getMaxTotalTokens() {
        return maxTotalTokens;
    }
    
    public ClassificationSettings setMaxTotalTokens(int maxTotalTokens) {
        this.maxTotalTokens = maxTotalTokens;
        return this;
    }
    
    public int getContextWindow() {
        return contextWindow;
    }
    
    public ClassificationSettings setContextWindow(int contextWindow) {
        this.contextWindow = contextWindow;
        return this;
    }
    
    public boolean isDependentFilterEnabled() {
        return dependentFilterEnabled;
    }
    
    public ClassificationSettings setDependentFilterEnabled(boolean dependentFilterEnabled) {
        this.dependentFilterEnabled = dependentFilterEnabled;
        return this;
    }
    
    public ClassificationPhase getPhase() {
        return phase;
    }
    
    public ClassificationSettings setPhase(ClassificationPhase phase) {
        this.phase = phase != null ? phase : ClassificationPhase.FULL;
        return this;
    }
}
