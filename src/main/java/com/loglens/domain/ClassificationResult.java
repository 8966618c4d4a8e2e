package com.loglens.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed classifier verdict for one candidate.
 */
public class ClassificationResult {
    
    private final String classification;
    private final String reason;
    private final List<String> tags;
    private final long tokensUsed;
    
    public ClassificationResult(String classification, String reason, List<String> tags) {
        this(classification, reason, tags, 0L);
    }
    
    public ClassificationResult(String classification, String reason, List<String> tags, long tokensUsed) {
        this.classification = classification;
        this.reason = reason;
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        this.tokensUsed = tokensUsed;
    }
    
    public ClassificationResult withTokensUsed(long tokens) {
        return new ClassificationResult(classification, reason, tags, tokens);
    }
    
    public String getClassification() {
        return classification;
    }
    
    public String getReason() {
        return reason;
    }
    
    public List<String> getTags() {
        return tags;
    }
    
    public long getTokensUsed() {
        return tokensUsed;
    }
    
    @Override
    public String toString() {
        return "ClassificationResult{" + classification + ", tags=" + tags + '}';
    }
}
