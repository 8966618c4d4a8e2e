package com.loglens.classification.provider;

/**
 * Text returned by a classifier plus the tokens it reported using (0 when unknown).
 */
public class ClassifierReply {
    
    private final String text;
    private final long tokensUsed;
    
    public ClassifierReply(String text, long tokensUsed) {
        this.text = text;
        this.tokensUsed = tokensUsed;
    }
    
    public String getText() {
        return text;
    }
    
    public long getTokensUsed() {
        return tokensUsed;
    }
}
