package com.loglens.domain;

import java.util.Collections;
import java.util.List;

/**
 * A statistical anomaly selected for secondary classification, with the
 * neighbouring records handed to the classifier as context.
 */
public class ClassificationCandidate {
    
    private final AnnotatedRecord record;
    private final List<LogRecord> contextWindow;
    
    public ClassificationCandidate(AnnotatedRecord record, List<LogRecord> contextWindow) {
        this.record = record;
        this.contextWindow = contextWindow != null
            ? Collections.unmodifiableList(contextWindow)
            : Collections.emptyList();
    }
    
    public AnnotatedRecord getRecord() {
        return record;
    }
    
    public List<LogRecord> getContextWindow() {
        return contextWindow;
    }
}
