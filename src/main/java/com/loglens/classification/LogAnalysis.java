package com.loglens.classification;

import java.util.List;

/**
 * Heuristic facts extracted from one log message before it is sent to the classifier.
 */
public class LogAnalysis {
    
    private final String severity;
    private final String component;
    private final String action;
    private final String errorType;
    private final List<String> patterns;
    private final boolean startupRelated;
    private final boolean sensitiveInfo;
    
    public LogAnalysis(String severity, String component, String action, String errorType,
                       List<String> patterns, boolean startupRelated, boolean sensitiveInfo) {
        this.severity = severity;
        this.component = component;
        this.action = action;
        this.errorType = errorType;
        this.patterns = List.copyOf(patterns);
        this.startupRelated = startupRelated;
        this.sensitiveInfo = sensitiveInfo;
    }
    
    public String getSeverity() {
        return severity;
    }
    
    public String getComponent() {
        return component;
    }
    
    public String getAction() {
        return action;
    }
    
    public String getErrorType() {
        return errorType;
    }
    
    public List<String> getPatterns() {
        return patterns;
    }
    
    public boolean isStartupRelated() {
        return startupRelated;
    }
    
    public boolean isSensitiveInfo() {
        return sensitiveInfo;
    }
}
