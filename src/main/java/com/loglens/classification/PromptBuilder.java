package com.loglens.classification;

import java.util.List;

/**
 * Renders the classifier prompt for one log line.
 */
public class PromptBuilder {
    
    static final int MAX_CONTEXT_LINES = 5;
    
    static final String CLASSES = "Normal Operation, Configuration Issue, Performance Problem, Security Issue, "
        + "System Error, Network Issue, Database Error, Application Error, Resource Issue, Unknown";
    
    /**
     * Context block as sent to the classifier, empty when there is no context.
     */
    public String summarizeContext(List<String> contextLines) {
        if (contextLines.isEmpty()) {
            return "";
        }
        List<String> shown = contextLines.subList(0, Math.min(MAX_CONTEXT_LINES, contextLines.size()));
        return "\nContext (" + contextLines.size() + " logs):\n" + String.join("\n", shown);
    }
    
    public String build(String logLine, List<String> contextLines, LogAnalysis analysis, ContextAnalysis context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze this log line and classify it as anomaly or normal. ")
            .append("Consider severity, patterns, and context.\n\n")
            .append("Log line: ").append(logLine).append('\n');
        
        if (analysis != null) {
            prompt.append("\nAnalysis:\n")
                .append("- Severity: ").append(analysis.getSeverity()).append('\n')
                .append("- Component: ").append(analysis.getComponent()).append('\n')
                .append("- Action: ").append(analysis.getAction()).append('\n')
                .append("- Error Type: ").append(analysis.getErrorType()).append('\n')
                .append("- Patterns: ").append(analysis.getPatterns().isEmpty()
                    ? "none" : String.join(", ", analysis.getPatterns())).append('\n');
            if (analysis.isStartupRelated()) {
                prompt.append("- Startup related: yes\n");
            }
        }
        
        if (context != null && !contextLines.isEmpty()) {
            prompt.append("\nContext Analysis:\n")
                .append("- Similar Log Count: ").append(context.getRepetitionCount()).append('\n')
                .append("- Severity Distribution: ").append(context.getSeverityDistribution()).append('\n')
                .append("- Related Components: ").append(String.join(", ", context.getRelatedComponents()))
                .append('\n');
        }
        
        prompt.append(summarizeContext(contextLines));
        
        prompt.append("\n\nClassify this log and answer in exactly this format:\n")
            .append("CLASSIFICATION: one of ").append(CLASSES).append('\n')
            .append("REASON: brief explanation of the classification\n")
            .append("TAGS: 2-3 comma-separated tags from ")
            .append(String.join(", ", ResponseParser.VALID_TAGS)).append('\n');
        return prompt.toString();
    }
}
