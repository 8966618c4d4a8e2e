package com.loglens.classification;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the context lines around a candidate.
 */
public class ContextAnalysis {
    
    private final int repetitionCount;
    private final Map<String, Integer> severityDistribution;
    private final List<String> relatedComponents;
    
    public ContextAnalysis(int repetitionCount, Map<String, Integer> severityDistribution,
                           List<String> relatedComponents) {
        this.repetitionCount = repetitionCount;
        this.severityDistribution = Map.copyOf(severityDistribution);
        this.relatedComponents = List.copyOf(relatedComponents);
    }
    
    public int getRepetitionCount() {
        return repetitionCount;
    }
    
    public Map<String, Integer> getSeverityDistribution() {
        return severityDistribution;
    }
    
    public List<String> getRelatedComponents() {
        return relatedComponents;
    }
}
