package com.loglens.domain;

/**
 * Detector family that flagged a record.
 * DENSITY is the local-outlier-factor flavour of statistical detection.
 */
public enum AnomalySource {
    RULE_BASED("rule-based"),
    STATISTICAL("statistical"),
    DENSITY("density"),
    BEHAVIORAL("behavioral"),
    FLOOD("flood"),
    LLM("llm");
    
    private final String label;
    
    AnomalySource(String label) {
        this.label = label;
    }
    
    public String getLabel() {
        return label;
    }
    
    public boolean isStatistical() {
        return this == STATISTICAL || this == DENSITY;
    }
}
