package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Summary of a run of near-identical records collapsed by the flood detector.
 */
public class FloodSummary {
    
    @JsonProperty("template")
    private String template;
    
    @JsonProperty("occurrence_count")
    private int occurrenceCount;
    
    @JsonProperty("dominant_severity")
    private String dominantSeverity; // error, warning or unknown
    
    @JsonProperty("components")
    private Set<String> components;
    
    @JsonProperty("variable_tokens")
    private List<String> variableTokens;
    
    @JsonProperty("start_index")
    private int startIndex;
    
    @JsonProperty("end_index")
    private int endIndex;
    
    public FloodSummary() {
        this.components = new LinkedHashSet<>();
        this.variableTokens = new ArrayList<>();
    }
    
    public FloodSummary(String template, int occurrenceCount, String dominantSeverity,
                        Set<String> components, List<String> variableTokens,
                        int startIndex, int endIndex) {
        this.template = template;
        this.occurrenceCount = occurrenceCount;
        this.dominantSeverity = dominantSeverity;
        this.components = components != null ? components : new LinkedHashSet<>();
        this.variableTokens = variableTokens != null ? variableTokens : new ArrayList<>();
        this.startIndex = startIndex;
        this.endIndex = endIndex;
    }
    
    @JsonIgnore
    public boolean isErrorSeverity() {
        return "error".equals(dominantSeverity);
    }
    
    public String getTemplate() {
        return template;
    }
    
    public void setTemplate(String template) {
        this.template = template;
    }
    
    public int getOccurrenceCount() {
        return occurrenceCount;
    }
    
    public void setOccurrenceCount(int occurrenceCount) {
        this.occurrenceCount = occurrenceCount;
    }
    
    public String getDominantSeverity() {
        return dominantSeverity;
    }
    
    public void setDominantSeverity(String dominantSeverity) {
        this.dominantSeverity = dominantSeverity;
    }
    
    public Set<String> getComponents() {
        return components;
    }
    
    public void setComponents(Set<String> components) {
        this.components = components;
    }
    
    public List<String> getVariableTokens() {
        return variableTokens;
    }
    
    public void setVariableTokens(List<String> variableTokens) {
        this.variableTokens = variableTokens;
    }
    
    public int getStartIndex() {
        return startIndex;
    }
    
    public void setStartIndex(int startIndex) {
        this.startIndex = startIndex;
    }
    
    public int getEndIndex() {
        return endIndex;
    }
    
    public void setEndIndex(int endIndex) {
        this.endIndex = endIndex;
    }
}
