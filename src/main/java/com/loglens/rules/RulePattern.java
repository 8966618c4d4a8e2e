package com.loglens.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named regular expression with the reason reported when it matches.
 * Used both for operational rule patterns and for security-leak patterns.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RulePattern {
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("pattern")
    private String pattern;
    
    @JsonProperty("reason")
    private String reason;
    
    /**
     * Default constructor for YAML binding
     */
    public RulePattern() {
    }
    
    public RulePattern(String name, String pattern, String reason) {
        this.name = name;
        this.pattern = pattern;
        this.reason = reason;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    public String getPattern() {
        return pattern;
    }
    
    public void setPattern(String pattern) {
        this.pattern = pattern;
    }
    
    public String getReason() {
        return reason;
    }
    
    public void setReason(String reason) {
        this.reason = reason;
    }
    
    @Override
    public String toString() {
        return name + " /" + pattern + "/";
    }
}
