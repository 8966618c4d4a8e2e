package com.loglens.detection.behavioral;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A sliding time-window rule evaluated per group of records.
 * 
 * Example YAML:
 * <pre>
 * - name: brute_force_login
 *   type: count
 *   group_by: user
 *   window_minutes: 5
 *   threshold: 5
 *   pattern: "failed login"
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BehavioralRule {
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("type")
    private String type; // count, distinct_count or ratio
    
    @JsonProperty("group_by")
    private String groupBy;
    
    @JsonProperty("window_minutes")
    private double windowMinutes;
    
    @JsonProperty("threshold")
    private Double threshold;
    
    @JsonProperty("threshold_ratio")
    private Double thresholdRatio;
    
    @JsonProperty("field")
    private String field;
    
    @JsonProperty("pattern")
    private String pattern;
    
    @JsonProperty("description")
    private String description;
    
    public BehavioralRule() {
    }
    
    public BehavioralRule(String name, String type, String groupBy, double windowMinutes) {
        this.name = name;
        this.type = type;
        this.groupBy = groupBy;
        this.windowMinutes = windowMinutes;
    }
    
    public static BehavioralRule count(String name, String groupBy, double windowMinutes,
                                       double threshold, String pattern) {
        BehavioralRule rule = new BehavioralRule(name, "count", groupBy, windowMinutes);
        rule.setThreshold(threshold);
        rule.setPattern(pattern);
        return rule;
    }
    
    public static BehavioralRule distinctCount(String name, String groupBy, double windowMinutes,
                                               double threshold, String field) {
        BehavioralRule rule = new BehavioralRule(name, "distinct_count", groupBy, windowMinutes);
        rule.setThreshold(threshold);
        rule.setField(field);
        return rule;
    }
    
    public static BehavioralRule ratio(String name, String groupBy, double windowMinutes,
                                       double thresholdRatio, String pattern) {
        BehavioralRule rule = new BehavioralRule(name, "ratio", groupBy, windowMinutes);
        rule.setThresholdRatio(thresholdRatio);
        rule.setPattern(pattern);
        return rule;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    public String getType() {
        return type;
    }
    
    public void setType(String type) {
        this.type = type;
    }
    
    public String getGroupBy() {
        return groupBy;
    }
    
    public void setGroupBy(String groupBy) {
        this.groupBy = groupBy;
    }
    
    public double getWindowMinutes() {
        return windowMinutes;
    }
    
    public void setWindowMinutes(double windowMinutes) {
        this.windowMinutes = windowMinutes;
    }
    
    public Double getThreshold() {
        return threshold;
    }
    
    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }
    
    public Double getThresholdRatio() {
        return thresholdRatio;
    }
    
    public void setThresholdRatio(Double thresholdRatio) {
        this.thresholdRatio = thresholdRatio;
    }
    
    public String getField() {
        return field;
    }
    
    public void setField(String field) {
        this.field = field;
    }
    
    public String getPattern() {
        return pattern;
    }
    
    public void setPattern(String pattern) {
        this.pattern = pattern;
    }
    
    public String getDescription() {
        return description;
    }
    
    public void setDescription(String description) {
        this.description = description;
    }
}
