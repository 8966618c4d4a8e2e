package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A behavioral rule firing for one group within one time window.
 */
public class BehavioralAnomaly {
    
    @JsonProperty("rule_name")
    private String ruleName;
    
    @JsonProperty("group_key")
    private String groupKey;
    
    @JsonProperty("metric_value")
    private double metricValue;
    
    @JsonProperty("matched_record_indices")
    private List<Integer> matchedRecordIndices;
    
    @JsonProperty("reason")
    private String reason;
    
    public BehavioralAnomaly() {
        this.matchedRecordIndices = new ArrayList<>();
    }
    
    public BehavioralAnomaly(String ruleName, String groupKey, double metricValue,
                             List<Integer> matchedRecordIndices, String reason) {
        this.ruleName = ruleName;
        this.groupKey = groupKey;
        this.metricValue = metricValue;
        this.matchedRecordIndices = matchedRecordIndices != null ? matchedRecordIndices : new ArrayList<>();
        this.reason = reason;
    }
    
    public String getRuleName() {
        return ruleName;
    }
    
    public String getGroupKey() {
        return groupKey;
    }
    
    public double getMetricValue() {
        return metricValue;
    }
    
    public List<Integer> getMatchedRecordIndices() {
        return matchedRecordIndices;
    }
    
    public String getReason() {
        return reason;
    }
}
