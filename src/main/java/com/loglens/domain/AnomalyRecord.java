package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of the anomaly stream. Messages are already redacted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyRecord {
    
    @JsonProperty("record_id")
    private String recordId;
    
    @JsonProperty("index")
    private int index;
    
    @JsonProperty("timestamp")
    private String timestamp;
    
    @JsonProperty("message")
    private String message;
    
    @JsonProperty("source")
    private String source;
    
    @JsonProperty("template")
    private String template;
    
    @JsonProperty("anomaly_source")
    private String anomalySource;
    
    @JsonProperty("classification")
    private String classification;
    
    @JsonProperty("reason")
    private String reason;
    
    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();
    
    @JsonProperty("knn_score")
    private Double knnScore;
    
    @JsonProperty("lof_score")
    private Double lofScore;
    
    @JsonProperty("is_security_related")
    private boolean securityRelated;
    
    @JsonProperty("behavioral_rule")
    private String behavioralRule;
    
    @JsonProperty("context_logs")
    private List<String> contextLogs;
    
    public String getRecordId() {
        return recordId;
    }
    
    public void setRecordId(String recordId) {
        this.recordId = recordId;
    }
    
    public int getIndex() {
        return index;
    }
    
    public void setIndex(int index) {
        this.index = index;
    }
    
    public String getTimestamp() {
        return timestamp;
    }
    
    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }
    
    public String getMessage() {
        return message;
    }
    
    public void setMessage(String message) {
        this.message = message;
    }
    
    public String getSource() {
        return source;
    }
    
    public void setSource(String source) {
        this.source = source;
    }
    
    public String getTemplate() {
        return template;
    }
    
    public void setTemplate(String template) {
        this.template = template;
    }
    
    public String getAnomalySource() {
        return anomalySource;
    }
    
    public void setAnomalySource(String anomalySource) {
        this.anomalySource = anomalySource;
    }
    
    public String getClassification() {
        return classification;
    }
    
    public void setClassification(String classification) {
        this.classification = classification;
    }
    
    public String getReason() {
        return reason;
    }
    
    public void setReason(String reason) {
        this.reason = reason;
    }
    
    public List<String> getTags() {
        return tags;
    }
    
    public void setTags(List<String> tags) {
        this.tags = tags;
    }
    
    public Double getKnnScore() {
        return knnScore;
    }
    
    public void setKnnScore(Double knnScore) {
        this.knnScore = knnScore;
    }
    
    public Double getLofScore() {
        return lofScore;
    }
    
    public void setLofScore(Double lofScore) {
        this.lofScore = lofScore;
    }
    
    public boolean isSecurityRelated() {
        return securityRelated;
    }
    
    public void setSecurityRelated(boolean securityRelated) {
        this.securityRelated = securityRelated;
    }
    
    public String getBehavioralRule() {
        return behavioralRule;
    }
    
    public void setBehavioralRule(String behavioralRule) {
        this.behavioralRule = behavioralRule;
    }
    
    public List<String> getContextLogs() {
        return contextLogs;
    }
    
    public void setContextLogs(List<String> contextLogs) {
        this.contextLogs = contextLogs;
    }
}
