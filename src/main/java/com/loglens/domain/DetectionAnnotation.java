package com.loglens.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable per-record detection state. Detectors only add to it; the classifier
 * stage is the one place allowed to clear the anomaly flag.
 */
public class DetectionAnnotation {
    
    private boolean anomaly;
    private final Set<AnomalySource> sources = EnumSet.noneOf(AnomalySource.class);
    private String classification;
    private String reason;
    private final Set<String> tags = new LinkedHashSet<>();
    private Double knnScore;
    private Double lofScore;
    private boolean knnAnomaly;
    private boolean lofAnomaly;
    private boolean securityRelated;
    private final List<String> behavioralRules = new ArrayList<>();
    
    /**
     * Flags the record as anomalous for the given detector.
     */
    public void markAnomaly(AnomalySource source) {
        this.anomaly = true;
        this.sources.add(source);
    }
    
    public void clearAnomaly() {
        this.anomaly = false;
    }
    
    public boolean isAnomaly() {
        return anomaly;
    }
    
    public Set<AnomalySource> getSources() {
        return sources;
    }
    
    public boolean hasSource(AnomalySource source) {
        return sources.contains(source);
    }
    
    public void addSource(AnomalySource source) {
        sources.add(source);
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
    
    public Set<String> getTags() {
        return tags;
    }
    
    public void setTags(Collection<String> newTags) {
        tags.clear();
        tags.addAll(newTags);
    }
    
    public void addTag(String tag) {
        tags.add(tag);
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
    
    public boolean isKnnAnomaly() {
        return knnAnomaly;
    }
    
    public void setKnnAnomaly(boolean knnAnomaly) {
        this.knnAnomaly = knnAnomaly;
    }
    
    public boolean isLofAnomaly() {
        return lofAnomaly;
    }
    
    public void setLofAnomaly(boolean lofAnomaly) {
        this.lofAnomaly = lofAnomaly;
    }
    
    public boolean isStatisticalAnomaly() {
        return knnAnomaly || lofAnomaly;
    }
    
    public boolean isSecurityRelated() {
        return securityRelated;
    }
    
    public void setSecurityRelated(boolean securityRelated) {
        this.securityRelated = securityRelated;
    }
    
    public List<String> getBehavioralRules() {
        return behavioralRules;
    }
    
    public void addBehavioralRule(String ruleName) {
        if (!behavioralRules.contains(ruleName)) {
            behavioralRules.add(ruleName);
        }
    }
}
