package com.loglens.report;

import com.loglens.classification.ClassificationOutcome;
import com.loglens.detection.FloodDetectionResult;
import com.loglens.detection.TemplateVolumeStats;
import com.loglens.detection.behavioral.BehavioralDetectionResult;
import com.loglens.domain.AnnotatedRecord;

import java.util.List;

/**
 * Everything the detectors produced for one batch, as handed to the report builder.
 */
public class AnalysisResults {
    
    private String sourceFile;
    private List<AnnotatedRecord> originals = List.of();
    private List<AnnotatedRecord> sequence = List.of();
    private TemplateVolumeStats volumeStats = TemplateVolumeStats.empty();
    private FloodDetectionResult floodResult;
    private int ruleBasedCount;
    private boolean behavioralEnabled;
    private BehavioralDetectionResult behavioralResult;
    private ClassificationOutcome classificationOutcome;
    private List<AggregatedAnomaly> anomalies = List.of();
    
    public String getSourceFile() {
        return sourceFile;
    }
    
    public void setSourceFile(String sourceFile) {
        this.sourceFile = sourceFile;
    }
    
    public List<AnnotatedRecord> getOriginals() {
        return originals;
    }
    
    public void setOriginals(List<AnnotatedRecord> originals) {
        this.originals = originals;
    }
    
    /**
     * The batch after flood collapsing; equal to the originals when no flood was found.
     */
    public List<AnnotatedRecord> getSequence() {
        return sequence;
    }
    
    public void setSequence(List<AnnotatedRecord> sequence) {
        this.sequence = sequence;
    }
    
    public TemplateVolumeStats getVolumeStats() {
        return volumeStats;
    }
    
    public void setVolumeStats(TemplateVolumeStats volumeStats) {
        this.volumeStats = volumeStats;
    }
    
    public FloodDetectionResult getFloodResult() {
        return floodResult;
    }
    
    public void setFloodResult(FloodDetectionResult floodResult) {
        this.floodResult = floodResult;
    }
    
    public int getRuleBasedCount() {
        return ruleBasedCount;
    }
    
    public void setRuleBasedCount(int ruleBasedCount) {
        this.ruleBasedCount = ruleBasedCount;
    }
    
    public boolean isBehavioralEnabled() {
        return behavioralEnabled;
    }
    
    public void setBehavioralEnabled(boolean behavioralEnabled) {
        this.behavioralEnabled = behavioralEnabled;
    }
    
    public BehavioralDetectionResult getBehavioralResult() {
        return behavioralResult;
    }
    
    public void setBehavioralResult(BehavioralDetectionResult behavioralResult) {
        this.behavioralResult = behavioralResult;
    }
    
    public ClassificationOutcome getClassificationOutcome() {
        return classificationOutcome;
    }
    
    public void setClassificationOutcome(ClassificationOutcome classificationOutcome) {
        this.classificationOutcome = classificationOutcome;
    }
    
    public List<AggregatedAnomaly> getAnomalies() {
        return anomalies;
    }
    
    public void setAnomalies(List<AggregatedAnomaly> anomalies) {
        this.anomalies = anomalies;
    }
}
