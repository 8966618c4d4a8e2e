package com.loglens.detection.behavioral;

import com.loglens.domain.BehavioralAnomaly;

import java.util.Collections;
import java.util.List;

public class BehavioralDetectionResult {
    
    private final List<BehavioralAnomaly> anomalies;
    private final int rulesEvaluated;
    private final String skippedReason;
    
    public BehavioralDetectionResult(List<BehavioralAnomaly> anomalies, int rulesEvaluated, String skippedReason) {
        this.anomalies = Collections.unmodifiableList(anomalies);
        this.rulesEvaluated = rulesEvaluated;
        this.skippedReason = skippedReason;
    }
    
    public static BehavioralDetectionResult skipped(String reason) {
        return new BehavioralDetectionResult(List.of(), 0, reason);
    }
    
    public List<BehavioralAnomaly> getAnomalies() {
        return anomalies;
    }
    
    public int getRulesEvaluated() {
        return rulesEvaluated;
    }
    
    /** Why the engine did not run, null when it ran. */
    public String getSkippedReason() {
        return skippedReason;
    }
    
    public boolean isSkipped() {
        return skippedReason != null;
    }
}
