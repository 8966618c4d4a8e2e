package com.loglens.pipeline;

import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.CandidateRecord;
import com.loglens.domain.SiemReport;

import java.util.List;

/**
 * The report and anomaly stream produced for one batch, plus the candidates
 * saved for a later classify run when classification runs in the prepare phase.
 */
public class BatchReport {
    
    private final SiemReport report;
    private final List<AnomalyRecord> anomalies;
    private final List<CandidateRecord> pendingCandidates;
    
    public BatchReport(SiemReport report, List<AnomalyRecord> anomalies) {
        this(report, anomalies, List.of());
    }
    
    public BatchReport(SiemReport report, List<AnomalyRecord> anomalies, List<CandidateRecord> pendingCandidates) {
        this.report = report;
        this.anomalies = List.copyOf(anomalies);
        this.pendingCandidates = List.copyOf(pendingCandidates);
    }
    
    public SiemReport getReport() {
        return report;
    }
    
    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }
    
    public List<CandidateRecord> getPendingCandidates() {
        return pendingCandidates;
    }
}
