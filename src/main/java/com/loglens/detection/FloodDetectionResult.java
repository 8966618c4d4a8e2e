package com.loglens.detection;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.FloodSummary;

import java.util.Collections;
import java.util.List;

/**
 * Output of the flood detector: the collapsed record sequence and the
 * summaries of every collapsed run.
 */
public class FloodDetectionResult {
    
    private final List<AnnotatedRecord> records;
    private final List<FloodSummary> summaries;
    
    public FloodDetectionResult(List<AnnotatedRecord> records, List<FloodSummary> summaries) {
        this.records = records;
        this.summaries = Collections.unmodifiableList(summaries);
    }
    
    public List<AnnotatedRecord> getRecords() {
        return records;
    }
    
    public List<FloodSummary> getSummaries() {
        return summaries;
    }
    
    public boolean isFloodDetected() {
        return !summaries.isEmpty();
    }
    
    public int getRecordsCollapsed() {
        return summaries.stream().mapToInt(FloodSummary::getOccurrenceCount).sum();
    }
}
