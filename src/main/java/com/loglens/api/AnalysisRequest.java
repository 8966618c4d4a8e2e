package com.loglens.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.domain.LogRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of an analysis request: a batch name and its records.
 */
public class AnalysisRequest {
    
    @JsonProperty("source")
    private String source;
    
    @JsonProperty("records")
    private List<LogRecord> records = new ArrayList<>();
    
    public AnalysisRequest() {
    }
    
    public AnalysisRequest(String source, List<LogRecord> records) {
        this.source = source;
        this.records = records;
    }
    
    public String getSource() {
        return source;
    }
    
    public void setSource(String source) {
        this.source = source;
    }
    
    public List<LogRecord> getRecords() {
        return records;
    }
    
    public void setRecords(List<LogRecord> records) {
        this.records = records;
    }
}
