package com.loglens.domain;

/**
 * A log record together with its detection state and its position in the
 * original batch. Synthetic flood records carry the index of the first record
 * they replaced.
 */
public class AnnotatedRecord {
    
    private final int index;
    private LogRecord record;
    private final DetectionAnnotation annotation;
    private final FloodSummary floodSummary;
    
    public AnnotatedRecord(int index, LogRecord record) {
        this(index, record, null);
    }
    
    public AnnotatedRecord(int index, LogRecord record, FloodSummary floodSummary) {
        this.index = index;
        this.record = record;
        this.annotation = new DetectionAnnotation();
        this.floodSummary = floodSummary;
    }
    
    public int getIndex() {
        return index;
    }
    
    public LogRecord getRecord() {
        return record;
    }
    
    /**
     * Assigns the mined template. Only valid once per record.
     */
    public void assignTemplate(String template) {
        this.record = record.withTemplate(template);
    }
    
    public DetectionAnnotation getAnnotation() {
        return annotation;
    }
    
    public FloodSummary getFloodSummary() {
        return floodSummary;
    }
    
    public boolean isFloodSummary() {
        return floodSummary != null;
    }
    
    public String getMessage() {
        return record.getMessage();
    }
    
    public String getTimestamp() {
        return record.getTimestamp();
    }
    
    public String getSource() {
        return record.getSource();
    }
}
