package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One line of a {@code <base>_llm_candidates.jsonl} file: a classification
 * candidate saved by the prepare phase for a later classify run.
 * 
 * Messages are kept as logged so the classify run can still recognise secrets.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateRecord {
    
    @JsonProperty("index")
    private int index;
    
    @JsonProperty("timestamp")
    private String timestamp;
    
    @JsonProperty("message")
    private String message;
    
    @JsonProperty("source")
    private String source;
    
    @JsonProperty("source_file")
    private String sourceFile;
    
    @JsonProperty("knn_score")
    private Double knnScore;
    
    @JsonProperty("lof_score")
    private Double lofScore;
    
    @JsonProperty("context_logs")
    private List<String> contextLogs = new ArrayList<>();
    
    public static CandidateRecord from(ClassificationCandidate candidate, String sourceFile) {
        AnnotatedRecord record = candidate.getRecord();
        CandidateRecord line = new CandidateRecord();
        line.setIndex(record.getIndex());
        line.setTimestamp(record.getTimestamp());
        line.setMessage(record.getMessage());
        line.setSource(record.getSource());
        line.setSourceFile(sourceFile);
        line.setKnnScore(record.getAnnotation().getKnnScore());
        line.setLofScore(record.getAnnotation().getLofScore());
        line.setContextLogs(candidate.getContextWindow().stream()
            .map(LogRecord::getMessage)
            .collect(Collectors.toList()));
        return line;
    }
    
    /**
     * Rebuilds the candidate as a statistical anomaly with its context window.
     */
    public ClassificationCandidate toCandidate() {
        AnnotatedRecord record = new AnnotatedRecord(index, new LogRecord(timestamp, message, source));
        DetectionAnnotation annotation = record.getAnnotation();
        annotation.setKnnScore(knnScore);
        annotation.setLofScore(lofScore);
        annotation.setKnnAnomaly(true);
        annotation.markAnomaly(AnomalySource.STATISTICAL);
        List<LogRecord> context = new ArrayList<>();
        if (contextLogs != null) {
            for (String entry : contextLogs) {
                context.add(new LogRecord(null, entry, source));
            }
        }
        return new ClassificationCandidate(record, context);
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
    
    public String getSourceFile() {
        return sourceFile;
    }
    
    public void setSourceFile(String sourceFile) {
        this.sourceFile = sourceFile;
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
    
    public List<String> getContextLogs() {
        return contextLogs;
    }
    
    public void setContextLogs(List<String> contextLogs) {
        this.contextLogs = contextLogs;
    }
}
