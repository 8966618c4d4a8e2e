package com.loglens.ingestion;

import com.loglens.domain.LogRecord;

import java.util.List;

/**
 * Records loaded from one input file.
 */
public class LogBatch {
    
    private final String sourceFile;
    private final List<LogRecord> records;
    private final int linesRead;
    
    public LogBatch(String sourceFile, List<LogRecord> records, int linesRead) {
        this.sourceFile = sourceFile;
        this.records = List.copyOf(records);
        this.linesRead = linesRead;
    }
    
    public String getSourceFile() {
        return sourceFile;
    }
    
    public List<LogRecord> getRecords() {
        return records;
    }
    
    /**
     * Entries present in the input before empty messages were dropped and sampling applied.
     */
    public int getLinesRead() {
        return linesRead;
    }
}
