package com.loglens.ingestion;

/**
 * The input of a batch could not be read. Aborts that batch only.
 */
public class BatchLoadException extends RuntimeException {
    
    private final String sourceFile;
    
    public BatchLoadException(String sourceFile, String message, Throwable cause) {
        super(message + ": " + sourceFile, cause);
        this.sourceFile = sourceFile;
    }
    
    public String getSourceFile() {
        return sourceFile;
    }
}
