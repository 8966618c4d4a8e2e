package com.loglens.report;

import java.nio.file.Path;

/**
 * Report files could not be written.
 */
public class ReportWriteException extends RuntimeException {
    
    private final transient Path path;
    
    public ReportWriteException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
    
    public Path getPath() {
        return path;
    }
}
