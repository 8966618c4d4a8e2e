package com.loglens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for LogLens.
 * 
 * LogLens analyses batches of log records with layered detectors (rules,
 * template floods, embedding outliers, behavioral windows and an optional
 * external classifier) and writes a security and operational report per batch.
 */
@SpringBootApplication
public class LogLensApplication {

    /**
     * Main entry point for the LogLens application.
     * 
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(LogLensApplication.class, args);
    }
}
