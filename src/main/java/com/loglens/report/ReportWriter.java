package com.loglens.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.SiemReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes {@code <base>_summary.json} and {@code <base>_anomalies.jsonl} into the results folder.
 */
public class ReportWriter {
    
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    
    private final ObjectMapper objectMapper;
    private final Path resultsFolder;
    
    public ReportWriter(ObjectMapper objectMapper, Path resultsFolder) {
        this.objectMapper = objectMapper;
        this.resultsFolder = resultsFolder;
    }
    
    /**
     * Writes both files and records their paths in the report's outputs section.
     *
     * @throws ReportWriteException if either file cannot be written
     */
    public void write(SiemReport report, List<AnomalyRecord> anomalies, String sourceFile) {
        String base = baseName(sourceFile);
        Path summaryFile = resultsFolder.resolve(base + "_summary.json");
        Path anomaliesFile = resultsFolder.resolve(base + "_anomalies.jsonl");
        
        try {
            Files.createDirectories(resultsFolder);
        } catch (IOException e) {
            throw new ReportWriteException("Cannot create results folder", resultsFolder, e);
        }
        
        try (BufferedWriter writer = Files.newBufferedWriter(anomaliesFile, StandardCharsets.UTF_8)) {
            for (AnomalyRecord anomaly : anomalies) {
                writer.write(objectMapper.writeValueAsString(anomaly));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write anomalies", anomaliesFile, e);
        }
        
        report.getReportOutputs().setSummaryFile(summaryFile.toString());
        report.getReportOutputs().setAnomaliesFile(anomaliesFile.toString());
        report.getReportOutputs().setAnomalyCount(anomalies.size());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(summaryFile.toFile(), report);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write summary", summaryFile, e);
        }
        log.info("Saved {} anomalies to {} and summary to {}", anomalies.size(), anomaliesFile, summaryFile);
    }
    
    static String baseName(String sourceFile) {
        if (sourceFile == null || sourceFile.isEmpty()) {
            return "batch";
        }
        String name = Path.of(sourceFile).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
