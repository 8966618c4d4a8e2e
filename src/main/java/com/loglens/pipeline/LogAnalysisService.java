package com.loglens.pipeline;

import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.CandidateRecord;
import com.loglens.domain.LogRecord;
import com.loglens.ingestion.BatchLoadException;
import com.loglens.ingestion.LogBatch;
import com.loglens.ingestion.LogBatchLoader;
import com.loglens.report.CandidateFileStore;
import com.loglens.report.ReportWriteException;
import com.loglens.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads batches, runs the pipeline and writes the results, one batch per input file.
 * Also drives the classify run over candidates saved by a prepare run.
 */
public class LogAnalysisService {
    
    private static final Logger log = LoggerFactory.getLogger(LogAnalysisService.class);
    
    private final LogBatchLoader loader;
    private final AnalysisPipeline pipeline;
    private final ReportWriter writer;
    private final CandidateFileStore candidateStore;
    private final PipelineMetrics metrics;
    
    public LogAnalysisService(LogBatchLoader loader, AnalysisPipeline pipeline, ReportWriter writer,
                              CandidateFileStore candidateStore, PipelineMetrics metrics) {
        this.loader = loader;
        this.pipeline = pipeline;
        this.writer = writer;
        this.candidateStore = candidateStore;
        this.metrics = metrics;
    }
    
    /**
     * @throws BatchLoadException if the file cannot be read
     * @throws ReportWriteException if the results cannot be written
     */
    public BatchReport analyzeFile(Path file) {
        LogBatch batch = loader.load(file);
        return analyzeRecords(batch.getSourceFile(), batch.getRecords());
    }
    
    public BatchReport analyzeRecords(String sourceFile, List<LogRecord> records) {
        BatchReport result = pipeline.analyze(sourceFile, records);
        candidateStore.save(result.getPendingCandidates(), sourceFile)
            .ifPresent(file -> result.getReport().getReportOutputs().setCandidatesFile(file.toString()));
        writer.write(result.getReport(), result.getAnomalies(), sourceFile);
        return result;
    }
    
    /**
     * Analyses every supported file of the folder. A failing file is logged and skipped.
     *
     * @return the number of files analysed successfully
     */
    public int analyzeFolder(Path folder) {
        if (!Files.isDirectory(folder)) {
            log.warn("Input folder {} does not exist", folder);
            return 0;
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(folder)) {
            files = entries.filter(Files::isRegularFile)
                .filter(LogBatchLoader::isSupported)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BatchLoadException(folder.toString(), "Cannot list input folder", e);
        }
        
        log.info("Found {} input file(s) in {}", files.size(), folder);
        int analysed = 0;
        for (Path file : files) {
            try {
                analyzeFile(file);
                analysed++;
            } catch (BatchLoadException | ReportWriteException e) {
                metrics.recordBatchFailure();
                log.error("Skipping {}: {}", file.getFileName(), e.getMessage(), e);
            }
        }
        return analysed;
    }
    
    /**
     * Classifies every candidates file left in the results folder by a prepare
     * run. A failing file is logged and skipped; it stays in place for the next run.
     *
     * @return the number of candidates files classified successfully
     */
    public int classifyPendingCandidates() {
        if (!pipeline.isClassificationEnabled()) {
            log.warn("Classification is disabled, leaving candidates files in place");
            return 0;
        }
        List<Path> files = candidateStore.pendingFiles();
        if (files.isEmpty()) {
            log.warn("No candidates files to classify");
            return 0;
        }
        
        log.info("Found {} candidates file(s) to classify", files.size());
        int classified = 0;
        for (Path file : files) {
            try {
                List<CandidateRecord> candidates = candidateStore.load(file);
                List<AnomalyRecord> results = pipeline.classifyPrepared(file.getFileName().toString(), candidates);
                candidateStore.saveResults(file, results);
                classified++;
            } catch (BatchLoadException | ReportWriteException e) {
                metrics.recordBatchFailure();
                log.error("Skipping {}: {}", file.getFileName(), e.getMessage(), e);
            }
        }
        return classified;
    }
}
