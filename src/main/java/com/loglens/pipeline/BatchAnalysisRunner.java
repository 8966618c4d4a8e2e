package com.loglens.pipeline;

import com.loglens.classification.ClassificationPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Analyses the whole input folder once at startup when {@code loglens.run-on-startup=true}.
 * In the classify phase it classifies the candidates saved by an earlier prepare run instead.
 */
@Component
@ConditionalOnProperty(prefix = "loglens", name = "run-on-startup", havingValue = "true")
public class BatchAnalysisRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchAnalysisRunner.class);
    
    private final LogAnalysisService analysisService;
    
    @Value("${loglens.input-folder:input}")
    private String inputFolder;
    
    @Value("${loglens.classifier.phase:full}")
    private String phase;
    
    public BatchAnalysisRunner(LogAnalysisService analysisService) {
        this.analysisService = analysisService;
    }
    
    @Override
    public void run(String... args) {
        if (ClassificationPhase.from(phase) == ClassificationPhase.CLASSIFY) {
            log.info("Starting classification of prepared candidates");
            int classified = analysisService.classifyPendingCandidates();
            log.info("Classification run complete: {} candidates file(s) classified", classified);
            return;
        }
        log.info("Starting batch analysis of {}", inputFolder);
        int analysed = analysisService.analyzeFolder(Path.of(inputFolder));
        log.info("Batch analysis complete: {} file(s) analysed", analysed);
    }
}
