package com.loglens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.classification.ClassificationStage;
import com.loglens.detection.DensityOutlierDetector;
import com.loglens.detection.FloodDetector;
import com.loglens.detection.StatisticalOutlierDetector;
import com.loglens.detection.VolumeAnalyzer;
import com.loglens.detection.behavioral.BehavioralRuleEngine;
import com.loglens.embedding.EmbeddingClient;
import com.loglens.ingestion.LogBatchLoader;
import com.loglens.mining.TemplateMinerClient;
import com.loglens.pipeline.AnalysisPipeline;
import com.loglens.pipeline.DetectionSettings;
import com.loglens.pipeline.LogAnalysisService;
import com.loglens.pipeline.PipelineMetrics;
import com.loglens.report.AnomalyAggregator;
import com.loglens.report.CandidateFileStore;
import com.loglens.report.ReportBuilder;
import com.loglens.report.ReportWriter;
import com.loglens.rules.RuleEngine;
import com.loglens.rules.SecurityClassifier;
import com.loglens.rules.SecurityPatternMatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Loader, pipeline and report output wiring.
 */
@Configuration
public class PipelineConfiguration {
    
    @Value("${loglens.results-folder:results}")
    private String resultsFolder;
    
    @Value("${loglens.max-log-lines:0}")
    private int maxLogLines;
    
    @Value("${loglens.large-log-warning-threshold:100000}")
    private int largeLogWarningThreshold;
    
    @Bean
    public LogBatchLoader logBatchLoader(ObjectMapper objectMapper) {
        return new LogBatchLoader(objectMapper, maxLogLines, largeLogWarningThreshold);
    }
    
    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry registry) {
        return new PipelineMetrics(registry);
    }
    
    @Bean
    public AnalysisPipeline analysisPipeline(RuleEngine ruleEngine,
                                             ObjectProvider<TemplateMinerClient> templateMiners,
                                             VolumeAnalyzer volumeAnalyzer,
                                             FloodDetector floodDetector,
                                             EmbeddingClient embeddingClient,
                                             StatisticalOutlierDetector statisticalOutlierDetector,
                                             DensityOutlierDetector densityOutlierDetector,
                                             BehavioralRuleEngine behavioralRuleEngine,
                                             ObjectProvider<ClassificationStage> classificationStage,
                                             SecurityPatternMatcher securityPatternMatcher,
                                             SecurityClassifier securityClassifier,
                                             DetectionSettings detectionSettings,
                                             PipelineMetrics pipelineMetrics) {
        return new AnalysisPipeline(ruleEngine, templateMiners::getObject, volumeAnalyzer, floodDetector,
            embeddingClient, statisticalOutlierDetector, densityOutlierDetector, behavioralRuleEngine,
            classificationStage.getIfAvailable(), new AnomalyAggregator(),
            new ReportBuilder(securityPatternMatcher), securityClassifier, detectionSettings, pipelineMetrics);
    }
    
    @Bean
    public ReportWriter reportWriter(ObjectMapper objectMapper) {
        return new ReportWriter(objectMapper, Path.of(resultsFolder));
    }
    
    @Bean
    public CandidateFileStore candidateFileStore(ObjectMapper objectMapper) {
        return new CandidateFileStore(objectMapper, Path.of(resultsFolder));
    }
    
    @Bean
    public LogAnalysisService logAnalysisService(LogBatchLoader logBatchLoader, AnalysisPipeline analysisPipeline,
                                                 ReportWriter reportWriter, CandidateFileStore candidateFileStore,
                                                 PipelineMetrics pipelineMetrics) {
        return new LogAnalysisService(logBatchLoader, analysisPipeline, reportWriter, candidateFileStore,
            pipelineMetrics);
    }
}
