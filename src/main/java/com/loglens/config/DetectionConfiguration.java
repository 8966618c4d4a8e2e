package com.loglens.config;

import com.loglens.detection.DensityOutlierDetector;
import com.loglens.detection.FloodDetector;
import com.loglens.detection.StatisticalOutlierDetector;
import com.loglens.detection.VolumeAnalyzer;
import com.loglens.detection.behavioral.BehavioralRuleEngine;
import com.loglens.embedding.CachingEmbeddingClient;
import com.loglens.embedding.EmbeddingClient;
import com.loglens.embedding.HashingEmbeddingClient;
import com.loglens.mining.MaskingTemplateMiner;
import com.loglens.mining.TemplateMinerClient;
import com.loglens.pipeline.DetectionSettings;
import com.loglens.rules.CustomPatternSource;
import com.loglens.rules.PatternCatalog;
import com.loglens.rules.RuleEngine;
import com.loglens.rules.SecurityClassifier;
import com.loglens.rules.SecurityPatternMatcher;
import com.loglens.rules.YamlPatternSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Detector wiring. Every detector is a plain object built from {@code loglens.*} properties.
 */
@Configuration
public class DetectionConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(DetectionConfiguration.class);
    
    @Value("${loglens.patterns.file:}")
    private String patternsFile;
    
    @Value("${loglens.detection.top-percent:0.05}")
    private double topPercent;
    
    @Value("${loglens.detection.knn-neighbors:5}")
    private int knnNeighbors;
    
    @Value("${loglens.detection.lof.enabled:true}")
    private boolean lofEnabled;
    
    @Value("${loglens.detection.lof.neighbors:20}")
    private int lofNeighbors;
    
    @Value("${loglens.detection.lof.contamination:0.05}")
    private double lofContamination;
    
    @Value("${loglens.detection.flood.enabled:true}")
    private boolean floodEnabled;
    
    @Value("${loglens.detection.flood.window-size:1000}")
    private int floodWindowSize;
    
    @Value("${loglens.detection.flood.threshold:0.75}")
    private double floodThreshold;
    
    @Value("${loglens.detection.spam.enabled:true}")
    private boolean spamEnabled;
    
    @Value("${loglens.detection.spam.template-threshold:0.75}")
    private double spamTemplateThreshold;
    
    @Value("${loglens.detection.behavioral.enabled:true}")
    private boolean behavioralEnabled;
    
    @Value("${loglens.embedding.dimensions:256}")
    private int embeddingDimensions;
    
    @Value("${loglens.embedding.cache-size:100000}")
    private long embeddingCacheSize;
    
    /**
     * Operator supplied patterns; defaults only when no file is configured.
     */
    @Bean
    public CustomPatternSource customPatternSource() {
        if (patternsFile == null || patternsFile.isBlank()) {
            return CustomPatternSource.EMPTY;
        }
        try {
            return YamlPatternSource.fromFile(Path.of(patternsFile));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot parse pattern file " + patternsFile, e);
        }
    }
    
    @Bean
    public SecurityPatternMatcher securityPatternMatcher(CustomPatternSource patterns) {
        return new SecurityPatternMatcher(PatternCatalog.withExtensions(
            PatternCatalog.defaultSecurityPatterns(), patterns.securityPatterns()));
    }
    
    @Bean
    public SecurityClassifier securityClassifier(SecurityPatternMatcher securityPatternMatcher) {
        return new SecurityClassifier(securityPatternMatcher);
    }
    
    @Bean
    public RuleEngine ruleEngine(CustomPatternSource patterns, SecurityClassifier securityClassifier) {
        return new RuleEngine(PatternCatalog.withExtensions(
            PatternCatalog.defaultRulePatterns(), patterns.rulePatterns()), securityClassifier);
    }
    
    /**
     * One miner per batch so templates learned from one file do not leak into the next.
     */
    @Bean
    @Scope("prototype")
    public TemplateMinerClient templateMiner() {
        return new MaskingTemplateMiner();
    }
    
    @Bean
    public EmbeddingClient embeddingClient() {
        logger.info("Embedding client: {} dimensions, cache size {}", embeddingDimensions, embeddingCacheSize);
        return new CachingEmbeddingClient(new HashingEmbeddingClient(embeddingDimensions), embeddingCacheSize);
    }
    
    @Bean
    public VolumeAnalyzer volumeAnalyzer() {
        return new VolumeAnalyzer(spamTemplateThreshold);
    }
    
    @Bean
    public FloodDetector floodDetector() {
        return new FloodDetector(floodWindowSize, floodThreshold);
    }
    
    @Bean
    public StatisticalOutlierDetector statisticalOutlierDetector() {
        return new StatisticalOutlierDetector(topPercent, knnNeighbors);
    }
    
    @Bean
    public DensityOutlierDetector densityOutlierDetector() {
        return new DensityOutlierDetector(lofNeighbors, lofContamination);
    }
    
    @Bean
    public BehavioralRuleEngine behavioralRuleEngine(CustomPatternSource patterns) {
        logger.info("Behavioral detection {} with {} rule(s)", behavioralEnabled ? "enabled" : "disabled",
            patterns.behavioralRules().size());
        return new BehavioralRuleEngine(patterns.behavioralRules());
    }
    
    @Bean
    public DetectionSettings detectionSettings() {
        return new DetectionSettings()
            .setFloodEnabled(floodEnabled)
            .setSpamEnabled(spamEnabled)
            .setLofEnabled(lofEnabled)
            .setBehavioralEnabled(behavioralEnabled);
    }
}
