package com.loglens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.classification.AllowListStore;
import com.loglens.classification.CandidateSelector;
import com.loglens.classification.ClassificationMetrics;
import com.loglens.classification.ClassificationPhase;
import com.loglens.classification.ClassificationSettings;
import com.loglens.classification.ClassificationStage;
import com.loglens.classification.ContextWindowBuilder;
import com.loglens.classification.FileAllowListStore;
import com.loglens.classification.HeuristicContextEntryFilter;
import com.loglens.classification.ResponseParser;
import com.loglens.classification.provider.ClassifierProvider;
import com.loglens.classification.provider.ClassifierProviderFactory;
import com.loglens.classification.retry.RetryExecutor;
import com.loglens.classification.retry.RetryPolicy;
import com.loglens.rules.SecurityClassifier;
import com.loglens.rules.SecurityPatternMatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Secondary classification wiring, active only with {@code loglens.classifier.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "loglens.classifier", name = "enabled", havingValue = "true")
public class ClassificationConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ClassificationConfiguration.class);
    
    @Value("${loglens.classifier.provider:ollama}")
    private String provider;
    
    @Value("${loglens.classifier.endpoint:http://localhost:11434/api/generate}")
    private String endpoint;
    
    @Value("${loglens.classifier.model:mistral:instruct}")
    private String model;
    
    @Value("${loglens.classifier.timeout-seconds:10}")
    private long timeoutSeconds;
    
    @Value("${loglens.classifier.concurrency:10}")
    private int concurrency;
    
    @Value("${loglens.classifier.top-n:10}")
    private int topN;
    
    @Value("${loglens.classifier.anomaly-threshold:0.0}")
    private double anomalyThreshold;
    
    @Value("${loglens.classifier.phase:full}")
    private String phase;
    
    @Value("${loglens.classifier.max-log-length:512}")
    private int maxLogLength;
    
    @Value("${loglens.classifier.max-total-tokens:2048}")
    private int maxTotalTokens;
    
    @Value("${loglens.classifier.max-reason-length:200}")
    private int maxReasonLength;
    
    @Value("${loglens.classifier.context-window:5}")
    private int contextWindow;
    
    @Value("${loglens.classifier.dependent-filter-enabled:true}")
    private boolean dependentFilterEnabled;
    
    @Value("${loglens.classifier.allow-list-folder:non_anomalies}")
    private String allowListFolder;
    
    @Value("${loglens.classifier.retry.max-attempts:3}")
    private int maxAttempts;
    
    @Value("${loglens.classifier.retry.initial-delay-ms:1000}")
    private long initialDelayMs;
    
    @Value("${loglens.classifier.retry.max-delay-ms:10000}")
    private long maxDelayMs;
    
    @Value("${loglens.classifier.retry.backoff-factor:2.0}")
    private double backoffFactor;
    
    @Value("${loglens.classifier.retry.jitter:0.1}")
    private double jitter;
    
    @Value("${loglens.classifier.retry.retryable-errors:}")
    private List<String> retryableErrors;
    
    @Bean
    public ClassifierProvider classifierProvider(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        ClassifierProviderFactory factory = new ClassifierProviderFactory(webClientBuilder.build(), objectMapper);
        ClassifierProvider classifier = factory.create(provider, endpoint, model, Duration.ofSeconds(timeoutSeconds));
        logger.info("Classifier provider {} ({}) at {}", classifier.getName(), classifier.getModel(), endpoint);
        return classifier;
    }
    
    @Bean
    public RetryExecutor retryExecutor() {
        List<String> keywords = retryableErrors == null || retryableErrors.isEmpty()
            || (retryableErrors.size() == 1 && retryableErrors.get(0).isBlank())
            ? RetryPolicy.DEFAULT_RETRYABLE_ERRORS
            : retryableErrors;
        return new RetryExecutor(new RetryPolicy(maxAttempts, Duration.ofMillis(initialDelayMs),
            Duration.ofMillis(maxDelayMs), backoffFactor, jitter, keywords));
    }
    
    @Bean
    public AllowListStore allowListStore(ObjectMapper objectMapper) {
        return new FileAllowListStore(Path.of(allowListFolder), objectMapper);
    }
    
    @Bean
    public ClassificationMetrics classificationMetrics(MeterRegistry registry) {
        return new ClassificationMetrics(registry);
    }
    
    @Bean(destroyMethod = "close")
    public ClassificationStage classificationStage(ClassifierProvider classifierProvider,
                                                   RetryExecutor retryExecutor,
                                                   AllowListStore allowListStore,
                                                   SecurityPatternMatcher securityPatternMatcher,
                                                   SecurityClassifier securityClassifier,
                                                   ClassificationMetrics classificationMetrics,
                                                   ObjectMapper objectMapper) {
        ClassificationSettings settings = new ClassificationSettings()
            .setConcurrency(concurrency)
            .setTopN(topN)
            .setMaxLogLength(maxLogLength)
            .setMaxTotalTokens(maxTotalTokens)
            .setContextWindow(contextWindow)
            .setDependentFilterEnabled(dependentFilterEnabled)
            .setPhase(ClassificationPhase.from(phase));
        CandidateSelector selector = new CandidateSelector(topN, anomalyThreshold, allowListStore,
            new ContextWindowBuilder(contextWindow, new HeuristicContextEntryFilter()));
        return new ClassificationStage(classifierProvider, retryExecutor, selector,
            new ResponseParser(objectMapper, maxReasonLength), securityPatternMatcher, securityClassifier,
            classificationMetrics, settings);
    }
}
