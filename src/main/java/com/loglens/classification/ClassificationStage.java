package com.loglens.classification;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.loglens.classification.provider.ClassifierProvider;
import com.loglens.classification.provider.ClassifierReply;
import com.loglens.classification.retry.RetryExecutor;
import com.loglens.classification.retry.RetryExhaustedException;
import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.ClassificationCandidate;
import com.loglens.domain.ClassificationResult;
import com.loglens.domain.DetectionAnnotation;
import com.loglens.domain.LogRecord;
import com.loglens.rules.SecurityClassifier;
import com.loglens.rules.SecurityPatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.stream.Collectors;

/**
 * Secondary classification of statistical anomalies through an external classifier.
 * 
 * All candidates of a batch are submitted at once; one semaphore, shared by
 * every batch running through this stage, bounds the number of calls in flight.
 * Each call goes through the {@link RetryExecutor}; a terminal failure, or any
 * other runtime failure while handling a candidate, labels that candidate
 * {@code Error} and the batch continues. Results are applied in candidate order
 * once every call has finished.
 */
public class ClassificationStage implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(ClassificationStage.class);
    
    public static final String SENSITIVE_LEAK = "Sensitive Information Leak";
    static final String SENSITIVE_REASON = "Contains possible secret/token.";
    static final List<String> SENSITIVE_TAGS = List.of("Sensitive", "Security Threat");
    public static final String ERROR_CLASSIFICATION = "Error";
    
    private static final Set<String> BENIGN_CLASSIFICATIONS = Set.of("routine", "normal", "normal operation", "unknown");
    
    private final ClassifierProvider provider;
    private final RetryExecutor retryExecutor;
    private final CandidateSelector candidateSelector;
    private final LogAnalyzer logAnalyzer;
    private final PromptBuilder promptBuilder;
    private final ResponseParser responseParser;
    private final SecurityPatternMatcher securityPatterns;
    private final SecurityClassifier securityClassifier;
    private final DependentAnomalyFilter dependentFilter;
    private final ClassificationMetrics metrics;
    private final ClassificationSettings settings;
    private final ExecutorService executor;
    private final Semaphore permits;
    
    public ClassificationStage(ClassifierProvider provider,
                               RetryExecutor retryExecutor,
                               CandidateSelector candidateSelector,
                               ResponseParser responseParser,
                               SecurityPatternMatcher securityPatterns,
                               SecurityClassifier securityClassifier,
                               ClassificationMetrics metrics,
                               ClassificationSettings settings) {
        this.provider = provider;
        this.retryExecutor = retryExecutor;
        this.candidateSelector = candidateSelector;
        this.logAnalyzer = new LogAnalyzer(securityPatterns);
        this.promptBuilder = new PromptBuilder();
        this.responseParser = responseParser;
        this.securityPatterns = securityPatterns;
        this.securityClassifier = securityClassifier;
        this.dependentFilter = new DependentAnomalyFilter();
        this.metrics = metrics;
        this.settings = settings;
        this.executor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("classifier-%d").setDaemon(true).build());
        this.permits = new Semaphore(settings.getConcurrency());
    }
    
    /**
     * Selects, classifies and relabels the candidates of one post-flood sequence.
     */
    public ClassificationOutcome process(List<AnnotatedRecord> sequence, String sourceFile) {
        CandidateSelection selection = select(sequence, sourceFile);
        return classifyCandidates(selection.getCandidates(), selection.getFalsePositivesFiltered());
    }
    
    /**
     * Selects the candidates of one post-flood sequence without classifying them.
     */
    public CandidateSelection select(List<AnnotatedRecord> sequence, String sourceFile) {
        return candidateSelector.select(sequence, sourceFile);
    }
    
    /**
     * Classifies already selected candidates and relabels their records.
     */
    public ClassificationOutcome classifyCandidates(List<ClassificationCandidate> candidates,
                                                    int falsePositivesFiltered) {
        ClassificationStatistics statistics = new ClassificationStatistics();
        if (candidates.isEmpty()) {
            return new ClassificationOutcome(candidates, falsePositivesFiltered, statistics,
                provider.getName(), provider.getModel());
        }
        
        log.info("Classifying {} candidate(s) with {} ({}), concurrency {}",
            candidates.size(), provider.getName(), provider.getModel(), settings.getConcurrency());
        List<ClassificationResult> results = classify(candidates, statistics);
        for (int i = 0; i < candidates.size(); i++) {
            apply(candidates.get(i).getRecord(), results.get(i));
        }
        log.info("Classification finished: {} call(s), {} error(s), {} ms total",
            statistics.getTotalCalls(), statistics.getErrors(), statistics.getTotalElapsedMillis());
        return new ClassificationOutcome(candidates, falsePositivesFiltered, statistics,
            provider.getName(), provider.getModel());
    }
    
    public ClassificationPhase getPhase() {
        return settings.getPhase();
    }
    
    /**
     * Classifies every candidate, returning results in candidate order.
     */
    public List<ClassificationResult> classify(List<ClassificationCandidate> candidates,
                                               ClassificationStatistics statistics) {
        List<CompletableFuture<ClassificationResult>> futures = new ArrayList<>();
        for (ClassificationCandidate candidate : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> classifyOne(candidate, statistics), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }
    
    private ClassificationResult classifyOne(ClassificationCandidate candidate, ClassificationStatistics statistics) {
        try {
            return classifyGuarded(candidate, statistics);
        } catch (RuntimeException e) {
            statistics.recordError(0L);
            metrics.recordError(0L);
            log.error("Classification of record {} failed", candidate.getRecord().getIndex(), e);
            return failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
    
    private ClassificationResult classifyGuarded(ClassificationCandidate candidate,
                                                 ClassificationStatistics statistics) {
        AnnotatedRecord record = candidate.getRecord();
        String message = record.getMessage();
        if (securityPatterns.containsSecret(message)) {
            metrics.recordShortCircuit();
            return new ClassificationResult(SENSITIVE_LEAK, SENSITIVE_REASON, SENSITIVE_TAGS);
        }
        
        String logLine = truncate(message);
        List<String> context = candidate.getContextWindow().stream()
            .map(LogRecord::getMessage)
            .collect(Collectors.toList());
        int estimatedTokens = (logLine.length() + promptBuilder.summarizeContext(context).length()) / 4;
        if (!context.isEmpty() && estimatedTokens > settings.getMaxTotalTokens()) {
            log.debug("Dropping context of record {} (~{} tokens)", record.getIndex(), estimatedTokens);
            context = List.of();
            statistics.recordContextTrimmed();
            metrics.recordContextTrimmed();
        }
        String prompt = promptBuilder.build(logLine, context,
            logAnalyzer.analyze(logLine), logAnalyzer.analyzeContext(context));
        
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            statistics.recordError(0L);
            metrics.recordError(0L);
            return failure("interrupted while waiting for a classifier slot");
        }
        long start = System.currentTimeMillis();
        try {
            ClassifierReply reply = retryExecutor.execute("classify-" + record.getIndex(),
                () -> provider.complete(prompt));
            ClassificationResult result = responseParser.parse(reply.getText()).withTokensUsed(reply.getTokensUsed());
            long elapsed = System.currentTimeMillis() - start;
            statistics.recordCall(elapsed, reply.getTokensUsed());
            metrics.recordCall(elapsed, reply.getTokensUsed());
            return result;
        } catch (RetryExhaustedException e) {
            long elapsed = System.currentTimeMillis() - start;
            statistics.recordError(elapsed);
            metrics.recordError(elapsed);
            String cause = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.error("Classification of record {} failed: {}", record.getIndex(), cause);
            return failure(cause);
        } finally {
            permits.release();
        }
    }
    
    private void apply(AnnotatedRecord record, ClassificationResult result) {
        DetectionAnnotation annotation = record.getAnnotation();
        annotation.setClassification(result.getClassification());
        annotation.setReason(result.getReason());
        result.getTags().forEach(annotation::addTag);
        annotation.addSource(AnomalySource.LLM);
        
        if (settings.isDependentFilterEnabled()) {
            dependentFilter.apply(record);
        }
        String label = result.getClassification().toLowerCase(Locale.ROOT);
        if (BENIGN_CLASSIFICATIONS.contains(label)) {
            annotation.clearAnomaly();
        }
        annotation.setSecurityRelated(securityClassifier.isSecurityRelated(record.getMessage(), annotation));
    }
    
    private String truncate(String message) {
        if (message.length() <= settings.getMaxLogLength()) {
            return message;
        }
        return message.substring(0, settings.getMaxLogLength()) + "...";
    }
    
    private static ClassificationResult failure(String message) {
        return new ClassificationResult(ERROR_CLASSIFICATION, "Classifier error: " + message,
            List.of(ResponseParser.UNKNOWN));
    }
    
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
