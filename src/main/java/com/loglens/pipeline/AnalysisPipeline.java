package com.loglens.pipeline;

import com.loglens.classification.ClassificationOutcome;
import com.loglens.classification.ClassificationPhase;
import com.loglens.classification.ClassificationStage;
import com.loglens.detection.DensityOutlierDetector;
import com.loglens.detection.FloodDetectionResult;
import com.loglens.detection.FloodDetector;
import com.loglens.detection.StatisticalOutlierDetector;
import com.loglens.detection.TemplateVolumeStats;
import com.loglens.detection.VolumeAnalyzer;
import com.loglens.detection.behavioral.BehavioralDetectionResult;
import com.loglens.detection.behavioral.BehavioralRuleEngine;
import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.CandidateRecord;
import com.loglens.domain.ClassificationCandidate;
import com.loglens.domain.DetectionAnnotation;
import com.loglens.domain.LogRecord;
import com.loglens.embedding.EmbeddingClient;
import com.loglens.mining.TemplateMinerClient;
import com.loglens.report.AggregatedAnomaly;
import com.loglens.report.AnalysisResults;
import com.loglens.report.AnomalyAggregator;
import com.loglens.report.ReportBuilder;
import com.loglens.rules.RuleEngine;
import com.loglens.rules.SecurityClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs every detector over one batch and builds its report.
 * 
 * Order: rules, template mining, volume analysis, flood collapsing, KNN and
 * LOF over the non-rule, non-flood records, behavioral rules over the original
 * records, optional classification, aggregation, report.
 * 
 * In the prepare phase the classification candidates are returned with the
 * report instead of being classified; {@link #classifyPrepared} classifies them
 * in a later run.
 */
public class AnalysisPipeline {
    
    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);
    
    private final RuleEngine ruleEngine;
    private final Supplier<TemplateMinerClient> templateMiners;
    private final VolumeAnalyzer volumeAnalyzer;
    private final FloodDetector floodDetector;
    private final EmbeddingClient embeddingClient;
    private final StatisticalOutlierDetector statisticalDetector;
    private final DensityOutlierDetector densityDetector;
    private final BehavioralRuleEngine behavioralEngine;
    private final ClassificationStage classificationStage;
    private final AnomalyAggregator aggregator;
    private final ReportBuilder reportBuilder;
    private final SecurityClassifier securityClassifier;
    private final DetectionSettings settings;
    private final PipelineMetrics metrics;
    
    /**
     * @param templateMiners supplies a fresh miner per batch
     * @param classificationStage null when secondary classification is disabled
     */
    public AnalysisPipeline(RuleEngine ruleEngine,
                            Supplier<TemplateMinerClient> templateMiners,
                            VolumeAnalyzer volumeAnalyzer,
                            FloodDetector floodDetector,
                            EmbeddingClient embeddingClient,
                            StatisticalOutlierDetector statisticalDetector,
                            DensityOutlierDetector densityDetector,
                            BehavioralRuleEngine behavioralEngine,
                            ClassificationStage classificationStage,
                            AnomalyAggregator aggregator,
                            ReportBuilder reportBuilder,
                            SecurityClassifier securityClassifier,
                            DetectionSettings settings,
                            PipelineMetrics metrics) {
        this.ruleEngine = ruleEngine;
        this.templateMiners = templateMiners;
        this.volumeAnalyzer = volumeAnalyzer;
        this.floodDetector = floodDetector;
        this.embeddingClient = embeddingClient;
        this.statisticalDetector = statisticalDetector;
        this.densityDetector = densityDetector;
        this.behavioralEngine = behavioralEngine;
        this.classificationStage = classificationStage;
        this.aggregator = aggregator;
        this.reportBuilder = reportBuilder;
        this.securityClassifier = securityClassifier;
        this.settings = settings;
        this.metrics = metrics;
    }
    
    public BatchReport analyze(String sourceFile, List<LogRecord> records) {
        long start = System.currentTimeMillis();
        log.info("Analysing {} records from {}", records.size(), sourceFile);
        
        List<AnnotatedRecord> originals = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            originals.add(new AnnotatedRecord(i, records.get(i)));
        }
        
        int ruleBased = ruleEngine.apply(originals);
        
        TemplateMinerClient templateMiner = templateMiners.get();
        List<String> templates = new ArrayList<>(originals.size());
        for (AnnotatedRecord record : originals) {
            if (record.getRecord().getTemplate() == null) {
                record.assignTemplate(templateMiner.mine(record.getMessage()));
            }
            templates.add(record.getRecord().getTemplate());
        }
        
        TemplateVolumeStats volumeStats = volumeAnalyzer.analyze(templates);
        if (!settings.isSpamEnabled()) {
            volumeStats = new TemplateVolumeStats(volumeStats.getTotalRecords(), volumeStats.getUniqueTemplates(),
                volumeStats.getEntropy(), volumeStats.getTopTemplateRatio(), volumeStats.getTopTemplates(), List.of());
        }
        
        FloodDetectionResult floodResult = settings.isFloodEnabled()
            ? floodDetector.detect(originals)
            : new FloodDetectionResult(originals, List.of());
        List<AnnotatedRecord> sequence = floodResult.getRecords();
        
        List<AnnotatedRecord> embedded = sequence.stream()
            .filter(r -> !r.isFloodSummary())
            .filter(r -> !r.getAnnotation().hasSource(AnomalySource.RULE_BASED))
            .collect(Collectors.toList());
        List<double[]> vectors = embeddingClient.embedAll(embedded.stream()
            .map(AnnotatedRecord::getMessage)
            .collect(Collectors.toList()));
        int knnFlagged = statisticalDetector.detect(embedded, vectors);
        int lofFlagged = settings.isLofEnabled() ? densityDetector.detect(embedded, vectors) : 0;
        log.info("Statistical detection over {} records: {} KNN, {} LOF anomalies", embedded.size(), knnFlagged, lofFlagged);
        
        BehavioralDetectionResult behavioral = settings.isBehavioralEnabled()
            ? behavioralEngine.evaluate(originals)
            : null;
        
        ClassificationOutcome classification = null;
        List<CandidateRecord> pending = new ArrayList<>();
        if (classificationStage != null && classificationStage.getPhase() == ClassificationPhase.FULL) {
            classification = classificationStage.process(sequence, sourceFile);
        } else if (classificationStage != null && classificationStage.getPhase() == ClassificationPhase.PREPARE) {
            for (ClassificationCandidate candidate : classificationStage.select(sequence, sourceFile).getCandidates()) {
                pending.add(CandidateRecord.from(candidate, sourceFile));
            }
            log.info("Prepared {} classification candidate(s) from {}", pending.size(), sourceFile);
        }
        
        List<AggregatedAnomaly> anomalies = aggregator.aggregate(originals, sequence, classification);
        assessSecurity(anomalies);
        
        AnalysisResults results = new AnalysisResults();
        results.setSourceFile(sourceFile);
        results.setOriginals(originals);
        results.setSequence(sequence);
        results.setVolumeStats(volumeStats);
        results.setFloodResult(floodResult);
        results.setRuleBasedCount(ruleBased);
        results.setBehavioralEnabled(settings.isBehavioralEnabled());
        results.setBehavioralResult(behavioral);
        results.setClassificationOutcome(classification);
        results.setAnomalies(anomalies);
        
        BatchReport batchReport = new BatchReport(reportBuilder.build(results), reportBuilder.anomalyRecords(anomalies),
            pending);
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordBatch(originals.size(), floodResult.getRecordsCollapsed(), anomalies, elapsed);
        log.info("Analysis of {} finished in {} ms: {} anomalies", sourceFile, elapsed, anomalies.size());
        return batchReport;
    }
    
    public boolean isClassificationEnabled() {
        return classificationStage != null;
    }
    
    /**
     * Classifies candidates saved by a prepare run.
     *
     * @return one anomaly stream line per candidate, in candidate order
     * @throws IllegalStateException when classification is disabled
     */
    public List<AnomalyRecord> classifyPrepared(String candidatesFile, List<CandidateRecord> prepared) {
        if (classificationStage == null) {
            throw new IllegalStateException("Classification is disabled, cannot classify " + candidatesFile);
        }
        List<ClassificationCandidate> candidates = prepared.stream()
            .map(CandidateRecord::toCandidate)
            .collect(Collectors.toList());
        ClassificationOutcome outcome = classificationStage.classifyCandidates(candidates, 0);
        List<AggregatedAnomaly> classified = new ArrayList<>(candidates.size());
        for (ClassificationCandidate candidate : outcome.getCandidates()) {
            classified.add(new AggregatedAnomaly(candidate.getRecord(), AnomalySource.LLM,
                candidate.getRecord().getAnnotation().isAnomaly(), candidate.getContextWindow()));
        }
        log.info("Classified {} prepared candidate(s) from {}: {} call(s), {} error(s)", candidates.size(),
            candidatesFile, outcome.getStatistics().getTotalCalls(), outcome.getStatistics().getErrors());
        return reportBuilder.anomalyRecords(classified);
    }
    
    /**
     * Rule and classifier verdicts already carry a security flag; the other
     * detector sets get theirs here.
     */
    private void assessSecurity(List<AggregatedAnomaly> anomalies) {
        for (AggregatedAnomaly anomaly : anomalies) {
            AnomalySource source = anomaly.getSource();
            if (source == AnomalySource.STATISTICAL || source == AnomalySource.DENSITY
                || source == AnomalySource.BEHAVIORAL) {
                DetectionAnnotation annotation = anomaly.getRecord().getAnnotation();
                annotation.setSecurityRelated(
                    securityClassifier.isSecurityRelated(anomaly.getRecord().getMessage(), annotation));
            }
        }
    }
}
