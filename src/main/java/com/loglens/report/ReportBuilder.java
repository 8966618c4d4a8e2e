package com.loglens.report;

import com.loglens.classification.ClassificationOutcome;
import com.loglens.classification.ClassificationStage;
import com.loglens.classification.ClassificationStatistics;
import com.loglens.detection.FloodDetectionResult;
import com.loglens.detection.TemplateVolumeStats;
import com.loglens.detection.behavioral.BehavioralDetectionResult;
import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.DetectionAnnotation;
import com.loglens.domain.FloodSummary;
import com.loglens.domain.LogRecord;
import com.loglens.domain.RiskLevel;
import com.loglens.domain.SiemReport;
import com.loglens.domain.ThreatIndicator;
import com.loglens.rules.CompiledPattern;
import com.loglens.rules.SecurityPatternMatcher;
import com.loglens.util.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the {@link SiemReport} and the anomaly stream for one analysed batch.
 * 
 * Message text copied into the report is redacted; the detection copy is left untouched.
 */
public class ReportBuilder {
    
    private static final Logger log = LoggerFactory.getLogger(ReportBuilder.class);
    
    static final double HIGH_ERROR_RATE = 0.10;
    
    private static final Pattern ERROR_KEYWORDS = Pattern.compile("error|exception|fail", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPONENT = Pattern.compile("\\[([^\\]]+)\\]|(\\w+):");
    private static final int MAX_COMPONENT_LENGTH = 30;
    private static final int TOP_COMPONENTS = 5;
    
    private static final Map<String, Pattern> LOG_LEVELS = new LinkedHashMap<>();
    
    static {
        LOG_LEVELS.put("debug", Pattern.compile("\\b(debug|trace)\\b", Pattern.CASE_INSENSITIVE));
        LOG_LEVELS.put("info", Pattern.compile("\\binfo\\b", Pattern.CASE_INSENSITIVE));
        LOG_LEVELS.put("warn", Pattern.compile("\\bwarn(ing)?\\b", Pattern.CASE_INSENSITIVE));
        LOG_LEVELS.put("error", Pattern.compile("\\b(error|critical|fatal)\\b", Pattern.CASE_INSENSITIVE));
    }
    
    private final SecurityPatternMatcher securityPatterns;
    private final Clock clock;
    
    public ReportBuilder(SecurityPatternMatcher securityPatterns) {
        this(securityPatterns, Clock.systemUTC());
    }
    
    public ReportBuilder(SecurityPatternMatcher securityPatterns, Clock clock) {
        this.securityPatterns = securityPatterns;
        this.clock = clock;
    }
    
    public SiemReport build(AnalysisResults results) {
        List<AnnotatedRecord> originals = results.getOriginals();
        SiemReport report = new SiemReport();
        
        List<SiemReport.SecurityLeak> leaks = findLeaks(originals);
        SiemReport.TimeMetrics timeMetrics = timeMetrics(originals);
        double errorRate = round(errorRate(originals), 4);
        long critical = results.getAnomalies().stream().filter(AggregatedAnomaly::isAnomaly).count();
        long incidents = leaks.size() + (long) results.getRuleBasedCount();
        boolean floodDetected = isFloodDetected(results);
        
        SiemReport.Header header = report.getHeader();
        header.setReportTimestamp(Instant.now(clock).toString());
        header.setSourceFile(results.getSourceFile());
        header.setRiskLevel(RiskLevel.assess(incidents, critical));
        header.setSecurityIncidents(incidents);
        header.setCriticalAnomalies(critical);
        header.setThreatIndicators(threatIndicators(floodDetected, leaks.size(), results.getRuleBasedCount(), errorRate));
        header.setAnalysisPeriod(timeMetrics != null
            ? new SiemReport.AnalysisPeriod(timeMetrics.getStartTime(), timeMetrics.getEndTime(),
                round(timeMetrics.getTimeSpanSeconds() / 3600.0, 2))
            : new SiemReport.AnalysisPeriod("Unknown", "Unknown", 0.0));
        
        fillSecurityAssessment(report.getSecurityAssessment(), results, leaks);
        fillOperationalMetrics(report.getOperationalMetrics(), results, timeMetrics, errorRate, floodDetected);
        fillTechnicalAnalysis(report.getTechnicalAnalysis(), results);
        report.getReportOutputs().setAnomalyCount(results.getAnomalies().size());
        
        log.info("Report for {}: risk {}, {} incident(s), {} critical anomalies, indicators {}",
            results.getSourceFile(), header.getRiskLevel(), incidents, critical, header.getThreatIndicators());
        return report;
    }
    
    /**
     * Converts the aggregated anomalies into anomaly stream lines.
     */
    public List<AnomalyRecord> anomalyRecords(List<AggregatedAnomaly> anomalies) {
        List<AnomalyRecord> lines = new ArrayList<>(anomalies.size());
        for (AggregatedAnomaly anomaly : anomalies) {
            AnnotatedRecord record = anomaly.getRecord();
            DetectionAnnotation annotation = record.getAnnotation();
            AnomalyRecord line = new AnomalyRecord();
            line.setRecordId(RecordIdGenerator.recordId(record.getTimestamp(), record.getMessage()));
            line.setIndex(record.getIndex());
            line.setTimestamp(record.getTimestamp());
            line.setMessage(SecurityPatternMatcher.redact(record.getMessage()));
            line.setSource(record.getSource());
            line.setTemplate(record.getRecord().getTemplate());
            line.setAnomalySource(anomaly.getSource().getLabel());
            line.setClassification(annotation.getClassification());
            line.setReason(annotation.getReason());
            line.setTags(new ArrayList<>(annotation.getTags()));
            line.setKnnScore(annotation.getKnnScore());
            line.setLofScore(annotation.getLofScore());
            line.setSecurityRelated(annotation.isSecurityRelated());
            if (!annotation.getBehavioralRules().isEmpty()) {
                line.setBehavioralRule(String.join(", ", annotation.getBehavioralRules()));
            }
            if (!anomaly.getContext().isEmpty()) {
                line.setContextLogs(anomaly.getContext().stream()
                    .map(LogRecord::getMessage)
                    .map(SecurityPatternMatcher::redact)
                    .collect(Collectors.toList()));
            }
            lines.add(line);
        }
        return lines;
    }
    
    private List<SiemReport.SecurityLeak> findLeaks(List<AnnotatedRecord> originals) {
        List<SiemReport.SecurityLeak> leaks = new ArrayList<>();
        for (AnnotatedRecord record : originals) {
            Optional<CompiledPattern> leak = securityPatterns.findLeak(record.getMessage());
            leak.ifPresent(pattern -> leaks.add(new SiemReport.SecurityLeak(
                record.getIndex(),
                record.getTimestamp(),
                SecurityPatternMatcher.redact(record.getMessage()),
                pattern.getReason(),
                pattern.getName())));
        }
        if (!leaks.isEmpty()) {
            log.warn("{} record(s) contain possible secrets", leaks.size());
        }
        return leaks;
    }
    
    private void fillSecurityAssessment(SiemReport.SecurityAssessment assessment, AnalysisResults results,
                                        List<SiemReport.SecurityLeak> leaks) {
        assessment.getDataExposure().setDetails(leaks);
        
        SiemReport.RuleViolations violations = assessment.getRuleBasedViolations();
        int ruleCount = results.getRuleBasedCount();
        violations.setCount(ruleCount);
        violations.setSeverity(ruleCount > 3 ? "HIGH" : ruleCount > 0 ? "MEDIUM" : "LOW");
        Map<String, Integer> byPattern = new LinkedHashMap<>();
        for (AnnotatedRecord record : results.getOriginals()) {
            if (record.getAnnotation().hasSource(AnomalySource.RULE_BASED)) {
                for (String tag : record.getAnnotation().getTags()) {
                    byPattern.merge(tag, 1, Integer::sum);
                }
            }
        }
        violations.setByPattern(byPattern);
        
        SiemReport.AnomalousBehavior behavior = assessment.getAnomalousBehavior();
        int knn = 0;
        int lof = 0;
        for (AnnotatedRecord record : results.getSequence()) {
            if (record.isFloodSummary()) {
                continue;
            }
            if (record.getAnnotation().isKnnAnomaly()) {
                knn++;
            }
            if (record.getAnnotation().isLofAnomaly()) {
                lof++;
            }
        }
        behavior.setStatisticalAnomalies(knn);
        behavior.setDensityAnomalies(lof);
        behavior.setBehavioralAnomalies((int) results.getOriginals().stream()
            .filter(r -> r.getAnnotation().hasSource(AnomalySource.BEHAVIORAL))
            .count());
        behavior.setFloodAnomalies(results.getFloodResult() != null ? results.getFloodResult().getSummaries().size() : 0);
        
        ClassificationOutcome outcome = results.getClassificationOutcome();
        if (outcome != null) {
            behavior.setAiVerifiedThreats((int) outcome.getCandidates().stream()
                .map(c -> c.getRecord().getAnnotation())
                .filter(DetectionAnnotation::isAnomaly)
                .filter(a -> !ClassificationStage.ERROR_CLASSIFICATION.equals(a.getClassification()))
                .count());
            behavior.setFalsePositivesFiltered(outcome.getFalsePositivesFiltered());
        }
    }
    
    private void fillOperationalMetrics(SiemReport.OperationalMetrics metrics, AnalysisResults results,
                                        SiemReport.TimeMetrics timeMetrics, double errorRate, boolean floodDetected) {
        SiemReport.LogVolume volume = metrics.getLogVolume();
        volume.setTotalLogs(results.getOriginals().size());
        volume.setLogsAfterFloodCollapse(results.getSequence().size());
        volume.setTimeMetrics(timeMetrics);
        
        SiemReport.SystemHealth health = metrics.getSystemHealth();
        health.setLogLevels(logLevels(results.getOriginals()));
        health.setErrorRate(errorRate);
        SiemReport.FloodDetection flood = health.getFloodDetection();
        flood.setDetected(floodDetected);
        FloodDetectionResult floodResult = results.getFloodResult();
        if (floodResult != null) {
            flood.setSummaryCount(floodResult.getSummaries().size());
            flood.setRecordsCollapsed(floodResult.getRecordsCollapsed());
        }
        
        Map<String, Long> components = new HashMap<>();
        Map<String, Integer> firstSeen = new HashMap<>();
        for (AnnotatedRecord record : results.getOriginals()) {
            Matcher matcher = COMPONENT.matcher(record.getMessage());
            while (matcher.find()) {
                String component = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                if (component != null && !component.isEmpty() && component.length() < MAX_COMPONENT_LENGTH) {
                    components.merge(component, 1L, Long::sum);
                    firstSeen.putIfAbsent(component, firstSeen.size());
                }
            }
        }
        Map<String, Long> top = new LinkedHashMap<>();
        components.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(e -> firstSeen.get(e.getKey())))
            .limit(TOP_COMPONENTS)
            .forEach(e -> top.put(e.getKey(), e.getValue()));
        metrics.getComponentAnalysis().setUniqueComponents(components.size());
        metrics.getComponentAnalysis().setTopComponents(top);
    }
    
    private void fillTechnicalAnalysis(SiemReport.TechnicalAnalysis technical, AnalysisResults results) {
        TemplateVolumeStats stats = results.getVolumeStats();
        technical.getTemplateDiversity().setUniqueTemplates(stats.getUniqueTemplates());
        technical.getTemplateDiversity().setEntropy(round(stats.getEntropy(), 2));
        technical.getTemplateDiversity().setTopTemplateRatio(round(stats.getTopTemplateRatio(), 3));
        technical.setTopPatterns(stats.getTopTemplates().stream()
            .map(t -> new SiemReport.TemplateCount(t.getTemplate(), t.getCount(), t.getRatio()))
            .collect(Collectors.toList()));
        technical.setGlobalFloodTemplates(stats.getFloodTemplates().stream()
            .map(TemplateVolumeStats.TemplateFrequency::getTemplate)
            .collect(Collectors.toList()));
        List<FloodSummary> summaries = results.getFloodResult() != null
            ? results.getFloodResult().getSummaries() : List.of();
        technical.setFloodSummaries(new ArrayList<>(summaries));
        
        SiemReport.BehavioralDetection behavioral = technical.getBehavioralDetection();
        behavioral.setEnabled(results.isBehavioralEnabled());
        BehavioralDetectionResult behavioralResult = results.getBehavioralResult();
        if (behavioralResult != null) {
            behavioral.setRulesEvaluated(behavioralResult.getRulesEvaluated());
            behavioral.setSkippedReason(behavioralResult.getSkippedReason());
            behavioral.setAnomalies(new ArrayList<>(behavioralResult.getAnomalies()));
        }
        
        technical.setTagSummary(tagSummary(results.getAnomalies()));
        
        ClassificationOutcome outcome = results.getClassificationOutcome();
        if (outcome != null) {
            ClassificationStatistics statistics = outcome.getStatistics();
            SiemReport.AiAnalysis ai = new SiemReport.AiAnalysis();
            ai.setProvider(outcome.getProvider());
            ai.setModel(outcome.getModel());
            ai.setCandidatesClassified(outcome.getCandidatesClassified());
            ai.setTotalCalls(statistics.getTotalCalls());
            ai.setTotalElapsedMs(statistics.getTotalElapsedMillis());
            ai.setAverageLatencyMs(round(statistics.getAverageLatencyMillis(), 2));
            ai.setErrors(statistics.getErrors());
            ai.setTokensUsed(statistics.getTokensUsed());
            ai.setContextsTrimmed(statistics.getContextsTrimmed());
            technical.setAiAnalysis(ai);
        }
    }
    
    /**
     * Counts the tags of the flagged anomalies, in first-seen order. A record
     * reported by two detectors counts twice.
     */
    private static Map<String, Integer> tagSummary(List<AggregatedAnomaly> anomalies) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AggregatedAnomaly anomaly : anomalies) {
            if (anomaly.isAnomaly()) {
                for (String tag : anomaly.getRecord().getAnnotation().getTags()) {
                    counts.merge(tag, 1, Integer::sum);
                }
            }
        }
        return counts;
    }
    
    private static SiemReport.TimeMetrics timeMetrics(List<AnnotatedRecord> originals) {
        List<Instant> times = new ArrayList<>();
        int errors = 0;
        Map<Instant, Long> perMinute = new HashMap<>();
        for (AnnotatedRecord record : originals) {
            Optional<Instant> time = TimestampParser.parse(record.getTimestamp());
            if (time.isEmpty()) {
                continue;
            }
            times.add(time.get());
            perMinute.merge(time.get().truncatedTo(ChronoUnit.MINUTES), 1L, Long::sum);
            if (ERROR_KEYWORDS.matcher(record.getMessage()).find()) {
                errors++;
            }
        }
        if (times.isEmpty()) {
            return null;
        }
        Instant start = times.stream().min(Instant::compareTo).get();
        Instant end = times.stream().max(Instant::compareTo).get();
        double span = (end.toEpochMilli() - start.toEpochMilli()) / 1000.0;
        
        SiemReport.TimeMetrics metrics = new SiemReport.TimeMetrics();
        metrics.setStartTime(start.toString());
        metrics.setEndTime(end.toString());
        metrics.setTimeSpanSeconds(round(span, 2));
        if (span > 0) {
            double perSecond = times.size() / span;
            metrics.setLogsPerSecond(round(perSecond, 2));
            metrics.setLogsPerMinute(round(perSecond * 60, 2));
            metrics.setLogsPerHour(round(perSecond * 3600, 2));
        }
        metrics.setPeakLogsPerMinute(perMinute.values().stream().mapToLong(Long::longValue).max().orElse(0L));
        metrics.setErrorRate(round((double) errors / times.size(), 4));
        return metrics;
    }
    
    private static double errorRate(List<AnnotatedRecord> originals) {
        if (originals.isEmpty()) {
            return 0.0;
        }
        long errors = originals.stream()
            .filter(r -> ERROR_KEYWORDS.matcher(r.getMessage()).find())
            .count();
        return (double) errors / originals.size();
    }
    
    private static Map<String, Long> logLevels(List<AnnotatedRecord> originals) {
        Map<String, Long> levels = new LinkedHashMap<>();
        LOG_LEVELS.keySet().forEach(level -> levels.put(level, 0L));
        levels.put("other", 0L);
        for (AnnotatedRecord record : originals) {
            String level = "other";
            for (Map.Entry<String, Pattern> entry : LOG_LEVELS.entrySet()) {
                if (entry.getValue().matcher(record.getMessage()).find()) {
                    level = entry.getKey();
                    break;
                }
            }
            levels.merge(level, 1L, Long::sum);
        }
        return levels;
    }
    
    private static boolean isFloodDetected(AnalysisResults results) {
        boolean windowed = results.getFloodResult() != null && results.getFloodResult().isFloodDetected();
        return windowed || !results.getVolumeStats().getFloodTemplates().isEmpty();
    }
    
    private static List<ThreatIndicator> threatIndicators(boolean floodDetected, int leaks, int ruleBased,
                                                          double errorRate) {
        List<ThreatIndicator> indicators = new ArrayList<>();
        if (floodDetected) {
            indicators.add(ThreatIndicator.LOG_FLOODING);
        }
        if (leaks > 0) {
            indicators.add(ThreatIndicator.DATA_EXPOSURE);
        }
        if (ruleBased > 0) {
            indicators.add(ThreatIndicator.RULE_VIOLATIONS);
        }
        if (errorRate > HIGH_ERROR_RATE) {
            indicators.add(ThreatIndicator.HIGH_ERROR_RATE);
        }
        return indicators;
    }
    
    static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
