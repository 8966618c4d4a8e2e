package com.loglens.detection.behavioral;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.BehavioralAnomaly;
import com.loglens.domain.DetectionAnnotation;
import com.loglens.rules.ConfigurationDefectException;
import com.loglens.util.TimestampParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Evaluates sliding time-window rules over grouped record streams.
 * 
 * Supported rule types:
 * - count: number of (optionally pattern-filtered) records in the window
 * - distinct_count: distinct values of a field in the window
 * - ratio: share of pattern-matching records among all records of the group in the window
 * 
 * Each rule fires at most once per group. Records without a parseable
 * timestamp are ignored; if no record has one the engine is skipped and the
 * reason is reported.
 */
public class BehavioralRuleEngine {
    
    private static final Logger log = LoggerFactory.getLogger(BehavioralRuleEngine.class);
    
    public static final String BEHAVIORAL_CLASSIFICATION = "Behavioral Anomaly";
    public static final String NO_TIMESTAMPS = "No records with a parseable timestamp";
    
    private static final String DEFAULT_GROUP = "all";
    private static final String MISSING_GROUP_VALUE = "unknown";
    
    private final List<BehavioralRule> rules;
    
    public BehavioralRuleEngine(List<BehavioralRule> rules) {
        this.rules = rules != null ? List.copyOf(rules) : List.of();
    }
    
    /**
     * Evaluates all rules and annotates the matched records.
     *
     * @param records the batch in original order
     */
    public BehavioralDetectionResult evaluate(List<AnnotatedRecord> records) {
        if (rules.isEmpty()) {
            return new BehavioralDetectionResult(List.of(), 0, null);
        }
        
        List<TimedRecord> timed = new ArrayList<>();
        for (AnnotatedRecord record : records) {
            if (record.isFloodSummary()) {
                continue;
            }
            Optional<Instant> time = TimestampParser.parse(record.getTimestamp());
            time.ifPresent(instant -> timed.add(new TimedRecord(record, instant.toEpochMilli())));
        }
        if (timed.isEmpty()) {
            log.warn("Behavioral detection skipped: {}", NO_TIMESTAMPS);
            return BehavioralDetectionResult.skipped(NO_TIMESTAMPS);
        }
        if (timed.size() < records.size()) {
            log.debug("Behavioral detection ignoring {} records without a parseable timestamp",
                records.size() - timed.size());
        }
        
        List<BehavioralAnomaly> anomalies = new ArrayList<>();
        int evaluated = 0;
        for (BehavioralRule rule : rules) {
            try {
                anomalies.addAll(evaluateRule(rule, timed));
                evaluated++;
            } catch (ConfigurationDefectException e) {
                log.warn("Skipping behavioral rule '{}': {}", e.getItemName(), e.getMessage());
            }
        }
        
        apply(records, anomalies);
        log.info("Behavioral detection: {} rule(s) evaluated, {} anomalies", evaluated, anomalies.size());
        return new BehavioralDetectionResult(anomalies, evaluated, null);
    }
    
    List<BehavioralAnomaly> evaluateRule(BehavioralRule rule, List<TimedRecord> timed) {
        BehavioralRuleType type = BehavioralRuleType.fromName(rule.getType())
            .orElseThrow(() -> new ConfigurationDefectException(
                "Unknown rule type: " + rule.getType(), rule.getName()));
        if (rule.getWindowMinutes() <= 0) {
            throw new ConfigurationDefectException("window_minutes must be positive", rule.getName());
        }
        Pattern pattern = compilePattern(rule);
        long spanMillis = (long) (rule.getWindowMinutes() * 60_000L);
        
        switch (type) {
            case COUNT:
            case DISTINCT_COUNT:
                return evaluateCount(rule, type, pattern, spanMillis, timed);
            case RATIO:
                return evaluateRatio(rule, pattern, spanMillis, timed);
            default:
                throw new ConfigurationDefectException("Unsupported rule type: " + type, rule.getName());
        }
    }
    
    private List<BehavioralAnomaly> evaluateCount(BehavioralRule rule, BehavioralRuleType type, Pattern pattern,
                                                  long spanMillis, List<TimedRecord> timed) {
        if (rule.getThreshold() == null) {
            throw new ConfigurationDefectException("Missing threshold", rule.getName());
        }
        if (type == BehavioralRuleType.DISTINCT_COUNT && rule.getField() == null) {
            throw new ConfigurationDefectException("distinct_count rule needs a field", rule.getName());
        }
        double threshold = rule.getThreshold();
        
        List<TimedRecord> stream = pattern == null ? timed : timed.stream()
            .filter(t -> matches(pattern, t))
            .collect(Collectors.toList());
        
        Function<TimedRecord, String> values = type == BehavioralRuleType.DISTINCT_COUNT
            ? t -> t.field(rule.getField())
            : null;
        
        List<BehavioralAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<TimedRecord>> group : groups(rule, stream).entrySet()) {
            SlidingWindow<TimedRecord> window = new SlidingWindow<TimedRecord>(spanMillis,
                TimedRecord::getEpochMillis, t -> true, values);
            
            for (TimedRecord next : group.getValue()) {
                window.push(next);
                double metric = type == BehavioralRuleType.COUNT ? window.size() : window.distinctValues();
                if (metric >= threshold) {
                    String what = type == BehavioralRuleType.COUNT
                        ? (int) metric + " events"
                        : (int) metric + " distinct " + rule.getField() + " values";
                    anomalies.add(fire(rule, group.getKey(), metric, window.items(),
                        what + " within " + formatMinutes(rule.getWindowMinutes()) + " (threshold "
                            + formatNumber(threshold) + ")"));
                    break;
                }
            }
        }
        return anomalies;
    }
    
    private List<BehavioralAnomaly> evaluateRatio(BehavioralRule rule, Pattern pattern, long spanMillis,
                                                  List<TimedRecord> timed) {
        if (rule.getThresholdRatio() == null) {
            throw new ConfigurationDefectException("Missing threshold_ratio", rule.getName());
        }
        if (pattern == null) {
            throw new ConfigurationDefectException("ratio rule needs a pattern", rule.getName());
        }
        double thresholdRatio = rule.getThresholdRatio();
        Predicate<TimedRecord> member = t -> matches(pattern, t);
        
        List<BehavioralAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<TimedRecord>> group : groups(rule, timed).entrySet()) {
            SlidingWindow<TimedRecord> window = new SlidingWindow<TimedRecord>(spanMillis,
                TimedRecord::getEpochMillis, member, null);
            
            for (TimedRecord next : group.getValue()) {
                window.push(next);
                if (!member.test(next)) {
                    continue;
                }
                double ratio = window.memberRatio();
                if (ratio >= thresholdRatio) {
                    anomalies.add(fire(rule, group.getKey(), ratio, window.members(),
                        window.memberCount() + " of " + window.size() + " events match within "
                            + formatMinutes(rule.getWindowMinutes()) + " (ratio "
                            + String.format(Locale.ROOT, "%.2f", ratio) + " >= "
                            + formatNumber(thresholdRatio) + ")"));
                    break;
                }
            }
        }
        return anomalies;
    }
    
    private BehavioralAnomaly fire(BehavioralRule rule, String group, double metric,
                                   List<TimedRecord> matched, String detail) {
        List<Integer> indices = matched.stream()
            .map(t -> t.getRecord().getIndex())
            .collect(Collectors.toList());
        String reason = "Behavioral rule '" + rule.getName() + "' triggered for " + group + ": " + detail + ".";
        log.debug("{}", reason);
        return new BehavioralAnomaly(rule.getName(), group, metric, indices, reason);
    }
    
    /**
     * Groups records by the rule's group_by field, each group sorted by time
     * with ties kept in batch order.
     */
    private Map<String, List<TimedRecord>> groups(BehavioralRule rule, List<TimedRecord> stream) {
        Map<String, List<TimedRecord>> groups = new LinkedHashMap<>();
        for (TimedRecord t : stream) {
            String key = DEFAULT_GROUP;
            if (rule.getGroupBy() != null && !rule.getGroupBy().isEmpty()) {
                String value = t.field(rule.getGroupBy());
                key = value != null ? value : MISSING_GROUP_VALUE;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(t);
        }
        Comparator<TimedRecord> byTime = Comparator.comparingLong(TimedRecord::getEpochMillis)
            .thenComparingInt(t -> t.getRecord().getIndex());
        groups.values().forEach(list -> list.sort(byTime));
        return groups;
    }
    
    private static Pattern compilePattern(BehavioralRule rule) {
        if (rule.getPattern() == null || rule.getPattern().isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationDefectException("Invalid pattern: " + e.getDescription(), rule.getName(), e);
        }
    }
    
    private static boolean matches(Pattern pattern, TimedRecord t) {
        return pattern.matcher(t.getRecord().getMessage()).find();
    }
    
    /**
     * Marks every record referenced by an anomaly as a behavioral anomaly.
     */
    private void apply(List<AnnotatedRecord> records, List<BehavioralAnomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return;
        }
        Map<Integer, AnnotatedRecord> byIndex = new HashMap<>();
        for (AnnotatedRecord record : records) {
            byIndex.putIfAbsent(record.getIndex(), record);
        }
        for (BehavioralAnomaly anomaly : anomalies) {
            String tag = "behavioral_" + snakeCase(anomaly.getRuleName());
            for (Integer index : anomaly.getMatchedRecordIndices()) {
                AnnotatedRecord record = byIndex.get(index);
                if (record == null) {
                    continue;
                }
                DetectionAnnotation annotation = record.getAnnotation();
                annotation.markAnomaly(AnomalySource.BEHAVIORAL);
                annotation.addBehavioralRule(anomaly.getRuleName());
                annotation.addTag(tag);
                if (annotation.getClassification() == null) {
                    annotation.setClassification(BEHAVIORAL_CLASSIFICATION);
                }
                if (annotation.getReason() == null) {
                    annotation.setReason(anomaly.getReason());
                }
            }
        }
    }
    
    static String snakeCase(String name) {
        if (name == null) {
            return "rule";
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }
    
    private static String formatMinutes(double minutes) {
        return formatNumber(minutes) + " minute(s)";
    }
    
    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
    
    public List<BehavioralRule> getRules() {
        return rules;
    }
    
    /**
     * A record with its parsed timestamp.
     */
    static final class TimedRecord {
        private final AnnotatedRecord record;
        private final long epochMillis;
        
        TimedRecord(AnnotatedRecord record, long epochMillis) {
            this.record = record;
            this.epochMillis = epochMillis;
        }
        
        AnnotatedRecord getRecord() {
            return record;
        }
        
        long getEpochMillis() {
            return epochMillis;
        }
        
        String field(String name) {
            return record.getRecord().field(name);
        }
    }
}
