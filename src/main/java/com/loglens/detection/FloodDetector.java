package com.loglens.detection;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.DetectionAnnotation;
import com.loglens.domain.FloodSummary;
import com.loglens.domain.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collapses runs of near-identical records into flood summaries.
 * 
 * A window of {@code windowSize} records starts at every position. When one
 * template fills at least {@code repetitionThreshold} of the window, the run is
 * extended past the window while following templates stay similar to the
 * dominant one, and the whole run is replaced by a single synthetic record.
 * Otherwise the record at the window start is kept and the window moves by
 * one. Window counts are updated incrementally on each move.
 */
public class FloodDetector {
    
    private static final Logger log = LoggerFactory.getLogger(FloodDetector.class);
    
    public static final String FLOOD_CLASSIFICATION = "Log Flood";
    
    private static final double EXTENSION_SIMILARITY = 0.8;
    private static final int MAX_VARIABLE_TOKENS = 20;
    private static final Pattern COMPONENT = Pattern.compile("^\\[?([a-zA-Z0-9_.-]+)\\]?[:|\\s]");
    
    private final int windowSize;
    private final double repetitionThreshold;
    
    public FloodDetector(int windowSize, double repetitionThreshold) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive but was " + windowSize);
        }
        if (repetitionThreshold <= 0.0 || repetitionThreshold > 1.0) {
            throw new IllegalArgumentException("repetitionThreshold must be in (0, 1] but was " + repetitionThreshold);
        }
        this.windowSize = windowSize;
        this.repetitionThreshold = repetitionThreshold;
    }
    
    /**
     * @param records records with templates assigned, in batch order
     * @return the collapsed sequence and the flood summaries
     */
    public FloodDetectionResult detect(List<AnnotatedRecord> records) {
        int n = records.size();
        if (n < windowSize) {
            log.debug("Flood detection skipped: {} records < window size {}", n, windowSize);
            return new FloodDetectionResult(records, List.of());
        }
        
        List<AnnotatedRecord> output = new ArrayList<>(n);
        List<FloodSummary> summaries = new ArrayList<>();
        Map<String, Integer> counts = new HashMap<>();
        
        int i = 0;
        int windowEnd = fillWindow(records, 0, counts);
        String dominant = dominantTemplate(records, 0, windowEnd, counts);
        
        while (i < n) {
            if (dominant != null) {
                int j = windowEnd;
                Set<String> dominantWords = words(dominant);
                while (j < n && jaccard(words(template(records.get(j))), dominantWords) > EXTENSION_SIMILARITY) {
                    j++;
                }
                AnnotatedRecord flood = collapse(records, i, j);
                output.add(flood);
                summaries.add(flood.getFloodSummary());
                log.info("Flood collapsed records [{}, {}): {} occurrences of '{}'",
                    records.get(i).getIndex(), records.get(j - 1).getIndex() + 1, j - i,
                    flood.getFloodSummary().getTemplate());
                
                i = j;
                counts.clear();
                windowEnd = fillWindow(records, i, counts);
                dominant = i < n ? dominantTemplate(records, i, windowEnd, counts) : null;
                continue;
            }
            
            output.add(records.get(i));
            counts.computeIfPresent(template(records.get(i)), (k, v) -> v > 1 ? v - 1 : null);
            i++;
            if (windowEnd < n) {
                String entering = template(records.get(windowEnd));
                int count = counts.merge(entering, 1, Integer::sum);
                windowEnd++;
                // only the entering template can newly reach the threshold
                dominant = floods(count) ? entering : null;
            }
        }
        
        log.info("Flood detection: {} summaries, {} records in, {} records out", summaries.size(), n, output.size());
        return new FloodDetectionResult(output, summaries);
    }
    
    private int fillWindow(List<AnnotatedRecord> records, int start, Map<String, Integer> counts) {
        int end = Math.min(start + windowSize, records.size());
        for (int k = start; k < end; k++) {
            counts.merge(template(records.get(k)), 1, Integer::sum);
        }
        return end;
    }
    
    /**
     * Highest-count flooding template in the window, ties going to the template
     * seen first; null when nothing floods.
     */
    private String dominantTemplate(List<AnnotatedRecord> records, int start, int end, Map<String, Integer> counts) {
        String best = null;
        int bestCount = 0;
        Set<String> seen = new HashSet<>();
        for (int k = start; k < end; k++) {
            String t = template(records.get(k));
            if (!seen.add(t)) {
                continue;
            }
            int count = counts.getOrDefault(t, 0);
            if (count > bestCount) {
                best = t;
                bestCount = count;
            }
        }
        return best != null && floods(bestCount) ? best : null;
    }
    
    private boolean floods(int count) {
        return (double) count / windowSize >= repetitionThreshold;
    }
    
    private AnnotatedRecord collapse(List<AnnotatedRecord> records, int start, int end) {
        List<AnnotatedRecord> run = records.subList(start, end);
        FloodSummary summary = summarize(run);
        summary.setStartIndex(run.get(0).getIndex());
        summary.setEndIndex(run.get(run.size() - 1).getIndex());
        
        LogRecord first = run.get(0).getRecord();
        String message = "[LOG FLOOD] " + run.size() + " occurrences of similar logs: " + summary.getTemplate();
        String template = "[LOG FLOOD] <count> occurrences of similar logs: " + summary.getTemplate();
        LogRecord synthetic = new LogRecord(first.getTimestamp(), message, first.getSource(), template, null);
        
        AnnotatedRecord flood = new AnnotatedRecord(run.get(0).getIndex(), synthetic, summary);
        DetectionAnnotation annotation = flood.getAnnotation();
        annotation.addSource(AnomalySource.FLOOD);
        annotation.setClassification(FLOOD_CLASSIFICATION);
        annotation.setReason(run.size() + " similar log records within a short span ("
            + summary.getDominantSeverity() + " severity).");
        annotation.addTag(FLOOD_CLASSIFICATION);
        if (summary.isErrorSeverity()) {
            annotation.markAnomaly(AnomalySource.FLOOD);
        }
        return flood;
    }
    
    /**
     * Summarises a run: most frequent template, severity, components and the
     * words that vary against the template.
     */
    FloodSummary summarize(List<AnnotatedRecord> run) {
        Map<String, Integer> templateCounts = new LinkedHashMap<>();
        for (AnnotatedRecord record : run) {
            templateCounts.merge(template(record), 1, Integer::sum);
        }
        String template = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : templateCounts.entrySet()) {
            if (entry.getValue() > best) {
                template = entry.getKey();
                best = entry.getValue();
            }
        }
        
        String[] templateWords = splitWords(template);
        List<String> variableTokens = new ArrayList<>();
        Set<String> components = new LinkedHashSet<>();
        boolean error = false;
        boolean warning = false;
        
        for (AnnotatedRecord record : run) {
            String message = record.getMessage();
            String[] words = splitWords(message);
            if (words.length == templateWords.length) {
                for (int w = 0; w < words.length && variableTokens.size() < MAX_VARIABLE_TOKENS; w++) {
                    if (!words[w].equals(templateWords[w]) && !variableTokens.contains(words[w])) {
                        variableTokens.add(words[w]);
                    }
                }
            }
            String lower = message.toLowerCase(Locale.ROOT);
            error |= lower.contains("error");
            warning |= lower.contains("warn");
            Matcher component = COMPONENT.matcher(message);
            if (component.find()) {
                components.add(component.group(1));
            }
        }
        
        String severity = error ? "error" : warning ? "warning" : "unknown";
        return new FloodSummary(template, run.size(), severity, components, variableTokens, 0, 0);
    }
    
    private static String template(AnnotatedRecord record) {
        return record.getRecord().templateOrMessage();
    }
    
    private static String[] splitWords(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }
    
    static Set<String> words(String text) {
        return new HashSet<>(Arrays.asList(splitWords(text)));
    }
    
    /**
     * Jaccard similarity of two word sets; 0 when both are empty.
     */
    static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String word : a) {
            if (b.contains(word)) {
                intersection++;
            }
        }
        return (double) intersection / union.size();
    }
    
    public int getWindowSize() {
        return windowSize;
    }
    
    public double getRepetitionThreshold() {
        return repetitionThreshold;
    }
}
