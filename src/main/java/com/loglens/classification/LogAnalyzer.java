package com.loglens.classification;

import com.loglens.rules.SecurityPatternMatcher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex heuristics that describe a log message: severity, component, action,
 * error type and notable value patterns.
 */
public class LogAnalyzer {
    
    public static final String UNKNOWN = "unknown";
    
    private static final Pattern ERROR = Pattern.compile("\\b(error|fail|exception|critical)\\b");
    private static final Pattern WARNING = Pattern.compile("\\b(warn|warning)\\b");
    private static final Pattern INFO = Pattern.compile("\\b(info|notice)\\b");
    private static final Pattern DEBUG = Pattern.compile("\\b(debug|trace)\\b");
    private static final Pattern COMPONENT = Pattern.compile("^\\[?([a-zA-Z0-9_.-]+)\\]?[:|\\s]");
    private static final Pattern STARTUP = Pattern.compile("\\b(start(ing|ed|up)?|boot(ing|ed)?|initiali[sz](ing|ed)|listening on)\\b");
    
    private static final List<String> ACTIONS = List.of(
        "started", "stopped", "created", "deleted", "updated", "failed", "connected", "disconnected");
    
    private static final Map<String, Pattern> ERROR_TYPES = new LinkedHashMap<>();
    private static final Map<String, Pattern> VALUE_PATTERNS = new LinkedHashMap<>();
    
    static {
        ERROR_TYPES.put("timeout", Pattern.compile("\\b(timeout|timed?\\s*out)\\b"));
        ERROR_TYPES.put("connection", Pattern.compile("\\b(connection|connect)\\s*(error|fail|refused)"));
        ERROR_TYPES.put("permission", Pattern.compile("\\b(permission|access)\\s*(denied|error)\\b"));
        ERROR_TYPES.put("validation", Pattern.compile("\\b(invalid|validation)\\s*(error|fail)"));
        ERROR_TYPES.put("resource", Pattern.compile("\\b(memory|disk|cpu|resource)\\s*(error|exhausted|full)\\b"));
        
        VALUE_PATTERNS.put("ip_address", Pattern.compile("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}"));
        VALUE_PATTERNS.put("hash", Pattern.compile("[a-fA-F0-9]{32}"));
        VALUE_PATTERNS.put("date", Pattern.compile("\\d{4}-\\d{2}-\\d{2}"));
        VALUE_PATTERNS.put("http_request", Pattern.compile("(GET|POST|PUT|DELETE|PATCH)\\s+/\\S+"));
    }
    
    private final SecurityPatternMatcher securityPatterns;
    
    public LogAnalyzer(SecurityPatternMatcher securityPatterns) {
        this.securityPatterns = securityPatterns;
    }
    
    public LogAnalysis analyze(String message) {
        String text = message != null ? message : "";
        String lower = text.toLowerCase(Locale.ROOT);
        
        String component = UNKNOWN;
        Matcher matcher = COMPONENT.matcher(text);
        if (matcher.find()) {
            component = matcher.group(1);
        }
        
        String action = UNKNOWN;
        for (String word : ACTIONS) {
            if (lower.contains(word)) {
                action = word;
                break;
            }
        }
        
        String errorType = "none";
        for (Map.Entry<String, Pattern> entry : ERROR_TYPES.entrySet()) {
            if (entry.getValue().matcher(lower).find()) {
                errorType = entry.getKey();
                break;
            }
        }
        
        List<String> patterns = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : VALUE_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                patterns.add(entry.getKey());
            }
        }
        
        return new LogAnalysis(severity(lower), component, action, errorType, patterns,
            STARTUP.matcher(lower).find(), securityPatterns.containsSecret(text));
    }
    
    public ContextAnalysis analyzeContext(List<String> contextLines) {
        Map<String, Integer> severities = new LinkedHashMap<>();
        severities.put("error", 0);
        severities.put("warning", 0);
        severities.put("info", 0);
        severities.put("debug", 0);
        if (contextLines.isEmpty()) {
            return new ContextAnalysis(0, severities, List.of());
        }
        
        Map<String, Integer> repeats = new HashMap<>();
        Set<String> components = new LinkedHashSet<>();
        for (String line : contextLines) {
            repeats.merge(line, 1, Integer::sum);
            LogAnalysis analysis = analyze(line);
            severities.merge(analysis.getSeverity(), 1, Integer::sum);
            if (!UNKNOWN.equals(analysis.getComponent())) {
                components.add(analysis.getComponent());
            }
        }
        int repetition = repeats.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return new ContextAnalysis(repetition, severities, new ArrayList<>(components));
    }
    
    private static String severity(String lower) {
        if (ERROR.matcher(lower).find()) {
            return "error";
        }
        if (WARNING.matcher(lower).find()) {
            return "warning";
        }
        if (INFO.matcher(lower).find()) {
            return "info";
        }
        if (DEBUG.matcher(lower).find()) {
            return "debug";
        }
        return UNKNOWN;
    }
}
