package com.loglens.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Built-in pattern lists and compilation of pattern lists.
 * 
 * Extensions are appended after the defaults so that built-in patterns keep
 * precedence under first-match-wins evaluation.
 */
public final class PatternCatalog {
    
    private static final Logger log = LoggerFactory.getLogger(PatternCatalog.class);
    
    public static final String OPERATIONAL_ERROR = "Operational Error";
    
    private static final List<RulePattern> DEFAULT_RULE_PATTERNS = List.of(
        new RulePattern("Database Error", "(database|db).*error", "Database operation failed."),
        new RulePattern("Service Timeout", "(timeout|timed out|request timed out)", "Service call timed out."),
        new RulePattern("HTTP 500 Error", "status\\s*[:=]\\s*500", "HTTP 500 server error."),
        new RulePattern("Process Crash", "(process|service)\\s*(exited|crashed|terminated)", "Process crash detected."),
        new RulePattern("Restart Detected", "(restart|restarting)", "Process or pod restart detected."),
        new RulePattern("Dependency Failure", "(dependency|service)\\s*(unavailable|failed|error)",
            "Dependency failure detected."),
        new RulePattern("Configuration Issue", "(invalid|missing)\\s*configuration", "Configuration issue."),
        new RulePattern("Resource Limit Issue", "(out of memory|OOM|cpu limit exceeded|quota exceeded)",
            "Resource limit breach.")
    );
    
    private static final List<RulePattern> DEFAULT_SECURITY_PATTERNS = List.of(
        new RulePattern("JWT Token", "eyJ[0-9a-zA-Z\\-_.]+", "Possible JWT Token leakage."),
        new RulePattern("Authorization Header", "Authorization: Bearer [a-zA-Z0-9\\-_.]+",
            "Possible Authorization Header leakage."),
        new RulePattern("API Key", "API[_-]?KEY[:=\\s][a-zA-Z0-9\\-_.]+", "Possible API Key leakage.")
    );
    
    private PatternCatalog() {
    }
    
    public static List<RulePattern> defaultRulePatterns() {
        return DEFAULT_RULE_PATTERNS;
    }
    
    public static List<RulePattern> defaultSecurityPatterns() {
        return DEFAULT_SECURITY_PATTERNS;
    }
    
    /**
     * Defaults followed by the given extensions.
     */
    public static List<RulePattern> withExtensions(List<RulePattern> defaults, List<RulePattern> extensions) {
        List<RulePattern> merged = new ArrayList<>(defaults);
        if (extensions != null) {
            merged.addAll(extensions);
        }
        return Collections.unmodifiableList(merged);
    }
    
    /**
     * Compiles a pattern list, skipping and logging entries that are invalid.
     *
     * @param patterns the patterns to compile
     * @param flags regex flags, e.g. {@link Pattern#CASE_INSENSITIVE}
     * @return the compiled patterns in the original order
     */
    public static List<CompiledPattern> compileAll(List<RulePattern> patterns, int flags) {
        List<CompiledPattern> compiled = new ArrayList<>();
        for (RulePattern pattern : patterns) {
            try {
                compiled.add(compile(pattern, flags));
            } catch (ConfigurationDefectException e) {
                log.warn("Skipping pattern '{}': {}", e.getItemName(), e.getMessage());
            }
        }
        return Collections.unmodifiableList(compiled);
    }
    
    /**
     * Compiles a single pattern.
     *
     * @throws ConfigurationDefectException if the name or regex is missing or invalid
     */
    public static CompiledPattern compile(RulePattern pattern, int flags) {
        if (pattern == null || pattern.getPattern() == null || pattern.getPattern().isEmpty()) {
            throw new ConfigurationDefectException("Pattern has no regular expression",
                pattern != null ? pattern.getName() : null);
        }
        try {
            return new CompiledPattern(pattern.getName(), Pattern.compile(pattern.getPattern(), flags),
                pattern.getReason());
        } catch (PatternSyntaxException e) {
            throw new ConfigurationDefectException("Invalid regular expression: " + e.getDescription(),
                pattern.getName(), e);
        }
    }
}
