package com.loglens.rules;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects credential and token leakage in log messages and produces redacted
 * copies of messages for anything written to reports.
 */
public class SecurityPatternMatcher {
    
    private static final Pattern BEARER_TOKEN =
        Pattern.compile("(Bearer|Token|Authorization)\\s+[\\w\\-.]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern JWT =
        Pattern.compile("eyJ[a-zA-Z0-9\\-_]+\\.[a-zA-Z0-9\\-_]+\\.[a-zA-Z0-9\\-_]+");
    private static final Pattern API_KEY =
        Pattern.compile("(API[_-]?KEY[:=\\s])([a-zA-Z0-9\\-_]+)", Pattern.CASE_INSENSITIVE);
    
    private final List<CompiledPattern> patterns;
    private final List<CompiledPattern> caseInsensitivePatterns;
    
    public SecurityPatternMatcher() {
        this(PatternCatalog.defaultSecurityPatterns());
    }
    
    public SecurityPatternMatcher(List<RulePattern> securityPatterns) {
        this.patterns = PatternCatalog.compileAll(securityPatterns, 0);
        this.caseInsensitivePatterns = PatternCatalog.compileAll(securityPatterns, Pattern.CASE_INSENSITIVE);
    }
    
    /**
     * @return the first security pattern matching the message, if any
     */
    public Optional<CompiledPattern> findLeak(String message) {
        if (message == null || message.isEmpty()) {
            return Optional.empty();
        }
        for (CompiledPattern pattern : patterns) {
            if (pattern.matches(message)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
    
    public boolean containsSecret(String message) {
        return findLeak(message).isPresent();
    }
    
    /**
     * Case-insensitive variant used when judging whether an anomaly is
     * security related.
     */
    public boolean matchesIgnoringCase(String message) {
        for (CompiledPattern pattern : caseInsensitivePatterns) {
            if (pattern.matches(message)) {
                return true;
            }
        }
        return false;
    }
    
    public List<CompiledPattern> getPatterns() {
        return patterns;
    }
    
    /**
     * Masks bearer tokens, JWTs and API keys.
     */
    public static String redact(String message) {
        if (message == null) {
            return null;
        }
        String redacted = BEARER_TOKEN.matcher(message).replaceAll("$1 <REDACTED>");
        redacted = JWT.matcher(redacted).replaceAll("<JWT_TOKEN>");
        redacted = API_KEY.matcher(redacted).replaceAll("$1<REDACTED>");
        return redacted;
    }
}
