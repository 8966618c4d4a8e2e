package com.loglens.rules;

import com.loglens.domain.DetectionAnnotation;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether an anomaly is security related, independently of how it
 * was detected. Checks the raw message against the security patterns, the
 * classification, reason and tags against security keywords, and the message
 * against a fixed list of security indicator expressions.
 */
public class SecurityClassifier {
    
    private static final List<String> SECURITY_KEYWORDS = List.of(
        "security", "breach", "unauthorized", "authentication", "auth", "login", "password",
        "token", "credential", "privilege", "permission", "access", "intrusion", "attack",
        "malicious", "suspicious", "threat", "vulnerability", "exploit", "injection",
        "xss", "csrf", "sql injection", "brute force", "ddos", "dos", "phishing",
        "malware", "virus", "trojan", "ransomware", "backdoor", "rootkit", "keylogger",
        "firewall", "blocked", "denied", "forbidden", "failed login", "invalid user",
        "certificate", "ssl", "tls", "encryption", "decrypt", "hash", "signature",
        "audit", "compliance", "policy violation", "data leak", "exposure"
    );
    
    private static final List<Pattern> SECURITY_LOG_PATTERNS = compile(List.of(
        "failed.*login", "invalid.*user", "authentication.*failed", "access.*denied",
        "permission.*denied", "unauthorized.*access", "security.*violation", "blocked.*request",
        "suspicious.*activity", "malicious.*request", "sql.*injection", "xss.*attack",
        "csrf.*token", "brute.*force", "ddos.*attack", "firewall.*block", "intrusion.*detect",
        "virus.*detect", "malware.*detect", "certificate.*error", "ssl.*error",
        "encryption.*failed", "audit.*failure", "compliance.*violation", "data.*breach",
        "information.*leak", "privilege.*escalation", "buffer.*overflow", "code.*injection",
        "path.*traversal", "directory.*traversal"
    ));
    
    private final SecurityPatternMatcher securityPatterns;
    
    public SecurityClassifier(SecurityPatternMatcher securityPatterns) {
        this.securityPatterns = securityPatterns;
    }
    
    private static List<Pattern> compile(List<String> expressions) {
        return expressions.stream()
            .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE))
            .collect(Collectors.toList());
    }
    
    public boolean isSecurityRelated(String message, DetectionAnnotation annotation) {
        if (securityPatterns.matchesIgnoringCase(message)) {
            return true;
        }
        if (containsKeyword(annotation.getClassification()) || containsKeyword(annotation.getReason())) {
            return true;
        }
        for (String tag : annotation.getTags()) {
            if (containsKeyword(tag)) {
                return true;
            }
        }
        if (message != null) {
            for (Pattern pattern : SECURITY_LOG_PATTERNS) {
                if (pattern.matcher(message).find()) {
                    return true;
                }
            }
        }
        return false;
    }
    
    private boolean containsKeyword(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : SECURITY_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
