package com.loglens.rules;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.DetectionAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Deterministic first-match-wins classification against an ordered list of
 * operational rule patterns.
 * 
 * A matching record is classified as "Operational Error" with the pattern's
 * reason and a single tag naming the pattern. Records without a match are left
 * untouched. Applying the engine twice yields the same annotations.
 */
public class RuleEngine {
    
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);
    
    private final List<CompiledPattern> patterns;
    private final SecurityClassifier securityClassifier;
    
    public RuleEngine(List<RulePattern> rulePatterns, SecurityClassifier securityClassifier) {
        this.patterns = PatternCatalog.compileAll(rulePatterns, Pattern.CASE_INSENSITIVE);
        this.securityClassifier = securityClassifier;
        log.info("Rule engine initialized with {} patterns", patterns.size());
    }
    
    /**
     * @return the first pattern matching the message, if any
     */
    public Optional<CompiledPattern> match(String message) {
        if (message == null) {
            return Optional.empty();
        }
        for (CompiledPattern pattern : patterns) {
            if (pattern.matches(message)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
    
    /**
     * Annotates every record that matches a rule pattern.
     *
     * @param records the batch, annotated in place
     * @return the number of records matched
     */
    public int apply(List<AnnotatedRecord> records) {
        int matched = 0;
        for (AnnotatedRecord record : records) {
            Optional<CompiledPattern> hit = match(record.getMessage());
            if (hit.isEmpty()) {
                continue;
            }
            CompiledPattern pattern = hit.get();
            DetectionAnnotation annotation = record.getAnnotation();
            annotation.setClassification(PatternCatalog.OPERATIONAL_ERROR);
            annotation.setReason(pattern.getReason());
            annotation.setTags(Collections.singletonList(pattern.getName()));
            annotation.markAnomaly(AnomalySource.RULE_BASED);
            annotation.setSecurityRelated(securityClassifier.isSecurityRelated(record.getMessage(), annotation));
            matched++;
            log.debug("Record {} matched rule '{}'", record.getIndex(), pattern.getName());
        }
        log.info("Rule-based detection matched {} of {} records", matched, records.size());
        return matched;
    }
    
    public List<CompiledPattern> getPatterns() {
        return patterns;
    }
}
