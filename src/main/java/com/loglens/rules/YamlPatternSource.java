package com.loglens.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.loglens.detection.behavioral.BehavioralRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loads custom patterns from a YAML document.
 * 
 * Recognised keys are {@code rule_based_patterns} and
 * {@code additional_rule_based_patterns}, {@code security_patterns} and
 * {@code additional_security_patterns}, and {@code behavioral_rules}. Unknown
 * keys are ignored so the file can be shared with other settings.
 */
public class YamlPatternSource implements CustomPatternSource {
    
    private static final Logger log = LoggerFactory.getLogger(YamlPatternSource.class);
    
    private final List<RulePattern> rulePatterns;
    private final List<RulePattern> securityPatterns;
    private final List<BehavioralRule> behavioralRules;
    
    YamlPatternSource(PatternDocument document) {
        this.rulePatterns = concat(document.rulePatterns, document.additionalRulePatterns);
        this.securityPatterns = concat(document.securityPatterns, document.additionalSecurityPatterns);
        this.behavioralRules = document.behavioralRules != null
            ? Collections.unmodifiableList(new ArrayList<>(document.behavioralRules))
            : List.of();
    }
    
    /**
     * Reads the given file. A missing file is not an error and yields an empty source.
     *
     * @throws IOException if the file exists but cannot be parsed
     */
    public static CustomPatternSource fromFile(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            log.info("No custom pattern file at {}, using defaults only", path);
            return CustomPatternSource.EMPTY;
        }
        try (InputStream in = Files.newInputStream(path)) {
            CustomPatternSource source = fromStream(in);
            log.info("Loaded custom patterns from {}", path);
            return source;
        }
    }
    
    public static CustomPatternSource fromStream(InputStream in) throws IOException {
        PatternDocument document = new YAMLMapper().readValue(in, PatternDocument.class);
        return new YamlPatternSource(document != null ? document : new PatternDocument());
    }
    
    public static CustomPatternSource fromString(String yaml) throws IOException {
        PatternDocument document = new YAMLMapper().readValue(yaml, PatternDocument.class);
        return new YamlPatternSource(document != null ? document : new PatternDocument());
    }
    
    private static List<RulePattern> concat(List<RulePattern> first, List<RulePattern> second) {
        List<RulePattern> all = new ArrayList<>();
        if (first != null) {
            all.addAll(first);
        }
        if (second != null) {
            all.addAll(second);
        }
        return Collections.unmodifiableList(all);
    }
    
    @Override
    public List<RulePattern> rulePatterns() {
        return rulePatterns;
    }
    
    @Override
    public List<RulePattern> securityPatterns() {
        return securityPatterns;
    }
    
    @Override
    public List<BehavioralRule> behavioralRules() {
        return behavioralRules;
    }
    
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PatternDocument {
        @JsonProperty("rule_based_patterns")
        List<RulePattern> rulePatterns;
        
        @JsonProperty("additional_rule_based_patterns")
        List<RulePattern> additionalRulePatterns;
        
        @JsonProperty("security_patterns")
        List<RulePattern> securityPatterns;
        
        @JsonProperty("additional_security_patterns")
        List<RulePattern> additionalSecurityPatterns;
        
        @JsonProperty("behavioral_rules")
        List<BehavioralRule> behavioralRules;
    }
}
