package com.loglens.rules;

import com.loglens.detection.behavioral.BehavioralRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class YamlPatternSourceTest {
    
    @Test
    void shouldLoadSamplePatternFile() throws IOException {
        // Given
        CustomPatternSource source;
        try (InputStream in = getClass().getResourceAsStream("/patterns/sample-patterns.yml")) {
            // When
            source = YamlPatternSource.fromStream(in);
        }
        
        // Then
        assertThat(source.rulePatterns()).extracting(RulePattern::getName)
            .containsExactly("Kubernetes CrashLoop", "Invalid User", "Payment Failure", "Disk Full");
        assertThat(source.securityPatterns()).extracting(RulePattern::getName)
            .containsExactly("Slack Token", "Basic Auth Header");
        assertThat(source.behavioralRules()).extracting(BehavioralRule::getName)
            .containsExactly("Brute Force Login", "User Enumeration", "Error Burst");
        
        BehavioralRule enumeration = source.behavioralRules().get(1);
        assertThat(enumeration.getType()).isEqualTo("distinct_count");
        assertThat(enumeration.getField()).isEqualTo("user");
        assertThat(enumeration.getGroupBy()).isEqualTo("source");
        assertThat(enumeration.getThreshold()).isEqualTo(5.0);
        assertThat(source.behavioralRules().get(2).getThresholdRatio()).isEqualTo(0.5);
    }
    
    @Test
    void shouldMergeBaseAndAdditionalKeys() throws IOException {
        // Given
        String yaml = "rule_based_patterns:\n"
            + "  - name: A\n    pattern: a\n    reason: ra\n"
            + "additional_rule_based_patterns:\n"
            + "  - name: B\n    pattern: b\n    reason: rb\n"
            + "unrelated_setting: 42\n";
        
        // When
        CustomPatternSource source = YamlPatternSource.fromString(yaml);
        
        // Then
        assertThat(source.rulePatterns()).extracting(RulePattern::getName).containsExactly("A", "B");
        assertThat(source.securityPatterns()).isEmpty();
        assertThat(source.behavioralRules()).isEmpty();
    }
    
    @Test
    void testFromFile_withMissingFile_returnsEmptySource(@TempDir Path dir) throws IOException {
        CustomPatternSource source = YamlPatternSource.fromFile(dir.resolve("absent.yml"));
        
        assertThat(source).isSameAs(CustomPatternSource.EMPTY);
    }
}
