package com.loglens.detection.behavioral;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.BehavioralAnomaly;
import com.loglens.domain.LogRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BehavioralRuleEngineTest {
    
    @Test
    void testCountRule_firesOnceWhenThresholdReached() {
        // Given: five failed logins within ten minutes
        List<AnnotatedRecord> records = failedLogins(5, "10.0.0.1");
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(
            BehavioralRule.count("Brute Force Login", "source", 10, 5, "failed login")));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(records);
        
        // Then
        assertThat(result.isSkipped()).isFalse();
        assertThat(result.getRulesEvaluated()).isEqualTo(1);
        assertThat(result.getAnomalies()).hasSize(1);
        BehavioralAnomaly anomaly = result.getAnomalies().get(0);
        assertThat(anomaly.getRuleName()).isEqualTo("Brute Force Login");
        assertThat(anomaly.getGroupKey()).isEqualTo("10.0.0.1");
        assertThat(anomaly.getMetricValue()).isEqualTo(5.0);
        assertThat(anomaly.getMatchedRecordIndices()).containsExactly(0, 1, 2, 3, 4);
        
        AnnotatedRecord record = records.get(2);
        assertThat(record.getAnnotation().isAnomaly()).isTrue();
        assertThat(record.getAnnotation().hasSource(AnomalySource.BEHAVIORAL)).isTrue();
        assertThat(record.getAnnotation().getClassification())
            .isEqualTo(BehavioralRuleEngine.BEHAVIORAL_CLASSIFICATION);
        assertThat(record.getAnnotation().getTags()).contains("behavioral_brute_force_login");
        assertThat(record.getAnnotation().getBehavioralRules()).containsExactly("Brute Force Login");
    }
    
    @Test
    void testCountRule_doesNotFireBelowThreshold() {
        // Given
        List<AnnotatedRecord> records = failedLogins(5, "10.0.0.1");
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(
            BehavioralRule.count("Brute Force Login", "source", 10, 6, "failed login")));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(records);
        
        // Then
        assertThat(result.getAnomalies()).isEmpty();
        assertThat(records).noneMatch(r -> r.getAnnotation().isAnomaly());
    }
    
    @Test
    void testCountRule_evictsEventsOutsideWindow() {
        // Given: five events spread over twenty minutes
        List<AnnotatedRecord> records = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            records.add(record(i, String.format("2024-03-01T10:%02d:00Z", i * 5), "failed login", "10.0.0.1", null));
        }
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(
            BehavioralRule.count("Brute Force Login", "source", 10, 4, "failed login")));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(records);
        
        // Then: at most three events ever share a ten minute window
        assertThat(result.getAnomalies()).isEmpty();
    }
    
    @Test
    void testCountRule_groupsIndependently() {
        // Given
        List<AnnotatedRecord> records = new ArrayList<>(failedLogins(3, "10.0.0.1"));
        for (int i = 0; i < 3; i++) {
            records.add(record(3 + i, String.format("2024-03-01T10:%02d:30Z", i), "failed login", "10.0.0.2", null));
        }
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(
            BehavioralRule.count("Brute Force Login", "source", 10, 3, "failed login")));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(records);
        
        // Then
        assertThat(result.getAnomalies()).extracting(BehavioralAnomaly::getGroupKey)
            .containsExactly("10.0.0.1", "10.0.0.2");
    }
    
    @Test
    void testDistinctCountRule_countsDistinctFieldValues() {
        // Given: one source trying four different users
        List<AnnotatedRecord> records = new ArrayList<>();
        String[] users = {"alice", "bob", "alice", "carol", "dave"};
        for (int i = 0; i < users.length; i++) {
            records.add(record(i, String.format("2024-03-01T10:%02d:00Z", i), "login attempt", "10.0.0.9", users[i]));
        }
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(
            BehavioralRule.distinctCount("User Enumeration", "source", 10, 4, "user")));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(records);
        
        // Then
        assertThat(result.getAnomalies()).hasSize(1);
        assertThat(result.getAnomalies().get(0).getMetricValue()).isEqualTo(4.0);
        assertThat(result.getAnomalies().get(0).getMatchedRecordIndices()).containsExactly(0, 1, 2, 3, 4);
    }
    
    @Test
    void testRatioRule_firesWhenShareOfMatchesReachesThreshold() {
        // Given: two normal records followed by three errors in one minute
        List<AnnotatedRecord> records = new ArrayList<>();
        String[] messages = {"request ok", "request ok", "request error", "request error", "request error"};
        for (int i = 0; i < messages.length; i++) {
            records.add(record(i, String.format("2024-03-01T10:00:%02dZ", i * 10), messages[i], "api", null));
        }
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(
            BehavioralRule.ratio("Error Burst", "source", 1, 0.5, "error")));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(records);
        
        // Then: fires on the fourth record (2 of 4) with only the matching records referenced
        assertThat(result.getAnomalies()).hasSize(1);
        assertThat(result.getAnomalies().get(0).getMetricValue()).isEqualTo(0.5);
        assertThat(result.getAnomalies().get(0).getMatchedRecordIndices()).containsExactly(2, 3);
        assertThat(records.get(0).getAnnotation().isAnomaly()).isFalse();
    }
    
    @Test
    void testEvaluate_withoutTimestamps_isSkipped() {
        // Given
        List<AnnotatedRecord> records = List.of(
            record(0, null, "failed login", "a", null),
            record(1, "not a time", "failed login", "a", null));
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(
            BehavioralRule.count("Brute Force Login", "source", 10, 1, "failed login")));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(records);
        
        // Then
        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getSkippedReason()).isEqualTo(BehavioralRuleEngine.NO_TIMESTAMPS);
        assertThat(result.getAnomalies()).isEmpty();
    }
    
    @Test
    void testEvaluate_skipsMalformedRulesAndKeepsOthers() {
        // Given: an unknown type, a missing threshold and a valid rule
        BehavioralRule unknown = new BehavioralRule("Odd", "median", null, 5);
        BehavioralRule noThreshold = new BehavioralRule("No Threshold", "count", null, 5);
        BehavioralRule valid = BehavioralRule.count("Any Login", null, 10, 2, "failed login");
        BehavioralRuleEngine engine = new BehavioralRuleEngine(List.of(unknown, noThreshold, valid));
        
        // When
        BehavioralDetectionResult result = engine.evaluate(failedLogins(2, "x"));
        
        // Then
        assertThat(result.getRulesEvaluated()).isEqualTo(1);
        assertThat(result.getAnomalies()).extracting(BehavioralAnomaly::getGroupKey).containsExactly("all");
    }
    
    @Test
    void shouldConvertRuleNamesToSnakeCase() {
        assertThat(BehavioralRuleEngine.snakeCase(" Brute-Force  Login! ")).isEqualTo("brute_force_login");
    }
    
    private static List<AnnotatedRecord> failedLogins(int count, String source) {
        List<AnnotatedRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(record(i, String.format("2024-03-01T10:%02d:00Z", i * 2),
                "Failed login for admin", source, null));
        }
        return records;
    }
    
    private static AnnotatedRecord record(int index, String timestamp, String message, String source, String user) {
        Map<String, String> attributes = user == null ? Map.of() : Map.of("user", user);
        return new AnnotatedRecord(index, new LogRecord(timestamp, message, source, null, attributes));
    }
}
