package com.loglens.detection;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.LogRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatisticalOutlierDetectorTest {
    
    @Test
    void shouldFlagDirectionalOutlier() {
        // Given: nine nearly parallel vectors and one orthogonal one
        List<AnnotatedRecord> records = new ArrayList<>();
        List<double[]> vectors = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            records.add(record(i));
            vectors.add(new double[] {1.0, i * 0.01});
        }
        records.add(record(9));
        vectors.add(new double[] {0.0, 1.0});
        StatisticalOutlierDetector detector = new StatisticalOutlierDetector(0.1, 3);
        
        // When
        int flagged = detector.detect(records, vectors);
        
        // Then
        assertThat(flagged).isEqualTo(1);
        assertThat(records.get(9).getAnnotation().isKnnAnomaly()).isTrue();
        assertThat(records.get(9).getAnnotation().hasSource(AnomalySource.STATISTICAL)).isTrue();
        assertThat(records.get(0).getAnnotation().isKnnAnomaly()).isFalse();
        assertThat(records.get(9).getAnnotation().getKnnScore())
            .isGreaterThan(records.get(0).getAnnotation().getKnnScore());
    }
    
    @Test
    void shouldFlagAtLeastOneAndRoundUp() {
        StatisticalOutlierDetector detector = new StatisticalOutlierDetector(0.03, 5);
        
        assertThat(detector.anomalyCount(100)).isEqualTo(3);
        assertThat(detector.anomalyCount(101)).isEqualTo(4);
        assertThat(detector.anomalyCount(10)).isEqualTo(1);
    }
    
    @Test
    void testDetect_withSingleRecord_isNoOp() {
        // Given
        List<AnnotatedRecord> records = List.of(record(0));
        
        // When
        int flagged = new StatisticalOutlierDetector(0.5, 5).detect(records, List.of(new double[] {1.0, 0.0}));
        
        // Then
        assertThat(flagged).isZero();
        assertThat(records.get(0).getAnnotation().getKnnScore()).isEqualTo(0.0);
        assertThat(records.get(0).getAnnotation().isAnomaly()).isFalse();
    }
    
    @Test
    void testDetect_withMismatchedVectors_throws() {
        StatisticalOutlierDetector detector = new StatisticalOutlierDetector(0.5, 5);
        
        assertThatThrownBy(() -> detector.detect(List.of(record(0), record(1)), List.of(new double[] {1.0})))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    private static AnnotatedRecord record(int index) {
        return new AnnotatedRecord(index, new LogRecord(null, "message " + index, "app"));
    }
}
