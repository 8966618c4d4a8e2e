package com.loglens.detection;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.LogRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DensityOutlierDetectorTest {
    
    @Test
    void shouldFlagIsolatedPoint() {
        // Given: a dense 3x3 grid and one distant point
        List<AnnotatedRecord> records = new ArrayList<>();
        List<double[]> vectors = new ArrayList<>();
        int index = 0;
        for (int x = 0; x < 3; x++) {
            for (int y = 0; y < 3; y++) {
                records.add(record(index++));
                vectors.add(new double[] {x, y});
            }
        }
        records.add(record(index));
        vectors.add(new double[] {20.0, 20.0});
        DensityOutlierDetector detector = new DensityOutlierDetector(3, 0.1);
        
        // When
        int flagged = detector.detect(records, vectors);
        
        // Then
        assertThat(flagged).isEqualTo(1);
        AnnotatedRecord outlier = records.get(9);
        assertThat(outlier.getAnnotation().isLofAnomaly()).isTrue();
        assertThat(outlier.getAnnotation().hasSource(AnomalySource.DENSITY)).isTrue();
        assertThat(outlier.getAnnotation().getLofScore()).isGreaterThan(2.0);
        assertThat(records.get(4).getAnnotation().isLofAnomaly()).isFalse();
    }
    
    @Test
    void testDetect_withSingleRecord_isNoOp() {
        List<AnnotatedRecord> records = List.of(record(0));
        
        int flagged = new DensityOutlierDetector(20, 0.05).detect(records, List.of(new double[] {1.0}));
        
        assertThat(flagged).isZero();
        assertThat(records.get(0).getAnnotation().getLofScore()).isEqualTo(0.0);
    }
    
    @Test
    void shouldRejectContaminationOutOfRange() {
        assertThatThrownBy(() -> new DensityOutlierDetector(5, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DensityOutlierDetector(5, 0.6)).isInstanceOf(IllegalArgumentException.class);
    }
    
    private static AnnotatedRecord record(int index) {
        return new AnnotatedRecord(index, new LogRecord(null, "message " + index, "app"));
    }
}
