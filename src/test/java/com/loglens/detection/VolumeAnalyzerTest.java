package com.loglens.detection;

import com.loglens.detection.TemplateVolumeStats.TemplateFrequency;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VolumeAnalyzerTest {
    
    private final VolumeAnalyzer analyzer = new VolumeAnalyzer(0.75);
    
    @Test
    void shouldComputeLog2EntropyForUniformDistribution() {
        // Given: four templates with equal frequency
        List<String> templates = List.of("a", "b", "c", "d", "a", "b", "c", "d");
        
        // When
        TemplateVolumeStats stats = analyzer.analyze(templates);
        
        // Then
        assertThat(stats.getEntropy()).isCloseTo(2.0, within(1e-9));
        assertThat(stats.getUniqueTemplates()).isEqualTo(4);
        assertThat(stats.getTotalRecords()).isEqualTo(8);
        assertThat(stats.getTopTemplateRatio()).isEqualTo(0.25);
        assertThat(stats.getFloodTemplates()).isEmpty();
    }
    
    @Test
    void shouldReportZeroEntropyForSingleTemplate() {
        TemplateVolumeStats stats = analyzer.analyze(List.of("only", "only", "only"));
        
        assertThat(stats.getEntropy()).isEqualTo(0.0);
        assertThat(stats.getTopTemplateRatio()).isEqualTo(1.0);
        assertThat(stats.getFloodTemplates()).extracting(TemplateFrequency::getTemplate).containsExactly("only");
    }
    
    @Test
    void shouldKeepTopFiveByCountWithFirstSeenTieBreak() {
        // Given
        List<String> templates = new ArrayList<>(List.of("x", "y", "z", "u", "v", "w"));
        templates.add("w");
        
        // When
        TemplateVolumeStats stats = analyzer.analyze(templates);
        
        // Then
        assertThat(stats.getTopTemplates()).extracting(TemplateFrequency::getTemplate)
            .containsExactly("w", "x", "y", "z", "u");
        assertThat(stats.getTopTemplates().get(0).getCount()).isEqualTo(2);
    }
    
    @Test
    void testAnalyze_withEmptyInput_returnsEmptyStats() {
        TemplateVolumeStats stats = analyzer.analyze(List.of());
        
        assertThat(stats.getTotalRecords()).isZero();
        assertThat(stats.getTopTemplates()).isEmpty();
    }
}
