package com.loglens.detection;

import com.loglens.detection.TemplateVolumeStats.TemplateFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global template frequency analysis: top templates, Shannon entropy of the
 * distribution and templates that dominate the whole batch.
 */
public class VolumeAnalyzer {
    
    private static final Logger log = LoggerFactory.getLogger(VolumeAnalyzer.class);
    private static final int TOP_N = 5;
    
    private final double spamTemplateThreshold;
    
    public VolumeAnalyzer(double spamTemplateThreshold) {
        this.spamTemplateThreshold = spamTemplateThreshold;
    }
    
    public TemplateVolumeStats analyze(List<String> templates) {
        if (templates.isEmpty()) {
            return TemplateVolumeStats.empty();
        }
        
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String template : templates) {
            counts.merge(template, 1L, Long::sum);
        }
        
        double total = templates.size();
        List<TemplateFrequency> frequencies = new ArrayList<>(counts.size());
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            frequencies.add(new TemplateFrequency(entry.getKey(), entry.getValue(), entry.getValue() / total));
        }
        // stable: equal counts keep first-seen order
        frequencies.sort(Comparator.comparingLong(TemplateFrequency::getCount).reversed());
        
        double entropy = entropy(counts.values(), total);
        double topRatio = frequencies.get(0).getRatio();
        
        List<TemplateFrequency> floods = new ArrayList<>();
        for (TemplateFrequency frequency : frequencies) {
            if (frequency.getRatio() >= spamTemplateThreshold) {
                floods.add(frequency);
            }
        }
        if (!floods.isEmpty()) {
            log.warn("{} template(s) exceed the global spam threshold {}", floods.size(), spamTemplateThreshold);
        }
        
        return new TemplateVolumeStats(templates.size(), counts.size(), entropy, topRatio,
            new ArrayList<>(frequencies.subList(0, Math.min(TOP_N, frequencies.size()))), floods);
    }
    
    /**
     * Shannon entropy {@code -sum p log2 p}.
     */
    static double entropy(Iterable<Long> counts, double total) {
        double entropy = 0.0;
        for (long count : counts) {
            double p = count / total;
            if (p > 0) {
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        // single template gives -0.0
        return entropy == 0.0 ? 0.0 : entropy;
    }
    
    public double getSpamTemplateThreshold() {
        return spamTemplateThreshold;
    }
}
