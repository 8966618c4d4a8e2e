package com.loglens.detection;

import java.util.Collections;
import java.util.List;

/**
 * Frequency profile of the templates in a batch.
 */
public class TemplateVolumeStats {
    
    private final int totalRecords;
    private final int uniqueTemplates;
    private final double entropy;
    private final double topTemplateRatio;
    private final List<TemplateFrequency> topTemplates;
    private final List<TemplateFrequency> floodTemplates;
    
    public TemplateVolumeStats(int totalRecords, int uniqueTemplates, double entropy, double topTemplateRatio,
                               List<TemplateFrequency> topTemplates, List<TemplateFrequency> floodTemplates) {
        this.totalRecords = totalRecords;
        this.uniqueTemplates = uniqueTemplates;
        this.entropy = entropy;
        this.topTemplateRatio = topTemplateRatio;
        this.topTemplates = Collections.unmodifiableList(topTemplates);
        this.floodTemplates = Collections.unmodifiableList(floodTemplates);
    }
    
    public static TemplateVolumeStats empty() {
        return new TemplateVolumeStats(0, 0, 0.0, 0.0, List.of(), List.of());
    }
    
    public int getTotalRecords() {
        return totalRecords;
    }
    
    public int getUniqueTemplates() {
        return uniqueTemplates;
    }
    
    /** Shannon entropy in bits, unrounded. */
    public double getEntropy() {
        return entropy;
    }
    
    public double getTopTemplateRatio() {
        return topTemplateRatio;
    }
    
    public List<TemplateFrequency> getTopTemplates() {
        return topTemplates;
    }
    
    /** Templates whose share of the whole batch reaches the spam threshold. */
    public List<TemplateFrequency> getFloodTemplates() {
        return floodTemplates;
    }
    
    public static class TemplateFrequency {
        private final String template;
        private final long count;
        private final double ratio;
        
        public TemplateFrequency(String template, long count, double ratio) {
            this.template = template;
            this.count = count;
            this.ratio = ratio;
        }
        
        public String getTemplate() {
            return template;
        }
        
        public long getCount() {
            return count;
        }
        
        public double getRatio() {
            return ratio;
        }
    }
}
