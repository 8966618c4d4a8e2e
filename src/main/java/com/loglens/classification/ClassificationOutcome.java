package com.loglens.classification;

import com.loglens.domain.ClassificationCandidate;

import java.util.List;

/**
 * What the classification stage did to one batch.
 */
public class ClassificationOutcome {
    
    private final List<ClassificationCandidate> candidates;
    private final int falsePositivesFiltered;
    private final ClassificationStatistics statistics;
    private final String provider;
    private final String model;
    
    public ClassificationOutcome(List<ClassificationCandidate> candidates, int falsePositivesFiltered,
                                 ClassificationStatistics statistics, String provider, String model) {
        this.candidates = List.copyOf(candidates);
        this.falsePositivesFiltered = falsePositivesFiltered;
        this.statistics = statistics;
        this.provider = provider;
        this.model = model;
    }
    
    public List<ClassificationCandidate> getCandidates() {
        return candidates;
    }
    
    public int getCandidatesClassified() {
        return candidates.size();
    }
    
    public int getFalsePositivesFiltered() {
        return falsePositivesFiltered;
    }
    
    public ClassificationStatistics getStatistics() {
        return statistics;
    }
    
    public String getProvider() {
        return provider;
    }
    
    public String getModel() {
        return model;
    }
}
