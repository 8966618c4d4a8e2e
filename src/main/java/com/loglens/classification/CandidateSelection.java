package com.loglens.classification;

import com.loglens.domain.ClassificationCandidate;

import java.util.List;

/**
 * Candidates chosen for classification and the number dropped by the allow-list.
 */
public class CandidateSelection {
    
    private final List<ClassificationCandidate> candidates;
    private final int falsePositivesFiltered;
    
    public CandidateSelection(List<ClassificationCandidate> candidates, int falsePositivesFiltered) {
        this.candidates = List.copyOf(candidates);
        this.falsePositivesFiltered = falsePositivesFiltered;
    }
    
    public List<ClassificationCandidate> getCandidates() {
        return candidates;
    }
    
    public int getFalsePositivesFiltered() {
        return falsePositivesFiltered;
    }
}
