package com.loglens.classification;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.ClassificationCandidate;
import com.loglens.domain.DetectionAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the statistical anomalies worth a classifier call.
 * 
 * Records flagged by KNN or LOF that no rule already classified are ranked by
 * KNN score, then LOF score, both descending, and the top {@code topN} kept.
 * Allow-listed messages are removed afterwards and counted as false positives.
 * When the highest KNN score of the batch is below the anomaly threshold nothing
 * is selected.
 */
public class CandidateSelector {
    
    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);
    
    private static final Comparator<AnnotatedRecord> BY_SCORE = Comparator
        .comparingDouble((AnnotatedRecord r) -> score(r.getAnnotation().getKnnScore()))
        .thenComparingDouble(r -> score(r.getAnnotation().getLofScore()))
        .reversed()
        .thenComparingInt(AnnotatedRecord::getIndex);
    
    private final int topN;
    private final double anomalyThreshold;
    private final AllowListStore allowList;
    private final ContextWindowBuilder contextWindowBuilder;
    
    public CandidateSelector(int topN, AllowListStore allowList, ContextWindowBuilder contextWindowBuilder) {
        this(topN, 0.0, allowList, contextWindowBuilder);
    }
    
    /**
     * @param anomalyThreshold minimum batch-wide KNN score for any candidate to be selected
     */
    public CandidateSelector(int topN, double anomalyThreshold, AllowListStore allowList,
                             ContextWindowBuilder contextWindowBuilder) {
        this.topN = topN;
        this.anomalyThreshold = anomalyThreshold;
        this.allowList = allowList != null ? allowList : AllowListStore.NONE;
        this.contextWindowBuilder = contextWindowBuilder;
    }
    
    public CandidateSelection select(List<AnnotatedRecord> sequence, String sourceFile) {
        double maxScore = maxKnnScore(sequence);
        if (maxScore < anomalyThreshold) {
            log.info("Max anomaly score {} of {} is below threshold {}, skipping classification",
                String.format("%.4f", maxScore), sourceFile, anomalyThreshold);
            return new CandidateSelection(List.of(), 0);
        }
        
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < sequence.size(); i++) {
            AnnotatedRecord record = sequence.get(i);
            DetectionAnnotation annotation = record.getAnnotation();
            if (!record.isFloodSummary()
                && annotation.isStatisticalAnomaly()
                && !annotation.hasSource(AnomalySource.RULE_BASED)) {
                positions.add(i);
            }
        }
        positions.sort((a, b) -> BY_SCORE.compare(sequence.get(a), sequence.get(b)));
        
        List<ClassificationCandidate> candidates = new ArrayList<>();
        int filtered = 0;
        for (int position : positions.subList(0, Math.min(topN, positions.size()))) {
            AnnotatedRecord record = sequence.get(position);
            if (allowList.isAllowListed(sourceFile, record.getMessage())) {
                filtered++;
                continue;
            }
            candidates.add(new ClassificationCandidate(record, contextWindowBuilder.build(sequence, position)));
        }
        log.debug("Selected {} of {} statistical anomalies for classification ({} allow-listed)",
            candidates.size(), positions.size(), filtered);
        return new CandidateSelection(candidates, filtered);
    }
    
    private static double maxKnnScore(List<AnnotatedRecord> sequence) {
        double max = 0.0;
        for (AnnotatedRecord record : sequence) {
            Double score = record.getAnnotation().getKnnScore();
            if (!record.isFloodSummary() && score != null && score > max) {
                max = score;
            }
        }
        return max;
    }
    
    private static double score(Double value) {
        return value != null ? value : Double.NEGATIVE_INFINITY;
    }
}
