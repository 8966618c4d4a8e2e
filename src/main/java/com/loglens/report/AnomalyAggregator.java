package com.loglens.report;

import com.loglens.classification.ClassificationOutcome;
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
 * Concatenates the per-detector anomaly sets in a fixed order: rule based,
 * statistical (refined by the classifier when it ran), behavioral, flood.
 * Records are not deduplicated across sets.
 */
public class AnomalyAggregator {
    
    private static final Logger log = LoggerFactory.getLogger(AnomalyAggregator.class);
    
    /**
     * @param originals the batch before flood collapsing
     * @param sequence the batch after flood collapsing
     * @param classification classifier outcome, or null when classification did not run
     */
    public List<AggregatedAnomaly> aggregate(List<AnnotatedRecord> originals,
                                             List<AnnotatedRecord> sequence,
                                             ClassificationOutcome classification) {
        List<AggregatedAnomaly> result = new ArrayList<>();
        
        int ruleBased = 0;
        for (AnnotatedRecord record : originals) {
            if (record.getAnnotation().hasSource(AnomalySource.RULE_BASED)) {
                result.add(new AggregatedAnomaly(record, AnomalySource.RULE_BASED, true, null));
                ruleBased++;
            }
        }
        
        int statistical = 0;
        if (classification != null) {
            List<ClassificationCandidate> classified = new ArrayList<>(classification.getCandidates());
            classified.sort(Comparator.comparingInt(c -> c.getRecord().getIndex()));
            for (ClassificationCandidate candidate : classified) {
                if (candidate.getRecord().getAnnotation().isAnomaly()) {
                    result.add(new AggregatedAnomaly(candidate.getRecord(), AnomalySource.LLM, true,
                        candidate.getContextWindow()));
                    statistical++;
                }
            }
        } else {
            for (AnnotatedRecord record : sequence) {
                DetectionAnnotation annotation = record.getAnnotation();
                if (!record.isFloodSummary()
                    && annotation.isStatisticalAnomaly()
                    && !annotation.hasSource(AnomalySource.RULE_BASED)) {
                    AnomalySource source = annotation.isKnnAnomaly() ? AnomalySource.STATISTICAL : AnomalySource.DENSITY;
                    result.add(new AggregatedAnomaly(record, source, true, null));
                    statistical++;
                }
            }
        }
        
        int behavioral = 0;
        for (AnnotatedRecord record : originals) {
            if (record.getAnnotation().hasSource(AnomalySource.BEHAVIORAL)) {
                result.add(new AggregatedAnomaly(record, AnomalySource.BEHAVIORAL, true, null));
                behavioral++;
            }
        }
        
        int floods = 0;
        for (AnnotatedRecord record : sequence) {
            if (record.isFloodSummary()) {
                result.add(new AggregatedAnomaly(record, AnomalySource.FLOOD, record.getAnnotation().isAnomaly(), null));
                floods++;
            }
        }
        
        log.info("Final anomalies: {} rule-based, {} statistical, {} behavioral, {} flood",
            ruleBased, statistical, behavioral, floods);
        return result;
    }
}
