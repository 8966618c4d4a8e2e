package com.loglens.detection;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.DetectionAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * k-nearest-neighbour outlier scoring.
 * 
 * Each record's score is its mean cosine distance to its k nearest other
 * records. The top {@code ceil(topPercent * n)} records by score (at least one)
 * are flagged as statistical anomalies.
 */
public class StatisticalOutlierDetector {
    
    private static final Logger log = LoggerFactory.getLogger(StatisticalOutlierDetector.class);
    
    private final double topPercent;
    private final int nNeighbors;
    
    public StatisticalOutlierDetector(double topPercent, int nNeighbors) {
        if (topPercent <= 0.0 || topPercent > 1.0) {
            throw new IllegalArgumentException("topPercent must be in (0, 1] but was " + topPercent);
        }
        if (nNeighbors < 1) {
            throw new IllegalArgumentException("nNeighbors must be positive but was " + nNeighbors);
        }
        this.topPercent = topPercent;
        this.nNeighbors = nNeighbors;
    }
    
    /**
     * Scores the records and flags the top fraction.
     *
     * @param records records to score, annotated in place
     * @param vectors one embedding per record, same order
     * @return number of records flagged
     */
    public int detect(List<AnnotatedRecord> records, List<double[]> vectors) {
        if (records.size() != vectors.size()) {
            throw new IllegalArgumentException("Expected one vector per record: "
                + records.size() + " records, " + vectors.size() + " vectors");
        }
        int n = records.size();
        if (n < 2) {
            records.forEach(r -> r.getAnnotation().setKnnScore(0.0));
            log.debug("KNN detection skipped: {} record(s)", n);
            return 0;
        }
        
        int k = Math.min(nNeighbors, n - 1);
        if (k < nNeighbors) {
            log.warn("KNN neighbours clamped from {} to {} for {} records", nNeighbors, k, n);
        }
        
        NearestNeighbors neighbors = NearestNeighbors.search(vectors, k, VectorMath::cosineDistance);
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            records.get(i).getAnnotation().setKnnScore(neighbors.meanDistance(i));
            order.add(i);
        }
        
        order.sort(Comparator
            .comparingDouble((Integer i) -> records.get(i).getAnnotation().getKnnScore())
            .reversed()
            .thenComparingInt(i -> i));
        
        int flagged = anomalyCount(n);
        for (int rank = 0; rank < flagged; rank++) {
            DetectionAnnotation annotation = records.get(order.get(rank)).getAnnotation();
            annotation.setKnnAnomaly(true);
            annotation.markAnomaly(AnomalySource.STATISTICAL);
        }
        log.info("KNN detection flagged {} of {} records (k={}, topPercent={})", flagged, n, k, topPercent);
        return flagged;
    }
    
    int anomalyCount(int n) {
        // epsilon keeps 0.03 * 100 from rounding up to 4
        int count = (int) Math.ceil(topPercent * n - 1e-9);
        return Math.max(1, Math.min(count, n));
    }
    
    public double getTopPercent() {
        return topPercent;
    }
    
    public int getNNeighbors() {
        return nNeighbors;
    }
}
