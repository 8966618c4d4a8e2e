package com.loglens.detection;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.AnomalySource;
import com.loglens.domain.DetectionAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Local outlier factor over Euclidean distance.
 * 
 * The local reachability density of a point is the inverse of its mean
 * reachability distance to its k neighbours. The outlier factor is the mean
 * density of the neighbours divided by the point's own density, so values
 * well above 1 mark sparse points. Points whose factor exceeds the
 * {@code (1 - contamination)} percentile of all factors are flagged.
 */
public class DensityOutlierDetector {
    
    private static final Logger log = LoggerFactory.getLogger(DensityOutlierDetector.class);
    private static final double DENSITY_EPSILON = 1e-10;
    
    private final int nNeighbors;
    private final double contamination;
    
    public DensityOutlierDetector(int nNeighbors, double contamination) {
        if (nNeighbors < 1) {
            throw new IllegalArgumentException("nNeighbors must be positive but was " + nNeighbors);
        }
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5] but was " + contamination);
        }
        this.nNeighbors = nNeighbors;
        this.contamination = contamination;
    }
    
    /**
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
            records.forEach(r -> r.getAnnotation().setLofScore(0.0));
            log.debug("LOF detection skipped: {} record(s)", n);
            return 0;
        }
        
        int k = Math.min(nNeighbors, n - 1);
        if (k < nNeighbors) {
            log.warn("LOF neighbours clamped from {} to {} for {} records", nNeighbors, k, n);
        }
        
        double[] scores = scores(vectors, k);
        double threshold = VectorMath.percentile(scores, 100.0 * (1.0 - contamination));
        
        int flagged = 0;
        for (int i = 0; i < n; i++) {
            DetectionAnnotation annotation = records.get(i).getAnnotation();
            annotation.setLofScore(scores[i]);
            if (scores[i] > threshold) {
                annotation.setLofAnomaly(true);
                annotation.markAnomaly(AnomalySource.DENSITY);
                flagged++;
            }
        }
        log.info("LOF detection flagged {} of {} records (k={}, threshold={})",
            flagged, n, k, String.format("%.4f", threshold));
        return flagged;
    }
    
    /**
     * Local outlier factor of every point.
     */
    double[] scores(List<double[]> vectors, int k) {
        int n = vectors.size();
        NearestNeighbors neighbors = NearestNeighbors.search(vectors, k, VectorMath::euclideanDistance);
        
        double[] lrd = new double[n];
        for (int p = 0; p < n; p++) {
            int[] hood = neighbors.neighbors(p);
            double[] dist = neighbors.distances(p);
            double reachSum = 0.0;
            for (int m = 0; m < hood.length; m++) {
                reachSum += Math.max(neighbors.kDistance(hood[m]), dist[m]);
            }
            lrd[p] = 1.0 / (reachSum / hood.length + DENSITY_EPSILON);
        }
        
        double[] lof = new double[n];
        for (int p = 0; p < n; p++) {
            int[] hood = neighbors.neighbors(p);
            double densitySum = 0.0;
            for (int o : hood) {
                densitySum += lrd[o];
            }
            lof[p] = (densitySum / hood.length) / lrd[p];
        }
        return lof;
    }
    
    public int getNNeighbors() {
        return nNeighbors;
    }
    
    public double getContamination() {
        return contamination;
    }
}
