package com.loglens.detection;

import java.util.Arrays;

/**
 * Distance functions over dense vectors.
 */
public final class VectorMath {
    
    private VectorMath() {
    }
    
    /**
     * Cosine distance {@code 1 - cos(a, b)}. A zero vector is at distance 1
     * from everything.
     */
    public static double cosineDistance(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 1.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, 1.0 - similarity);
    }
    
    public static double euclideanDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
    
    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values the sample, not modified
     * @param percentile in [0, 100]
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take a percentile of an empty sample");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
