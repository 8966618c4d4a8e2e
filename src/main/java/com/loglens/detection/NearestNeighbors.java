package com.loglens.detection;

import java.util.List;
import java.util.PriorityQueue;
import java.util.function.ToDoubleBiFunction;

/**
 * Exact brute-force k-nearest-neighbour search. A point is never its own
 * neighbour. Ties are broken by the lower index.
 */
public class NearestNeighbors {
    
    private final int[][] indices;
    private final double[][] distances;
    
    private NearestNeighbors(int[][] indices, double[][] distances) {
        this.indices = indices;
        this.distances = distances;
    }
    
    /**
     * @param vectors the points
     * @param k number of neighbours, at most {@code vectors.size() - 1}
     * @param metric distance function
     */
    public static NearestNeighbors search(List<double[]> vectors, int k,
                                          ToDoubleBiFunction<double[], double[]> metric) {
        int n = vectors.size();
        if (k < 1 || k > n - 1) {
            throw new IllegalArgumentException("k must be in [1, " + (n - 1) + "] but was " + k);
        }
        
        int[][] indices = new int[n][k];
        double[][] distances = new double[n][k];
        double[] row = new double[n];
        for (int i = 0; i < n; i++) {
            double[] point = vectors.get(i);
            for (int j = 0; j < n; j++) {
                row[j] = j == i ? Double.POSITIVE_INFINITY : metric.applyAsDouble(point, vectors.get(j));
            }
            
            // max-heap of the k best candidates, worst on top
            PriorityQueue<Integer> best = new PriorityQueue<>(k + 1, (a, b) -> {
                int cmp = Double.compare(row[b], row[a]);
                return cmp != 0 ? cmp : Integer.compare(b, a);
            });
            for (int j = 0; j < n; j++) {
                if (j == i) {
                    continue;
                }
                best.offer(j);
                if (best.size() > k) {
                    best.poll();
                }
            }
            for (int m = k - 1; m >= 0; m--) {
                int neighbor = best.poll();
                indices[i][m] = neighbor;
                distances[i][m] = row[neighbor];
            }
        }
        return new NearestNeighbors(indices, distances);
    }
    
    public int[] neighbors(int point) {
        return indices[point];
    }
    
    public double[] distances(int point) {
        return distances[point];
    }
    
    /**
     * Distance to the k-th nearest neighbour.
     */
    public double kDistance(int point) {
        double[] d = distances[point];
        return d[d.length - 1];
    }
    
    public double meanDistance(int point) {
        double sum = 0.0;
        for (double d : distances[point]) {
            sum += d;
        }
        return sum / distances[point].length;
    }
}
