package com.loglens.embedding;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic embedding based on signed feature hashing.
 * 
 * Features are lower-cased word tokens plus character trigrams of each token,
 * hashed with murmur3 into {@code dimensions} buckets. The sign of each
 * contribution comes from a second hash bit so collisions tend to cancel. The
 * result is L2-normalised; empty text maps to the zero vector.
 */
public class HashingEmbeddingClient implements EmbeddingClient {
    
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{Alnum}<>_]+");
    private static final double TRIGRAM_WEIGHT = 0.5;
    
    private final int dimensions;
    private final HashFunction hashFunction = Hashing.murmur3_32_fixed();
    
    public HashingEmbeddingClient(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive: " + dimensions);
        }
        this.dimensions = dimensions;
    }
    
    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimensions];
        if (text == null || text.isBlank()) {
            return vector;
        }
        
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            addFeature(vector, "w:" + token, 1.0);
            String padded = "^" + token + "$";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                addFeature(vector, "c:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }
        
        normalize(vector);
        return vector;
    }
    
    private void addFeature(double[] vector, String feature, double weight) {
        int hash = hashFunction.hashString(feature, StandardCharsets.UTF_8).asInt();
        int bucket = Math.floorMod(hash, dimensions);
        double sign = (hash & 0x80000000) == 0 ? 1.0 : -1.0;
        vector[bucket] += sign * weight;
    }
    
    private static void normalize(double[] vector) {
        double norm = 0.0;
        for (double v : vector) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
    
    @Override
    public int dimensions() {
        return dimensions;
    }
}
