package com.loglens.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps text to a fixed-dimension vector.
 * The same input must always produce the same vector.
 */
public interface EmbeddingClient {
    
    double[] embed(String text);
    
    int dimensions();
    
    default List<double[]> embedAll(List<String> texts) {
        List<double[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
