package com.loglens.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed cache in front of another embedding client, keyed by the
 * exact input text. Repeated templates are embedded once per process.
 */
public class CachingEmbeddingClient implements EmbeddingClient {
    
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingClient.class);
    
    private final EmbeddingClient delegate;
    private final Cache<String, double[]> cache;
    
    public CachingEmbeddingClient(EmbeddingClient delegate, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build();
        log.info("Embedding cache initialized (maxSize={})", maximumSize);
    }
    
    @Override
    public double[] embed(String text) {
        String key = text != null ? text : "";
        return cache.get(key, delegate::embed).clone();
    }
    
    @Override
    public int dimensions() {
        return delegate.dimensions();
    }
    
    public CacheStats stats() {
        return cache.stats();
    }
}
