package com.loglens.classification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Allow-list backed by JSON files named after the input file, each holding an
 * array of {@code {"log": "..."}} objects. Files are read once and kept in a
 * Caffeine cache as sets of normalized messages.
 */
public class FileAllowListStore implements AllowListStore {
    
    private static final Logger log = LoggerFactory.getLogger(FileAllowListStore.class);
    
    private final Path folder;
    private final ObjectMapper objectMapper;
    private final LoadingCache<String, Set<String>> entries;
    
    public FileAllowListStore(Path folder, ObjectMapper objectMapper) {
        this.folder = folder;
        this.objectMapper = objectMapper;
        this.entries = Caffeine.newBuilder()
            .maximumSize(256)
            .build(this::load);
    }
    
    @Override
    public boolean isAllowListed(String sourceFile, String message) {
        if (sourceFile == null || sourceFile.isEmpty()) {
            return false;
        }
        String fileName = Path.of(sourceFile).getFileName().toString();
        return entries.get(fileName).contains(MessageNormalizer.normalize(message));
    }
    
    private Set<String> load(String fileName) {
        Path file = folder.resolve(fileName);
        Set<String> normalized = new HashSet<>();
        if (!Files.isRegularFile(file)) {
            log.debug("No allow-list for {}", fileName);
            return normalized;
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root != null && root.isArray()) {
                for (JsonNode entry : root) {
                    String line = entry.path("log").asText("");
                    if (!line.isEmpty()) {
                        normalized.add(MessageNormalizer.normalize(line));
                    }
                }
            }
            log.info("Loaded {} allow-list entries from {}", normalized.size(), file);
        } catch (IOException e) {
            log.warn("Ignoring unreadable allow-list {}: {}", file, e.getMessage());
        }
        return normalized;
    }
}
