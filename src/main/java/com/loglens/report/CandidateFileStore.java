package com.loglens.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.CandidateRecord;
import com.loglens.ingestion.BatchLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Hands classification candidates from a prepare run to a classify run through
 * the results folder.
 *
 * The prepare run saves {@code <base>_llm_candidates.jsonl}; the classify run
 * reads it, saves {@code <base>_llm_results.jsonl} and deletes the candidates file.
 */
public class CandidateFileStore {

    private static final Logger log = LoggerFactory.getLogger(CandidateFileStore.class);

    static final String CANDIDATES_SUFFIX = "_llm_candidates.jsonl";
    static final String RESULTS_SUFFIX = "_llm_results.jsonl";

    private final ObjectMapper objectMapper;
    private final Path resultsFolder;

    public CandidateFileStore(ObjectMapper objectMapper, Path resultsFolder) {
        this.objectMapper = objectMapper;
        this.resultsFolder = resultsFolder;
    }

    /**
     * @return the written file, or empty when there was nothing to save
     * @throws ReportWriteException if the file cannot be written
     */
    public Optional<Path> save(List<CandidateRecord> candidates, String sourceFile) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Path file = resultsFolder.resolve(ReportWriter.baseName(sourceFile) + CANDIDATES_SUFFIX);
        writeLines(file, candidates);
        log.info("Saved {} classification candidate(s) to {}", candidates.size(), file);
        return Optional.of(file);
    }

    /**
     * Candidate files waiting for a classify run, in name order.
     */
    public List<Path> pendingFiles() {
        if (!Files.isDirectory(resultsFolder)) {
            log.warn("Results folder {} does not exist", resultsFolder);
            return List.of();
        }
        try (Stream<Path> entries = Files.list(resultsFolder)) {
            return entries.filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(CANDIDATES_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BatchLoadException(resultsFolder.toString(), "Cannot list results folder", e);
        }
    }

    /**
     * @throws BatchLoadException if the file cannot be read or a line is not a candidate
     */
    public List<CandidateRecord> load(Path candidatesFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(candidatesFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BatchLoadException(candidatesFile.toString(), "Cannot read candidates", e);
        }
        List<CandidateRecord> candidates = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                candidates.add(objectMapper.readValue(line, CandidateRecord.class));
            } catch (JsonProcessingException e) {
                throw new BatchLoadException(candidatesFile.toString(),
                    "Malformed candidate on line " + (i + 1) + ": " + e.getOriginalMessage(), e);
            }
        }
        return candidates;
    }

    /**
     * Saves the classified candidates next to their candidates file, then deletes it.
     *
     * @return the results file
     * @throws ReportWriteException if the results cannot be written
     */
    public Path saveResults(Path candidatesFile, List<AnomalyRecord> classified) {
        String name = candidatesFile.getFileName().toString();
        String base = name.endsWith(CANDIDATES_SUFFIX)
            ? name.substring(0, name.length() - CANDIDATES_SUFFIX.length())
            : ReportWriter.baseName(name);
        Path resultsFile = candidatesFile.resolveSibling(base + RESULTS_SUFFIX);
        writeLines(resultsFile, classified);
        log.info("Saved {} classified candidate(s) to {}", classified.size(), resultsFile);
        try {
            Files.delete(candidatesFile);
        } catch (IOException e) {
            log.warn("Could not delete candidates file {}: {}", candidatesFile, e.getMessage(), e);
        }
        return resultsFile;
    }

    private void writeLines(Path file, List<?> lines) {
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw new ReportWriteException("Cannot create results folder", file.getParent(), e);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Object line : lines) {
                writer.write(objectMapper.writeValueAsString(line));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + file.getFileName(), file, e);
        }
    }
}
