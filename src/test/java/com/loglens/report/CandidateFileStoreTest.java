package com.loglens.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.CandidateRecord;
import com.loglens.ingestion.BatchLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateFileStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void shouldSaveAndLoadCandidates() {
        // Given
        CandidateFileStore store = new CandidateFileStore(objectMapper, tempDir.resolve("results"));
        CandidateRecord candidate = candidate(7, "worker stalled");
        candidate.setKnnScore(2.5);
        candidate.setContextLogs(List.of("queue depth 900", "worker stalled"));

        // When
        Optional<Path> saved = store.save(List.of(candidate), "/var/log/app.log");

        // Then
        assertThat(saved).contains(tempDir.resolve("results").resolve("app_llm_candidates.jsonl"));
        List<CandidateRecord> loaded = store.load(saved.get());
        assertThat(loaded).hasSize(1);
        assertThat(loaded.get(0).getIndex()).isEqualTo(7);
        assertThat(loaded.get(0).getKnnScore()).isEqualTo(2.5);
        assertThat(loaded.get(0).getContextLogs()).containsExactly("queue depth 900", "worker stalled");
    }

    @Test
    void shouldNotWriteFileWithoutCandidates() {
        // Given
        CandidateFileStore store = new CandidateFileStore(objectMapper, tempDir);

        // When
        Optional<Path> saved = store.save(List.of(), "app.log");

        // Then
        assertThat(saved).isEmpty();
        assertThat(tempDir.resolve("app_llm_candidates.jsonl")).doesNotExist();
    }

    @Test
    void shouldListOnlyCandidatesFilesInNameOrder() throws Exception {
        // Given
        CandidateFileStore store = new CandidateFileStore(objectMapper, tempDir);
        store.save(List.of(candidate(1, "b")), "zeta.log");
        store.save(List.of(candidate(1, "a")), "alpha.log");
        Files.writeString(tempDir.resolve("alpha_anomalies.jsonl"), "{}\n");

        // When
        List<Path> pending = store.pendingFiles();

        // Then
        assertThat(pending).extracting(path -> path.getFileName().toString())
            .containsExactly("alpha_llm_candidates.jsonl", "zeta_llm_candidates.jsonl");
    }

    @Test
    void shouldReturnNoPendingFilesForMissingFolder() {
        CandidateFileStore store = new CandidateFileStore(objectMapper, tempDir.resolve("missing"));

        assertThat(store.pendingFiles()).isEmpty();
    }

    @Test
    void shouldSaveResultsAndDeleteCandidatesFile() throws Exception {
        // Given
        CandidateFileStore store = new CandidateFileStore(objectMapper, tempDir);
        Path candidates = store.save(List.of(candidate(4, "disk full")), "app.log").orElseThrow();
        AnomalyRecord classified = new AnomalyRecord();
        classified.setIndex(4);
        classified.setClassification("Resource Exhaustion");

        // When
        Path results = store.saveResults(candidates, List.of(classified));

        // Then
        assertThat(results).isEqualTo(tempDir.resolve("app_llm_results.jsonl"));
        assertThat(candidates).doesNotExist();
        List<String> lines = Files.readAllLines(results, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1);
        assertThat(objectMapper.readTree(lines.get(0)).get("classification").asText())
            .isEqualTo("Resource Exhaustion");
    }

    @Test
    void shouldRejectMalformedCandidateLine() throws Exception {
        // Given
        CandidateFileStore store = new CandidateFileStore(objectMapper, tempDir);
        Path file = tempDir.resolve("app_llm_candidates.jsonl");
        Files.writeString(file, "{\"index\":1,\"message\":\"ok\"}\n\n{ broken\n");

        // When / Then
        assertThatThrownBy(() -> store.load(file))
            .isInstanceOf(BatchLoadException.class)
            .hasMessageContaining("line 3");
    }

    private static CandidateRecord candidate(int index, String message) {
        CandidateRecord candidate = new CandidateRecord();
        candidate.setIndex(index);
        candidate.setMessage(message);
        candidate.setSource("app");
        return candidate;
    }
}
