package com.loglens.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.CandidateRecord;
import com.loglens.domain.LogRecord;
import com.loglens.domain.SiemReport;
import com.loglens.ingestion.LogBatchLoader;
import com.loglens.report.CandidateFileStore;
import com.loglens.report.ReportWriteException;
import com.loglens.report.ReportWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LogAnalysisServiceTest {

    @TempDir
    Path input;

    private AnalysisPipeline pipeline;
    private ReportWriter writer;
    private CandidateFileStore candidateStore;
    private Path results;
    private SimpleMeterRegistry registry;
    private LogAnalysisService service;

    @BeforeEach
    void setUp() {
        pipeline = mock(AnalysisPipeline.class);
        writer = mock(ReportWriter.class);
        registry = new SimpleMeterRegistry();
        LogBatchLoader loader = new LogBatchLoader(new ObjectMapper(), 0, 100_000);
        results = input.resolve("results");
        candidateStore = new CandidateFileStore(new ObjectMapper(), results);
        service = new LogAnalysisService(loader, pipeline, writer, candidateStore, new PipelineMetrics(registry));
        when(pipeline.analyze(anyString(), anyList()))
            .thenAnswer(invocation -> new BatchReport(new SiemReport(), List.of()));
    }

    @Test
    void shouldAnalyseAndWriteRecords() {
        // Given
        List<LogRecord> records = List.of(new LogRecord(null, "service started", "api-batch"));

        // When
        BatchReport result = service.analyzeRecords("api-batch", records);

        // Then
        verify(pipeline).analyze("api-batch", records);
        verify(writer).write(result.getReport(), result.getAnomalies(), "api-batch");
    }

    @Test
    void shouldContinuePastFilesThatFailToLoad() throws Exception {
        // Given: one broken JSON file between two readable ones, plus an unsupported file
        Files.writeString(input.resolve("a.log"), "2024-03-01T10:00:00Z service started\n");
        Files.writeString(input.resolve("b.json"), "{ broken");
        Files.writeString(input.resolve("c.txt"), "plain line\n");
        Files.writeString(input.resolve("d.csv"), "ignored,row\n");

        // When
        int analysed = service.analyzeFolder(input);

        // Then
        assertThat(analysed).isEqualTo(2);
        verify(pipeline).analyze(eq("a.log"), anyList());
        verify(pipeline).analyze(eq("c.txt"), anyList());
        verify(pipeline, never()).analyze(eq("b.json"), anyList());
        verify(pipeline, never()).analyze(eq("d.csv"), anyList());
        assertThat(registry.get("loglens.batches.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldContinuePastFilesThatFailToWrite() throws Exception {
        // Given
        Files.writeString(input.resolve("a.log"), "first\n");
        Files.writeString(input.resolve("b.log"), "second\n");
        doThrow(new ReportWriteException("Failed to write summary", input, new IOException("disk full")))
            .when(writer).write(any(), anyList(), eq("a.log"));

        // When
        int analysed = service.analyzeFolder(input);

        // Then
        assertThat(analysed).isEqualTo(1);
        verify(writer).write(any(), anyList(), eq("b.log"));
    }

    @Test
    void shouldSaveCandidatesOfPreparePhaseAndReferenceThemInReport() {
        // Given
        CandidateRecord candidate = new CandidateRecord();
        candidate.setIndex(4);
        candidate.setMessage("worker stalled");
        when(pipeline.analyze(eq("api-batch"), anyList()))
            .thenReturn(new BatchReport(new SiemReport(), List.of(), List.of(candidate)));

        // When
        BatchReport result = service.analyzeRecords("api-batch", List.of(new LogRecord(null, "worker stalled", "api")));

        // Then
        Path saved = results.resolve("api-batch_llm_candidates.jsonl");
        assertThat(saved).exists();
        assertThat(candidateStore.load(saved)).extracting(CandidateRecord::getIndex).containsExactly(4);
        assertThat(result.getReport().getReportOutputs().getCandidatesFile()).isEqualTo(saved.toString());
        verify(writer).write(result.getReport(), result.getAnomalies(), "api-batch");
    }

    @Test
    void shouldClassifyPendingCandidatesAndSkipBrokenFiles() throws Exception {
        // Given: one readable candidates file and one broken one
        CandidateRecord candidate = new CandidateRecord();
        candidate.setIndex(2);
        candidate.setMessage("worker stalled");
        candidateStore.save(List.of(candidate), "app.log");
        Files.writeString(results.resolve("broken_llm_candidates.jsonl"), "{ nope\n");
        AnomalyRecord classified = new AnomalyRecord();
        classified.setIndex(2);
        classified.setClassification("Performance Issue");
        when(pipeline.isClassificationEnabled()).thenReturn(true);
        when(pipeline.classifyPrepared(eq("app_llm_candidates.jsonl"), anyList())).thenReturn(List.of(classified));

        // When
        int done = service.classifyPendingCandidates();

        // Then
        assertThat(done).isEqualTo(1);
        assertThat(results.resolve("app_llm_results.jsonl")).exists();
        assertThat(results.resolve("app_llm_candidates.jsonl")).doesNotExist();
        assertThat(results.resolve("broken_llm_candidates.jsonl")).exists();
        assertThat(registry.get("loglens.batches.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldLeaveCandidatesInPlaceWhenClassificationIsDisabled() {
        // Given
        CandidateRecord candidate = new CandidateRecord();
        candidate.setMessage("worker stalled");
        candidateStore.save(List.of(candidate), "app.log");

        // When
        int done = service.classifyPendingCandidates();

        // Then
        assertThat(done).isZero();
        assertThat(results.resolve("app_llm_candidates.jsonl")).exists();
        verify(pipeline, never()).classifyPrepared(anyString(), anyList());
    }

    @Test
    void shouldReturnZeroForMissingFolder() {
        assertThat(service.analyzeFolder(input.resolve("missing"))).isZero();
    }
}
