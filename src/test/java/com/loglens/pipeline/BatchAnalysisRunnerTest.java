package com.loglens.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BatchAnalysisRunnerTest {

    private LogAnalysisService analysisService;
    private BatchAnalysisRunner runner;

    @BeforeEach
    void setUp() {
        analysisService = mock(LogAnalysisService.class);
        runner = new BatchAnalysisRunner(analysisService);
        ReflectionTestUtils.setField(runner, "inputFolder", "input");
    }

    @Test
    void shouldAnalyseInputFolderInFullPhase() {
        // Given
        ReflectionTestUtils.setField(runner, "phase", "full");

        // When
        runner.run();

        // Then
        verify(analysisService).analyzeFolder(Path.of("input"));
        verify(analysisService, never()).classifyPendingCandidates();
    }

    @Test
    void shouldClassifyPendingCandidatesInClassifyPhase() {
        // Given
        ReflectionTestUtils.setField(runner, "phase", "CLASSIFY");

        // When
        runner.run();

        // Then
        verify(analysisService).classifyPendingCandidates();
        verify(analysisService, never()).analyzeFolder(any());
    }
}
