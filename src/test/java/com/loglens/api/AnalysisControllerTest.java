package com.loglens.api;

import com.loglens.domain.LogRecord;
import com.loglens.domain.SiemReport;
import com.loglens.pipeline.BatchReport;
import com.loglens.pipeline.LogAnalysisService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AnalysisController
 */
@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    private LogAnalysisService analysisService;

    private SimpleMeterRegistry registry;
    private AnalysisController controller;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        controller = new AnalysisController(analysisService, registry);
    }

    @Test
    void testAnalyze_Success() {
        // Given
        List<LogRecord> records = List.of(new LogRecord("2024-03-01T10:00:00Z", "database error", "orders"));
        SiemReport report = new SiemReport();
        when(analysisService.analyzeRecords("orders", records)).thenReturn(new BatchReport(report, List.of()));

        // When/Then
        StepVerifier.create(controller.analyze(Mono.just(new AnalysisRequest("orders", records))))
            .expectNext(report)
            .verifyComplete();
        assertThat(registry.get("loglens.api.requests.received").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testAnalyze_DefaultSourceName() {
        // Given
        List<LogRecord> records = List.of(new LogRecord(null, "service started", null));
        when(analysisService.analyzeRecords("api-batch", records))
            .thenReturn(new BatchReport(new SiemReport(), List.of()));

        // When/Then
        StepVerifier.create(controller.analyze(Mono.just(new AnalysisRequest(" ", records))))
            .expectNextCount(1)
            .verifyComplete();
        verify(analysisService).analyzeRecords("api-batch", records);
    }

    @Test
    void testAnalyze_EmptyRecordsRejected() {
        // When/Then
        StepVerifier.create(controller.analyze(Mono.just(new AnalysisRequest("orders", List.of()))))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ResponseStatusException.class);
                assertThat(((ResponseStatusException) error).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            })
            .verify();
        verify(analysisService, never()).analyzeRecords(anyString(), anyList());
        assertThat(registry.get("loglens.api.requests.rejected").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testAnalyze_MissingBody() {
        StepVerifier.create(controller.analyze(Mono.empty()))
            .expectError(ResponseStatusException.class)
            .verify();
    }
}
