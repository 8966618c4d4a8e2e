package com.loglens.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loglens.domain.AnomalyRecord;
import com.loglens.domain.SiemReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteSummaryAndAnomalyStream() throws Exception {
        // Given
        Path results = tempDir.resolve("results");
        ReportWriter writer = new ReportWriter(objectMapper, results);
        SiemReport report = new SiemReport();
        AnomalyRecord first = new AnomalyRecord();
        first.setIndex(3);
        first.setMessage("database error");
        AnomalyRecord second = new AnomalyRecord();
        second.setIndex(9);
        second.setMessage("rare event");

        // When
        writer.write(report, List.of(first, second), "/var/log/app.json");

        // Then
        Path anomalies = results.resolve("app_anomalies.jsonl");
        Path summary = results.resolve("app_summary.json");
        List<String> lines = Files.readAllLines(anomalies, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(objectMapper.readTree(lines.get(0)).get("index").asInt()).isEqualTo(3);
        assertThat(objectMapper.readTree(lines.get(1)).get("message").asText()).isEqualTo("rare event");

        JsonNode written = objectMapper.readTree(summary.toFile());
        assertThat(written.path("report_outputs").path("anomaly_count").asInt()).isEqualTo(2);
        assertThat(written.path("report_outputs").path("anomalies_file").asText()).isEqualTo(anomalies.toString());
        assertThat(report.getReportOutputs().getSummaryFile()).isEqualTo(summary.toString());
    }

    @Test
    void shouldWriteEmptyStreamWhenNothingWasFlagged() throws Exception {
        // Given
        ReportWriter writer = new ReportWriter(objectMapper, tempDir);

        // When
        writer.write(new SiemReport(), List.of(), "quiet.log");

        // Then
        assertThat(Files.readAllLines(tempDir.resolve("quiet_anomalies.jsonl"))).isEmpty();
        assertThat(tempDir.resolve("quiet_summary.json")).exists();
    }

    @Test
    void shouldFailWhenResultsFolderIsAFile() throws Exception {
        // Given
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        ReportWriter writer = new ReportWriter(objectMapper, blocker);

        // When/Then
        assertThatThrownBy(() -> writer.write(new SiemReport(), List.of(), "app.log"))
            .isInstanceOf(ReportWriteException.class);
    }

    @Test
    void testBaseName_withVariousSources() {
        assertThat(ReportWriter.baseName("logs/app.log")).isEqualTo("app");
        assertThat(ReportWriter.baseName("archive.tar.csv")).isEqualTo("archive.tar");
        assertThat(ReportWriter.baseName("README")).isEqualTo("README");
        assertThat(ReportWriter.baseName("")).isEqualTo("batch");
        assertThat(ReportWriter.baseName(null)).isEqualTo("batch");
    }
}
