package com.loglens.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecordIdGeneratorTest {

    @Test
    void shouldProduceSixteenHexCharacters() {
        String id = RecordIdGenerator.recordId("2024-01-01T10:00:00Z", "database error");

        assertThat(id).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    void shouldIgnoreTimestampLayout() {
        // Given: the same instant in two layouts
        String iso = RecordIdGenerator.recordId("2024-01-01T10:00:00Z", "database error");
        String spaced = RecordIdGenerator.recordId("2024-01-01 10:00:00", "database error");

        // Then
        assertThat(spaced).isEqualTo(iso);
    }

    @Test
    void shouldDifferByMessage() {
        String a = RecordIdGenerator.recordId("2024-01-01T10:00:00Z", "database error");
        String b = RecordIdGenerator.recordId("2024-01-01T10:00:00Z", "database errors");

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void shouldAcceptMissingValues() {
        assertThat(RecordIdGenerator.recordId(null, null))
            .isEqualTo(RecordIdGenerator.recordId("", ""));
    }
}
