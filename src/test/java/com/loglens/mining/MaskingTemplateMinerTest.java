package com.loglens.mining;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class MaskingTemplateMinerTest {

    @Test
    void shouldMaskAddressesAndNumbers() {
        assertThat(MaskingTemplateMiner.mask("Connection from 192.168.1.10:8080 closed after 35 ms"))
            .isEqualTo("Connection from <IP> closed after <NUM> ms");
    }

    @Test
    void shouldMaskQuotedStringsAndPaths() {
        assertThat(MaskingTemplateMiner.mask("user \"alice\" opened /var/log/app.log"))
            .isEqualTo("user <STR> opened <PATH>");
    }

    @Test
    void shouldMaskTimestampsHexAndUuids() {
        assertThat(MaskingTemplateMiner.mask("2024-01-01T10:00:00Z job 0xdeadbeef done"))
            .isEqualTo("<TS> job <HEX> done");
        assertThat(MaskingTemplateMiner.mask("request 123e4567-e89b-12d3-a456-426614174000 failed"))
            .isEqualTo("request <UUID> failed");
    }

    @Test
    void shouldCollapseWhitespaceAndHandleBlank() {
        assertThat(MaskingTemplateMiner.mask("  cache   miss\tfor key  ")).isEqualTo("cache miss for key");
        assertThat(MaskingTemplateMiner.mask("   ")).isEmpty();
        assertThat(MaskingTemplateMiner.mask(null)).isEmpty();
    }

    @Test
    void shouldCountTemplatesInFirstSeenOrder() {
        // Given
        MaskingTemplateMiner miner = new MaskingTemplateMiner();

        // When
        List<String> templates = miner.mineAll(List.of(
            "worker 1 started", "disk full", "worker 2 started", "worker 3 started"));

        // Then
        assertThat(templates).containsExactly(
            "worker <NUM> started", "disk full", "worker <NUM> started", "worker <NUM> started");
        assertThat(miner.templateCount()).isEqualTo(2);
        assertThat(miner.templateCounts()).containsExactly(
            entry("worker <NUM> started", 3), entry("disk full", 1));
    }
}
