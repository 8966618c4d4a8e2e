package com.loglens.classification;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationPhaseTest {

    @Test
    void shouldParsePhaseNamesIgnoringCase() {
        assertThat(ClassificationPhase.from("prepare")).isEqualTo(ClassificationPhase.PREPARE);
        assertThat(ClassificationPhase.from(" Classify ")).isEqualTo(ClassificationPhase.CLASSIFY);
        assertThat(ClassificationPhase.from("FULL")).isEqualTo(ClassificationPhase.FULL);
    }

    @Test
    void shouldDefaultToFullWhenUnset() {
        assertThat(ClassificationPhase.from(null)).isEqualTo(ClassificationPhase.FULL);
        assertThat(ClassificationPhase.from("  ")).isEqualTo(ClassificationPhase.FULL);
    }

    @Test
    void shouldRejectUnknownPhase() {
        assertThatThrownBy(() -> ClassificationPhase.from("later"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("later");
    }
}
