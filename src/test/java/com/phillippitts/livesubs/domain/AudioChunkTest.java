package com.phillippitts.livesubs.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AudioChunk}.
 */
class AudioChunkTest {

    @Test
    void shouldCompareSampleContentRatherThanArrayIdentity() {
        AudioChunk a = new AudioChunk(3, new short[] {1, 2, 3}, 0.5, false);
        AudioChunk b = new AudioChunk(3, new short[] {1, 2, 3}, 0.5, false);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void shouldDifferWhenSamplesOrFlagsDiffer() {
        AudioChunk base = new AudioChunk(3, new short[] {1, 2, 3}, 0.5, false);

        assertThat(base).isNotEqualTo(new AudioChunk(3, new short[] {1, 2, 4}, 0.5, false));
        assertThat(base).isNotEqualTo(new AudioChunk(3, new short[] {1, 2, 3}, 0.5, true));
        assertThat(base).isNotEqualTo(new AudioChunk(4, new short[] {1, 2, 3}, 0.5, false));
    }

    @Test
    void shouldPrintSampleCountInsteadOfArray() {
        AudioChunk chunk = new AudioChunk(0, new short[160], 0.01, true);

        assertThat(chunk.toString()).contains("samples=160").contains("isFinal=true");
    }

    @Test
    void shouldRejectEmptySamplesAndNegativeSequence() {
        assertThatThrownBy(() -> new AudioChunk(0, new short[0], 0.0, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AudioChunk(-1, new short[] {1}, 0.1, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
