package com.phillippitts.livesubs.service.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WavWriterTest {

    @TempDir
    Path dir;

    @Test
    void shouldWriteValidWavHeaderAndPayload() throws IOException {
        short[] samples = new short[AudioFormat.SAMPLE_RATE];
        samples[0] = 0x0102;
        Path wav = dir.resolve("chunk.wav");

        WavWriter.write(samples, wav);
        byte[] all = Files.readAllBytes(wav);
        ByteBuffer header = ByteBuffer.wrap(all).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(all.length).isEqualTo(WavWriter.HEADER_SIZE + samples.length * 2);
        assertThat(new String(all, 0, 4)).isEqualTo("RIFF");
        assertThat(header.getInt(4)).isEqualTo(36 + samples.length * 2);
        assertThat(new String(all, 8, 4)).isEqualTo("WAVE");
        assertThat(header.getInt(16)).isEqualTo(16);
        assertThat(header.getShort(20)).isEqualTo((short) 1);
        assertThat(header.getShort(22)).isEqualTo((short) AudioFormat.CHANNELS);
        assertThat(header.getInt(24)).isEqualTo(AudioFormat.SAMPLE_RATE);
        assertThat(header.getInt(28)).isEqualTo(AudioFormat.BYTE_RATE);
        assertThat(header.getShort(32)).isEqualTo((short) AudioFormat.BLOCK_ALIGN);
        assertThat(header.getShort(34)).isEqualTo((short) AudioFormat.BITS_PER_SAMPLE);
        assertThat(new String(all, 36, 4)).isEqualTo("data");
        assertThat(header.getInt(40)).isEqualTo(samples.length * 2);
        assertThat(all[44]).isEqualTo((byte) 0x02);
        assertThat(all[45]).isEqualTo((byte) 0x01);
    }

    @Test
    void unwritablePathFails() {
        Path missingDir = dir.resolve("missing").resolve("chunk.wav");

        assertThatThrownBy(() -> WavWriter.write(new short[10], missingDir))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to write WAV file");
    }
}
