package com.phillippitts.livesubs.service.audio.capture;

import com.phillippitts.livesubs.config.properties.AudioCaptureProperties;
import com.phillippitts.livesubs.exception.AudioSourceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link JavaSoundAudioSource}.
 */
class JavaSoundAudioSourceTest {

    private final AudioCaptureProperties props = new AudioCaptureProperties(20, 100);
    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final ApplicationEventPublisher publisher = events::add;
    private JavaSoundAudioSource source;

    @AfterEach
    void tearDown() {
        if (source != null) {
            source.stop();
        }
    }

    @Test
    void shouldDeliverDecodedSamplesUntilStopped() throws Exception {
        // Arrange
        TargetDataLine line = repeatingLine((byte) 0x10);
        source = new JavaSoundAudioSource(props, publisher, providerFor(line));
        AtomicInteger samples = new AtomicInteger();
        List<Short> firstValues = new CopyOnWriteArrayList<>();

        // Act
        source.start(0, s -> {
            samples.addAndGet(s.length);
            firstValues.add(s[0]);
        });
        await().atMost(Duration.ofSeconds(2)).until(() -> samples.get() >= 640);
        source.stop();

        // Assert
        assertThat(source.isCapturing()).isFalse();
        assertThat(firstValues).contains((short) 0x1010);
        verify(line).start();
        verify(line).close();
        assertThat(events).isEmpty();
    }

    @Test
    void shouldAllowOnlyOneCaptureAtATime() throws Exception {
        source = new JavaSoundAudioSource(props, publisher, providerFor(repeatingLine((byte) 0)));
        source.start(0, s -> { });

        assertThatThrownBy(() -> source.start(0, s -> { }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already active");
        assertThat(source.isCapturing()).isTrue();
    }

    @Test
    void shouldFailStartForUnavailableDevice() {
        JavaSoundAudioSource.DataLineProvider provider = new StubProvider(null) {
            @Override
            public TargetDataLine open(AudioFormat format, int deviceIndex, int bufferBytes)
                    throws LineUnavailableException {
                throw new LineUnavailableException("busy");
            }
        };
        source = new JavaSoundAudioSource(props, publisher, provider);

        assertThatThrownBy(() -> source.start(2, s -> { }))
                .isInstanceOf(AudioSourceException.class)
                .hasMessageContaining("Microphone unavailable: busy")
                .satisfies(e -> assertThat(((AudioSourceException) e).getDeviceIndex()).isEqualTo(2));
        assertThat(source.isCapturing()).isFalse();
    }

    @Test
    void shouldPublishCaptureErrorAndEndCaptureOnReadFailure() throws Exception {
        TargetDataLine line = mock(TargetDataLine.class);
        when(line.read(any(byte[].class), anyInt(), anyInt())).thenThrow(new IllegalStateException("line lost"));
        source = new JavaSoundAudioSource(props, publisher, providerFor(line));

        source.start(1, s -> { });

        await().atMost(Duration.ofSeconds(2)).until(() -> !source.isCapturing());
        assertThat(events).singleElement().isInstanceOfSatisfying(CaptureErrorEvent.class, e -> {
            assertThat(e.reason()).isEqualTo("CAPTURE_ERROR");
            assertThat(e.deviceIndex()).isEqualTo(1);
        });
        verify(line).close();
    }

    @Test
    void shouldListCaptureMixersInProviderOrder() {
        Mixer.Info builtIn = new Mixer.Info("Built-in Microphone", "vendor", "desc", "1") { };
        Mixer.Info usb = new Mixer.Info("USB Audio", "vendor", "desc", "1") { };
        source = new JavaSoundAudioSource(props, publisher, new StubProvider(null, builtIn, usb));

        assertThat(source.listDevices()).containsExactly(
                new AudioDevice(0, "Built-in Microphone", 1, 16000),
                new AudioDevice(1, "USB Audio", 1, 16000));
    }

    private static TargetDataLine repeatingLine(byte value) throws Exception {
        TargetDataLine line = mock(TargetDataLine.class);
        when(line.read(any(byte[].class), anyInt(), anyInt())).thenAnswer(inv -> {
            byte[] buf = inv.getArgument(0);
            int off = inv.getArgument(1);
            int len = inv.getArgument(2);
            Arrays.fill(buf, off, off + len, value);
            Thread.sleep(5);
            return len;
        });
        return line;
    }

    private static JavaSoundAudioSource.DataLineProvider providerFor(TargetDataLine line) {
        return new StubProvider(line);
    }

    private static class StubProvider implements JavaSoundAudioSource.DataLineProvider {
        private final TargetDataLine line;
        private final List<Mixer.Info> mixers;

        StubProvider(TargetDataLine line, Mixer.Info... mixers) {
            this.line = line;
            this.mixers = List.of(mixers);
        }

        @Override
        public List<Mixer.Info> captureMixers(AudioFormat format) {
            return mixers;
        }

        @Override
        public TargetDataLine open(AudioFormat format, int deviceIndex, int bufferBytes)
                throws LineUnavailableException {
            return line;
        }
    }
}
