package com.phillippitts.livesubs.service.audio.capture;

import com.phillippitts.livesubs.config.properties.AudioCaptureProperties;
import com.phillippitts.livesubs.exception.AudioSourceException;
import com.phillippitts.livesubs.service.audio.AudioFormat;
import com.phillippitts.livesubs.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.phillippitts.livesubs.service.audio.AudioFormat.BYTE_RATE;

/**
 * Java Sound based microphone source producing 16 kHz mono PCM samples.
 *
 * <p>The line is opened synchronously in {@link #start} so an unusable device fails the
 * pipeline start; reading then happens on a dedicated {@code audio-capture} daemon thread.
 */
@Service
public class JavaSoundAudioSource implements AudioSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSource.class);

    /** Abstraction over device enumeration and line opening (for testing). */
    public interface DataLineProvider {
        List<Mixer.Info> captureMixers(javax.sound.sampled.AudioFormat format);

        TargetDataLine open(javax.sound.sampled.AudioFormat format, int deviceIndex, int bufferBytes)
                throws LineUnavailableException;
    }

    private static final javax.sound.sampled.AudioFormat FORMAT = new javax.sound.sampled.AudioFormat(
            AudioFormat.SAMPLE_RATE,
            AudioFormat.BITS_PER_SAMPLE,
            AudioFormat.CHANNELS,
            AudioFormat.SIGNED,
            AudioFormat.BIG_ENDIAN
    );

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private Capture current;

    @Autowired
    public JavaSoundAudioSource(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioSource(AudioCaptureProperties props,
                         ApplicationEventPublisher publisher,
                         DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @Override
    public List<AudioDevice> listDevices() {
        List<Mixer.Info> mixers = provider.captureMixers(FORMAT);
        List<AudioDevice> devices = new ArrayList<>(mixers.size());
        for (int i = 0; i < mixers.size(); i++) {
            devices.add(new AudioDevice(i, mixers.get(i).getName(), AudioFormat.CHANNELS, AudioFormat.SAMPLE_RATE));
        }
        return List.copyOf(devices);
    }

    @Override
    public void start(int deviceIndex, SampleListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Another capture is already active");
            }
            TargetDataLine line = openLine(deviceIndex);
            line.start();
            Capture capture = new Capture(deviceIndex, line);
            capture.active.set(true);
            Thread t = new Thread(() -> doCapture(capture, listener), "audio-capture");
            t.setDaemon(true);
            capture.thread = t;
            current = capture;
            t.start();
            LOG.info("Audio capture started: device={}, read={}ms", deviceIndex, props.getReadChunkMillis());
        }
    }

    @Override
    public void stop() {
        Thread captureThread;
        synchronized (lock) {
            if (current == null) {
                return;
            }
            current.active.set(false);
            captureThread = current.thread;
            current = null;
        }
        // Join outside the lock; the capture thread never takes it
        joinThread(captureThread, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
    }

    @Override
    public boolean isCapturing() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (isCapturing()) {
            LOG.info("Shutting down with active capture; forcing cleanup");
            stop();
        }
    }

    private TargetDataLine openLine(int deviceIndex) {
        int bufferBytes = (props.getBufferMillis() * BYTE_RATE) / 1000;
        try {
            return provider.open(FORMAT, deviceIndex, bufferBytes);
        } catch (LineUnavailableException e) {
            throw new AudioSourceException(deviceIndex, "Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new AudioSourceException(deviceIndex, "Microphone access denied", e);
        } catch (IllegalArgumentException e) {
            throw new AudioSourceException(deviceIndex, "Device does not support 16 kHz mono PCM", e);
        }
    }

    private void doCapture(Capture capture, SampleListener listener) {
        int bytesPerRead = (props.getReadChunkMillis() * BYTE_RATE) / 1000;
        byte[] buf = new byte[bytesPerRead];
        long total = 0;
        try {
            while (capture.active.get()) {
                int n = capture.line.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                listener.onSamples(AudioFormat.toSamples(buf, n));
                total += n;
            }
            LOG.info("Audio capture completed: {} bytes captured", total);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Audio capture interrupted after {} bytes", total);
        } catch (RuntimeException e) {
            LOG.warn("Capture failed on device {}: {}", capture.deviceIndex, e.toString());
            publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", capture.deviceIndex, Instant.now()));
        } finally {
            capture.active.set(false);
            closeLine(capture.line);
        }
    }

    private static void closeLine(TargetDataLine line) {
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing capture line: {}", e.toString());
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms; interrupting", timeoutMs);
                thread.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static DataLineProvider defaultProvider() {
        return new DataLineProvider() {
            @Override
            public List<Mixer.Info> captureMixers(javax.sound.sampled.AudioFormat format) {
                DataLine.Info lineInfo = new DataLine.Info(TargetDataLine.class, format);
                List<Mixer.Info> result = new ArrayList<>();
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (AudioSystem.getMixer(info).isLineSupported(lineInfo)) {
                        result.add(info);
                    }
                }
                return result;
            }

            @Override
            public TargetDataLine open(javax.sound.sampled.AudioFormat format, int deviceIndex, int bufferBytes)
                    throws LineUnavailableException {
                DataLine.Info lineInfo = new DataLine.Info(TargetDataLine.class, format);
                TargetDataLine line;
                if (deviceIndex < 0) {
                    line = (TargetDataLine) AudioSystem.getLine(lineInfo);
                } else {
                    List<Mixer.Info> mixers = captureMixers(format);
                    if (deviceIndex >= mixers.size()) {
                        throw new LineUnavailableException("No capture device at index " + deviceIndex
                                + " (" + mixers.size() + " available)");
                    }
                    Mixer mixer = AudioSystem.getMixer(mixers.get(deviceIndex));
                    line = (TargetDataLine) mixer.getLine(lineInfo);
                }
                line.open(format, bufferBytes);
                return line;
            }
        };
    }

    private static final class Capture {
        final int deviceIndex;
        final TargetDataLine line;
        final AtomicBoolean active = new AtomicBoolean(false);
        volatile Thread thread;

        Capture(int deviceIndex, TargetDataLine line) {
            this.deviceIndex = deviceIndex;
            this.line = line;
        }
    }
}
