package com.phillippitts.livesubs.service.stt.whisper;

import com.phillippitts.livesubs.config.properties.WhisperProperties;
import com.phillippitts.livesubs.domain.AudioChunk;
import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.exception.ModelLoadException;
import com.phillippitts.livesubs.exception.RecognitionException;
import com.phillippitts.livesubs.service.audio.AudioFormat;
import com.phillippitts.livesubs.service.audio.WavWriter;
import com.phillippitts.livesubs.service.engine.AbstractModelEngine;
import com.phillippitts.livesubs.service.stt.RecognitionEngine;
import com.phillippitts.livesubs.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Recognition engine backed by the whisper.cpp command-line tool.
 *
 * <p>Each chunk is treated as one utterance: whisper's segments are reported as cumulative
 * partials, followed by a single final result carrying the full text. A chunk with no speech
 * produces nothing.
 */
@Component
public class WhisperRecognitionEngine extends AbstractModelEngine implements RecognitionEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperRecognitionEngine.class);

    static final String ENGINE = "whisper";

    private final WhisperProperties cfg;
    private final WhisperProcessManager manager;
    private final AtomicLong nextSegmentId = new AtomicLong();

    public WhisperRecognitionEngine(WhisperProperties cfg, WhisperProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    protected void doLoadModel() {
        Path binary = WhisperProcessManager.resolvePath(cfg.binaryPath());
        Path model = WhisperProcessManager.resolvePath(cfg.modelPath());
        if (!Files.isRegularFile(binary) || !Files.isExecutable(binary)) {
            throw new ModelLoadException(ENGINE, "whisper binary missing or not executable: " + binary);
        }
        if (!Files.isRegularFile(model) || !Files.isReadable(model)) {
            throw new ModelLoadException(ENGINE, "whisper model missing or unreadable: " + model);
        }
        LOG.info("Whisper engine loaded: bin={}, model={}, lang={}, threads={}, timeout={}s",
                binary, model, cfg.language(), cfg.threads(), cfg.timeoutSeconds());
    }

    @Override
    public void warmUp() {
        long start = System.nanoTime();
        short[] silence = new short[AudioFormat.SAMPLE_RATE];
        List<String> segments = runWhisper(silence);
        LOG.info("Whisper warm-up finished in {} ms ({} segments)", TimeUtils.elapsedMillis(start), segments.size());
    }

    @Override
    public void transcribe(AudioChunk chunk, Consumer<RecognitionResult> listener) {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(listener, "listener");
        long start = System.nanoTime();
        List<String> segments = runWhisper(chunk.samples());
        if (segments.isEmpty()) {
            LOG.debug("Chunk {} produced no speech", chunk.sequence());
            return;
        }
        long segmentId = nextSegmentId.getAndIncrement();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            text.append(segments.get(i));
            if (i < segments.size() - 1) {
                listener.accept(RecognitionResult.partial(chunk.sequence(), segmentId, i, text.toString().strip()));
            }
        }
        listener.accept(RecognitionResult.finalSegment(chunk.sequence(), segmentId, segments.size(),
                text.toString().strip()));
        LOG.debug("Whisper transcribed chunk {} in {} ms ({} segments)",
                chunk.sequence(), TimeUtils.elapsedMillis(start), segments.size());
    }

    private List<String> runWhisper(short[] samples) {
        if (!isReady()) {
            throw new RecognitionException("engine not loaded", ENGINE);
        }
        Path wav = null;
        try {
            wav = Files.createTempFile("livesubs-", ".wav");
            WavWriter.write(samples, wav);
            return WhisperJsonParser.extractSegments(manager.run(wav, cfg));
        } catch (IOException | IllegalStateException e) {
            throw new RecognitionException("Cannot prepare audio: " + e.getMessage(), ENGINE, e);
        } catch (JSONException e) {
            throw new RecognitionException("Malformed whisper output: " + e.getMessage(), ENGINE, e);
        } finally {
            deleteTempFile(wav);
        }
    }

    private static void deleteTempFile(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.debug("Could not delete temp WAV {}: {}", wav, e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    @Override
    protected void doClose() {
        manager.close();
        LOG.info("Whisper engine closed");
    }
}
