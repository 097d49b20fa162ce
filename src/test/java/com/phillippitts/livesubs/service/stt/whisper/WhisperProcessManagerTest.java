package com.phillippitts.livesubs.service.stt.whisper;

import com.phillippitts.livesubs.config.properties.WhisperProperties;
import com.phillippitts.livesubs.exception.RecognitionException;
import com.phillippitts.livesubs.service.stt.whisper.WhisperTestDoubles.ScriptedProcessFactory;
import com.phillippitts.livesubs.service.stt.whisper.WhisperTestDoubles.ScriptedRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WhisperProcessManager}.
 */
class WhisperProcessManagerTest {

    @TempDir
    Path dir;

    private final WhisperProperties cfg =
            new WhisperProperties("/opt/whisper/main", "/opt/models/ggml-medium.bin", 1, "ja", 2, 4096);

    @Test
    void shouldReadJsonFileWrittenNextToWavAndDeleteIt() {
        String json = "{\"transcription\":[{\"text\":\" こんにちは\"}]}";
        ScriptedProcessFactory factory = new ScriptedProcessFactory(ScriptedRun.writingJson(json));
        Path wav = dir.resolve("chunk-1.wav");

        String out = new WhisperProcessManager(factory).run(wav, cfg);

        assertThat(out).isEqualTo(json);
        assertThat(Files.exists(dir.resolve("chunk-1.json"))).isFalse();
    }

    @Test
    void shouldFallBackToStdoutWhenNoJsonFileWasWritten() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(ScriptedRun.printing("{\"text\":\"hi\"}"));

        String out = new WhisperProcessManager(factory).run(dir.resolve("a.wav"), cfg);

        assertThat(out).isEqualTo("{\"text\":\"hi\"}");
    }

    @Test
    void shouldCarryDiagnosticsOnNonZeroExit() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(
                ScriptedRun.failing(3, "error: failed to load model"));
        WhisperProcessManager manager = new WhisperProcessManager(factory);

        assertThatThrownBy(() -> manager.run(dir.resolve("a.wav"), cfg))
                .isInstanceOf(RecognitionException.class)
                .hasMessageStartingWith("Non-zero exit: 3")
                .hasMessageContaining("exitCode=3")
                .hasMessageContaining("modelPath=/opt/models/ggml-medium.bin")
                .hasMessageContaining("stderr=error: failed to load model")
                .hasMessageEndingWith("(engine: whisper)");
    }

    @Test
    void shouldDestroyProcessOnTimeout() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(ScriptedRun.hanging());
        WhisperProcessManager manager = new WhisperProcessManager(factory);

        assertThatThrownBy(() -> manager.run(dir.resolve("a.wav"), cfg))
                .isInstanceOf(RecognitionException.class)
                .hasMessageStartingWith("Timeout after 1s");
        assertThat(factory.lastProcess.wasDestroyCalled()).isTrue();
    }

    @Test
    void shouldWrapLaunchFailureInRecognitionException() {
        WhisperProcessManager manager = new WhisperProcessManager(new WhisperTestDoubles.UnlaunchableProcessFactory());

        assertThatThrownBy(() -> manager.run(dir.resolve("a.wav"), cfg))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("I/O failure")
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    void shouldBuildJsonOutputCommandLine() {
        Path wav = dir.resolve("chunk-7.wav");
        Path prefix = WhisperProcessManager.outputPrefix(wav);

        List<String> cmd = WhisperProcessManager.buildCommand(cfg, wav, prefix);

        assertThat(prefix).isEqualTo(dir.resolve("chunk-7").toAbsolutePath());
        assertThat(cmd).containsExactly(
                "/opt/whisper/main",
                "-m", "/opt/models/ggml-medium.bin",
                "-f", wav.toAbsolutePath().toString(),
                "-l", "ja",
                "-t", "2",
                "-oj",
                "-of", prefix.toString(),
                "-np");
    }

    @Test
    void shouldResolveRelativePathsAgainstWorkingDirectory() {
        Path resolved = WhisperProcessManager.resolvePath("models/ggml.bin");

        assertThat(resolved.isAbsolute()).isTrue();
        assertThat(resolved.endsWith(Path.of("models", "ggml.bin"))).isTrue();
        assertThat(WhisperProcessManager.resolvePath("/abs/bin")).isEqualTo(Path.of("/abs/bin"));
    }
}
