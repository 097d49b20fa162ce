package com.phillippitts.livesubs.service.stt.whisper;

import com.phillippitts.livesubs.config.properties.WhisperProperties;
import com.phillippitts.livesubs.exception.RecognitionException;
import com.phillippitts.livesubs.exception.RecognitionExceptionBuilder;
import com.phillippitts.livesubs.util.ProcessTimeouts;
import com.phillippitts.livesubs.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one whisper.cpp process per chunk and returns its JSON output.
 *
 * <p>whisper.cpp writes {@code <prefix>.json} next to the input WAV; that file is read and
 * deleted. If it is missing, stdout is returned instead. stdout and stderr are drained by
 * daemon gobbler threads so a chatty process can never block on a full pipe.
 */
@Component
public class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    static final int STDERR_MAX_BYTES = 256 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;

    private volatile Process current;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public WhisperProcessManager() {
        this(new DefaultProcessFactory());
    }

    WhisperProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Transcribes one WAV file.
     *
     * @return raw JSON produced by whisper.cpp
     * @throws RecognitionException on launch failure, timeout, non-zero exit or interruption
     */
    public String run(Path wavPath, WhisperProperties cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");

        Path outputPrefix = outputPrefix(wavPath);
        List<String> command = buildCommand(cfg, wavPath, outputPrefix);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = start(command, wavPath, cfg);
            boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw error("Timeout after " + cfg.timeoutSeconds() + "s", cfg, -1, exec.stderr(), startTime, null);
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw error("Non-zero exit: " + exitCode, cfg, exitCode, exec.stderr(), startTime, null);
            }
            return readOutput(outputPrefix, exec.stdout());
        } catch (IOException e) {
            throw error("I/O failure: " + e.getMessage(), cfg, -1, null, startTime, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (exec != null) {
                destroyProcess(exec.process());
            }
            throw error("Interrupted", cfg, -1, null, startTime, e);
        } finally {
            current = null;
            deleteQuietly(Path.of(outputPrefix + ".json"));
        }
    }

    private ProcessExecution start(List<String> command, Path wavPath, WhisperProperties cfg) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command, wavPath.toAbsolutePath().getParent());
        current = process;
        Thread out = startGobbler(process.getInputStream(), stdout, "whisper-out", cfg.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "whisper-err", STDERR_MAX_BYTES);
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private static String readOutput(Path outputPrefix, StringBuilder stdout) throws IOException {
        Path json = Path.of(outputPrefix + ".json");
        if (Files.isRegularFile(json)) {
            return Files.readString(json, StandardCharsets.UTF_8);
        }
        LOG.debug("No {} written; using stdout ({} chars)", json.getFileName(), stdout.length());
        return stdout.toString();
    }

    static Path outputPrefix(Path wavPath) {
        String name = wavPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return wavPath.toAbsolutePath().resolveSibling(base);
    }

    static List<String> buildCommand(WhisperProperties cfg, Path wavPath, Path outputPrefix) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add(outputPrefix.toString());
        cmd.add("-np");
        return cmd;
    }

    static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    // Keep draining past the cap so the process never blocks
                    if (sink.length() >= maxBytes) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        }
                        continue;
                    }
                    if (sink.length() > 0) {
                        sink.append('\n');
                    }
                    int available = maxBytes - sink.length();
                    sink.append(line, 0, Math.min(line.length(), available));
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", path, e.toString());
        }
    }

    private static void destroyProcess(Process process) {
        process.destroy();
        try {
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("whisper process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while destroying whisper process");
        }
    }

    private static RecognitionException error(String msg, WhisperProperties cfg, int exitCode,
                                              StringBuilder stderr, long startNano, Throwable cause) {
        String stderrSnippet = stderr == null ? ""
                : stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        RecognitionExceptionBuilder builder = RecognitionExceptionBuilder.create(msg)
                .engine(WhisperRecognitionEngine.ENGINE)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("modelPath", cfg.modelPath())
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    /** Kills a process still running, e.g. on shutdown. */
    @Override
    public void close() {
        Process process = current;
        current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
    }
}
