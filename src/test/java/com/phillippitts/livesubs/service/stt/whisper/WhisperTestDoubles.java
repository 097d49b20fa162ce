package com.phillippitts.livesubs.service.stt.whisper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Scripted whisper.cpp runs for hermetic tests: no binary is ever launched.
 */
final class WhisperTestDoubles {

    private WhisperTestDoubles() {}

    /**
     * What one scripted run does.
     *
     * @param jsonFile          written to {@code <-of prefix>.json} on start, or null to write nothing
     * @param stdout            stdout content
     * @param stderr            stderr content
     * @param exitCode          exit code reported once finished
     * @param finishAfterMillis delay before the process finishes (-1 means never)
     */
    record ScriptedRun(String jsonFile, String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ScriptedRun writingJson(String json) {
            return new ScriptedRun(json, "", "", 0, 0);
        }

        static ScriptedRun printing(String stdout) {
            return new ScriptedRun(null, stdout, "", 0, 0);
        }

        static ScriptedRun failing(int exitCode, String stderr) {
            return new ScriptedRun(null, "", stderr, exitCode, 0);
        }

        static ScriptedRun hanging() {
            return new ScriptedRun(null, "", "", 0, -1);
        }
    }

    /**
     * Plays one {@link ScriptedRun} per start and records every command line it was given.
     */
    static final class ScriptedProcessFactory implements ProcessFactory {
        private final ScriptedRun run;
        final List<List<String>> commands = new CopyOnWriteArrayList<>();
        volatile ScriptedProcess lastProcess;

        ScriptedProcessFactory(ScriptedRun run) {
            this.run = run;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            if (run.jsonFile() != null) {
                String prefix = command.get(command.indexOf("-of") + 1);
                Files.writeString(Path.of(prefix + ".json"), run.jsonFile(), StandardCharsets.UTF_8);
            }
            ScriptedProcess process = new ScriptedProcess(run);
            lastProcess = process;
            return process;
        }
    }

    /** Fails to launch, as when the binary vanished after load. */
    static final class UnlaunchableProcessFactory implements ProcessFactory {
        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            throw new IOException("Cannot run program \"" + command.get(0) + "\"");
        }
    }

    static final class ScriptedProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive;
        private volatile boolean destroyCalled;

        ScriptedProcess(ScriptedRun run) {
            this.out = run.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = run.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = run.exitCode();
            this.finishAfterMillis = run.finishAfterMillis();
            this.alive = finishAfterMillis != 0;
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (!alive) {
                return true;
            }
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis < 0 || finishAfterMillis > ms) {
                Thread.sleep(ms);
                return !alive;
            }
            Thread.sleep(finishAfterMillis);
            alive = false;
            return true;
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
