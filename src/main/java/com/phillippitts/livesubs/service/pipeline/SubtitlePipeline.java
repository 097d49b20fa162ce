package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.config.properties.ContextProperties;
import com.phillippitts.livesubs.config.properties.PipelineProperties;
import com.phillippitts.livesubs.domain.AudioChunk;
import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.exception.PipelineException;
import com.phillippitts.livesubs.service.audio.AudioFormat;
import com.phillippitts.livesubs.service.audio.Chunker;
import com.phillippitts.livesubs.service.audio.capture.AudioDevice;
import com.phillippitts.livesubs.service.audio.capture.AudioSource;
import com.phillippitts.livesubs.service.context.ContextManager;
import com.phillippitts.livesubs.service.display.DisplayCallbacks;
import com.phillippitts.livesubs.service.display.DisplayDispatcher;
import com.phillippitts.livesubs.service.display.DisplayMessage;
import com.phillippitts.livesubs.service.display.DisplaySink;
import com.phillippitts.livesubs.service.display.TranslationListener;
import com.phillippitts.livesubs.service.engine.ModelEngine;
import com.phillippitts.livesubs.service.stt.RecognitionEngine;
import com.phillippitts.livesubs.service.translate.TranslationEngine;
import com.phillippitts.livesubs.util.ProcessTimeouts;
import com.phillippitts.livesubs.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Orchestrates the subtitle pipeline:
 * audio source → chunker → recognition stage → translation stage → display.
 *
 * <p><b>Start</b> brings components up consumer-first (display, translation, recognition, audio)
 * so no stage ever produces into a queue nobody drains. Any failure on the way is fatal: every
 * started worker is halted and joined, the pipeline enters {@link PipelineState#ERROR} and
 * {@code start} returns false.
 *
 * <p><b>Stop</b> arms the shutdown deadline, stops capture, flushes the final chunk and closes the
 * audio queue. A capture thread blocked by backpressure gives up its hand-off at the deadline. Each stage
 * drains its input and closes the next queue as it exits, so finalized items already accepted
 * are still delivered. Workers that have not finished when the grace period ends are halted and,
 * if still alive, abandoned; this is logged as a shutdown timeout and reflected by
 * {@link #lastShutdownClean()}, but the pipeline still reports {@link PipelineState#STOPPED}.
 *
 * <p>Thread-safety: {@code start} and {@code stop} are serialized by one lock; callbacks may be
 * registered at any time.
 */
public class SubtitlePipeline {

    private static final Logger LOG = LogManager.getLogger(SubtitlePipeline.class);

    static final String RECOGNITION_STAGE = "recognition";
    static final String TRANSLATION_STAGE = "translation";
    static final String DISPLAY_STAGE = "display";

    private final RecognitionEngine recognitionEngine;
    private final TranslationEngine translationEngine;
    private final AudioSource audioSource;
    private final ContextManager contextManager;
    private final PipelineProperties props;
    private final ContextProperties contextProps;
    private final PipelineMetricsPublisher metrics;
    private final Executor fatalStopExecutor;

    private final DisplayCallbacks callbacks = new DisplayCallbacks();
    private final PipelineStateMachine stateMachine = new PipelineStateMachine();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile Session session;
    private volatile Throwable lastError;
    private volatile boolean lastShutdownClean = true;

    private SubtitlePipeline(Builder b) {
        this.recognitionEngine = Objects.requireNonNull(b.recognitionEngine, "recognitionEngine must not be null");
        this.translationEngine = Objects.requireNonNull(b.translationEngine, "translationEngine must not be null");
        this.audioSource = Objects.requireNonNull(b.audioSource, "audioSource must not be null");
        this.contextManager = Objects.requireNonNull(b.contextManager, "contextManager must not be null");
        this.props = b.props == null ? PipelineProperties.defaults() : b.props;
        this.contextProps = b.contextProps == null ? ContextProperties.defaults() : b.contextProps;
        this.metrics = b.metrics == null ? PipelineMetricsPublisher.NOOP : b.metrics;
        this.fatalStopExecutor = b.fatalStopExecutor == null ? SubtitlePipeline::startFatalStopThread
                : b.fatalStopExecutor;
        for (DisplaySink sink : b.sinks) {
            callbacks.addSink(sink);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Registers a callback for partial recognition text. */
    public void onPartial(Consumer<String> listener) {
        callbacks.addPartialListener(listener);
    }

    /** Registers a callback for completed translations. */
    public void onTranslation(TranslationListener listener) {
        callbacks.addTranslationListener(listener);
    }

    public List<AudioDevice> listDevices() {
        return audioSource.listDevices();
    }

    /**
     * Starts the pipeline on the given capture device.
     *
     * @param deviceIndex device index from {@link #listDevices()}, negative for the system default
     * @return true if the pipeline is running; false if it was not in a startable state or a
     *         component failed to start (see {@link #lastError()})
     */
    public boolean start(int deviceIndex) {
        lifecycleLock.lock();
        try {
            PipelineState current = stateMachine.current();
            if (!current.canStart() || !stateMachine.transitionTo(PipelineState.STARTING)) {
                LOG.warn("Ignoring start request in state {}", current);
                return false;
            }
            lastError = null;
            Session s = new Session(UUID.randomUUID().toString().substring(0, 8));
            ThreadContext.put("session", s.id);
            long startNanos = System.nanoTime();
            try {
                bringUp(s, deviceIndex);
            } catch (RuntimeException e) {
                LOG.error("Pipeline start failed: {}", e.getMessage(), e);
                tearDownAfterFailure(s);
                lastError = e;
                stateMachine.transitionTo(PipelineState.ERROR);
                return false;
            } finally {
                ThreadContext.remove("session");
            }
            session = s;
            stateMachine.transitionTo(PipelineState.RUNNING);
            LOG.info("Pipeline {} running on device {} (started in {} ms)",
                    s.id, deviceIndex, TimeUtils.elapsedMillis(startNanos));
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void bringUp(Session s, int deviceIndex) {
        if (contextProps.isResetOnStart()) {
            contextManager.clear();
        }

        s.audioFinalized = audioFinalized();
        s.audioQueue = new StageQueue<>("audio", props.getAudioQueueCapacity(), s.audioFinalized, metrics);
        s.recognitionQueue = new StageQueue<>("recognition", props.getRecognitionQueueCapacity(),
                RecognitionResult::isFinalSegment, metrics);
        s.displayQueue = new StageQueue<>("display", props.getDisplayQueueCapacity(),
                DisplayMessage::isFinalized, metrics);
        DisplayDispatcher dispatcher = new DisplayDispatcher(s.displayQueue, callbacks);

        s.displayWorker = startWorker(s, StageWorker.builder(DISPLAY_STAGE, s.displayQueue, dispatcher));

        prepare(translationEngine);
        TranslationStage translation = new TranslationStage(translationEngine, contextManager, dispatcher,
                contextProps.getPromptRecentTurns());
        s.translationWorker = startWorker(s, StageWorker.builder(TRANSLATION_STAGE, s.recognitionQueue, translation)
                .onExit(s.displayQueue::close));

        prepare(recognitionEngine);
        RecognitionStage recognition = new RecognitionStage(recognitionEngine, s.recognitionQueue, dispatcher,
                props.getSilenceRmsThreshold());
        s.recognitionWorker = startWorker(s, StageWorker.builder(RECOGNITION_STAGE, s.audioQueue, recognition)
                .onExit(s.recognitionQueue::close));

        s.chunker = new Chunker(props.getChunkDurationSeconds(), AudioFormat.SAMPLE_RATE, chunk -> enqueueChunk(s, chunk));
        audioSource.start(deviceIndex, s.chunker::push);
        s.audioStarted = true;
    }

    private Predicate<AudioChunk> audioFinalized() {
        if (props.getAudioOverflowPolicy() == PipelineProperties.AudioOverflowPolicy.DROP_OLDEST) {
            return AudioChunk::isFinal;
        }
        return chunk -> true;
    }

    private <I> StageWorker<I> startWorker(Session s, StageWorker.Builder<I> builder) {
        StageWorker<I> worker = builder
                .sessionId(s.id)
                .metrics(metrics)
                .onFatal(outcome -> onStageFatal(s, outcome))
                .build();
        s.workers.add(worker);
        worker.start();
        return worker;
    }

    private static void prepare(ModelEngine engine) {
        engine.loadModel();
        long start = System.nanoTime();
        try {
            engine.warmUp();
            LOG.debug("{} warmed up in {} ms", engine.getEngineName(), TimeUtils.elapsedMillis(start));
        } catch (RuntimeException e) {
            LOG.warn("{} warm-up failed; continuing: {}", engine.getEngineName(), e.toString());
        }
    }

    /**
     * Hands a chunk to the audio queue. Until stop arms the deadline the wait is unbounded but
     * polled, so a capture thread stuck behind a slow recognizer still observes the deadline.
     */
    private void enqueueChunk(Session s, AudioChunk chunk) throws InterruptedException {
        while (true) {
            long deadline = s.flushDeadlineNanos;
            if (deadline == 0L) {
                if (s.audioQueue.put(chunk, ProcessTimeouts.CHUNK_HANDOFF_POLL) || !s.audioFinalized.test(chunk)) {
                    return;
                }
                continue;
            }
            Duration remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
            if (!s.audioQueue.put(chunk, remaining) && s.audioFinalized.test(chunk)) {
                LOG.error("Shutdown timeout: chunk {} ({} samples, final={}) could not be queued",
                        chunk.sequence(), chunk.sampleCount(), chunk.isFinal());
            }
            return;
        }
    }

    private void tearDownAfterFailure(Session s) {
        if (s.audioStarted) {
            audioSource.stop();
        }
        for (StageWorker<?> worker : s.workers) {
            worker.halt();
        }
        for (StageWorker<?> worker : s.workers) {
            if (!worker.awaitTermination(Duration.ofMillis(props.getShutdownGraceMillis()))) {
                LOG.error("Stage '{}' did not terminate within {}ms after failed start",
                        worker.stageName(), props.getShutdownGraceMillis());
            }
        }
        session = s;
    }

    /**
     * Stops the pipeline and waits, up to the configured grace period, for all stages to drain.
     * A no-op unless the pipeline is running.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (!stateMachine.compareAndTransition(PipelineState.RUNNING, PipelineState.STOPPING)) {
                LOG.debug("Ignoring stop request in state {}", stateMachine.current());
                return;
            }
            Session s = session;
            boolean clean = shutDown(s);
            lastShutdownClean = clean;
            stateMachine.transitionTo(PipelineState.STOPPED);
            if (clean) {
                LOG.info("Pipeline {} stopped", s.id);
            } else {
                LOG.warn("Pipeline {} stopped after shutdown timeout; lagging stages were abandoned", s.id);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private boolean shutDown(Session s) {
        long graceMillis = props.getShutdownGraceMillis();
        long deadline = System.nanoTime() + Duration.ofMillis(graceMillis).toNanos();

        s.flushDeadlineNanos = deadline;
        audioSource.stop();
        try {
            s.chunker.flush();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while flushing the final chunk");
        } catch (PipelineException e) {
            LOG.error("Final chunk could not be queued: {}", e.getMessage());
        }
        s.audioQueue.close();

        List<StageWorker<?>> lagging = new ArrayList<>();
        for (StageWorker<?> worker : List.of(s.recognitionWorker, s.translationWorker, s.displayWorker)) {
            if (!worker.awaitTermination(Duration.ofMillis(TimeUtils.millisUntil(deadline, 1L)))) {
                lagging.add(worker);
            }
        }
        if (lagging.isEmpty()) {
            return true;
        }

        LOG.error("Shutdown timeout: {} stage(s) still running after {}ms; forcing termination",
                lagging.size(), graceMillis);
        // Halt every stage so downstream workers are not left waiting on an upstream that never closes
        for (StageWorker<?> worker : List.of(s.recognitionWorker, s.translationWorker, s.displayWorker)) {
            int lost = worker.halt();
            if (lost > 0) {
                LOG.error("Stage '{}' abandoned {} finalized item(s)", worker.stageName(), lost);
            }
        }
        for (StageWorker<?> worker : lagging) {
            if (!worker.awaitTermination(ProcessTimeouts.STAGE_HALT_TIMEOUT)) {
                LOG.error("Stage '{}' still alive after forced halt; abandoning thread", worker.stageName());
            }
        }
        return false;
    }

    private void onStageFatal(Session origin, StageOutcome outcome) {
        if (stateMachine.current() != PipelineState.RUNNING || session != origin) {
            // Closed-queue failures are expected while stages are being halted
            LOG.debug("Ignoring fatal outcome from session {} in state {}: {}",
                    origin.id, stateMachine.current(), outcome.reason());
            return;
        }
        lastError = outcome.cause() != null ? outcome.cause() : new PipelineException(outcome.reason());
        fatalStopExecutor.execute(() -> stopAfterFatal(origin, outcome.reason()));
    }

    private void stopAfterFatal(Session origin, String reason) {
        lifecycleLock.lock();
        try {
            if (session != origin) {
                LOG.debug("Session {} already replaced; fatal stop skipped", origin.id);
                return;
            }
            LOG.error("Stopping pipeline after fatal stage failure: {}", reason);
            stop();
        } finally {
            lifecycleLock.unlock();
        }
    }

    private static void startFatalStopThread(Runnable task) {
        Thread stopper = new Thread(task, "pipeline-fatal-stop");
        stopper.setDaemon(true);
        stopper.start();
    }

    public PipelineState state() {
        return stateMachine.current();
    }

    /** Cause of the last failed start or fatal stage failure; null if none. */
    public Throwable lastError() {
        return lastError;
    }

    /** False if the last stop had to force-terminate or abandon a stage. */
    public boolean lastShutdownClean() {
        return lastShutdownClean;
    }

    /** Stage worker threads of the current (or last) session that are still alive. */
    public int liveWorkerCount() {
        Session s = session;
        if (s == null) {
            return 0;
        }
        int alive = 0;
        for (StageWorker<?> worker : s.workers) {
            if (worker.isAlive()) {
                alive++;
            }
        }
        return alive;
    }

    /** Partial items dropped under overload in the current (or last) session. */
    public long droppedPartialCount() {
        Session s = session;
        if (s == null) {
            return 0L;
        }
        long dropped = 0L;
        for (StageQueue<?> queue : s.queues()) {
            dropped += queue.droppedCount();
        }
        return dropped;
    }

    public ContextManager contextManager() {
        return contextManager;
    }

    /** Per-start resources; discarded when the pipeline stops or fails. */
    private static final class Session {
        final String id;
        final List<StageWorker<?>> workers = new ArrayList<>(3);
        StageQueue<AudioChunk> audioQueue;
        StageQueue<RecognitionResult> recognitionQueue;
        StageQueue<DisplayMessage> displayQueue;
        StageWorker<DisplayMessage> displayWorker;
        StageWorker<RecognitionResult> translationWorker;
        StageWorker<AudioChunk> recognitionWorker;
        Chunker chunker;
        Predicate<AudioChunk> audioFinalized;
        boolean audioStarted;
        volatile long flushDeadlineNanos;

        Session(String id) {
            this.id = id;
        }

        List<StageQueue<?>> queues() {
            List<StageQueue<?>> queues = new ArrayList<>(3);
            if (audioQueue != null) {
                queues.add(audioQueue);
            }
            if (recognitionQueue != null) {
                queues.add(recognitionQueue);
            }
            if (displayQueue != null) {
                queues.add(displayQueue);
            }
            return queues;
        }
    }

    /**
     * Builder for {@link SubtitlePipeline}. Engines, audio source and context manager are required;
     * properties default to their documented defaults and metrics to {@link PipelineMetricsPublisher#NOOP}.
     */
    public static final class Builder {
        private RecognitionEngine recognitionEngine;
        private TranslationEngine translationEngine;
        private AudioSource audioSource;
        private ContextManager contextManager;
        private PipelineProperties props;
        private ContextProperties contextProps;
        private PipelineMetricsPublisher metrics;
        private Executor fatalStopExecutor;
        private final List<DisplaySink> sinks = new ArrayList<>();

        private Builder() {
        }

        public Builder recognitionEngine(RecognitionEngine recognitionEngine) {
            this.recognitionEngine = recognitionEngine;
            return this;
        }

        public Builder translationEngine(TranslationEngine translationEngine) {
            this.translationEngine = translationEngine;
            return this;
        }

        public Builder audioSource(AudioSource audioSource) {
            this.audioSource = audioSource;
            return this;
        }

        public Builder contextManager(ContextManager contextManager) {
            this.contextManager = contextManager;
            return this;
        }

        public Builder properties(PipelineProperties props) {
            this.props = props;
            return this;
        }

        public Builder contextProperties(ContextProperties contextProps) {
            this.contextProps = contextProps;
            return this;
        }

        public Builder metrics(PipelineMetricsPublisher metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Runs the stop triggered by a fatal stage failure; defaults to a new daemon thread. */
        Builder fatalStopExecutor(Executor fatalStopExecutor) {
            this.fatalStopExecutor = fatalStopExecutor;
            return this;
        }

        public Builder displaySink(DisplaySink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public SubtitlePipeline build() {
            return new SubtitlePipeline(this);
        }
    }
}
