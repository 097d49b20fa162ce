package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.exception.PipelineException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs one pipeline stage on a dedicated thread: takes items from its input {@link StageQueue}
 * in FIFO order and hands each to a {@link StageProcessor}.
 *
 * <p>Stopping is cooperative. {@link #finishAndStop()} closes the input so the worker drains what
 * is queued and exits; {@link #halt()} additionally discards the backlog and interrupts the
 * thread. Either way the item in flight is finished first unless the collaborator reacts to
 * interruption. When the loop ends, the exit hook runs (typically closing the downstream queue).
 *
 * @param <I> input item type
 */
public final class StageWorker<I> {

    private static final Logger LOG = LogManager.getLogger(StageWorker.class);

    private final String stageName;
    private final String sessionId;
    private final StageQueue<I> input;
    private final StageProcessor<I> processor;
    private final Runnable onExit;
    private final Consumer<StageOutcome> fatalListener;
    private final PipelineMetricsPublisher metrics;

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean halted;
    private volatile Thread thread;

    private StageWorker(Builder<I> b) {
        this.stageName = Objects.requireNonNull(b.stageName, "stageName must not be null");
        this.input = Objects.requireNonNull(b.input, "input must not be null");
        this.processor = Objects.requireNonNull(b.processor, "processor must not be null");
        this.sessionId = b.sessionId == null ? "-" : b.sessionId;
        this.onExit = b.onExit == null ? () -> { } : b.onExit;
        this.fatalListener = b.fatalListener == null ? outcome -> { } : b.fatalListener;
        this.metrics = b.metrics == null ? PipelineMetricsPublisher.NOOP : b.metrics;
    }

    public static <I> Builder<I> builder(String stageName, StageQueue<I> input, StageProcessor<I> processor) {
        return new Builder<>(stageName, input, processor);
    }

    /**
     * Starts the worker thread.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Stage worker '" + stageName + "' already started");
        }
        Thread t = new Thread(this::runLoop, "stage-" + stageName);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /** Lets the worker drain its queued items and exit. */
    public void finishAndStop() {
        input.close();
    }

    /**
     * Stops the worker as soon as possible: the backlog is discarded and the thread interrupted.
     *
     * @return number of finalized items discarded from the input queue
     */
    public int halt() {
        halted = true;
        int lost = input.discardRemaining();
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
        return lost;
    }

    /**
     * Waits for the worker thread to end.
     *
     * @return true if the thread is no longer alive (or was never started)
     */
    public boolean awaitTermination(Duration timeout) {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        try {
            t.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for stage '{}' to terminate", stageName);
        }
        return !t.isAlive();
    }

    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public String stageName() {
        return stageName;
    }

    public long succeededCount() {
        return succeeded.get();
    }

    public long skippedCount() {
        return skipped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private void runLoop() {
        ThreadContext.put("session", sessionId);
        ThreadContext.put("stage", stageName);
        LOG.info("Stage '{}' started", stageName);
        try {
            while (!halted) {
                I item = input.take();
                if (item == null) {
                    break; // closed and drained
                }
                if (!handle(item)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!halted) {
                LOG.warn("Stage '{}' interrupted unexpectedly", stageName);
            }
        } finally {
            try {
                onExit.run();
            } finally {
                LOG.info("Stage '{}' stopped: succeeded={}, skipped={}, failed={}",
                        stageName, succeeded.get(), skipped.get(), failed.get());
                ThreadContext.clearMap();
            }
        }
    }

    /**
     * @return false if the loop must end
     */
    private boolean handle(I item) throws InterruptedException {
        long start = System.nanoTime();
        StageOutcome outcome;
        try {
            outcome = processor.process(item);
        } catch (PipelineException e) {
            outcome = StageOutcome.fatal(e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Stage '{}' processor threw unexpectedly; skipping item", stageName, e);
            outcome = StageOutcome.transientFailure("unexpected " + e.getClass().getSimpleName(), e);
        }
        metrics.recordOutcome(stageName, outcome.kind(), System.nanoTime() - start);

        return switch (outcome.kind()) {
            case SUCCESS -> {
                succeeded.incrementAndGet();
                yield true;
            }
            case SKIPPED -> {
                skipped.incrementAndGet();
                LOG.debug("Stage '{}' skipped item: {}", stageName, outcome.reason());
                yield true;
            }
            case TRANSIENT_FAILURE -> {
                failed.incrementAndGet();
                LOG.warn("Stage '{}' item failed, continuing: {}", stageName, outcome.reason());
                yield true;
            }
            case FATAL -> {
                LOG.error("Stage '{}' failed fatally: {}", stageName, outcome.reason(), outcome.cause());
                fatalListener.accept(outcome);
                yield false;
            }
        };
    }

    /**
     * Builder for {@link StageWorker}; stage name, input queue and processor are required.
     */
    public static final class Builder<I> {
        private final String stageName;
        private final StageQueue<I> input;
        private final StageProcessor<I> processor;
        private String sessionId;
        private Runnable onExit;
        private Consumer<StageOutcome> fatalListener;
        private PipelineMetricsPublisher metrics;

        private Builder(String stageName, StageQueue<I> input, StageProcessor<I> processor) {
            this.stageName = stageName;
            this.input = input;
            this.processor = processor;
        }

        public Builder<I> sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        /** Runs on the worker thread when the loop ends, however it ends. */
        public Builder<I> onExit(Runnable onExit) {
            this.onExit = onExit;
            return this;
        }

        public Builder<I> onFatal(Consumer<StageOutcome> fatalListener) {
            this.fatalListener = fatalListener;
            return this;
        }

        public Builder<I> metrics(PipelineMetricsPublisher metrics) {
            this.metrics = metrics;
            return this;
        }

        public StageWorker<I> build() {
            return new StageWorker<>(this);
        }
    }
}
