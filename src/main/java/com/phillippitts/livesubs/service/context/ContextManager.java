package com.phillippitts.livesubs.service.context;

import com.phillippitts.livesubs.domain.ContextEntry;
import com.phillippitts.livesubs.domain.ContextSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the rolling window of recent turns and the periodically regenerated summary.
 *
 * <p>Thread-safety: one {@link ReentrantLock} serializes {@link #recordTurn}, {@link #snapshot}
 * and {@link #clear}. Snapshots are copies; callers never observe later mutation.
 *
 * <p>Invariant: the window never holds more than {@code windowSize} entries; the oldest entry is
 * evicted first.
 */
public class ContextManager {

    private static final Logger LOG = LogManager.getLogger(ContextManager.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final int windowSize;
    private final int updateIntervalTurns;
    private final SummaryStrategy summaryStrategy;

    private final Deque<ContextEntry> window = new ArrayDeque<>();
    private String summary = "";
    private long turnCount;

    public ContextManager(int windowSize, int updateIntervalTurns, SummaryStrategy summaryStrategy) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        if (updateIntervalTurns < 1) {
            throw new IllegalArgumentException("updateIntervalTurns must be >= 1, got: " + updateIntervalTurns);
        }
        this.windowSize = windowSize;
        this.updateIntervalTurns = updateIntervalTurns;
        this.summaryStrategy = Objects.requireNonNull(summaryStrategy, "summaryStrategy must not be null");
    }

    /**
     * Returns an immutable copy of the current summary and window.
     */
    public ContextSnapshot snapshot() {
        lock.lock();
        try {
            return new ContextSnapshot(summary, List.copyOf(window));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a completed turn, evicting the oldest entry when over capacity, and regenerates the
     * summary every {@code updateIntervalTurns} turns.
     *
     * <p>Turns with a blank original are ignored.
     *
     * @return true if the turn was recorded
     */
    public boolean recordTurn(ContextEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (entry.originalText().isBlank()) {
            LOG.debug("Ignoring context turn with blank original (seq={})", entry.sequenceId());
            return false;
        }
        lock.lock();
        try {
            window.addLast(entry);
            while (window.size() > windowSize) {
                window.removeFirst();
            }
            turnCount++;
            if (turnCount % updateIntervalTurns == 0) {
                regenerateSummary();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Drops all entries and the summary, and resets the turn counter. */
    public void clear() {
        lock.lock();
        try {
            window.clear();
            summary = "";
            turnCount = 0;
        } finally {
            lock.unlock();
        }
        LOG.debug("Context cleared");
    }

    public long turnCount() {
        lock.lock();
        try {
            return turnCount;
        } finally {
            lock.unlock();
        }
    }

    public int windowSize() {
        return windowSize;
    }

    // Caller holds the lock
    private void regenerateSummary() {
        try {
            String next = summaryStrategy.summarize(List.copyOf(window), summary);
            summary = next == null ? "" : next;
            LOG.debug("Context summary regenerated after {} turns ({} chars)", turnCount, summary.length());
        } catch (RuntimeException e) {
            LOG.error("Summary regeneration failed; keeping previous summary: {}", e.toString());
        }
    }
}
