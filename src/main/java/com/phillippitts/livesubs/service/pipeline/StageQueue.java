package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.exception.PipelineException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Small bounded FIFO queue between two pipeline stages, applying the backpressure policy.
 *
 * <ul>
 *   <li>Finalized items are never dropped: {@link #put} blocks until there is room.</li>
 *   <li>Partial items never block: when the queue is full the oldest queued partial is dropped,
 *       or the incoming partial itself when only finalized items are queued. Each drop is logged
 *       at WARN and counted.</li>
 * </ul>
 *
 * <p>{@link #close()} is the end-of-stream signal: it wakes every blocked producer and consumer,
 * and {@link #take()} returns {@code null} once the queue is closed and empty.
 *
 * @param <T> item type
 */
public final class StageQueue<T> {

    private static final Logger LOG = LogManager.getLogger(StageQueue.class);

    private final String name;
    private final int capacity;
    private final Predicate<? super T> finalized;
    private final PipelineMetricsPublisher metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> items;
    private boolean closed;
    private long droppedPartials;

    /**
     * @param finalized decides whether an item falls under the never-drop rule
     */
    public StageQueue(String name, int capacity, Predicate<? super T> finalized, PipelineMetricsPublisher metrics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.capacity = capacity;
        this.finalized = Objects.requireNonNull(finalized, "finalized must not be null");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueues an item according to the backpressure policy.
     *
     * @return true if the item was queued, false if a partial item was dropped or the queue was closed
     * @throws PipelineException if a finalized item is offered to a closed queue
     * @throws InterruptedException if interrupted while waiting for room
     */
    public boolean put(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item must not be null");
        return finalized.test(item) ? putFinalized(item) : offerPartial(item);
    }

    /**
     * Enqueues a partial item without ever blocking.
     *
     * @return true if queued, false if dropped or the queue was closed
     * @throws IllegalArgumentException if the item is finalized
     */
    public boolean offer(T item) {
        Objects.requireNonNull(item, "item must not be null");
        if (finalized.test(item)) {
            throw new IllegalArgumentException("Finalized items must use put on queue '" + name + "'");
        }
        return offerPartial(item);
    }

    /**
     * Like {@link #put(Object)} but gives up on a finalized item once {@code timeout} has elapsed.
     *
     * @return false if the item was dropped (partial) or could not be queued in time (finalized)
     */
    public boolean put(T item, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(item, "item must not be null");
        if (!finalized.test(item)) {
            return offerPartial(item);
        }
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = notFull.awaitNanos(remaining);
            }
            if (closed) {
                throw new PipelineException("Finalized item offered to closed queue '" + name + "'");
            }
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean putFinalized(T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed) {
                throw new PipelineException("Finalized item offered to closed queue '" + name + "'");
            }
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private boolean offerPartial(T item) {
        boolean accepted;
        long dropCount;
        lock.lock();
        try {
            if (closed) {
                LOG.debug("Queue '{}' closed; partial item discarded", name);
                return false;
            }
            if (items.size() < capacity) {
                items.addLast(item);
                notEmpty.signal();
                return true;
            }
            accepted = removeOldestPartial();
            if (accepted) {
                items.addLast(item);
                notEmpty.signal();
            }
            dropCount = ++droppedPartials;
        } finally {
            lock.unlock();
        }
        metrics.recordDrop(name);
        LOG.warn("Queue '{}' full; dropped {} partial item (dropped so far: {})",
                name, accepted ? "oldest" : "incoming", dropCount);
        return accepted;
    }

    // Caller holds the lock
    private boolean removeOldestPartial() {
        Iterator<T> it = items.iterator();
        while (it.hasNext()) {
            if (!finalized.test(it.next())) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Removes the head item, waiting while the queue is empty and open.
     *
     * @return the next item, or {@code null} once the queue is closed and drained
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            T item = items.pollFirst();
            if (item != null) {
                notFull.signal();
            }
            return item;
        } finally {
            lock.unlock();
        }
    }

    /** Marks end of stream and wakes all waiters. Idempotent. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue and throws away whatever is still queued. Used only when a stage is
     * forcibly halted.
     *
     * @return number of finalized items that were discarded
     */
    public int discardRemaining() {
        int finalizedLost = 0;
        int total;
        lock.lock();
        try {
            closed = true;
            total = items.size();
            for (T item : items) {
                if (finalized.test(item)) {
                    finalizedLost++;
                }
            }
            items.clear();
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        if (total > 0) {
            LOG.warn("Queue '{}' discarded {} item(s) on forced halt ({} finalized)", name, total, finalizedLost);
        }
        return finalizedLost;
    }

    public long droppedCount() {
        lock.lock();
        try {
            return droppedPartials;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }
}
