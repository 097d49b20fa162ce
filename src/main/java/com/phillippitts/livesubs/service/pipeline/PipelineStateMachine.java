package com.phillippitts.livesubs.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe guard for pipeline lifecycle transitions.
 *
 * <p>Only the transitions listed in {@link PipelineState} are accepted; anything else is
 * rejected and leaves the state unchanged.
 */
public final class PipelineStateMachine {

    private static final Logger LOG = LogManager.getLogger(PipelineStateMachine.class);

    private static final Map<PipelineState, Set<PipelineState>> ALLOWED = Map.of(
            PipelineState.IDLE, EnumSet.of(PipelineState.STARTING),
            PipelineState.STARTING, EnumSet.of(PipelineState.RUNNING, PipelineState.ERROR),
            PipelineState.RUNNING, EnumSet.of(PipelineState.STOPPING),
            PipelineState.STOPPING, EnumSet.of(PipelineState.STOPPED),
            PipelineState.STOPPED, EnumSet.of(PipelineState.STARTING),
            PipelineState.ERROR, EnumSet.of(PipelineState.STARTING)
    );

    private final Lock lock = new ReentrantLock();
    private PipelineState state = PipelineState.IDLE;

    /**
     * Moves to {@code target} if the current state allows it.
     *
     * @return true if the transition happened
     */
    public boolean transitionTo(PipelineState target) {
        lock.lock();
        try {
            if (!ALLOWED.get(state).contains(target)) {
                LOG.debug("Rejected pipeline transition {} -> {}", state, target);
                return false;
            }
            LOG.debug("Pipeline transition {} -> {}", state, target);
            state = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves from {@code expected} to {@code target} only if the current state is {@code expected}.
     */
    public boolean compareAndTransition(PipelineState expected, PipelineState target) {
        lock.lock();
        try {
            return state == expected && transitionTo(target);
        } finally {
            lock.unlock();
        }
    }

    public PipelineState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }
}
