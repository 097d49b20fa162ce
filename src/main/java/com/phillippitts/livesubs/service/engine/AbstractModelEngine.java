package com.phillippitts.livesubs.service.engine;

import com.phillippitts.livesubs.exception.ModelLoadException;
import jakarta.annotation.PreDestroy;

/**
 * Template for engine lifecycle: idempotent load and close guarded by one lock.
 *
 * <p>Subclasses implement {@link #doLoadModel()} and {@link #doClose()}. Runtime failures
 * while loading are wrapped in {@link ModelLoadException}.
 */
public abstract class AbstractModelEngine implements ModelEngine {

    private final Object lock = new Object();

    private boolean loaded = false;

    private boolean closed = false;

    @Override
    public final void loadModel() {
        synchronized (lock) {
            if (loaded && !closed) {
                return;
            }
            try {
                doLoadModel();
            } catch (ModelLoadException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ModelLoadException(getEngineName(), "Model load failed: " + e.getMessage(), e);
            }
            loaded = true;
            closed = false;
        }
    }

    protected abstract void doLoadModel();

    @Override
    public final boolean isReady() {
        synchronized (lock) {
            return loaded && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed || !loaded) {
                closed = true;
                return;
            }
            doClose();
            closed = true;
            loaded = false;
        }
    }

    protected abstract void doClose();
}
