package com.phillippitts.livesubs.service.engine;

/**
 * Lifecycle shared by the recognition and translation engines.
 *
 * <p>{@link #loadModel()} is called once per pipeline start, before the engine's stage starts;
 * it must be idempotent. {@link #warmUp()} follows a successful load and may be slow.
 */
public interface ModelEngine extends AutoCloseable {

    /**
     * Loads the model or verifies the backend is reachable.
     *
     * @throws com.phillippitts.livesubs.exception.ModelLoadException if the engine cannot be used
     */
    void loadModel();

    /**
     * Runs a throwaway inference so the first real item is not penalized. Failures are reported by
     * exception and are not fatal to the caller.
     */
    void warmUp();

    String getEngineName();

    /** True once loaded and not closed. */
    boolean isReady();

    /** Releases resources; idempotent. */
    @Override
    void close();
}
