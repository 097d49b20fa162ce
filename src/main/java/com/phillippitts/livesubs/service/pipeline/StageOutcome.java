package com.phillippitts.livesubs.service.pipeline;

import java.util.Objects;

/**
 * Result of processing one item in a stage.
 *
 * <p>The worker branches on {@link #kind()}: {@code TRANSIENT_FAILURE} and {@code SKIPPED} let it
 * continue with the next item, {@code FATAL} halts the pipeline.
 *
 * @param kind   outcome category
 * @param reason short description for logs (empty for success)
 * @param cause  underlying exception, if any
 */
public record StageOutcome(Kind kind, String reason, Throwable cause) {

    public enum Kind {
        SUCCESS,
        /** Nothing to do for this item (e.g. silence, blank text). */
        SKIPPED,
        /** This item failed; move on. */
        TRANSIENT_FAILURE,
        /** The stage cannot continue. */
        FATAL
    }

    private static final StageOutcome SUCCESS = new StageOutcome(Kind.SUCCESS, "", null);

    public StageOutcome {
        Objects.requireNonNull(kind, "kind must not be null");
        reason = reason == null ? "" : reason;
    }

    public static StageOutcome success() {
        return SUCCESS;
    }

    public static StageOutcome skipped(String reason) {
        return new StageOutcome(Kind.SKIPPED, reason, null);
    }

    public static StageOutcome transientFailure(String reason, Throwable cause) {
        return new StageOutcome(Kind.TRANSIENT_FAILURE, reason, cause);
    }

    public static StageOutcome fatal(String reason, Throwable cause) {
        return new StageOutcome(Kind.FATAL, reason, cause);
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }
}
