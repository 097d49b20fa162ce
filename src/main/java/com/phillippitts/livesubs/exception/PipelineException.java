package com.phillippitts.livesubs.exception;

/**
 * Signals a broken orchestration invariant, such as a finalized item offered to a queue
 * that has already been closed. Always treated as fatal.
 */
public class PipelineException extends LiveSubsException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
