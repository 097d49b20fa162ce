package com.phillippitts.livesubs.exception;

/**
 * Base exception for all live-subs application errors.
 * Subclasses distinguish fatal startup failures from per-item inference failures.
 */
public class LiveSubsException extends RuntimeException {

    public LiveSubsException(String message) {
        super(message);
    }

    public LiveSubsException(String message, Throwable cause) {
        super(message, cause);
    }
}
