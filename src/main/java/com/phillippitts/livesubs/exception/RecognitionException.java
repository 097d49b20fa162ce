package com.phillippitts.livesubs.exception;

/**
 * Thrown when speech recognition fails for a single chunk.
 * Transient: the chunk is skipped and the recognition stage continues.
 */
public class RecognitionException extends LiveSubsException {

    private final String engineName;

    public RecognitionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public RecognitionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
