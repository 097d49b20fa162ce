package com.phillippitts.livesubs.exception;

/**
 * Thrown when translating a single utterance fails.
 * Transient: the utterance is skipped and no context entry is recorded for it.
 */
public class TranslationException extends LiveSubsException {

    private final String engineName;

    public TranslationException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranslationException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
