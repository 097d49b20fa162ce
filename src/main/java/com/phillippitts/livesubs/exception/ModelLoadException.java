package com.phillippitts.livesubs.exception;

/**
 * Thrown when a recognition or translation engine cannot load its model.
 * Fatal: the pipeline moves to the error state and no worker is left running.
 */
public class ModelLoadException extends LiveSubsException {

    private final String engineName;

    public ModelLoadException(String engineName, String message) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public ModelLoadException(String engineName, String message, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
