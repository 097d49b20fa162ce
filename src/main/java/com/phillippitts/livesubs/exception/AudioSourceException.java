package com.phillippitts.livesubs.exception;

/**
 * Thrown when the capture device cannot be opened or enumerated.
 */
public class AudioSourceException extends LiveSubsException {

    private final int deviceIndex;

    public AudioSourceException(int deviceIndex, String message) {
        super(message + " (device: " + deviceIndex + ")");
        this.deviceIndex = deviceIndex;
    }

    public AudioSourceException(int deviceIndex, String message, Throwable cause) {
        super(message + " (device: " + deviceIndex + ")", cause);
        this.deviceIndex = deviceIndex;
    }

    public int getDeviceIndex() {
        return deviceIndex;
    }
}
