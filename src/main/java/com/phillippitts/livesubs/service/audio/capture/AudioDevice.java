package com.phillippitts.livesubs.service.audio.capture;

/**
 * A capture-capable input device.
 *
 * @param index        position in {@link AudioSource#listDevices()}; passed back to {@code start}
 * @param name         mixer name as reported by the platform
 * @param channelCount channels the device is opened with
 * @param sampleRate   sample rate the device is opened with
 */
public record AudioDevice(int index, String name, int channelCount, int sampleRate) { }
