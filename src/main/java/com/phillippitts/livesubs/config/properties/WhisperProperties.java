package com.phillippitts.livesubs.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the whisper.cpp recognition engine.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.model-path=models/ggml-medium.bin
 * stt.whisper.language=ja
 * </pre>
 *
 * @param binaryPath     path to the whisper.cpp executable
 * @param modelPath      path to the GGML model file
 * @param timeoutSeconds upper bound for one chunk's transcription
 * @param language       source language code
 * @param threads        CPU threads handed to whisper.cpp
 * @param maxStdoutBytes cap on captured stdout
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperProperties(
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Thread count must be positive")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
    @ConstructorBinding
    public WhisperProperties {
    }

    public WhisperProperties() {
        this("tools/whisper.cpp/main", "models/ggml-medium.bin", 10, "ja", 4, 1048576);
    }
}
