package com.phillippitts.livesubs.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the llama.cpp translation server.
 * Binds to properties prefixed with "translation".
 *
 * @param serverUrl      base URL of the llama.cpp HTTP server
 * @param sourceLanguage language name used in the prompt for the source text
 * @param targetLanguage language name used in the prompt for the output
 * @param maxTokens      completion token limit
 * @param temperature    sampling temperature
 * @param timeoutMillis  call timeout for one translation
 */
@ConfigurationProperties(prefix = "translation")
@Validated
public record TranslationProperties(
        @NotBlank String serverUrl,
        @NotBlank String sourceLanguage,
        @NotBlank String targetLanguage,
        @Positive int maxTokens,
        @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
        @Positive long timeoutMillis
) {
    @ConstructorBinding
    public TranslationProperties {
    }

    public TranslationProperties() {
        this("http://localhost:8080", "Japanese", "Traditional Chinese", 200, 0.3, 5000L);
    }
}
