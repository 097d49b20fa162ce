package com.phillippitts.livesubs.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link RecognitionException} carrying process diagnostics.
 *
 * <pre>
 * throw RecognitionExceptionBuilder.create("whisper exited with error")
 *         .engine("whisper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", snippet)
 *         .build();
 * </pre>
 */
public final class RecognitionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RecognitionExceptionBuilder(String message) {
        this.message = message;
    }

    public static RecognitionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RecognitionExceptionBuilder(message);
    }

    public RecognitionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public RecognitionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public RecognitionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public RecognitionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** Null keys or values are ignored. */
    public RecognitionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public RecognitionException build() {
        String engine = engineName != null ? engineName : "unknown";
        String detailed = describe();
        return cause != null
                ? new RecognitionException(detailed, engine, cause)
                : new RecognitionException(detailed, engine);
    }

    private String describe() {
        Map<String, String> details = new LinkedHashMap<>();
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        String sep = "";
        for (Map.Entry<String, String> e : details.entrySet()) {
            sb.append(sep).append(e.getKey()).append('=').append(e.getValue());
            sep = ", ";
        }
        return sb.append(')').toString();
    }
}
