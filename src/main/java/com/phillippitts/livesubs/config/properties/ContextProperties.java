package com.phillippitts.livesubs.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the rolling translation context.
 */
@Validated
@ConfigurationProperties(prefix = "context")
public class ContextProperties {

    /** Capacity N of the context window. */
    @Min(1)
    @Max(50)
    private final int windowSize;

    /** The summary is regenerated every M recorded turns. */
    @Min(1)
    private final int updateIntervalTurns;

    @Min(10)
    private final int maxSummaryLength;

    /** Number of recent originals rendered next to the summary. */
    @Min(0)
    private final int promptRecentTurns;

    private final boolean resetOnStart;

    @ConstructorBinding
    public ContextProperties(Integer windowSize,
                             Integer updateIntervalTurns,
                             Integer maxSummaryLength,
                             Integer promptRecentTurns,
                             Boolean resetOnStart) {
        this.windowSize = windowSize == null ? 5 : windowSize;
        this.updateIntervalTurns = updateIntervalTurns == null ? 3 : updateIntervalTurns;
        this.maxSummaryLength = maxSummaryLength == null ? 200 : maxSummaryLength;
        this.promptRecentTurns = promptRecentTurns == null ? 2 : promptRecentTurns;
        this.resetOnStart = resetOnStart == null || resetOnStart;
    }

    public static ContextProperties defaults() {
        return new ContextProperties(null, null, null, null, null);
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getUpdateIntervalTurns() {
        return updateIntervalTurns;
    }

    public int getMaxSummaryLength() {
        return maxSummaryLength;
    }

    public int getPromptRecentTurns() {
        return promptRecentTurns;
    }

    public boolean isResetOnStart() {
        return resetOnStart;
    }
}
