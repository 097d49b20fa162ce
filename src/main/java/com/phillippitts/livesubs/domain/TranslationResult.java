package com.phillippitts.livesubs.domain;

import java.util.Objects;

/**
 * A translated utterance, consumed exactly once by the display.
 *
 * @param originalText   finalized source text
 * @param translatedText translation
 * @param context        snapshot used for the translation
 * @param contextSummary rendered form of {@code context} handed to the display
 * @param segmentId      segment id of the utterance
 */
public record TranslationResult(
        String originalText,
        String translatedText,
        ContextSnapshot context,
        String contextSummary,
        long segmentId
) {

    public TranslationResult {
        Objects.requireNonNull(originalText, "originalText must not be null");
        Objects.requireNonNull(translatedText, "translatedText must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(contextSummary, "contextSummary must not be null");
    }
}
