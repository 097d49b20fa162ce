package com.phillippitts.livesubs.domain;

import java.util.Objects;

/**
 * One completed turn: an utterance and its translation.
 *
 * @param originalText   recognized source text
 * @param translatedText translation produced for it
 * @param sequenceId     segment id of the utterance
 */
public record ContextEntry(String originalText, String translatedText, long sequenceId) {

    public ContextEntry {
        Objects.requireNonNull(originalText, "originalText must not be null");
        Objects.requireNonNull(translatedText, "translatedText must not be null");
    }
}
