package com.phillippitts.livesubs.domain;

import java.util.Objects;

/**
 * A finalized utterance together with the context that existed when it was submitted.
 *
 * @param text      finalized utterance text
 * @param context   snapshot taken before translation
 * @param segmentId segment id of the utterance
 */
public record TranslationRequest(String text, ContextSnapshot context, long segmentId) {

    public TranslationRequest {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(context, "context must not be null");
    }
}
