package com.phillippitts.livesubs.domain;

import java.util.Objects;

/**
 * Output of the recognition engine for part or all of one utterance.
 *
 * <p>All partials sharing a {@code segmentId} carry strictly increasing {@code tokenIndex}
 * values; exactly one result per segment has {@code isFinalSegment = true}.
 *
 * @param chunkSequence  sequence number of the source {@link AudioChunk}
 * @param text           recognized text (may be empty for partials)
 * @param isFinalSegment whether the recognizer judged the utterance complete
 * @param segmentId      groups all results of one utterance
 * @param tokenIndex     position of this result within its segment
 */
public record RecognitionResult(
        long chunkSequence,
        String text,
        boolean isFinalSegment,
        long segmentId,
        int tokenIndex
) {

    public RecognitionResult {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static RecognitionResult partial(long chunkSequence, long segmentId, int tokenIndex, String text) {
        return new RecognitionResult(chunkSequence, text, false, segmentId, tokenIndex);
    }

    public static RecognitionResult finalSegment(long chunkSequence, long segmentId, int tokenIndex, String text) {
        return new RecognitionResult(chunkSequence, text, true, segmentId, tokenIndex);
    }
}
