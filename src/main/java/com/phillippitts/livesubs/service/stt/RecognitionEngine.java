package com.phillippitts.livesubs.service.stt;

import com.phillippitts.livesubs.domain.AudioChunk;
import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.service.engine.ModelEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Speech recognition backend driven by the recognition stage.
 *
 * <p>Contract for {@link #transcribe(AudioChunk, Consumer)}:
 * <ul>
 *   <li>zero or more results may be produced for one chunk, delivered as they become available;</li>
 *   <li>partials of one segment arrive with increasing {@code tokenIndex};</li>
 *   <li>each segment ends with exactly one result where {@code isFinalSegment} is true.</li>
 * </ul>
 * Calls are made from a single thread and block until the chunk is fully processed.
 */
public interface RecognitionEngine extends ModelEngine {

    /**
     * @throws com.phillippitts.livesubs.exception.RecognitionException if this chunk cannot be recognized
     */
    void transcribe(AudioChunk chunk, Consumer<RecognitionResult> listener);

    /**
     * Collects all results for one chunk.
     */
    default List<RecognitionResult> transcribe(AudioChunk chunk) {
        List<RecognitionResult> results = new ArrayList<>();
        transcribe(chunk, results::add);
        return results;
    }
}
