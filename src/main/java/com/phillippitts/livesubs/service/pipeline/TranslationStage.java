package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.domain.ContextEntry;
import com.phillippitts.livesubs.domain.ContextSnapshot;
import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.domain.TranslationRequest;
import com.phillippitts.livesubs.domain.TranslationResult;
import com.phillippitts.livesubs.exception.TranslationException;
import com.phillippitts.livesubs.service.context.ContextManager;
import com.phillippitts.livesubs.service.display.DisplayDispatcher;
import com.phillippitts.livesubs.service.translate.TranslationEngine;

import java.util.Objects;

/**
 * Translation stage: for each finalized utterance, snapshots the context, translates, records the
 * new turn and posts the result to the display.
 *
 * <p>A failed translation records nothing and posts nothing.
 */
final class TranslationStage implements StageProcessor<RecognitionResult> {

    private final TranslationEngine engine;
    private final ContextManager contextManager;
    private final DisplayDispatcher display;
    private final int recentTurns;

    TranslationStage(TranslationEngine engine, ContextManager contextManager,
                     DisplayDispatcher display, int recentTurns) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.contextManager = Objects.requireNonNull(contextManager, "contextManager");
        this.display = Objects.requireNonNull(display, "display");
        this.recentTurns = recentTurns;
    }

    @Override
    public StageOutcome process(RecognitionResult result) throws InterruptedException {
        if (!result.isFinalSegment()) {
            return StageOutcome.skipped("partial result for segment " + result.segmentId());
        }
        String text = result.text().strip();
        if (text.isEmpty()) {
            return StageOutcome.skipped("blank utterance " + result.segmentId());
        }

        ContextSnapshot snapshot = contextManager.snapshot();
        TranslationRequest request = new TranslationRequest(text, snapshot, result.segmentId());
        String translated;
        try {
            translated = engine.translate(request.text(), request.context());
        } catch (TranslationException e) {
            return StageOutcome.transientFailure("segment " + request.segmentId() + ": " + e.getMessage(), e);
        }
        if (translated == null || translated.isBlank()) {
            return StageOutcome.transientFailure("empty translation for segment " + request.segmentId(), null);
        }

        contextManager.recordTurn(new ContextEntry(text, translated, request.segmentId()));
        display.postTranslation(new TranslationResult(text, translated, snapshot,
                snapshot.render(recentTurns), request.segmentId()));
        return StageOutcome.success();
    }
}
