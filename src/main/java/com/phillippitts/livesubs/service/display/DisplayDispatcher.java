package com.phillippitts.livesubs.service.display;

import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.domain.TranslationResult;
import com.phillippitts.livesubs.service.pipeline.StageOutcome;
import com.phillippitts.livesubs.service.pipeline.StageProcessor;
import com.phillippitts.livesubs.service.pipeline.StageQueue;

import java.util.Objects;

/**
 * Marshals display calls from stage threads onto the display thread.
 *
 * <p>Stages post {@link DisplayMessage}s into the display queue; the display worker drains it
 * and invokes the {@link DisplaySink} through {@link #process}. Partials never block the
 * poster, translations wait for room.
 */
public final class DisplayDispatcher implements StageProcessor<DisplayMessage> {

    private final StageQueue<DisplayMessage> queue;
    private final DisplaySink sink;

    public DisplayDispatcher(StageQueue<DisplayMessage> queue, DisplaySink sink) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /** Posts a partial; returns immediately, possibly dropping an older partial. */
    public void postPartial(RecognitionResult partial) {
        queue.offer(DisplayMessage.partial(partial));
    }

    /** Posts a translation, blocking while the display queue is full. */
    public void postTranslation(TranslationResult result) throws InterruptedException {
        queue.put(DisplayMessage.translation(result));
    }

    @Override
    public StageOutcome process(DisplayMessage message) {
        if (message.partial() != null) {
            sink.onPartial(message.partial().text());
        } else {
            TranslationResult t = message.translation();
            sink.onTranslation(t.originalText(), t.translatedText(), t.contextSummary());
        }
        return StageOutcome.success();
    }
}
