package com.phillippitts.livesubs.service.pipeline;

import com.phillippitts.livesubs.domain.AudioChunk;
import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.exception.RecognitionException;
import com.phillippitts.livesubs.service.audio.AudioLevel;
import com.phillippitts.livesubs.service.display.DisplayDispatcher;
import com.phillippitts.livesubs.service.stt.RecognitionEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recognition stage: transcribes each chunk, posts partials straight to the display and forwards
 * finalized segments to the translation queue.
 *
 * <p>Results that break the engine contract are dropped with a warning: a partial whose token
 * index does not increase within its segment, anything after a segment's final result, and a
 * second final for the same segment.
 */
final class RecognitionStage implements StageProcessor<AudioChunk> {

    private static final Logger LOG = LogManager.getLogger(RecognitionStage.class);

    private static final int TRACKED_SEGMENTS = 64;

    private final RecognitionEngine engine;
    private final StageQueue<RecognitionResult> translationQueue;
    private final DisplayDispatcher display;
    private final double silenceRmsThreshold;

    private final Map<Long, Integer> lastTokenBySegment = boundedMap();
    private final Map<Long, Boolean> finalizedSegments = boundedMap();

    RecognitionStage(RecognitionEngine engine,
                     StageQueue<RecognitionResult> translationQueue,
                     DisplayDispatcher display,
                     double silenceRmsThreshold) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.translationQueue = Objects.requireNonNull(translationQueue, "translationQueue");
        this.display = Objects.requireNonNull(display, "display");
        this.silenceRmsThreshold = silenceRmsThreshold;
    }

    @Override
    public StageOutcome process(AudioChunk chunk) throws InterruptedException {
        if (!chunk.isFinal() && AudioLevel.isSilent(chunk.samples(), silenceRmsThreshold)) {
            return StageOutcome.skipped("silent chunk " + chunk.sequence());
        }
        List<RecognitionResult> finals = new ArrayList<>(1);
        RecognitionException failure = null;
        try {
            engine.transcribe(chunk, result -> route(result, finals));
        } catch (RecognitionException e) {
            failure = e;
        }
        // Finals reported before a failure are still complete utterances
        for (RecognitionResult result : finals) {
            translationQueue.put(result);
        }
        if (failure != null) {
            return StageOutcome.transientFailure("chunk " + chunk.sequence() + ": " + failure.getMessage(), failure);
        }
        return finals.isEmpty() ? StageOutcome.skipped("no speech in chunk " + chunk.sequence())
                : StageOutcome.success();
    }

    private void route(RecognitionResult result, List<RecognitionResult> finals) {
        long segment = result.segmentId();
        if (finalizedSegments.containsKey(segment)) {
            LOG.warn("Dropping result for already finalized segment {} (token {})", segment, result.tokenIndex());
            return;
        }
        if (result.isFinalSegment()) {
            finalizedSegments.put(segment, Boolean.TRUE);
            lastTokenBySegment.remove(segment);
            if (result.text().isBlank()) {
                LOG.debug("Segment {} finalized with no text", segment);
                return;
            }
            finals.add(result);
            return;
        }
        Integer last = lastTokenBySegment.get(segment);
        if (last != null && result.tokenIndex() <= last) {
            LOG.warn("Dropping out-of-order partial for segment {}: token {} after {}",
                    segment, result.tokenIndex(), last);
            return;
        }
        lastTokenBySegment.put(segment, result.tokenIndex());
        display.postPartial(result);
    }

    private static <V> Map<Long, V> boundedMap() {
        return new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, V> eldest) {
                return size() > TRACKED_SEGMENTS;
            }
        };
    }
}
