package com.phillippitts.livesubs.service.display;

import com.phillippitts.livesubs.domain.ContextEntry;
import com.phillippitts.livesubs.domain.ContextSnapshot;
import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.domain.TranslationResult;
import com.phillippitts.livesubs.service.pipeline.PipelineMetricsPublisher;
import com.phillippitts.livesubs.service.pipeline.StageOutcome;
import com.phillippitts.livesubs.service.pipeline.StageQueue;
import com.phillippitts.livesubs.testutil.RecordingDisplaySink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DisplayDispatcherTest {

    private final StageQueue<DisplayMessage> queue =
            new StageQueue<>("display", 2, DisplayMessage::isFinalized, PipelineMetricsPublisher.NOOP);
    private final RecordingDisplaySink sink = new RecordingDisplaySink();
    private final DisplayDispatcher dispatcher = new DisplayDispatcher(queue, sink);

    @Test
    void postedMessagesReachSinkOnlyWhenProcessed() throws Exception {
        dispatcher.postPartial(RecognitionResult.partial(0, 1, 1, "今"));
        dispatcher.postTranslation(translation("今日は", "今天"));

        assertThat(sink.partials).isEmpty();

        assertThat(dispatcher.process(queue.take()).kind()).isEqualTo(StageOutcome.Kind.SUCCESS);
        dispatcher.process(queue.take());

        assertThat(sink.partials).containsExactly("今");
        assertThat(sink.translations).singleElement().satisfies(t -> {
            assertThat(t.original()).isEqualTo("今日は");
            assertThat(t.translation()).isEqualTo("今天");
            assertThat(t.contextSummary()).isEqualTo("Recent:\n- 昨日");
        });
    }

    @Test
    void partialPostNeverBlocksOnFullQueue() throws Exception {
        dispatcher.postTranslation(translation("a", "A"));
        dispatcher.postTranslation(translation("b", "B"));

        dispatcher.postPartial(RecognitionResult.partial(0, 1, 1, "dropped"));

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.droppedCount()).isEqualTo(1);
    }

    @Test
    void messageMustCarryExactlyOnePayload() {
        assertThatThrownBy(() -> new DisplayMessage(null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(DisplayMessage.partial(RecognitionResult.partial(0, 0, 0, "x")).isFinalized()).isFalse();
    }

    private static TranslationResult translation(String original, String translated) {
        ContextSnapshot ctx = new ContextSnapshot("", List.of(new ContextEntry("昨日", "昨天", 0)));
        return new TranslationResult(original, translated, ctx, ctx.render(2), 1);
    }
}
