package com.phillippitts.livesubs.service.display;

import com.phillippitts.livesubs.testutil.RecordingDisplaySink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DisplayCallbacksTest {

    @Test
    void fansOutToSinksAndListenersInRegistrationOrder() {
        DisplayCallbacks callbacks = new DisplayCallbacks();
        RecordingDisplaySink sink = new RecordingDisplaySink();
        List<String> seen = new ArrayList<>();
        callbacks.addSink(sink);
        callbacks.addPartialListener(text -> seen.add("partial:" + text));
        callbacks.addTranslationListener((original, translation, ctx) -> seen.add("final:" + translation));

        callbacks.onPartial("こん");
        callbacks.onTranslation("こんにちは", "你好", "");

        assertThat(sink.partials).containsExactly("こん");
        assertThat(sink.translations).extracting(RecordingDisplaySink.Translation::translation)
                .containsExactly("你好");
        assertThat(seen).containsExactly("partial:こん", "final:你好");
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        DisplayCallbacks callbacks = new DisplayCallbacks();
        RecordingDisplaySink sink = new RecordingDisplaySink();
        callbacks.addPartialListener(text -> {
            throw new IllegalStateException("overlay closed");
        });
        callbacks.addTranslationListener((o, t, c) -> {
            throw new IllegalStateException("overlay closed");
        });
        callbacks.addSink(sink);

        callbacks.onPartial("a");
        callbacks.onTranslation("b", "c", "");

        assertThat(sink.partials).containsExactly("a");
        assertThat(sink.translations).hasSize(1);
    }
}
