package com.phillippitts.livesubs.service.display;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans display calls out to every registered sink and listener.
 *
 * <p>Registration is thread-safe; delivery happens on the display thread. A listener that
 * throws is logged and does not prevent delivery to the others.
 */
public final class DisplayCallbacks implements DisplaySink {

    private static final Logger LOG = LogManager.getLogger(DisplayCallbacks.class);

    private final List<Consumer<String>> partialListeners = new CopyOnWriteArrayList<>();
    private final List<TranslationListener> translationListeners = new CopyOnWriteArrayList<>();

    public void addPartialListener(Consumer<String> listener) {
        partialListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void addTranslationListener(TranslationListener listener) {
        translationListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Registers both callbacks of a sink. */
    public void addSink(DisplaySink sink) {
        Objects.requireNonNull(sink, "sink");
        addPartialListener(sink::onPartial);
        addTranslationListener(sink::onTranslation);
    }

    @Override
    public void onPartial(String text) {
        for (Consumer<String> listener : partialListeners) {
            try {
                listener.accept(text);
            } catch (RuntimeException e) {
                LOG.warn("Partial listener failed: {}", e.toString());
            }
        }
    }

    @Override
    public void onTranslation(String original, String translation, String contextSummary) {
        for (TranslationListener listener : translationListeners) {
            try {
                listener.onTranslation(original, translation, contextSummary);
            } catch (RuntimeException e) {
                LOG.warn("Translation listener failed: {}", e.toString());
            }
        }
    }
}
