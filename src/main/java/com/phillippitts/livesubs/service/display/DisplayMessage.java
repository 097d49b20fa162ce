package com.phillippitts.livesubs.service.display;

import com.phillippitts.livesubs.domain.RecognitionResult;
import com.phillippitts.livesubs.domain.TranslationResult;

import java.util.Objects;

/**
 * Message posted from a stage thread to the display thread.
 *
 * @param partial     partial recognition to show, or null
 * @param translation completed translation to show, or null
 */
public record DisplayMessage(RecognitionResult partial, TranslationResult translation) {

    public DisplayMessage {
        if ((partial == null) == (translation == null)) {
            throw new IllegalArgumentException("exactly one of partial or translation must be set");
        }
    }

    public static DisplayMessage partial(RecognitionResult result) {
        return new DisplayMessage(Objects.requireNonNull(result, "result"), null);
    }

    public static DisplayMessage translation(TranslationResult result) {
        return new DisplayMessage(null, Objects.requireNonNull(result, "result"));
    }

    /** Translations must reach the display; partials may be dropped under overload. */
    public boolean isFinalized() {
        return translation != null;
    }
}
