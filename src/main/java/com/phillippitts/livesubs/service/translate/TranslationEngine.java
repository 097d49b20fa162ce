package com.phillippitts.livesubs.service.translate;

import com.phillippitts.livesubs.domain.ContextSnapshot;
import com.phillippitts.livesubs.service.engine.ModelEngine;

/**
 * Translation backend driven by the translation stage.
 *
 * <p>Calls are made from a single thread and block until the translation is available.
 */
public interface TranslationEngine extends ModelEngine {

    /**
     * Translates one finalized utterance.
     *
     * @param text    source text, never blank
     * @param context immutable context taken before this call
     * @return the translation, never null
     * @throws com.phillippitts.livesubs.exception.TranslationException if this utterance cannot be translated
     */
    String translate(String text, ContextSnapshot context);
}
