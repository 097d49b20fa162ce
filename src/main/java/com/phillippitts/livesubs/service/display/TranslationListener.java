package com.phillippitts.livesubs.service.display;

/**
 * Callback for completed translations.
 */
@FunctionalInterface
public interface TranslationListener {
    void onTranslation(String original, String translation, String contextSummary);
}
