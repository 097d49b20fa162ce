package com.phillippitts.livesubs.service.display;

/**
 * Subtitle surface fed by the pipeline.
 *
 * <p>Both methods are invoked only on the pipeline's single display thread, never concurrently.
 */
public interface DisplaySink {

    /** Latest partial recognition text; no translation and no context. */
    void onPartial(String text);

    /**
     * Called exactly once per finalized, successfully translated utterance.
     *
     * @param contextSummary rendered context that existed before this utterance was translated
     */
    void onTranslation(String original, String translation, String contextSummary);
}
