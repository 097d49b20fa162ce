package com.phillippitts.livesubs.service.translate;

import com.phillippitts.livesubs.domain.ContextSnapshot;

import java.util.Objects;

/**
 * Builds the completion prompt for one utterance: optional context first, then the instruction
 * and the text.
 */
public final class TranslationPromptBuilder {

    private final String sourceLanguage;
    private final String targetLanguage;
    private final int recentTurns;

    public TranslationPromptBuilder(String sourceLanguage, String targetLanguage, int recentTurns) {
        this.sourceLanguage = Objects.requireNonNull(sourceLanguage, "sourceLanguage");
        this.targetLanguage = Objects.requireNonNull(targetLanguage, "targetLanguage");
        this.recentTurns = recentTurns;
    }

    public String build(String text, ContextSnapshot context) {
        StringBuilder sb = new StringBuilder();
        String rendered = context == null ? "" : context.render(recentTurns);
        if (!rendered.isEmpty()) {
            sb.append(rendered).append("\n\n");
        }
        sb.append("Translate the following ").append(sourceLanguage)
                .append(" text into ").append(targetLanguage)
                .append(". Output only the translation.\n")
                .append(text.strip())
                .append("\nTranslation:");
        return sb.toString();
    }
}
