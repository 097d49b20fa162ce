package com.phillippitts.livesubs.service.context;

import com.phillippitts.livesubs.domain.ContextEntry;

import java.util.List;
import java.util.StringJoiner;

/**
 * Summarizes by joining the most recent originals, each shortened, with an arrow.
 *
 * <p>Fewer than two entries leave the previous summary unchanged.
 */
public final class ConcatenatingSummaryStrategy implements SummaryStrategy {

    static final int ENTRIES = 3;
    static final int MAX_ENTRY_CHARS = 30;
    static final String SEPARATOR = " → ";
    static final String ELLIPSIS = "...";

    private final int maxLength;

    public ConcatenatingSummaryStrategy(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0, got: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    @Override
    public String summarize(List<ContextEntry> window, String previousSummary) {
        if (window.size() < 2) {
            return previousSummary;
        }
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (ContextEntry entry : window.subList(Math.max(0, window.size() - ENTRIES), window.size())) {
            joiner.add(shorten(entry.originalText().strip(), MAX_ENTRY_CHARS));
        }
        return shorten(joiner.toString(), maxLength);
    }

    private static String shorten(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + ELLIPSIS;
    }
}
