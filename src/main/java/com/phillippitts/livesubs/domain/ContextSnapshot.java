package com.phillippitts.livesubs.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable copy of the context window and summary taken at request time.
 *
 * <p>Later turns recorded in the context manager never change a snapshot already handed out.
 *
 * @param summary rolling summary text (empty until first regenerated)
 * @param entries window entries, oldest first
 */
public record ContextSnapshot(String summary, List<ContextEntry> entries) {

    public static final ContextSnapshot EMPTY = new ContextSnapshot("", List.of());

    public ContextSnapshot {
        Objects.requireNonNull(summary, "summary must not be null");
        entries = List.copyOf(entries);
    }

    public boolean isEmpty() {
        return summary.isBlank() && entries.isEmpty();
    }

    /**
     * Renders the summary followed by the originals of the most recent turns.
     *
     * @param recentTurns how many of the newest entries to list
     * @return rendered context, or an empty string when there is nothing to show
     */
    public String render(int recentTurns) {
        StringBuilder sb = new StringBuilder();
        if (!summary.isBlank()) {
            sb.append("Context: ").append(summary);
        }
        int from = Math.max(0, entries.size() - Math.max(0, recentTurns));
        List<ContextEntry> recent = entries.subList(from, entries.size());
        if (!recent.isEmpty()) {
            if (sb.length() > 0) {
                sb.append("\n");
            }
            sb.append("Recent:");
            for (ContextEntry entry : recent) {
                sb.append("\n- ").append(entry.originalText());
            }
        }
        return sb.toString();
    }
}
