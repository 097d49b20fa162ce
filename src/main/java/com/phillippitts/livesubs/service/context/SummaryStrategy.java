package com.phillippitts.livesubs.service.context;

import com.phillippitts.livesubs.domain.ContextEntry;

import java.util.List;

/**
 * Regenerates the rolling context summary.
 *
 * <p>Implementations must be deterministic: the same window and previous summary always yield
 * the same result. They are invoked while the context manager holds its lock, so they must not
 * call back into it.
 */
@FunctionalInterface
public interface SummaryStrategy {

    /**
     * @param window          current window, oldest first (immutable)
     * @param previousSummary summary in effect before this regeneration
     * @return the new summary, never null
     */
    String summarize(List<ContextEntry> window, String previousSummary);
}
