package com.phillippitts.livesubs.service.context;

import com.phillippitts.livesubs.domain.ContextEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcatenatingSummaryStrategyTest {

    private final ConcatenatingSummaryStrategy strategy = new ConcatenatingSummaryStrategy(200);

    @Test
    void joinsLastThreeOriginals() {
        List<ContextEntry> window = List.of(entry("一"), entry(" 二 "), entry("三"), entry("四"));

        assertThat(strategy.summarize(window, "")).isEqualTo("二 → 三 → 四");
    }

    @Test
    void singleEntryKeepsPreviousSummary() {
        assertThat(strategy.summarize(List.of(entry("一")), "old")).isEqualTo("old");
        assertThat(strategy.summarize(List.of(), "old")).isEqualTo("old");
    }

    @Test
    void shortensLongEntriesWithEllipsis() {
        String longText = "x".repeat(ConcatenatingSummaryStrategy.MAX_ENTRY_CHARS + 5);

        String summary = strategy.summarize(List.of(entry("short"), entry(longText)), "");

        assertThat(summary).isEqualTo("short" + ConcatenatingSummaryStrategy.SEPARATOR
                + "x".repeat(ConcatenatingSummaryStrategy.MAX_ENTRY_CHARS) + ConcatenatingSummaryStrategy.ELLIPSIS);
    }

    @Test
    void shortensWholeSummaryToMaxLength() {
        ConcatenatingSummaryStrategy tight = new ConcatenatingSummaryStrategy(10);

        String summary = tight.summarize(List.of(entry("abcdefgh"), entry("ijklmnop")), "");

        assertThat(summary).isEqualTo("abcdefgh →" + ConcatenatingSummaryStrategy.ELLIPSIS);
    }

    @Test
    void isDeterministic() {
        List<ContextEntry> window = List.of(entry("a"), entry("b"));

        assertThat(strategy.summarize(window, "p")).isEqualTo(strategy.summarize(window, "p"));
    }

    @Test
    void rejectsNonPositiveMaxLength() {
        assertThatThrownBy(() -> new ConcatenatingSummaryStrategy(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ContextEntry entry(String original) {
        return new ContextEntry(original, "t", 0);
    }
}
