package com.phillippitts.livesubs.util;

/**
 * Keeps subtitle text out of logs in full. Recognized speech is user content; log at most a
 * short prefix on one line.
 */
public final class LogSanitizer {

    private LogSanitizer() {}

    /**
     * @return the first {@code max} characters of {@code s}; empty for null or non-positive max
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of {@code text}: line breaks become spaces and anything past {@code max}
     * characters is replaced by a length marker, e.g. {@code "こんにちは、今日は…(+12)"}.
     */
    public static String preview(String text, int max) {
        if (text == null) {
            return "";
        }
        String flat = text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').strip();
        if (flat.length() <= max) {
            return flat;
        }
        return truncate(flat, max) + "…(+" + (flat.length() - Math.max(0, max)) + ")";
    }
}
