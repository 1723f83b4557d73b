package com.phillippitts.talkback.util;

/** Utility for privacy-safe logging of transcript and response text. */
public final class LogSanitizer {

    /** Default preview length for DEBUG logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: whitespace collapsed, truncated with an ellipsis, and the full length
     * appended, e.g. {@code "hello there…" (57 chars)}.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "\"\" (0 chars)";
        }
        String collapsed = s.strip().replaceAll("\\s+", " ");
        String shown = truncate(collapsed, max);
        String suffix = shown.length() < collapsed.length() ? "…" : "";
        return "\"" + shown + suffix + "\" (" + s.length() + " chars)";
    }

    public static String preview(String s) {
        return preview(s, DEFAULT_PREVIEW_CHARS);
    }
}
