package com.phillippitts.dialoguetts.util;

/** Utility for privacy-safe logging of script text previews. */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview for log output: newlines flattened, truncated to max characters
     * with a trailing ellipsis when anything was cut.
     */
    public static String preview(String s, int max) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : truncate(flat, max) + ELLIPSIS;
    }
}
