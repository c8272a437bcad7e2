package com.phillippitts.lineaccuracy.util;

/** Utility for privacy-safe logging of script and transcript previews. */
public final class LogSanitizer {

    static final int DEFAULT_PREVIEW = 40;

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
     * Short single-line preview of user text: newlines flattened, truncated with an ellipsis marker.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("[\\r\\n\\t]+", " ").strip();
        return flat.length() <= DEFAULT_PREVIEW ? flat : truncate(flat, DEFAULT_PREVIEW) + "...";
    }
}
