package com.phillippitts.mathwords.util;

/** Utility for compact, single-line log previews of user-supplied expressions. */
public final class LogSanitizer {

    /** Preview length used for expressions in log lines. */
    public static final int EXPRESSION_PREVIEW = 80;

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
     * Collapses line breaks and truncates, marking cut previews with an ellipsis.
     */
    public static String preview(String expression) {
        if (expression == null) {
            return "";
        }
        String flat = expression.replaceAll("[\\r\\n\\t]+", " ");
        return flat.length() <= EXPRESSION_PREVIEW ? flat : truncate(flat, EXPRESSION_PREVIEW) + "...";
    }
}
