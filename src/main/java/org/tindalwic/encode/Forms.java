package org.tindalwic.encode;

/**
 * Decides between the short form ({@code key=value}, or a bare line in a linear array) and
 * the bracketed long form. Parser and encoder share these rules, which is what makes the
 * canonical encoding read back to the same tree.
 */
public final class Forms {

    /** Bytes that open a context or a comment when they lead a line. */
    public static final String MARKERS = "#/<[{";

    private Forms() {
    }

    public static boolean isMarker(char c) {
        return MARKERS.indexOf(c) >= 0;
    }

    /** Whitespace that may never follow the indentation tabs of a short-form line. */
    public static boolean isInlineWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }

    /** Whether the value is empty, spans lines, or starts with a marker byte or whitespace. */
    public static boolean valueNeedsLongForm(String value) {
        if (value.isEmpty() || value.indexOf('\n') >= 0) {
            return true;
        }
        char first = value.charAt(0);
        return isMarker(first) || isInlineWhitespace(first);
    }

    /**
     * Whether a key cannot be spelled before {@code '='}: it contains {@code '='}, starts with
     * a marker byte or whitespace, or ends with the spaces or tabs that are trimmed around
     * {@code '='}.
     */
    public static boolean keyNeedsLongForm(String key) {
        if (key.indexOf('=') >= 0) {
            return true;
        }
        if (key.isEmpty()) {
            return false;
        }
        char first = key.charAt(0);
        char last = key.charAt(key.length() - 1);
        return isMarker(first) || isInlineWhitespace(first) || last == ' ' || last == '\t';
    }

    public static boolean isBlank(String remainder) {
        for (int i = 0; i < remainder.length(); i++) {
            if (!isInlineWhitespace(remainder.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
