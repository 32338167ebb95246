package org.tindalwic.error;

/**
 * Raised for a non-tab whitespace byte inside indentation, a skipped indentation level, or nesting past the configured limit.
 */
public class IndentationException extends TindalwicException {

    public IndentationException(String message) {
        super(message);
    }

    public IndentationException(String message, int line, long offset) {
        super(message, line, offset);
    }
}
