package org.tindalwic.error;

/**
 * Raised for a line whose kind is not allowed in its context, e.g. a bare string inside an associative array.
 */
public class MalformedLineException extends TindalwicException {

    public MalformedLineException(String message) {
        super(message);
    }

    public MalformedLineException(String message, int line, long offset) {
        super(message, line, offset);
    }
}
