package org.tindalwic.error;

/**
 * Raised when a key or value was written in the short form although its content needs the bracketed form.
 */
public class RequiresLongFormException extends TindalwicException {

    public RequiresLongFormException(String message) {
        super(message);
    }

    public RequiresLongFormException(String message, int line, long offset) {
        super(message, line, offset);
    }
}
