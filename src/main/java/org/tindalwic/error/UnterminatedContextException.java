package org.tindalwic.error;

/**
 * Raised for an opening bracket line whose closing byte does not match.
 */
public class UnterminatedContextException extends TindalwicException {

    public UnterminatedContextException(String message) {
        super(message);
    }

    public UnterminatedContextException(String message, int line, long offset) {
        super(message, line, offset);
    }
}
