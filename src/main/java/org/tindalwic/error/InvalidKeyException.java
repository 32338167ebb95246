package org.tindalwic.error;

/**
 * Raised for a key that cannot be represented, e.g. one containing a line break.
 */
public class InvalidKeyException extends TindalwicException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public InvalidKeyException(String message, int line, long offset) {
        super(message, line, offset);
    }
}
