package org.tindalwic.error;

/**
 * Raised when a key appears twice in one associative array, whether parsed or inserted.
 */
public class DuplicateKeyException extends TindalwicException {

    public DuplicateKeyException(String message) {
        super(message);
    }

    public DuplicateKeyException(String message, int line, long offset) {
        super(message, line, offset);
    }
}
