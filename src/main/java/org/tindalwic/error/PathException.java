package org.tindalwic.error;

/**
 * Raised when a path cannot be followed through a document.
 */
public class PathException extends TindalwicException {

    public PathException(String message) {
        super(message);
    }
}
