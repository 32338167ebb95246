package org.tindalwic.error;

/**
 * Raised when bytes are not valid UTF-8, when a byte order mark is rejected, or when the
 * encoder meets content it cannot render unambiguously.
 */
public class EncodingException extends TindalwicException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, int line, long offset) {
        super(message, line, offset);
    }

    public EncodingException(String message, int line, long offset, Throwable cause) {
        super(message, line, offset, cause);
    }
}
