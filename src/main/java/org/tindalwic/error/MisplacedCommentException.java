package org.tindalwic.error;

/**
 * Raised when a comment (or the blank line that may precede a key comment) sits where no subject can claim it.
 */
public class MisplacedCommentException extends TindalwicException {

    public MisplacedCommentException(String message) {
        super(message);
    }

    public MisplacedCommentException(String message, int line, long offset) {
        super(message, line, offset);
    }
}
