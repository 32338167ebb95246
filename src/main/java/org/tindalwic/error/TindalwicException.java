package org.tindalwic.error;

/**
 * Base of every failure raised while parsing, encoding or editing a Tindalwic document.
 * <p>
 * Parse failures are fatal for the whole parse and carry the 1-based number of the
 * offending line together with the byte offset (from the start of the input buffer)
 * at which the problem was detected. Failures that are not tied to source text, such
 * as programmatic tree edits, report line {@code 0} and offset {@code -1}.
 */
public class TindalwicException extends RuntimeException {

    private final int line;
    private final long offset;

    public TindalwicException(String message) {
        this(message, 0, -1);
    }

    public TindalwicException(String message, int line, long offset) {
        super(message);
        this.line = line;
        this.offset = offset;
    }

    public TindalwicException(String message, int line, long offset, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.offset = offset;
    }

    /** 1-based source line, or {@code 0} when the failure has no source position. */
    public int getLine() {
        return line;
    }

    /** Byte offset from the start of the input, or {@code -1} when unknown. */
    public long getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (line <= 0) {
            return message;
        }
        if (offset < 0) {
            return message + " (line " + line + ")";
        }
        return message + " (line " + line + ", offset " + offset + ")";
    }
}
