package org.tindalwic.model;

/**
 * Where a comment sits relative to its subject. Each position has exactly one marker.
 */
public enum CommentPosition {

    /** {@code //} line directly before a key line. */
    PRECEDING_KEY("//"),
    /** First {@code #} line inside an array, or the document prolog. */
    INTRODUCING_COLLECTION("#"),
    /** {@code #} line following an array, at the array's own depth. */
    CLOSING_COLLECTION("#"),
    /** {@code #} line following a text value, at the value's own depth. */
    TRAILING_VALUE("#"),
    /** Unix {@code #!} first line of a document. */
    HASHBANG("#!");

    private final String marker;

    CommentPosition(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }
}
